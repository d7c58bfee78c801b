/*
Copyright 2023 National Technology & Engineering Solutions of Sandia, LLC (NTESS).
Under the terms of Contract DE-NA0003525 with NTESS,
the U.S. Government retains certain rights in this software.
*/

package gov.sandia.odegen.importers;

@SuppressWarnings("serial")
public class ImportException extends Exception
{
    public ImportException (String message)
    {
        super (message);
    }

    public ImportException (String message, Throwable cause)
    {
        super (message, cause);
    }
}
