/*
Copyright 2013-2023 National Technology & Engineering Solutions of Sandia, LLC (NTESS).
Under the terms of Contract DE-NA0003525 with NTESS,
the U.S. Government retains certain rights in this software.
*/

package gov.sandia.odegen.language;

/**
    Math markup that could not be read as a MathML document.
**/
@SuppressWarnings("serial")
public class ParseException extends Exception
{
    public ParseException (String message)
    {
        super (message);
    }

    public ParseException (String message, Throwable cause)
    {
        super (message, cause);
    }
}
