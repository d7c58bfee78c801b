/*
Copyright 2023 National Technology & Engineering Solutions of Sandia, LLC (NTESS).
Under the terms of Contract DE-NA0003525 with NTESS,
the U.S. Government retains certain rights in this software.
*/

package gov.sandia.odegen.eqset;

/**
    A problem found while analyzing a model. Any issue blocks code generation.
**/
public class Issue
{
    public enum Kind
    {
        GENERATOR,  // roles, integration variable, differential order
        MATHML      // math text of a component could not be read
    }

    public String description;
    public Kind   kind;

    public Issue (String description, Kind kind)
    {
        this.description = description;
        this.kind        = kind;
    }

    public String toString ()
    {
        return description;
    }
}
