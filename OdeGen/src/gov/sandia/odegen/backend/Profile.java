/*
Copyright 2023 National Technology & Engineering Solutions of Sandia, LLC (NTESS).
Under the terms of Contract DE-NA0003525 with NTESS,
the U.S. Government retains certain rights in this software.
*/

package gov.sandia.odegen.backend;

import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import org.apache.log4j.Logger;

import gov.sandia.odegen.db.MVolatile;
import gov.sandia.odegen.db.Schema;
import gov.sandia.odegen.language.MathFunction;

/**
    Target-language syntax: the text of every operator, the templates for conditionals and whole
    functions, and flags for the capabilities the language has natively.
    Top-level keys are operator, conditional, piecewise, constant, has, array, statement, function and file.
**/
public class Profile extends MVolatile
{
    private static Logger logger = Logger.getLogger (Profile.class);

    public static final String C      = "C";
    public static final String PYTHON = "Python";

    public Profile ()
    {
    }

    /**
        Loads one of the profiles packaged with this library.
    **/
    public static Profile load (String name) throws IOException
    {
        InputStream stream = Profile.class.getResourceAsStream (name + ".profile");
        if (stream == null) throw new IOException ("No built-in profile named " + name);
        try (Reader reader = new InputStreamReader (stream, StandardCharsets.UTF_8))
        {
            return read (reader);
        }
    }

    public static Profile read (Path path) throws IOException
    {
        try (Reader reader = Files.newBufferedReader (path, StandardCharsets.UTF_8))
        {
            return read (reader);
        }
    }

    public static Profile read (Reader reader) throws IOException
    {
        Profile result = new Profile ();
        Schema schema = Schema.readAll (result, reader);
        if (! schema.type.isEmpty ()  &&  ! schema.type.equals ("profile")) throw new IOException ("Not a profile: " + schema.type);
        logger.debug ("loaded profile " + result.get ("name"));
        return result;
    }

    /**
        The default profile, which generates C.
        It is part of the library, so failure to load it means the installation is broken.
    **/
    public static Profile defaultProfile ()
    {
        try
        {
            return load (C);
        }
        catch (IOException e)
        {
            throw new IllegalStateException ("Built-in C profile is missing or damaged", e);
        }
    }

    public String name ()
    {
        return get ("name");
    }

    public String operator (String key)
    {
        return get ("operator", key);
    }

    public String constant (String key)
    {
        return get ("constant", key);
    }

    public boolean has (String capability)
    {
        return getFlag ("has", capability);
    }

    public String array (String key)
    {
        return get ("array", key);
    }

    public String terminator ()
    {
        return get ("statement", "terminator");
    }

    public String indent ()
    {
        return get ("statement", "indent");
    }

    /**
        Either the native conditional template or the textual piecewise one, whichever the target uses.
        @param key "if" or "else"
    **/
    public String conditional (String key)
    {
        if (has ("conditionalOperator")) return get ("conditional", key);
        return get ("piecewise", key);
    }

    /**
        @return Source code that defines the given function, or "" if the target already has it.
    **/
    public String function (MathFunction f)
    {
        return get ("function", f.key);
    }

    public String file (String key)
    {
        return get ("file", key);
    }
}
