/*
Copyright 2017-2023 National Technology & Engineering Solutions of Sandia, LLC (NTESS).
Under the terms of Contract DE-NA0003525 with NTESS,
the U.S. Government retains certain rights in this software.
*/

package gov.sandia.odegen.db;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.Reader;
import java.io.Writer;

/**
    Encapsulates the serialization method used for a particular file.
    The first line of the file names the schema version and the type of document,
    for example "OdeGen.schema=1,profile". Everything after that line is expressed in the
    format of the given version.
**/
public class Schema
{
    public static final String HEADER = "OdeGen.schema";

    public int    version;  // increments with each incompatible change to the format
    public String type;

    public Schema (int version, String type)
    {
        this.version = version;
        this.type    = type;
    }

    public static Schema latest ()
    {
        return new Schema1 (1, "");
    }

    /**
        Reads the header line, then the rest of the document into node.
        @return The schema named by the header, which also tells the caller the document type.
    **/
    public static Schema readAll (MNode node, Reader reader) throws IOException
    {
        BufferedReader buffered = reader instanceof BufferedReader ? (BufferedReader) reader : new BufferedReader (reader);
        Schema result = read (buffered);
        result.read (node, buffered);
        if (buffered != reader) buffered.close ();
        return result;
    }

    /**
        Parses the header line "OdeGen.schema=version[,type]".
    **/
    public static Schema read (BufferedReader reader) throws IOException
    {
        String line = reader.readLine ();
        if (line == null) throw new IOException ("Document is empty");
        line = line.trim ();
        String prefix = HEADER + "=";
        if (! line.startsWith (prefix)) throw new IOException ("Missing " + HEADER + " header");

        String[] pieces = line.substring (prefix.length ()).split (",", 2);
        int version;
        try
        {
            version = Integer.parseInt (pieces[0].trim ());
        }
        catch (NumberFormatException e)
        {
            throw new IOException ("Bad schema version: " + pieces[0], e);
        }
        String type = pieces.length > 1 ? pieces[1].trim () : "";

        if (version == 1) return new Schema1 (version, type);
        throw new IOException ("Unsupported schema version: " + version);
    }

    public void read (MNode node, Reader reader) throws IOException
    {
        throw new IOException ("Schema version " + version + " has no reader");
    }

    /**
        Writes the header, then each child of node. The node itself is only a container and is not written.
    **/
    public void writeAll (MNode node, Writer writer) throws IOException
    {
        write (writer);
        for (MNode c : node) write (c, writer, "");
    }

    public void write (Writer writer) throws IOException
    {
        writer.write (HEADER + "=" + version);
        if (! type.isEmpty ()) writer.write ("," + type);
        writer.write (String.format ("%n"));
    }

    /**
        Writes a subtree with no indent. Meant for in-memory writers, which don't throw.
    **/
    public void write (MNode node, Writer writer)
    {
        try
        {
            write (node, writer, "");
        }
        catch (IOException e)
        {
            throw new RuntimeException (e);
        }
    }

    public void write (MNode node, Writer writer, String indent) throws IOException
    {
        throw new IOException ("Schema version " + version + " has no writer");
    }
}
