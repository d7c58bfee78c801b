/*
Copyright 2018-2023 National Technology & Engineering Solutions of Sandia, LLC (NTESS).
Under the terms of Contract DE-NA0003525 with NTESS,
the U.S. Government retains certain rights in this software.
*/

package gov.sandia.odegen.db;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.Reader;
import java.io.Writer;

/**
    Version 1 of the document format: one "key:value" per line, with each level of the tree
    indented one space past its parent. Keys containing a colon, and values with blanks at either
    end, are written in double quotes (a doubled quote inside stands for one quote).
    A value of "|" introduces a block of text on the following, more deeply indented lines.
    Blank lines are ignored everywhere, including inside blocks.
**/
public class Schema1 extends Schema
{
    public Schema1 (int version, String type)
    {
        super (version, type);
    }

    /**
        Replaces the children of node with the document body. The header line must already be consumed.
    **/
    public void read (MNode node, Reader reader) throws IOException
    {
        node.clear ();
        LineReader lineReader = new LineReader (reader);
        read (node, lineReader, 0);
        lineReader.close ();
    }

    /**
        Reads sibling entries at the given indent, recursing into deeper lines as children.
        On return, reader holds the first line that belongs to an ancestor (or end of file).
    **/
    public void read (MNode node, LineReader reader, int indent) throws IOException
    {
        while (reader.line != null)
        {
            String[] pair = split (reader.line.trim ());
            String value = pair[1];
            reader.getNextLine ();
            if ("|".equals (value)) value = readBlock (reader, indent);

            MNode child = node.set (value, pair[0]);
            if (reader.whitespaces > indent) read (child, reader, reader.whitespaces);
            if (reader.whitespaces < indent) return;
        }
    }

    /**
        Collects the lines of a text block. They are indented deeper than the key that introduces
        them, and the indent of the first line is removed from all of them.
    **/
    protected String readBlock (LineReader reader, int indent) throws IOException
    {
        if (reader.whitespaces <= indent) return "";
        int blockIndent = reader.whitespaces;
        StringBuilder block = new StringBuilder (reader.line.substring (blockIndent));
        reader.getNextLine ();
        while (reader.whitespaces >= blockIndent)
        {
            block.append ("\n");
            block.append (reader.line.substring (blockIndent));
            reader.getNextLine ();
        }
        return block.toString ();
    }

    /**
        Separates a line at the first colon that is not inside a quoted key.
        @return {key, value}, where value is null if the line has no colon.
    **/
    public static String[] split (String line)
    {
        StringBuilder key = new StringBuilder ();
        boolean quoted = line.startsWith ("\"");
        int length = line.length ();
        for (int i = quoted ? 1 : 0; i < length; i++)
        {
            char c = line.charAt (i);
            if (quoted  &&  c == '"')
            {
                if (i + 1 < length  &&  line.charAt (i + 1) == '"')  // doubled quote stands for itself
                {
                    key.append (c);
                    i++;
                }
                else
                {
                    quoted = false;
                }
                continue;
            }
            if (! quoted  &&  c == ':') return new String[] {key.toString ().trim (), unquote (line.substring (i + 1).trim ())};
            key.append (c);
        }
        return new String[] {key.toString ().trim (), null};
    }

    public static String unquote (String value)
    {
        int length = value.length ();
        if (length < 2  ||  value.charAt (0) != '"'  ||  value.charAt (length - 1) != '"') return value;
        return value.substring (1, length - 1).replace ("\"\"", "\"");
    }

    public static String quote (String value)
    {
        return "\"" + value.replace ("\"", "\"\"") + "\"";
    }

    /**
        A value needs quotes if reading it back would otherwise lose blanks at either end, or strip quotes it starts with.
    **/
    public static boolean needsQuote (String value)
    {
        if (value.isEmpty ()) return false;
        if (value.startsWith ("\"")) return true;
        return  Character.isWhitespace (value.charAt (0))  ||  Character.isWhitespace (value.charAt (value.length () - 1));
    }

    public void write (MNode node, Writer writer, String indent) throws IOException
    {
        String newLine = System.lineSeparator ();
        String key = node.key ();
        if (key.isEmpty ()  ||  key.startsWith ("\"")  ||  key.contains (":")) key = quote (key);

        StringBuilder line = new StringBuilder (indent + key);
        if (node.data ())
        {
            String value = node.get ();
            if (value.contains ("\n")  ||  value.equals ("|"))
            {
                String blockIndent = indent + "  ";
                line.append (":|" + newLine + blockIndent + value.replace ("\n", newLine + blockIndent));
            }
            else
            {
                if (needsQuote (value)) value = quote (value);
                line.append (":" + value);
            }
        }
        writer.write (line + newLine);

        for (MNode c : node) write (c, writer, indent + " ");
    }

    /**
        Holds the next non-blank line and the number of spaces that start it.
        At end of file, line is null and whitespaces is -1.
    **/
    public static class LineReader
    {
        public BufferedReader reader;
        public boolean        ownsReader;  // we wrapped the caller's reader, so we close it
        public String         line;
        public int            whitespaces;

        public LineReader (Reader reader) throws IOException
        {
            ownsReader  = ! (reader instanceof BufferedReader);
            this.reader = ownsReader ? new BufferedReader (reader) : (BufferedReader) reader;
            getNextLine ();
        }

        public void getNextLine () throws IOException
        {
            do
            {
                line = reader.readLine ();
            }
            while (line != null  &&  line.trim ().isEmpty ());

            whitespaces = -1;
            if (line == null) return;
            whitespaces = 0;
            while (line.charAt (whitespaces) == ' ') whitespaces++;  // terminates because the line is not blank
        }

        public void close () throws IOException
        {
            if (ownsReader) reader.close ();
        }
    }
}
