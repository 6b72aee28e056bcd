/*
Copyright 2026 National Technology & Engineering Solutions of Sandia, LLC (NTESS).
Under the terms of Contract DE-NA0003525 with NTESS,
the U.S. Government retains certain rights in this software.
*/

package gov.sandia.arith.db;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.Reader;
import java.io.UncheckedIOException;
import java.io.Writer;

/**
    Reads and writes an MNode tree in the indented text format.
    The first line is a header of the form "Arith.schema=3". Every following line holds
    one node as "key:value", and children are indented one space deeper than their parent.
    A value of "|" starts a block of text that continues on the lines indented below it.
**/
public class Schema
{
    public static final String header = "Arith.schema";

    public int    version;
    public String type;

    public Schema (int version, String type)
    {
        this.version = version;
        this.type    = type;
    }

    public static Schema latest ()
    {
        return new Schema (3, "");
    }

    /**
        Convenience method which reads the header and loads all the objects as children of the given node.
    **/
    public static Schema readAll (MNode node, Reader reader) throws IOException
    {
        BufferedReader br;
        if (reader instanceof BufferedReader) br = (BufferedReader) reader;
        else                                  br = new BufferedReader (reader);
        Schema result = read (br);
        result.read (node, br);
        return result;
    }

    public static Schema read (BufferedReader reader) throws IOException
    {
        String line = reader.readLine ();
        if (line == null) throw new IOException ("File is empty.");
        line = line.trim ();
        if (! line.startsWith (header)) throw new IOException ("Schema line not found.");
        if (line.length () < header.length () + 2) throw new IOException ("Malformed schema line.");
        char delimiter = line.charAt (header.length ());
        if (delimiter != '=') throw new IOException ("Malformed schema line.");
        line = line.substring (header.length () + 1);
        String[] pieces = line.split (",", 2);
        int version;
        try
        {
            version = Integer.parseInt (pieces[0].trim ());
        }
        catch (NumberFormatException e)
        {
            throw new IOException ("Malformed schema version: " + pieces[0], e);
        }
        String type = "";
        if (pieces.length >= 2) type = pieces[1].trim ();
        if (version < 2) throw new IOException ("Unsupported schema version " + version);
        return new Schema (version, type);
    }

    /**
        Brings in children of the given node from a stream.
        The direct value of the node must be set by the caller.
    **/
    public void read (MNode node, BufferedReader reader) throws IOException
    {
        LineReader lineReader = new LineReader (reader);
        read (node, lineReader, 0);
    }

    /**
        Recursive version of read() for loading children.
        We assume LineReader always holds the next unprocessed line.
    **/
    public void read (MNode node, LineReader reader, int whitespaces) throws IOException
    {
        while (true)
        {
            if (reader.line == null) return;  // stop at end of file

            // Parse the line into key:value. A leading quote escapes colons in the key.
            String line = reader.line.trim ();
            StringBuilder prefix = new StringBuilder ();
            String value = null;
            boolean escape =  ! line.isEmpty ()  &&  line.charAt (0) == '"';
            int i = escape ? 1 : 0;
            int last = line.length () - 1;
            for (; i <= last; i++)
            {
                char c = line.charAt (i);
                if (escape)
                {
                    if (c == '"')
                    {
                        if (i < last  &&  line.charAt (i+1) == '"')
                        {
                            i++;
                        }
                        else
                        {
                            escape = false;
                            continue;
                        }
                    }
                }
                else if (c == ':')
                {
                    value = line.substring (i+1).trim ();
                    break;
                }
                prefix.append (c);
            }
            String key = prefix.toString ().trim ();

            if (value != null  &&  value.startsWith ("|"))  // go into string reading mode
            {
                StringBuilder block = new StringBuilder ();
                reader.getNextLine ();
                if (reader.whitespaces > whitespaces)
                {
                    int blockIndent = reader.whitespaces;
                    while (true)
                    {
                        block.append (reader.line.substring (blockIndent));
                        reader.getNextLine ();
                        if (reader.whitespaces < blockIndent) break;
                        block.append ("\n");
                    }
                }
                value = block.toString ();
            }
            else
            {
                reader.getNextLine ();
            }
            MNode child = node.set (value, key);
            if (reader.whitespaces > whitespaces) read (child, reader, reader.whitespaces);
            if (reader.whitespaces < whitespaces) return;  // end recursion
        }
    }

    /**
        Writes the header and all the children of the given node.
        The node itself acts merely as a container.
    **/
    public void writeAll (MNode node, Writer writer) throws IOException
    {
        writer.write (header + "=" + version);
        if (! type.isEmpty ()) writer.write ("," + type);
        writer.write (String.format ("%n"));
        for (MNode c : node) write (c, writer, "");
    }

    /**
        Convenience function for calling write(MNode,Writer,String) with no initial indent.
    **/
    public void write (MNode node, Writer writer)
    {
        try
        {
            write (node, writer, "");
        }
        catch (IOException e)
        {
            throw new UncheckedIOException (e);
        }
    }

    public void write (MNode node, Writer writer, String indent) throws IOException
    {
        String key = node.key ();
        if (key.startsWith ("\"")  ||  key.contains (":")  ||  key.isEmpty ())
        {
            key = "\"" + key.replace ("\"", "\"\"") + "\"";
        }

        if (! node.data ())
        {
            writer.write (String.format ("%s%s%n", indent, key));
        }
        else
        {
            String value = node.get ();
            String newLine = String.format ("%n");
            if (value.contains ("\n")  ||  value.startsWith ("|"))  // go into extended text write mode
            {
                value = value.replace ("\n", newLine + indent + " ");
                value = "|" + newLine + indent + " " + value;
            }
            writer.write (String.format ("%s%s:%s%n", indent, key, value));
        }

        String space2 = indent + " ";
        for (MNode c : node) write (c, writer, space2);
    }

    public static class LineReader
    {
        public BufferedReader reader;
        public String         line;
        public int            whitespaces;

        public LineReader (BufferedReader reader) throws IOException
        {
            this.reader = reader;
            getNextLine ();
        }

        public void getNextLine () throws IOException
        {
            // Scan for non-empty line
            while (true)
            {
                line = reader.readLine ();
                if (line == null)  // end of file
                {
                    whitespaces = -1;
                    return;
                }
                if (line.trim ().isEmpty ()) continue;
                break;
            }

            int length = line.length ();
            whitespaces = 0;
            while (whitespaces < length  &&  line.charAt (whitespaces) == ' ') whitespaces++;
        }
    }
}
