/*
Copyright 2026 National Technology & Engineering Solutions of Sandia, LLC (NTESS).
Under the terms of Contract DE-NA0003525 with NTESS,
the U.S. Government retains certain rights in this software.
*/

package gov.sandia.arith.db;

import java.io.StringWriter;
import java.util.Comparator;

/**
    Tree of named settings. Each node has a key, an optional string value and ordered children.
    Paths are given as a sequence of keys, so get("limits","depth") reads the value of "depth"
    under "limits". A missing node reads as "", which is also how an undefined value reads;
    data() tells them apart.

    Subclasses supply storage through the handful of abstract methods. MVolatile keeps everything in memory.
**/
public abstract class MNode implements Iterable<MNode>, Comparable<MNode>
{
    /**
        Sorts keys that parse as numbers ahead of all other keys, in numeric order, so "9" comes before "10".
    **/
    public static final Comparator<String> order = new Comparator<String> ()
    {
        public int compare (String a, String b)
        {
            return MNode.compare (a, b);
        }
    };

    public abstract String key ();

    public abstract MNode parent ();

    /**
        @return The value stored directly in this node, or null if undefined.
    **/
    protected abstract String value ();

    /**
        Stores the value of this node. null makes it undefined.
    **/
    public abstract void set (String value);

    /**
        @return The immediate child with the given key, or null.
    **/
    protected abstract MNode lookup (String key);

    /**
        Sets the value of an immediate child, creating it if needed.
        @return The child.
    **/
    public abstract MNode set (String value, String key);

    protected abstract void remove (String key);

    /**
        Removes every child.
    **/
    public abstract void clear ();

    public abstract int size ();

    public boolean isEmpty ()
    {
        return size () == 0;
    }

    public synchronized MNode child (String... keys)
    {
        MNode node = this;
        for (int i = 0; i < keys.length  &&  node != null; i++) node = node.lookup (keys[i]);
        return node;
    }

    public synchronized MNode childOrCreate (String... keys)
    {
        MNode node = this;
        for (String key : keys)
        {
            MNode next = node.lookup (key);
            node = next == null ? node.set (null, key) : next;
        }
        return node;
    }

    /**
        Removes the node at the end of the path. With no keys, removes all children of this node.
    **/
    public synchronized void clear (String... keys)
    {
        if (keys.length == 0)
        {
            clear ();
            return;
        }
        MNode node = this;
        for (int i = 0; i < keys.length - 1  &&  node != null; i++) node = node.lookup (keys[i]);
        if (node != null) node.remove (keys[keys.length - 1]);
    }

    public boolean data ()
    {
        return value () != null;
    }

    public boolean data (String... keys)
    {
        MNode node = child (keys);
        return node != null  &&  node.data ();
    }

    public String get ()
    {
        return getOrDefault ("");
    }

    public String get (String... keys)
    {
        MNode node = child (keys);
        if (node == null) return "";
        return node.get ();
    }

    /**
        @return The value of this node, or defaultValue if it is undefined or empty.
    **/
    public String getOrDefault (String defaultValue)
    {
        String value = value ();
        if (value == null  ||  value.isEmpty ()) return defaultValue;
        return value;
    }

    public String getOrDefault (String defaultValue, String... keys)
    {
        String value = get (keys);
        return value.isEmpty () ? defaultValue : value;
    }

    /**
        "1" and "true" (in any case) are true. Any other non-empty value is false.
    **/
    public boolean getOrDefault (boolean defaultValue, String... keys)
    {
        String value = get (keys).trim ();
        if (value.isEmpty ()) return defaultValue;
        return value.equals ("1")  ||  value.equalsIgnoreCase ("true");
    }

    public int getOrDefault (int defaultValue, String... keys)
    {
        String value = get (keys).trim ();
        if (value.isEmpty ()) return defaultValue;
        try
        {
            return Integer.parseInt (value);
        }
        catch (NumberFormatException e)
        {
            return defaultValue;
        }
    }

    public boolean getBoolean (String... keys)
    {
        return getOrDefault (false, keys);
    }

    /**
        A flag is on when its node exists with any value other than "0", including no value at all.
    **/
    public boolean getFlag (String... keys)
    {
        MNode node = child (keys);
        return node != null  &&  ! node.get ().equals ("0");
    }

    public int getInt (String... keys)
    {
        return getOrDefault (0, keys);
    }

    /**
        Sets a node at any depth, creating the path as needed. Booleans are stored as "1" or "0".
    **/
    public synchronized MNode set (Object value, String... keys)
    {
        MNode node = childOrCreate (keys);
        if      (value == null)            node.set ((String) null);
        else if (value instanceof Boolean) node.set ((Boolean) value ? "1" : "0");
        else                               node.set (value.toString ());
        return node;
    }

    /**
        Overlays that tree onto this one. Defined values in that replace values here.
        Nodes present only here are left alone.
    **/
    public synchronized void merge (MNode that)
    {
        if (that.data ()) set (that.get ());
        for (MNode from : that) childOrCreate (from.key ()).merge (from);
    }

    public interface Visitor
    {
        /**
            @return false to skip the children of node.
        **/
        public boolean visit (MNode node);
    }

    /**
        Depth-first, parents before children.
    **/
    public synchronized void visit (Visitor v)
    {
        if (! v.visit (this)) return;
        for (MNode c : this) c.visit (v);
    }

    public static int compare (String a, String b)
    {
        if (a.equals (b)) return 0;
        Double x = numeric (a);
        Double y = numeric (b);
        if (x == null  &&  y == null) return a.compareTo (b);
        if (x == null) return 1;
        if (y == null) return -1;
        return Double.compare (x, y);
    }

    protected static Double numeric (String key)
    {
        try
        {
            return Double.valueOf (key);
        }
        catch (NumberFormatException e)
        {
            return null;
        }
    }

    public int compareTo (MNode that)
    {
        return compare (key (), that.key ());
    }

    /**
        Two nodes are equal when their keys match and their subtrees hold the same keys and values.
    **/
    public boolean equals (Object o)
    {
        if (this == o) return true;
        if (! (o instanceof MNode)) return false;
        MNode that = (MNode) o;
        return key ().equals (that.key ())  &&  sameContent (that);
    }

    public int hashCode ()
    {
        return key ().hashCode ();
    }

    protected boolean sameContent (MNode that)
    {
        if (data () != that.data ()  ||  ! get ().equals (that.get ())  ||  size () != that.size ()) return false;
        for (MNode a : this)
        {
            MNode b = that.lookup (a.key ());
            if (b == null  ||  ! a.sameContent (b)) return false;
        }
        return true;
    }

    /**
        Renders the subtree in the indented settings format, without header.
    **/
    public String toString ()
    {
        StringWriter writer = new StringWriter ();
        Schema.latest ().write (this, writer);
        return writer.toString ();
    }
}
