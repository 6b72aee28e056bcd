/*
Copyright 2026 National Technology & Engineering Solutions of Sandia, LLC (NTESS).
Under the terms of Contract DE-NA0003525 with NTESS,
the U.S. Government retains certain rights in this software.
*/

package gov.sandia.arith.db;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.TreeMap;

/**
    In-memory settings tree. Children are kept sorted by MNode.order.
**/
public class MVolatile extends MNode
{
    protected final String               name;
    protected final MNode                parent;
    protected String                     value;
    protected TreeMap<String,MVolatile>  children;  // created on first child

    public MVolatile ()
    {
        this (null, "", null);
    }

    public MVolatile (String value, String name, MNode parent)
    {
        this.value  = value;
        this.name   = name == null ? "" : name;
        this.parent = parent;
    }

    public String key ()
    {
        return name;
    }

    public MNode parent ()
    {
        return parent;
    }

    protected synchronized String value ()
    {
        return value;
    }

    public synchronized void set (String value)
    {
        this.value = value;
    }

    protected synchronized MNode lookup (String key)
    {
        return children == null ? null : children.get (key);
    }

    public synchronized MNode set (String value, String key)
    {
        if (children == null) children = new TreeMap<String,MVolatile> (order);
        MVolatile c = children.get (key);
        if (c == null) children.put (key, c = new MVolatile (value, key, this));
        else           c.value = value;
        return c;
    }

    protected synchronized void remove (String key)
    {
        if (children != null) children.remove (key);
    }

    public synchronized void clear ()
    {
        children = null;
    }

    public synchronized int size ()
    {
        return children == null ? 0 : children.size ();
    }

    /**
        Iterates over a snapshot, so the caller may modify this node while looping.
    **/
    public synchronized Iterator<MNode> iterator ()
    {
        if (children == null) return Collections.<MNode>emptyIterator ();
        List<MNode> snapshot = new ArrayList<MNode> (children.values ());
        return snapshot.iterator ();
    }
}
