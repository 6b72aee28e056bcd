/*
Copyright 2026 National Technology & Engineering Solutions of Sandia, LLC (NTESS).
Under the terms of Contract DE-NA0003525 with NTESS,
the U.S. Government retains certain rights in this software.
*/

package gov.sandia.arith.language;

import gov.sandia.arith.range.Range;

/**
    An opaque integer quantity. Identity is the id issued by the owning Scope, not the name,
    so two variables with the same name are distinct.
    The range given at construction is the declared range. Narrowed ranges live in a RangeEnvironment.
**/
public class Variable extends Operator
{
    public final String name;
    public final Range  range;
    public final int    id;

    Variable (String name, Range range, int id)
    {
        this.name  = name;
        this.range = range;
        this.id    = id;
        simplified = true;
    }

    public String name ()
    {
        return "var";
    }

    protected int computeDigest ()
    {
        return mix (0x54e9bd5e ^ id);
    }

    protected boolean equalsLeaf (Operator that)
    {
        return id == ((Variable) that).id;
    }

    public Operator min ()
    {
        return this;
    }

    public Operator max ()
    {
        return this;
    }

    public String toString ()
    {
        if (name.isEmpty ()) return "v_" + id;
        return name + "_" + id;
    }
}
