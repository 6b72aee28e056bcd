/*
Copyright 2026 National Technology & Engineering Solutions of Sandia, LLC (NTESS).
Under the terms of Contract DE-NA0003525 with NTESS,
the U.S. Government retains certain rights in this software.
*/

package gov.sandia.arith.language;

import gov.sandia.arith.range.Range;
import gov.sandia.arith.range.RangeUnbounded;

/**
    Issues variables with monotonically increasing ids.
    Variables from one Scope should not be mixed with those of another, since ids may coincide.
    A Scope is not thread-safe.
**/
public class Scope
{
    protected int next;

    public Variable variable (String name, Range range)
    {
        return new Variable (name, range, next++);
    }

    public Variable variable (String name)
    {
        return variable (name, RangeUnbounded.instance);
    }

    /**
        Creates an anonymous variable.
    **/
    public Variable variable (Range range)
    {
        return variable ("", range);
    }

    public SizeVariable sizeVariable (String name)
    {
        return new SizeVariable (name, next++);
    }

    /**
        @return The id the next variable will receive.
    **/
    public int peek ()
    {
        return next;
    }
}
