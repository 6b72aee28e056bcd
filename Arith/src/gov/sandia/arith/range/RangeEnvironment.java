/*
Copyright 2026 National Technology & Engineering Solutions of Sandia, LLC (NTESS).
Under the terms of Contract DE-NA0003525 with NTESS,
the U.S. Government retains certain rights in this software.
*/

package gov.sandia.arith.range;

import gov.sandia.arith.language.Operator;
import gov.sandia.arith.language.Variable;

import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.function.UnaryOperator;

/**
    Maps variable ids to ranges that override the declared range of the variable.
    Narrowing a range produces a new environment, so two analyses that share a variable
    never see each other's narrowed ranges.
**/
public class RangeEnvironment
{
    public static final RangeEnvironment EMPTY = new RangeEnvironment (new HashMap<Integer,Range> ());

    protected final Map<Integer,Range> ranges;

    protected RangeEnvironment (Map<Integer,Range> ranges)
    {
        this.ranges = Collections.unmodifiableMap (ranges);
    }

    /**
        @return The range recorded for v in this environment, or its declared range if none.
    **/
    public Range rangeOf (Variable v)
    {
        Range result = ranges.get (v.id);
        if (result == null) return v.range;
        return result;
    }

    public RangeEnvironment withRange (Variable v, Range range)
    {
        Map<Integer,Range> next = new HashMap<Integer,Range> (ranges);
        next.put (v.id, range);
        return new RangeEnvironment (next);
    }

    /**
        Applies f to the range of v, unless that range is unbounded, in which case nothing changes.
    **/
    public RangeEnvironment updateRange (Variable v, UnaryOperator<Range> f)
    {
        Range current = rangeOf (v);
        if (current instanceof RangeUnbounded) return this;
        return withRange (v, f.apply (current));
    }

    /**
        Substitutes already-resolved variables into the range endpoints of each given variable.
        @param bindings Typically maps variables to the constants they resolved to.
    **/
    public RangeEnvironment withNarrowedRange (Collection<Variable> variables, Map<Operator,Operator> bindings)
    {
        Map<Integer,Range> next = new HashMap<Integer,Range> (ranges);
        for (Variable v : variables)
        {
            if (bindings.containsKey (v)) continue;
            next.put (v.id, rangeOf (v).substitute (bindings));
        }
        return new RangeEnvironment (next);
    }

    public int size ()
    {
        return ranges.size ();
    }
}
