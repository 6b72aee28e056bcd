/*
Copyright 2026 National Technology & Engineering Solutions of Sandia, LLC (NTESS).
Under the terms of Contract DE-NA0003525 with NTESS,
the U.S. Government retains certain rights in this software.
*/

package gov.sandia.arith.language;

import gov.sandia.arith.language.operator.Power;
import gov.sandia.arith.language.operator.Product;
import gov.sandia.arith.language.operator.Sum;
import gov.sandia.arith.range.Range;
import gov.sandia.arith.range.RangeEnvironment;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
    Static bounds analysis. Computes the tightest known lower and upper bound of an expression by
    recursing over its shape and the ranges of its variables.

    Terms of a sum and factors of a product are treated as independent, and the sign of a factor
    is not tracked. The bound of a product with a factor that can be negative may therefore be wrong.
    The simplification rules that consult this oracle tolerate that.
**/
public class Bounds
{
    /**
        Bounds over the declared ranges of the variables.
    **/
    public static final Bounds declared = new Bounds (RangeEnvironment.EMPTY);

    public final RangeEnvironment environment;

    public Bounds (RangeEnvironment environment)
    {
        this.environment = environment;
    }

    protected Range rangeOf (Operator e)
    {
        if (e instanceof Variable)      return environment.rangeOf ((Variable) e);
        if (e instanceof ArithFunction) return ((ArithFunction) e).range;
        return null;
    }

    /**
        @throws NotEvaluableException if the expression has a shape for which no bound is known.
    **/
    public Operator min (Operator e)
    {
        return bound (e, true);
    }

    /**
        @throws NotEvaluableException if the expression has a shape for which no bound is known.
    **/
    public Operator max (Operator e)
    {
        return bound (e, false);
    }

    protected Operator bound (Operator e, boolean lower)
    {
        if (e instanceof Constant) return e;
        if (e instanceof Variable)
        {
            // A variable whose endpoint is unknown is its own best bound.
            Range r = environment.rangeOf ((Variable) e);
            Operator end = lower ? r.min () : r.max ();
            if (end instanceof Unknown) return e;
            return bound (end, lower);
        }
        if (e instanceof Sum)
        {
            Operator result = Constant.ZERO;
            for (Operator t : ((Sum) e).operands) result = result.add (bound (t, lower));
            return result;
        }
        if (e instanceof Product)
        {
            Operator result = Constant.ONE;
            for (Operator f : ((Product) e).operands) result = result.multiply (bound (f, lower));
            return result;
        }
        if (e instanceof Power)
        {
            Power p = (Power) e;
            if (p.operand1 instanceof Constant)
            {
                long c = ((Constant) p.operand1).value;
                if (c < 0) return power (bound (p.operand0, ! lower), p.operand1);  // decreasing
                Operator baseMin = bound (p.operand0, true);
                if (baseMin instanceof Constant  &&  ((Constant) baseMin).value >= 0)  // increasing
                {
                    if (lower) return power (baseMin, p.operand1);
                    return power (bound (p.operand0, false), p.operand1);
                }
            }
        }
        throw new NotEvaluableException ("No bound for " + e);
    }

    /**
        A reciprocal bound whose base bound is zero has no value.
    **/
    protected static Operator power (Operator base, Operator exponent)
    {
        try
        {
            return base.pow (exponent);
        }
        catch (ArithmeticException x)
        {
            throw new NotEvaluableException ("No bound for " + base + " raised to " + exponent);
        }
    }

    /**
        Replaces every variable and function placeholder that has a known upper endpoint with that endpoint.
    **/
    public Operator atMax (Operator e)
    {
        return atMax (e, false);
    }

    /**
        @param constantMax When every endpoint used is a literal, decrement each by one.
        This models an index that ranges up to, but excluding, its maximum.
    **/
    public Operator atMax (Operator e, boolean constantMax)
    {
        List<Operator> targets = new ArrayList<Operator> ();
        List<Operator> ends    = new ArrayList<Operator> ();
        collectEnds (e, false, targets, ends);

        if (constantMax)
        {
            boolean allLiteral = true;
            for (Operator end : ends) if (! (end instanceof Constant)) allLiteral = false;
            if (allLiteral)
            {
                for (int i = 0; i < ends.size (); i++) ends.set (i, new Constant (((Constant) ends.get (i)).value - 1));
            }
        }
        return specialize (e, bindings (targets, ends));
    }

    /**
        Replaces every variable and function placeholder that has a known lower endpoint with that endpoint.
    **/
    public Operator atMin (Operator e)
    {
        List<Operator> targets = new ArrayList<Operator> ();
        List<Operator> ends    = new ArrayList<Operator> ();
        collectEnds (e, true, targets, ends);
        return specialize (e, bindings (targets, ends));
    }

    protected void collectEnds (Operator e, boolean lower, List<Operator> targets, List<Operator> ends)
    {
        List<Operator> candidates = new ArrayList<Operator> ();
        candidates.addAll (e.variables ());
        candidates.addAll (e.functions ());
        for (Operator c : candidates)
        {
            Range r = rangeOf (c);
            Operator end = lower ? r.min () : r.max ();
            if (end instanceof Unknown) continue;
            targets.add (c);
            ends.add (end);
        }
    }

    /**
        @throws NotEvaluableException if an endpoint puts a zero under a reciprocal or a division.
    **/
    protected static Operator specialize (Operator e, Map<Operator,Operator> bindings)
    {
        try
        {
            return e.substitute (bindings);
        }
        catch (ArithmeticException x)
        {
            throw new NotEvaluableException ("Specializing " + e + " at its bounds divides by zero");
        }
    }

    protected static Map<Operator,Operator> bindings (List<Operator> targets, List<Operator> ends)
    {
        Map<Operator,Operator> result = new HashMap<Operator,Operator> ();
        for (int i = 0; i < targets.size (); i++) result.put (targets.get (i), ends.get (i));
        return result;
    }

    /**
        @return The smaller of two expressions.
        @throws NotEvaluableException if the order can't be decided.
        @throws IllegalStateException if a variable endpoint needed for the comparison is not a literal.
    **/
    public Operator smaller (Operator a, Operator b)
    {
        return order (a, b)[0];
    }

    /**
        @return The larger of two expressions.
        @see #smaller(Operator, Operator)
    **/
    public Operator larger (Operator a, Operator b)
    {
        return order (a, b)[1];
    }

    /**
        @return {smaller, larger}
    **/
    protected Operator[] order (Operator a, Operator b)
    {
        Operator difference = a.subtract (b);
        if (difference instanceof Constant)
        {
            if (((Constant) difference).value < 0) return new Operator[] {a, b};
            return new Operator[] {b, a};
        }

        // The pair returned below is already {smaller, larger}, whichever side the constant is on.
        if (a instanceof Variable  &&  b instanceof Constant) return order ((Variable) a, (Constant) b);
        if (a instanceof Constant  &&  b instanceof Variable) return order ((Variable) b, (Constant) a);
        if (a instanceof Product   &&  b instanceof Constant) return order ((Product) a, (Constant) b);
        if (a instanceof Constant  &&  b instanceof Product)  return order ((Product) b, (Constant) a);
        throw new NotEvaluableException ("Can't order " + a + " and " + b);
    }

    protected Operator[] order (Variable v, Constant c)
    {
        Range r = environment.rangeOf (v);
        long lo = literal (v, r.min (), "Lower");
        if (lo >= c.value) return new Operator[] {c, v};
        long hi = literal (v, r.max (), "Upper");
        if (hi <= c.value) return new Operator[] {v, c};
        throw new NotEvaluableException ("Can't order " + v + " and " + c);
    }

    protected static long literal (Variable v, Operator end, String which)
    {
        if (end instanceof Constant) return ((Constant) end).value;
        throw new IllegalStateException (which + " bound of " + v + " is not a literal: " + end);
    }

    protected Operator[] order (Product p, Constant c)
    {
        Long lo = productBound (p, true);
        if (lo != null  &&  lo >= c.value) return new Operator[] {c, p};
        Long hi = productBound (p, false);
        if (hi != null  &&  hi <= c.value) return new Operator[] {p, c};
        throw new NotEvaluableException ("Can't order " + p + " and " + c);
    }

    /**
        Multiplies the literal endpoints of the factors of a product of variables and constants.
        @return The bound, or null if some variable endpoint is not a literal.
        @throws IllegalArgumentException if a factor is neither a variable nor a constant.
    **/
    protected Long productBound (Product p, boolean lower)
    {
        Operator result = Constant.ONE;
        for (Operator f : p.operands)
        {
            if (f instanceof Constant)
            {
                result = result.multiply (f);
            }
            else if (f instanceof Variable)
            {
                Range r = environment.rangeOf ((Variable) f);
                Operator end = lower ? r.min () : r.max ();
                if (! (end instanceof Constant)) return null;
                result = result.multiply (end);
            }
            else
            {
                throw new IllegalArgumentException ((lower ? "Lower" : "Upper") + " bound of a product expects only variables and constants: " + f);
            }
        }
        return result.eval ();
    }
}
