/*
Copyright 2026 National Technology & Engineering Solutions of Sandia, LLC (NTESS).
Under the terms of Contract DE-NA0003525 with NTESS,
the U.S. Government retains certain rights in this software.
*/

package gov.sandia.arith.language;

import gov.sandia.arith.language.function.IfThenElse;

import org.apache.log4j.Logger;

/**
    A comparison between two expressions. This is plain data and is not itself an expression.
    It becomes one when combined into a conditional with then(x).otherwise(y).
**/
public class Predicate
{
    private static Logger logger = Logger.getLogger (Predicate.class);

    public enum Comparison
    {
        LT ("<",  0x1f3a),
        GT (">",  0x2e51),
        LE ("<=", 0x47c9),
        GE (">=", 0x5b06),
        EQ ("==", 0x6d82),
        NE ("!=", 0x7a1d);

        public final String symbol;
        public final int    salt;

        Comparison (String symbol, int salt)
        {
            this.symbol = symbol;
            this.salt   = salt;
        }

        /**
            Applies this comparison to a known difference lhs-rhs.
        **/
        public boolean test (long difference)
        {
            switch (this)
            {
                case LT: return difference <  0;
                case GT: return difference >  0;
                case LE: return difference <= 0;
                case GE: return difference >= 0;
                case EQ: return difference == 0;
                default: return difference != 0;
            }
        }

        /**
            Applies this comparison to a difference known only to lie in [lo,hi].
            Either end may be null if it is unknown.
            @return The outcome, or null if the interval doesn't settle it.
        **/
        public Boolean test (Long lo, Long hi)
        {
            switch (this)
            {
                case LT:
                    if (hi != null  &&  hi <  0) return true;
                    if (lo != null  &&  lo >= 0) return false;
                    return null;
                case GT:
                    if (lo != null  &&  lo >  0) return true;
                    if (hi != null  &&  hi <= 0) return false;
                    return null;
                case LE:
                    if (hi != null  &&  hi <= 0) return true;
                    if (lo != null  &&  lo >  0) return false;
                    return null;
                case GE:
                    if (lo != null  &&  lo >= 0) return true;
                    if (hi != null  &&  hi <  0) return false;
                    return null;
                case EQ:
                    if (lo != null  &&  hi != null  &&  lo == 0  &&  hi == 0) return true;
                    if (lo != null  &&  lo > 0  ||  hi != null  &&  hi < 0) return false;
                    return null;
                default:
                    if (lo != null  &&  hi != null  &&  lo == 0  &&  hi == 0) return false;
                    if (lo != null  &&  lo > 0  ||  hi != null  &&  hi < 0) return true;
                    return null;
            }
        }
    }

    public final Operator   lhs;
    public final Operator   rhs;
    public final Comparison comparison;

    public Predicate (Operator lhs, Operator rhs, Comparison comparison)
    {
        this.lhs        = lhs;
        this.rhs        = rhs;
        this.comparison = comparison;
    }

    public class Then
    {
        public final Operator thenValue;

        public Then (Operator thenValue)
        {
            this.thenValue = thenValue;
        }

        /**
            Completes the conditional and simplifies it, which folds it when the test is decidable.
        **/
        public Operator otherwise (Operator elseValue)
        {
            return new IfThenElse (Predicate.this, thenValue, elseValue).simplify ();
        }
    }

    public Then then (Operator thenValue)
    {
        return new Then (thenValue);
    }

    /**
        Attempts to settle this comparison statically: first by evaluating the difference of
        the two sides, then from the declared bounds of that difference.
        @return The outcome, or null if it can't be decided.
    **/
    public Boolean decide ()
    {
        Operator difference = lhs.subtract (rhs);
        if (difference instanceof Constant) return comparison.test (((Constant) difference).value);
        try
        {
            return comparison.test (difference.eval ());
        }
        catch (NotEvaluableException e)
        {
            logger.trace ("Difference not evaluable: " + difference);
        }

        Long lo = boundOf (difference, true);
        Long hi = boundOf (difference, false);
        return comparison.test (lo, hi);
    }

    protected static Long boundOf (Operator e, boolean lower)
    {
        try
        {
            if (lower) return Bounds.declared.min (e).eval ();
            return Bounds.declared.max (e).eval ();
        }
        catch (NotEvaluableException e2)
        {
            return null;
        }
    }

    public int digest ()
    {
        return 0x7c6736c0 ^ lhs.digest () ^ Integer.rotateLeft (~rhs.digest (), 1) ^ comparison.salt;
    }

    public boolean equals (Object o)
    {
        if (! (o instanceof Predicate)) return false;
        return digest () == ((Predicate) o).digest ();
    }

    public int hashCode ()
    {
        return digest ();
    }

    public String toString ()
    {
        return "(" + lhs + " " + comparison.symbol + " " + rhs + ")";
    }
}
