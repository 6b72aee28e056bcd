/*
Copyright 2026 National Technology & Engineering Solutions of Sandia, LLC (NTESS).
Under the terms of Contract DE-NA0003525 with NTESS,
the U.S. Government retains certain rights in this software.
*/

package gov.sandia.arith.language.function;

import gov.sandia.arith.language.Operator;
import gov.sandia.arith.language.Predicate;

/**
    Conditional, like ?: in C. Folds to one branch when the test can be decided statically,
    and to either branch when both are equal.
    The operands, in order, are the two sides of the test followed by the two branches.
**/
public class IfThenElse extends Operator
{
    public final Predicate test;
    public final Operator  thenValue;
    public final Operator  elseValue;

    public IfThenElse (Predicate test, Operator thenValue, Operator elseValue)
    {
        this.test      = test;
        this.thenValue = thenValue;
        this.elseValue = elseValue;
    }

    public String name ()
    {
        return "ite";
    }

    public Operator[] operands ()
    {
        return new Operator[] {test.lhs, test.rhs, thenValue, elseValue};
    }

    public Operator create (Operator[] operands)
    {
        return new IfThenElse (new Predicate (operands[0], operands[1], test.comparison), operands[2], operands[3]);
    }

    protected Operator rules (Operator[] operands)
    {
        if (operands[2].equals (operands[3])) return operands[2];
        Boolean outcome = new Predicate (operands[0], operands[1], test.comparison).decide ();
        if (outcome == null) return null;
        if (outcome) return operands[2];
        return operands[3];
    }

    protected int computeDigest ()
    {
        return 0x32c3d095 ^ test.digest () ^ Integer.rotateLeft (thenValue.digest (), 3) ^ Integer.rotateLeft (~elseValue.digest (), 1);
    }

    protected boolean equalsLeaf (Operator that)
    {
        return test.comparison == ((IfThenElse) that).test.comparison;
    }

    public String toString ()
    {
        return "(" + test + " ? " + thenValue + " : " + elseValue + ")";
    }
}
