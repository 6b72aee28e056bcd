/*
Copyright 2026 National Technology & Engineering Solutions of Sandia, LLC (NTESS).
Under the terms of Contract DE-NA0003525 with NTESS,
the U.S. Government retains certain rights in this software.
*/

package gov.sandia.arith.language.function;

import gov.sandia.arith.language.Operator;

/**
    Rounds toward negative infinity. Only the operand is simplified.
**/
public class Floor extends Operator
{
    public final Operator operand;

    public Floor (Operator operand)
    {
        this.operand = operand;
    }

    public static Operator floor (Operator operand)
    {
        return new Floor (operand).simplify ();
    }

    public String name ()
    {
        return "floor";
    }

    public Operator[] operands ()
    {
        return new Operator[] {operand};
    }

    public Operator create (Operator[] operands)
    {
        return new Floor (operands[0]);
    }

    protected int computeDigest ()
    {
        return 0x558052ce ^ operand.digest ();
    }

    public double evalDouble ()
    {
        return Math.floor (operand.evalDouble ());
    }
}
