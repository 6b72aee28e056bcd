/*
Copyright 2026 National Technology & Engineering Solutions of Sandia, LLC (NTESS).
Under the terms of Contract DE-NA0003525 with NTESS,
the U.S. Government retains certain rights in this software.
*/

package gov.sandia.arith.language.function;

import gov.sandia.arith.language.Operator;
import gov.sandia.arith.language.OperatorBinary;

/**
    Logarithm of value in the given base. Only the operands are simplified.
**/
public class Log extends OperatorBinary
{
    public Log (Operator base, Operator value)
    {
        super (base, value);
    }

    public static Operator log (Operator base, Operator value)
    {
        return new Log (base, value).simplify ();
    }

    public String name ()
    {
        return "log";
    }

    public Operator create (Operator operand0, Operator operand1)
    {
        return new Log (operand0, operand1);
    }

    protected int salt ()
    {
        return 0x370285bf;
    }

    public double evalDouble ()
    {
        return Math.log (operand1.evalDouble ()) / Math.log (operand0.evalDouble ());
    }
}
