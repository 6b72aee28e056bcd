/*
Copyright 2026 National Technology & Engineering Solutions of Sandia, LLC (NTESS).
Under the terms of Contract DE-NA0003525 with NTESS,
the U.S. Government retains certain rights in this software.
*/

package gov.sandia.arith.language;

public class Constant extends Operator
{
    public static final Constant ZERO      = new Constant (0);
    public static final Constant ONE       = new Constant (1);
    public static final Constant MINUS_ONE = new Constant (-1);

    public final long value;

    public Constant (long value)
    {
        this.value = value;
        simplified = true;
    }

    /**
        @return true if e is a constant with the given value.
    **/
    public static boolean isValue (Operator e, long value)
    {
        return e instanceof Constant  &&  ((Constant) e).value == value;
    }

    public String name ()
    {
        return "cst";
    }

    /**
        Mixes both halves of the value so that small negative numbers don't collide with zero.
    **/
    protected int computeDigest ()
    {
        return mix (0x1b873593 ^ (int) value ^ Integer.rotateLeft (mix ((int) (value >>> 32)), 16));
    }

    protected boolean equalsLeaf (Operator that)
    {
        return value == ((Constant) that).value;
    }

    public double evalDouble ()
    {
        return value;
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
        return String.valueOf (value);
    }
}
