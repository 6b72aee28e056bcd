/*
Copyright 2026 National Technology & Engineering Solutions of Sandia, LLC (NTESS).
Under the terms of Contract DE-NA0003525 with NTESS,
the U.S. Government retains certain rights in this software.
*/

package gov.sandia.arith.language;

import gov.sandia.arith.range.RangeFrom;

/**
    A variable that holds a size or count. It ranges from 1 upward, and its own lower bound formula is 1.
**/
public class SizeVariable extends Variable
{
    SizeVariable (String name, int id)
    {
        super (name, new RangeFrom (Constant.ONE), id);
    }

    public Operator min ()
    {
        return Constant.ONE;
    }
}
