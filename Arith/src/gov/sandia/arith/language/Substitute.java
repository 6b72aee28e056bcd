/*
Copyright 2026 National Technology & Engineering Solutions of Sandia, LLC (NTESS).
Under the terms of Contract DE-NA0003525 with NTESS,
the U.S. Government retains certain rights in this software.
*/

package gov.sandia.arith.language;

import java.util.Map;

/**
    Replaces every subtree that matches a key of the bindings (by digest equality) with its value.
**/
public class Substitute extends Transformer
{
    public Map<Operator,Operator> bindings;

    public Substitute (Map<Operator,Operator> bindings)
    {
        this.bindings = bindings;
    }

    public Operator transform (Operator op)
    {
        return bindings.get (op);
    }
}
