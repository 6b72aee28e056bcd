/*
Copyright 2026 National Technology & Engineering Solutions of Sandia, LLC (NTESS).
Under the terms of Contract DE-NA0003525 with NTESS,
the U.S. Government retains certain rights in this software.
*/

package gov.sandia.arith.language;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

import gov.sandia.arith.language.operator.Sum;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import org.junit.Test;

public class SubstituteTest {

    @Test
    public void testResimplify() {
        Scope scope = new Scope();
        Variable i = scope.variable("i");
        Variable j = scope.variable("j");
        assertEquals(j.add(3), i.add(j).substitute(i, new Constant(3)));
        assertEquals(Constant.ZERO, i.multiply(j).substitute(j, Constant.ZERO));
        assertEquals(new Constant(7), i.add(j).substitute(i, new Constant(3)).substitute(j, new Constant(4)));
    }

    @Test
    public void testReflatten() {
        Scope scope = new Scope();
        Variable i = scope.variable("i");
        Variable j = scope.variable("j");
        Variable k = scope.variable("k");
        Operator s = i.add(j).substitute(j, k.add(1));
        assertTrue(s instanceof Sum);
        assertEquals(3, ((Sum) s).operands.size());
        assertEquals(i.add(k).add(1), s);
    }

    @Test
    public void testSubtree() {
        Scope scope = new Scope();
        Variable i = scope.variable("i");
        Variable j = scope.variable("j");
        Variable n = scope.variable("n");
        Operator m = i.modulo(n);
        assertEquals(j.add(2), m.add(j).substitute(m, new Constant(2)));
    }

    @Test
    public void testSimultaneous() {
        Scope scope = new Scope();
        Variable i = scope.variable("i");
        Variable j = scope.variable("j");
        Map<Operator,Operator> swap = new HashMap<Operator,Operator>();
        swap.put(i, j);
        swap.put(j, i);
        Operator m = i.modulo(j);
        assertEquals(j.modulo(i), m.substitute(swap));
    }

    @Test
    public void testConditionalFolds() {
        Scope scope = new Scope();
        Variable i = scope.variable("i");
        Variable a = scope.variable("a");
        Variable b = scope.variable("b");
        Operator c = i.lt(5).then(a).otherwise(b);
        assertEquals(a, c.substitute(i, new Constant(3)));
        assertEquals(b, c.substitute(i, new Constant(5)));
    }

    @Test
    public void testTraversal() {
        Scope scope = new Scope();
        Variable i = scope.variable("i");
        Variable j = scope.variable("j");
        Variable k = scope.variable("k");
        Operator e = i.modulo(j).add(k);

        assertEquals(Arrays.asList(i, j, k), new ArrayList<Variable>(e.variables()));
        assertTrue(e.contains(j));
        assertFalse(e.contains(scope.variable("n")));

        final List<Operator> seen = new ArrayList<Operator>();
        e.visit(new Visitor() {
            public boolean visit(Operator op) {
                seen.add(op);
                return ! (op instanceof Sum);
            }
        });
        assertEquals(1, seen.size());

        ArithFunction f = new ArithFunction();
        assertTrue(f.add(i).functions().contains(f));
        assertTrue(i.functions().isEmpty());
    }
}
