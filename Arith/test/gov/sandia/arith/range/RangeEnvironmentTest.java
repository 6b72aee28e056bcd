/*
Copyright 2026 National Technology & Engineering Solutions of Sandia, LLC (NTESS).
Under the terms of Contract DE-NA0003525 with NTESS,
the U.S. Government retains certain rights in this software.
*/

package gov.sandia.arith.range;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertSame;

import gov.sandia.arith.language.Constant;
import gov.sandia.arith.language.Operator;
import gov.sandia.arith.language.Scope;
import gov.sandia.arith.language.Variable;

import java.util.Arrays;
import java.util.HashMap;
import java.util.Map;
import java.util.function.UnaryOperator;

import org.junit.Test;

public class RangeEnvironmentTest {

    @Test
    public void testDeclaredRange() {
        Scope scope = new Scope();
        Range declared = RangeStepped.continuous(Constant.ZERO, new Constant(10));
        Variable v = scope.variable("v", declared);
        assertSame(declared, RangeEnvironment.EMPTY.rangeOf(v));
        assertEquals(0, RangeEnvironment.EMPTY.size());
    }

    @Test
    public void testWithRangeLeavesOriginal() {
        Scope scope = new Scope();
        Range declared = RangeStepped.continuous(Constant.ZERO, new Constant(10));
        Range narrow = RangeStepped.continuous(Constant.ZERO, new Constant(4));
        Variable v = scope.variable("v", declared);
        RangeEnvironment env = RangeEnvironment.EMPTY.withRange(v, narrow);
        assertSame(narrow, env.rangeOf(v));
        assertSame(declared, RangeEnvironment.EMPTY.rangeOf(v));
        assertSame(declared, v.range);
        assertEquals(1, env.size());
    }

    @Test
    public void testUpdateRange() {
        Scope scope = new Scope();
        Variable v = scope.variable("v", RangeStepped.continuous(Constant.ONE, new Constant(10)));
        Variable w = scope.variable("w");
        UnaryOperator<Range> triple = new UnaryOperator<Range>() {
            public Range apply(Range r) {
                return r.scale(new Constant(3));
            }
        };

        RangeEnvironment env = RangeEnvironment.EMPTY.updateRange(v, triple);
        assertEquals(new Constant(3), env.rangeOf(v).min());
        assertEquals(new Constant(30), env.rangeOf(v).max());
        assertSame(env, env.updateRange(w, triple));
    }

    @Test
    public void testNarrow() {
        Scope scope = new Scope();
        Variable i = scope.variable("i", RangeStepped.continuous(Constant.ZERO, new Constant(8)));
        Variable j = scope.variable("j", RangeStepped.continuous(Constant.ZERO, i));
        Map<Operator,Operator> bindings = new HashMap<Operator,Operator>();
        bindings.put(i, new Constant(4));

        RangeEnvironment env = RangeEnvironment.EMPTY.withNarrowedRange(Arrays.asList(i, j), bindings);
        assertEquals(new Constant(4), env.rangeOf(j).max());
        assertSame(i.range, env.rangeOf(i));
        assertEquals(i, j.range.max());
    }
}
