/*
Copyright 2026 National Technology & Engineering Solutions of Sandia, LLC (NTESS).
Under the terms of Contract DE-NA0003525 with NTESS,
the U.S. Government retains certain rights in this software.
*/

package gov.sandia.arith.language;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertSame;

import gov.sandia.arith.range.RangeEnvironment;
import gov.sandia.arith.range.RangeFrom;
import gov.sandia.arith.range.RangeStepped;

import org.junit.Test;

public class BoundsTest {

    static RangeStepped upTo(long lo, long hi) {
        return RangeStepped.continuous(new Constant(lo), new Constant(hi));
    }

    @Test
    public void testSteppedRange() {
        Scope scope = new Scope();
        Variable v = scope.variable("v", new RangeStepped(new Constant(0), new Constant(10), new Constant(2)));
        assertEquals(new Constant(0), Bounds.declared.min(v));
        assertEquals(new Constant(10), Bounds.declared.max(v));
        assertSame(v, v.min());
        assertSame(v, v.max());
    }

    @Test
    public void testSumAndProduct() {
        Scope scope = new Scope();
        Variable v = scope.variable("v", upTo(0, 10));
        assertEquals(new Constant(3), Bounds.declared.min(v.add(3)));
        assertEquals(new Constant(13), Bounds.declared.max(v.add(3)));
        assertEquals(new Constant(0), Bounds.declared.min(v.multiply(2)));
        assertEquals(new Constant(20), Bounds.declared.max(v.multiply(2)));
    }

    @Test
    public void testPower() {
        Scope scope = new Scope();
        Variable v = scope.variable("v", upTo(0, 10));
        assertEquals(new Constant(0), Bounds.declared.min(v.pow(2)));
        assertEquals(new Constant(100), Bounds.declared.max(v.pow(2)));

        // A negative exponent swaps the ends.
        Variable u = scope.variable("u", upTo(1, 4));
        assertEquals(new Constant(4).pow(-1), Bounds.declared.min(u.pow(-1)));
        assertEquals(Constant.ONE, Bounds.declared.max(u.pow(-1)));
    }

    @Test
    public void testUnknownEnd() {
        Scope scope = new Scope();
        Variable w = scope.variable("w");
        assertSame(w, Bounds.declared.min(w));
        assertSame(w, Bounds.declared.max(w));

        Variable f = scope.variable("f", new RangeFrom(new Constant(5)));
        assertEquals(new Constant(5), Bounds.declared.min(f));
        assertSame(f, Bounds.declared.max(f));
    }

    @Test
    public void testSymbolicEnd() {
        Scope scope = new Scope();
        Variable n = scope.variable("n");
        Variable k = scope.variable("k", RangeStepped.continuous(Constant.ZERO, n));
        assertEquals(n.add(-1), Bounds.declared.max(k.subtract(1)));
    }

    @Test(expected = NotEvaluableException.class)
    public void testNoBoundForModulo() {
        Scope scope = new Scope();
        Bounds.declared.min(scope.variable("i").modulo(scope.variable("j")));
    }

    @Test
    public void testEnvironment() {
        Scope scope = new Scope();
        Variable v = scope.variable("v", upTo(0, 10));
        Bounds narrowed = new Bounds(RangeEnvironment.EMPTY.withRange(v, upTo(2, 5)));
        assertEquals(new Constant(5), narrowed.max(v));
        assertEquals(new Constant(10), Bounds.declared.max(v));
    }

    @Test
    public void testMixedSignProductIsApproximate() {
        // Factors are bounded independently, so the true minimum -6 is not found.
        Scope scope = new Scope();
        Variable x = scope.variable("x", upTo(-2, 3));
        Variable y = scope.variable("y", upTo(-2, 3));
        assertEquals(new Constant(4), Bounds.declared.min(x.multiply(y)));
    }

    @Test
    public void testAtMaxAndAtMin() {
        Scope scope = new Scope();
        Variable i = scope.variable("i", upTo(0, 8));
        Variable j = scope.variable("j", upTo(0, 4));
        Operator e = i.add(j);
        assertEquals(new Constant(12), Bounds.declared.atMax(e));
        assertEquals(new Constant(10), Bounds.declared.atMax(e, true));
        assertEquals(Constant.ZERO, Bounds.declared.atMin(e));

        Variable n = scope.variable("n");
        Variable k = scope.variable("k", RangeStepped.continuous(Constant.ZERO, n));
        assertEquals(n, Bounds.declared.atMax(k, true));

        ArithFunction f = new ArithFunction(upTo(0, 16));
        assertEquals(new Constant(17), Bounds.declared.atMax(f.add(1)));
    }

    @Test
    public void testSmallerAndLarger() {
        Scope scope = new Scope();
        Variable v = scope.variable("v", upTo(0, 10));
        Constant twenty = new Constant(20);
        assertSame(v, Bounds.declared.smaller(v, twenty));
        assertSame(v, Bounds.declared.smaller(twenty, v));
        assertSame(twenty, Bounds.declared.larger(v, twenty));
        assertSame(twenty, Bounds.declared.larger(twenty, v));

        assertEquals(new Constant(3), Bounds.declared.smaller(new Constant(3), new Constant(5)));
        assertEquals(new Constant(5), Bounds.declared.larger(new Constant(5), new Constant(3)));

        Operator p = v.multiply(2);
        assertSame(p, Bounds.declared.smaller(p, new Constant(30)));
        assertSame(p, Bounds.declared.larger(new Constant(-1), p));
    }

    @Test(expected = NotEvaluableException.class)
    public void testOverlapNotOrdered() {
        Scope scope = new Scope();
        Variable v = scope.variable("v", upTo(0, 10));
        Bounds.declared.smaller(v, new Constant(5));
    }

    @Test(expected = IllegalStateException.class)
    public void testSymbolicEndNotOrdered() {
        Scope scope = new Scope();
        Bounds.declared.smaller(scope.variable("w"), new Constant(5));
    }

    @Test(expected = IllegalArgumentException.class)
    public void testProductOfPowerNotOrdered() {
        Scope scope = new Scope();
        Variable v = scope.variable("v", upTo(0, 10));
        Variable u = scope.variable("u", upTo(1, 4));
        Bounds.declared.smaller(v.pow(2).multiply(u), new Constant(100));
    }

    @Test(expected = NotEvaluableException.class)
    public void testConstantMaxReachesZeroUnderReciprocal() {
        Scope scope = new Scope();
        Variable x = scope.variable("x", upTo(0, 1));
        Bounds.declared.atMax(x.pow(-1), true);
    }

    @Test(expected = NotEvaluableException.class)
    public void testReciprocalOfRangeStartingAtZero() {
        Scope scope = new Scope();
        Variable x = scope.variable("x", upTo(0, 4));
        Bounds.declared.max(x.pow(-1));
    }
}
