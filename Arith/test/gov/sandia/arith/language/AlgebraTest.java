/*
Copyright 2026 National Technology & Engineering Solutions of Sandia, LLC (NTESS).
Under the terms of Contract DE-NA0003525 with NTESS,
the U.S. Government retains certain rights in this software.
*/

package gov.sandia.arith.language;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNotNull;
import static org.junit.Assert.assertTrue;

import gov.sandia.arith.language.operator.Divide;
import gov.sandia.arith.language.operator.Sum;
import gov.sandia.arith.range.RangeStepped;

import java.math.BigInteger;
import java.util.Arrays;
import java.util.Random;

import org.junit.Test;

public class AlgebraTest {

    static RangeStepped upTo(long lo, long hi) {
        return RangeStepped.continuous(new Constant(lo), new Constant(hi));
    }

    @Test
    public void testGcdConstants() {
        assertEquals(new Constant(6), Algebra.gcd(new Constant(12), new Constant(18)));
        assertEquals(new Constant(5), Algebra.gcd(new Constant(0), new Constant(5)));
        assertEquals(new Constant(2), Algebra.gcd(new Constant(-4), new Constant(6)));
        assertEquals(6, Algebra.gcd(12, 18));
        assertEquals(1, Algebra.gcd(17, 5));
    }

    @Test
    public void testGcdRandomConstants() {
        Random random = new Random(42);
        for (int n = 0; n < 500; n++) {
            long a = random.nextInt(2001) - 1000;
            long b = random.nextInt(2001) - 1000;
            if (a == 0 && b == 0) continue;
            Operator g = Algebra.gcd(new Constant(a), new Constant(b));
            long expected = BigInteger.valueOf(a).gcd(BigInteger.valueOf(b)).longValue();
            assertEquals(new Constant(expected), g);
            assertTrue(Algebra.multipleOf(g, new Constant(a)));
            assertTrue(Algebra.multipleOf(g, new Constant(b)));
        }
    }

    @Test
    public void testGcdProductsAndPowers() {
        Scope scope = new Scope();
        Variable x = scope.variable("x");
        Variable y = scope.variable("y");
        assertEquals(x, Algebra.gcd(x, x));
        assertEquals(new Constant(2).multiply(x), Algebra.gcd(x.multiply(2), x.multiply(4)));
        assertEquals(x.pow(2), Algebra.gcd(x.pow(2), x.pow(3)));
        assertEquals(x, Algebra.gcd(x, x.pow(3)));
        assertEquals(x, Algebra.gcd(x.multiply(y), x));
        assertEquals(Constant.ONE, Algebra.gcd(x, y));
    }

    @Test
    public void testGcdNeverFraction() {
        Scope scope = new Scope();
        Variable x = scope.variable("x");
        Variable y = scope.variable("y");
        assertEquals(Constant.ONE, Algebra.gcd(x.pow(-1), x));
        assertEquals(Constant.ONE, Algebra.gcd(x.pow(-1), x.pow(-1)));
        Operator q = x.divide(y);
        assertTrue(q instanceof Divide);
        assertEquals(Constant.ONE, Algebra.gcd(q, q));
    }

    @Test
    public void testGcdSums() {
        Scope scope = new Scope();
        Variable x = scope.variable("x");
        Variable y = scope.variable("y");
        Operator s = x.multiply(2).add(y.multiply(2));
        assertEquals(new Constant(2), Algebra.gcd(s, new Constant(4)));
        assertEquals(new Constant(2), Algebra.gcd(new Constant(4), s));
        assertEquals(x.add(y), Algebra.gcd(x.multiply(3).add(y.multiply(3)), s));
        assertEquals(Constant.ONE, Algebra.gcd(x.add(1), s));
    }

    @Test
    public void testFactorize() {
        Scope scope = new Scope();
        Variable x = scope.variable("x");
        Variable y = scope.variable("y");
        assertEquals(new Constant(3), Algebra.factorize((Sum) x.multiply(6).add(y.multiply(9))));
        assertEquals(Constant.ONE, Algebra.factorize((Sum) x.add(1)));
        assertEquals(x, Algebra.factorize((Sum) x.multiply(y).add(x.pow(2))));
    }

    @Test
    public void testMultipleOf() {
        Scope scope = new Scope();
        Variable x = scope.variable("x");
        Variable y = scope.variable("y");
        assertTrue(Algebra.multipleOf(new Constant(2), new Constant(6)));
        assertFalse(Algebra.multipleOf(new Constant(4), new Constant(6)));
        assertFalse(Algebra.multipleOf(Constant.ZERO, new Constant(5)));
        assertTrue(Algebra.multipleOf(new Constant(3), x.multiply(6)));
        assertFalse(Algebra.multipleOf(new Constant(4), x.multiply(6)));
        assertTrue(Algebra.multipleOf(x, x.multiply(2)));
        assertTrue(Algebra.multipleOf(x.multiply(y), x.multiply(y).multiply(2)));
        assertFalse(Algebra.multipleOf(x.multiply(y), x.multiply(2)));
        assertTrue(Algebra.multipleOf(x, x));
        assertFalse(Algebra.multipleOf(x, y));
        assertTrue(Algebra.multipleOf(x.divide(4), x.divide(2)));
    }

    @Test
    public void testIsSmaller() {
        Scope scope = new Scope();
        Variable i = scope.variable("i", upTo(0, 4));
        assertTrue(Algebra.isSmaller(i, new Constant(5)));
        assertTrue(Algebra.isSmaller(i, new Constant(4)));
        assertFalse(Algebra.isSmaller(i, new Constant(3)));
        assertFalse(Algebra.isSmaller(scope.variable("w"), new Constant(100)));

        Variable n = scope.variable("n");
        Variable y = scope.variable("y");
        Variable x = scope.variable("x", RangeStepped.continuous(Constant.ZERO, n));
        assertTrue(Algebra.isSmaller(x.multiply(y.pow(-1)), n));
    }

    @Test
    public void testMightBeNegative() {
        Scope scope = new Scope();
        assertFalse(Algebra.mightBeNegative(Constant.ZERO));
        assertTrue(Algebra.mightBeNegative(Constant.MINUS_ONE));
        assertFalse(Algebra.mightBeNegative(scope.variable("v", upTo(0, 10))));
        assertTrue(Algebra.mightBeNegative(scope.variable("w")));
        assertTrue(Algebra.mightBeNegative(scope.variable("u", upTo(-1, 10))));
    }

    @Test
    public void testDivisions() {
        Scope scope = new Scope();
        Variable x = scope.variable("x");
        assertTrue(Algebra.isDivision(x.pow(-1)));
        assertFalse(Algebra.isDivision(x.pow(-2)));
        assertFalse(Algebra.isDivision(x));
        assertTrue(Algebra.hasDivision(Arrays.<Operator>asList(x, x.pow(-1))));
        assertFalse(Algebra.hasDivision(Arrays.<Operator>asList(x, x.pow(2))));
    }

    @Test
    public void testIsSmallerWithZeroUnderReciprocal() {
        Scope scope = new Scope();
        Variable x = scope.variable("x", upTo(0, 1));
        assertFalse(Algebra.isSmaller(x.pow(-1), new Constant(5)));
        assertNotNull(x.pow(-1).divide(5));
    }
}
