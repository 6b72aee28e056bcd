/*
Copyright 2026 National Technology & Engineering Solutions of Sandia, LLC (NTESS).
Under the terms of Contract DE-NA0003525 with NTESS,
the U.S. Government retains certain rights in this software.
*/

package gov.sandia.arith.language.operator;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;

import gov.sandia.arith.language.Constant;
import gov.sandia.arith.language.Operator;
import gov.sandia.arith.language.Scope;
import gov.sandia.arith.language.Variable;
import gov.sandia.arith.language.Visitor;

import org.junit.Test;

public class ProductTest {

    @Test
    public void testIdentityAndZero() {
        Scope scope = new Scope();
        Variable x = scope.variable("x");
        assertSame(x, x.multiply(1));
        assertEquals(Constant.ZERO, x.multiply(0));
        assertEquals(Constant.ZERO, Constant.ZERO.multiply(x.add(1)));
    }

    @Test
    public void testConstantFirst() {
        Scope scope = new Scope();
        Variable x = scope.variable("x");
        Operator p = x.multiply(2).multiply(3);
        assertTrue(p instanceof Product);
        Product product = (Product) p;
        assertEquals(new Constant(6), product.operands.get(0));
        assertEquals(new Constant(6), product.constantFactor());
        assertNull(((Product) x.multiply(scope.variable("y"))).constantFactor());
    }

    @Test
    public void testPowers() {
        Scope scope = new Scope();
        Variable x = scope.variable("x");
        assertEquals(new Power(x, new Constant(2)), x.multiply(x));
        assertEquals(new Power(x, new Constant(5)), x.pow(2).multiply(x.pow(3)));
        assertEquals(Constant.ONE, x.multiply(x.pow(-1)));
    }

    @Test
    public void testConstantReciprocals() {
        assertEquals(new Constant(2), new Constant(4).multiply(new Constant(2).pow(-1)));
        assertEquals(new Power(new Constant(2), Constant.MINUS_ONE), new Constant(2).multiply(new Constant(4).pow(-1)));
        assertEquals(new Power(new Constant(6), Constant.MINUS_ONE), new Constant(2).pow(-1).multiply(new Constant(3).pow(-1)));
    }

    @Test
    public void testDistribute() {
        Scope scope = new Scope();
        Variable x = scope.variable("x");
        assertEquals(new Constant(2).multiply(x).add(2), new Constant(2).multiply(x.add(1)));

        Operator square = x.add(1).multiply(x.add(1));
        assertEquals(x.pow(2).add(x.multiply(2)).add(1), square);
        assertTrue(square instanceof Sum);
    }

    @Test
    public void testNoSumFactors() {
        Scope scope = new Scope();
        Variable x = scope.variable("x");
        Variable y = scope.variable("y");
        Operator e = x.add(y).multiply(x.subtract(y)).multiply(3);
        e.visit(new Visitor() {
            public boolean visit(Operator op) {
                if (op instanceof Product) {
                    for (Operator f : ((Product) op).operands) assertFalse(f instanceof Sum);
                }
                return true;
            }
        });
        assertEquals(x.pow(2).multiply(3).subtract(y.pow(2).multiply(3)), e);
    }

    @Test
    public void testNegatedTerm() {
        Scope scope = new Scope();
        Variable x = scope.variable("x");
        Variable y = scope.variable("y");
        assertTrue(((Product) x.multiply(-1)).isNegatedTerm());
        assertFalse(((Product) x.multiply(-2)).isNegatedTerm());
        assertFalse(((Product) x.multiply(y)).isNegatedTerm());
    }

    @Test
    public void testWithoutFactor() {
        Scope scope = new Scope();
        Variable x = scope.variable("x");
        Variable y = scope.variable("y");
        Product p = (Product) x.multiply(y).multiply(5);
        assertEquals(x.multiply(5), p.withoutFactor(y));
        assertEquals(x.multiply(y), p.withoutFactor(new Constant(5)));
    }

    @Test
    public void testBoundsFormula() {
        Scope scope = new Scope();
        Variable x = scope.variable("x");
        Product p = new Product(new Constant(3), x);
        assertEquals(new Constant(3).multiply(x), p.min());
    }
}
