/*
Copyright 2026 National Technology & Engineering Solutions of Sandia, LLC (NTESS).
Under the terms of Contract DE-NA0003525 with NTESS,
the U.S. Government retains certain rights in this software.
*/

package gov.sandia.arith.language;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNotEquals;
import static org.junit.Assert.assertTrue;

import gov.sandia.arith.range.RangeFrom;
import gov.sandia.arith.range.RangeUnbounded;

import org.junit.Test;

public class ScopeTest {

    @Test
    public void testIds() {
        Scope scope = new Scope();
        assertEquals(0, scope.peek());
        Variable i = scope.variable("i");
        Variable j = scope.variable("j");
        assertEquals(0, i.id);
        assertEquals(1, j.id);
        assertEquals(2, scope.peek());
        assertEquals("i_0", i.toString());
    }

    @Test
    public void testSameNameDistinct() {
        Scope scope = new Scope();
        Variable a = scope.variable("i");
        Variable b = scope.variable("i");
        assertNotEquals(a, b);
        assertNotEquals(a.digest(), b.digest());
    }

    @Test
    public void testAnonymous() {
        Scope scope = new Scope();
        Variable v = scope.variable(RangeUnbounded.instance);
        assertEquals("v_0", v.toString());
    }

    @Test
    public void testSizeVariable() {
        Scope scope = new Scope();
        SizeVariable n = scope.sizeVariable("N");
        assertTrue(n.range instanceof RangeFrom);
        assertEquals(Constant.ONE, n.min());
        assertEquals(Constant.ONE, Bounds.declared.min(n));
        assertEquals(n, Bounds.declared.max(n));
        assertEquals(Constant.ONE, n.divide(n));
    }
}
