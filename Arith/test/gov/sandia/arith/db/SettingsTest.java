/*
Copyright 2026 National Technology & Engineering Solutions of Sandia, LLC (NTESS).
Under the terms of Contract DE-NA0003525 with NTESS,
the U.S. Government retains certain rights in this software.
*/

package gov.sandia.arith.db;

import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

import gov.sandia.arith.language.Constant;
import gov.sandia.arith.language.Operator;
import gov.sandia.arith.language.operator.Sum;

import org.junit.Test;

public class SettingsTest {

    @Test
    public void testDefaults() {
        Settings.load();
        assertTrue(Settings.simplify());
        assertTrue(Settings.sanityCheck());
    }

    @Test
    public void testSystemProperty() {
        System.setProperty("arith.sanityCheck", "0");
        try {
            Settings.load();
            assertFalse(Settings.sanityCheck());
            assertTrue(Settings.simplify());
        } finally {
            System.clearProperty("arith.sanityCheck");
            Settings.load();
        }
        assertTrue(Settings.sanityCheck());
    }

    @Test
    public void testDisableSimplification() {
        Settings.state.set("false", "simplify");
        try {
            Operator s = new Constant(2).add(3);
            assertTrue(s instanceof Sum);
        } finally {
            Settings.state.set("1", "simplify");
        }
        assertTrue(new Constant(2).add(3) instanceof Constant);
    }
}
