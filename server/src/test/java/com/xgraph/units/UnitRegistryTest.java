package com.xgraph.units;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class UnitRegistryTest {

    private final UnitRegistry units = new UnitRegistry();

    @Test
    public void testConversionFactors() {
        assertEquals(0.001, units.conversionFactor("ms", "s"), 1e-15);
        assertEquals(1000.0, units.conversionFactor("V", "mV"), 1e-9);
        assertEquals(1.0, units.conversionFactor("pA", "pA"));
        assertArrayEquals(new double[] { -0.07, 0.02 }, units.convert(new double[] { -70, 20 }, "mV", "V"), 1e-12);
    }

    @Test
    public void testOpaqueLabels() {
        assertTrue(units.parse(UnitRegistry.INDEX_UNITS).isEmpty());
        assertTrue(units.parse("").isEmpty());
        assertTrue(units.parse(null).isEmpty());
        assertEquals("index", units.canonical(" index "));
        assertTrue(units.sameUnits("index", "index"));
        assertTrue(units.sameUnits(null, ""));
        assertFalse(units.sameUnits("s", "ms"));
    }

    @Test
    public void testCompatibility() {
        assertTrue(units.isCompatible("ms", "s"));
        assertFalse(units.isCompatible("mV", "s"));
        assertFalse(units.isCompatible("index", "s"));
    }

    @Test
    public void testIncommensurableUnits() {
        assertThrows(IncommensurableUnitsException.class, () -> units.conversionFactor("mV", "s"));
        assertThrows(IncommensurableUnitsException.class, () -> units.convert(new double[] { 1 }, "index", "s"));
    }

    @Test
    public void testToBaseUnits() {
        UnitRegistry.Converted c = units.toBaseUnits(new double[] { 250, 500 }, "ms");
        assertEquals("s", c.getUnits());
        assertArrayEquals(new double[] { 0.25, 0.5 }, c.getValues(), 1e-12);

        UnitRegistry.Converted opaque = units.toBaseUnits(new double[] { 1, 2 }, "arbitrary");
        assertEquals("arbitrary", opaque.getUnits());
        assertArrayEquals(new double[] { 1, 2 }, opaque.getValues());
    }
}
