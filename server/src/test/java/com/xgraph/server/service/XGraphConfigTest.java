package com.xgraph.server.service;

import org.junit.jupiter.api.Test;

import java.io.ByteArrayInputStream;
import java.nio.charset.StandardCharsets;

import static org.junit.jupiter.api.Assertions.*;

public class XGraphConfigTest {

    @Test
    public void testLoadFromClasspath() {
        // test resources carry their own xgraph_config.json
        XGraphConfig config = XGraphConfig.load();
        assertTrue(config.visibility.showDataVars);
        assertFalse(config.visibility.showInheritedCoords);
        assertEquals(500, config.fit.maxIterations);
        assertEquals(2000, config.fit.maxEvaluations);
        // unspecified fields keep their defaults
        assertEquals(1e-10, config.fit.costRelativeTolerance, 1e-20);
        assertNull(config.dataFile);
    }

    @Test
    public void testMissingSectionsUseDefaults() throws Exception {
        XGraphConfig config = XGraphConfig.read(
                new ByteArrayInputStream("{\"visibility\": null}".getBytes(StandardCharsets.UTF_8)));
        assertTrue(config.visibility.showInheritedCoords);
        assertEquals(1000, config.fit.maxIterations);
    }
}
