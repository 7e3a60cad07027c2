package com.xgraph.server.fit;

import com.xgraph.server.data.slice.Slice;
import org.apache.commons.math3.exception.ConvergenceException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Random;

import static org.junit.jupiter.api.Assertions.*;

public class FitEngineTest {

    private ModelRegistry registry;
    private FitEngine engine;
    private double[] x;
    private double[] y;

    @BeforeEach
    public void setUp() {
        registry = ModelRegistry.withBuiltins();
        engine = new FitEngine(registry);
        // 2*exp(-x/0.5) + 0.1 plus small gaussian noise
        Random rnd = new Random(42);
        x = new double[100];
        y = new double[100];
        for (int i = 0; i < 100; i++) {
            x[i] = 0.01 * i;
            y[i] = 2 * Math.exp(-x[i] / 0.5) + 0.1 + 2e-4 * rnd.nextGaussian();
        }
    }

    private FitSpec exponentialSpec() {
        return new FitSpec(BuiltinModels.EXPONENTIAL,
                List.of(new ParameterSpec("a", 1), new ParameterSpec("b", 1), new ParameterSpec("c", 0)), 0.0, 0.4);
    }

    @Test
    public void testExponentialRecoversGenerators() {
        FitResult result = engine.fit(new Slice(x, y, "s", "pA", null), exponentialSpec());
        assertTrue(result.isConverged(), result.getMessage());
        assertEquals(2.0, result.parameter("a"), 0.2);
        assertEquals(0.5, result.parameter("b"), 0.05);
        assertEquals(0.1, result.parameter("c"), 0.01);

        // only the 41 points in [0, 0.4] were used
        assertEquals(41, result.getX().length);
        assertEquals(41, result.getFitted().length);
        for (int i = 0; i < 41; i++) {
            assertEquals(y[i] - result.getFitted()[i], result.getResiduals()[i], 1e-12);
        }
        for (double se : result.getStandardErrors()) {
            assertTrue(Double.isFinite(se) && se >= 0);
        }
        assertTrue(result.getRms() < 1e-3);
    }

    @Test
    public void testFitIsIdempotent() {
        Slice slice = new Slice(x, y, "s", "pA", null);
        FitResult first = engine.fit(slice, exponentialSpec());
        FitResult second = engine.fit(slice, exponentialSpec());
        assertArrayEquals(first.getParameters(), second.getParameters(), 1e-12);
        assertArrayEquals(first.getStandardErrors(), second.getStandardErrors(), 1e-12);
    }

    @Test
    public void testPointsOutsideRegionHaveNoInfluence() {
        FitResult baseline = engine.fit(new Slice(x, y, "s", "pA", null), exponentialSpec());

        double[] perturbed = y.clone();
        for (int i = 41; i < perturbed.length; i++) {
            perturbed[i] += 50.0 * (i % 2 == 0 ? 1 : -1);
        }
        FitResult other = engine.fit(new Slice(x, perturbed, "s", "pA", null), exponentialSpec());
        assertArrayEquals(baseline.getParameters(), other.getParameters(), 0.0);
    }

    @Test
    public void testNaNPointsAreDropped() {
        double[] withGaps = y.clone();
        withGaps[3] = Double.NaN;
        withGaps[10] = Double.NaN;
        FitResult result = engine.fit(new Slice(x, withGaps, "s", "pA", null), exponentialSpec());
        assertEquals(39, result.getX().length);
        assertTrue(result.isConverged());
        assertEquals(0.5, result.parameter("b"), 0.05);
    }

    @Test
    public void testFixedParameterHasNoStandardError() {
        FitSpec spec = exponentialSpec().withParameter(ParameterSpec.fixed("c", 0.1));
        FitResult result = engine.fit(new Slice(x, y, "s", "pA", null), spec);
        assertTrue(result.isConverged());
        assertEquals(0.1, result.parameter("c"), 0.0);
        assertTrue(Double.isNaN(result.standardError("c")));
        assertFalse(Double.isNaN(result.standardError("a")));
        assertFalse(Double.isNaN(result.standardError("b")));
    }

    @Test
    public void testBoundsAreHonored() {
        FitSpec spec = exponentialSpec().withParameter(ParameterSpec.bounded("a", 1, 0, 1.5));
        FitResult result = engine.fit(new Slice(x, y, "s", "pA", null), spec);
        assertTrue(result.parameter("a") <= 1.5);
    }

    @Test
    public void testEvaluationLimitGivesBestEffortResult() {
        FitEngine limited = new FitEngine(registry, FitOptions.defaults().withMaxEvaluations(2));
        FitResult result = limited.fit(new Slice(x, y, "s", "pA", null), exponentialSpec());
        assertFalse(result.isConverged());
        assertEquals(3, result.getParameters().length);
        assertEquals(41, result.getResiduals().length);
        for (double p : result.getParameters()) {
            assertTrue(Double.isFinite(p));
        }
    }

    @Test
    public void testAllParametersFixed() {
        FitSpec spec = new FitSpec(BuiltinModels.LINEAR,
                List.of(ParameterSpec.fixed("m", 2), ParameterSpec.fixed("b", 1)), 0, 1);
        FitResult result = engine.fit(new Slice(new double[] { 0, 1 }, new double[] { 1, 3 }, null, null, null), spec);
        assertTrue(result.isConverged());
        assertArrayEquals(new double[] { 0, 0 }, result.getResiduals(), 1e-12);
        assertTrue(Double.isNaN(result.standardError("m")));
    }

    @Test
    public void testLinearExact() {
        double[] lx = { 0, 1, 2, 3, 4 };
        double[] ly = { 1, 3, 5, 7, 9 };
        FitSpec spec = FitSpec.fromDefaults(registry, BuiltinModels.LINEAR, Double.NEGATIVE_INFINITY,
                Double.POSITIVE_INFINITY);
        FitResult result = engine.fit(new Slice(lx, ly, null, null, null), spec);
        assertEquals(2.0, result.parameter("m"), 1e-8);
        assertEquals(1.0, result.parameter("b"), 1e-8);
        assertEquals(11.0, result.evaluate(5.0), 1e-7);
    }

    @Test
    public void testGaussianFromDefaults() {
        double[] gx = new double[81];
        double[] gy = new double[81];
        for (int i = 0; i < gx.length; i++) {
            gx[i] = -4 + 0.1 * i;
            gy[i] = 3 * Math.exp(-Math.pow(gx[i] - 0.5, 2) / (2 * 0.8 * 0.8));
        }
        FitSpec spec = FitSpec.fromDefaults(registry, BuiltinModels.GAUSSIAN, -4, 4);
        FitResult result = engine.fit(new Slice(gx, gy, null, null, null), spec);
        assertTrue(result.isConverged());
        assertEquals(3.0, result.parameter("a"), 1e-4);
        assertEquals(0.5, result.parameter("b"), 1e-4);
        assertEquals(0.8, result.parameter("c"), 1e-4);
    }

    @Test
    public void testEmptyRegion() {
        FitSpec spec = exponentialSpec().withRange(5, 6);
        assertThrows(EmptyRegionException.class, () -> engine.fit(new Slice(x, y, "s", "pA", null), spec));
    }

    @Test
    public void testUnknownModelAndParameters() {
        Slice slice = new Slice(x, y, "s", "pA", null);
        assertThrows(IllegalArgumentException.class,
                () -> engine.fit(slice, new FitSpec("sigmoid", List.of(), 0, 1)));
        assertThrows(IllegalArgumentException.class,
                () -> engine.fit(slice, new FitSpec(BuiltinModels.EXPONENTIAL, List.of(new ParameterSpec("a", 1)), 0, 1)));
        assertThrows(IllegalArgumentException.class,
                () -> FitSpec.fromDefaults(registry, "sigmoid", 0, 1));
    }

    @Test
    public void testRegisterCustomModel() {
        registry.register("offset", "c", (xv, p) -> p[0], List.of(new ParameterSpec("c", 0)));
        FitResult result = engine.fit(new Slice(new double[] { 0, 1, 2 }, new double[] { 4, 5, 6 }, null, null, null),
                FitSpec.fromDefaults(registry, "offset", 0, 2));
        assertEquals(5.0, result.parameter("c"), 1e-6);
    }

    @Test
    public void testNumericalFailureGivesBestEffortResult() {
        // the model breaks down once the offset leaves [-2, 2]; the first full step jumps to 5
        registry.register("guarded", "c", (xv, p) -> {
            if (Math.abs(p[0]) > 2) {
                throw new ConvergenceException();
            }
            return p[0];
        }, List.of(new ParameterSpec("c", 0)));
        FitResult result = engine.fit(new Slice(new double[] { 0, 1, 2 }, new double[] { 4, 5, 6 }, null, null, null),
                FitSpec.fromDefaults(registry, "guarded", 0, 2));

        assertFalse(result.isConverged());
        assertTrue(result.getMessage().startsWith("Numerical failure"), result.getMessage());
        assertEquals(0, result.getIterations());
        assertEquals(1, result.getParameters().length);
        assertEquals(0.0, result.parameter("c"), 1e-12);
        assertArrayEquals(new double[] { 4, 5, 6 }, result.getResiduals(), 1e-12);
        assertTrue(result.getEvaluations() >= 2);
    }
}
