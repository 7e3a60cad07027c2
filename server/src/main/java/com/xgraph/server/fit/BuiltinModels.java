package com.xgraph.server.fit;

import java.util.List;

/**
 * Models available without any application setup. Defaults for the Gaussian and Hill
 * equation follow the parameter hints of the curve-fit panel.
 */
public final class BuiltinModels {

    public static final String LINEAR = "linear";
    public static final String QUADRATIC = "quadratic";
    public static final String EXPONENTIAL = "exponential";
    public static final String DOUBLE_EXPONENTIAL = "double_exponential";
    public static final String GAUSSIAN = "gaussian";
    public static final String HILL = "hill";

    private static final double INF = Double.POSITIVE_INFINITY;

    private BuiltinModels() {
    }

    public static void registerAll(ModelRegistry registry) {
        registry.register(LINEAR, "m*x + b", linear(),
                List.of(new ParameterSpec("m", 1), new ParameterSpec("b", 0)));
        registry.register(QUADRATIC, "a*x^2 + b*x + c", quadratic(),
                List.of(new ParameterSpec("a", 1), new ParameterSpec("b", 0), new ParameterSpec("c", 0)));
        registry.register(EXPONENTIAL, "a*exp(-x/b) + c", exponential(),
                List.of(new ParameterSpec("a", 1), new ParameterSpec("b", 1), new ParameterSpec("c", 0)));
        registry.register(DOUBLE_EXPONENTIAL, "a1*exp(-x/b1) + a2*exp(-x/b2) + c", doubleExponential(),
                List.of(new ParameterSpec("a1", 1), new ParameterSpec("b1", 1), new ParameterSpec("a2", 1),
                        new ParameterSpec("b2", 10), new ParameterSpec("c", 0)));
        registry.register(GAUSSIAN, "a*exp(-(x-b)^2/(2*c^2))", gaussian(),
                List.of(ParameterSpec.bounded("a", 1, 0, INF), new ParameterSpec("b", 0),
                        ParameterSpec.bounded("c", 1, 0, INF)));
        registry.register(HILL, "Y0 + Y1/(1 + (EC50/x)^n)", hill(),
                List.of(ParameterSpec.fixed("Y0", 0), new ParameterSpec("Y1", 1),
                        ParameterSpec.bounded("EC50", 1, 1e-15, INF), ParameterSpec.bounded("n", 1, 1e-2, 10)));
    }

    static ModelFunction linear() {
        return new ModelFunction() {
            @Override
            public double value(double x, double[] p) {
                return p[0] * x + p[1];
            }

            @Override
            public double[] gradient(double x, double[] p) {
                return new double[] { x, 1 };
            }
        };
    }

    static ModelFunction quadratic() {
        return new ModelFunction() {
            @Override
            public double value(double x, double[] p) {
                return (p[0] * x + p[1]) * x + p[2];
            }

            @Override
            public double[] gradient(double x, double[] p) {
                return new double[] { x * x, x, 1 };
            }
        };
    }

    static ModelFunction exponential() {
        return new ModelFunction() {
            @Override
            public double value(double x, double[] p) {
                return p[0] * Math.exp(-x / p[1]) + p[2];
            }

            @Override
            public double[] gradient(double x, double[] p) {
                double e = Math.exp(-x / p[1]);
                return new double[] { e, p[0] * e * x / (p[1] * p[1]), 1 };
            }
        };
    }

    static ModelFunction doubleExponential() {
        return new ModelFunction() {
            @Override
            public double value(double x, double[] p) {
                return p[0] * Math.exp(-x / p[1]) + p[2] * Math.exp(-x / p[3]) + p[4];
            }

            @Override
            public double[] gradient(double x, double[] p) {
                double e1 = Math.exp(-x / p[1]);
                double e2 = Math.exp(-x / p[3]);
                return new double[] { e1, p[0] * e1 * x / (p[1] * p[1]), e2, p[2] * e2 * x / (p[3] * p[3]), 1 };
            }
        };
    }

    static ModelFunction gaussian() {
        return new ModelFunction() {
            @Override
            public double value(double x, double[] p) {
                double d = x - p[1];
                return p[0] * Math.exp(-d * d / (2 * p[2] * p[2]));
            }

            @Override
            public double[] gradient(double x, double[] p) {
                double d = x - p[1];
                double c2 = p[2] * p[2];
                double g = Math.exp(-d * d / (2 * c2));
                return new double[] { g, p[0] * g * d / c2, p[0] * g * d * d / (c2 * p[2]) };
            }
        };
    }

    // finite-difference gradient
    static ModelFunction hill() {
        return (x, p) -> p[0] + p[1] / (1 + Math.pow(p[2] / x, p[3]));
    }
}
