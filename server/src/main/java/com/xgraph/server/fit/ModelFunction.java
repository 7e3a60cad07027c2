package com.xgraph.server.fit;

/**
 * A pure model {@code y = f(x, p)}. Implementations without an analytic gradient get a
 * central finite-difference one.
 */
@FunctionalInterface
public interface ModelFunction {

    double value(double x, double[] params);

    /** Partial derivatives of f with respect to each parameter at x. */
    default double[] gradient(double x, double[] params) {
        double[] grad = new double[params.length];
        double[] p = params.clone();
        for (int j = 0; j < p.length; j++) {
            double h = 1e-6 * Math.max(1.0, Math.abs(params[j]));
            p[j] = params[j] + h;
            double up = value(x, p);
            p[j] = params[j] - h;
            double down = value(x, p);
            p[j] = params[j];
            grad[j] = (up - down) / (2 * h);
        }
        return grad;
    }
}
