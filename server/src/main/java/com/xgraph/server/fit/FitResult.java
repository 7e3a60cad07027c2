package com.xgraph.server.fit;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Outcome of one fit. A non-converged fit still carries the best parameters the
 * optimizer reached; check {@link #isConverged()} before trusting it.
 */
public class FitResult {
    private final String model;
    private final List<String> parameterNames;
    private final double[] parameters;
    private final double[] standardErrors;
    private final double[] x;
    private final double[] fitted;
    private final double[] residuals;
    private final boolean converged;
    private final String message;
    private final int iterations;
    private final int evaluations;
    private final double rms;
    private final double chiSquare;
    private final ModelFunction function;

    FitResult(String model, List<String> parameterNames, double[] parameters, double[] standardErrors, double[] x,
            double[] fitted, double[] residuals, boolean converged, String message, int iterations, int evaluations,
            double rms, double chiSquare, ModelFunction function) {
        this.model = model;
        this.parameterNames = Collections.unmodifiableList(new ArrayList<>(parameterNames));
        this.parameters = parameters;
        this.standardErrors = standardErrors;
        this.x = x;
        this.fitted = fitted;
        this.residuals = residuals;
        this.converged = converged;
        this.message = message;
        this.iterations = iterations;
        this.evaluations = evaluations;
        this.rms = rms;
        this.chiSquare = chiSquare;
        this.function = function;
    }

    public String getModel() {
        return model;
    }

    public List<String> getParameterNames() {
        return parameterNames;
    }

    public double[] getParameters() {
        return parameters.clone();
    }

    /** NaN for fixed parameters and wherever the covariance could not be estimated. */
    public double[] getStandardErrors() {
        return standardErrors.clone();
    }

    public double parameter(String name) {
        return parameters[indexOf(name)];
    }

    public double standardError(String name) {
        return standardErrors[indexOf(name)];
    }

    public Map<String, Double> parameterMap() {
        Map<String, Double> map = new LinkedHashMap<>();
        for (int i = 0; i < parameters.length; i++) {
            map.put(parameterNames.get(i), parameters[i]);
        }
        return map;
    }

    /** x values of the points that took part in the fit. */
    public double[] getX() {
        return x.clone();
    }

    public double[] getFitted() {
        return fitted.clone();
    }

    /** observed - fitted, aligned with {@link #getX()}. */
    public double[] getResiduals() {
        return residuals.clone();
    }

    public boolean isConverged() {
        return converged;
    }

    public String getMessage() {
        return message;
    }

    /** Optimizer iterations; 0 when the fit stopped early or had nothing to optimize. */
    public int getIterations() {
        return iterations;
    }

    public int getEvaluations() {
        return evaluations;
    }

    public double getRms() {
        return rms;
    }

    public double getChiSquare() {
        return chiSquare;
    }

    /** Samples the fitted curve at arbitrary x, e.g. to draw it beyond the fit region. */
    public double evaluate(double atX) {
        return function.value(atX, parameters);
    }

    public double[] evaluate(double[] xs) {
        double[] out = new double[xs.length];
        for (int i = 0; i < xs.length; i++) {
            out[i] = function.value(xs[i], parameters);
        }
        return out;
    }

    private int indexOf(String name) {
        int i = parameterNames.indexOf(name);
        if (i < 0) {
            throw new IllegalArgumentException("No parameter " + name + " in model " + model);
        }
        return i;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("FitResult{").append(model);
        for (int i = 0; i < parameters.length; i++) {
            sb.append(", ").append(parameterNames.get(i)).append("=").append(String.format("%.6g", parameters[i]));
            if (!Double.isNaN(standardErrors[i])) {
                sb.append("±").append(String.format("%.2g", standardErrors[i]));
            }
        }
        sb.append(", n=").append(x.length);
        sb.append(", rms=").append(String.format("%.4g", rms));
        sb.append(", converged=").append(converged);
        return sb.append("}").toString();
    }
}
