package com.xgraph.server.fit;

public class FitOptions {
    public int maxIterations = 1000;
    public int maxEvaluations = 5000;
    public double costRelativeTolerance = 1e-10;
    public double parameterRelativeTolerance = 1e-10;
    public double orthoTolerance = 1e-10;
    // below this pivot, J^T J is treated as singular when estimating errors
    public double singularityThreshold = 1e-14;

    public FitOptions() {
    }

    public static FitOptions defaults() {
        return new FitOptions();
    }

    public FitOptions copy() {
        FitOptions o = new FitOptions();
        o.maxIterations = maxIterations;
        o.maxEvaluations = maxEvaluations;
        o.costRelativeTolerance = costRelativeTolerance;
        o.parameterRelativeTolerance = parameterRelativeTolerance;
        o.orthoTolerance = orthoTolerance;
        o.singularityThreshold = singularityThreshold;
        return o;
    }

    public FitOptions withMaxEvaluations(int max) {
        FitOptions o = copy();
        o.maxEvaluations = max;
        return o;
    }

    public FitOptions withMaxIterations(int max) {
        FitOptions o = copy();
        o.maxIterations = max;
        return o;
    }
}
