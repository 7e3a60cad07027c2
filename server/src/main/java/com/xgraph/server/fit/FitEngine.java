package com.xgraph.server.fit;

import com.xgraph.server.data.slice.Slice;
import org.apache.commons.math3.exception.MathIllegalStateException;
import org.apache.commons.math3.exception.MaxCountExceededException;
import org.apache.commons.math3.fitting.leastsquares.LeastSquaresBuilder;
import org.apache.commons.math3.fitting.leastsquares.LeastSquaresOptimizer;
import org.apache.commons.math3.fitting.leastsquares.LeastSquaresProblem;
import org.apache.commons.math3.fitting.leastsquares.LevenbergMarquardtOptimizer;
import org.apache.commons.math3.fitting.leastsquares.MultivariateJacobianFunction;
import org.apache.commons.math3.fitting.leastsquares.ParameterValidator;
import org.apache.commons.math3.linear.Array2DRowRealMatrix;
import org.apache.commons.math3.linear.ArrayRealVector;
import org.apache.commons.math3.linear.DecompositionSolver;
import org.apache.commons.math3.linear.QRDecomposition;
import org.apache.commons.math3.linear.RealMatrix;
import org.apache.commons.math3.linear.RealVector;
import org.apache.commons.math3.util.Pair;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Nonlinear least-squares fitting of a registered model to a region of a slice, using
 * Levenberg-Marquardt. Holds no per-call state, so one engine can serve several worker
 * threads as long as the slices and specs passed in are not mutated.
 */
public class FitEngine {

    private static final Logger logger = LoggerFactory.getLogger(FitEngine.class);

    private final ModelRegistry registry;
    private final FitOptions options;

    public FitEngine(ModelRegistry registry) {
        this(registry, FitOptions.defaults());
    }

    public FitEngine(ModelRegistry registry, FitOptions options) {
        this.registry = registry;
        this.options = options.copy();
    }

    public ModelRegistry getRegistry() {
        return registry;
    }

    public FitResult fit(Slice slice, FitSpec spec) {
        RegisteredModel model = registry.get(spec.getModel())
                .orElseThrow(() -> new IllegalArgumentException("Unknown fit model: " + spec.getModel()));
        ParameterSpec[] params = alignParameters(model, spec);
        ModelFunction f = model.getFunction();

        // restrict to the region, dropping NaN pairs
        List<Integer> keep = new ArrayList<>();
        for (int i = 0; i < slice.size(); i++) {
            double xi = slice.x(i);
            double yi = slice.y(i);
            if (!Double.isNaN(xi) && !Double.isNaN(yi) && spec.contains(xi)) {
                keep.add(i);
            }
        }
        if (keep.isEmpty()) {
            throw new EmptyRegionException(spec.getXMin(), spec.getXMax());
        }
        final int n = keep.size();
        final double[] x = new double[n];
        final double[] y = new double[n];
        for (int k = 0; k < n; k++) {
            x[k] = slice.x(keep.get(k));
            y[k] = slice.y(keep.get(k));
        }

        final double[] full = new double[params.length];
        List<Integer> freeList = new ArrayList<>();
        for (int j = 0; j < params.length; j++) {
            full[j] = params[j].isFixed() ? params[j].getValue() : params[j].clip(params[j].getValue());
            if (!params[j].isFixed()) {
                freeList.add(j);
            }
        }
        final int[] free = freeList.stream().mapToInt(Integer::intValue).toArray();

        if (free.length == 0) {
            return buildResult(model, params, full, free, x, y, true, "All parameters fixed", 0, 1);
        }

        BestPointTracker tracker = new BestPointTracker(full, free, x, y, f);
        double[] start = new double[free.length];
        for (int k = 0; k < free.length; k++) {
            start[k] = full[free[k]];
        }

        ParameterValidator validator = point -> {
            double[] clipped = point.toArray();
            for (int k = 0; k < free.length; k++) {
                clipped[k] = params[free[k]].clip(clipped[k]);
            }
            return new ArrayRealVector(clipped, false);
        };

        LeastSquaresProblem problem = new LeastSquaresBuilder()
                .start(start)
                .model(tracker)
                .target(y)
                .parameterValidator(validator)
                .lazyEvaluation(false)
                .maxEvaluations(options.maxEvaluations)
                .maxIterations(options.maxIterations)
                .build();

        LevenbergMarquardtOptimizer optimizer = new LevenbergMarquardtOptimizer()
                .withCostRelativeTolerance(options.costRelativeTolerance)
                .withParameterRelativeTolerance(options.parameterRelativeTolerance)
                .withOrthoTolerance(options.orthoTolerance);

        double[] solution;
        boolean converged;
        String message;
        int iterations = 0;
        try {
            LeastSquaresOptimizer.Optimum optimum = optimizer.optimize(problem);
            solution = validator.validate(optimum.getPoint()).toArray();
            converged = true;
            message = "Converged";
            iterations = optimum.getIterations();
        } catch (MaxCountExceededException e) {
            solution = tracker.best();
            converged = false;
            message = "Limit reached: " + e.getMessage();
        } catch (MathIllegalStateException e) {
            solution = tracker.best();
            converged = false;
            message = "Numerical failure: " + e.getMessage();
        }

        double[] fittedParams = full.clone();
        for (int k = 0; k < free.length; k++) {
            fittedParams[free[k]] = solution[k];
        }
        FitResult result = buildResult(model, params, fittedParams, free, x, y, converged, message, iterations,
                tracker.evaluations());
        if (converged) {
            logger.debug("Fit {} over {} points: {}", model.getName(), n, result);
        } else {
            logger.debug("Fit {} did not converge ({}), returning best effort: {}", model.getName(), message, result);
        }
        return result;
    }

    private ParameterSpec[] alignParameters(RegisteredModel model, FitSpec spec) {
        List<String> names = model.parameterNames();
        Map<String, ParameterSpec> given = new HashMap<>();
        for (ParameterSpec p : spec.getParameters()) {
            if (!names.contains(p.getName())) {
                throw new IllegalArgumentException("Model " + model.getName() + " has no parameter " + p.getName()
                        + "; expected " + names);
            }
            given.put(p.getName(), p);
        }
        ParameterSpec[] aligned = new ParameterSpec[names.size()];
        for (int j = 0; j < aligned.length; j++) {
            aligned[j] = given.get(names.get(j));
            if (aligned[j] == null) {
                throw new IllegalArgumentException("Missing parameter " + names.get(j) + " for model "
                        + model.getName());
            }
        }
        return aligned;
    }

    private FitResult buildResult(RegisteredModel model, ParameterSpec[] params, double[] p, int[] free, double[] x,
            double[] y, boolean converged, String message, int iterations, int evaluations) {
        ModelFunction f = model.getFunction();
        int n = x.length;
        double[] fitted = new double[n];
        double[] residuals = new double[n];
        double ssr = 0;
        for (int i = 0; i < n; i++) {
            fitted[i] = f.value(x[i], p);
            residuals[i] = y[i] - fitted[i];
            ssr += residuals[i] * residuals[i];
        }
        double[] errors = standardErrors(f, p, free, x, ssr);
        return new FitResult(model.getName(), model.parameterNames(), p, errors, x, fitted, residuals, converged,
                message, iterations, evaluations, Math.sqrt(ssr / n), ssr, f);
    }

    /**
     * sqrt(diag((J^T J)^-1) * SSR / (n - k)) over the free parameters.
     */
    private double[] standardErrors(ModelFunction f, double[] p, int[] free, double[] x, double ssr) {
        double[] errors = new double[p.length];
        Arrays.fill(errors, Double.NaN);
        int n = x.length;
        int k = free.length;
        if (k == 0 || n <= k || !Double.isFinite(ssr)) {
            return errors;
        }
        RealMatrix jacobian = new Array2DRowRealMatrix(n, k);
        for (int i = 0; i < n; i++) {
            double[] grad = f.gradient(x[i], p);
            for (int c = 0; c < k; c++) {
                jacobian.setEntry(i, c, grad[free[c]]);
            }
        }
        RealMatrix jtj = jacobian.transpose().multiply(jacobian);
        DecompositionSolver solver = new QRDecomposition(jtj, options.singularityThreshold).getSolver();
        if (!solver.isNonSingular()) {
            return errors;
        }
        RealMatrix covariance = solver.getInverse().scalarMultiply(ssr / (n - k));
        for (int c = 0; c < k; c++) {
            double var = covariance.getEntry(c, c);
            errors[free[c]] = var >= 0 ? Math.sqrt(var) : Double.NaN;
        }
        return errors;
    }

    /**
     * Model wrapper that evaluates the free parameters and remembers the lowest-cost
     * point seen, so a fit that hits a limit can still report where it got to.
     */
    private static final class BestPointTracker implements MultivariateJacobianFunction {
        private final double[] full;
        private final int[] free;
        private final double[] x;
        private final double[] y;
        private final ModelFunction f;
        private double[] best;
        private double bestCost = Double.POSITIVE_INFINITY;
        private int evaluations = 0;

        BestPointTracker(double[] full, int[] free, double[] x, double[] y, ModelFunction f) {
            this.full = full.clone();
            this.free = free;
            this.x = x;
            this.y = y;
            this.f = f;
            this.best = new double[free.length];
            for (int k = 0; k < free.length; k++) {
                best[k] = full[free[k]];
            }
        }

        @Override
        public Pair<RealVector, RealMatrix> value(RealVector point) {
            evaluations++;
            double[] p = full.clone();
            for (int k = 0; k < free.length; k++) {
                p[free[k]] = point.getEntry(k);
            }
            int n = x.length;
            RealVector value = new ArrayRealVector(n);
            RealMatrix jacobian = new Array2DRowRealMatrix(n, free.length);
            double cost = 0;
            for (int i = 0; i < n; i++) {
                double fi = f.value(x[i], p);
                value.setEntry(i, fi);
                cost += (y[i] - fi) * (y[i] - fi);
                double[] grad = f.gradient(x[i], p);
                for (int k = 0; k < free.length; k++) {
                    jacobian.setEntry(i, k, grad[free[k]]);
                }
            }
            if (Double.isFinite(cost) && cost < bestCost) {
                bestCost = cost;
                best = point.toArray();
            }
            return new Pair<>(value, jacobian);
        }

        double[] best() {
            return best.clone();
        }

        int evaluations() {
            return evaluations;
        }
    }
}
