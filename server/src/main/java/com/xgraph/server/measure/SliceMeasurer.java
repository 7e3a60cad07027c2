package com.xgraph.server.measure;

import com.xgraph.server.data.slice.Slice;
import com.xgraph.server.fit.EmptyRegionException;
import org.apache.commons.math3.stat.StatUtils;
import org.apache.commons.math3.stat.descriptive.rank.Median;

import java.util.ArrayList;
import java.util.List;

/**
 * Summary measurements of the y values of a slice within an x-range. NaN samples are
 * ignored.
 */
public class SliceMeasurer {

    public Measurement measure(Slice slice, MeasureType type, double xMin, double xMax) {
        return measure(slice, type, xMin, xMax, 0);
    }

    /**
     * @param plusMinusSamples for MIN and MAX, report the mean of the samples within this
     *                         many positions of the extremum instead of the extremum itself
     */
    public Measurement measure(Slice slice, MeasureType type, double xMin, double xMax, int plusMinusSamples) {
        List<Integer> keep = new ArrayList<>();
        for (int i = 0; i < slice.size(); i++) {
            double xi = slice.x(i);
            if (xi >= xMin && xi <= xMax && !Double.isNaN(slice.y(i))) {
                keep.add(i);
            }
        }
        if (keep.isEmpty()) {
            throw new EmptyRegionException(xMin, xMax);
        }
        int n = keep.size();
        double[] x = new double[n];
        double[] y = new double[n];
        for (int k = 0; k < n; k++) {
            x[k] = slice.x(keep.get(k));
            y[k] = slice.y(keep.get(k));
        }
        String units = slice.getYUnits();

        switch (type) {
            case MEAN:
                return new Measurement(type, Double.NaN, StatUtils.mean(y), n, units);
            case MEDIAN:
                return new Measurement(type, Double.NaN, new Median().evaluate(y), n, units);
            case MIN:
            case MAX: {
                int best = 0;
                for (int k = 1; k < n; k++) {
                    if (type == MeasureType.MIN ? y[k] < y[best] : y[k] > y[best]) {
                        best = k;
                    }
                }
                double value = y[best];
                if (plusMinusSamples > 0) {
                    int from = Math.max(0, best - plusMinusSamples);
                    int to = Math.min(best + plusMinusSamples + 1, n);
                    value = StatUtils.mean(y, from, to - from);
                }
                return new Measurement(type, x[best], value, n, units);
            }
            case STD:
                return new Measurement(type, Double.NaN, Math.sqrt(StatUtils.populationVariance(y)), n, units);
            case VARIANCE:
                return new Measurement(type, Double.NaN, StatUtils.populationVariance(y), n,
                        units != null ? "(" + units + ")^2" : null);
            default:
                throw new IllegalArgumentException("Unsupported measurement " + type);
        }
    }
}
