package com.mathrok.engine.solver.numeric;

import com.mathrok.engine.config.NumericSettings;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.function.DoubleUnaryOperator;

/**
 * Finds real roots of a function on a closed interval.
 * <p>
 * The interval is sampled evenly. Each sign change between neighbouring samples is refined by
 * Newton-Raphson kept inside the bracket by bisection; samples where {@code |f|} has a local minimum
 * close to zero are polished by plain Newton to catch roots of even multiplicity. Candidates where
 * {@code |f|} is not small are discarded, which drops the sign changes across poles such as
 * {@code 1/x}. Non-finite samples ({@code NaN} outside the domain of {@code sqrt} or {@code log})
 * are skipped.
 */
public class NumericRootFinder {

    private static final double SNAP_EPSILON = 1e-9;

    private final NumericSettings settings;
    private final double acceptance;

    public NumericRootFinder(NumericSettings settings) {
        this.settings = settings;
        this.acceptance = Math.max(Math.sqrt(settings.tolerance()), 1e-6);
    }

    public List<Double> findRoots(DoubleUnaryOperator f) {
        return findRoots(f, settings.searchMin(), settings.searchMax());
    }

    /**
     * Roots in {@code [min, max]} in ascending order, duplicates merged.
     */
    public List<Double> findRoots(DoubleUnaryOperator f, double min, double max) {
        int samples = settings.samples();
        double step = (max - min) / samples;
        double[] xs = new double[samples + 1];
        double[] ys = new double[samples + 1];
        for (int i = 0; i <= samples; i++) {
            xs[i] = i == samples ? max : min + i * step;
            ys[i] = f.applyAsDouble(xs[i]);
        }

        List<Double> roots = new ArrayList<>();
        for (int i = 0; i <= samples; i++) {
            if (!Double.isFinite(ys[i])) {
                continue;
            }
            if (Math.abs(ys[i]) <= settings.tolerance()) {
                accept(f, xs[i], roots);
                continue;
            }
            if (i < samples && Double.isFinite(ys[i + 1]) && Math.signum(ys[i]) * Math.signum(ys[i + 1]) < 0) {
                accept(f, refine(f, xs[i], ys[i], xs[i + 1], ys[i + 1]), roots);
            } else if (isNearZeroMinimum(ys, i)) {
                polish(f, xs[i], min, max).ifPresent(root -> accept(f, root, roots));
            }
        }

        roots.sort(Double::compare);
        return roots;
    }

    /**
     * Newton-Raphson on {@code [a, b]} with {@code f(a)} and {@code f(b)} of opposite sign, falling back to
     * bisection whenever the Newton step leaves the bracket.
     */
    double refine(DoubleUnaryOperator f, double a, double fa, double b, double fb) {
        double x = (a + b) / 2;
        for (int iteration = 0; iteration < settings.maxIterations(); iteration++) {
            double fx = f.applyAsDouble(x);
            if (!Double.isFinite(fx) || Math.abs(fx) <= settings.tolerance()) {
                return x;
            }

            if (Math.signum(fx) == Math.signum(fa)) {
                a = x;
                fa = fx;
            } else {
                b = x;
            }
            if (b - a <= settings.tolerance() * Math.max(1, Math.abs(x))) {
                return (a + b) / 2;
            }

            double derivative = derivative(f, x);
            double next = x - fx / derivative;
            x = Double.isFinite(next) && next > a && next < b ? next : (a + b) / 2;
        }
        return x;
    }

    private Optional<Double> polish(DoubleUnaryOperator f, double start, double min, double max) {
        double x = start;
        for (int iteration = 0; iteration < settings.maxIterations(); iteration++) {
            double fx = f.applyAsDouble(x);
            if (!Double.isFinite(fx)) {
                return Optional.empty();
            }
            if (Math.abs(fx) <= settings.tolerance()) {
                break;
            }
            double derivative = derivative(f, x);
            if (derivative == 0 || !Double.isFinite(derivative)) {
                break;
            }
            x -= fx / derivative;
        }
        if (x < min || x > max || !Double.isFinite(x)) {
            return Optional.empty();
        }
        return Optional.of(x);
    }

    private boolean isNearZeroMinimum(double[] ys, int i) {
        if (i == 0 || i == ys.length - 1) {
            return false;
        }
        double here = Math.abs(ys[i]);
        return Double.isFinite(ys[i - 1]) && Double.isFinite(ys[i + 1])
                && here < Math.abs(ys[i - 1]) && here < Math.abs(ys[i + 1])
                && Math.signum(ys[i - 1]) == Math.signum(ys[i + 1])
                && here < 1e-2;
    }

    private void accept(DoubleUnaryOperator f, double candidate, List<Double> roots) {
        double root = snap(f, candidate);
        double value = f.applyAsDouble(root);
        if (!Double.isFinite(value) || Math.abs(value) > acceptance) {
            return;
        }
        for (double existing : roots) {
            if (Math.abs(existing - root) <= 1e-7 * Math.max(1, Math.abs(root))) {
                return;
            }
        }
        roots.add(root);
    }

    // prefer a nearby integer when it is at least as good a root
    private static double snap(DoubleUnaryOperator f, double x) {
        double nearest = Math.rint(x);
        if (Math.abs(x - nearest) < SNAP_EPSILON) {
            double atNearest = f.applyAsDouble(nearest);
            if (Double.isFinite(atNearest) && Math.abs(atNearest) <= Math.abs(f.applyAsDouble(x))) {
                return nearest == 0 ? 0 : nearest;
            }
        }
        return x == 0 ? 0 : x;
    }

    private static double derivative(DoubleUnaryOperator f, double x) {
        double h = 1e-7 * Math.max(1, Math.abs(x));
        return (f.applyAsDouble(x + h) - f.applyAsDouble(x - h)) / (2 * h);
    }
}
