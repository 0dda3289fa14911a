package com.demo.churn.service.model;

import com.demo.churn.service.error.TrainingException;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.math3.linear.Array2DRowRealMatrix;
import org.apache.commons.math3.linear.ArrayRealVector;
import org.apache.commons.math3.linear.CholeskyDecomposition;
import org.apache.commons.math3.linear.LUDecomposition;
import org.apache.commons.math3.linear.NonPositiveDefiniteMatrixException;
import org.apache.commons.math3.linear.RealMatrix;
import org.apache.commons.math3.linear.RealVector;
import org.apache.commons.math3.linear.SingularMatrixException;

/**
 * L2-regularized, sample-weighted logistic regression solved with damped Newton steps.
 * The intercept is not penalized. Fully deterministic for a given input.
 */
@Slf4j
final class LogisticRegressionSolver {

    private static final double INTERCEPT_RIDGE = 1e-10;

    private final double c;
    private final int maxIterations;
    private final double tolerance;

    LogisticRegressionSolver(double c, int maxIterations, double tolerance) {
        this.c = c;
        this.maxIterations = maxIterations;
        this.tolerance = tolerance;
    }

    /** @return coefficients followed by the intercept in the last slot */
    double[] fit(double[][] x, int[] y, double[] sampleWeights) {
        int n = x.length;
        int p = n == 0 ? 0 : x[0].length;
        double[] theta = new double[p + 1];

        double loss = objective(x, y, sampleWeights, theta);
        int iter = 0;
        for (; iter < maxIterations; iter++) {
            double[] grad = new double[p + 1];
            double[][] hess = new double[p + 1][p + 1];
            accumulate(x, y, sampleWeights, theta, grad, hess);

            if (maxAbs(grad) <= tolerance) break;

            double[] step = solve(hess, grad);
            double t = 1.0;
            double[] next = new double[p + 1];
            double nextLoss;
            do {
                for (int k = 0; k <= p; k++) next[k] = theta[k] - t * step[k];
                nextLoss = objective(x, y, sampleWeights, next);
                t *= 0.5;
            } while (nextLoss > loss && t > 1e-10);

            if (nextLoss > loss) break;
            theta = next.clone();
            if (Math.abs(loss - nextLoss) <= 1e-12 * Math.max(1.0, Math.abs(loss))) {
                loss = nextLoss;
                break;
            }
            loss = nextLoss;
        }
        if (iter >= maxIterations) {
            log.warn("Logistic regression hit the iteration cap ({}) before converging", maxIterations);
        }
        for (double v : theta) {
            if (!Double.isFinite(v)) {
                throw new TrainingException("Logistic regression produced non-finite weights");
            }
        }
        log.debug("Logistic regression finished after {} iterations, objective={}", iter, loss);
        return theta;
    }

    private void accumulate(double[][] x, int[] y, double[] w, double[] theta, double[] grad, double[][] hess) {
        int p = theta.length - 1;
        for (int k = 0; k < p; k++) {
            grad[k] = theta[k];
            hess[k][k] = 1.0;
        }
        hess[p][p] = INTERCEPT_RIDGE;
        for (int i = 0; i < x.length; i++) {
            double prob = FittedPipeline.sigmoid(linear(x[i], theta));
            double r = c * w[i] * (prob - y[i]);
            double h = c * w[i] * prob * (1.0 - prob);
            for (int a = 0; a <= p; a++) {
                double xa = a == p ? 1.0 : x[i][a];
                grad[a] += r * xa;
                if (h == 0.0) continue;
                for (int b = a; b <= p; b++) {
                    double xb = b == p ? 1.0 : x[i][b];
                    hess[a][b] += h * xa * xb;
                }
            }
        }
        for (int a = 0; a <= p; a++) {
            for (int b = 0; b < a; b++) hess[a][b] = hess[b][a];
        }
    }

    private double objective(double[][] x, int[] y, double[] w, double[] theta) {
        double penalty = 0.0;
        for (int k = 0; k < theta.length - 1; k++) penalty += theta[k] * theta[k];
        double sum = 0.0;
        for (int i = 0; i < x.length; i++) {
            double z = linear(x[i], theta);
            sum += w[i] * (softplus(z) - y[i] * z);
        }
        return 0.5 * penalty + c * sum;
    }

    private static double[] solve(double[][] hess, double[] grad) {
        RealMatrix h = new Array2DRowRealMatrix(hess, false);
        RealVector g = new ArrayRealVector(grad, false);
        try {
            return new CholeskyDecomposition(h).getSolver().solve(g).toArray();
        } catch (NonPositiveDefiniteMatrixException e) {
            try {
                return new LUDecomposition(h).getSolver().solve(g).toArray();
            } catch (SingularMatrixException se) {
                throw new TrainingException("Newton system is singular", se);
            }
        }
    }

    private static double linear(double[] xi, double[] theta) {
        int p = theta.length - 1;
        double s = theta[p];
        for (int k = 0; k < p; k++) s += theta[k] * xi[k];
        return s;
    }

    private static double softplus(double z) {
        return z > 0 ? z + Math.log1p(Math.exp(-z)) : Math.log1p(Math.exp(z));
    }

    private static double maxAbs(double[] v) {
        double m = 0.0;
        for (double d : v) m = Math.max(m, Math.abs(d));
        return m;
    }
}
