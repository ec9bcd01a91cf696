package com.portfoliorisk.backend.service.optimization;

import com.portfoliorisk.backend.exception.NumericalInstabilityException;
import org.apache.commons.math3.linear.Array2DRowRealMatrix;
import org.apache.commons.math3.linear.ArrayRealVector;
import org.apache.commons.math3.linear.DecompositionSolver;
import org.apache.commons.math3.linear.LUDecomposition;
import org.apache.commons.math3.linear.MatrixUtils;
import org.apache.commons.math3.linear.RealMatrix;
import org.apache.commons.math3.linear.RealVector;
import org.apache.commons.math3.linear.SingularMatrixException;
import org.apache.commons.math3.linear.SingularValueDecomposition;

import java.util.Arrays;

/**
 * Linear algebra helpers for the allocation strategies.
 */
public final class MatrixOps {

    private MatrixOps() {}

    /**
     * Moore-Penrose pseudo-inverse. Singular values below {@code max(m, n) * s_max * ulp(1)}
     * are treated as zero.
     */
    public static RealMatrix pseudoInverse(RealMatrix matrix) {
        SingularValueDecomposition svd = new SingularValueDecomposition(matrix);
        double[] singular = svd.getSingularValues();
        double max = Arrays.stream(singular).max().orElse(0.0);
        double cutoff = Math.max(matrix.getRowDimension(), matrix.getColumnDimension()) * max * Math.ulp(1.0);

        RealMatrix u = svd.getU();
        RealMatrix v = svd.getV();
        RealMatrix inverseSigma = new Array2DRowRealMatrix(singular.length, singular.length);
        for (int i = 0; i < singular.length; i++) {
            if (singular[i] > cutoff) {
                inverseSigma.setEntry(i, i, 1.0 / singular[i]);
            }
        }
        RealMatrix result = v.multiply(inverseSigma).multiply(u.transpose());
        requireFinite(result.getData(), "pseudo-inverse");
        return result;
    }

    /** Solves {@code (A + epsilon * I) x = b} by LU decomposition. */
    public static double[] solveRegularized(RealMatrix matrix, double epsilon, double[] rhs) {
        int n = matrix.getRowDimension();
        RealMatrix regularized = matrix.add(MatrixUtils.createRealIdentityMatrix(n).scalarMultiply(epsilon));
        DecompositionSolver solver = new LUDecomposition(regularized).getSolver();
        if (!solver.isNonSingular()) {
            throw new NumericalInstabilityException("Regularized covariance matrix is singular");
        }
        try {
            double[] solution = solver.solve(new ArrayRealVector(rhs)).toArray();
            requireFinite(solution, "regularized solve");
            return solution;
        } catch (SingularMatrixException e) {
            throw new NumericalInstabilityException("Regularized covariance matrix is singular", e);
        }
    }

    public static double[] multiply(RealMatrix matrix, double[] vector) {
        RealVector result = matrix.operate(new ArrayRealVector(vector));
        return result.toArray();
    }

    public static double quadraticForm(RealMatrix matrix, double[] weights) {
        return new ArrayRealVector(weights).dotProduct(matrix.operate(new ArrayRealVector(weights)));
    }

    /**
     * Clips negatives to zero and rescales to sum 1. Falls back to equal weights when
     * nothing positive is left.
     */
    public static double[] clipAndNormalize(double[] raw) {
        double[] clipped = new double[raw.length];
        double sum = 0.0;
        for (int i = 0; i < raw.length; i++) {
            double value = Double.isFinite(raw[i]) ? Math.max(0.0, raw[i]) : 0.0;
            clipped[i] = value;
            sum += value;
        }
        if (sum <= 0) {
            return equalWeights(raw.length);
        }
        for (int i = 0; i < clipped.length; i++) {
            clipped[i] /= sum;
        }
        return clipped;
    }

    public static double[] equalWeights(int n) {
        double[] weights = new double[n];
        if (n > 0) {
            Arrays.fill(weights, 1.0 / n);
        }
        return weights;
    }

    private static void requireFinite(double[][] values, String operation) {
        for (double[] row : values) {
            requireFinite(row, operation);
        }
    }

    private static void requireFinite(double[] values, String operation) {
        for (double value : values) {
            if (!Double.isFinite(value)) {
                throw new NumericalInstabilityException("Non-finite result from " + operation);
            }
        }
    }
}
