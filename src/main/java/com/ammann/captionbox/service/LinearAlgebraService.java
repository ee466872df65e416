/* (C)2026 */
package com.ammann.captionbox.service;

import com.ammann.captionbox.enumeration.FeatureName;
import com.ammann.captionbox.exception.DimensionMismatchException;
import com.ammann.captionbox.exception.NotPositiveDefiniteException;
import com.ammann.captionbox.model.FeatureVector;
import com.ammann.captionbox.model.InversionResult;
import jakarta.enterprise.context.ApplicationScoped;
import org.jboss.logging.Logger;

/**
 * Dense matrix primitives on square matrices stored as flat row-major arrays of length n².
 *
 * <p>Provides:
 * <ul>
 *   <li>identity construction</li>
 *   <li>Cholesky decomposition (A = L·Lᵗ) for symmetric positive-definite matrices</li>
 *   <li>lower-triangular inversion by forward substitution</li>
 *   <li>symmetric inversion via Cholesky, with a diagonal fallback</li>
 *   <li>Mahalanobis distance between feature vectors</li>
 * </ul>
 *
 * <p>Exactly-zero pivots are replaced by 1.0 during triangular solves. This is an epsilon
 * guard against division by zero, not a regularization.
 */
@ApplicationScoped
public class LinearAlgebraService {

    private static final Logger LOG = Logger.getLogger(LinearAlgebraService.class);

    private static final double ZERO_PIVOT_SUBSTITUTE = 1.0;

    /**
     * Creates an n×n identity matrix.
     *
     * @param n matrix dimension
     * @return flattened identity matrix
     */
    public double[] identity(int n) {
        if (n < 0) {
            throw new IllegalArgumentException("Matrix dimension must not be negative: " + n);
        }
        double[] matrix = new double[n * n];
        for (int i = 0; i < n; i++) {
            matrix[i * n + i] = 1.0;
        }
        return matrix;
    }

    /**
     * Cholesky decomposition of a symmetric positive-definite matrix.
     *
     * @param a flattened row-major input matrix
     * @param n matrix dimension
     * @return lower-triangular factor L with A = L·Lᵗ
     * @throws NotPositiveDefiniteException if a computed diagonal term is not positive
     */
    public double[] cholesky(double[] a, int n) {
        requireSquare(a, n);
        double[] l = new double[n * n];

        for (int i = 0; i < n; i++) {
            for (int j = 0; j <= i; j++) {
                double sum = 0.0;

                if (j == i) {
                    for (int k = 0; k < j; k++) {
                        sum += l[j * n + k] * l[j * n + k];
                    }
                    double diagonal = a[j * n + j] - sum;
                    if (diagonal <= 0) {
                        throw new NotPositiveDefiniteException(j, diagonal);
                    }
                    l[j * n + j] = Math.sqrt(diagonal);
                } else {
                    for (int k = 0; k < j; k++) {
                        sum += l[i * n + k] * l[j * n + k];
                    }
                    l[i * n + j] = (a[i * n + j] - sum) / pivot(l[j * n + j]);
                }
            }
        }

        return l;
    }

    /**
     * Inverts a lower-triangular matrix by forward substitution.
     *
     * @param l flattened lower-triangular matrix
     * @param n matrix dimension
     * @return flattened lower-triangular inverse
     */
    public double[] invertLowerTriangular(double[] l, int n) {
        requireSquare(l, n);
        double[] inverse = new double[n * n];

        for (int i = 0; i < n; i++) {
            inverse[i * n + i] = 1.0 / pivot(l[i * n + i]);

            for (int j = i + 1; j < n; j++) {
                double sum = 0.0;
                for (int k = i; k < j; k++) {
                    sum += l[j * n + k] * inverse[k * n + i];
                }
                inverse[j * n + i] = -sum / pivot(l[j * n + j]);
            }
        }

        return inverse;
    }

    /**
     * Diagonal approximation of an inverse. Off-diagonal terms are dropped, positive
     * diagonal entries are inverted and all others become 1.0.
     *
     * @param matrix flattened square matrix
     * @param n      matrix dimension
     * @return flattened diagonal inverse
     */
    public double[] invertDiagonal(double[] matrix, int n) {
        requireSquare(matrix, n);
        double[] inverse = new double[n * n];
        for (int i = 0; i < n; i++) {
            double diagonal = matrix[i * n + i];
            inverse[i * n + i] = diagonal > 0 ? 1.0 / diagonal : 1.0;
        }
        return inverse;
    }

    /**
     * Inverts a symmetric matrix as A⁻¹ = L⁻ᵗ·L⁻¹.
     *
     * <p>Never fails for numerical reasons. If the matrix is not positive definite the
     * diagonal approximation is returned, tagged as degraded, and a warning is logged.
     *
     * @param matrix flattened symmetric matrix
     * @return exact or degraded inverse
     * @throws DimensionMismatchException if the array length is not a perfect square
     */
    public InversionResult invertSymmetric(double[] matrix) {
        int n = dimensionOf(matrix);

        try {
            double[] l = cholesky(matrix, n);
            double[] lInverse = invertLowerTriangular(l, n);

            double[] result = new double[n * n];
            for (int i = 0; i < n; i++) {
                for (int j = 0; j < n; j++) {
                    double sum = 0.0;
                    // L⁻¹ is lower triangular: rows above max(i, j) contribute zero
                    for (int k = Math.max(i, j); k < n; k++) {
                        sum += lInverse[k * n + i] * lInverse[k * n + j];
                    }
                    result[i * n + j] = sum;
                }
            }
            return InversionResult.exact(result);

        } catch (NotPositiveDefiniteException e) {
            LOG.warnf(
                    "Cholesky decomposition failed (%s); using diagonal approximation for %dx%d inverse",
                    e.getMessage(), n, n);
            return InversionResult.degraded(invertDiagonal(matrix, n), e.getMessage());
        }
    }

    /**
     * Mahalanobis distance sqrt(max(0, (x−y)ᵗ·Σ⁻¹·(x−y))).
     *
     * @param x                 first feature vector
     * @param y                 second feature vector
     * @param covarianceInverse flattened inverse covariance ({@code NUM_FEATURES²} values)
     * @return non-negative distance
     * @throws DimensionMismatchException if any size disagrees with the feature count
     */
    public double mahalanobis(FeatureVector x, FeatureVector y, double[] covarianceInverse) {
        int n = FeatureName.COUNT;
        if (x.size() != n) {
            throw DimensionMismatchException.of("features in x", n, x.size());
        }
        if (y.size() != n) {
            throw DimensionMismatchException.of("features in y", n, y.size());
        }
        if (covarianceInverse == null || covarianceInverse.length != n * n) {
            throw DimensionMismatchException.of(
                    "covariance values", n * n, covarianceInverse == null ? 0 : covarianceInverse.length);
        }

        double[] diff = new double[n];
        for (int i = 0; i < n; i++) {
            diff[i] = x.get(i) - y.get(i);
        }

        double total = 0.0;
        for (int i = 0; i < n; i++) {
            if (diff[i] == 0.0) {
                continue;
            }
            double rowSum = 0.0;
            for (int j = 0; j < n; j++) {
                rowSum += covarianceInverse[i * n + j] * diff[j];
            }
            total += diff[i] * rowSum;
        }

        return Math.sqrt(Math.max(0.0, total));
    }

    private static double pivot(double value) {
        return value != 0.0 ? value : ZERO_PIVOT_SUBSTITUTE;
    }

    private static void requireSquare(double[] matrix, int n) {
        if (matrix == null || matrix.length != n * n) {
            throw DimensionMismatchException.of(
                    "matrix values", n * n, matrix == null ? 0 : matrix.length);
        }
    }

    private static int dimensionOf(double[] matrix) {
        if (matrix == null) {
            throw new DimensionMismatchException("Matrix must not be null");
        }
        int n = (int) Math.round(Math.sqrt(matrix.length));
        if (n * n != matrix.length) {
            throw new DimensionMismatchException(
                    "Matrix length " + matrix.length + " is not a perfect square");
        }
        return n;
    }
}
