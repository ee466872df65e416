/* (C)2026 */
package com.ammann.captionbox.exception;

/**
 * Cholesky decomposition met a non-positive diagonal term.
 *
 * <p>Raised by the linear algebra kernel and recovered internally through the
 * diagonal fallback inversion.
 */
public class NotPositiveDefiniteException extends ApiException {

    private final int row;

    public NotPositiveDefiniteException(int row, double diagonal) {
        super(String.format("Matrix not positive definite at diagonal %d (value=%.6g)", row, diagonal));
        this.row = row;
    }

    public int getRow() {
        return row;
    }
}
