/* (C)2026 */
package com.ammann.captionbox.exception;

import static org.assertj.core.api.Assertions.assertThat;

import com.ammann.captionbox.model.BoxRef;
import org.junit.jupiter.api.Test;

class ValidationExceptionTest {

    @Test
    void unknownResourceNamesTypeAndId() {
        ValidationException e = ValidationException.unknownResource("box", new BoxRef(3, 7));

        assertThat(e).hasMessage("Unknown box: 3-7");
        assertThat(e).isInstanceOf(ApiException.class);
    }

    @Test
    void invalidParameterDescribesExpectation() {
        ValidationException e = ValidationException.invalidParameter("threshold", 1.5, "a value in [0, 1]");

        assertThat(e).hasMessage("Invalid parameter 'threshold': got '1.5', expected a value in [0, 1]");
    }

    @Test
    void notPositiveDefiniteKeepsRow() {
        NotPositiveDefiniteException e = new NotPositiveDefiniteException(4, -0.25);

        assertThat(e.getRow()).isEqualTo(4);
        assertThat(e.getMessage()).contains("diagonal 4");
    }
}
