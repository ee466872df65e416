/* (C)2026 */
package com.ammann.captionbox.enumeration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.NullAndEmptySource;
import org.junit.jupiter.params.provider.ValueSource;

class BoxLabelTest {

    @ParameterizedTest
    @ValueSource(strings = {"in", "IN", " In "})
    void parsesInIgnoringCaseAndWhitespace(String value) {
        assertThat(BoxLabel.fromValue(value)).isEqualTo(BoxLabel.IN);
    }

    @Test
    void parsesOut() {
        assertThat(BoxLabel.fromValue("out")).isEqualTo(BoxLabel.OUT);
        assertThat(BoxLabel.OUT.getValue()).isEqualTo("out");
    }

    @ParameterizedTest
    @NullAndEmptySource
    @ValueSource(strings = {"inside", "0"})
    void rejectsUnknownValues(String value) {
        assertThatThrownBy(() -> BoxLabel.fromValue(value))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageStartingWith("Unknown box label");
    }
}
