/* (C)2026 */
package com.ammann.captionbox.model;

import com.ammann.captionbox.enumeration.BoxLabel;

/**
 * Result of re-scoring one box: its label before and after, and whether it reversed.
 */
public record RescoreOutcome(
        BoxWithPrediction box, BoxLabel oldLabel, BoxLabel newLabel, boolean reversed) {

    public static RescoreOutcome of(BoxWithPrediction box, BoxLabel oldLabel, BoxLabel newLabel) {
        return new RescoreOutcome(box, oldLabel, newLabel, oldLabel != newLabel);
    }
}
