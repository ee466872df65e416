/* (C)2026 */
package com.ammann.captionbox.model;

/**
 * Identifies one OCR box: the frame it was detected in and its index within that frame.
 */
public record BoxRef(int frameIndex, int boxIndex) {

    @Override
    public String toString() {
        return frameIndex + "-" + boxIndex;
    }
}
