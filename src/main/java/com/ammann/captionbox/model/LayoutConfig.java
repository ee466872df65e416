/* (C)2026 */
package com.ammann.captionbox.model;

/**
 * Video frame geometry used as the layout context for feature extraction.
 */
public record LayoutConfig(int frameWidth, int frameHeight) {

    public LayoutConfig {
        if (frameWidth <= 0 || frameHeight <= 0) {
            throw new IllegalArgumentException(
                    "Frame dimensions must be positive: " + frameWidth + "x" + frameHeight);
        }
    }
}
