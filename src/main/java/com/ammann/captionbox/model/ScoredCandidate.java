/* (C)2026 */
package com.ammann.captionbox.model;

/**
 * A box paired with the estimated probability that its prediction will flip.
 */
public record ScoredCandidate(BoxWithPrediction box, double changeProbability) {}
