/* (C)2026 */
package com.ammann.captionbox.service;

import com.ammann.captionbox.model.RescoreOutcome;
import com.ammann.captionbox.model.ScoredCandidate;
import java.util.List;

/**
 * Re-scores a batch of boxes with the current model and persists the new predictions.
 *
 * <p>May block on I/O. One outcome is returned per candidate, in candidate order.
 */
@FunctionalInterface
public interface BatchPredictor {

    List<RescoreOutcome> predictAndUpdate(List<ScoredCandidate> batch);
}
