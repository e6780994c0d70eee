package com.driftwatch.service.window;

import com.driftwatch.domain.WindowPolicyType;
import com.driftwatch.domain.WindowRange;

import java.util.Optional;

/**
 * Decides where the baseline and monitor windows of one record kind should sit given
 * the latest stored row id. Implementations are pure; persistence is the caller's job.
 */
public interface WindowPolicy {

    WindowPolicyType type();

    /**
     * Desired baseline, or empty while too few rows exist.
     *
     * @param current the stored baseline, or null if none exists yet
     */
    Optional<WindowRange> baseline(WindowRange current, long latestRowId, int baselineBatchSize);

    /**
     * Desired monitor window for the given baseline, or empty when none should exist.
     *
     * @param current       the stored monitor window, or null
     * @param baselineMoved whether the baseline was created or moved in this pass
     */
    Optional<WindowRange> monitor(WindowRange baseline, WindowRange current, boolean baselineMoved,
                                  long latestRowId, int monitorBatchSize);
}
