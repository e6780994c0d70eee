package com.driftwatch.service.window;

import com.driftwatch.domain.WindowPolicyType;
import com.driftwatch.domain.WindowRange;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * Baseline is the latest complete batch and jumps forward once a full new batch has
 * arrived past it. The monitor window covers the most recent rows after the baseline.
 */
@Component
public class SlidingWindowPolicy implements WindowPolicy {

    @Override
    public WindowPolicyType type() {
        return WindowPolicyType.SLIDING;
    }

    @Override
    public Optional<WindowRange> baseline(WindowRange current, long latestRowId, int baselineBatchSize) {
        boolean due = current == null
            ? latestRowId >= baselineBatchSize
            : latestRowId >= current.endRow() + baselineBatchSize;
        if (due) {
            return Optional.of(new WindowRange(latestRowId - baselineBatchSize + 1, latestRowId));
        }
        return Optional.ofNullable(current);
    }

    @Override
    public Optional<WindowRange> monitor(WindowRange baseline, WindowRange current, boolean baselineMoved,
                                         long latestRowId, int monitorBatchSize) {
        if (latestRowId <= baseline.endRow()) {
            return Optional.empty();
        }
        long start = Math.max(baseline.endRow() + 1, latestRowId - monitorBatchSize + 1);
        return Optional.of(new WindowRange(start, latestRowId));
    }
}
