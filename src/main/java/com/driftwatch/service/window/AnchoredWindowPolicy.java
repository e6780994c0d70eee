package com.driftwatch.service.window;

import com.driftwatch.domain.WindowPolicyType;
import com.driftwatch.domain.WindowRange;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * Baseline anchored at row 1 that grows one batch at a time. The monitor window is
 * the batch right after the baseline and is reset whenever the baseline grows.
 */
@Component
public class AnchoredWindowPolicy implements WindowPolicy {

    @Override
    public WindowPolicyType type() {
        return WindowPolicyType.ANCHORED;
    }

    @Override
    public Optional<WindowRange> baseline(WindowRange current, long latestRowId, int baselineBatchSize) {
        if (current == null) {
            return latestRowId >= baselineBatchSize
                ? Optional.of(new WindowRange(1, baselineBatchSize))
                : Optional.empty();
        }
        if (latestRowId >= current.endRow() + baselineBatchSize) {
            return Optional.of(new WindowRange(current.startRow(), current.endRow() + baselineBatchSize));
        }
        return Optional.of(current);
    }

    @Override
    public Optional<WindowRange> monitor(WindowRange baseline, WindowRange current, boolean baselineMoved,
                                         long latestRowId, int monitorBatchSize) {
        if (current == null || baselineMoved || current.startRow() <= baseline.endRow()) {
            return Optional.of(new WindowRange(baseline.endRow() + 1, baseline.endRow() + monitorBatchSize));
        }
        return Optional.of(current);
    }
}
