package com.driftwatch.service.window;

import com.driftwatch.domain.WindowPolicyType;
import com.driftwatch.domain.WindowRange;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.Optional;

import static org.assertj.core.api.Assertions.*;

class WindowPolicyTest {

    private static final int BASELINE = 1000;
    private static final int MONITOR = 500;

    @Nested
    class Anchored {

        private final WindowPolicy policy = new AnchoredWindowPolicy();

        @Test
        void type() {
            assertThat(policy.type()).isEqualTo(WindowPolicyType.ANCHORED);
        }

        @Test
        void tooFewRows_noBaseline() {
            assertThat(policy.baseline(null, 999, BASELINE)).isEmpty();
        }

        @Test
        void firstFullBatch_createsBaselineAndNextMonitor() {
            WindowRange baseline = policy.baseline(null, 1200, BASELINE).orElseThrow();
            WindowRange monitor = policy.monitor(baseline, null, true, 1200, MONITOR).orElseThrow();

            assertThat(baseline).isEqualTo(new WindowRange(1, 1000));
            assertThat(monitor).isEqualTo(new WindowRange(1001, 1500));
        }

        @Test
        void baselineGrowsOnlyAfterFullBatch() {
            WindowRange current = new WindowRange(1, 1000);

            assertThat(policy.baseline(current, 1999, BASELINE)).contains(current);
            assertThat(policy.baseline(current, 2000, BASELINE)).contains(new WindowRange(1, 2000));
        }

        @Test
        void baselineGrowsOneBatchPerPass() {
            WindowRange current = new WindowRange(1, 1000);
            assertThat(policy.baseline(current, 5000, BASELINE)).contains(new WindowRange(1, 2000));
        }

        @Test
        void monitorResetsWhenBaselineMoves() {
            WindowRange baseline = new WindowRange(1, 2000);
            WindowRange stale = new WindowRange(1001, 1500);

            assertThat(policy.monitor(baseline, stale, true, 2000, MONITOR))
                .contains(new WindowRange(2001, 2500));
        }

        @Test
        void monitorKeptWhenBaselineStill() {
            WindowRange baseline = new WindowRange(1, 1000);
            WindowRange monitor = new WindowRange(1001, 1500);

            assertThat(policy.monitor(baseline, monitor, false, 1300, MONITOR)).contains(monitor);
        }

        @Test
        void overlappingMonitor_isReset() {
            WindowRange baseline = new WindowRange(1, 1000);
            WindowRange overlapping = new WindowRange(900, 1400);

            assertThat(policy.monitor(baseline, overlapping, false, 1300, MONITOR))
                .contains(new WindowRange(1001, 1500));
        }

        @Test
        void windowsNeverOverlapAcrossGrowth() {
            WindowRange baseline = null;
            WindowRange monitor = null;
            for (long latest = 0; latest <= 6000; latest += 137) {
                Optional<WindowRange> next = policy.baseline(baseline, latest, BASELINE);
                if (next.isEmpty()) {
                    continue;
                }
                boolean moved = !next.get().equals(baseline);
                baseline = next.get();
                monitor = policy.monitor(baseline, monitor, moved, latest, MONITOR).orElseThrow();

                assertThat(baseline.startRow()).isEqualTo(1);
                assertThat(baseline.endRow()).isLessThanOrEqualTo(latest);
                assertThat(baseline.length() % BASELINE).isZero();
                assertThat(monitor.startRow()).isEqualTo(baseline.endRow() + 1);
                assertThat(monitor.length()).isEqualTo(MONITOR);
            }
        }
    }

    @Nested
    class Sliding {

        private final WindowPolicy policy = new SlidingWindowPolicy();

        @Test
        void type() {
            assertThat(policy.type()).isEqualTo(WindowPolicyType.SLIDING);
        }

        @Test
        void firstFullBatch_takesLatestRows_noMonitorYet() {
            WindowRange baseline = policy.baseline(null, 1200, BASELINE).orElseThrow();

            assertThat(baseline).isEqualTo(new WindowRange(201, 1200));
            assertThat(policy.monitor(baseline, null, true, 1200, MONITOR)).isEmpty();
        }

        @Test
        void monitorCoversRecentRowsAfterBaseline() {
            WindowRange baseline = new WindowRange(201, 1200);

            assertThat(policy.monitor(baseline, null, false, 1300, MONITOR))
                .contains(new WindowRange(1201, 1300));
            assertThat(policy.monitor(baseline, null, false, 2000, MONITOR))
                .contains(new WindowRange(1501, 2000));
        }

        @Test
        void baselineJumpsAfterFullNewBatch() {
            WindowRange baseline = new WindowRange(201, 1200);

            assertThat(policy.baseline(baseline, 2199, BASELINE)).contains(baseline);
            assertThat(policy.baseline(baseline, 2350, BASELINE)).contains(new WindowRange(1351, 2350));
        }

        @Test
        void windowsAreDisjointAndBaselineKeepsItsLength() {
            WindowRange baseline = null;
            WindowRange monitor = null;
            for (long latest = 0; latest <= 8000; latest += 211) {
                Optional<WindowRange> next = policy.baseline(baseline, latest, BASELINE);
                if (next.isEmpty()) {
                    continue;
                }
                boolean moved = !next.get().equals(baseline);
                baseline = next.get();
                monitor = policy.monitor(baseline, monitor, moved, latest, MONITOR).orElse(null);

                assertThat(baseline.length()).isEqualTo(BASELINE);
                assertThat(baseline.endRow()).isLessThanOrEqualTo(latest);
                if (monitor != null) {
                    assertThat(monitor.startRow()).isGreaterThan(baseline.endRow());
                    assertThat(monitor.endRow()).isEqualTo(latest);
                    assertThat(monitor.length()).isLessThanOrEqualTo(MONITOR);
                }
            }
        }
    }
}
