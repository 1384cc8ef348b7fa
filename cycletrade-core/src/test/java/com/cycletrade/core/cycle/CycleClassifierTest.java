package com.cycletrade.core.cycle;

import com.cycletrade.core.model.Phase;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static com.cycletrade.core.model.Phase.*;
import static org.junit.jupiter.api.Assertions.*;

class CycleClassifierTest {

    private CycleClassifier classifier;

    @BeforeEach
    void setUp() {
        classifier = new CycleClassifier(CycleThresholds.defaults());
    }

    private List<Classification> run(double... values) {
        List<Classification> out = new ArrayList<>();
        for (int i = 0; i < values.length; i++) {
            out.add(classifier.advance(i, i * 1000L, 100 + i, values[i]));
        }
        return out;
    }

    private List<Phase> phases(double... values) {
        return run(values).stream().map(Classification::phase).toList();
    }

    @Nested
    @DisplayName("Bull side")
    class BullSide {

        @Test
        @DisplayName("Warning, strong and back to consolidation")
        void fullBullCycle() {
            assertEquals(
                List.of(CONSOLIDATION, BULL_WARNING, BULL_WARNING, BULL_STRONG, BULL_STRONG, CONSOLIDATION),
                phases(500, 650, 750, 1050, 900, -50));
        }

        @Test
        @DisplayName("Warning that never confirms falls back at zero")
        void warningWithoutConfirmation() {
            List<Classification> out = run(650, 700, -10);
            assertEquals(List.of(BULL_WARNING, BULL_WARNING, CONSOLIDATION),
                out.stream().map(Classification::phase).toList());
            assertFalse(out.get(1).confirmed());
        }

        @Test
        @DisplayName("Threshold values themselves do not trigger")
        void strictThresholds() {
            assertEquals(List.of(CONSOLIDATION), phases(600));
            classifier = new CycleClassifier(CycleThresholds.defaults());
            assertEquals(List.of(BULL_WARNING, BULL_WARNING, CONSOLIDATION), phases(700, 1000, 0));
        }

        @Test
        @DisplayName("Strong phase is confirmed")
        void strongIsConfirmed() {
            List<Classification> out = run(700, 1100, 300);
            assertTrue(out.get(1).confirmed());
            assertTrue(out.get(2).confirmed());
            assertEquals(BULL_STRONG, out.get(2).phase(), "strong holds above the exit level");
        }
    }

    @Nested
    @DisplayName("Bear side")
    class BearSide {

        @Test
        @DisplayName("Mirror of the bull cycle")
        void fullBearCycle() {
            assertEquals(
                List.of(CONSOLIDATION, BEAR_WARNING, BEAR_WARNING, BEAR_STRONG, BEAR_STRONG, CONSOLIDATION),
                phases(-500, -650, -750, -1050, -900, 50));
        }

        @Test
        @DisplayName("Bear warning can deepen straight into strong")
        void warningToStrong() {
            assertEquals(List.of(BEAR_WARNING, BEAR_STRONG), phases(-700, -1200));
        }

        @Test
        @DisplayName("Bear warning never jumps to a bull phase")
        void noDirectFlip() {
            assertEquals(List.of(BEAR_WARNING, CONSOLIDATION, BULL_WARNING), phases(-700, 700, 800));
        }
    }

    @Nested
    @DisplayName("Insufficient data")
    class InsufficientData {

        @Test
        @DisplayName("NaN is labelled consolidation, unconfirmed, and leaves the state untouched")
        void nanLeavesStateAlone() {
            List<Classification> out = run(Double.NaN, 700, Double.NaN, 1100);

            assertEquals(CONSOLIDATION, out.get(0).phase());
            assertFalse(out.get(0).sufficientData());
            assertFalse(out.get(0).confirmed());

            assertEquals(BULL_WARNING, out.get(1).phase());
            assertEquals(CONSOLIDATION, out.get(2).phase());
            assertFalse(out.get(2).sufficientData());
            assertEquals(BULL_STRONG, out.get(3).phase(), "machine resumes from bull_warning");
        }
    }

    @Nested
    @DisplayName("Streaks")
    class Streaks {

        @Test
        @DisplayName("Extremum tracks the highest value of a bull streak")
        void bullExtremum() {
            List<Classification> out = run(650, 900, 800);
            assertEquals(900.0, out.get(2).streak().extremumValue(), 1e-9);
            assertEquals(0, out.get(2).streak().startBarIndex());
            assertEquals(3, out.get(2).streak().durationBars(2));
        }

        @Test
        @DisplayName("Extremum tracks the lowest value of a bear streak")
        void bearExtremum() {
            List<Classification> out = run(-650, -900, -800);
            assertEquals(-900.0, out.get(2).streak().extremumValue(), 1e-9);
        }

        @Test
        @DisplayName("Streak restarts on every phase change")
        void resetOnPhaseChange() {
            List<Classification> out = run(650, 1100, 1300, -10);

            assertEquals(BULL_STRONG, out.get(1).streak().phase());
            assertEquals(1, out.get(1).streak().startBarIndex());
            assertEquals(101.0, out.get(1).streak().startPrice(), 1e-9);
            assertEquals(1300.0, out.get(2).streak().extremumValue(), 1e-9);

            assertEquals(CONSOLIDATION, out.get(3).streak().phase());
            assertEquals(3, out.get(3).streak().startBarIndex());
            assertNull(out.get(3).streak().extremumValue());
        }
    }
}
