package com.cycletrade.core.cycle;

import com.cycletrade.core.indicators.IndicatorPipeline;
import com.cycletrade.core.indicators.IndicatorSettings;
import com.cycletrade.core.indicators.SignalSnapshot;
import com.cycletrade.core.model.Bar;
import com.cycletrade.core.model.Phase;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Batch cycle labelling of a whole bar series, one pipeline and classifier per call.
 */
public final class CycleAnalyzer {

    private CycleAnalyzer() {}

    /**
     * Label every bar of the series in order.
     *
     * @throws com.cycletrade.core.model.InvalidBarException on the first malformed bar
     */
    public static List<Classification> label(String instrumentId, List<Bar> bars,
                                             IndicatorSettings settings, CycleThresholds thresholds,
                                             int minLookback) {
        IndicatorPipeline pipeline = new IndicatorPipeline(settings, minLookback);
        CycleClassifier classifier = new CycleClassifier(thresholds);
        List<Classification> labels = new ArrayList<>(bars.size());

        for (int i = 0; i < bars.size(); i++) {
            Bar bar = bars.get(i);
            bar.validate(instrumentId);
            SignalSnapshot snapshot = pipeline.update(bar);
            labels.add(classifier.classify(i, bar, snapshot));
        }
        return labels;
    }

    /**
     * Number of bars spent in each phase.
     */
    public static Map<Phase, Integer> phaseCounts(List<Classification> labels) {
        Map<Phase, Integer> counts = new EnumMap<>(Phase.class);
        for (Phase phase : Phase.values()) {
            counts.put(phase, 0);
        }
        for (Classification c : labels) {
            counts.merge(c.phase(), 1, Integer::sum);
        }
        return counts;
    }
}
