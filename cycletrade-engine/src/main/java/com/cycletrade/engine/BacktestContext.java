package com.cycletrade.engine;

import com.cycletrade.core.model.Bar;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Bar series of every instrument in a run, and the order in which instruments are
 * processed within one timestamp.
 *
 * <p>With an empty order instruments run in ascending identifier order. Instruments missing
 * from an explicit order are appended in ascending order; listed identifiers without bars
 * are ignored.</p>
 */
public record BacktestContext(
    Map<String, List<Bar>> bars,
    List<String> instrumentOrder
) {
    private static final Logger log = LoggerFactory.getLogger(BacktestContext.class);

    public BacktestContext {
        Map<String, List<Bar>> sorted = new TreeMap<>();
        bars.forEach((id, series) -> sorted.put(id, series == null ? List.of() : series));
        bars = Collections.unmodifiableMap(sorted);
        instrumentOrder = instrumentOrder == null ? List.of() : List.copyOf(instrumentOrder);
    }

    /**
     * Context in ascending instrument order.
     */
    public static BacktestContext of(Map<String, List<Bar>> bars) {
        return new BacktestContext(bars, List.of());
    }

    public static BacktestContext of(Map<String, List<Bar>> bars, List<String> instrumentOrder) {
        return new BacktestContext(bars, instrumentOrder);
    }

    /**
     * Processing order of the instruments that have bars.
     */
    public List<String> resolveOrder() {
        Map<String, Boolean> ordered = new LinkedHashMap<>();
        for (String id : instrumentOrder) {
            if (!bars.containsKey(id)) {
                log.warn("Instrument {} is in the processing order but has no bars, ignoring", id);
                continue;
            }
            ordered.putIfAbsent(id, Boolean.TRUE);
        }
        for (String id : bars.keySet()) {
            if (!ordered.containsKey(id)) {
                if (!instrumentOrder.isEmpty()) {
                    log.warn("Instrument {} is missing from the processing order, appending it", id);
                }
                ordered.put(id, Boolean.TRUE);
            }
        }
        return new ArrayList<>(ordered.keySet());
    }

    /**
     * Sorted union of all bar timestamps. Missing (null) bars contribute nothing; the driver
     * rejects them when their instrument reaches them.
     */
    public TreeSet<Long> timeline() {
        TreeSet<Long> timestamps = new TreeSet<>();
        for (List<Bar> series : bars.values()) {
            for (Bar bar : series) {
                if (bar != null) {
                    timestamps.add(bar.timestamp());
                }
            }
        }
        return timestamps;
    }

    public int totalBars() {
        return bars.values().stream().mapToInt(List::size).sum();
    }
}
