package com.cycletrade.engine.risk;

import com.cycletrade.core.model.Phase;

import java.util.Collection;
import java.util.EnumSet;
import java.util.Set;

/**
 * Decides whether new entries are allowed in a phase.
 */
@FunctionalInterface
public interface EntryGate {

    boolean allows(Phase phase);

    /**
     * Gate that refuses entries in the given phases.
     */
    static EntryGate blocking(Collection<Phase> blocked) {
        Set<Phase> phases = blocked.isEmpty() ? EnumSet.noneOf(Phase.class) : EnumSet.copyOf(blocked);
        return phase -> !phases.contains(phase);
    }

    /**
     * Entries allowed everywhere except bear_warning.
     */
    static EntryGate defaultGate() {
        return blocking(EnumSet.of(Phase.BEAR_WARNING));
    }

    static EntryGate allowAll() {
        return phase -> true;
    }
}
