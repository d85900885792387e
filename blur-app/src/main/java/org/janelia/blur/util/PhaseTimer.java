package org.janelia.blur.util;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Tracks elapsed time overall and for consecutive named phases of a run.
 */
public class PhaseTimer {

    private final long start;
    private final Map<String, Long> phaseMilliseconds;
    private String currentPhase;
    private long currentPhaseStart;

    public PhaseTimer() {
        this.start = System.currentTimeMillis();
        this.phaseMilliseconds = new LinkedHashMap<>();
        this.currentPhase = null;
        this.currentPhaseStart = this.start;
    }

    /**
     * Ends the current phase (if any) and starts the named phase.
     */
    public void startPhase(final String phaseName) {
        stopPhase();
        currentPhase = phaseName;
        currentPhaseStart = System.currentTimeMillis();
    }

    public void stopPhase() {
        if (currentPhase != null) {
            phaseMilliseconds.merge(currentPhase, System.currentTimeMillis() - currentPhaseStart, Long::sum);
            currentPhase = null;
        }
    }

    public Map<String, Long> getPhaseMilliseconds() {
        return new LinkedHashMap<>(phaseMilliseconds);
    }

    public long getElapsedMilliseconds() {
        return System.currentTimeMillis() - start;
    }

    @Override
    public String toString() {
        final StringBuilder sb = new StringBuilder();
        sb.append(getElapsedMilliseconds()).append(" ms");
        if (! phaseMilliseconds.isEmpty()) {
            sb.append(' ').append(phaseMilliseconds);
        }
        return sb.toString();
    }
}
