package org.metalad.conduct;

import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Result of a pipeline run: final state, counts per outcome and all item results.
 */
public final class RunSummary {
    private final RunState state;
    private final boolean stopped;
    private final String message;
    private final List<ItemResult> results;
    private final Map<Outcome, Integer> counts = new EnumMap<>(Outcome.class);

    public RunSummary(RunState state, boolean stopped, String message, List<ItemResult> results) {
        this.state = state;
        this.stopped = stopped;
        this.message = message;
        this.results = List.copyOf(results);
        for (Outcome outcome : Outcome.values()) {
            counts.put(outcome, 0);
        }
        for (ItemResult result : results) {
            counts.merge(result.getOutcome(), 1, Integer::sum);
        }
    }

    /**
     * Summary of a run that could not start, e.g. because of a configuration error
     */
    public static RunSummary failed(String message) {
        return new RunSummary(RunState.FAILED, false, message, Collections.emptyList());
    }

    public RunState getState() {
        return state;
    }

    public boolean isStopped() {
        return stopped;
    }

    public String getMessage() {
        return message;
    }

    public List<ItemResult> getResults() {
        return results;
    }

    public int getCount(Outcome outcome) {
        return counts.get(outcome);
    }

    public int getItemCount() {
        return results.size();
    }

    /**
     * @return True if at least one item was processed and every item ended in error
     */
    public boolean isTotalFailure() {
        return !results.isEmpty() && getCount(Outcome.ERROR) == results.size();
    }

    /**
     * @return 1 if the run failed or all items failed, 0 otherwise
     */
    public int getExitCode() {
        return state == RunState.FAILED || isTotalFailure() ? 1 : 0;
    }

    @Override
    public String toString() {
        StringBuilder builder = new StringBuilder(state.name());
        if (stopped) {
            builder.append(" (stopped)");
        }
        for (Outcome outcome : Outcome.values()) {
            builder.append(' ').append(outcome.getName()).append('=').append(counts.get(outcome));
        }
        if (message != null) {
            builder.append(": ").append(message);
        }
        return builder.toString();
    }
}
