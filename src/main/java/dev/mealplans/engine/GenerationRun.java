package dev.mealplans.engine;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Mutable state of one generation request as it moves through the orchestration states.
 */
public final class GenerationRun {

    public enum State {
        AWAIT_DRAFT,
        VALIDATE,
        REPAIR,
        REVALIDATE,
        FALLBACK_DETERMINISTIC,
        ACCEPT
    }

    private final String label;
    private State current;
    private final List<State> trace;
    private final Map<State, Integer> visitCounts;
    private final long startTime;

    public GenerationRun(String label, State initial) {
        this.label = label;
        this.current = initial;
        this.trace = new ArrayList<>();
        this.visitCounts = new EnumMap<>(State.class);
        this.startTime = System.currentTimeMillis();

        this.trace.add(initial);
        this.visitCounts.put(initial, 1);
    }

    public String label() { return label; }
    public State current() { return current; }

    public List<String> traceNames() {
        return trace.stream().map(State::name).toList();
    }

    public int visitCount(State state) {
        return visitCounts.getOrDefault(state, 0);
    }

    public boolean visited(State state) {
        return visitCount(state) > 0;
    }

    public long elapsedMillis() {
        return System.currentTimeMillis() - startTime;
    }

    /**
     * Move to the next state and record the visit.
     */
    public void transitionTo(State next) {
        this.current = next;
        this.trace.add(next);
        this.visitCounts.merge(next, 1, Integer::sum);
    }
}
