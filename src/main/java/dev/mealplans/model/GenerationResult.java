package dev.mealplans.model;

import java.util.List;

/**
 * An accepted plan plus how it was produced.
 *
 * @param trace         orchestration states visited, in order
 * @param unfilledSlots required slots left empty because no candidate matched
 * @param qualityNotes  remaining validator findings on a deterministic plan
 */
public record GenerationResult(
    Plan plan,
    GenerationMethod method,
    List<String> trace,
    List<String> unfilledSlots,
    List<Violation> qualityNotes,
    List<DaySummary> summaries
) {
    public GenerationResult {
        trace = List.copyOf(trace);
        unfilledSlots = List.copyOf(unfilledSlots);
        qualityNotes = List.copyOf(qualityNotes);
        summaries = List.copyOf(summaries);
    }

    public boolean degraded() {
        return !unfilledSlots.isEmpty() || !qualityNotes.isEmpty();
    }
}
