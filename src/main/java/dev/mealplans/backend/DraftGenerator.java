package dev.mealplans.backend;

/**
 * A text generator that drafts or optimizes meal plans from a prompt.
 */
public interface DraftGenerator {

    /**
     * Send a prompt and return the raw response text.
     *
     * @param prompt full prompt text, including candidate recipes and the output format
     * @param model  backend-specific model identifier, or null for the backend default
     * @return structured response; failures are reported through {@link DraftResponse#success()}
     */
    DraftResponse requestDraft(String prompt, String model);

    /** Get backend display name. */
    default String getName() {
        return getClass().getSimpleName();
    }
}
