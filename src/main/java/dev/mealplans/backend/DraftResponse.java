package dev.mealplans.backend;

/**
 * Structured response from a draft generator invocation.
 */
public record DraftResponse(
    boolean success,
    String responseText,
    String error,
    long durationMillis
) {
    public static DraftResponse ok(String responseText, long durationMillis) {
        return new DraftResponse(true, responseText, null, durationMillis);
    }

    public static DraftResponse failed(String error, long durationMillis) {
        return new DraftResponse(false, null, error, durationMillis);
    }
}
