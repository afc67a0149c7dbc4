package com.eainde.dialog.nodes;

/**
 * Bound on how often an agent is re-prompted after an unusable (empty) model output.
 *
 * @param maxAttempts total model invocations allowed for one turn, at least 1
 * @param onExhausted what to do once the attempts are used up
 * @param apology     reply emitted when {@code onExhausted} is {@link OnExhausted#APOLOGIZE}
 */
public record RetryPolicy(int maxAttempts, OnExhausted onExhausted, String apology) {

    public static final String DEFAULT_APOLOGY =
            "I'm sorry, I could not produce an answer this time. Could you rephrase or try again?";

    public enum OnExhausted {
        /** Reply with the canned apology; the turn ends normally. */
        APOLOGIZE,
        /** Fail the turn with a {@link com.eainde.dialog.exception.RetryExhaustedException}. */
        FAIL
    }

    public RetryPolicy {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be at least 1, was " + maxAttempts);
        }
        if (onExhausted == null) {
            onExhausted = OnExhausted.APOLOGIZE;
        }
        if (apology == null || apology.isBlank()) {
            apology = DEFAULT_APOLOGY;
        }
    }

    public static RetryPolicy defaults() {
        return new RetryPolicy(5, OnExhausted.APOLOGIZE, DEFAULT_APOLOGY);
    }
}
