package com.eainde.dialog.exception;

public class RetryExhaustedException extends DialogRouterException {

    private final String agentName;
    private final int attempts;

    public RetryExhaustedException(String agentName, int attempts) {
        super("Agent '" + agentName + "' produced no usable output after " + attempts + " attempts");
        this.agentName = agentName;
        this.attempts = attempts;
    }

    public String getAgentName() {
        return agentName;
    }

    public int getAttempts() {
        return attempts;
    }
}
