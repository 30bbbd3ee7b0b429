package org.calista.grila.crossword.events;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public final class GenerationEvent {
    public static final String ATTEMPT_STARTED = "ATTEMPT_STARTED";
    public static final String ATTEMPT_RETRY = "ATTEMPT_RETRY";
    public static final String ATTEMPT_OK = "ATTEMPT_OK";
    public static final String GENERATION_FAILED = "GENERATION_FAILED";

    public String type;
    public long tsEpochMs;
    public String runId;
    public int attempt;
    public Long gridSeed;
    public String text;        // reason / summary

    public static GenerationEvent of(String type, String runId, int attempt, Long gridSeed, String text, long tsEpochMs) {
        GenerationEvent e = new GenerationEvent();
        e.type = type;
        e.runId = runId;
        e.attempt = attempt;
        e.gridSeed = gridSeed;
        e.text = text;
        e.tsEpochMs = tsEpochMs;
        return e;
    }
}
