package com.phillippitts.speakwell.exception;

/**
 * Thrown when rubric weights fall outside their documented ranges
 * (weights in [0,100], mispronunciation threshold &gt;= 0).
 */
public class InvalidRubricException extends SpeakWellException {

    private final String field;
    private final int value;

    public InvalidRubricException(String field, int value, String reason) {
        super("Invalid rubric " + field + "=" + value + ": " + reason);
        this.field = field;
        this.value = value;
    }

    public String getField() {
        return field;
    }

    public int getValue() {
        return value;
    }
}
