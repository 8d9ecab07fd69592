package com.phillippitts.speakwell.domain;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Classification of a single word after alignment.
 */
public enum ErrorType {

    /** Target word matched a transcript word exactly. */
    NONE("none"),

    /** Target word matched a transcript word within the edit-distance threshold. */
    MISPRONUNCIATION("mispronunciation"),

    /** Target word had no matching transcript word. */
    OMISSION("omission"),

    /** Transcript word was not matched to any target word. */
    INSERTION("insertion");

    private final String wireName;

    ErrorType(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }

    /**
     * True for classifications that occupy a target-word slot.
     */
    public boolean isTargetSlot() {
        return this != INSERTION;
    }
}
