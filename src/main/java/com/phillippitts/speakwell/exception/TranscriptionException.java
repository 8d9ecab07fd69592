package com.phillippitts.speakwell.exception;

/**
 * Thrown when transcriber output cannot be turned into a transcript.
 * The analysis is aborted rather than scored against a partial transcript.
 */
public class TranscriptionException extends SpeakWellException {

    private final String source;

    public TranscriptionException(String message) {
        super(message);
        this.source = "unknown";
    }

    public TranscriptionException(String message, String source) {
        super(message + " (source: " + source + ")");
        this.source = source;
    }

    public TranscriptionException(String message, Throwable cause) {
        super(message, cause);
        this.source = "unknown";
    }

    public TranscriptionException(String message, String source, Throwable cause) {
        super(message + " (source: " + source + ")", cause);
        this.source = source;
    }

    public String getSource() {
        return source;
    }
}
