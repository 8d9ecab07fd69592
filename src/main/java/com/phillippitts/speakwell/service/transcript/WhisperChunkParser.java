package com.phillippitts.speakwell.service.transcript;

import com.phillippitts.speakwell.domain.TranscriptWord;
import com.phillippitts.speakwell.domain.Transcription;
import com.phillippitts.speakwell.exception.TranscriptionException;
import org.json.JSONArray;
import org.json.JSONException;
import org.json.JSONObject;

import java.util.ArrayList;
import java.util.List;

/**
 * Parses word-level Whisper output as produced by the transformers.js ASR pipeline with
 * {@code return_timestamps: 'word'}:
 *
 * <pre>{@code
 * {
 *   "text": " Hello world",
 *   "chunks": [
 *     {"text": " Hello", "timestamp": [0.1, 0.5]},
 *     {"text": " world", "timestamp": [0.6, null]}
 *   ]
 * }
 * }</pre>
 *
 * <p>Word text is trimmed and empty words are dropped. A missing end timestamp takes the
 * start value; a missing start is 0. When the top-level text is absent the word texts are
 * joined with spaces.
 */
public final class WhisperChunkParser {

    static final String SOURCE = "whisper";

    private WhisperChunkParser() {}

    /**
     * Parses transcriber JSON into a transcription.
     *
     * @param json raw ASR output
     * @return parsed transcription (possibly without words)
     * @throws TranscriptionException if json is null, blank or not a JSON object
     */
    public static Transcription parse(String json) {
        if (json == null || json.isBlank()) {
            throw new TranscriptionException("Empty transcriber output", SOURCE);
        }
        JSONObject obj;
        try {
            obj = new JSONObject(json);
        } catch (JSONException e) {
            throw new TranscriptionException("Malformed transcriber output", SOURCE, e);
        }

        List<TranscriptWord> words = extractWords(obj.optJSONArray("chunks"));
        if (obj.has("text") && !obj.isNull("text")) {
            return new Transcription(obj.optString("text", "").trim(), words);
        }
        return Transcription.ofWords(words);
    }

    private static List<TranscriptWord> extractWords(JSONArray chunks) {
        if (chunks == null) {
            return List.of();
        }
        List<TranscriptWord> words = new ArrayList<>();
        for (int i = 0; i < chunks.length(); i++) {
            JSONObject chunk = chunks.optJSONObject(i);
            if (chunk == null) {
                continue;
            }
            String text = chunk.optString("text", "").trim();
            if (text.isEmpty()) {
                continue;
            }
            JSONArray ts = chunk.optJSONArray("timestamp");
            double start = timestampAt(ts, 0, 0.0);
            double end = timestampAt(ts, 1, start);
            words.add(new TranscriptWord(text, start, end));
        }
        return words;
    }

    private static double timestampAt(JSONArray ts, int index, double fallback) {
        if (ts == null || ts.isNull(index)) {
            return fallback;
        }
        double v = ts.optDouble(index, fallback);
        return Double.isNaN(v) ? fallback : v;
    }
}
