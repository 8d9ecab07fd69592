package com.phillippitts.speakwell.service.analysis;

import com.phillippitts.speakwell.config.properties.AnalysisProperties;
import com.phillippitts.speakwell.domain.AnalysisResult;
import com.phillippitts.speakwell.domain.ErrorType;
import com.phillippitts.speakwell.service.analysis.event.PronunciationAnalyzedEvent;
import com.phillippitts.speakwell.util.LogSanitizer;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

/**
 * In-process consumer of completed analyses. Logs a privacy-safe practice record; a
 * history store would subscribe to the same event.
 */
@Component
class PracticeHistoryListener {

    private static final Logger LOG = LogManager.getLogger(PracticeHistoryListener.class);

    private final AnalysisProperties props;

    PracticeHistoryListener(AnalysisProperties props) {
        this.props = props;
    }

    @EventListener
    void onAnalyzed(PronunciationAnalyzedEvent e) {
        LOG.info("Practice record: patient={}, sentence='{}', {}",
                e.patientId() == null ? "anonymous" : e.patientId(),
                LogSanitizer.preview(e.targetSentence(), props.getLogPreviewChars()),
                summarize(e.result()));
    }

    // Package-private for tests
    static String summarize(AnalysisResult r) {
        return "score=" + r.overallScore()
                + ", correct=" + r.count(ErrorType.NONE)
                + ", mispronounced=" + r.count(ErrorType.MISPRONUNCIATION)
                + ", omitted=" + r.count(ErrorType.OMISSION)
                + ", inserted=" + r.count(ErrorType.INSERTION);
    }
}
