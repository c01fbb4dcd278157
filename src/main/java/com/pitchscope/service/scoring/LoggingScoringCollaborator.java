package com.pitchscope.service.scoring;

import com.pitchscope.service.intelligence.AudioIntelligenceReport;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.stereotype.Component;

import java.util.Locale;

/**
 * Default collaborator: logs a one-line summary of each finished session.
 */
@Component
public class LoggingScoringCollaborator implements ScoringCollaborator {

    private static final Logger LOG = LogManager.getLogger(LoggingScoringCollaborator.class);

    @Override
    public void onSessionFinalized(FinalizedSession session) {
        AudioIntelligenceReport report = session.report();
        LOG.info("Session {} finalized: segments={}, words={}, wpm={}, fillers={}%, deliveryScore={}/{}",
                session.sessionId(),
                session.transcript().size(),
                report.speech().totalWords(),
                String.format(Locale.ROOT, "%.1f", report.speech().wordsPerMinute()),
                String.format(Locale.ROOT, "%.1f", report.filler().fillerPercentage()),
                report.deliveryScore(),
                AudioIntelligenceReport.MAX_DELIVERY_SCORE);
    }
}
