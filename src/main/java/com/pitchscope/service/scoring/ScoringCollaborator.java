package com.pitchscope.service.scoring;

/**
 * Downstream consumer of finished sessions (pitch scoring, persistence, feedback).
 *
 * <p>Called once per session that reaches STOPPED, on a worker thread. Implementations may throw;
 * the failure is logged and counted and never affects the session result.
 */
@FunctionalInterface
public interface ScoringCollaborator {

    void onSessionFinalized(FinalizedSession session);
}
