package com.pitchscope.exception;

/**
 * Thrown when the provider reports a batch transcription job as failed.
 */
public class UpstreamJobException extends PitchScopeException {

    private final String jobId;

    public UpstreamJobException(String message, String jobId) {
        super(message + " (job: " + jobId + ")");
        this.jobId = jobId;
    }

    public String getJobId() {
        return jobId;
    }
}
