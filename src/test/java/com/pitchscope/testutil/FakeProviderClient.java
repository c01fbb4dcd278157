package com.pitchscope.testutil;

import com.pitchscope.domain.AudioConfiguration;
import com.pitchscope.domain.ProviderSession;
import com.pitchscope.exception.ConnectionException;
import com.pitchscope.service.stt.provider.JobStatus;
import com.pitchscope.service.stt.provider.SttProviderClient;
import com.pitchscope.service.stt.provider.SubmittedJob;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * In-memory provider client with scripted job statuses and call counters.
 *
 * <p>When the status script runs out, every further poll reports PROCESSING.
 */
public class FakeProviderClient implements SttProviderClient {

    private final Deque<JobStatus> statuses = new ArrayDeque<>();
    private final AtomicInteger liveSessions = new AtomicInteger();
    private final AtomicInteger uploads = new AtomicInteger();
    private final AtomicInteger submissions = new AtomicInteger();
    private final AtomicInteger polls = new AtomicInteger();
    private final AtomicInteger deletions = new AtomicInteger();
    private boolean liveUnavailable;
    private boolean deleteFails;
    private String lastLanguage;

    public FakeProviderClient liveUnavailable() {
        this.liveUnavailable = true;
        return this;
    }

    public FakeProviderClient failingDeletes() {
        this.deleteFails = true;
        return this;
    }

    public FakeProviderClient thenStatus(JobStatus status) {
        statuses.add(status);
        return this;
    }

    @Override
    public ProviderSession createLiveSession(AudioConfiguration configuration) {
        if (liveUnavailable) {
            throw new ConnectionException("live endpoint unavailable", "fake://live");
        }
        int n = liveSessions.incrementAndGet();
        return new ProviderSession("live-" + n, "wss://fake/live/" + n);
    }

    @Override
    public String uploadAudio(byte[] audio, String fileName) {
        uploads.incrementAndGet();
        return "fake://audio/" + fileName;
    }

    @Override
    public SubmittedJob submitJob(String audioUrl, AudioConfiguration configuration, String language) {
        int n = submissions.incrementAndGet();
        lastLanguage = language;
        return new SubmittedJob("job-" + n, "fake://jobs/job-" + n);
    }

    @Override
    public JobStatus fetchJob(SubmittedJob job) {
        polls.incrementAndGet();
        JobStatus next = statuses.poll();
        return next == null ? JobStatus.pending(JobStatus.State.PROCESSING) : next;
    }

    @Override
    public void deleteJob(SubmittedJob job) {
        deletions.incrementAndGet();
        if (deleteFails) {
            throw new ConnectionException("delete failed", job.resultUrl());
        }
    }

    public int liveSessionCount() {
        return liveSessions.get();
    }

    public int uploadCount() {
        return uploads.get();
    }

    public int submissionCount() {
        return submissions.get();
    }

    public int pollCount() {
        return polls.get();
    }

    public int deletionCount() {
        return deletions.get();
    }

    public String lastLanguage() {
        return lastLanguage;
    }
}
