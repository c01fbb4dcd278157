package com.pitchscope.exception;

/**
 * Thrown when audio exceeds a size ceiling: the batch upload limit (no upload is attempted) or the
 * per-session buffer limit (the chunk is not buffered).
 */
public class SizeLimitExceededException extends PitchScopeException {

    private final long size;
    private final long limit;

    public SizeLimitExceededException(long size, long limit) {
        super("Audio size " + size + " bytes exceeds limit of " + limit + " bytes");
        this.size = size;
        this.limit = limit;
    }

    public long getSize() {
        return size;
    }

    public long getLimit() {
        return limit;
    }
}
