package com.entity.canonical.extraction;

import com.entity.canonical.core.model.RawMention;

import java.util.List;
import java.util.Objects;

/**
 * Outcome of one extractor call. Failures are values rather than exceptions so the caller
 * can decide whether to retry.
 *
 * @param status   OK, RETRYABLE_ERROR or FATAL_ERROR
 * @param mentions extracted mentions; empty unless OK
 * @param error    failure description; null when OK
 */
public record ExtractionResult(Status status, List<RawMention> mentions, String error) {

    public enum Status {
        OK,
        /** Transient failure such as a timeout or rate limit. */
        RETRYABLE_ERROR,
        /** Permanent failure such as an unparseable payload. */
        FATAL_ERROR
    }

    public ExtractionResult {
        Objects.requireNonNull(status, "status is required");
        mentions = mentions != null ? List.copyOf(mentions) : List.of();
        if (status != Status.OK && error == null) {
            throw new IllegalArgumentException("error is required for failed extractions");
        }
    }

    public static ExtractionResult ok(List<RawMention> mentions) {
        return new ExtractionResult(Status.OK, mentions, null);
    }

    public static ExtractionResult retryable(String error) {
        return new ExtractionResult(Status.RETRYABLE_ERROR, List.of(), error);
    }

    public static ExtractionResult fatal(String error) {
        return new ExtractionResult(Status.FATAL_ERROR, List.of(), error);
    }

    public boolean isOk() {
        return status == Status.OK;
    }

    public boolean isRetryable() {
        return status == Status.RETRYABLE_ERROR;
    }
}
