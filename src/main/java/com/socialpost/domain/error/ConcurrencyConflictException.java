package com.socialpost.domain.error;

import java.util.OptionalInt;
import java.util.UUID;

/**
 * Raised when an append's expected version no longer matches the stored stream.
 * Callers recover by reloading the aggregate, re-applying the command and saving again.
 */
public class ConcurrencyConflictException extends BusinessException {

    private static final String ERROR_CODE = "CONCURRENCY_CONFLICT";

    private final UUID aggregateId;
    private final int expectedVersion;
    private final Integer actualVersion;

    public ConcurrencyConflictException(UUID aggregateId, int expectedVersion, int actualVersion) {
        this(aggregateId, expectedVersion, actualVersion, null);
    }

    public ConcurrencyConflictException(UUID aggregateId, int expectedVersion, int actualVersion, Throwable cause) {
        super(ERROR_CODE,
            "Post " + aggregateId + " was modified concurrently (expected version "
                + expectedVersion + ", found " + actualVersion + ")",
            cause);
        this.aggregateId = aggregateId;
        this.expectedVersion = expectedVersion;
        this.actualVersion = actualVersion;
    }

    private ConcurrencyConflictException(UUID aggregateId, int attemptedVersion) {
        super(ERROR_CODE,
            "Post " + aggregateId + " was modified concurrently (version " + attemptedVersion + " is already stored)");
        this.aggregateId = aggregateId;
        this.expectedVersion = attemptedVersion - 1;
        this.actualVersion = null;
    }

    /**
     * The storage rejected a record because its version is already taken. The stored last
     * version is not known at that point.
     */
    public static ConcurrencyConflictException versionTaken(UUID aggregateId, int attemptedVersion) {
        return new ConcurrencyConflictException(aggregateId, attemptedVersion);
    }

    public UUID getAggregateId() {
        return aggregateId;
    }

    public int getExpectedVersion() {
        return expectedVersion;
    }

    /**
     * The stored last version, when it was read.
     */
    public OptionalInt getActualVersion() {
        return actualVersion != null ? OptionalInt.of(actualVersion) : OptionalInt.empty();
    }
}
