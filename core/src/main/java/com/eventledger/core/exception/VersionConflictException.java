package com.eventledger.core.exception;

/**
 * The stored aggregate version no longer matches the version the caller loaded.
 * The whole operation must be discarded and retried by the caller.
 */
public class VersionConflictException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    private final String aggregateType;
    private final String aggregateId;
    private final long expectedVersion;

    public VersionConflictException(String aggregateType, String aggregateId, long expectedVersion) {
        super(String.format("Version conflict on %s %s: expected version=%d is stale",
                aggregateType, aggregateId, expectedVersion));
        this.aggregateType = aggregateType;
        this.aggregateId = aggregateId;
        this.expectedVersion = expectedVersion;
    }

    public VersionConflictException(String aggregateType, String aggregateId, long expectedVersion, long actualVersion) {
        super(String.format("Version conflict on %s %s: expected version=%d, actual=%d",
                aggregateType, aggregateId, expectedVersion, actualVersion));
        this.aggregateType = aggregateType;
        this.aggregateId = aggregateId;
        this.expectedVersion = expectedVersion;
    }

    public String getAggregateType() {
        return aggregateType;
    }

    public String getAggregateId() {
        return aggregateId;
    }

    public long getExpectedVersion() {
        return expectedVersion;
    }
}
