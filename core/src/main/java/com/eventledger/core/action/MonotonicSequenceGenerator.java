package com.eventledger.core.action;

import java.time.Clock;

/**
 * Time-ordered 64-bit id generator.
 *
 * Layout: 41 bits of milliseconds since 2024-01-01T00:00:00Z, 10 bits node id,
 * 12 bits per-millisecond counter. Ids are strictly increasing per node; when the
 * wall clock steps backwards, or the counter overflows, the generator keeps
 * counting on a logical millisecond ahead of the wall clock.
 */
public class MonotonicSequenceGenerator implements SequenceGenerator {

    static final long EPOCH_MILLIS = 1_704_067_200_000L;
    private static final int NODE_BITS = 10;
    private static final int COUNTER_BITS = 12;
    private static final long MAX_NODE_ID = (1L << NODE_BITS) - 1;
    private static final long COUNTER_MASK = (1L << COUNTER_BITS) - 1;

    private final long nodeId;
    private final Clock clock;

    private long lastMillis = -1L;
    private long counter;

    public MonotonicSequenceGenerator(long nodeId, Clock clock) {
        if (nodeId < 0 || nodeId > MAX_NODE_ID) {
            throw new IllegalArgumentException("nodeId must be between 0 and " + MAX_NODE_ID + ": " + nodeId);
        }
        this.nodeId = nodeId;
        this.clock = clock;
    }

    @Override
    public synchronized long next() {
        long millis = Math.max(clock.millis(), lastMillis);
        if (millis == lastMillis) {
            counter = (counter + 1) & COUNTER_MASK;
            if (counter == 0) {
                millis = lastMillis + 1;
            }
        } else {
            counter = 0;
        }
        lastMillis = millis;
        return ((millis - EPOCH_MILLIS) << (NODE_BITS + COUNTER_BITS)) | (nodeId << COUNTER_BITS) | counter;
    }
}
