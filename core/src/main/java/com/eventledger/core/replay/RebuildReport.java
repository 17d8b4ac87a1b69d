package com.eventledger.core.replay;

import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.ToString;

@Getter
@ToString
@AllArgsConstructor
public class RebuildReport {

    private final String aggregateType;
    private final long aggregatesRebuilt;
    private final int chunks;
}
