package com.eventledger.ledger.projection;

/**
 * Values of {@link AccountSnapshot#getSource()}.
 */
public final class LedgerSources {

    public static final String READ_MODEL = "read-model";
    public static final String EVENT_STORE = "event-store";

    private LedgerSources() {}
}
