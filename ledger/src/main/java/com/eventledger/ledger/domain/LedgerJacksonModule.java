package com.eventledger.ledger.domain;

import com.fasterxml.jackson.databind.jsontype.NamedType;
import com.fasterxml.jackson.databind.module.SimpleModule;

/**
 * Registers the ledger's {@link com.eventledger.core.action.ActionDetails} subtypes
 * so stored action payloads decode to their concrete class.
 */
public class LedgerJacksonModule extends SimpleModule {

    private static final long serialVersionUID = 1L;

    public LedgerJacksonModule() {
        super("eventledger-ledger");
        registerSubtypes(
                new NamedType(LedgerActions.DepositDetails.class, LedgerActions.DEPOSIT),
                new NamedType(LedgerActions.WithdrawalDetails.class, LedgerActions.WITHDRAWAL),
                new NamedType(LedgerActions.TransferDetails.class, LedgerActions.TRANSFER));
    }
}
