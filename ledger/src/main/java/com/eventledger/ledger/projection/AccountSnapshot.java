package com.eventledger.ledger.projection;

import com.eventledger.ledger.domain.Account;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * Denormalized account view, cached in Redis and returned by the query API.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AccountSnapshot {

    private String accountId;
    private String name;
    private BigDecimal balance;
    private String status;
    private long version;
    private Instant openedAt;
    private Instant closedAt;
    private String source;

    public static AccountSnapshot of(Account account, String source) {
        return AccountSnapshot.builder()
                .accountId(account.getId())
                .name(account.getName())
                .balance(account.getBalance())
                .status(account.getStatus() == null ? null : account.getStatus().name())
                .version(account.getVersion())
                .openedAt(account.getOpenedAt())
                .closedAt(account.getClosedAt())
                .source(source)
                .build();
    }
}
