package com.streamearn.model;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.IdClass;
import jakarta.persistence.Table;
import lombok.Getter;
import lombok.Setter;

import java.math.BigDecimal;
import java.time.OffsetDateTime;

/**
 * Balance of one token held by one wallet address.
 */
@Getter
@Setter
@Entity
@Table(name = "wallet_balance")
@IdClass(WalletBalanceId.class)
public class WalletBalance {

    @Id
    @Column(name = "wallet_address", nullable = false, updatable = false, length = 128)
    private String walletAddress;

    @Id
    @Column(name = "token_symbol", nullable = false, updatable = false, length = 16)
    private String tokenSymbol;

    @Column(name = "balance", nullable = false, precision = 30, scale = 6)
    private BigDecimal balance = BigDecimal.ZERO;

    @Column(name = "updated_at", nullable = false)
    private OffsetDateTime updatedAt = OffsetDateTime.now();
}
