package com.streamearn.service;

import com.streamearn.model.WalletBalance;
import com.streamearn.repository.WalletBalanceRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.OffsetDateTime;
import java.util.List;

/**
 * Durable token balances keyed by wallet address and token symbol.
 */
@Service
@RequiredArgsConstructor
public class WalletService {

    private final WalletBalanceRepository walletBalanceRepository;

    /**
     * Credit a wallet inside the caller's transaction. The balance row is
     * created on first credit and locked for the update.
     *
     * @param periodKey period the credit is paid from, reported if the balance overflows
     * @return the new balance
     */
    @Transactional
    public BigDecimal credit(String walletAddress, String tokenSymbol, BigDecimal amount,
                             String periodKey, OffsetDateTime now) {
        if (amount == null || amount.signum() <= 0) {
            throw new IllegalArgumentException("Credit amount must be positive");
        }
        walletBalanceRepository.insertIfAbsent(walletAddress, tokenSymbol, now);
        WalletBalance balance = walletBalanceRepository.findForUpdate(walletAddress, tokenSymbol)
                .orElseThrow(() -> new IllegalStateException("Wallet balance missing for " + walletAddress));

        balance.setBalance(MonetaryAmounts.checkedAdd(periodKey, balance.getBalance(), amount));
        balance.setUpdatedAt(now);
        walletBalanceRepository.save(balance);
        return balance.getBalance();
    }

    @Transactional(readOnly = true)
    public List<WalletBalance> getBalances(String walletAddress) {
        return walletBalanceRepository.findByWalletAddressOrderByTokenSymbolAsc(walletAddress);
    }
}
