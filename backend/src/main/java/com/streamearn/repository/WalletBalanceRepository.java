package com.streamearn.repository;

import com.streamearn.model.WalletBalance;
import com.streamearn.model.WalletBalanceId;
import jakarta.persistence.LockModeType;
import jakarta.persistence.QueryHint;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.jpa.repository.QueryHints;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.Optional;

@Repository
public interface WalletBalanceRepository extends JpaRepository<WalletBalance, WalletBalanceId> {

    List<WalletBalance> findByWalletAddressOrderByTokenSymbolAsc(String walletAddress);

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @QueryHints(@QueryHint(name = "jakarta.persistence.lock.timeout", value = "3000"))
    @Query("select w from WalletBalance w where w.walletAddress = :walletAddress and w.tokenSymbol = :tokenSymbol")
    Optional<WalletBalance> findForUpdate(@Param("walletAddress") String walletAddress,
                                          @Param("tokenSymbol") String tokenSymbol);

    @Modifying
    @Query(value = """
            INSERT INTO wallet_balance (wallet_address, token_symbol, balance, updated_at)
            VALUES (:walletAddress, :tokenSymbol, 0, :now)
            ON CONFLICT (wallet_address, token_symbol) DO NOTHING
            """, nativeQuery = true)
    int insertIfAbsent(@Param("walletAddress") String walletAddress,
                       @Param("tokenSymbol") String tokenSymbol,
                       @Param("now") OffsetDateTime now);
}
