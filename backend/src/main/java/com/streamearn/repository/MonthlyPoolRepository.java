package com.streamearn.repository;

import com.streamearn.model.MonthlyPool;
import jakarta.persistence.LockModeType;
import jakarta.persistence.QueryHint;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.jpa.repository.QueryHints;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.math.BigDecimal;
import java.time.OffsetDateTime;
import java.util.Optional;

@Repository
public interface MonthlyPoolRepository extends JpaRepository<MonthlyPool, String> {

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @QueryHints(@QueryHint(name = "jakarta.persistence.lock.timeout", value = "3000"))
    @Query("select p from MonthlyPool p where p.periodKey = :periodKey")
    Optional<MonthlyPool> findByPeriodKeyForUpdate(@Param("periodKey") String periodKey);

    @Modifying
    @Query(value = """
            INSERT INTO monthly_pool (
                period_key, token_symbol, total_amount, remaining_amount,
                artist_allocation, listener_allocation, artist_spent, listener_spent,
                halted, created_at, updated_at
            )
            VALUES (
                :periodKey, :tokenSymbol, :totalAmount, :totalAmount,
                :artistAllocation, :listenerAllocation, 0, 0,
                FALSE, :now, :now
            )
            ON CONFLICT (period_key) DO NOTHING
            """, nativeQuery = true)
    int insertIfAbsent(@Param("periodKey") String periodKey,
                       @Param("tokenSymbol") String tokenSymbol,
                       @Param("totalAmount") BigDecimal totalAmount,
                       @Param("artistAllocation") BigDecimal artistAllocation,
                       @Param("listenerAllocation") BigDecimal listenerAllocation,
                       @Param("now") OffsetDateTime now);
}
