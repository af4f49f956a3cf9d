package com.streamearn.repository;

import com.streamearn.model.RewardAuditEntry;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.math.BigDecimal;
import java.time.OffsetDateTime;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface RewardAuditEntryRepository extends JpaRepository<RewardAuditEntry, UUID> {

    List<RewardAuditEntry> findByIdentityOrderByCreatedAtDesc(String identity, Pageable pageable);

    Optional<RewardAuditEntry> findFirstByIdentityOrderByCreatedAtAsc(String identity);

    long countByPeriodKey(String periodKey);

    @Query("select coalesce(sum(a.amount), 0) from RewardAuditEntry a where a.periodKey = :periodKey")
    BigDecimal sumAmountByPeriodKey(@Param("periodKey") String periodKey);

    @Query("select coalesce(sum(a.amount), 0) from RewardAuditEntry a " +
            "where a.createdAt >= :from and a.createdAt < :to")
    BigDecimal sumAmountBetween(@Param("from") OffsetDateTime from, @Param("to") OffsetDateTime to);

    @Query("select coalesce(sum(a.amount), 0) from RewardAuditEntry a " +
            "where a.identity = :identity and a.createdAt >= :from and a.createdAt < :to")
    BigDecimal sumAmountByIdentityBetween(@Param("identity") String identity,
                                          @Param("from") OffsetDateTime from,
                                          @Param("to") OffsetDateTime to);

    @Query("select coalesce(sum(a.amount), 0) from RewardAuditEntry a where a.identity = :identity")
    BigDecimal sumAmountByIdentity(@Param("identity") String identity);

    @Query("select count(a) from RewardAuditEntry a where a.createdAt >= :from and a.createdAt < :to")
    long countBetween(@Param("from") OffsetDateTime from, @Param("to") OffsetDateTime to);

    @Query("select count(distinct a.identity) from RewardAuditEntry a " +
            "where a.createdAt >= :from and a.createdAt < :to")
    long countDistinctIdentitiesBetween(@Param("from") OffsetDateTime from, @Param("to") OffsetDateTime to);

    @Query("select distinct a.contentId from RewardAuditEntry a " +
            "where a.identity = :identity and a.createdAt >= :from and a.createdAt < :to")
    List<String> findDistinctContentIdsBetween(@Param("identity") String identity,
                                               @Param("from") OffsetDateTime from,
                                               @Param("to") OffsetDateTime to);

    @Query("select a.createdAt from RewardAuditEntry a " +
            "where a.identity = :identity and a.createdAt >= :from and a.createdAt < :to")
    List<OffsetDateTime> findCreatedAtBetween(@Param("identity") String identity,
                                              @Param("from") OffsetDateTime from,
                                              @Param("to") OffsetDateTime to);

    @Query("select coalesce(sum(a.amount), 0) from RewardAuditEntry a")
    BigDecimal sumAllAmounts();

    @Query("select a.identity as identity, sum(a.amount) as totalEarned, count(a) as settlementCount, " +
            "sum(a.approvedSeconds) as approvedSeconds from RewardAuditEntry a " +
            "where a.createdAt >= :from and a.createdAt < :to " +
            "group by a.identity order by sum(a.amount) desc, a.identity asc")
    List<EarnerTotal> findTopEarnersBetween(@Param("from") OffsetDateTime from,
                                            @Param("to") OffsetDateTime to,
                                            Pageable pageable);

    @Query("select a.contentId as contentId, sum(a.amount) as totalEarned, count(a) as settlementCount, " +
            "sum(a.approvedSeconds) as approvedSeconds from RewardAuditEntry a " +
            "where a.identity = :identity " +
            "group by a.contentId order by sum(a.approvedSeconds) desc, a.contentId asc")
    List<ContentTotal> findTopContentByIdentity(@Param("identity") String identity, Pageable pageable);

    interface EarnerTotal {
        String getIdentity();

        BigDecimal getTotalEarned();

        Long getSettlementCount();

        Long getApprovedSeconds();
    }

    interface ContentTotal {
        String getContentId();

        BigDecimal getTotalEarned();

        Long getSettlementCount();

        Long getApprovedSeconds();
    }
}
