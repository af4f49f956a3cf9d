package com.streamearn.service;

import com.streamearn.config.StreamEarnProperties;
import com.streamearn.model.ContentDailyUsage;
import com.streamearn.model.SessionState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.PessimisticLockingFailureException;
import org.springframework.dao.QueryTimeoutException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.TransactionException;
import org.springframework.transaction.TransactionStatus;
import org.springframework.transaction.TransactionTimedOutException;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Instant;
import java.time.OffsetDateTime;

/**
 * Entry point for activity submissions.
 *
 * Runs the policy engine, the calculator and the settlement engine for one
 * request inside a single transaction bounded by the settlement timeout.
 * Rate limiting happens at the HTTP boundary before this service is reached.
 * Every failure path resolves to a rejection; nothing here pays by default.
 */
@Service
public class RewardService {

    private static final Logger log = LoggerFactory.getLogger(RewardService.class);

    /** Column width of identity and content id in every ledger table. */
    static final int MAX_KEY_LENGTH = 128;

    private final AntiFarmPolicyService antiFarmPolicyService;
    private final BonusEligibilityService bonusEligibilityService;
    private final RewardCalculator rewardCalculator;
    private final SettlementService settlementService;
    private final PoolLedgerService poolLedgerService;
    private final ContentOwnershipLookup contentOwnershipLookup;
    private final RewardMetrics rewardMetrics;
    private final RewardCalendar rewardCalendar;
    private final IdentityLocks identityLocks;
    private final TransactionTemplate transactionTemplate;

    public RewardService(AntiFarmPolicyService antiFarmPolicyService,
                         BonusEligibilityService bonusEligibilityService,
                         RewardCalculator rewardCalculator,
                         SettlementService settlementService,
                         PoolLedgerService poolLedgerService,
                         ContentOwnershipLookup contentOwnershipLookup,
                         RewardMetrics rewardMetrics,
                         RewardCalendar rewardCalendar,
                         IdentityLocks identityLocks,
                         PlatformTransactionManager transactionManager,
                         StreamEarnProperties streamEarnProperties) {
        this.antiFarmPolicyService = antiFarmPolicyService;
        this.bonusEligibilityService = bonusEligibilityService;
        this.rewardCalculator = rewardCalculator;
        this.settlementService = settlementService;
        this.poolLedgerService = poolLedgerService;
        this.contentOwnershipLookup = contentOwnershipLookup;
        this.rewardMetrics = rewardMetrics;
        this.rewardCalendar = rewardCalendar;
        this.identityLocks = identityLocks;
        this.transactionTemplate = new TransactionTemplate(transactionManager);
        this.transactionTemplate.setIsolationLevel(TransactionDefinition.ISOLATION_READ_COMMITTED);
        this.transactionTemplate.setTimeout(streamEarnProperties.getSettlement().getTimeoutSeconds());
    }

    /**
     * Submit verified activity for reward.
     *
     * @throws IllegalArgumentException when the submission is malformed
     * @throws UnknownContentException when the content is not known to the catalog
     */
    public RewardResult submitActivity(ActivitySubmission submission) {
        validate(submission);
        // Used for diagnostics only; the settled period is read after the session lock is held.
        String requestPeriodKey = rewardCalendar.currentPeriodKey();

        synchronized (identityLocks.of(submission.identity())) {
            RewardResult result;
            try {
                String contentOwner = contentOwnershipLookup.findOwner(submission.contentId())
                        .orElseThrow(() -> new UnknownContentException(submission.contentId()));
                result = transactionTemplate.execute(status -> processInTransaction(submission, contentOwner, status));
            } catch (InvariantViolationException ex) {
                log.error("Invariant violation while settling {} activity of {} on {} (period {}): {}",
                        submission.role(), submission.identity(), submission.contentId(), requestPeriodKey,
                        ex.getMessage(), ex);
                haltAfterViolation(ex.getPeriodKey() == null ? requestPeriodKey : ex.getPeriodKey(), ex.getMessage());
                result = RewardResult.rejected(RejectionReason.INVARIANT_VIOLATION);
            } catch (TransactionTimedOutException | QueryTimeoutException | PessimisticLockingFailureException ex) {
                log.error("Settlement timed out for {} activity of {} on {} (period {}, duration {}s)",
                        submission.role(), submission.identity(), submission.contentId(), requestPeriodKey,
                        submission.durationSeconds(), ex);
                result = RewardResult.rejected(RejectionReason.TIMEOUT);
            } catch (DataAccessException | TransactionException ex) {
                log.error("Settlement persistence failed for {} activity of {} on {} (period {}, duration {}s)",
                        submission.role(), submission.identity(), submission.contentId(), requestPeriodKey,
                        submission.durationSeconds(), ex);
                result = RewardResult.rejected(RejectionReason.PERSISTENCE_FAILURE);
            }
            if (result == null) {
                throw new IllegalStateException("Settlement transaction produced no result");
            }
            if (result.isPaid()) {
                rewardMetrics.recordPaid(submission.role(), result.amount());
            } else {
                rewardMetrics.recordRejected(result.reason());
            }
            return result;
        }
    }

    private void haltAfterViolation(String periodKey, String reason) {
        try {
            poolLedgerService.haltPeriod(periodKey, reason);
        } catch (RuntimeException haltFailure) {
            log.error("Failed to halt reward pool {} after invariant violation ({}); manual halt required",
                    periodKey, reason, haltFailure);
        }
    }

    private RewardResult processInTransaction(ActivitySubmission submission,
                                              String contentOwner,
                                              TransactionStatus status) {
        SessionState session = antiFarmPolicyService.lockSessionState(submission.identity(), rewardCalendar.now());
        Instant now = rewardCalendar.instant();
        OffsetDateTime nowAtZone = rewardCalendar.at(now);
        String periodKey = rewardCalendar.periodKeyOf(now);
        ContentDailyUsage usage = antiFarmPolicyService.loadContentUsage(
                submission.identity(),
                submission.contentId(),
                rewardCalendar.dateOf(now)
        );

        PolicyDecision decision = antiFarmPolicyService.evaluate(
                submission,
                contentOwner,
                antiFarmPolicyService.snapshot(session, usage),
                now
        );
        if (!decision.isApproved()) {
            log.info("Rejected {} activity of {} on {}: {}",
                    submission.role(), submission.identity(), submission.contentId(), decision.rejection());
            return RewardResult.rejected(decision.rejection());
        }

        BonusEligibility bonuses = bonusEligibilityService.resolve(submission.identity(), submission.contentId(), now);
        PricedReward priced = rewardCalculator.price(
                submission.role(),
                submission.durationSeconds(),
                decision.approvedSeconds(),
                bonuses
        );

        SettlementResult settlement = settlementService.settle(new SettlementRequest(
                submission.identity(),
                submission.role(),
                submission.contentId(),
                priced.amount(),
                periodKey,
                priced.pricedSeconds(),
                priced.bonusMultiplier()
        ));
        if (!settlement.isCommitted()) {
            status.setRollbackOnly();
            log.info("Settlement of {} for {} activity of {} on {} failed: {}",
                    priced.amount(), submission.role(), submission.identity(), submission.contentId(),
                    settlement.failure());
            return RewardResult.rejected(settlement.failure());
        }

        antiFarmPolicyService.recordAccepted(session, usage, decision, nowAtZone);
        return RewardResult.paid(priced.amount(), settlement.auditId());
    }

    private static void validate(ActivitySubmission submission) {
        if (submission == null) {
            throw new IllegalArgumentException("submission is required");
        }
        if (submission.identity() == null || submission.identity().isBlank()) {
            throw new IllegalArgumentException("identity is required");
        }
        if (submission.identity().length() > MAX_KEY_LENGTH) {
            throw new IllegalArgumentException("identity must be at most " + MAX_KEY_LENGTH + " characters");
        }
        if (submission.role() == null) {
            throw new IllegalArgumentException("role is required");
        }
        if (submission.contentId() == null || submission.contentId().isBlank()) {
            throw new IllegalArgumentException("contentId is required");
        }
        if (submission.contentId().length() > MAX_KEY_LENGTH) {
            throw new IllegalArgumentException("contentId must be at most " + MAX_KEY_LENGTH + " characters");
        }
        if (submission.durationSeconds() <= 0) {
            throw new IllegalArgumentException("durationSeconds must be positive");
        }
    }
}
