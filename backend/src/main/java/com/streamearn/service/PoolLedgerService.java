package com.streamearn.service;

import com.streamearn.config.StreamEarnProperties;
import com.streamearn.model.MonthlyPool;
import com.streamearn.model.RewardRole;
import com.streamearn.repository.MonthlyPoolRepository;
import com.streamearn.repository.RewardAuditEntryRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.OffsetDateTime;
import java.util.Optional;

/**
 * Monthly reward budget ledger.
 *
 * The pool row of a period is the only serialization point for budget
 * consumption: every reservation locks it with SELECT ... FOR UPDATE and
 * updates it in the same transaction, so concurrent reservations can never
 * drive the remaining amount below zero.
 */
@Service
public class PoolLedgerService {

    private static final Logger log = LoggerFactory.getLogger(PoolLedgerService.class);

    private final MonthlyPoolRepository monthlyPoolRepository;
    private final RewardAuditEntryRepository rewardAuditEntryRepository;
    private final StreamEarnProperties streamEarnProperties;
    private final RewardCalendar rewardCalendar;

    public PoolLedgerService(MonthlyPoolRepository monthlyPoolRepository,
                             RewardAuditEntryRepository rewardAuditEntryRepository,
                             StreamEarnProperties streamEarnProperties,
                             RewardCalendar rewardCalendar) {
        this.monthlyPoolRepository = monthlyPoolRepository;
        this.rewardAuditEntryRepository = rewardAuditEntryRepository;
        this.streamEarnProperties = streamEarnProperties;
        this.rewardCalendar = rewardCalendar;
    }

    /**
     * Reserve {@code amount} from the period's budget for the given role.
     * The reservation is all or nothing; a request that does not fit in full
     * is rejected and leaves the pool untouched.
     *
     * @throws InvariantViolationException when the locked row is not balanced
     */
    @Transactional
    public ReservationOutcome tryReserve(String periodKey, RewardRole role, BigDecimal amount) {
        BigDecimal requested = requirePositiveAmount(amount);
        Optional<MonthlyPool> locked = lockPool(periodKey);
        if (locked.isEmpty()) {
            log.info("No reward pool for period {}; rejecting reservation of {}", periodKey, requested);
            return ReservationOutcome.INSUFFICIENT_FUNDS;
        }

        MonthlyPool pool = locked.get();
        if (pool.isHalted()) {
            log.warn("Reward pool {} is halted ({}); rejecting reservation", periodKey, pool.getHaltReason());
            return ReservationOutcome.HALTED;
        }
        verifyBalanced(pool);

        BigDecimal roleHeadroom = pool.allocationFor(role).subtract(pool.spentFor(role));
        if (requested.compareTo(pool.getRemainingAmount()) > 0 || requested.compareTo(roleHeadroom) > 0) {
            log.info("Insufficient funds in pool {} for {} reservation of {}: remaining={}, roleHeadroom={}",
                    periodKey, role, requested, pool.getRemainingAmount(), roleHeadroom);
            return ReservationOutcome.INSUFFICIENT_FUNDS;
        }

        pool.setSpentFor(role, MonetaryAmounts.checkedAdd(periodKey, pool.spentFor(role), requested));
        pool.setRemainingAmount(MonetaryAmounts.checkedSubtract(periodKey, pool.getRemainingAmount(), requested));
        pool.setUpdatedAt(rewardCalendar.now());
        verifyBalanced(pool);
        monthlyPoolRepository.save(pool);

        log.debug("Reserved {} for {} from pool {}, remaining {}", requested, role, periodKey, pool.getRemainingAmount());
        return ReservationOutcome.RESERVED;
    }

    /**
     * Status of a period. The current period reports its opening allocation
     * even before its first reservation.
     */
    @Transactional(readOnly = true)
    public PoolStatus getPoolStatus(String periodKey) {
        rewardCalendar.parsePeriodKey(periodKey);
        return monthlyPoolRepository.findById(periodKey)
                .map(PoolStatus::from)
                .orElseGet(() -> {
                    if (!periodKey.equals(rewardCalendar.currentPeriodKey())) {
                        throw new PoolNotFoundException(periodKey);
                    }
                    return PoolStatus.from(openingPool(periodKey, rewardCalendar.now()));
                });
    }

    /**
     * Freeze a period after an invariant violation. Runs in its own transaction
     * so the halt survives the rollback of the failed settlement.
     */
    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public void haltPeriod(String periodKey, String reason) {
        Optional<MonthlyPool> locked = monthlyPoolRepository.findByPeriodKeyForUpdate(periodKey);
        if (locked.isEmpty()) {
            log.error("Cannot halt reward pool {}: no such period", periodKey);
            return;
        }
        MonthlyPool pool = locked.get();
        if (pool.isHalted()) {
            return;
        }
        OffsetDateTime now = rewardCalendar.now();
        pool.setHalted(true);
        pool.setHaltReason(reason);
        pool.setHaltedAt(now);
        pool.setUpdatedAt(now);
        monthlyPoolRepository.save(pool);
        log.error("Reward pool {} halted: {}", periodKey, reason);
    }

    /**
     * Operator action: resume payouts for a halted period once its row balances again.
     *
     * @throws InvariantViolationException when the ledger is still inconsistent
     */
    @Transactional
    public PoolStatus resumePeriod(String periodKey) {
        rewardCalendar.parsePeriodKey(periodKey);
        MonthlyPool pool = monthlyPoolRepository.findByPeriodKeyForUpdate(periodKey)
                .orElseThrow(() -> new PoolNotFoundException(periodKey));
        if (!isBalanced(pool)) {
            throw new InvariantViolationException(periodKey, "Reward pool " + periodKey + " is still unbalanced");
        }
        if (pool.isHalted()) {
            pool.setHalted(false);
            pool.setHaltReason(null);
            pool.setHaltedAt(null);
            pool.setUpdatedAt(rewardCalendar.now());
            monthlyPoolRepository.save(pool);
            log.info("Reward pool {} resumed", periodKey);
        }
        return PoolStatus.from(pool);
    }

    @Transactional(readOnly = true)
    public PoolReconciliation reconcile(String periodKey) {
        rewardCalendar.parsePeriodKey(periodKey);
        MonthlyPool pool = monthlyPoolRepository.findById(periodKey)
                .orElseThrow(() -> new PoolNotFoundException(periodKey));
        BigDecimal ledgerSpent = pool.getTotalAmount().subtract(pool.getRemainingAmount());
        BigDecimal audited = rewardAuditEntryRepository.sumAmountByPeriodKey(periodKey);
        long auditedCount = rewardAuditEntryRepository.countByPeriodKey(periodKey);
        boolean matches = ledgerSpent.compareTo(audited) == 0;
        if (!matches) {
            log.warn("Reward pool {} does not reconcile: ledgerSpent={}, audited={}", periodKey, ledgerSpent, audited);
        }
        return new PoolReconciliation(periodKey, ledgerSpent, audited, auditedCount, isBalanced(pool), matches);
    }

    private Optional<MonthlyPool> lockPool(String periodKey) {
        rewardCalendar.parsePeriodKey(periodKey);
        if (periodKey.equals(rewardCalendar.currentPeriodKey())) {
            materialize(periodKey);
        }
        return monthlyPoolRepository.findByPeriodKeyForUpdate(periodKey);
    }

    private void materialize(String periodKey) {
        MonthlyPool opening = openingPool(periodKey, rewardCalendar.now());
        int inserted = monthlyPoolRepository.insertIfAbsent(
                periodKey,
                opening.getTokenSymbol(),
                opening.getTotalAmount(),
                opening.getArtistAllocation(),
                opening.getListenerAllocation(),
                opening.getCreatedAt()
        );
        if (inserted > 0) {
            log.info("Opened reward pool {}: total={}, artist={}, listener={}",
                    periodKey, opening.getTotalAmount(), opening.getArtistAllocation(), opening.getListenerAllocation());
        }
    }

    private MonthlyPool openingPool(String periodKey, OffsetDateTime now) {
        StreamEarnProperties.Pool config = streamEarnProperties.getPool();
        BigDecimal total = MonetaryAmounts.normalize(config.getOpeningAllocation());
        BigDecimal artist = MonetaryAmounts.normalize(total.multiply(config.getArtistShare()));

        MonthlyPool pool = new MonthlyPool();
        pool.setPeriodKey(periodKey);
        pool.setTokenSymbol(streamEarnProperties.getTokenSymbol());
        pool.setTotalAmount(total);
        pool.setRemainingAmount(total);
        pool.setArtistAllocation(artist);
        pool.setListenerAllocation(total.subtract(artist));
        pool.setArtistSpent(MonetaryAmounts.normalize(BigDecimal.ZERO));
        pool.setListenerSpent(MonetaryAmounts.normalize(BigDecimal.ZERO));
        pool.setCreatedAt(now);
        pool.setUpdatedAt(now);
        return pool;
    }

    private void verifyBalanced(MonthlyPool pool) {
        if (!isBalanced(pool)) {
            throw new InvariantViolationException(pool.getPeriodKey(), String.format(
                    "Reward pool %s is unbalanced: total=%s, remaining=%s, artistSpent=%s, listenerSpent=%s",
                    pool.getPeriodKey(),
                    pool.getTotalAmount(),
                    pool.getRemainingAmount(),
                    pool.getArtistSpent(),
                    pool.getListenerSpent()
            ));
        }
    }

    private static boolean isBalanced(MonthlyPool pool) {
        BigDecimal expectedRemaining = pool.getTotalAmount()
                .subtract(pool.getArtistSpent())
                .subtract(pool.getListenerSpent());
        return pool.getRemainingAmount().signum() >= 0
                && expectedRemaining.compareTo(pool.getRemainingAmount()) == 0
                && pool.getArtistSpent().compareTo(pool.getArtistAllocation()) <= 0
                && pool.getListenerSpent().compareTo(pool.getListenerAllocation()) <= 0;
    }

    private static BigDecimal requirePositiveAmount(BigDecimal amount) {
        if (amount == null || amount.signum() <= 0) {
            throw new IllegalArgumentException("Reservation amount must be positive");
        }
        if (amount.stripTrailingZeros().scale() > MonetaryAmounts.SCALE) {
            throw new IllegalArgumentException("Reservation amount has more than " + MonetaryAmounts.SCALE + " decimals");
        }
        return MonetaryAmounts.normalize(amount);
    }
}
