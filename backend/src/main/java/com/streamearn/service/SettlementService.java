package com.streamearn.service;

import com.streamearn.config.StreamEarnProperties;
import com.streamearn.model.AuditOutcome;
import com.streamearn.model.RewardAuditEntry;
import com.streamearn.repository.RewardAuditEntryRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.OffsetDateTime;
import java.util.UUID;

/**
 * Settlement engine.
 * Reserves budget, credits the wallet and appends the audit entry as one unit:
 * either all three are persisted or none is.
 */
@Service
public class SettlementService {

    private static final Logger log = LoggerFactory.getLogger(SettlementService.class);

    private final PoolLedgerService poolLedgerService;
    private final WalletService walletService;
    private final RewardAuditEntryRepository rewardAuditEntryRepository;
    private final StreamEarnProperties streamEarnProperties;
    private final RewardCalendar rewardCalendar;

    public SettlementService(PoolLedgerService poolLedgerService,
                             WalletService walletService,
                             RewardAuditEntryRepository rewardAuditEntryRepository,
                             StreamEarnProperties streamEarnProperties,
                             RewardCalendar rewardCalendar) {
        this.poolLedgerService = poolLedgerService;
        this.walletService = walletService;
        this.rewardAuditEntryRepository = rewardAuditEntryRepository;
        this.streamEarnProperties = streamEarnProperties;
        this.rewardCalendar = rewardCalendar;
    }

    /**
     * Settle a priced reward.
     * Budget shortfalls and halted periods come back as {@code Failed} before
     * anything is written. Exceptions raised after the reservation roll the
     * whole transaction back.
     *
     * @param request identity, role, content, amount and period to settle
     * @return committed with the audit id, or failed with the reason
     */
    @Transactional(timeoutString = "${streamearn.settlement.timeout-seconds:5}")
    public SettlementResult settle(SettlementRequest request) {
        ReservationOutcome reservation = poolLedgerService.tryReserve(
                request.periodKey(),
                request.role(),
                request.amount()
        );
        if (reservation == ReservationOutcome.INSUFFICIENT_FUNDS) {
            return SettlementResult.failed(RejectionReason.INSUFFICIENT_FUNDS);
        }
        if (reservation == ReservationOutcome.HALTED) {
            return SettlementResult.failed(RejectionReason.INVARIANT_VIOLATION);
        }

        OffsetDateTime now = rewardCalendar.now();
        String tokenSymbol = streamEarnProperties.getTokenSymbol();
        walletService.credit(request.identity(), tokenSymbol, request.amount(), request.periodKey(), now);

        RewardAuditEntry entry = new RewardAuditEntry(
                UUID.randomUUID(),
                request.identity(),
                request.contentId(),
                request.role(),
                MonetaryAmounts.normalize(request.amount()),
                tokenSymbol,
                request.periodKey(),
                request.approvedSeconds(),
                request.bonusMultiplier(),
                AuditOutcome.COMMITTED,
                now
        );
        rewardAuditEntryRepository.save(entry);

        log.info("Settled {} {} to {} for {} activity on {} (period {}, audit {})",
                entry.getAmount(), tokenSymbol, request.identity(), request.role(),
                request.contentId(), request.periodKey(), entry.getAuditId());
        return SettlementResult.committed(entry.getAuditId());
    }
}
