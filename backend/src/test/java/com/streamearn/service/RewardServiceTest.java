package com.streamearn.service;

import com.streamearn.config.StreamEarnProperties;
import com.streamearn.model.ContentDailyUsage;
import com.streamearn.model.ContentDailyUsageId;
import com.streamearn.model.RewardRole;
import com.streamearn.model.SessionState;
import com.streamearn.repository.ContentDailyUsageRepository;
import com.streamearn.repository.SessionStateRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.dao.QueryTimeoutException;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionStatus;
import org.springframework.transaction.support.SimpleTransactionStatus;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.doAnswer;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class RewardServiceTest {

    private static final String PERIOD = "2026-03";

    @Mock
    private SessionStateRepository sessionStateRepository;

    @Mock
    private ContentDailyUsageRepository contentDailyUsageRepository;

    @Mock
    private BonusEligibilityService bonusEligibilityService;

    @Mock
    private SettlementService settlementService;

    @Mock
    private PoolLedgerService poolLedgerService;

    @Mock
    private ContentOwnershipLookup contentOwnershipLookup;

    @Mock
    private RewardMetrics rewardMetrics;

    @Mock
    private PlatformTransactionManager transactionManager;

    private final Map<String, SessionState> sessions = new ConcurrentHashMap<>();
    private final Map<ContentDailyUsageId, ContentDailyUsage> usages = new ConcurrentHashMap<>();
    private MutableClock clock;
    private RewardService rewardService;

    @BeforeEach
    void setUp() {
        StreamEarnProperties properties = new StreamEarnProperties();
        clock = new MutableClock(Instant.parse("2026-03-15T12:00:00Z"));
        RewardCalendar calendar = new RewardCalendar(clock, properties);
        AntiFarmPolicyService policyService =
                new AntiFarmPolicyService(sessionStateRepository, contentDailyUsageRepository, properties);

        rewardService = new RewardService(
                policyService,
                bonusEligibilityService,
                new RewardCalculator(properties),
                settlementService,
                poolLedgerService,
                contentOwnershipLookup,
                rewardMetrics,
                calendar,
                new IdentityLocks(),
                transactionManager,
                properties
        );

        lenient().when(transactionManager.getTransaction(any())).thenAnswer(invocation -> new SimpleTransactionStatus());
        lenient().when(contentOwnershipLookup.findOwner("track-1")).thenReturn(Optional.of("artist-1"));
        lenient().when(bonusEligibilityService.resolve(anyString(), anyString(), any()))
                .thenReturn(BonusEligibility.none());
        lenient().when(sessionStateRepository.findByIdentityForUpdate(anyString())).thenAnswer(invocation -> {
            String identity = invocation.getArgument(0);
            return Optional.of(sessions.computeIfAbsent(identity, key -> {
                SessionState session = new SessionState();
                session.setIdentity(key);
                return session;
            }));
        });
        lenient().when(contentDailyUsageRepository.findById(any())).thenAnswer(invocation ->
                Optional.ofNullable(usages.get(invocation.<ContentDailyUsageId>getArgument(0))));
        lenient().when(contentDailyUsageRepository.save(any())).thenAnswer(invocation -> {
            ContentDailyUsage usage = invocation.getArgument(0);
            usages.put(new ContentDailyUsageId(usage.getIdentity(), usage.getContentId(), usage.getUsageDate()), usage);
            return usage;
        });
    }

    @Test
    void committedSettlementPaysAndAdvancesSession() {
        UUID auditId = UUID.randomUUID();
        when(settlementService.settle(any())).thenReturn(SettlementResult.committed(auditId));

        RewardResult result = rewardService.submitActivity(listen("listener-1", 600));

        assertTrue(result.isPaid());
        assertEquals(new BigDecimal("1.000000"), result.amount());
        assertEquals(auditId, result.auditId());
        assertEquals(600L, sessions.get("listener-1").getContinuousSeconds());
        assertNotNull(sessions.get("listener-1").getLastActivityAt());
        verify(rewardMetrics).recordPaid(RewardRole.LISTENER, new BigDecimal("1.000000"));

        ArgumentCaptor<SettlementRequest> captor = ArgumentCaptor.forClass(SettlementRequest.class);
        verify(settlementService).settle(captor.capture());
        assertEquals(PERIOD, captor.getValue().periodKey());
        assertEquals(600L, captor.getValue().approvedSeconds());
    }

    @Test
    void insufficientFundsRollsBackAndLeavesCountersUntouched() {
        when(settlementService.settle(any())).thenReturn(SettlementResult.failed(RejectionReason.INSUFFICIENT_FUNDS));

        RewardResult result = rewardService.submitActivity(listen("listener-1", 600));

        assertFalse(result.isPaid());
        assertEquals(RejectionReason.INSUFFICIENT_FUNDS, result.reason());
        assertEquals(0L, sessions.get("listener-1").getContinuousSeconds());
        verify(sessionStateRepository, never()).save(any());
        verify(contentDailyUsageRepository, never()).save(any());
        verify(rewardMetrics).recordRejected(RejectionReason.INSUFFICIENT_FUNDS);

        ArgumentCaptor<TransactionStatus> status = ArgumentCaptor.forClass(TransactionStatus.class);
        verify(transactionManager).commit(status.capture());
        assertTrue(status.getValue().isRollbackOnly());
    }

    @Test
    void policyRejectionNeverReachesSettlement() {
        RewardResult result = rewardService.submitActivity(
                new ActivitySubmission("artist-1", RewardRole.LISTENER, "track-1", 300));

        assertEquals(RejectionReason.SELF_CONSUMPTION_BLOCKED, result.reason());
        verifyNoInteractions(settlementService, bonusEligibilityService);
    }

    @Test
    void cooldownRejectsUntilThirtyMinutesHavePassed() {
        when(settlementService.settle(any())).thenAnswer(invocation -> SettlementResult.committed(UUID.randomUUID()));
        when(contentOwnershipLookup.findOwner("track-2")).thenReturn(Optional.of("artist-2"));

        assertTrue(rewardService.submitActivity(listen("listener-1", 300)).isPaid());
        clock.advance(Duration.ofMinutes(29));
        assertEquals(RejectionReason.COOLDOWN_ACTIVE,
                rewardService.submitActivity(
                        new ActivitySubmission("listener-1", RewardRole.LISTENER, "track-2", 300)).reason());
        clock.advance(Duration.ofMinutes(2));
        assertTrue(rewardService.submitActivity(
                new ActivitySubmission("listener-1", RewardRole.LISTENER, "track-2", 300)).isPaid());

        assertEquals(300L, sessions.get("listener-1").getContinuousSeconds());
    }

    @Test
    void persistenceFailureMapsToPersistenceRejection() {
        when(settlementService.settle(any())).thenThrow(new DataIntegrityViolationException("audit insert failed"));

        RewardResult result = rewardService.submitActivity(listen("listener-1", 600));

        assertEquals(RejectionReason.PERSISTENCE_FAILURE, result.reason());
        assertTrue(result.reason().retryable());
        verify(transactionManager).rollback(any());
        verify(sessionStateRepository, never()).save(any());
    }

    @Test
    void queryTimeoutMapsToTimeoutRejection() {
        when(settlementService.settle(any())).thenThrow(new QueryTimeoutException("pool lock wait"));

        RewardResult result = rewardService.submitActivity(listen("listener-1", 600));

        assertEquals(RejectionReason.TIMEOUT, result.reason());
        verify(rewardMetrics).recordRejected(RejectionReason.TIMEOUT);
    }

    @Test
    void invariantViolationHaltsThePeriod() {
        when(settlementService.settle(any()))
                .thenThrow(new InvariantViolationException(PERIOD, "Reward pool 2026-03 is unbalanced"));

        RewardResult result = rewardService.submitActivity(listen("listener-1", 600));

        assertEquals(RejectionReason.INVARIANT_VIOLATION, result.reason());
        verify(poolLedgerService).haltPeriod(PERIOD, "Reward pool 2026-03 is unbalanced");
    }

    @Test
    void failedHaltStillReportsInvariantViolation() {
        when(settlementService.settle(any()))
                .thenThrow(new InvariantViolationException(PERIOD, "Reward pool 2026-03 is unbalanced"));
        doThrow(new DataAccessResourceFailureException("connection refused"))
                .when(poolLedgerService).haltPeriod(anyString(), anyString());

        RewardResult result = rewardService.submitActivity(listen("listener-1", 600));

        assertEquals(RejectionReason.INVARIANT_VIOLATION, result.reason());
        verify(rewardMetrics).recordRejected(RejectionReason.INVARIANT_VIOLATION);
    }

    @Test
    void ownershipLookupFailureMapsToPersistenceRejection() {
        when(contentOwnershipLookup.findOwner("track-1"))
                .thenThrow(new DataAccessResourceFailureException("connection refused"));

        RewardResult result = rewardService.submitActivity(listen("listener-1", 600));

        assertFalse(result.isPaid());
        assertEquals(RejectionReason.PERSISTENCE_FAILURE, result.reason());
        verify(rewardMetrics).recordRejected(RejectionReason.PERSISTENCE_FAILURE);
        verifyNoInteractions(transactionManager, settlementService);
    }

    @Test
    void clockIsReadOnceTheSessionLockIsHeld() {
        clock.set(Instant.parse("2026-03-31T23:58:00Z"));
        when(settlementService.settle(any())).thenReturn(SettlementResult.committed(UUID.randomUUID()));
        doAnswer(invocation -> {
            clock.advance(Duration.ofMinutes(5));
            SessionState session = new SessionState();
            session.setIdentity(invocation.getArgument(0));
            sessions.put(session.getIdentity(), session);
            return Optional.of(session);
        }).when(sessionStateRepository).findByIdentityForUpdate("listener-1");

        assertTrue(rewardService.submitActivity(listen("listener-1", 600)).isPaid());

        assertEquals(OffsetDateTime.parse("2026-04-01T00:03:00Z"), sessions.get("listener-1").getLastActivityAt());
        ArgumentCaptor<SettlementRequest> captor = ArgumentCaptor.forClass(SettlementRequest.class);
        verify(settlementService).settle(captor.capture());
        assertEquals("2026-04", captor.getValue().periodKey());
    }

    @Test
    void unknownContentIsRejectedBeforeAnyTransaction() {
        when(contentOwnershipLookup.findOwner("missing")).thenReturn(Optional.empty());

        assertThrows(UnknownContentException.class, () -> rewardService.submitActivity(
                new ActivitySubmission("listener-1", RewardRole.LISTENER, "missing", 60)));
        verifyNoInteractions(transactionManager);
    }

    @Test
    void malformedSubmissionsAreRejected() {
        assertThrows(IllegalArgumentException.class, () -> rewardService.submitActivity(listen("listener-1", 0)));
        assertThrows(IllegalArgumentException.class, () -> rewardService.submitActivity(listen(" ", 60)));
        assertThrows(IllegalArgumentException.class, () -> rewardService.submitActivity(
                new ActivitySubmission("listener-1", null, "track-1", 60)));
        assertThrows(IllegalArgumentException.class, () -> rewardService.submitActivity(listen("w".repeat(129), 60)));
        assertThrows(IllegalArgumentException.class, () -> rewardService.submitActivity(
                new ActivitySubmission("listener-1", RewardRole.LISTENER, "t".repeat(129), 60)));
        verifyNoInteractions(transactionManager, contentOwnershipLookup);
    }

    @Test
    void concurrentDuplicateSubmissionsPayOnlyOnce() throws Exception {
        when(settlementService.settle(any())).thenAnswer(invocation -> SettlementResult.committed(UUID.randomUUID()));

        int threads = 8;
        ExecutorService executor = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<RewardResult>> futures = new ArrayList<>();
        try {
            for (int i = 0; i < threads; i++) {
                futures.add(executor.submit(() -> {
                    start.await();
                    return rewardService.submitActivity(listen("listener-1", 600));
                }));
            }
            start.countDown();

            int paid = 0;
            for (Future<RewardResult> future : futures) {
                RewardResult result = future.get(10, TimeUnit.SECONDS);
                if (result.isPaid()) {
                    paid++;
                } else {
                    assertEquals(RejectionReason.CONTENT_DAILY_LIMIT_EXCEEDED, result.reason());
                }
            }
            assertEquals(1, paid);
            verify(settlementService, times(1)).settle(any());
        } finally {
            executor.shutdownNow();
        }
    }

    private static ActivitySubmission listen(String identity, long seconds) {
        return new ActivitySubmission(identity, RewardRole.LISTENER, "track-1", seconds);
    }
}
