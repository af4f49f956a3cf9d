package com.streamearn.service;

import com.streamearn.config.StreamEarnProperties;
import com.streamearn.repository.ContentDailyUsageRepository;
import com.streamearn.repository.RewardAuditEntryRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.List;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class DashboardServiceTest {

    private static final LocalDate TODAY = LocalDate.of(2026, 3, 15);

    @Mock
    private PoolLedgerService poolLedgerService;

    @Mock
    private RewardAuditEntryRepository rewardAuditEntryRepository;

    @Mock
    private ContentDailyUsageRepository contentDailyUsageRepository;

    @Mock
    private RewardMetrics rewardMetrics;

    private DashboardService dashboardService;

    @BeforeEach
    void setUp() {
        StreamEarnProperties properties = new StreamEarnProperties();
        RewardCalendar calendar = new RewardCalendar(
                Clock.fixed(Instant.parse("2026-03-15T12:00:00Z"), ZoneOffset.UTC), properties);
        dashboardService = new DashboardService(poolLedgerService, rewardAuditEntryRepository,
                contentDailyUsageRepository, rewardMetrics, calendar, properties);
    }

    @Test
    void healthyPeriodRaisesNoAlerts() {
        when(poolLedgerService.getPoolStatus("2026-03")).thenReturn(status("1500000", false));
        when(rewardAuditEntryRepository.sumAmountBetween(any(), any())).thenReturn(new BigDecimal("1200.000000"));
        when(rewardAuditEntryRepository.countDistinctIdentitiesBetween(any(), any())).thenReturn(40L);
        when(rewardAuditEntryRepository.countBetween(any(), any())).thenReturn(120L);
        when(contentDailyUsageRepository.sumSecondsByIdentityOn(TODAY))
                .thenReturn(List.of(usage("a", 600L), usage("b", 5_400L)));

        DashboardSnapshot snapshot = dashboardService.getDashboardSnapshot();

        assertEquals("2026-03", snapshot.periodKey());
        // 2,000,000 over 31 days
        assertEquals(new BigDecimal("64516.129032"), snapshot.expectedDailyEmission());
        assertEquals(40L, snapshot.activeIdentitiesToday());
        assertEquals(0, snapshot.anomalyScore());
        assertTrue(snapshot.alerts().isEmpty());
    }

    @Test
    void stressedPeriodRaisesEveryAlert() {
        when(poolLedgerService.getPoolStatus("2026-03")).thenReturn(status("100000", true));
        when(rewardAuditEntryRepository.sumAmountBetween(any(), any())).thenReturn(new BigDecimal("100000"));
        when(rewardAuditEntryRepository.countDistinctIdentitiesBetween(any(), any())).thenReturn(2L);
        when(rewardAuditEntryRepository.countBetween(any(), any())).thenReturn(60L);
        when(contentDailyUsageRepository.sumSecondsByIdentityOn(TODAY))
                .thenReturn(List.of(usage("a", 5_400L), usage("b", 6_000L)));

        DashboardSnapshot snapshot = dashboardService.getDashboardSnapshot();

        assertEquals(80, snapshot.anomalyScore());
        assertEquals(
                List.of(DashboardAlert.Type.POOL_HALTED, DashboardAlert.Type.LOW_POOL_BALANCE,
                        DashboardAlert.Type.HIGH_DAILY_EMISSION, DashboardAlert.Type.ANOMALY_DETECTED),
                snapshot.alerts().stream().map(DashboardAlert::type).collect(Collectors.toList()));
    }

    @Test
    void anomalyScoreWeighsHeavyShareAndSettlementRate() {
        assertEquals(0, DashboardService.anomalyScore(0, 0, 0, 0));
        assertEquals(25, DashboardService.anomalyScore(10, 6, 10, 50));
        assertEquals(50, DashboardService.anomalyScore(10, 9, 10, 50));
        assertEquals(15, DashboardService.anomalyScore(10, 0, 10, 150));
        assertEquals(80, DashboardService.anomalyScore(10, 10, 1, 21));
    }

    private static PoolStatus status(String remaining, boolean halted) {
        BigDecimal total = new BigDecimal("2000000.000000");
        BigDecimal left = new BigDecimal(remaining);
        BigDecimal spent = total.subtract(left);
        return new PoolStatus("2026-03", "DYO", total, left, PoolStatus.percentOf(left, total),
                new BigDecimal("1200000.000000"), new BigDecimal("800000.000000"),
                spent.min(new BigDecimal("1200000")), spent.subtract(spent.min(new BigDecimal("1200000"))),
                halted, halted ? "ledger drift" : null);
    }

    private static ContentDailyUsageRepository.IdentityUsageTotal usage(String identity, long seconds) {
        return new ContentDailyUsageRepository.IdentityUsageTotal() {
            @Override
            public String getIdentity() {
                return identity;
            }

            @Override
            public Long getSecondsAccrued() {
                return seconds;
            }
        };
    }
}
