package com.streamearn.controller;

import com.streamearn.service.AdminRewardQueryService;
import com.streamearn.service.AdminStats;
import com.streamearn.service.EarningsWindow;
import com.streamearn.service.EndpointClass;
import com.streamearn.service.PoolLedgerService;
import com.streamearn.service.PoolReconciliation;
import com.streamearn.service.PoolStatus;
import com.streamearn.service.TopEarners;
import com.streamearn.web.RateLimited;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/**
 * Operator endpoints. Access control is enforced by the gateway in front of
 * this service.
 */
@RestController
@RequestMapping("/api/s2e/admin")
@RateLimited(EndpointClass.AUTHENTICATION)
public class AdminPoolController {

    private final PoolLedgerService poolLedgerService;
    private final AdminRewardQueryService adminRewardQueryService;

    public AdminPoolController(PoolLedgerService poolLedgerService, AdminRewardQueryService adminRewardQueryService) {
        this.poolLedgerService = poolLedgerService;
        this.adminRewardQueryService = adminRewardQueryService;
    }

    @GetMapping("/stats")
    public ResponseEntity<AdminStats> getStats() {
        return ResponseEntity.ok(adminRewardQueryService.stats());
    }

    /**
     * Top ten earners over {@code today}, {@code week} or {@code month}.
     */
    @GetMapping("/top-earners")
    public ResponseEntity<TopEarners> getTopEarners(@RequestParam(defaultValue = "today") String period) {
        return ResponseEntity.ok(adminRewardQueryService.topEarners(EarningsWindow.parse(period)));
    }

    @GetMapping("/pools/{periodKey}/reconciliation")
    public ResponseEntity<PoolReconciliation> reconcile(@PathVariable String periodKey) {
        return ResponseEntity.ok(poolLedgerService.reconcile(periodKey));
    }

    @PostMapping("/pools/{periodKey}/resume")
    public ResponseEntity<PoolStatus> resume(@PathVariable String periodKey) {
        return ResponseEntity.ok(poolLedgerService.resumePeriod(periodKey));
    }
}
