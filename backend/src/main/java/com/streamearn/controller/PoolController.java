package com.streamearn.controller;

import com.streamearn.service.PoolLedgerService;
import com.streamearn.service.PoolStatus;
import com.streamearn.service.RewardCalendar;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/s2e/pools")
public class PoolController {

    private final PoolLedgerService poolLedgerService;
    private final RewardCalendar rewardCalendar;

    public PoolController(PoolLedgerService poolLedgerService, RewardCalendar rewardCalendar) {
        this.poolLedgerService = poolLedgerService;
        this.rewardCalendar = rewardCalendar;
    }

    @GetMapping("/current")
    public ResponseEntity<PoolStatus> getCurrentPool() {
        return ResponseEntity.ok(poolLedgerService.getPoolStatus(rewardCalendar.currentPeriodKey()));
    }

    @GetMapping("/{periodKey}")
    public ResponseEntity<PoolStatus> getPool(@PathVariable String periodKey) {
        return ResponseEntity.ok(poolLedgerService.getPoolStatus(periodKey));
    }
}
