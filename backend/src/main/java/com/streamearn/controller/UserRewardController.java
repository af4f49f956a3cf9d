package com.streamearn.controller;

import com.streamearn.controller.dto.RewardHistoryResponse;
import com.streamearn.controller.dto.WalletResponse;
import com.streamearn.service.RewardStats;
import com.streamearn.service.TopContent;
import com.streamearn.service.UserLimits;
import com.streamearn.service.UserRewardQueryService;
import com.streamearn.service.WalletService;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/s2e")
public class UserRewardController {

    private final UserRewardQueryService userRewardQueryService;
    private final WalletService walletService;

    public UserRewardController(UserRewardQueryService userRewardQueryService, WalletService walletService) {
        this.userRewardQueryService = userRewardQueryService;
        this.walletService = walletService;
    }

    @GetMapping("/users/{identity}/history")
    public ResponseEntity<RewardHistoryResponse> getHistory(@PathVariable String identity,
                                                            @RequestParam(defaultValue = "20") int limit) {
        return ResponseEntity.ok(RewardHistoryResponse.of(identity, userRewardQueryService.history(identity, limit)));
    }

    @GetMapping("/users/{identity}/limits")
    public ResponseEntity<UserLimits> getLimits(@PathVariable String identity) {
        return ResponseEntity.ok(userRewardQueryService.limits(identity));
    }

    @GetMapping("/users/{identity}/stats")
    public ResponseEntity<RewardStats> getStats(@PathVariable String identity) {
        return ResponseEntity.ok(userRewardQueryService.stats(identity));
    }

    @GetMapping("/users/{identity}/top-content")
    public ResponseEntity<TopContent> getTopContent(@PathVariable String identity,
                                                    @RequestParam(defaultValue = "5") int limit) {
        return ResponseEntity.ok(userRewardQueryService.topContent(identity, limit));
    }

    @GetMapping("/wallets/{address}")
    public ResponseEntity<WalletResponse> getWallet(@PathVariable String address) {
        return ResponseEntity.ok(WalletResponse.of(address, walletService.getBalances(address)));
    }
}
