package com.streamearn.controller;

import com.streamearn.config.StreamEarnProperties;
import com.streamearn.controller.dto.ActivityResultResponse;
import com.streamearn.controller.dto.SubmitActivityRequest;
import com.streamearn.model.RewardRole;
import com.streamearn.service.ActivitySubmission;
import com.streamearn.service.EndpointClass;
import com.streamearn.service.RewardResult;
import com.streamearn.service.RewardService;
import com.streamearn.web.AuthenticatedIdentity;
import com.streamearn.web.RateLimited;
import jakarta.validation.Valid;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Locale;

@RestController
@RequestMapping("/api/s2e")
public class ActivityController {

    private final RewardService rewardService;
    private final StreamEarnProperties streamEarnProperties;

    public ActivityController(RewardService rewardService, StreamEarnProperties streamEarnProperties) {
        this.rewardService = rewardService;
        this.streamEarnProperties = streamEarnProperties;
    }

    /**
     * Submit verified streaming activity for a reward.
     * Policy and budget rejections are regular 200 results; infrastructure
     * failures map to 503 and halted periods to 500.
     */
    @PostMapping("/activity")
    @RateLimited(EndpointClass.FINANCIAL)
    public ResponseEntity<ActivityResultResponse> submitActivity(
            @RequestHeader(AuthenticatedIdentity.IDENTITY_HEADER) String identity,
            @RequestHeader(AuthenticatedIdentity.ROLE_HEADER) String role,
            @Valid @RequestBody SubmitActivityRequest request) {
        RewardResult result = rewardService.submitActivity(new ActivitySubmission(
                identity.trim(),
                parseRole(role),
                request.contentId().trim(),
                request.durationSeconds()
        ));
        ActivityResultResponse body = ActivityResultResponse.from(result, streamEarnProperties.getTokenSymbol());
        if (result.isPaid()) {
            return ResponseEntity.ok(body);
        }
        return ResponseEntity.status(result.reason().httpStatus()).body(body);
    }

    private static RewardRole parseRole(String role) {
        try {
            return RewardRole.valueOf(role.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException ex) {
            throw new IllegalArgumentException("Unknown role: " + role);
        }
    }
}
