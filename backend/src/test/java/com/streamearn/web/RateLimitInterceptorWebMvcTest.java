package com.streamearn.web;

import com.streamearn.controller.AdminPoolController;
import com.streamearn.controller.PoolController;
import com.streamearn.service.AdminRewardQueryService;
import com.streamearn.service.EndpointClass;
import com.streamearn.service.PoolLedgerService;
import com.streamearn.service.RateController;
import com.streamearn.service.RateDecision;
import com.streamearn.service.RewardCalendar;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.context.annotation.Import;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

import java.time.Duration;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.header;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest({PoolController.class, AdminPoolController.class})
@Import(RateLimitWebConfig.class)
class RateLimitInterceptorWebMvcTest {

    @Autowired
    private MockMvc mockMvc;

    @MockitoBean
    private RateController rateController;

    @MockitoBean
    private PoolLedgerService poolLedgerService;

    @MockitoBean
    private RewardCalendar rewardCalendar;

    @MockitoBean
    private AdminRewardQueryService adminRewardQueryService;

    @Test
    void throttledRequestGets429WithRetryAfterAndNeverReachesHandler() throws Exception {
        when(rateController.admit(anyString(), any())).thenReturn(RateDecision.throttled(Duration.ofMillis(41_200)));

        mockMvc.perform(get("/api/s2e/pools/2026-03")
                        .header(AuthenticatedIdentity.IDENTITY_HEADER, "wallet-1"))
                .andExpect(status().isTooManyRequests())
                .andExpect(header().string("Retry-After", "42"))
                .andExpect(header().string(RateLimitInterceptor.REMAINING_HEADER, "0"))
                .andExpect(jsonPath("$.status").value("REJECTED"))
                .andExpect(jsonPath("$.reason").value("THROTTLED"))
                .andExpect(jsonPath("$.category").value("RATE"))
                .andExpect(jsonPath("$.retryAfterSeconds").value(42));

        verifyNoInteractions(poolLedgerService);
    }

    @Test
    void anonymousRequestsAreKeyedByClientAddress() throws Exception {
        when(rateController.admit(anyString(), any())).thenReturn(RateDecision.allowed(99));

        mockMvc.perform(get("/api/s2e/pools/2026-03").with(request -> {
                    request.setRemoteAddr("203.0.113.7");
                    return request;
                }))
                .andExpect(header().string(RateLimitInterceptor.REMAINING_HEADER, "99"));

        verify(rateController).admit("addr:203.0.113.7", EndpointClass.PUBLIC);
    }

    @Test
    void classLevelAnnotationAppliesToEveryAdminHandler() throws Exception {
        when(rateController.admit(anyString(), any())).thenReturn(RateDecision.allowed(9));

        mockMvc.perform(get("/api/s2e/admin/pools/2026-03/reconciliation")
                .header(AuthenticatedIdentity.IDENTITY_HEADER, " operator-1 "));

        verify(rateController).admit(eq("operator-1"), eq(EndpointClass.AUTHENTICATION));
    }

    @Test
    void publicRequestsIgnoreClientSuppliedIdentity() throws Exception {
        when(rateController.admit(anyString(), any())).thenReturn(RateDecision.allowed(98));

        for (String rotated : new String[] {"wallet-a", "wallet-b"}) {
            mockMvc.perform(get("/api/s2e/pools/2026-03")
                            .header(AuthenticatedIdentity.IDENTITY_HEADER, rotated)
                            .with(request -> {
                                request.setRemoteAddr("198.51.100.4");
                                return request;
                            }))
                    .andExpect(status().isOk());
        }

        verify(rateController, times(2)).admit("addr:198.51.100.4", EndpointClass.PUBLIC);
    }
}
