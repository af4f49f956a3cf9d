package com.streamearn.controller;

import com.streamearn.service.DashboardService;
import com.streamearn.service.DashboardSnapshot;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/s2e/dashboard")
@RequiredArgsConstructor
public class DashboardController {

    private final DashboardService dashboardService;

    @GetMapping
    public ResponseEntity<DashboardSnapshot> getDashboard() {
        return ResponseEntity.ok(dashboardService.getDashboardSnapshot());
    }
}
