package org.example.ednascan.controller;

import lombok.RequiredArgsConstructor;
import org.example.ednascan.dto.response.ActivityItem;
import org.example.ednascan.dto.response.DashboardStats;
import org.example.ednascan.service.DashboardService;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/api")
@RequiredArgsConstructor
public class DashboardController {

    private final DashboardService dashboardService;

    @GetMapping("/dashboard/stats")
    public DashboardStats stats() {
        return dashboardService.getStats();
    }

    @GetMapping("/live/activity")
    public List<ActivityItem> liveActivity() {
        return dashboardService.getLiveActivity();
    }
}
