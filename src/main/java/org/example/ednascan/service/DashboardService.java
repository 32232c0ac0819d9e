package org.example.ednascan.service;

import org.example.ednascan.dto.response.ActivityItem;
import org.example.ednascan.dto.response.DashboardStats;

import java.util.List;

public interface DashboardService {
    DashboardStats getStats();

    /** Recent detections, alerts and running samples merged newest first. */
    List<ActivityItem> getLiveActivity();
}
