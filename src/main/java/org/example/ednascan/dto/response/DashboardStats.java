package org.example.ednascan.dto.response;

import lombok.Builder;
import lombok.Data;

@Data @Builder
public class DashboardStats {
    private long speciesCount;
    private long activeSamples;
    /** Unread alerts only. */
    private long alertsCount;
}
