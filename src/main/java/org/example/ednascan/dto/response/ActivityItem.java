package org.example.ednascan.dto.response;

import lombok.AllArgsConstructor;
import lombok.Getter;

import java.time.Instant;

@Getter
@AllArgsConstructor
public class ActivityItem {
    public static final String DETECTION = "detection";
    public static final String ALERT = "alert";
    public static final String PROCESSING = "processing";

    private String type;
    private Instant timestamp;
    private String message;
    private Object data;
}
