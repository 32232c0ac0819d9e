package org.example.ednascan.dto.response;

import lombok.Builder;
import lombok.Data;
import org.example.ednascan.model.SampleStatus;

import java.time.Instant;

@Data @Builder
public class SampleStatusResponse {
    private Long sampleId;
    private SampleStatus status;
    private String processedFormat;
    private Instant processedAt;
}
