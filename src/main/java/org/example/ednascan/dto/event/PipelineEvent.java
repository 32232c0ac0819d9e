package org.example.ednascan.dto.event;

import lombok.AllArgsConstructor;
import lombok.Getter;
import org.example.ednascan.model.SampleStatus;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Message pushed to live observers, serialized as {@code {"type": ..., "data": {...}}}.
 */
@Getter
@AllArgsConstructor
public class PipelineEvent {

    public static final String SAMPLE_PROCESSED = "sample_processed";
    public static final String SAMPLE_ERROR = "sample_error";

    private final String type;
    private final Map<String, Object> data;

    public static PipelineEvent sampleProcessed(Long sampleId, SampleStatus status) {
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("sampleId", sampleId);
        data.put("status", status.value());
        return new PipelineEvent(SAMPLE_PROCESSED, Collections.unmodifiableMap(data));
    }

    public static PipelineEvent sampleError(Long sampleId, String error) {
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("sampleId", sampleId);
        data.put("error", error == null ? "Processing failed" : error);
        return new PipelineEvent(SAMPLE_ERROR, Collections.unmodifiableMap(data));
    }
}
