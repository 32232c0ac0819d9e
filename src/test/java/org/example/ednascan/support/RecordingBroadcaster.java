package org.example.ednascan.support;

import org.example.ednascan.dto.event.PipelineEvent;
import org.example.ednascan.service.NotificationBroadcaster;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

public class RecordingBroadcaster implements NotificationBroadcaster {
    private final List<PipelineEvent> events = new CopyOnWriteArrayList<>();

    @Override
    public void publish(PipelineEvent event) {
        events.add(event);
    }

    public List<PipelineEvent> events() {
        return events;
    }

    public List<PipelineEvent> eventsFor(Long sampleId) {
        return events.stream()
                .filter(e -> sampleId.equals(e.getData().get("sampleId")))
                .toList();
    }

    public void clear() {
        events.clear();
    }
}
