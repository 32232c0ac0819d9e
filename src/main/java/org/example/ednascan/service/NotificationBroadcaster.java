package org.example.ednascan.service;

import org.example.ednascan.dto.event.PipelineEvent;

/**
 * Fan-out of pipeline events to whoever is listening right now. Delivery is best-effort and
 * at-most-once; implementations must not throw back into the pipeline.
 */
public interface NotificationBroadcaster {
    void publish(PipelineEvent event);
}
