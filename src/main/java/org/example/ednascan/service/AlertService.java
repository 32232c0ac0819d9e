package org.example.ednascan.service;

import org.example.ednascan.model.Alert;

import java.util.List;

public interface AlertService {
    List<Alert> getRecent(int limit);
    List<Alert> getUnread();
    List<Alert> getForSample(Long sampleId);
    boolean markAsRead(Long id);
}
