package org.example.ednascan.service.impl;

import lombok.RequiredArgsConstructor;
import org.example.ednascan.model.Alert;
import org.example.ednascan.model.Detection;
import org.example.ednascan.repository.AlertRepository;
import org.example.ednascan.repository.DetectionRepository;
import org.example.ednascan.service.AlertService;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;

@Service
@RequiredArgsConstructor
public class AlertServiceImpl implements AlertService {

    private final AlertRepository alertRepository;
    private final DetectionRepository detectionRepository;

    @Override
    @Transactional(readOnly = true)
    public List<Alert> getRecent(int limit) {
        return alertRepository.findAllByOrderByCreatedAtDesc(PageRequest.of(0, Math.max(1, limit)));
    }

    @Override
    @Transactional(readOnly = true)
    public List<Alert> getUnread() {
        return alertRepository.findByReadFalseOrderByCreatedAtDesc();
    }

    @Override
    @Transactional(readOnly = true)
    public List<Alert> getForSample(Long sampleId) {
        List<Long> detectionIds = detectionRepository.findBySampleIdOrderByConfidenceDesc(sampleId).stream()
                .map(Detection::getId)
                .toList();
        if (detectionIds.isEmpty()) {
            return List.of();
        }
        return alertRepository.findByDetectionIdIn(detectionIds);
    }

    @Override
    @Transactional
    public boolean markAsRead(Long id) {
        return alertRepository.markRead(id) > 0;
    }
}
