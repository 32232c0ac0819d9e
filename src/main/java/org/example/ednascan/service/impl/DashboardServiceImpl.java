package org.example.ednascan.service.impl;

import lombok.RequiredArgsConstructor;
import org.example.ednascan.dto.response.ActivityItem;
import org.example.ednascan.dto.response.DashboardStats;
import org.example.ednascan.model.SampleStatus;
import org.example.ednascan.repository.AlertRepository;
import org.example.ednascan.repository.DetectionRepository;
import org.example.ednascan.repository.SampleRepository;
import org.example.ednascan.repository.SpeciesRepository;
import org.example.ednascan.service.DashboardService;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

@Service
@RequiredArgsConstructor
public class DashboardServiceImpl implements DashboardService {

    static final int RECENT_PER_SOURCE = 5;
    static final int ACTIVITY_LIMIT = 10;

    private final SpeciesRepository speciesRepository;
    private final SampleRepository sampleRepository;
    private final DetectionRepository detectionRepository;
    private final AlertRepository alertRepository;

    @Override
    @Transactional(readOnly = true)
    public DashboardStats getStats() {
        return DashboardStats.builder()
                .speciesCount(speciesRepository.count())
                .activeSamples(sampleRepository.countByStatus(SampleStatus.PROCESSING))
                .alertsCount(alertRepository.countByReadFalse())
                .build();
    }

    @Override
    @Transactional(readOnly = true)
    public List<ActivityItem> getLiveActivity() {
        List<ActivityItem> items = new ArrayList<>();
        detectionRepository.findAllByOrderByDetectedAtDesc(PageRequest.of(0, RECENT_PER_SOURCE))
                .forEach(d -> items.add(new ActivityItem(
                        ActivityItem.DETECTION, d.getDetectedAt(), "New species detected", d)));
        alertRepository.findAllByOrderByCreatedAtDesc(PageRequest.of(0, RECENT_PER_SOURCE))
                .forEach(a -> items.add(new ActivityItem(
                        ActivityItem.ALERT, a.getCreatedAt(), a.getMessage(), a)));
        sampleRepository.findByStatusOrderByUploadedAtAsc(SampleStatus.PROCESSING)
                .forEach(s -> items.add(new ActivityItem(
                        ActivityItem.PROCESSING, s.getUploadedAt(), "Sample being processed", s)));

        items.sort(Comparator.comparing(ActivityItem::getTimestamp,
                Comparator.nullsLast(Comparator.reverseOrder())));
        return items.size() > ACTIVITY_LIMIT ? new ArrayList<>(items.subList(0, ACTIVITY_LIMIT)) : items;
    }
}
