package org.example.ednascan.service.impl;

import org.springframework.stereotype.Component;

import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

@Component
public class SampleLockRegistry {

    private final ConcurrentHashMap<Long, String> owners = new ConcurrentHashMap<>();

    public Optional<String> tryAcquire(Long sampleId) {
        String token = UUID.randomUUID().toString();
        String existing = owners.putIfAbsent(sampleId, token);
        return existing == null ? Optional.of(token) : Optional.empty();
    }

    // no-op unless the token still owns the sample
    public boolean release(Long sampleId, String token) {
        return owners.remove(sampleId, token);
    }

    public boolean isHeld(Long sampleId) {
        return owners.containsKey(sampleId);
    }

    public Set<Long> heldSampleIds() {
        return Set.copyOf(owners.keySet());
    }
}
