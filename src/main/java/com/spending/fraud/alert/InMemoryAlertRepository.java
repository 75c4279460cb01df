package com.spending.fraud.alert;

import com.spending.fraud.core.model.EntityKind;

import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * In-memory implementation of AlertRepository.
 * Thread-safe via ConcurrentHashMap; ids are assigned from 1 upwards.
 */
public class InMemoryAlertRepository implements AlertRepository {

    private final Map<Long, Alert> alerts = new ConcurrentHashMap<>();
    private final AtomicLong sequence = new AtomicLong();

    @Override
    public Alert insert(Alert alert) {
        long id = sequence.incrementAndGet();
        Alert stored = new Alert(id, alert.alertType(), alert.severity(), alert.title(), alert.description(),
                alert.entityKind(), alert.entityId(), alert.evidence(), alert.status(), alert.createdAt());
        alerts.put(id, stored);
        return stored;
    }

    @Override
    public Optional<Alert> findById(long id) {
        return Optional.ofNullable(alerts.get(id));
    }

    @Override
    public Optional<Alert> findOpen(String alertType, EntityKind entityKind, Long entityId) {
        return alerts.values().stream()
                .filter(a -> a.blocks(alertType, entityKind, entityId))
                .min(Comparator.comparingLong(Alert::id));
    }

    @Override
    public Optional<Alert> updateStatus(long id, AlertStatus status) {
        return Optional.ofNullable(alerts.computeIfPresent(id, (k, alert) -> alert.withStatus(status)));
    }

    @Override
    public List<Alert> findAll() {
        return alerts.values().stream()
                .sorted(Comparator.comparingLong(Alert::id))
                .toList();
    }

    @Override
    public List<Alert> findByType(String alertType) {
        return alerts.values().stream()
                .filter(a -> a.alertType().equals(alertType))
                .sorted(Comparator.comparingLong(Alert::id))
                .toList();
    }

    @Override
    public int count() {
        return alerts.size();
    }
}
