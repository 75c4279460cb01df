package com.spending.fraud.alert;

import com.spending.fraud.exception.EntityNotFoundException;
import com.spending.fraud.exception.ValidationException;
import com.spending.fraud.lock.KeyedLock;
import com.spending.fraud.lock.StripedKeyedLock;
import com.spending.fraud.metrics.MetricsService;
import com.spending.fraud.metrics.NoOpMetricsService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Creates alerts with duplicate suppression. For a given alert type and entity at most one
 * open alert exists: the check and the insert run under a lock on that key, so concurrent
 * rules cannot both insert.
 */
public class AlertEngine {
    private static final Logger log = LoggerFactory.getLogger(AlertEngine.class);

    private final AlertRepository repository;
    private final KeyedLock lock;
    private final EvidenceSerializer serializer;
    private final MetricsService metrics;
    private final Clock clock;

    public AlertEngine(AlertRepository repository) {
        this(repository, new StripedKeyedLock(), new EvidenceSerializer(), new NoOpMetricsService(), Clock.systemUTC());
    }

    public AlertEngine(AlertRepository repository, KeyedLock lock, EvidenceSerializer serializer,
                       MetricsService metrics, Clock clock) {
        this.repository = repository;
        this.lock = lock;
        this.serializer = serializer;
        this.metrics = metrics;
        this.clock = clock;
    }

    public AlertCreationResult createAlert(AlertRequest request) {
        return createAlert(request, false);
    }

    /**
     * Inserts an alert unless an open alert exists for the same type and entity.
     * Requests without an entity are never suppressed.
     */
    public AlertCreationResult createAlert(AlertRequest request, boolean skipDuplicateCheck) {
        Map<String, Object> evidence = serializer.toMap(request.evidence());
        if (skipDuplicateCheck || !request.hasSubject()) {
            return insert(request, evidence);
        }
        return lock.withLock(lockKey(request.alertType(), request.entityKind(), request.entityId()), () -> {
            Optional<Alert> open = repository.findOpen(request.alertType(), request.entityKind(), request.entityId());
            if (open.isPresent()) {
                log.debug("alert.duplicate type={} entity={}:{} existingId={}",
                        request.alertType(), request.entityKind(), request.entityId(), open.get().id());
                metrics.incrementAlertSuppressed(request.alertType());
                return AlertCreationResult.duplicate(open.get().id());
            }
            return insert(request, evidence);
        });
    }

    /**
     * Moves an alert to a new status. Reopening is refused while another open alert exists
     * for the same type and entity.
     *
     * @throws EntityNotFoundException if no alert has the id
     * @throws ValidationException if reopening would create a second open alert
     */
    public Alert updateStatus(long alertId, AlertStatus status) {
        Alert subject = repository.findById(alertId)
                .orElseThrow(() -> new EntityNotFoundException("Alert not found: " + alertId));
        return lock.withLock(lockKey(subject.alertType(), subject.entityKind(), subject.entityId()), () -> {
            // type and entity never change, but the status may have moved before the lock was taken
            Alert current = repository.findById(alertId)
                    .orElseThrow(() -> new EntityNotFoundException("Alert not found: " + alertId));
            if (status.isOpen() && !current.status().isOpen() && current.entityId() != null) {
                Optional<Alert> open = repository.findOpen(current.alertType(), current.entityKind(), current.entityId());
                if (open.isPresent() && open.get().id() != alertId) {
                    throw new ValidationException("Alert " + alertId + " cannot be reopened: alert "
                            + open.get().id() + " is already open for the same entity");
                }
            }
            Alert updated = repository.updateStatus(alertId, status)
                    .orElseThrow(() -> new EntityNotFoundException("Alert not found: " + alertId));
            log.info("alert.status id={} from={} to={}", alertId, current.status(), status);
            return updated;
        });
    }

    public Optional<Alert> findById(long alertId) {
        return repository.findById(alertId);
    }

    public List<Alert> findAll() {
        return repository.findAll();
    }

    public AlertRepository getRepository() {
        return repository;
    }

    private AlertCreationResult insert(AlertRequest request, Map<String, Object> evidence) {
        Alert alert = repository.insert(new Alert(0L, request.alertType(), request.severity(), request.title(),
                request.description(), request.entityKind(), request.entityId(), evidence,
                AlertStatus.NEW, clock.instant()));
        log.info("alert.created id={} type={} severity={} entity={}:{}",
                alert.id(), alert.alertType(), alert.severity(), alert.entityKind(), alert.entityId());
        metrics.incrementAlertCreated(request.alertType());
        return AlertCreationResult.created(alert.id());
    }

    private static String lockKey(String alertType, Object entityKind, Long entityId) {
        return "alert|" + alertType + "|" + entityKind + "|" + entityId;
    }
}
