package com.queryguard.service.core.policy;

import com.queryguard.service.core.shape.ShapeKeys;
import java.time.Clock;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.stream.Stream;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * One policy per shape key; later writes overwrite earlier ones. Unknown shapes resolve to
 * {@link PolicyAction#ALLOW}. A rejection stays in place until a later {@code setPolicy} call
 * replaces it.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class GovernancePolicyStore {

    private final ConcurrentMap<String, PolicyRecord> policies = new ConcurrentHashMap<>();
    private final List<PolicyChangeListener> listeners = new CopyOnWriteArrayList<>();
    private final Clock clock;

    public PolicyRecord setPolicy(String shapeKey, PolicyAction action, String comment) {
        return setPolicy(shapeKey, action, comment, PolicySource.MANUAL);
    }

    public PolicyRecord setPolicy(String shapeKey, PolicyAction action, String comment, PolicySource source) {
        String key = ShapeKeys.normalize(shapeKey);
        if (action == null) {
            throw new IllegalArgumentException("action is required");
        }
        PolicySource effectiveSource = source == null ? PolicySource.MANUAL : source;
        String effectiveComment = comment == null || comment.isBlank() ? null : comment.trim();
        PolicyRecord stored = policies.compute(key, (k, existing) -> {
            if (existing != null && existing.sameSettings(action, effectiveComment, effectiveSource)) {
                return existing;
            }
            return new PolicyRecord(k, action, effectiveComment, clock.instant(), effectiveSource);
        });
        log.info(
                "Policy set shape={} action={} source={} comment={}",
                key,
                stored.action(),
                stored.source(),
                stored.comment());
        notifyListeners(stored);
        return stored;
    }

    public PolicyRecord getPolicy(String shapeKey) {
        String key = ShapeKeys.normalize(shapeKey);
        PolicyRecord record = policies.get(key);
        return record != null ? record : PolicyRecord.defaultAllow(key);
    }

    public Optional<PolicyRecord> findPolicy(String shapeKey) {
        return Optional.ofNullable(policies.get(ShapeKeys.normalize(shapeKey)));
    }

    /** Lazy view over the active records; iteration order is unspecified. */
    public Stream<PolicyRecord> listPolicies() {
        return policies.values().stream();
    }

    public void addListener(PolicyChangeListener listener) {
        listeners.add(listener);
    }

    private void notifyListeners(PolicyRecord record) {
        for (PolicyChangeListener listener : listeners) {
            try {
                listener.onPolicyChanged(record);
            } catch (RuntimeException ex) {
                log.warn("Policy listener {} failed for shape {}", listener, record.shapeKey(), ex);
            }
        }
    }
}
