package com.queryguard.service.core.policy;

import com.fasterxml.jackson.databind.JsonNode;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.LoadingCache;
import com.queryguard.service.core.config.QueryGuardProperties;
import com.queryguard.service.core.shape.QueryShapeHasher;
import com.queryguard.service.core.shape.ShapeKeys;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Hot-path check consulted before a query runs. Decisions come from a Caffeine cache in front of
 * the policy store; writes invalidate the affected entry and the TTL bounds staleness if an
 * invalidation is missed.
 */
@Service
@Slf4j
public class ExecutionGate {

    private final LoadingCache<String, PolicyRecord> cache;
    private final QueryShapeHasher hasher;

    public ExecutionGate(GovernancePolicyStore policyStore, QueryShapeHasher hasher, QueryGuardProperties properties) {
        QueryGuardProperties.Gate gate = properties.getGate();
        this.hasher = hasher;
        this.cache = Caffeine.newBuilder()
                .maximumSize(gate.getCacheSize())
                .expireAfterWrite(gate.getCacheTtl())
                .build(policyStore::getPolicy);
        policyStore.addListener(record -> cache.invalidate(record.shapeKey()));
        log.info("Execution gate ready cacheSize={} cacheTtl={}", gate.getCacheSize(), gate.getCacheTtl());
    }

    public GateDecision beforeExecute(String shapeKey) {
        PolicyRecord policy = cache.get(ShapeKeys.normalize(shapeKey));
        if (policy.isReject()) {
            log.debug("Rejected query shape={} comment={}", policy.shapeKey(), policy.comment());
            return new GateDecision(policy.shapeKey(), PolicyAction.REJECT, policy.comment());
        }
        return new GateDecision(policy.shapeKey(), PolicyAction.ALLOW, null);
    }

    public GateDecision beforeExecute(JsonNode query) {
        return beforeExecute(hasher.shapeKey(query));
    }
}
