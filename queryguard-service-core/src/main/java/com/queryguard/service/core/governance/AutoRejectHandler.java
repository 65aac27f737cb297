package com.queryguard.service.core.governance;

import com.queryguard.service.core.config.QueryGuardProperties;
import com.queryguard.service.core.policy.GovernancePolicyStore;
import com.queryguard.service.core.policy.PolicyAction;
import com.queryguard.service.core.policy.PolicyRecord;
import com.queryguard.service.core.policy.PolicySource;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Writes a rejection for every flagged shape when {@code queryguard.governance.auto-reject} is on.
 * Shapes already under a manual policy are left to the operator.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class AutoRejectHandler implements ShapeFlagHandler {

    private final GovernancePolicyStore policyStore;
    private final QueryGuardProperties properties;

    @Override
    public void handle(ShapeFlaggedEvent event) {
        QueryGuardProperties.Governance governance = properties.getGovernance();
        if (!governance.isAutoReject()) {
            log.debug("Auto-reject disabled; shape {} flagged but not blocked", event.shapeKey());
            return;
        }
        Optional<PolicyRecord> existing = policyStore.findPolicy(event.shapeKey());
        if (existing.isPresent() && existing.get().source() == PolicySource.MANUAL) {
            log.info("Shape {} has a manual policy; skipping automatic rejection", event.shapeKey());
            return;
        }
        if (existing.isPresent() && existing.get().isReject()) {
            return;
        }
        policyStore.setPolicy(
                event.shapeKey(), PolicyAction.REJECT, governance.getRejectComment(), PolicySource.AUTOMATIC);
        log.warn(
                "Automatically rejected shape {} windowAverage={} threshold={} executions={}",
                event.shapeKey(),
                event.stats().windowAverage(),
                event.thresholdCost(),
                event.stats().windowCount());
    }
}
