package com.queryguard.service.core.governance;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.queryguard.service.core.config.QueryGuardProperties;
import com.queryguard.service.core.policy.GovernancePolicyStore;
import com.queryguard.service.core.policy.PolicyAction;
import com.queryguard.service.core.policy.PolicyRecord;
import com.queryguard.service.core.policy.PolicySource;
import com.queryguard.service.core.shape.ShapeStats;
import java.time.Instant;
import java.util.Optional;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;

class AutoRejectHandlerTest {

    private static final String SHAPE = "9".repeat(64);
    private static final Instant NOW = Instant.parse("2024-12-25T10:00:00Z");

    @Mock
    private GovernancePolicyStore policyStore;

    private QueryGuardProperties properties;
    private AutoRejectHandler handler;

    @BeforeEach
    void setUp() {
        MockitoAnnotations.openMocks(this);
        properties = new QueryGuardProperties();
        properties.getGovernance().setAutoReject(true);
        handler = new AutoRejectHandler(policyStore, properties);
    }

    @Test
    void rejectsFlaggedShapeAutomatically() {
        when(policyStore.findPolicy(SHAPE)).thenReturn(Optional.empty());

        handler.handle(event());

        verify(policyStore)
                .setPolicy(
                        SHAPE,
                        PolicyAction.REJECT,
                        "Blocked query with excessive resource consumption",
                        PolicySource.AUTOMATIC);
    }

    @Test
    void leavesManualPoliciesAlone() {
        when(policyStore.findPolicy(SHAPE))
                .thenReturn(Optional.of(new PolicyRecord(SHAPE, PolicyAction.ALLOW, "reviewed", NOW, PolicySource.MANUAL)));

        handler.handle(event());

        verify(policyStore, never()).setPolicy(anyString(), any(), any(), any());
    }

    @Test
    void doesNothingWhenAutoRejectIsOff() {
        properties.getGovernance().setAutoReject(false);

        handler.handle(event());

        verify(policyStore, never()).findPolicy(anyString());
        verify(policyStore, never()).setPolicy(anyString(), any(), any(), any());
    }

    @Test
    void skipsShapesAlreadyRejected() {
        when(policyStore.findPolicy(SHAPE))
                .thenReturn(Optional.of(new PolicyRecord(SHAPE, PolicyAction.REJECT, "x", NOW, PolicySource.AUTOMATIC)));

        handler.handle(event());

        verify(policyStore, never()).setPolicy(anyString(), any(), any(), any());
    }

    private static ShapeFlaggedEvent event() {
        ShapeStats stats = new ShapeStats(SHAPE, 10, 50_000, 9_000, NOW, 10, 5_000);
        return new ShapeFlaggedEvent(stats, 1_000, 5, NOW);
    }
}
