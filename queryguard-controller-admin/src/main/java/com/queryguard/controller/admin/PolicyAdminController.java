package com.queryguard.controller.admin;

import com.queryguard.service.core.policy.GovernancePolicyStore;
import com.queryguard.service.core.policy.PolicyAction;
import com.queryguard.service.core.policy.PolicyRecord;
import java.util.Comparator;
import java.util.List;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/** Manual override path over the policy store: block, unblock and confirm policies. */
@RestController
@RequestMapping(path = "/admin/policies", produces = MediaType.APPLICATION_JSON_VALUE)
public class PolicyAdminController {

    private final GovernancePolicyStore policyStore;

    public PolicyAdminController(GovernancePolicyStore policyStore) {
        this.policyStore = policyStore;
    }

    @PutMapping(path = "/{shapeKey}", consumes = MediaType.APPLICATION_JSON_VALUE)
    public PolicyRecord setPolicy(@PathVariable String shapeKey, @RequestBody PolicyUpdate update) {
        return policyStore.setPolicy(shapeKey, PolicyAction.fromValue(update.action()), update.comment());
    }

    @GetMapping("/{shapeKey}")
    public PolicyRecord getPolicy(@PathVariable String shapeKey) {
        return policyStore.getPolicy(shapeKey);
    }

    @GetMapping
    public List<PolicyRecord> listPolicies() {
        return policyStore.listPolicies()
                .sorted(Comparator.comparing(PolicyRecord::shapeKey))
                .toList();
    }

    public record PolicyUpdate(String action, String comment) {}
}
