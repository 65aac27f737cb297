package com.queryguard.service.core.policy;

public record GateDecision(String shapeKey, PolicyAction action, String comment) {

    public boolean allowed() {
        return action == PolicyAction.ALLOW;
    }
}
