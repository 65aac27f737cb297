package com.queryguard.service.core.policy;

@FunctionalInterface
public interface PolicyChangeListener {
    void onPolicyChanged(PolicyRecord record);
}
