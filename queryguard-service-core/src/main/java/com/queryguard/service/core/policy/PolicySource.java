package com.queryguard.service.core.policy;

/** Who wrote a policy. Manual policies are never replaced by the automatic loop. */
public enum PolicySource {
    MANUAL,
    AUTOMATIC
}
