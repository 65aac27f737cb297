package com.queryguard.service.core.policy;

import java.time.Instant;

/**
 * Policy for one shape. A record with a null {@code setAt} is the implicit allow returned for an
 * unmanaged shape.
 */
public record PolicyRecord(String shapeKey, PolicyAction action, String comment, Instant setAt, PolicySource source) {

    static PolicyRecord defaultAllow(String shapeKey) {
        return new PolicyRecord(shapeKey, PolicyAction.ALLOW, null, null, null);
    }

    public boolean isManaged() {
        return setAt != null;
    }

    public boolean isReject() {
        return action == PolicyAction.REJECT;
    }

    boolean sameSettings(PolicyAction otherAction, String otherComment, PolicySource otherSource) {
        return action == otherAction
                && source == otherSource
                && (comment == null ? otherComment == null : comment.equals(otherComment));
    }
}
