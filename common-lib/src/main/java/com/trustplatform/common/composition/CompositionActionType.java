package com.trustplatform.common.composition;

public enum CompositionActionType {
    ISOLATE_COMPONENT,
    REDUCE_TRUST_WEIGHT,
    TRIGGER_ALERT,
    UPDATE_SECURITY_POLICY,
    SCALE_RESOURCES,
    FAILOVER_TO_BACKUP
}
