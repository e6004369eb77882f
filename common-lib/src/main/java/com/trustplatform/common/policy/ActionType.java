package com.trustplatform.common.policy;

public enum ActionType {
    ISOLATE_COMPONENT,
    SCALE_RESOURCES,
    UPDATE_CONFIGURATION,
    TRIGGER_WORKFLOW,
    SEND_NOTIFICATION,
    UPDATE_SECURITY_POLICY,
    FAILOVER_TO_BACKUP,
    RESTART_SERVICE,
    UPDATE_FIREWALL_RULES,
    QUARANTINE_DATA,
    ENABLE_MONITORING,
    DISABLE_ACCESS
}
