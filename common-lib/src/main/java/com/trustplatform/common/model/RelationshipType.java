package com.trustplatform.common.model;

public enum RelationshipType {
    DATA_FLOW,
    DEPENDENCY,
    COMMUNICATION,
    CONTROL,
    MONITORING,
    BACKUP,
    LOAD_BALANCING
}
