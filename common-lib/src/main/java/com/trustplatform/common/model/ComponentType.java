package com.trustplatform.common.model;

/**
 * Kind of component a {@link TrustNode} represents inside the monitored system.
 */
public enum ComponentType {
    MICROSERVICE,
    DATABASE,
    API,
    LOAD_BALANCER,
    MESSAGE_QUEUE,
    CACHE,
    EXTERNAL_SERVICE,
    LEGACY_SYSTEM,
    EDGE_DEVICE,
    CONTAINER
}
