package com.trustplatform.response.executor;

import com.trustplatform.common.policy.ResponseAction;

/**
 * Performs one concrete kind of remediation.
 *
 * <p>Executors hold no reference to the trust graph or the incident store and are invoked
 * concurrently from the dispatch scheduler. A failure may be reported either by returning an
 * unsuccessful {@link ActionResult} or by throwing {@link ActionExecutionException}; both are
 * recorded as a failed action.
 */
public interface ActionExecutor {
    ActionResult execute(ResponseAction action);
    String executorName();
    boolean isHealthy();
}
