package com.trustplatform.response.executor;

import com.trustplatform.common.exception.TrustEngineException;

public class ActionExecutionException extends TrustEngineException {
    private final String executorName;

    public ActionExecutionException(String executorName, String message) {
        super("[" + executorName + "] " + message);
        this.executorName = executorName;
    }

    public ActionExecutionException(String executorName, String message, Throwable cause) {
        super("[" + executorName + "] " + message, cause);
        this.executorName = executorName;
    }

    public String getExecutorName() {
        return executorName;
    }
}
