package com.trustplatform.response.service;

import com.trustplatform.common.policy.ResponseAction;
import com.trustplatform.response.executor.ActionExecutor;
import com.trustplatform.response.executor.ActionResult;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;

/** Configurable executor for dispatch tests. */
class StubExecutor implements ActionExecutor {

    private final String name;
    private final int failuresBeforeSuccess;
    private final Duration delay;
    private final boolean healthy;
    final AtomicInteger invocations = new AtomicInteger();

    StubExecutor(String name, int failuresBeforeSuccess, Duration delay, boolean healthy) {
        this.name = name;
        this.failuresBeforeSuccess = failuresBeforeSuccess;
        this.delay = delay;
        this.healthy = healthy;
    }

    static StubExecutor succeeding(String name) {
        return new StubExecutor(name, 0, Duration.ZERO, true);
    }

    static StubExecutor alwaysFailing(String name) {
        return new StubExecutor(name, Integer.MAX_VALUE, Duration.ZERO, true);
    }

    @Override
    public ActionResult execute(ResponseAction action) {
        int call = invocations.incrementAndGet();
        if (!delay.isZero()) {
            try {
                Thread.sleep(delay.toMillis());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new IllegalStateException("interrupted", e);
            }
        }
        if (call <= failuresBeforeSuccess) {
            throw new IllegalStateException(name + " failure #" + call);
        }
        return ActionResult.success(name + " ok", Map.of("calls", (double) call));
    }

    @Override
    public String executorName() { return name; }

    @Override
    public boolean isHealthy() { return healthy; }
}
