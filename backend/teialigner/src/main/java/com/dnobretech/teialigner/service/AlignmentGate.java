package com.dnobretech.teialigner.service;

import com.dnobretech.teialigner.exception.AlignmentBusyException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;
import java.util.function.Supplier;

/**
 * Admission control for alignment work: at most {@code max-concurrent} computations run
 * at once, later callers wait up to {@code acquire-timeout-seconds} in arrival order.
 */
@Slf4j
@Component
public class AlignmentGate {

    private final Semaphore permits;
    private final long acquireTimeoutSeconds;

    public AlignmentGate(@Value("${teialigner.alignment.max-concurrent:2}") int maxConcurrent,
                         @Value("${teialigner.alignment.acquire-timeout-seconds:30}") long acquireTimeoutSeconds) {
        this.permits = new Semaphore(Math.max(1, maxConcurrent), true);
        this.acquireTimeoutSeconds = acquireTimeoutSeconds;
    }

    public <T> T run(Supplier<T> work) {
        boolean acquired;
        try {
            acquired = permits.tryAcquire(acquireTimeoutSeconds, TimeUnit.SECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new AlignmentBusyException("Interrupted while waiting for an alignment slot");
        }
        if (!acquired) {
            throw new AlignmentBusyException("All alignment slots busy for " + acquireTimeoutSeconds + "s, try again later");
        }
        try {
            return work.get();
        } finally {
            permits.release();
        }
    }

    public int available() {
        return permits.availablePermits();
    }
}
