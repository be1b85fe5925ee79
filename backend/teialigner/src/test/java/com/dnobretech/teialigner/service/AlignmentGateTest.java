package com.dnobretech.teialigner.service;

import com.dnobretech.teialigner.exception.AlignmentBusyException;
import org.junit.jupiter.api.Test;

import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class AlignmentGateTest {

    @Test
    void runsWorkAndReleasesThePermit() {
        AlignmentGate gate = new AlignmentGate(2, 1);

        assertThat(gate.run(() -> "done")).isEqualTo("done");
        assertThat(gate.available()).isEqualTo(2);
    }

    @Test
    void releasesThePermitWhenWorkFails() {
        AlignmentGate gate = new AlignmentGate(1, 1);

        assertThatThrownBy(() -> gate.run(() -> {
            throw new IllegalStateException("boom");
        })).isInstanceOf(IllegalStateException.class);
        assertThat(gate.available()).isEqualTo(1);
    }

    @Test
    void rejectsWhenAllSlotsStayBusy() throws Exception {
        AlignmentGate gate = new AlignmentGate(1, 0);
        CountDownLatch started = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        ExecutorService pool = Executors.newSingleThreadExecutor();
        try {
            Future<String> holder = pool.submit(() -> gate.run(() -> {
                started.countDown();
                try {
                    release.await(5, TimeUnit.SECONDS);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
                return "first";
            }));
            assertThat(started.await(5, TimeUnit.SECONDS)).isTrue();

            assertThatThrownBy(() -> gate.run(() -> "second"))
                    .isInstanceOf(AlignmentBusyException.class);

            release.countDown();
            assertThat(holder.get(5, TimeUnit.SECONDS)).isEqualTo("first");
        } finally {
            pool.shutdownNow();
        }
    }
}
