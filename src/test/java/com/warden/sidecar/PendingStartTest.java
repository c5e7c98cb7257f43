package com.warden.sidecar;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.concurrent.CancellationException;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

import static org.junit.jupiter.api.Assertions.*;

class PendingStartTest {

    @Test
    @DisplayName("a start cancelled before it runs never executes its body")
    void cancelBeforeRun() throws Exception {
        var ran = new AtomicBoolean();
        var finished = new AtomicBoolean();
        var pending = new PendingStart(() -> {
            ran.set(true);
            return null;
        }, self -> finished.set(true));

        pending.cancelAndAwait();
        pending.run();

        assertFalse(ran.get());
        assertFalse(finished.get());
        assertThrows(CancellationException.class, () -> pending.future().get());
    }

    @Test
    @DisplayName("cancelling a running start interrupts it and waits for its cleanup")
    void cancelWhileRunning() throws Exception {
        var entered = new CountDownLatch(1);
        var cleanedUp = new AtomicBoolean();
        var pending = new PendingStart(() -> {
            entered.countDown();
            try {
                Thread.sleep(TimeUnit.SECONDS.toMillis(30));
                return null;
            } finally {
                Thread.sleep(50);
                cleanedUp.set(true);
            }
        }, self -> { });

        var worker = new Thread(pending);
        worker.start();
        assertTrue(entered.await(5, TimeUnit.SECONDS));

        pending.cancelAndAwait();

        assertTrue(cleanedUp.get());
        worker.join(5000);
        assertFalse(worker.isAlive());
        assertThrows(CancellationException.class, () -> pending.future().get());
    }

    @Test
    @DisplayName("onFinish runs after the body completes")
    void onFinishRuns() throws Exception {
        var finished = new AtomicBoolean();
        var pending = new PendingStart(() -> null, self -> finished.set(true));

        pending.run();

        assertTrue(finished.get());
        assertNull(pending.future().get());
    }
}
