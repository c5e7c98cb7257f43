package com.warden.sidecar;

import com.warden.core.model.SidecarStatus;

import java.util.concurrent.Callable;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.Future;
import java.util.concurrent.FutureTask;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Consumer;

/**
 * Handle on one tenant's in-flight start, used to supersede it.
 *
 * <p>A cancel that wins the race against the body guarantees the body never runs; a
 * cancel that loses it interrupts the body and waits until it has cleaned up.
 */
final class PendingStart implements Runnable {

    private final AtomicBoolean claimed = new AtomicBoolean();
    private final CountDownLatch finished = new CountDownLatch(1);
    private final FutureTask<SidecarStatus> task;

    /**
     * @param onFinish runs after the body, before waiters in {@link #cancelAndAwait()} are released
     */
    PendingStart(Callable<SidecarStatus> body, Consumer<PendingStart> onFinish) {
        this.task = new FutureTask<>(() -> {
            if (!claimed.compareAndSet(false, true)) {
                throw new CancellationException("Start was superseded before it began");
            }
            try {
                return body.call();
            } finally {
                try {
                    onFinish.accept(this);
                } finally {
                    finished.countDown();
                }
            }
        });
    }

    @Override
    public void run() {
        task.run();
    }

    Future<SidecarStatus> future() {
        return task;
    }

    /**
     * Cancels the start and returns once its body can no longer touch the registry or
     * any process it launched.
     */
    void cancelAndAwait() throws InterruptedException {
        task.cancel(true);
        if (!claimed.compareAndSet(false, true)) {
            finished.await();
        }
    }
}
