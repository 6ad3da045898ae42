package com.sensor.alerts.service;

import com.sensor.alerts.config.FanOutConfig;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.FutureTask;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.BiFunction;
import java.util.function.Function;

/**
 * Runs one task per recipient on the bounded recipient executor and joins
 * the results in recipient order.
 *
 * All tasks of one call share a deadline of {@code recipientTimeoutMs},
 * started before the first submission. When the deadline passes:
 * <ul>
 *   <li>a task that has not started is dropped and never runs; its recipient
 *       gets {@code onFailure} with a {@link TimeoutException}</li>
 *   <li>a task that is running is interrupted and awaited, and its recipient
 *       gets whatever the task actually produced</li>
 * </ul>
 * A result is therefore never reported as failed for work that completed.
 * The wait after an interrupt relies on the task's own I/O being bounded
 * (Aerospike policy timeouts, JDBC query timeout, push read timeout).
 *
 * With a caller-runs rejection policy a saturated pool runs the task on the
 * calling thread during submission. That time counts against the deadline,
 * but such a task cannot be interrupted.
 */
@Component
public class RecipientFanOut {

    private final Executor executor;
    private final long timeoutMs;

    public RecipientFanOut(@Qualifier("recipientExecutor") Executor executor, FanOutConfig config) {
        this.executor = executor;
        this.timeoutMs = config.getRecipientTimeoutMs();
    }

    public <T> List<T> map(List<String> recipients,
                           Function<String, T> task,
                           BiFunction<String, Throwable, T> onFailure) {
        long deadline = System.nanoTime() + TimeUnit.MILLISECONDS.toNanos(timeoutMs);

        List<RecipientTask<T>> tasks = new ArrayList<>(recipients.size());
        for (String recipient : recipients) {
            RecipientTask<T> recipientTask = new RecipientTask<>(recipient, task);
            tasks.add(recipientTask);
            executor.execute(recipientTask.runner);
        }

        List<T> results = new ArrayList<>(recipients.size());
        InterruptedException interruption = null;
        for (RecipientTask<T> recipientTask : tasks) {
            if (interruption != null) {
                results.add(settleWithoutWaiting(recipientTask, onFailure, interruption));
                continue;
            }
            try {
                results.add(join(recipientTask, deadline, onFailure));
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                interruption = e;
                results.add(settleWithoutWaiting(recipientTask, onFailure, e));
            }
        }
        return results;
    }

    private <T> T join(RecipientTask<T> recipientTask, long deadline,
                       BiFunction<String, Throwable, T> onFailure) throws InterruptedException {
        try {
            long remaining = Math.max(0, deadline - System.nanoTime());
            return recipientTask.outcome.get(remaining, TimeUnit.NANOSECONDS);
        } catch (ExecutionException e) {
            return onFailure.apply(recipientTask.recipient, e.getCause());
        } catch (TimeoutException e) {
            TimeoutException timeout = new TimeoutException("Timed out after " + timeoutMs + "ms");
            if (recipientTask.abandon()) {
                return onFailure.apply(recipientTask.recipient, timeout);
            }
            try {
                return recipientTask.outcome.get();
            } catch (ExecutionException failed) {
                timeout.initCause(failed.getCause());
                return onFailure.apply(recipientTask.recipient, timeout);
            }
        }
    }

    /**
     * Used once the calling thread has been interrupted: finished tasks keep
     * their result, unfinished ones are cancelled and reported as failed.
     */
    private <T> T settleWithoutWaiting(RecipientTask<T> recipientTask,
                                       BiFunction<String, Throwable, T> onFailure,
                                       InterruptedException interruption) {
        if (!recipientTask.outcome.isDone()) {
            recipientTask.abandon();
            return onFailure.apply(recipientTask.recipient, interruption);
        }
        try {
            return recipientTask.outcome.join();
        } catch (CompletionException e) {
            return onFailure.apply(recipientTask.recipient, e.getCause());
        }
    }

    private static final class RecipientTask<T> implements Runnable {

        private final String recipient;
        private final Function<String, T> task;
        private final AtomicBoolean claimed = new AtomicBoolean();
        private final CompletableFuture<T> outcome = new CompletableFuture<>();
        private final FutureTask<Void> runner = new FutureTask<>(this, null);

        RecipientTask(String recipient, Function<String, T> task) {
            this.recipient = recipient;
            this.task = task;
        }

        @Override
        public void run() {
            if (!claimed.compareAndSet(false, true)) {
                return; // abandoned while queued
            }
            try {
                outcome.complete(task.apply(recipient));
            } catch (Throwable e) {
                outcome.completeExceptionally(e);
            }
        }

        /**
         * Returns true when the task had not started and now never will.
         * Otherwise the running task is interrupted and still settles
         * {@code outcome} itself.
         */
        boolean abandon() {
            if (claimed.compareAndSet(false, true)) {
                runner.cancel(false);
                return true;
            }
            if (!outcome.isDone()) {
                runner.cancel(true);
            }
            return false;
        }
    }
}
