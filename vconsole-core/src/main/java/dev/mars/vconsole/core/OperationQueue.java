/*
 * Copyright 2025 Mark Andrew Ray-Smith Cityline Ltd
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package dev.mars.vconsole.core;

import io.vertx.core.Future;
import io.vertx.core.Promise;

import java.util.concurrent.CancellationException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Supplier;

/**
 * FIFO queue of asynchronous operations; each operation starts only after the
 * future of the previous one has completed, whatever its outcome.
 *
 * <p>Operations running inside the queue must not submit to the same queue and
 * wait on the result, since the nested operation is ordered after its caller.</p>
 *
 * <p>{@link #discardPending()} fails every operation that has been submitted
 * but not yet started with a {@link CancellationException}.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-08-20
 * @version 1.0
 */
public final class OperationQueue {

    private final String name;
    private final AtomicInteger pending = new AtomicInteger();
    private Future<?> tail = Future.succeededFuture();
    private long generation = 0;

    public OperationQueue(String name) {
        this.name = name;
    }

    public <T> Future<T> submit(Supplier<Future<T>> operation) {
        Promise<T> promise = Promise.promise();
        Future<?> previous;
        long submittedIn;
        synchronized (this) {
            previous = tail;
            tail = promise.future();
            submittedIn = generation;
        }
        pending.incrementAndGet();
        previous.onComplete(ignored -> run(operation, promise, submittedIn));
        return promise.future();
    }

    /**
     * Cancels every queued operation that has not started yet.
     */
    public synchronized void discardPending() {
        generation++;
    }

    /**
     * Returns the number of operations submitted and not yet finished.
     */
    public int size() {
        return pending.get();
    }

    public boolean isIdle() {
        return pending.get() == 0;
    }

    private <T> void run(Supplier<Future<T>> operation, Promise<T> promise, long submittedIn) {
        boolean cancelled;
        synchronized (this) {
            cancelled = submittedIn < generation;
        }
        if (cancelled) {
            pending.decrementAndGet();
            promise.fail(new CancellationException(name + ": operation discarded"));
            return;
        }
        Future<T> result;
        try {
            result = operation.get();
        } catch (RuntimeException e) {
            result = Future.failedFuture(e);
        }
        result.onComplete(ar -> {
            pending.decrementAndGet();
            if (ar.succeeded()) {
                promise.complete(ar.result());
            } else {
                promise.fail(ar.cause());
            }
        });
    }

    @Override
    public String toString() {
        return "OperationQueue{" + "name='" + name + '\'' + ", pending=" + pending.get() + '}';
    }
}
