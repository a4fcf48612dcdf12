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

package dev.mars.stepflow.queue;

import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Single consumer loop for a {@link BackgroundTaskQueue}.
 *
 * <p>Items run one at a time in arrival order on a dedicated daemon thread. An item
 * that throws is logged and counted, and the loop continues with the next item.
 * {@link #stop(long)} cancels the shared token, which is also passed to every item.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-08-17
 * @version 1.0
 */
public class QueuedTaskWorker {
    private static final Logger logger = Logger.getLogger(QueuedTaskWorker.class.getName());

    private final BackgroundTaskQueue queue;
    private final CancellationToken cancellationToken = new CancellationToken();
    private final AtomicBoolean started = new AtomicBoolean(false);
    private final AtomicLong processedCount = new AtomicLong();
    private final AtomicLong failedCount = new AtomicLong();
    private final Thread thread;

    public QueuedTaskWorker(BackgroundTaskQueue queue, String threadName) {
        this.queue = queue;
        this.thread = new Thread(this::runLoop, threadName);
        this.thread.setDaemon(true);
    }

    public void start() {
        if (started.compareAndSet(false, true)) {
            thread.start();
            logger.info("Queued task worker started: " + thread.getName());
        }
    }

    /**
     * Cancel the loop and wait for the current item to finish.
     *
     * @param timeoutMs how long to wait for the worker thread to exit
     * @return {@code true} if the worker thread has exited
     */
    public boolean stop(long timeoutMs) {
        cancellationToken.cancel();
        if (!started.get()) {
            return true;
        }
        try {
            thread.join(timeoutMs);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        if (thread.isAlive()) {
            logger.warning("Queued task worker did not stop within " + timeoutMs + "ms, interrupting");
            thread.interrupt();
            return false;
        }
        logger.info("Queued task worker stopped after " + processedCount.get() + " items ("
                + failedCount.get() + " failed)");
        return true;
    }

    public CancellationToken getCancellationToken() {
        return cancellationToken;
    }

    public boolean isRunning() {
        return started.get() && thread.isAlive();
    }

    public long getProcessedCount() {
        return processedCount.get();
    }

    public long getFailedCount() {
        return failedCount.get();
    }

    private void runLoop() {
        while (!cancellationToken.isCancellationRequested()) {
            QueuedWorkItem item;
            try {
                item = queue.dequeue(cancellationToken);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                break;
            }
            if (item == null) {
                break;
            }
            try {
                item.workItem().execute(cancellationToken);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                logger.warning("Work item interrupted: " + item.describe());
                break;
            } catch (Exception e) {
                failedCount.incrementAndGet();
                logger.log(Level.SEVERE, "Work item failed: " + item.describe() + ": " + e.getMessage());
                if (logger.isLoggable(Level.FINE)) {
                    logger.log(Level.FINE, "Work item failure details", e);
                }
            } finally {
                processedCount.incrementAndGet();
            }
        }
        logger.fine("Queued task worker loop exited");
    }
}
