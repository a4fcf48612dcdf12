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

import dev.mars.stepflow.core.exceptions.StepflowInfrastructureException;

import java.time.Instant;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.logging.Logger;

/**
 * Bounded FIFO hand-off of work items from many producers to a single consumer.
 *
 * <p>Capacity is fixed at construction. When the queue is full a producer either
 * blocks or is rejected, depending on the {@link QueueFullMode}.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-08-17
 * @version 1.0
 */
public class BackgroundTaskQueue {
    private static final Logger logger = Logger.getLogger(BackgroundTaskQueue.class.getName());

    private static final long POLL_INTERVAL_MS = 250;

    private final BlockingQueue<QueuedWorkItem> channel;
    private final int capacity;
    private final QueueFullMode fullMode;

    public BackgroundTaskQueue(int capacity, QueueFullMode fullMode) {
        if (capacity < 1) {
            throw new IllegalArgumentException("Queue capacity must be at least 1");
        }
        this.capacity = capacity;
        this.fullMode = fullMode;
        this.channel = new ArrayBlockingQueue<>(capacity, true);
    }

    /**
     * Add a work item to the tail of the queue.
     *
     * @throws StepflowInfrastructureException if the queue is full in {@link QueueFullMode#FAIL} mode
     * @throws InterruptedException if interrupted while waiting for capacity
     */
    public void enqueue(BackgroundWorkItem workItem, String correlationId)
            throws StepflowInfrastructureException, InterruptedException {
        QueuedWorkItem item = new QueuedWorkItem(workItem, correlationId, Instant.now());
        if (fullMode == QueueFullMode.FAIL) {
            if (!channel.offer(item)) {
                logger.warning("Task queue full (capacity " + capacity + "), rejected " + item.describe());
                throw new StepflowInfrastructureException(
                        "Task queue is full (capacity " + capacity + ")");
            }
        } else {
            channel.put(item);
        }
        logger.fine("Enqueued " + item.describe() + ", queue size " + channel.size());
    }

    /**
     * Take the next item, waiting until one arrives or the token is cancelled.
     *
     * @return the next item, or {@code null} once cancellation has been requested
     * @throws InterruptedException if the consumer thread is interrupted
     */
    public QueuedWorkItem dequeue(CancellationToken cancellationToken) throws InterruptedException {
        while (!cancellationToken.isCancellationRequested()) {
            QueuedWorkItem item = channel.poll(POLL_INTERVAL_MS, TimeUnit.MILLISECONDS);
            if (item != null) {
                return item;
            }
        }
        return null;
    }

    public int size() {
        return channel.size();
    }

    public int remainingCapacity() {
        return channel.remainingCapacity();
    }

    public int getCapacity() {
        return capacity;
    }

    public QueueFullMode getFullMode() {
        return fullMode;
    }
}
