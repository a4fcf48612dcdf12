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

import java.util.List;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Cooperative cancellation signal shared between the queue worker and the work it runs.
 * Callbacks registered after cancellation run immediately on the registering thread.
 */
public final class CancellationToken {
    private static final Logger logger = Logger.getLogger(CancellationToken.class.getName());

    private final AtomicBoolean cancelled = new AtomicBoolean(false);
    private final List<Runnable> callbacks = new CopyOnWriteArrayList<>();

    public boolean isCancellationRequested() {
        return cancelled.get();
    }

    /**
     * Signal cancellation and run registered callbacks once.
     */
    public void cancel() {
        if (!cancelled.compareAndSet(false, true)) {
            return;
        }
        for (Runnable callback : callbacks) {
            runCallback(callback);
        }
        callbacks.clear();
    }

    public void onCancel(Runnable callback) {
        callbacks.add(callback);
        if (cancelled.get() && callbacks.remove(callback)) {
            runCallback(callback);
        }
    }

    public void throwIfCancellationRequested() {
        if (cancelled.get()) {
            throw new CancellationException("Operation cancelled");
        }
    }

    private static void runCallback(Runnable callback) {
        try {
            callback.run();
        } catch (RuntimeException e) {
            logger.log(Level.WARNING, "Cancellation callback failed: " + e.getMessage(), e);
        }
    }
}
