package dev.mars.s3kit.transfer;

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


import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Cooperative control handle for a running transfer.
 *
 * <p>Cancelling stops workers from picking up further chunks and from retrying; calls
 * already on the wire run to completion. Pausing holds workers before their next
 * chunk until {@link #resume()} or {@link #cancel()} is called.</p>
 */
public class TransferContext {

    private final AtomicBoolean cancelled = new AtomicBoolean(false);
    private final AtomicBoolean paused = new AtomicBoolean(false);

    private final Lock pauseLock = new ReentrantLock();
    private final Condition resumeCondition = pauseLock.newCondition();

    public boolean isCancelled() {
        return cancelled.get();
    }

    public void cancel() {
        pauseLock.lock();
        try {
            cancelled.set(true);
            resumeCondition.signalAll();
        } finally {
            pauseLock.unlock();
        }
    }

    public boolean isPaused() {
        return paused.get();
    }

    public void pause() {
        paused.set(true);
    }

    public void resume() {
        pauseLock.lock();
        try {
            paused.set(false);
            resumeCondition.signalAll();
        } finally {
            pauseLock.unlock();
        }
    }

    public boolean shouldContinue() {
        return !cancelled.get() && !paused.get();
    }

    /**
     * Blocks while paused, up to {@code maxWaitMs} per call.
     *
     * @return true if the caller may go on, false if the transfer was cancelled or the
     *         thread interrupted
     */
    public boolean waitForResumeOrCancel(long maxWaitMs) {
        if (cancelled.get()) {
            return false;
        }
        if (!paused.get()) {
            return true;
        }

        pauseLock.lock();
        try {
            long remainingNanos = maxWaitMs * 1_000_000;
            while (paused.get() && !cancelled.get() && remainingNanos > 0) {
                try {
                    remainingNanos = resumeCondition.awaitNanos(remainingNanos);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    return false;
                }
            }
            return !cancelled.get();
        } finally {
            pauseLock.unlock();
        }
    }
}
