package me.golemcore.krishi.domain.model;

/*
 * Copyright 2026 Aleksei Kuleshov
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
 *
 * Contact: alex@kuleshov.tech
 */

import me.golemcore.krishi.domain.exception.DeadlineExceededException;

import java.time.Duration;

/**
 * Caller-supplied time budget for scan-style operations (full-corpus
 * similarity search, range deletion). Measured on the monotonic clock.
 */
public final class Deadline {

    private static final Deadline NONE = new Deadline(Long.MAX_VALUE);

    private final long deadlineNanos;

    private Deadline(long deadlineNanos) {
        this.deadlineNanos = deadlineNanos;
    }

    public static Deadline none() {
        return NONE;
    }

    public static Deadline after(Duration budget) {
        if (budget == null || budget.isNegative()) {
            return new Deadline(System.nanoTime());
        }
        long nanos;
        try {
            nanos = budget.toNanos();
        } catch (ArithmeticException e) {
            return NONE;
        }
        long now = System.nanoTime();
        // saturate instead of overflowing for very large budgets
        long target = nanos > Long.MAX_VALUE - now ? Long.MAX_VALUE : now + nanos;
        return new Deadline(target);
    }

    public boolean isUnbounded() {
        return deadlineNanos == Long.MAX_VALUE;
    }

    public long remainingMillis() {
        if (isUnbounded()) {
            return Long.MAX_VALUE;
        }
        return Math.max(0, (deadlineNanos - System.nanoTime()) / 1_000_000L);
    }

    public boolean isExpired() {
        return !isUnbounded() && System.nanoTime() - deadlineNanos >= 0;
    }

    /**
     * Throws {@link DeadlineExceededException} when the budget is spent.
     *
     * @param operation
     *            name of the running operation, used in the error message
     */
    public void check(String operation) {
        if (isExpired()) {
            throw new DeadlineExceededException(operation);
        }
    }
}
