package me.golemcore.warranty.domain.step;

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

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Run-level cancellation signal and deadline.
 *
 * <p>
 * {@link #cancel(String)} may be called from any thread. It cancels the
 * reasoning call the run is currently waiting on, and the orchestrator does not
 * start another step afterwards.
 */
public final class RunControl {

    private final Clock clock;
    private final Instant deadline;
    private final AtomicReference<String> cancelReason = new AtomicReference<>();
    private final AtomicReference<Future<?>> inFlight = new AtomicReference<>();

    private RunControl(Clock clock, Instant deadline) {
        this.clock = clock;
        this.deadline = deadline;
    }

    public static RunControl unbounded() {
        return new RunControl(Clock.systemUTC(), null);
    }

    public static RunControl withTimeout(Duration timeout, Clock clock) {
        if (timeout == null || timeout.isZero() || timeout.isNegative()) {
            return new RunControl(clock, null);
        }
        return new RunControl(clock, clock.instant().plus(timeout));
    }

    /**
     * Requests cancellation. Only the first reason is kept.
     */
    public void cancel(String reason) {
        if (cancelReason.compareAndSet(null, reason != null ? reason : "cancelled")) {
            Future<?> current = inFlight.get();
            if (current != null) {
                current.cancel(true);
            }
        }
    }

    public boolean isCancelled() {
        return cancelReason.get() != null;
    }

    public String getCancelReason() {
        return cancelReason.get();
    }

    public boolean isExpired() {
        return deadline != null && !clock.instant().isBefore(deadline);
    }

    /**
     * Time left until the deadline, or empty when the run has none.
     */
    public Optional<Duration> remaining() {
        if (deadline == null) {
            return Optional.empty();
        }
        Duration left = Duration.between(clock.instant(), deadline);
        return Optional.of(left.isNegative() ? Duration.ZERO : left);
    }

    /**
     * Registers the call the run is currently waiting on so {@link #cancel} can
     * abort it.
     */
    public void attach(Future<?> future) {
        inFlight.set(future);
        if (isCancelled()) {
            future.cancel(true);
        }
    }

    public void detach(Future<?> future) {
        inFlight.compareAndSet(future, null);
    }
}
