/*
 * Copyright 2026 Bundesagentur für Arbeit
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

package de.arbeitsagentur.mfa.orchestrator.session;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import org.jboss.logging.Logger;

/** Fixed-rate ticker for the session countdown. At most one schedule runs at a time. */
public class CountdownTicker {

    private static final Logger LOG = Logger.getLogger(CountdownTicker.class);

    private final ScheduledExecutorService scheduler;
    private final Duration interval;
    private ScheduledFuture<?> scheduled;

    public CountdownTicker(ScheduledExecutorService scheduler, Duration interval) {
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler");
        this.interval = Objects.requireNonNull(interval, "interval");
        if (interval.isZero() || interval.isNegative()) {
            throw new IllegalArgumentException("interval must be positive");
        }
    }

    /** Starts ticking unless already running. */
    public synchronized void start(Runnable tick) {
        Objects.requireNonNull(tick, "tick");
        if (scheduled != null) {
            return;
        }
        long millis = interval.toMillis();
        scheduled = scheduler.scheduleAtFixedRate(
                () -> {
                    try {
                        tick.run();
                    } catch (RuntimeException ex) {
                        // an escaping exception would cancel the schedule silently
                        LOG.warnf(ex, "Session countdown tick failed");
                    }
                },
                millis,
                millis,
                TimeUnit.MILLISECONDS);
        LOG.tracef("Countdown ticker started, interval=%dms", millis);
    }

    public synchronized void stop() {
        if (scheduled == null) {
            return;
        }
        scheduled.cancel(false);
        scheduled = null;
        LOG.trace("Countdown ticker stopped");
    }

    public synchronized boolean isRunning() {
        return scheduled != null;
    }

    public static ScheduledExecutorService newScheduler() {
        ThreadFactory factory = new ThreadFactory() {
            private final AtomicInteger counter = new AtomicInteger(1);

            @Override
            public Thread newThread(Runnable runnable) {
                Thread thread = new Thread(runnable, "session-countdown-" + counter.getAndIncrement());
                thread.setDaemon(true);
                return thread;
            }
        };
        return Executors.newSingleThreadScheduledExecutor(factory);
    }
}
