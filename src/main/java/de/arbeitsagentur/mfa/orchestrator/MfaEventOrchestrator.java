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

package de.arbeitsagentur.mfa.orchestrator;

import de.arbeitsagentur.mfa.orchestrator.event.DispatchObserver;
import de.arbeitsagentur.mfa.orchestrator.event.EventDispatchRegistry;
import de.arbeitsagentur.mfa.orchestrator.event.LoggingDispatchObserver;
import de.arbeitsagentur.mfa.orchestrator.navigation.NavigationService;
import de.arbeitsagentur.mfa.orchestrator.navigation.Navigator;
import de.arbeitsagentur.mfa.orchestrator.navigation.OverlayPresenter;
import de.arbeitsagentur.mfa.orchestrator.router.ChallengeRouteTable;
import de.arbeitsagentur.mfa.orchestrator.router.ChallengeRouter;
import de.arbeitsagentur.mfa.orchestrator.sdk.SdkCommandService;
import de.arbeitsagentur.mfa.orchestrator.sdk.SdkTransport;
import de.arbeitsagentur.mfa.orchestrator.session.AppLifecycleState;
import de.arbeitsagentur.mfa.orchestrator.session.CountdownTicker;
import de.arbeitsagentur.mfa.orchestrator.session.SessionTimeoutTracker;
import de.arbeitsagentur.mfa.orchestrator.util.OrchestratorConfig;
import java.time.Clock;
import java.util.Objects;
import java.util.concurrent.ScheduledExecutorService;
import org.jboss.logging.Logger;

/**
 * Wires the orchestration core: one registry shared by the router and the session tracker.
 *
 * <p>The SDK transport feeds events into {@link #registry()}; lifecycle changes go to
 * {@link #onLifecycleChange(String)}.
 */
public final class MfaEventOrchestrator {

    private static final Logger LOG = Logger.getLogger(MfaEventOrchestrator.class);

    private final EventDispatchRegistry registry;
    private final SdkCommandService commands;
    private final ChallengeRouter router;
    private final SessionTimeoutTracker sessionTracker;

    private MfaEventOrchestrator(Builder builder) {
        OrchestratorConfig config = builder.config;
        this.registry = new EventDispatchRegistry(config.events(), builder.observer);
        this.commands = new SdkCommandService(builder.transport);
        Navigator navigator = new Navigator(builder.navigation);
        this.router = new ChallengeRouter(
                builder.routeTable, navigator, builder.overlay, commands, config, builder.clock);
        CountdownTicker ticker = new CountdownTicker(builder.scheduler, config.session().tickInterval());
        this.sessionTracker = new SessionTimeoutTracker(builder.clock, ticker, commands, navigator, config.session());
        router.attach(registry);
        sessionTracker.attach(registry);
        LOG.debugf(
                "MFA event orchestrator ready, platform=%s, tick=%dms",
                config.lda().platform(), config.session().tickIntervalMillis());
    }

    public static Builder builder() {
        return new Builder();
    }

    public EventDispatchRegistry registry() {
        return registry;
    }

    public SdkCommandService commands() {
        return commands;
    }

    public ChallengeRouter router() {
        return router;
    }

    public SessionTimeoutTracker sessionTracker() {
        return sessionTracker;
    }

    /** Entry point for the platform's lifecycle signal ({@code active}, {@code background}, {@code inactive}). */
    public void onLifecycleChange(String state) {
        sessionTracker.onLifecycleChange(AppLifecycleState.fromPlatform(state));
    }

    public static final class Builder {

        private OrchestratorConfig config;
        private SdkTransport transport;
        private NavigationService navigation;
        private OverlayPresenter overlay;
        private DispatchObserver observer = new LoggingDispatchObserver();
        private ChallengeRouteTable routeTable = ChallengeRouteTable.standard();
        private Clock clock = Clock.systemUTC();
        private ScheduledExecutorService scheduler;

        private Builder() {}

        public Builder config(OrchestratorConfig config) {
            this.config = config;
            return this;
        }

        public Builder transport(SdkTransport transport) {
            this.transport = transport;
            return this;
        }

        public Builder navigation(NavigationService navigation) {
            this.navigation = navigation;
            return this;
        }

        public Builder overlay(OverlayPresenter overlay) {
            this.overlay = overlay;
            return this;
        }

        public Builder observer(DispatchObserver observer) {
            this.observer = observer;
            return this;
        }

        public Builder routeTable(ChallengeRouteTable routeTable) {
            this.routeTable = routeTable;
            return this;
        }

        public Builder clock(Clock clock) {
            this.clock = clock;
            return this;
        }

        public Builder scheduler(ScheduledExecutorService scheduler) {
            this.scheduler = scheduler;
            return this;
        }

        public MfaEventOrchestrator build() {
            Objects.requireNonNull(transport, "transport");
            Objects.requireNonNull(navigation, "navigation");
            Objects.requireNonNull(overlay, "overlay");
            Objects.requireNonNull(observer, "observer");
            Objects.requireNonNull(routeTable, "routeTable");
            Objects.requireNonNull(clock, "clock");
            if (config == null) {
                config = OrchestratorConfig.load();
            }
            if (scheduler == null) {
                scheduler = CountdownTicker.newScheduler();
            }
            return new MfaEventOrchestrator(this);
        }
    }
}
