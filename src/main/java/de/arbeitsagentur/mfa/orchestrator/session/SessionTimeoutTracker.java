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

import de.arbeitsagentur.mfa.orchestrator.event.EventDispatchRegistry;
import de.arbeitsagentur.mfa.orchestrator.event.SdkEventType;
import de.arbeitsagentur.mfa.orchestrator.event.payload.SessionExtensionResponseEvent;
import de.arbeitsagentur.mfa.orchestrator.event.payload.SessionTimeoutEvent;
import de.arbeitsagentur.mfa.orchestrator.event.payload.SessionTimeoutNotificationEvent;
import de.arbeitsagentur.mfa.orchestrator.navigation.Navigator;
import de.arbeitsagentur.mfa.orchestrator.router.ChallengeStatus;
import de.arbeitsagentur.mfa.orchestrator.router.ChallengeStatusEvaluator;
import de.arbeitsagentur.mfa.orchestrator.sdk.CommandAcknowledgement;
import de.arbeitsagentur.mfa.orchestrator.sdk.SdkCommandService;
import de.arbeitsagentur.mfa.orchestrator.session.SessionTimeoutState.AdvisoryCountdown;
import de.arbeitsagentur.mfa.orchestrator.session.SessionTimeoutState.Idle;
import de.arbeitsagentur.mfa.orchestrator.session.SessionTimeoutState.MandatoryExpired;
import de.arbeitsagentur.mfa.orchestrator.util.OrchestratorConfig;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;
import org.jboss.logging.Logger;

/**
 * State machine behind the session timeout modal.
 *
 * <p>Driven by SDK notifications (hard expiry, advisory idle warning, extension response), by
 * countdown ticks and by app lifecycle transitions. Ticks only run while the modal is visible and
 * the app is in the foreground; when the app comes back from the background the countdown is
 * corrected by the wall clock time spent there, read from the injected {@link Clock}.
 *
 * <p>{@code secondsRemaining} never increases while counting down. Only an extension or a dismissal
 * leaves the countdown.
 */
public class SessionTimeoutTracker {

    private static final Logger LOG = Logger.getLogger(SessionTimeoutTracker.class);

    private final Clock clock;
    private final CountdownTicker ticker;
    private final SdkCommandService commands;
    private final Navigator navigator;
    private final String homeScreen;
    private final List<SessionTimeoutListener> listeners = new CopyOnWriteArrayList<>();

    private SessionTimeoutState state = Idle.INSTANCE;
    private boolean backgrounded;
    private boolean visible;
    private boolean extensionInFlight;

    public SessionTimeoutTracker(
            Clock clock,
            CountdownTicker ticker,
            SdkCommandService commands,
            Navigator navigator,
            OrchestratorConfig.Session config) {
        this.clock = Objects.requireNonNull(clock, "clock");
        this.ticker = Objects.requireNonNull(ticker, "ticker");
        this.commands = Objects.requireNonNull(commands, "commands");
        this.navigator = Objects.requireNonNull(navigator, "navigator");
        this.homeScreen = Objects.requireNonNull(config, "config").homeScreen();
    }

    public void attach(EventDispatchRegistry registry) {
        registry.subscribe(SdkEventType.SESSION_TIMEOUT, this::onSessionTimeout);
        registry.subscribe(SdkEventType.SESSION_TIMEOUT_NOTIFICATION, this::onTimeoutNotification);
        registry.subscribe(SdkEventType.SESSION_EXTENSION_RESPONSE, this::onExtensionResponse);
    }

    public void addListener(SessionTimeoutListener listener) {
        listeners.add(Objects.requireNonNull(listener, "listener"));
    }

    public void removeListener(SessionTimeoutListener listener) {
        listeners.remove(listener);
    }

    public synchronized SessionTimeoutState state() {
        return state;
    }

    public synchronized CountdownView view() {
        if (state instanceof AdvisoryCountdown advisory) {
            return new CountdownView(
                    SessionTimeoutState.Kind.ADVISORY,
                    advisory.secondsRemaining(),
                    advisory.canExtend(),
                    advisory.message(),
                    extensionInFlight,
                    visible);
        }
        if (state instanceof MandatoryExpired expired) {
            return new CountdownView(SessionTimeoutState.Kind.MANDATORY, 0, false, expired.message(), false, visible);
        }
        return new CountdownView(SessionTimeoutState.Kind.IDLE, 0, false, null, false, false);
    }

    /** Hard expiry: valid from any state, the session is already over. */
    public synchronized void onSessionTimeout(SessionTimeoutEvent event) {
        LOG.infof("Session expired: %s", event.message());
        ticker.stop();
        extensionInFlight = false;
        state = new MandatoryExpired(event.message());
        visible = true;
        publishState();
    }

    public synchronized void onTimeoutNotification(SessionTimeoutNotificationEvent event) {
        if (state instanceof MandatoryExpired) {
            LOG.debug("Ignoring idle timeout warning, session already expired");
            return;
        }
        int seconds = event.timeLeftInSeconds();
        Instant backgroundedAt = backgrounded ? clock.instant() : null;
        if (state instanceof AdvisoryCountdown current) {
            seconds = Math.min(seconds, current.secondsRemaining());
            if (current.backgroundedAt() != null) {
                backgroundedAt = current.backgroundedAt();
            }
        }
        LOG.debugf(
                "Idle timeout warning for %s: %d seconds left, extendable=%s",
                event.userID(), seconds, event.canExtend());
        state = new AdvisoryCountdown(seconds, event.canExtend(), event.message(), backgroundedAt);
        visible = true;
        publishState();
        if (seconds == 0) {
            publish(SessionTimeoutListener::onCountdownElapsed);
        } else {
            startTickerIfRunnable();
        }
    }

    /** One countdown step. Ignored unless counting down, visible and in the foreground. */
    public synchronized void tick() {
        if (!(state instanceof AdvisoryCountdown advisory) || backgrounded || !visible) {
            return;
        }
        if (advisory.secondsRemaining() == 0) {
            ticker.stop();
            return;
        }
        AdvisoryCountdown next = advisory.withSecondsRemaining(advisory.secondsRemaining() - 1);
        state = next;
        publishState();
        if (next.secondsRemaining() == 0) {
            ticker.stop();
            LOG.debug("Idle timeout countdown elapsed");
            publish(SessionTimeoutListener::onCountdownElapsed);
        }
    }

    public synchronized void onLifecycleChange(AppLifecycleState lifecycle) {
        if (lifecycle.isBackgrounded()) {
            onBackgrounded();
        } else {
            onForegrounded();
        }
    }

    private void onBackgrounded() {
        if (backgrounded) {
            return;
        }
        backgrounded = true;
        ticker.stop();
        if (state instanceof AdvisoryCountdown advisory && advisory.backgroundedAt() == null) {
            state = advisory.withBackgroundedAt(clock.instant());
            LOG.debugf("App backgrounded with %d seconds left", advisory.secondsRemaining());
        }
    }

    private void onForegrounded() {
        if (!backgrounded) {
            return;
        }
        backgrounded = false;
        if (!(state instanceof AdvisoryCountdown advisory)) {
            return;
        }
        int remaining = advisory.secondsRemaining();
        if (advisory.backgroundedAt() != null) {
            long elapsed = Duration.between(advisory.backgroundedAt(), clock.instant()).getSeconds();
            if (elapsed > 0) {
                remaining = (int) Math.max(0L, remaining - elapsed);
            }
            LOG.debugf("App foregrounded after %d seconds, %d seconds left", Math.max(0L, elapsed), remaining);
        }
        AdvisoryCountdown corrected = new AdvisoryCountdown(remaining, advisory.canExtend(), advisory.message(), null);
        state = corrected;
        publishState();
        if (remaining == 0) {
            if (advisory.secondsRemaining() > 0) {
                publish(SessionTimeoutListener::onCountdownElapsed);
            }
        } else {
            startTickerIfRunnable();
        }
    }

    /** The modal was mounted or unmounted; the ticker only runs while it is shown. */
    public synchronized void setVisible(boolean shown) {
        if (visible == shown) {
            return;
        }
        visible = shown;
        if (shown) {
            startTickerIfRunnable();
        } else {
            ticker.stop();
        }
    }

    /**
     * Asks the SDK to extend the idle timeout. Only possible while an extendable countdown is shown and
     * no other extension is pending.
     */
    public synchronized CompletableFuture<CommandAcknowledgement> extendSession() {
        if (!(state instanceof AdvisoryCountdown advisory) || !advisory.canExtend()) {
            return CompletableFuture.failedFuture(new IllegalStateException("Session cannot be extended"));
        }
        if (extensionInFlight) {
            return CompletableFuture.failedFuture(new IllegalStateException("Session extension already in progress"));
        }
        extensionInFlight = true;
        publishState();
        LOG.debug("Requesting session extension");
        CompletableFuture<CommandAcknowledgement> submitted = commands.extendSessionIdleTimeout();
        submitted.whenComplete((ack, error) -> {
            if (error != null) {
                onExtensionRejected(error);
            }
        });
        return submitted;
    }

    private synchronized void onExtensionRejected(Throwable error) {
        if (!extensionInFlight) {
            return;
        }
        extensionInFlight = false;
        Throwable cause = error.getCause() != null ? error.getCause() : error;
        LOG.warnf("Session extension rejected: %s", cause.getMessage());
        publishState();
        publish(listener -> listener.onExtensionFailed(cause.getMessage()));
    }

    public synchronized void onExtensionResponse(SessionExtensionResponseEvent event) {
        if (!extensionInFlight) {
            LOG.debug("Ignoring session extension response without pending request");
            return;
        }
        extensionInFlight = false;
        ChallengeStatus outcome = ChallengeStatusEvaluator.evaluate(event.error(), event.status());
        if (outcome.success()) {
            LOG.info("Session extended");
            ticker.stop();
            state = Idle.INSTANCE;
            visible = false;
            publishState();
            publish(SessionTimeoutListener::onSessionExtended);
            return;
        }
        LOG.warnf("Session extension failed: code=%d, message=%s", outcome.code(), outcome.message());
        publishState();
        publish(listener -> listener.onExtensionFailed(outcome.message()));
    }

    /**
     * User acknowledged the modal. After a hard expiry the app returns to the unauthenticated entry
     * point.
     */
    public synchronized void dismiss() {
        SessionTimeoutState previous = state;
        ticker.stop();
        state = Idle.INSTANCE;
        visible = false;
        extensionInFlight = false;
        if (previous instanceof MandatoryExpired) {
            LOG.infof("Session expiry acknowledged, returning to %s", homeScreen);
            navigator.reset(homeScreen);
        }
        if (!(previous instanceof Idle)) {
            publishState();
        }
    }

    /** @return {@code true} when the back action was swallowed by the modal */
    public synchronized boolean onBackPressed() {
        return visible && !(state instanceof Idle);
    }

    private void startTickerIfRunnable() {
        if (state instanceof AdvisoryCountdown advisory
                && advisory.secondsRemaining() > 0
                && visible
                && !backgrounded) {
            ticker.start(this::tick);
        }
    }

    private void publishState() {
        CountdownView view = view();
        publish(listener -> listener.onStateChanged(view));
    }

    private void publish(Consumer<SessionTimeoutListener> callback) {
        for (SessionTimeoutListener listener : listeners) {
            try {
                callback.accept(listener);
            } catch (RuntimeException ex) {
                LOG.warnf(ex, "SessionTimeoutListener %s failed", listener.getClass().getName());
            }
        }
    }
}
