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

package de.arbeitsagentur.mfa.orchestrator.event;

import de.arbeitsagentur.mfa.orchestrator.event.payload.SdkEvent;
import de.arbeitsagentur.mfa.orchestrator.util.OrchestratorConfig;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Consumer;
import org.jboss.logging.Logger;

/**
 * Decouples the SDK transport from feature code.
 *
 * <p>Per event name the registry keeps an ordered stack of registrations. Only the top registration
 * receives events. {@link #subscribe} replaces the top entry (last registration wins), while
 * {@link #acquire} pushes a new owner that is removed again by closing the returned
 * {@link Subscription}, restoring whoever owned the event before.
 *
 * <p>Decoding never throws past this class: malformed payloads are reported to the
 * {@link DispatchObserver} and dropped, handlers never see partially typed objects. Handler failures
 * are caught and logged as well, so nothing reaches the transport.
 */
public class EventDispatchRegistry {

    private static final Logger LOG = Logger.getLogger(EventDispatchRegistry.class);

    private final Map<SdkEventType<?>, List<Registration<?>>> handlers = new HashMap<>();
    private final int maxPayloadLength;
    private final DispatchObserver observer;

    public EventDispatchRegistry() {
        this(OrchestratorConfig.defaults().events(), new LoggingDispatchObserver());
    }

    public EventDispatchRegistry(OrchestratorConfig.Events config, DispatchObserver observer) {
        this.maxPayloadLength = Objects.requireNonNull(config, "config").maxPayloadLength();
        this.observer = Objects.requireNonNull(observer, "observer");
    }

    /**
     * Registers {@code handler} as the sole receiver for {@code type}, replacing the current owner.
     */
    public synchronized <T extends SdkEvent> void subscribe(SdkEventType<T> type, Consumer<? super T> handler) {
        Objects.requireNonNull(handler, "handler");
        List<Registration<?>> stack = handlers.computeIfAbsent(type, ignored -> new ArrayList<>());
        Registration<T> registration = new Registration<>(type, handler);
        if (stack.isEmpty()) {
            stack.add(registration);
        } else {
            stack.set(stack.size() - 1, registration);
        }
        LOG.debugf("Subscribed handler for %s", type);
    }

    /** Clears every registration for {@code type}. */
    public synchronized void unsubscribe(SdkEventType<?> type) {
        List<Registration<?>> removed = handlers.remove(type);
        if (removed != null) {
            LOG.debugf("Unsubscribed %d handler(s) for %s", removed.size(), type);
        }
    }

    /**
     * Pushes {@code handler} as the new owner of {@code type}.
     *
     * @return token that removes this registration when closed
     */
    public synchronized <T extends SdkEvent> Subscription acquire(SdkEventType<T> type, Consumer<? super T> handler) {
        Objects.requireNonNull(handler, "handler");
        Registration<T> registration = new Registration<>(type, handler);
        handlers.computeIfAbsent(type, ignored -> new ArrayList<>()).add(registration);
        LOG.debugf("Acquired scoped handler for %s", type);
        return registration;
    }

    public synchronized boolean hasSubscriber(SdkEventType<?> type) {
        List<Registration<?>> stack = handlers.get(type);
        return stack != null && !stack.isEmpty();
    }

    /** Entry point for the SDK transport: {@code emit(eventName, jsonPayload)}. */
    public void onTransportEvent(String eventName, String rawPayload) {
        onTransportEvent(new EventEnvelope(eventName, rawPayload));
    }

    /** Entry point for the SDK transport. Never throws. */
    public void onTransportEvent(EventEnvelope envelope) {
        Optional<SdkEventType<?>> type = SdkEventType.byName(envelope.eventName());
        if (type.isEmpty()) {
            LOG.debugf("Ignoring unknown SDK event %s", envelope.eventName());
            notifyObserver(() -> observer.onUnhandled(envelope));
            return;
        }
        dispatch(type.get(), envelope);
    }

    private <T extends SdkEvent> void dispatch(SdkEventType<T> type, EventEnvelope envelope) {
        Registration<T> registration = top(type);
        if (registration == null) {
            notifyObserver(() -> observer.onUnhandled(envelope));
            return;
        }

        T event;
        try {
            if (envelope.payloadLength() > maxPayloadLength) {
                throw new MalformedEventException(
                        type.name(), "payload exceeds " + maxPayloadLength + " characters");
            }
            event = type.decode(envelope.rawPayload());
        } catch (MalformedEventException ex) {
            notifyObserver(() -> observer.onDropped(envelope, ex));
            return;
        }

        try {
            registration.handler.accept(event);
        } catch (RuntimeException ex) {
            notifyObserver(() -> observer.onHandlerFailed(event, ex));
            return;
        }
        notifyObserver(() -> observer.onDelivered(event));
    }

    @SuppressWarnings("unchecked")
    private synchronized <T extends SdkEvent> Registration<T> top(SdkEventType<T> type) {
        List<Registration<?>> stack = handlers.get(type);
        if (stack == null || stack.isEmpty()) {
            return null;
        }
        return (Registration<T>) stack.get(stack.size() - 1);
    }

    private synchronized boolean release(Registration<?> registration) {
        List<Registration<?>> stack = handlers.get(registration.type);
        if (stack == null) {
            return false;
        }
        // identity, not equals: the same handler may be registered more than once
        for (int i = stack.size() - 1; i >= 0; i--) {
            if (stack.get(i) == registration) {
                stack.remove(i);
                if (stack.isEmpty()) {
                    handlers.remove(registration.type);
                }
                return true;
            }
        }
        return false;
    }

    private synchronized boolean isRegistered(Registration<?> registration) {
        List<Registration<?>> stack = handlers.get(registration.type);
        if (stack == null) {
            return false;
        }
        for (Registration<?> candidate : stack) {
            if (candidate == registration) {
                return true;
            }
        }
        return false;
    }

    private void notifyObserver(Runnable callback) {
        try {
            callback.run();
        } catch (RuntimeException ex) {
            LOG.warnf(ex, "DispatchObserver %s failed", observer.getClass().getName());
        }
    }

    private final class Registration<T extends SdkEvent> implements Subscription {

        private final SdkEventType<T> type;
        private final Consumer<? super T> handler;

        private Registration(SdkEventType<T> type, Consumer<? super T> handler) {
            this.type = Objects.requireNonNull(type, "type");
            this.handler = handler;
        }

        @Override
        public SdkEventType<?> type() {
            return type;
        }

        @Override
        public boolean isActive() {
            return isRegistered(this);
        }

        @Override
        public void close() {
            if (release(this)) {
                LOG.debugf("Released scoped handler for %s", type);
            }
        }
    }
}
