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
import org.jboss.logging.Logger;

/**
 * Default {@link DispatchObserver} that logs every outcome.
 *
 * <p>Deliveries are logged at DEBUG, unknown or unhandled events at DEBUG, dropped payloads at WARN.
 * Payload bodies are only ever written at TRACE.
 */
public final class LoggingDispatchObserver implements DispatchObserver {

    private static final Logger LOG = Logger.getLogger(LoggingDispatchObserver.class);

    @Override
    public void onDelivered(SdkEvent event) {
        LOG.debugf("SDK event delivered: name=%s", event.eventName());
    }

    @Override
    public void onUnhandled(EventEnvelope envelope) {
        LOG.debugf("SDK event without handler: name=%s, length=%d", envelope.eventName(), envelope.payloadLength());
    }

    @Override
    public void onDropped(EventEnvelope envelope, MalformedEventException reason) {
        LOG.warnf("SDK event dropped: name=%s, reason=%s", envelope.eventName(), reason.getMessage());
        LOG.tracef("Dropped payload for %s: %s", envelope.eventName(), envelope.rawPayload());
    }

    @Override
    public void onHandlerFailed(SdkEvent event, RuntimeException error) {
        LOG.warnf(error, "Handler for SDK event %s failed", event.eventName());
    }
}
