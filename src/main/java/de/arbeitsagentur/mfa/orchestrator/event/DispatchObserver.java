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

/**
 * Observes what the {@link EventDispatchRegistry} does with each envelope.
 *
 * <p>All callback methods have default empty implementations, so observers only need to override
 * the outcomes they care about. Observers are called synchronously on the dispatching thread and
 * must not block.
 */
public interface DispatchObserver {

    /**
     * Called after a decoded event was handed to its handler.
     *
     * @param event the delivered event
     */
    default void onDelivered(SdkEvent event) {}

    /**
     * Called when no handler is registered for the envelope's event name.
     *
     * @param envelope the envelope that was not delivered
     */
    default void onUnhandled(EventEnvelope envelope) {}

    /**
     * Called when the envelope was dropped because it could not be decoded.
     *
     * @param envelope the dropped envelope
     * @param reason   why it was dropped
     */
    default void onDropped(EventEnvelope envelope, MalformedEventException reason) {}

    /**
     * Called when the handler itself failed.
     *
     * @param event the event being handled
     * @param error what the handler threw
     */
    default void onHandlerFailed(SdkEvent event, RuntimeException error) {}
}
