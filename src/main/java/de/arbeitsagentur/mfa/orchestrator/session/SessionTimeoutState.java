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

import java.time.Instant;

/**
 * State of the session timeout modal.
 *
 * <p>Only the {@link SessionTimeoutTracker} creates and replaces these values.
 */
public sealed interface SessionTimeoutState
        permits SessionTimeoutState.Idle, SessionTimeoutState.AdvisoryCountdown, SessionTimeoutState.MandatoryExpired {

    enum Kind {
        IDLE,
        ADVISORY,
        MANDATORY
    }

    Kind kind();

    record Idle() implements SessionTimeoutState {

        static final Idle INSTANCE = new Idle();

        @Override
        public Kind kind() {
            return Kind.IDLE;
        }
    }

    /**
     * Idle-timeout warning counting down.
     *
     * @param secondsRemaining seconds until the SDK ends the session, never negative
     * @param canExtend        the session may be extended
     * @param message          message from the SDK
     * @param backgroundedAt   wall clock time the app went to background, {@code null} while in foreground
     */
    record AdvisoryCountdown(int secondsRemaining, boolean canExtend, String message, Instant backgroundedAt)
            implements SessionTimeoutState {

        public AdvisoryCountdown {
            if (secondsRemaining < 0) {
                secondsRemaining = 0;
            }
        }

        @Override
        public Kind kind() {
            return Kind.ADVISORY;
        }

        AdvisoryCountdown withSecondsRemaining(int seconds) {
            return new AdvisoryCountdown(seconds, canExtend, message, backgroundedAt);
        }

        AdvisoryCountdown withBackgroundedAt(Instant timestamp) {
            return new AdvisoryCountdown(secondsRemaining, canExtend, message, timestamp);
        }
    }

    /**
     * The session is already over; only acknowledgement is possible.
     *
     * @param message message from the SDK
     */
    record MandatoryExpired(String message) implements SessionTimeoutState {

        @Override
        public Kind kind() {
            return Kind.MANDATORY;
        }
    }
}
