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

package de.arbeitsagentur.mfa.orchestrator.event.payload;

import de.arbeitsagentur.mfa.orchestrator.event.MalformedEventException;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

final class PayloadChecks {

    private PayloadChecks() {}

    /** Immutable copy without {@code null} elements; {@code null} becomes an empty list. */
    static <T> List<T> nonNullElements(List<T> values) {
        if (values == null) {
            return List.of();
        }
        return values.stream().filter(Objects::nonNull).collect(Collectors.toUnmodifiableList());
    }

    static void require(Object value, String eventName, String field) {
        if (value == null) {
            throw new MalformedEventException(eventName, "missing field: " + field);
        }
    }

    static void requireNonNegative(Integer value, String eventName, String field) {
        require(value, eventName, field);
        if (value < 0) {
            throw new MalformedEventException(eventName, "negative field: " + field);
        }
    }

    static void requireError(RdnaError error, String eventName, String field) {
        require(error, eventName, field);
        require(error.longErrorCode(), eventName, field + ".longErrorCode");
    }

    static void requireStatus(RdnaStatus status, String eventName, String field) {
        require(status, eventName, field);
        require(status.statusCode(), eventName, field + ".statusCode");
    }

    static void requireChallengeEnvelope(ChallengeEvent event, String eventName) {
        requireError(event.error(), eventName, "error");
        require(event.challengeResponse(), eventName, "challengeResponse");
        requireStatus(event.challengeResponse().status(), eventName, "challengeResponse.status");
    }
}
