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

import static org.junit.jupiter.api.Assertions.*;

import de.arbeitsagentur.mfa.orchestrator.event.payload.SessionTimeoutNotificationEvent;
import de.arbeitsagentur.mfa.orchestrator.support.SdkPayloads;
import org.junit.jupiter.api.Test;

class SdkEventTypeTest {

    @Test
    void registersEveryEventName() {
        assertEquals(18, SdkEventType.values().size());
        for (SdkEventType<?> type : SdkEventType.values()) {
            assertSame(type, SdkEventType.byName(type.name()).orElseThrow());
        }
    }

    @Test
    void byNameIsCaseSensitive() {
        assertTrue(SdkEventType.byName("getPassword").isPresent());
        assertTrue(SdkEventType.byName("GetPassword").isEmpty());
        assertTrue(SdkEventType.byName(null).isEmpty());
    }

    @Test
    void decodesTimeoutNotification() {
        SessionTimeoutNotificationEvent event =
                SdkEventType.SESSION_TIMEOUT_NOTIFICATION.decode(SdkPayloads.sessionTimeoutNotification(60, 1));

        assertEquals(60, event.timeLeftInSeconds());
        assertTrue(event.canExtend());
        assertEquals("MFA", event.info().currentWorkFlow());
    }

    @Test
    void acceptsNumericStringsForIntegers() {
        SessionTimeoutNotificationEvent event = SdkEventType.SESSION_TIMEOUT_NOTIFICATION.decode(
                "{\"timeLeftInSeconds\":\"30\",\"sessionCanBeExtended\":0}");

        assertEquals(30, event.timeLeftInSeconds());
        assertFalse(event.canExtend());
    }

    @Test
    void rejectsNegativeTimeLeft() {
        MalformedEventException ex = assertThrows(
                MalformedEventException.class,
                () -> SdkEventType.SESSION_TIMEOUT_NOTIFICATION.decode(SdkPayloads.sessionTimeoutNotification(-5, 1)));
        assertEquals("onSessionTimeOutNotification", ex.eventName());
    }

    @Test
    void rejectsExtensionResponseWithEmptyStatus() {
        MalformedEventException ex = assertThrows(
                MalformedEventException.class,
                () -> SdkEventType.SESSION_EXTENSION_RESPONSE.decode(
                        "{\"status\":{},\"error\":" + SdkPayloads.noError() + "}"));
        assertTrue(ex.getMessage().contains("status.statusCode"));
    }

    @Test
    void rejectsSigningResponseWithoutStatus() {
        assertThrows(
                MalformedEventException.class,
                () -> SdkEventType.AUTHENTICATE_USER_AND_SIGN_DATA.decode(
                        "{\"error\":" + SdkPayloads.noError() + "}"));
    }
}
