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

package de.arbeitsagentur.mfa.orchestrator.router;

import static org.junit.jupiter.api.Assertions.*;

import de.arbeitsagentur.mfa.orchestrator.util.OrchestratorConfig.Platform;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.NullAndEmptySource;
import org.junit.jupiter.params.provider.ValueSource;

class LdaConsentMessageTest {

    @ParameterizedTest
    @NullAndEmptySource
    @ValueSource(strings = {"{not json", "[\"title\"]", "\"text\""})
    void fallsBackToDefaults(String custom) {
        LdaConsentMessage message = LdaConsentMessage.resolve("Face ID", custom);

        assertEquals(LdaConsentMessage.defaults("Face ID"), message);
        assertEquals("Face ID Consent", message.title());
        assertEquals(
                "Do you want to enable Face ID for faster and more secure access to this application?",
                message.message());
    }

    @Test
    void substitutesTokensInTitleAndMessage() {
        LdaConsentMessage message = LdaConsentMessage.resolve(
                "Touch ID",
                "{\"title\":\"Use __LDA_NAME__\",\"message\":\"Line one<BR>Enable __LDA_NAME__ now\","
                        + "\"btnApprove\":\"Enable\",\"btnReject\":\"Later\"}");

        assertEquals("Use Touch ID", message.title());
        assertEquals("Line one\nEnable Touch ID now", message.message());
        assertEquals("Enable", message.approveText());
        assertEquals("Later", message.rejectText());
    }

    @Test
    void emptyOrNonTextFieldsKeepDefaults() {
        LdaConsentMessage message = LdaConsentMessage.resolve("Pattern", "{\"title\":\"\",\"message\":42}");

        assertEquals("Pattern Consent", message.title());
        assertEquals(LdaConsentMessage.defaults("Pattern").message(), message.message());
    }

    @Test
    void ldaNamesDependOnPlatform() {
        assertEquals("Fingerprint", LdaType.displayName(1, Platform.ANDROID));
        assertEquals("Touch ID", LdaType.displayName(1, Platform.IOS));
        assertEquals("Face ID", LdaType.FACE.displayName(Platform.IOS));
        assertEquals("Device Credentials", LdaType.displayName(5, Platform.ANDROID));
        assertEquals(LdaType.UNKNOWN_NAME, LdaType.displayName(77, Platform.IOS));
    }
}
