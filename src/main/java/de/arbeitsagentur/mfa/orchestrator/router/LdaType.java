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

import de.arbeitsagentur.mfa.orchestrator.util.OrchestratorConfig.Platform;

/** Local device authentication mechanisms, keyed by the SDK's {@code authenticationType} code. */
public enum LdaType {
    INVALID(0, "Invalid Authentication", "Invalid Authentication"),
    FINGERPRINT(1, "Fingerprint", "Touch ID"),
    FACE(2, "Face Recognition", "Face ID"),
    PATTERN(3, "Pattern", "Pattern"),
    SSKB_PASSWORD(4, "SSKB Password", "SSKB Password"),
    DEVICE_PASSCODE(5, "Device Credentials", "Device Passcode"),
    BIOMETRIC(6, "Device Biometric", "Device Biometric"),
    SECURITY_QUESTION(7, "Security Question", "Security Question"),
    DEVICE_LDA(8, "Device Authentication", "Device Authentication"),
    EXTERNAL_BIOMETRIC_OPT_IN(9, "External Biometric (Opt-In)", "External Biometric (Opt-In)"),
    EXTERNAL_BIOMETRIC_OPT_OUT(10, "External Biometric (Opt-Out)", "External Biometric (Opt-Out)");

    public static final String UNKNOWN_NAME = "Local Device Authentication";

    private final int code;
    private final String androidName;
    private final String iosName;

    LdaType(int code, String androidName, String iosName) {
        this.code = code;
        this.androidName = androidName;
        this.iosName = iosName;
    }

    public int code() {
        return code;
    }

    public String displayName(Platform platform) {
        return platform == Platform.IOS ? iosName : androidName;
    }

    /** Display name for a raw SDK code; unknown codes get a generic name. */
    public static String displayName(int code, Platform platform) {
        for (LdaType type : values()) {
            if (type.code == code) {
                return type.displayName(platform);
            }
        }
        return UNKNOWN_NAME;
    }
}
