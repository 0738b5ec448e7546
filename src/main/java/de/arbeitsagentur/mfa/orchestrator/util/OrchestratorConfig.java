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

package de.arbeitsagentur.mfa.orchestrator.util;

import java.time.Duration;
import java.util.Locale;

public record OrchestratorConfig(Session session, Lda lda, Events events) {

    private static final String PREFIX = "mfa-orchestrator.";

    public enum Platform {
        ANDROID,
        IOS
    }

    public record Session(int tickIntervalMillis, String homeScreen) {

        public Duration tickInterval() {
            return Duration.ofMillis(tickIntervalMillis);
        }
    }

    public record Lda(Platform platform) {}

    public record Events(int maxPayloadLength) {}

    public static OrchestratorConfig defaults() {
        return new OrchestratorConfig(
                new Session(1000, OrchestratorConstants.DEFAULT_HOME_SCREEN),
                new Lda(Platform.ANDROID),
                new Events(262144));
    }

    public static OrchestratorConfig load() {
        return new OrchestratorConfig(
                new Session(
                        boundedInt("session", "tickIntervalMillis", 1000, 100, 10000),
                        text("session", "homeScreen", OrchestratorConstants.DEFAULT_HOME_SCREEN)),
                new Lda(platform(text("lda", "platform", "android"))),
                new Events(boundedInt("events", "maxPayloadLength", 262144, 1024, 4194304)));
    }

    private static Platform platform(String raw) {
        return "ios".equals(raw.trim().toLowerCase(Locale.ROOT)) ? Platform.IOS : Platform.ANDROID;
    }

    private static int boundedInt(String group, String key, int defaultValue, int min, int max) {
        Integer configured = readSystemInt(
                PREFIX + group + "." + key, PREFIX + group + "." + toKebabCase(key));
        int raw = configured != null ? configured : defaultValue;
        if (raw < min) {
            return min;
        }
        if (raw > max) {
            return max;
        }
        return raw;
    }

    private static String text(String group, String key, String defaultValue) {
        String raw = readSystemValue(PREFIX + group + "." + key, PREFIX + group + "." + toKebabCase(key));
        return raw != null ? raw.trim() : defaultValue;
    }

    private static Integer readSystemInt(String... propertyNames) {
        String raw = readSystemValue(propertyNames);
        if (raw == null) {
            return null;
        }
        try {
            return Integer.parseInt(raw.trim());
        } catch (NumberFormatException ignored) {
            // invalid values fall back to the default
            return null;
        }
    }

    private static String readSystemValue(String... propertyNames) {
        for (String propertyName : propertyNames) {
            String raw = System.getProperty(propertyName);
            if (raw == null || raw.isBlank()) {
                raw = System.getenv(toEnvVarName(propertyName));
            }
            if (raw != null && !raw.isBlank()) {
                return raw;
            }
        }
        return null;
    }

    private static String toEnvVarName(String propertyName) {
        return propertyName.toUpperCase(Locale.ROOT).replace('.', '_').replace('-', '_');
    }

    private static String toKebabCase(String value) {
        StringBuilder builder = new StringBuilder();
        for (int i = 0; i < value.length(); i++) {
            char ch = value.charAt(i);
            if (Character.isUpperCase(ch)) {
                if (builder.length() > 0) {
                    builder.append('-');
                }
                builder.append(Character.toLowerCase(ch));
            } else {
                builder.append(ch);
            }
        }
        return builder.toString();
    }
}
