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

import com.fasterxml.jackson.databind.JsonNode;
import java.io.IOException;
import java.util.Base64;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.jboss.logging.Logger;

/**
 * Debug logging of a successful login.
 *
 * <p>The SDK hands out {@code jwtJsonTokenInfo} either as a JSON document or as a compact JWT. Only
 * the claims in {@link #LOGGED_CLAIMS} are logged, never the token itself.
 */
public final class SessionTokenLog {

    private static final Logger LOG = Logger.getLogger(SessionTokenLog.class);

    static final List<String> LOGGED_CLAIMS = List.of("sub", "iss", "aud", "iat", "exp");

    private SessionTokenLog() {}

    public static void logLogin(String userID, String sessionID, String userRole, String jwtJsonTokenInfo) {
        if (!LOG.isDebugEnabled()) {
            return;
        }
        LOG.debugf(
                "Dashboard login of %s: sessionID=%s, userRole=%s, token claims=%s",
                userID, sessionID, userRole, loggableClaims(jwtJsonTokenInfo));
    }

    static Map<String, String> loggableClaims(String jwtJsonTokenInfo) {
        if (jwtJsonTokenInfo == null || jwtJsonTokenInfo.isBlank()) {
            return Map.of();
        }
        JsonNode claims;
        try {
            String trimmed = jwtJsonTokenInfo.trim();
            claims = trimmed.startsWith("{") ? SdkJson.MAPPER.readTree(trimmed) : compactJwtPayload(trimmed);
        } catch (IOException | IllegalArgumentException ex) {
            LOG.debugf("Unreadable jwtJsonTokenInfo (%d chars): %s", jwtJsonTokenInfo.length(), ex.getMessage());
            return Map.of();
        }
        Map<String, String> selected = new LinkedHashMap<>();
        if (claims == null || !claims.isObject()) {
            return selected;
        }
        for (String name : LOGGED_CLAIMS) {
            JsonNode value = claims.get(name);
            if (value != null && !value.isNull()) {
                selected.put(name, value.isValueNode() ? value.asText() : value.toString());
            }
        }
        return selected;
    }

    private static JsonNode compactJwtPayload(String token) throws IOException {
        String[] segments = token.split("\\.");
        if (segments.length < 2) {
            throw new IllegalArgumentException("neither a JSON document nor a compact JWT");
        }
        // the URL decoder accepts unpadded segments
        return SdkJson.MAPPER.readTree(Base64.getUrlDecoder().decode(segments[1]));
    }
}
