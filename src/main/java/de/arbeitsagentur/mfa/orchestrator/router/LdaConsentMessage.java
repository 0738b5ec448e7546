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

import com.fasterxml.jackson.databind.JsonNode;
import de.arbeitsagentur.mfa.orchestrator.util.SdkJson;
import org.jboss.logging.Logger;

/**
 * Copy of the LDA consent screen.
 *
 * <p>The server may customise it through a JSON document under {@code LDA_CONSENT_MESSAGE} with
 * {@code title}, {@code message}, {@code btnApprove} and {@code btnReject}. In title and message,
 * {@code <BR>} becomes a line break and {@code __LDA_NAME__} the mechanism name.
 *
 * @param ldaName     mechanism name
 * @param title       screen title
 * @param message     consent question
 * @param approveText approve button label
 * @param rejectText  reject button label
 */
public record LdaConsentMessage(
        String ldaName, String title, String message, String approveText, String rejectText) {

    private static final Logger LOG = Logger.getLogger(LdaConsentMessage.class);

    static final String LINE_BREAK_TOKEN = "<BR>";
    static final String LDA_NAME_TOKEN = "__LDA_NAME__";

    public static LdaConsentMessage defaults(String ldaName) {
        return new LdaConsentMessage(
                ldaName,
                ldaName + " Consent",
                "Do you want to enable " + ldaName + " for faster and more secure access to this application?",
                "Approve",
                "Reject");
    }

    /**
     * Builds the consent copy, applying the custom document when present and readable.
     *
     * @param ldaName    mechanism name
     * @param customJson custom document, may be {@code null}
     */
    public static LdaConsentMessage resolve(String ldaName, String customJson) {
        LdaConsentMessage result = defaults(ldaName);
        if (customJson == null || customJson.isBlank()) {
            return result;
        }
        JsonNode custom;
        try {
            custom = SdkJson.MAPPER.readTree(customJson);
        } catch (Exception ex) {
            LOG.warnf("Failed to parse custom LDA consent message: %s", ex.getMessage());
            return result;
        }
        if (custom == null || !custom.isObject()) {
            LOG.warn("Custom LDA consent message is not an object");
            return result;
        }
        String title = text(custom, "title");
        String message = text(custom, "message");
        String approve = text(custom, "btnApprove");
        String reject = text(custom, "btnReject");
        return new LdaConsentMessage(
                ldaName,
                title != null ? substitute(title, ldaName) : result.title(),
                message != null ? substitute(message, ldaName) : result.message(),
                approve != null ? approve : result.approveText(),
                reject != null ? reject : result.rejectText());
    }

    private static String text(JsonNode node, String field) {
        JsonNode value = node.get(field);
        if (value == null || !value.isTextual() || value.asText().isEmpty()) {
            return null;
        }
        return value.asText();
    }

    private static String substitute(String template, String ldaName) {
        return template.replace(LINE_BREAK_TOKEN, "\n").replace(LDA_NAME_TOKEN, ldaName);
    }
}
