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

package de.arbeitsagentur.mfa.orchestrator.support;

/** Raw SDK payloads as the native bridge emits them. */
public final class SdkPayloads {

    private SdkPayloads() {}

    public static String error(int longErrorCode, String errorString) {
        return "{\"longErrorCode\":" + longErrorCode + ",\"shortErrorCode\":" + (longErrorCode == 0 ? 0 : 1)
                + ",\"errorString\":\"" + errorString + "\"}";
    }

    public static String noError() {
        return error(0, "Success");
    }

    public static String status(int statusCode, String statusMessage) {
        return "{\"statusCode\":" + statusCode + ",\"statusMessage\":\"" + statusMessage + "\"}";
    }

    public static String challengeResponse(String status, String challengeInfo) {
        return "{\"status\":" + status
                + ",\"session\":{\"sessionType\":0,\"sessionID\":\"app-session\"}"
                + ",\"additionalInfo\":{\"currentWorkFlow\":\"\"}"
                + ",\"challengeInfo\":" + challengeInfo + "}";
    }

    public static String getPassword(String userID, int challengeMode, int attemptsLeft) {
        return getPassword(userID, challengeMode, attemptsLeft, status(100, "Success"), "[]");
    }

    public static String getPassword(
            String userID, int challengeMode, int attemptsLeft, String status, String challengeInfo) {
        return "{\"userID\":\"" + userID + "\",\"challengeMode\":" + challengeMode + ",\"attemptsLeft\":"
                + attemptsLeft + ",\"challengeResponse\":" + challengeResponse(status, challengeInfo)
                + ",\"error\":" + noError() + "}";
    }

    public static String getUser() {
        return "{\"recentLoggedInUser\":\"alice\",\"rememberedUsers\":[\"alice\"],\"challengeResponse\":"
                + challengeResponse(status(100, "Success"), "[]") + ",\"error\":" + noError() + "}";
    }

    public static String getActivationCode(String userID, int attemptsLeft) {
        return "{\"userID\":\"" + userID + "\",\"verificationKey\":\"vk-1\",\"attemptsLeft\":" + attemptsLeft
                + ",\"challengeResponse\":" + challengeResponse(status(100, "Success"), "[]")
                + ",\"error\":" + noError() + "}";
    }

    public static String getUserConsentForLda(String userID, int authenticationType, String challengeInfo) {
        return "{\"userID\":\"" + userID + "\",\"challengeMode\":16,\"authenticationType\":" + authenticationType
                + ",\"challengeResponse\":" + challengeResponse(status(100, "Success"), challengeInfo)
                + ",\"error\":" + noError() + "}";
    }

    public static String userLoggedIn(String userID) {
        return "{\"userID\":\"" + userID + "\",\"challengeResponse\":{"
                + "\"status\":" + status(100, "Success")
                + ",\"session\":{\"sessionType\":1,\"sessionID\":\"session-42\"}"
                + ",\"additionalInfo\":{\"jwtJsonTokenInfo\":\"not-a-jwt\",\"idvUserRole\":\"customer\","
                + "\"currentWorkFlow\":\"MFA\"}"
                + ",\"challengeInfo\":[]},\"error\":" + noError() + "}";
    }

    public static String userLoggedOff(String userID) {
        return "{\"userID\":\"" + userID + "\",\"challengeResponse\":"
                + challengeResponse(status(100, "Success"), "[]") + ",\"error\":" + noError() + "}";
    }

    public static String credentialsAvailable(String userID, int longErrorCode, String... options) {
        StringBuilder list = new StringBuilder("[");
        for (int i = 0; i < options.length; i++) {
            if (i > 0) {
                list.append(',');
            }
            list.append('"').append(options[i]).append('"');
        }
        list.append(']');
        return "{\"userID\":\"" + userID + "\",\"options\":" + list + ",\"error\":"
                + error(longErrorCode, longErrorCode == 0 ? "Success" : "failed") + "}";
    }

    public static String addNewDeviceOptions(String userID) {
        return "{\"userID\":\"" + userID + "\",\"newDeviceOptions\":[\"fallback\"],\"challengeInfo\":[]}";
    }

    public static String sessionTimeout(String message) {
        return "{\"message\":\"" + message + "\"}";
    }

    public static String sessionTimeoutNotification(int timeLeftInSeconds, int sessionCanBeExtended) {
        return "{\"userID\":\"alice\",\"message\":\"Your session is about to expire\",\"timeLeftInSeconds\":"
                + timeLeftInSeconds + ",\"sessionCanBeExtended\":" + sessionCanBeExtended
                + ",\"info\":{\"sessionType\":1,\"currentWorkFlow\":\"MFA\"}}";
    }

    public static String sessionExtensionResponse(int longErrorCode, int statusCode) {
        return "{\"status\":" + status(statusCode, statusCode == 100 ? "Success" : "Extension denied")
                + ",\"error\":" + error(longErrorCode, longErrorCode == 0 ? "Success" : "failed") + "}";
    }

    public static String dataSigningResponse(int longErrorCode, int statusCode) {
        return "{\"dataPayload\":\"pay 10 EUR\",\"dataPayloadLength\":10,\"reason\":\"transfer\","
                + "\"payloadSignature\":\"c2lnbmF0dXJl\",\"dataSignatureID\":\"sig-1\",\"authLevel\":4,"
                + "\"authenticationType\":1,\"status\":" + status(statusCode, "done")
                + ",\"error\":" + error(longErrorCode, longErrorCode == 0 ? "Success" : "failed") + "}";
    }

    public static String acknowledgement(int longErrorCode) {
        return "{\"error\":" + error(longErrorCode, longErrorCode == 0 ? "Success" : "rejected") + "}";
    }
}
