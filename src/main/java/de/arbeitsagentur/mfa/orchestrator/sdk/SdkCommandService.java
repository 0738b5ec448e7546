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

package de.arbeitsagentur.mfa.orchestrator.sdk;

import static de.arbeitsagentur.mfa.orchestrator.sdk.CommandInputValidator.MAX_CODE_LENGTH;
import static de.arbeitsagentur.mfa.orchestrator.sdk.CommandInputValidator.MAX_SECRET_LENGTH;
import static de.arbeitsagentur.mfa.orchestrator.sdk.CommandInputValidator.MAX_SIGNING_PAYLOAD_LENGTH;
import static de.arbeitsagentur.mfa.orchestrator.sdk.CommandInputValidator.MAX_USER_ID_LENGTH;

import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.function.Supplier;
import org.jboss.logging.Logger;

/**
 * Typed facade over {@link SdkTransport}.
 *
 * <p>Every command returns a future of the submission acknowledgement. A completed future only
 * means "the SDK accepted the command, wait for the event"; it never means the operation is done.
 * The future fails with {@link CommandRejectedException} when {@code longErrorCode != 0} or the
 * acknowledgement cannot be read, and with {@link IllegalArgumentException} when the arguments are
 * invalid, in which case nothing is sent to the SDK.
 */
public class SdkCommandService {

    private static final Logger LOG = Logger.getLogger(SdkCommandService.class);

    private final SdkTransport transport;

    public SdkCommandService(SdkTransport transport) {
        this.transport = Objects.requireNonNull(transport, "transport");
    }

    public CompletableFuture<CommandAcknowledgement> setUser(String userID) {
        return submit("setUser", () -> List.of(CommandInputValidator.requireBoundedText(
                userID, MAX_USER_ID_LENGTH, "userID")));
    }

    public CompletableFuture<CommandAcknowledgement> setActivationCode(String activationCode) {
        return submit("setActivationCode", () -> List.of(CommandInputValidator.requireBoundedText(
                activationCode, MAX_CODE_LENGTH, "activationCode")));
    }

    public CompletableFuture<CommandAcknowledgement> resendActivationCode() {
        return submit("resendActivationCode", List::of);
    }

    public CompletableFuture<CommandAcknowledgement> setUserConsentForLDA(
            boolean enrollLda, int challengeMode, int authenticationType) {
        return submit("setUserConsentForLDA", () -> List.of(
                enrollLda,
                CommandInputValidator.requireNonNegative(challengeMode, "challengeMode"),
                CommandInputValidator.requireNonNegative(authenticationType, "authenticationType")));
    }

    public CompletableFuture<CommandAcknowledgement> setPassword(String password, int challengeMode) {
        return submit("setPassword", () -> List.of(
                CommandInputValidator.requireSecret(password, MAX_SECRET_LENGTH, "password"),
                CommandInputValidator.requireNonNegative(challengeMode, "challengeMode")));
    }

    public CompletableFuture<CommandAcknowledgement> updatePassword(
            String currentPassword, String newPassword, int challengeMode) {
        return submit("updatePassword", () -> List.of(
                CommandInputValidator.requireSecret(currentPassword, MAX_SECRET_LENGTH, "currentPassword"),
                CommandInputValidator.requireSecret(newPassword, MAX_SECRET_LENGTH, "newPassword"),
                CommandInputValidator.requireNonNegative(challengeMode, "challengeMode")));
    }

    public CompletableFuture<CommandAcknowledgement> resetAuthState() {
        return submit("resetAuthState", List::of);
    }

    public CompletableFuture<CommandAcknowledgement> logOff(String userID) {
        return submit("logOff", () -> List.of(CommandInputValidator.requireBoundedText(
                userID, MAX_USER_ID_LENGTH, "userID")));
    }

    public CompletableFuture<CommandAcknowledgement> extendSessionIdleTimeout() {
        return submit("extendSessionIdleTimeout", List::of);
    }

    public CompletableFuture<CommandAcknowledgement> getAllChallenges(String userID) {
        return submit("getAllChallenges", () -> List.of(CommandInputValidator.requireBoundedText(
                userID, MAX_USER_ID_LENGTH, "userID")));
    }

    public CompletableFuture<CommandAcknowledgement> initiateUpdateFlowForCredential(String credentialType) {
        return submit("initiateUpdateFlowForCredential", () -> List.of(CommandInputValidator.requireBoundedText(
                credentialType, MAX_CODE_LENGTH, "credentialType")));
    }

    public CompletableFuture<CommandAcknowledgement> performVerifyAuth(boolean verified) {
        return submit("performVerifyAuth", () -> List.of(verified));
    }

    public CompletableFuture<CommandAcknowledgement> fallbackNewDeviceActivationFlow() {
        return submit("fallbackNewDeviceActivationFlow", List::of);
    }

    /** Starts the forgot-password flow; a {@code null} user means the current user. */
    public CompletableFuture<CommandAcknowledgement> forgotPassword(String userID) {
        return submit("forgotPassword", () -> {
            String normalized = CommandInputValidator.optionalBoundedText(userID, MAX_USER_ID_LENGTH, "userID");
            return normalized == null ? List.of() : List.of(normalized);
        });
    }

    public CompletableFuture<CommandAcknowledgement> authenticateUserAndSignData(
            String payload, int authLevel, int authenticatorType, String reason) {
        return submit("authenticateUserAndSignData", () -> List.of(
                CommandInputValidator.requireBoundedText(payload, MAX_SIGNING_PAYLOAD_LENGTH, "payload"),
                CommandInputValidator.requireNonNegative(authLevel, "authLevel"),
                CommandInputValidator.requireNonNegative(authenticatorType, "authenticatorType"),
                CommandInputValidator.requireBoundedText(reason, MAX_CODE_LENGTH, "reason")));
    }

    public CompletableFuture<CommandAcknowledgement> resetAuthenticateUserAndSignDataState() {
        return submit("resetAuthenticateUserAndSignDataState", List::of);
    }

    private CompletableFuture<CommandAcknowledgement> submit(String command, Supplier<List<Object>> arguments) {
        CompletableFuture<CommandAcknowledgement> result = new CompletableFuture<>();
        List<Object> validated;
        try {
            validated = arguments.get();
        } catch (IllegalArgumentException ex) {
            LOG.debugf("Command %s not submitted: %s", command, ex.getMessage());
            result.completeExceptionally(ex);
            return result;
        }

        LOG.debugf("Submitting command %s", command);
        try {
            transport.call(command, validated, json -> complete(result, command, json));
        } catch (RuntimeException ex) {
            LOG.warnf(ex, "Transport failed to submit %s", command);
            result.completeExceptionally(new CommandRejectedException(command, "transport failure", ex));
        }
        return result;
    }

    private static void complete(CompletableFuture<CommandAcknowledgement> result, String command, String json) {
        CommandAcknowledgement acknowledgement;
        try {
            acknowledgement = CommandAcknowledgement.parse(command, json);
        } catch (Exception ex) {
            LOG.warnf("Unreadable acknowledgement for %s: %s", command, ex.getMessage());
            result.completeExceptionally(new CommandRejectedException(command, "unreadable acknowledgement", ex));
            return;
        }
        if (acknowledgement.accepted()) {
            LOG.debugf("Command %s accepted", command);
            result.complete(acknowledgement);
        } else {
            LOG.infof(
                    "Command %s rejected: longErrorCode=%d, error=%s",
                    command, acknowledgement.error().longErrorCode(), acknowledgement.error().errorString());
            result.completeExceptionally(new CommandRejectedException(command, acknowledgement.error()));
        }
    }
}
