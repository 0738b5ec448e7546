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

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

import de.arbeitsagentur.mfa.orchestrator.support.SdkPayloads;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.function.Consumer;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

class SdkCommandServiceTest {

    private SdkTransport transport;
    private SdkCommandService commands;

    @BeforeEach
    void setUp() {
        transport = mock(SdkTransport.class);
        commands = new SdkCommandService(transport);
    }

    @SuppressWarnings("unchecked")
    private void acknowledge(String command, String json) {
        ArgumentCaptor<Consumer<String>> ack = ArgumentCaptor.forClass(Consumer.class);
        verify(transport).call(eq(command), any(), ack.capture());
        ack.getValue().accept(json);
    }

    @Test
    void acceptedAcknowledgementCompletesFuture() {
        CompletableFuture<CommandAcknowledgement> future = commands.setUser("alice");
        assertFalse(future.isDone());

        acknowledge("setUser", "{\"error\":" + SdkPayloads.noError() + ",\"response\":\"queued\"}");

        CommandAcknowledgement ack = future.join();
        assertTrue(ack.accepted());
        assertEquals("setUser", ack.command());
        assertEquals("queued", ack.response());
        verify(transport).call(eq("setUser"), eq(List.of("alice")), any());
    }

    @Test
    void rejectedAcknowledgementFailsWithError() {
        CompletableFuture<CommandAcknowledgement> future = commands.setActivationCode("123456");

        acknowledge("setActivationCode", SdkPayloads.acknowledgement(17));

        CompletionException ex = assertThrows(CompletionException.class, future::join);
        CommandRejectedException rejected = assertInstanceOf(CommandRejectedException.class, ex.getCause());
        assertEquals("setActivationCode", rejected.command());
        assertEquals(17, rejected.error().longErrorCode());
    }

    @Test
    void unreadableAcknowledgementFails() {
        CompletableFuture<CommandAcknowledgement> future = commands.resetAuthState();

        acknowledge("resetAuthState", "{\"status\":1}");

        CompletionException ex = assertThrows(CompletionException.class, future::join);
        CommandRejectedException rejected = assertInstanceOf(CommandRejectedException.class, ex.getCause());
        assertNull(rejected.error());
        assertTrue(rejected.getMessage().contains("unreadable acknowledgement"));
    }

    @Test
    void errorBlockWithoutCodeIsNotAnAcceptance() {
        CompletableFuture<CommandAcknowledgement> future = commands.resetAuthState();

        acknowledge("resetAuthState", "{\"error\":{}}");

        CompletionException ex = assertThrows(CompletionException.class, future::join);
        CommandRejectedException rejected = assertInstanceOf(CommandRejectedException.class, ex.getCause());
        assertTrue(rejected.getMessage().contains("unreadable acknowledgement"));
    }

    @Test
    void invalidInputNeverReachesTransport() {
        CompletableFuture<CommandAcknowledgement> future = commands.setUser("  ");

        CompletionException ex = assertThrows(CompletionException.class, future::join);
        assertInstanceOf(IllegalArgumentException.class, ex.getCause());
        assertEquals("Missing field: userID", ex.getCause().getMessage());
        verifyNoInteractions(transport);
    }

    @Test
    void negativeChallengeModeIsRejected() {
        CompletableFuture<CommandAcknowledgement> future = commands.setPassword("secret", -1);

        assertThrows(CompletionException.class, future::join);
        verifyNoInteractions(transport);
    }

    @Test
    void transportFailureFailsFuture() {
        doThrow(new IllegalStateException("bridge detached")).when(transport).call(any(), any(), any());

        CompletableFuture<CommandAcknowledgement> future = commands.logOff("alice");

        CompletionException ex = assertThrows(CompletionException.class, future::join);
        CommandRejectedException rejected = assertInstanceOf(CommandRejectedException.class, ex.getCause());
        assertInstanceOf(IllegalStateException.class, rejected.getCause());
    }

    @Test
    void passesArgumentsInCommandOrder() {
        commands.setUserConsentForLDA(true, 16, 1);
        commands.updatePassword("old pass", "new pass", 2);
        commands.authenticateUserAndSignData("pay 10 EUR", 4, 1, "transfer");

        verify(transport).call(eq("setUserConsentForLDA"), eq(List.of(true, 16, 1)), any());
        verify(transport).call(eq("updatePassword"), eq(List.of("old pass", "new pass", 2)), any());
        verify(transport).call(eq("authenticateUserAndSignData"), eq(List.of("pay 10 EUR", 4, 1, "transfer")), any());
    }

    @Test
    void forgotPasswordWithoutUserSendsNoArguments() {
        commands.forgotPassword(null);
        commands.forgotPassword("alice");

        verify(transport).call(eq("forgotPassword"), eq(List.of()), any());
        verify(transport).call(eq("forgotPassword"), eq(List.of("alice")), any());
    }

    @Test
    void argumentFreeCommandsUseTheirSdkNames() {
        commands.resendActivationCode();
        commands.extendSessionIdleTimeout();
        commands.fallbackNewDeviceActivationFlow();
        commands.resetAuthenticateUserAndSignDataState();
        commands.performVerifyAuth(false);
        commands.initiateUpdateFlowForCredential("Password");
        commands.getAllChallenges("alice");

        verify(transport).call(eq("resendActivationCode"), eq(List.of()), any());
        verify(transport).call(eq("extendSessionIdleTimeout"), eq(List.of()), any());
        verify(transport).call(eq("fallbackNewDeviceActivationFlow"), eq(List.of()), any());
        verify(transport).call(eq("resetAuthenticateUserAndSignDataState"), eq(List.of()), any());
        verify(transport).call(eq("performVerifyAuth"), eq(List.of(false)), any());
        verify(transport).call(eq("initiateUpdateFlowForCredential"), eq(List.of("Password")), any());
        verify(transport).call(eq("getAllChallenges"), eq(List.of("alice")), any());
    }
}
