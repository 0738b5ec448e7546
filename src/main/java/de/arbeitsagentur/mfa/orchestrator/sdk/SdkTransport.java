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

import java.util.List;
import java.util.function.Consumer;

/**
 * Command side of the native SDK bridge.
 *
 * <p>Implementations submit the command and invoke {@code acknowledgement} exactly once with the
 * JSON acknowledgement ({@code {"error":{...}}}). The acknowledgement only reports whether the
 * submission was accepted; the real outcome arrives later as an event.
 */
@FunctionalInterface
public interface SdkTransport {

    void call(String command, List<Object> arguments, Consumer<String> acknowledgement);
}
