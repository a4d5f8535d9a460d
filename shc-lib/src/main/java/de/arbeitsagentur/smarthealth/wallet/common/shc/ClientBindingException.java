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
package de.arbeitsagentur.smarthealth.wallet.common.shc;

/**
 * Raised when an anonymous client's {@code client_id} and {@code redirect_uri} differ.
 */
public class ClientBindingException extends PresentationExchangeException {
    public ClientBindingException(String clientId, String redirectUri) {
        super("client_id must match redirect_uri for anonymous clients (client_id=%s, redirect_uri=%s)"
                .formatted(clientId, redirectUri));
    }
}
