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

import tools.jackson.core.JacksonException;
import tools.jackson.databind.ObjectMapper;

import java.security.SecureRandom;
import java.util.Base64;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Supplier;

/**
 * Builds authorization requests for an anonymous client: the client id doubles as the
 * redirect URI and every request gets a fresh nonce.
 */
public class AuthorizationRequestBuilder {
    private static final SecureRandom RANDOM = new SecureRandom();

    private final ObjectMapper objectMapper;
    private final String clientId;
    private final ClientMetadata clientMetadata;
    private final Supplier<String> nonceSource;

    public AuthorizationRequestBuilder(ObjectMapper objectMapper, String clientId) {
        this(objectMapper, clientId, ClientMetadata.walletDefault(), AuthorizationRequestBuilder::randomNonce);
    }

    public AuthorizationRequestBuilder(ObjectMapper objectMapper,
                                       String clientId,
                                       ClientMetadata clientMetadata,
                                       Supplier<String> nonceSource) {
        if (clientId == null || clientId.isBlank()) {
            throw new IllegalArgumentException("clientId must not be blank");
        }
        this.objectMapper = objectMapper;
        this.clientId = clientId;
        this.clientMetadata = clientMetadata;
        this.nonceSource = nonceSource;
    }

    public BuiltAuthorizationRequest build(ProviderConfiguration provider, List<String> scopes) {
        List<String> unsupported = scopes == null ? List.of() : scopes.stream()
                .filter(s -> !provider.supportsScope(s))
                .toList();
        if (!unsupported.isEmpty()) {
            throw new IllegalArgumentException("Provider %s does not support scopes %s"
                    .formatted(provider.issuer(), unsupported));
        }
        return build(provider.authorizationEndpoint(), scopes);
    }

    public BuiltAuthorizationRequest build(String providerEndpoint, List<String> scopes) {
        if (providerEndpoint == null || providerEndpoint.isBlank()) {
            throw new IllegalArgumentException("Provider endpoint must not be blank");
        }
        if (scopes == null || scopes.isEmpty()) {
            throw new IllegalArgumentException("At least one scope is required");
        }
        AuthorizationRequest request = new AuthorizationRequest(
                null,
                null,
                String.join(" ", scopes),
                nonceSource.get(),
                clientId,
                clientId,
                clientMetadata,
                AuthorizationRequest.RESPONSE_TYPE_VP_TOKEN);
        String separator = providerEndpoint.contains("?") ? "&" : "?";
        return new BuiltAuthorizationRequest(request, providerEndpoint + separator + encode(request));
    }

    /**
     * Serializes a request to its query string form; object-valued parameters are JSON
     * encoded before percent-encoding.
     */
    public String encode(AuthorizationRequest request) {
        Map<String, String> parameters = new LinkedHashMap<>();
        parameters.put(AuthorizationRequest.PRESENTATION_DEFINITION, json(request.presentationDefinition()));
        parameters.put(AuthorizationRequest.PRESENTATION_DEFINITION_URI, request.presentationDefinitionUri());
        parameters.put(AuthorizationRequest.SCOPE, request.scope());
        parameters.put(AuthorizationRequest.NONCE, request.nonce());
        parameters.put(AuthorizationRequest.CLIENT_ID, request.clientId());
        parameters.put(AuthorizationRequest.REDIRECT_URI, request.redirectUri());
        parameters.put(AuthorizationRequest.CLIENT_METADATA, json(request.clientMetadata()));
        parameters.put(AuthorizationRequest.RESPONSE_TYPE, request.responseType());
        return QueryStringCodec.encode(parameters);
    }

    /**
     * 128 random bits, base64url without padding.
     */
    public static String randomNonce() {
        byte[] bytes = new byte[16];
        RANDOM.nextBytes(bytes);
        return Base64.getUrlEncoder().withoutPadding().encodeToString(bytes);
    }

    private String json(Object value) {
        if (value == null) {
            return null;
        }
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JacksonException e) {
            throw new IllegalStateException("Failed to serialize authorization request parameter", e);
        }
    }
}
