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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import tools.jackson.core.JacksonException;
import tools.jackson.databind.ObjectMapper;

import java.util.Map;

/**
 * Parses authorization requests received by the wallet and resolves the presentation
 * definition they refer to. Every violation is fatal.
 */
public class AuthorizationRequestParser {
    private static final Logger LOG = LoggerFactory.getLogger(AuthorizationRequestParser.class);

    private final ObjectMapper objectMapper;
    private final ScopeRegistry scopeRegistry;
    private final ConstraintMatcher matcher;
    private final DefinitionUriResolver definitionUriResolver;

    public AuthorizationRequestParser(ObjectMapper objectMapper, ScopeRegistry scopeRegistry, ConstraintMatcher matcher) {
        this(objectMapper, scopeRegistry, matcher, null);
    }

    public AuthorizationRequestParser(ObjectMapper objectMapper,
                                      ScopeRegistry scopeRegistry,
                                      ConstraintMatcher matcher,
                                      DefinitionUriResolver definitionUriResolver) {
        this.objectMapper = objectMapper;
        this.scopeRegistry = scopeRegistry;
        this.matcher = matcher;
        this.definitionUriResolver = definitionUriResolver;
    }

    /**
     * Parses a query string or a complete authorization URL.
     *
     * @throws MalformedRequestException if a required parameter is missing or does not decode
     * @throws ClientBindingException if {@code client_id} differs from {@code redirect_uri}
     */
    public AuthorizationRequest parse(String queryOrUrl) {
        if (queryOrUrl == null || queryOrUrl.isBlank()) {
            throw new MalformedRequestException("Empty authorization request");
        }
        Map<String, String> parameters = QueryStringCodec.decode(QueryStringCodec.queryOf(queryOrUrl.trim()));

        String nonce = required(parameters, AuthorizationRequest.NONCE);
        String clientId = required(parameters, AuthorizationRequest.CLIENT_ID);
        String redirectUri = required(parameters, AuthorizationRequest.REDIRECT_URI);
        String clientMetadataJson = required(parameters, AuthorizationRequest.CLIENT_METADATA);

        if (!clientId.equals(redirectUri)) {
            LOG.warn("Rejecting authorization request: client_id {} does not match redirect_uri {}", clientId, redirectUri);
            throw new ClientBindingException(clientId, redirectUri);
        }

        String responseType = parameters.get(AuthorizationRequest.RESPONSE_TYPE);
        if (responseType != null && !AuthorizationRequest.RESPONSE_TYPE_VP_TOKEN.equals(responseType)) {
            throw new MalformedRequestException("Unsupported response_type '%s'".formatted(responseType));
        }

        ClientMetadata clientMetadata = decode(AuthorizationRequest.CLIENT_METADATA, clientMetadataJson, ClientMetadata.class);
        String definitionJson = parameters.get(AuthorizationRequest.PRESENTATION_DEFINITION);
        PresentationDefinition definition = definitionJson == null || definitionJson.isBlank()
                ? null
                : decode(AuthorizationRequest.PRESENTATION_DEFINITION, definitionJson, PresentationDefinition.class);

        return new AuthorizationRequest(
                definition,
                blankToNull(parameters.get(AuthorizationRequest.PRESENTATION_DEFINITION_URI)),
                blankToNull(parameters.get(AuthorizationRequest.SCOPE)),
                nonce,
                clientId,
                redirectUri,
                clientMetadata,
                responseType);
    }

    /**
     * Picks the effective definition: inline first, then by scope, then by URI.
     *
     * @throws UnknownScopeException if the scope is not registered
     * @throws MalformedRequestException if no source is present or inline and URI are combined
     */
    public CompiledDefinition resolveDefinition(AuthorizationRequest request) {
        if (request.presentationDefinition() != null && request.presentationDefinitionUri() != null) {
            throw new MalformedRequestException(
                    "presentation_definition and presentation_definition_uri must not be combined");
        }
        if (request.presentationDefinition() != null) {
            return matcher.compile(request.presentationDefinition());
        }
        if (request.scope() != null) {
            return scopeRegistry.resolve(request.scope());
        }
        if (request.presentationDefinitionUri() != null) {
            if (definitionUriResolver == null) {
                throw new MalformedRequestException("presentation_definition_uri is not supported");
            }
            PresentationDefinition fetched = definitionUriResolver.resolve(request.presentationDefinitionUri());
            if (fetched == null) {
                throw new MalformedRequestException("No presentation definition at %s"
                        .formatted(request.presentationDefinitionUri()));
            }
            return matcher.compile(fetched);
        }
        throw new MalformedRequestException("Request carries neither a presentation definition nor a scope");
    }

    private String required(Map<String, String> parameters, String name) {
        String value = parameters.get(name);
        if (value == null || value.isBlank()) {
            throw new MalformedRequestException("Missing required parameter '%s'".formatted(name));
        }
        return value;
    }

    private <T> T decode(String name, String json, Class<T> type) {
        try {
            T value = objectMapper.readValue(json, type);
            if (value == null) {
                throw new MalformedRequestException("Parameter '%s' is null".formatted(name));
            }
            return value;
        } catch (JacksonException e) {
            throw new MalformedRequestException("Parameter '%s' is not valid JSON".formatted(name), e);
        }
    }

    private static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value;
    }
}
