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

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Arrays;
import java.util.List;

/**
 * Authorization request carrying a presentation definition (inline, by URI or by scope)
 * from the verifier to the wallet.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record AuthorizationRequest(
        @JsonProperty("presentation_definition") PresentationDefinition presentationDefinition,
        @JsonProperty("presentation_definition_uri") String presentationDefinitionUri,
        @JsonProperty("scope") String scope,
        @JsonProperty("nonce") String nonce,
        @JsonProperty("client_id") String clientId,
        @JsonProperty("redirect_uri") String redirectUri,
        @JsonProperty("client_metadata") ClientMetadata clientMetadata,
        @JsonProperty("response_type") String responseType
) {
    public static final String PRESENTATION_DEFINITION = "presentation_definition";
    public static final String PRESENTATION_DEFINITION_URI = "presentation_definition_uri";
    public static final String SCOPE = "scope";
    public static final String NONCE = "nonce";
    public static final String CLIENT_ID = "client_id";
    public static final String REDIRECT_URI = "redirect_uri";
    public static final String CLIENT_METADATA = "client_metadata";
    public static final String RESPONSE_TYPE = "response_type";

    public static final String RESPONSE_TYPE_VP_TOKEN = "vp_token";

    public AuthorizationRequest {
        if (responseType == null) {
            responseType = RESPONSE_TYPE_VP_TOKEN;
        }
    }

    /**
     * Individual scope identifiers of the space separated {@code scope} parameter.
     */
    @JsonIgnore
    public List<String> scopes() {
        if (scope == null || scope.isBlank()) {
            return List.of();
        }
        return Arrays.stream(scope.trim().split(" +")).toList();
    }
}
