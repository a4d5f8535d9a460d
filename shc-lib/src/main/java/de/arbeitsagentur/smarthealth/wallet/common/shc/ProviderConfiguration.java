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

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Map;

/**
 * Metadata of a wallet provider as consumed by the request builder.
 */
public record ProviderConfiguration(
        @JsonProperty("issuer") String issuer,
        @JsonProperty("authorization_endpoint") String authorizationEndpoint,
        @JsonProperty("presentation_definition_uri_supported") Boolean presentationDefinitionUriSupported,
        @JsonProperty("scopes_supported") List<String> scopesSupported,
        @JsonProperty("response_types_supported") List<String> responseTypesSupported,
        @JsonProperty("response_modes_supported") List<String> responseModesSupported,
        @JsonProperty("vp_formats_supported") Map<String, FormatAlgorithms> vpFormatsSupported
) {
    public ProviderConfiguration {
        presentationDefinitionUriSupported = Boolean.TRUE.equals(presentationDefinitionUriSupported);
        scopesSupported = scopesSupported == null ? List.of() : List.copyOf(scopesSupported);
        responseTypesSupported = responseTypesSupported == null ? List.of() : List.copyOf(responseTypesSupported);
        responseModesSupported = responseModesSupported == null ? List.of() : List.copyOf(responseModesSupported);
        vpFormatsSupported = vpFormatsSupported == null ? Map.of() : Map.copyOf(vpFormatsSupported);
    }

    public boolean supportsScope(String scope) {
        return scopesSupported.contains(scope);
    }
}
