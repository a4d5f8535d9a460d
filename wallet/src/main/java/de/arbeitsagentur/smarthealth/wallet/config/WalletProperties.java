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
package de.arbeitsagentur.smarthealth.wallet.config;

import de.arbeitsagentur.smarthealth.wallet.common.shc.ClientMetadata;
import de.arbeitsagentur.smarthealth.wallet.common.shc.FormatAlgorithms;
import de.arbeitsagentur.smarthealth.wallet.common.shc.PresentationTokenAssembler;
import de.arbeitsagentur.smarthealth.wallet.common.shc.ProviderConfiguration;
import de.arbeitsagentur.smarthealth.wallet.common.shc.SmartHealthCardScopes;
import de.arbeitsagentur.smarthealth.wallet.common.shc.VersionMatching;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.nio.file.Path;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@ConfigurationProperties(prefix = "wallet")
@Validated
public record WalletProperties(
        @NotBlank String issuer,
        @NotBlank String baseUrl,
        @NotNull Path storageDir,
        @NotNull Path walletKeyFile,
        @Valid Provider provider,
        @Valid Presentation presentation
) {
    /**
     * Metadata of the provider the wallet sends authorization requests to.
     */
    public record Provider(String name,
                           String authorizationEndpoint,
                           List<String> scopesSupported,
                           List<String> responseModesSupported,
                           Boolean presentationDefinitionUriSupported) {
    }

    public record Presentation(Duration tokenTtl,
                               VersionMatching versionMatching,
                               Boolean allowUnsecured) {
    }

    public String providerName() {
        return provider != null && provider.name() != null ? provider.name() : "SMART Demo Wallet";
    }

    public ProviderConfiguration providerConfiguration() {
        String endpoint = provider != null && provider.authorizationEndpoint() != null
                ? provider.authorizationEndpoint()
                : "%s/authorize".formatted(issuer);
        List<String> scopes = provider != null && provider.scopesSupported() != null
                ? provider.scopesSupported()
                : List.of(SmartHealthCardScopes.COVID_TEST, SmartHealthCardScopes.COVID_VACCINE, SmartHealthCardScopes.INSURANCE);
        List<String> responseModes = provider != null && provider.responseModesSupported() != null
                ? provider.responseModesSupported()
                : List.of("fragment");
        boolean definitionUriSupported = provider != null && Boolean.TRUE.equals(provider.presentationDefinitionUriSupported());
        Map<String, FormatAlgorithms> formats = new LinkedHashMap<>();
        formats.put(ClientMetadata.FORMAT_JWT_VP_JSON, FormatAlgorithms.of(presentationAlgorithm()));
        formats.put(ClientMetadata.FORMAT_SHC_VC, FormatAlgorithms.of("ES256"));
        return new ProviderConfiguration(issuer, endpoint, definitionUriSupported, scopes,
                List.of("vp_token"), responseModes, formats);
    }

    public Duration tokenTtlOrDefault() {
        return presentation != null && presentation.tokenTtl() != null
                ? presentation.tokenTtl()
                : PresentationTokenAssembler.DEFAULT_TTL;
    }

    public VersionMatching versionMatchingOrDefault() {
        return presentation != null && presentation.versionMatching() != null
                ? presentation.versionMatching()
                : VersionMatching.STRICT;
    }

    public boolean allowUnsecuredPresentations() {
        return presentation != null && Boolean.TRUE.equals(presentation.allowUnsecured());
    }

    public String presentationAlgorithm() {
        return allowUnsecuredPresentations() ? "none" : "ES256";
    }
}
