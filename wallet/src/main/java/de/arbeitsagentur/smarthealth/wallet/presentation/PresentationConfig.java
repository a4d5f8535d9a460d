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
package de.arbeitsagentur.smarthealth.wallet.presentation;

import de.arbeitsagentur.smarthealth.wallet.common.crypto.WalletKeyService;
import de.arbeitsagentur.smarthealth.wallet.common.shc.AuthorizationRequestBuilder;
import de.arbeitsagentur.smarthealth.wallet.common.shc.AuthorizationRequestParser;
import de.arbeitsagentur.smarthealth.wallet.common.shc.ClientMetadata;
import de.arbeitsagentur.smarthealth.wallet.common.shc.ConstraintMatcher;
import de.arbeitsagentur.smarthealth.wallet.common.shc.JwkPresentationSigner;
import de.arbeitsagentur.smarthealth.wallet.common.shc.PresentationSigner;
import de.arbeitsagentur.smarthealth.wallet.common.shc.PresentationTokenAssembler;
import de.arbeitsagentur.smarthealth.wallet.common.shc.ScopeRegistry;
import de.arbeitsagentur.smarthealth.wallet.common.shc.SmartHealthCardScopes;
import de.arbeitsagentur.smarthealth.wallet.common.shc.UnsecuredPresentationSigner;
import de.arbeitsagentur.smarthealth.wallet.config.WalletProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import tools.jackson.databind.ObjectMapper;

import java.time.Clock;

/**
 * Wires the presentation exchange core from {@link WalletProperties}.
 */
@Configuration
public class PresentationConfig {
    private static final Logger LOG = LoggerFactory.getLogger(PresentationConfig.class);

    @Bean
    Clock presentationClock() {
        return Clock.systemUTC();
    }

    @Bean
    ConstraintMatcher constraintMatcher(WalletProperties properties) {
        return new ConstraintMatcher(properties.versionMatchingOrDefault());
    }

    @Bean
    ScopeRegistry scopeRegistry(ConstraintMatcher constraintMatcher) {
        ScopeRegistry registry = SmartHealthCardScopes.registry(constraintMatcher);
        LOG.info("Registered presentation definitions for scopes {}", registry.scopes());
        return registry;
    }

    @Bean
    AuthorizationRequestBuilder authorizationRequestBuilder(ObjectMapper objectMapper, WalletProperties properties) {
        return new AuthorizationRequestBuilder(objectMapper,
                properties.baseUrl(),
                ClientMetadata.forPresentationAlgorithm(properties.presentationAlgorithm()),
                AuthorizationRequestBuilder::randomNonce);
    }

    @Bean
    AuthorizationRequestParser authorizationRequestParser(ObjectMapper objectMapper,
                                                          ScopeRegistry scopeRegistry,
                                                          ConstraintMatcher constraintMatcher) {
        return new AuthorizationRequestParser(objectMapper, scopeRegistry, constraintMatcher);
    }

    @Bean
    PresentationSigner presentationSigner(WalletProperties properties, WalletKeyService walletKeyService, Clock presentationClock) {
        if (properties.allowUnsecuredPresentations()) {
            return new UnsecuredPresentationSigner(true);
        }
        return new JwkPresentationSigner(walletKeyService.loadOrCreateKey(), presentationClock);
    }

    @Bean
    PresentationTokenAssembler presentationTokenAssembler(WalletProperties properties,
                                                          PresentationSigner presentationSigner,
                                                          Clock presentationClock) {
        return new PresentationTokenAssembler(properties.issuer(), properties.tokenTtlOrDefault(),
                presentationClock, presentationSigner);
    }
}
