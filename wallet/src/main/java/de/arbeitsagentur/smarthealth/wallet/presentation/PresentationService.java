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

import de.arbeitsagentur.smarthealth.wallet.common.shc.AuthorizationRequest;
import de.arbeitsagentur.smarthealth.wallet.common.shc.AuthorizationRequestBuilder;
import de.arbeitsagentur.smarthealth.wallet.common.shc.AuthorizationRequestParser;
import de.arbeitsagentur.smarthealth.wallet.common.shc.BuiltAuthorizationRequest;
import de.arbeitsagentur.smarthealth.wallet.common.shc.CompiledDefinition;
import de.arbeitsagentur.smarthealth.wallet.common.shc.ConstraintMatcher;
import de.arbeitsagentur.smarthealth.wallet.common.shc.ManifestEntry;
import de.arbeitsagentur.smarthealth.wallet.common.shc.PresentationDefinition;
import de.arbeitsagentur.smarthealth.wallet.common.shc.PresentationTokenAssembler;
import de.arbeitsagentur.smarthealth.wallet.common.storage.CredentialStore;
import de.arbeitsagentur.smarthealth.wallet.config.WalletProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Optional;

/**
 * Runs the presentation exchange: builds authorization requests for the configured
 * provider and answers incoming ones with a presentation of the holder's matching cards.
 */
@Service
public class PresentationService {
    private static final Logger LOG = LoggerFactory.getLogger(PresentationService.class);

    private final WalletProperties properties;
    private final CredentialStore credentialStore;
    private final AuthorizationRequestBuilder requestBuilder;
    private final AuthorizationRequestParser requestParser;
    private final ConstraintMatcher matcher;
    private final PresentationTokenAssembler assembler;

    public PresentationService(WalletProperties properties,
                               CredentialStore credentialStore,
                               AuthorizationRequestBuilder requestBuilder,
                               AuthorizationRequestParser requestParser,
                               ConstraintMatcher matcher,
                               PresentationTokenAssembler assembler) {
        this.properties = properties;
        this.credentialStore = credentialStore;
        this.requestBuilder = requestBuilder;
        this.requestParser = requestParser;
        this.matcher = matcher;
        this.assembler = assembler;
    }

    public BuiltAuthorizationRequest prepareAuthorization(List<String> scopes) {
        BuiltAuthorizationRequest built = requestBuilder.build(properties.providerConfiguration(), scopes);
        LOG.info("Prepared authorization request to {} for scopes {}", properties.providerName(), scopes);
        return built;
    }

    /**
     * Answers an authorization request for the given holder.
     *
     * @return the presentation, or empty if none of the holder's cards satisfy the definition
     */
    public Optional<Presentation> respond(String ownerId, String authorizationRequest) {
        AuthorizationRequest request = requestParser.parse(authorizationRequest);
        CompiledDefinition definition = requestParser.resolveDefinition(request);
        LOG.debug("Resolved presentation definition {} for client {} (scopes {})",
                definition.definition().id(), request.clientId(), request.scopes());

        List<ManifestEntry> snapshot = credentialStore.snapshot(ownerId);
        List<ManifestEntry> matches = matcher.match(definition, snapshot);
        if (matches.isEmpty()) {
            LOG.info("No credential of {} satisfies {} ({} checked)", ownerId, definition.definition().id(), snapshot.size());
            return Optional.empty();
        }
        List<String> credentials = matches.stream().map(ManifestEntry::credential).toList();
        String vpToken = assembler.assembleAndSign(credentials, request.nonce(), request.clientId());
        LOG.info("Presenting {} credential(s) to {} for {}", credentials.size(), request.clientId(), definition.definition().id());
        return Optional.of(new Presentation(vpToken, request, definition.definition(), matches));
    }

    public record Presentation(String vpToken,
                               AuthorizationRequest request,
                               PresentationDefinition definition,
                               List<ManifestEntry> credentials) {
    }
}
