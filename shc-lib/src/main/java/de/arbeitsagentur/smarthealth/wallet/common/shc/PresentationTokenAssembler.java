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

import com.nimbusds.jwt.JWTClaimsSet;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.Date;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Wraps matched credentials into the claims of a verifiable presentation token.
 * Credentials are embedded verbatim and in the given order.
 */
public class PresentationTokenAssembler {
    public static final String CREDENTIALS_CONTEXT = "https://www.w3.org/2018/credentials/v1";
    public static final String PRESENTATION_TYPE = "VerifiablePresentation";
    public static final Duration DEFAULT_TTL = Duration.ofMinutes(5);

    private final String issuer;
    private final Duration ttl;
    private final Clock clock;
    private final PresentationSigner signer;

    public PresentationTokenAssembler(String issuer, PresentationSigner signer) {
        this(issuer, DEFAULT_TTL, Clock.systemUTC(), signer);
    }

    public PresentationTokenAssembler(String issuer, Duration ttl, Clock clock, PresentationSigner signer) {
        if (issuer == null || issuer.isBlank()) {
            throw new IllegalArgumentException("issuer must not be blank");
        }
        this.issuer = issuer;
        this.ttl = ttl != null && !ttl.isNegative() && !ttl.isZero() ? ttl : DEFAULT_TTL;
        this.clock = clock;
        this.signer = signer;
    }

    public JWTClaimsSet assemble(List<String> credentials, String nonce, String audience) {
        if (nonce == null || nonce.isBlank()) {
            throw new IllegalArgumentException("nonce must not be blank");
        }
        if (audience == null || audience.isBlank()) {
            throw new IllegalArgumentException("audience must not be blank");
        }
        if (credentials != null && credentials.stream().anyMatch(c -> c == null || c.isBlank())) {
            throw new IllegalArgumentException("credentials must not contain blank entries");
        }
        Instant issuedAt = clock.instant().truncatedTo(ChronoUnit.SECONDS);

        Map<String, Object> vp = new LinkedHashMap<>();
        vp.put("@context", List.of(CREDENTIALS_CONTEXT));
        vp.put("type", List.of(PRESENTATION_TYPE));
        vp.put("verifiableCredential", credentials == null ? List.of() : List.copyOf(credentials));

        return new JWTClaimsSet.Builder()
                .issuer(issuer)
                .jwtID(UUID.randomUUID().toString())
                .audience(audience)
                .notBeforeTime(Date.from(issuedAt))
                .issueTime(Date.from(issuedAt))
                .expirationTime(Date.from(issuedAt.plus(ttl)))
                .claim("nonce", nonce)
                .claim("vp", vp)
                .build();
    }

    public String assembleAndSign(List<String> credentials, String nonce, String audience) {
        if (signer == null) {
            throw new IllegalStateException("No presentation signer configured");
        }
        return signer.sign(assemble(credentials, nonce, audience));
    }

    public String issuer() {
        return issuer;
    }
}
