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

import com.nimbusds.jose.JWSAlgorithm;
import com.nimbusds.jose.jwk.Curve;
import com.nimbusds.jose.jwk.ECKey;
import com.nimbusds.jose.jwk.OctetSequenceKey;
import com.nimbusds.jose.jwk.RSAKey;
import com.nimbusds.jose.jwk.gen.ECKeyGenerator;
import com.nimbusds.jose.jwk.gen.OctetSequenceKeyGenerator;
import com.nimbusds.jose.jwk.gen.RSAKeyGenerator;
import com.nimbusds.jwt.JWTClaimsSet;
import com.nimbusds.jwt.PlainJWT;
import com.nimbusds.jwt.SignedJWT;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class JwkPresentationSignerTest {
    private static final Instant NOW = Instant.parse("2026-03-01T10:15:30Z");

    private final Clock clock = Clock.fixed(NOW, ZoneOffset.UTC);

    private JWTClaimsSet claims() {
        return new PresentationTokenAssembler("https://example.org/shc-wallet", PresentationTokenAssembler.DEFAULT_TTL,
                clock, null).assemble(List.of("shcA"), "abc", "https://rp.example");
    }

    @Test
    void signsAndVerifiesWithEcKey() throws Exception {
        ECKey key = new ECKeyGenerator(Curve.P_256).keyID("wallet-es256").generate();
        JwkPresentationSigner signer = new JwkPresentationSigner(key, clock);

        String token = signer.sign(claims());

        SignedJWT parsed = SignedJWT.parse(token);
        assertThat(parsed.getHeader().getAlgorithm()).isEqualTo(JWSAlgorithm.ES256);
        assertThat(parsed.getHeader().getKeyID()).isEqualTo("wallet-es256");
        assertThat(signer.verify(token).getStringClaim("nonce")).isEqualTo("abc");
    }

    @Test
    void algorithmFollowsCurve() throws Exception {
        assertThat(new JwkPresentationSigner(new ECKeyGenerator(Curve.P_384).generate()).algorithm())
                .isEqualTo(JWSAlgorithm.ES384);
        assertThat(new JwkPresentationSigner(new ECKeyGenerator(Curve.P_521).generate()).algorithm())
                .isEqualTo(JWSAlgorithm.ES512);
    }

    @Test
    void signsAndVerifiesWithRsaKey() throws Exception {
        RSAKey key = new RSAKeyGenerator(2048).generate();
        JwkPresentationSigner signer = new JwkPresentationSigner(key, clock);

        String token = signer.sign(claims());

        assertThat(SignedJWT.parse(token).getHeader().getAlgorithm()).isEqualTo(JWSAlgorithm.RS256);
        assertThat(signer.verify(token).getAudience()).containsExactly("https://rp.example");
    }

    @Test
    void rejectsTokenFromAnotherKey() throws Exception {
        JwkPresentationSigner signer = new JwkPresentationSigner(new ECKeyGenerator(Curve.P_256).generate(), clock);
        JwkPresentationSigner other = new JwkPresentationSigner(new ECKeyGenerator(Curve.P_256).generate(), clock);

        String token = other.sign(claims());

        assertThatThrownBy(() -> signer.verify(token))
                .isInstanceOf(PresentationSigningException.class)
                .hasMessageContaining("signature");
    }

    @Test
    void rejectsUnsecuredToken() throws Exception {
        JwkPresentationSigner signer = new JwkPresentationSigner(new ECKeyGenerator(Curve.P_256).generate(), clock);
        String unsecured = new PlainJWT(claims()).serialize();

        assertThatThrownBy(() -> signer.verify(unsecured))
                .isInstanceOf(PresentationSigningException.class)
                .hasMessageContaining("Unsecured");
    }

    @Test
    void rejectsExpiredToken() throws Exception {
        ECKey key = new ECKeyGenerator(Curve.P_256).generate();
        String token = new JwkPresentationSigner(key, clock).sign(claims());
        JwkPresentationSigner later = new JwkPresentationSigner(key,
                Clock.fixed(NOW.plus(Duration.ofMinutes(6)), ZoneOffset.UTC));

        assertThatThrownBy(() -> later.verify(token))
                .isInstanceOf(PresentationSigningException.class)
                .hasMessageContaining("expired");
    }

    @Test
    void rejectsGarbage() throws Exception {
        JwkPresentationSigner signer = new JwkPresentationSigner(new ECKeyGenerator(Curve.P_256).generate(), clock);

        assertThatThrownBy(() -> signer.verify("not-a-jwt"))
                .isInstanceOf(PresentationSigningException.class);
    }

    @Test
    void rejectsSymmetricKeys() throws Exception {
        OctetSequenceKey secret = new OctetSequenceKeyGenerator(256).generate();

        assertThatThrownBy(() -> new JwkPresentationSigner(secret))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("oct");
    }
}
