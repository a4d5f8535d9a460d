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
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class PresentationTokenAssemblerTest {
    private static final String ISSUER = "https://example.org/shc-wallet";
    private static final Instant NOW = Instant.parse("2026-03-01T10:15:30.750Z");

    private final Clock clock = Clock.fixed(NOW, ZoneOffset.UTC);
    private final PresentationTokenAssembler assembler =
            new PresentationTokenAssembler(ISSUER, PresentationTokenAssembler.DEFAULT_TTL, clock, null);

    @Test
    void assemblesPresentationClaims() throws Exception {
        JWTClaimsSet claims = assembler.assemble(List.of("shcA", "shcB"), "abc", "https://rp.example");

        assertThat(claims.getIssuer()).isEqualTo(ISSUER);
        assertThat(claims.getAudience()).containsExactly("https://rp.example");
        assertThat(claims.getStringClaim("nonce")).isEqualTo("abc");
        assertThat(claims.getJWTID()).isNotBlank();
        assertThat(claims.getIssueTime().toInstant()).isEqualTo(Instant.parse("2026-03-01T10:15:30Z"));
        assertThat(claims.getNotBeforeTime()).isEqualTo(claims.getIssueTime());
        assertThat(claims.getExpirationTime().getTime() - claims.getIssueTime().getTime()).isEqualTo(300_000L);

        Map<String, Object> vp = claims.getJSONObjectClaim("vp");
        assertThat(vp).containsEntry("@context", List.of("https://www.w3.org/2018/credentials/v1"));
        assertThat(vp).containsEntry("type", List.of("VerifiablePresentation"));
        assertThat(vp).containsEntry("verifiableCredential", List.of("shcA", "shcB"));
    }

    @Test
    void embedsNoCredentialsAsEmptyArray() throws Exception {
        JWTClaimsSet claims = assembler.assemble(List.of(), "abc", "https://rp.example");

        assertThat(claims.getJSONObjectClaim("vp")).containsEntry("verifiableCredential", List.of());
    }

    @Test
    void everyTokenGetsItsOwnId() {
        String first = assembler.assemble(List.of("shcA"), "abc", "https://rp.example").getJWTID();
        String second = assembler.assemble(List.of("shcA"), "abc", "https://rp.example").getJWTID();

        assertThat(first).isNotEqualTo(second);
    }

    @Test
    void honoursConfiguredLifetime() {
        PresentationTokenAssembler shortLived =
                new PresentationTokenAssembler(ISSUER, Duration.ofSeconds(30), clock, null);

        JWTClaimsSet claims = shortLived.assemble(List.of("shcA"), "abc", "https://rp.example");

        assertThat(claims.getExpirationTime().getTime() - claims.getIssueTime().getTime()).isEqualTo(30_000L);
    }

    @Test
    void fallsBackToDefaultLifetimeForNonPositiveValues() {
        PresentationTokenAssembler zero = new PresentationTokenAssembler(ISSUER, Duration.ZERO, clock, null);

        JWTClaimsSet claims = zero.assemble(List.of("shcA"), "abc", "https://rp.example");

        assertThat(claims.getExpirationTime().getTime() - claims.getIssueTime().getTime()).isEqualTo(300_000L);
    }

    @Test
    void requiresNonceAndAudience() {
        assertThatThrownBy(() -> assembler.assemble(List.of("shcA"), " ", "https://rp.example"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("nonce");
        assertThatThrownBy(() -> assembler.assemble(List.of("shcA"), "abc", null))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("audience");
    }

    @Test
    void rejectsMissingCredentialValues() {
        List<String> withNull = new ArrayList<>();
        withNull.add(null);

        assertThatThrownBy(() -> assembler.assemble(withNull, "abc", "https://rp.example"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("credentials");
        assertThatThrownBy(() -> assembler.assemble(List.of("shcA", " "), "abc", "https://rp.example"))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void delegatesSigningToSigner() {
        PresentationSigner signer = mock(PresentationSigner.class);
        when(signer.sign(any())).thenReturn("header.payload.signature");
        PresentationTokenAssembler signing =
                new PresentationTokenAssembler(ISSUER, PresentationTokenAssembler.DEFAULT_TTL, clock, signer);

        assertThat(signing.assembleAndSign(List.of("shcA"), "abc", "https://rp.example"))
                .isEqualTo("header.payload.signature");
        verify(signer).sign(any(JWTClaimsSet.class));
    }

    @Test
    void signingWithoutSignerFails() {
        assertThatThrownBy(() -> assembler.assembleAndSign(List.of("shcA"), "abc", "https://rp.example"))
                .isInstanceOf(IllegalStateException.class);
    }
}
