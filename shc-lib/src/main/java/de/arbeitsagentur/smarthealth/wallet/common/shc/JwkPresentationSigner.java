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

import com.nimbusds.jose.JOSEException;
import com.nimbusds.jose.JOSEObjectType;
import com.nimbusds.jose.JWSAlgorithm;
import com.nimbusds.jose.JWSHeader;
import com.nimbusds.jose.JWSSigner;
import com.nimbusds.jose.JWSVerifier;
import com.nimbusds.jose.crypto.ECDSASigner;
import com.nimbusds.jose.crypto.ECDSAVerifier;
import com.nimbusds.jose.crypto.RSASSASigner;
import com.nimbusds.jose.crypto.RSASSAVerifier;
import com.nimbusds.jose.jwk.Curve;
import com.nimbusds.jose.jwk.ECKey;
import com.nimbusds.jose.jwk.JWK;
import com.nimbusds.jose.jwk.RSAKey;
import com.nimbusds.jwt.JWT;
import com.nimbusds.jwt.JWTClaimsSet;
import com.nimbusds.jwt.JWTParser;
import com.nimbusds.jwt.SignedJWT;

import java.text.ParseException;
import java.time.Clock;
import java.time.Instant;
import java.util.Date;

/**
 * Signs presentations with an EC or RSA JWK. The algorithm follows the key:
 * ES256/ES384/ES512 for P-256/P-384/P-521, RS256 for RSA.
 */
public class JwkPresentationSigner implements PresentationSigner {
    private final JWK signingKey;
    private final Clock clock;

    public JwkPresentationSigner(JWK signingKey) {
        this(signingKey, Clock.systemUTC());
    }

    public JwkPresentationSigner(JWK signingKey, Clock clock) {
        if (!(signingKey instanceof ECKey) && !(signingKey instanceof RSAKey)) {
            throw new IllegalArgumentException("Unsupported key type: "
                    + (signingKey == null ? "null" : signingKey.getKeyType()));
        }
        this.signingKey = signingKey;
        this.clock = clock;
    }

    @Override
    public String sign(JWTClaimsSet claims) {
        try {
            JWSHeader.Builder header = new JWSHeader.Builder(algorithm())
                    .type(JOSEObjectType.JWT);
            if (signingKey.getKeyID() != null) {
                header.keyID(signingKey.getKeyID());
            }
            SignedJWT jwt = new SignedJWT(header.build(), claims);
            jwt.sign(signer());
            return jwt.serialize();
        } catch (JOSEException e) {
            throw new PresentationSigningException("Failed to sign presentation", e);
        }
    }

    @Override
    public JWTClaimsSet verify(String token) {
        JWT parsed;
        try {
            parsed = JWTParser.parse(token);
        } catch (ParseException e) {
            throw new PresentationSigningException("Presentation token is not a JWT", e);
        }
        if (!(parsed instanceof SignedJWT signed)) {
            throw new PresentationSigningException("Unsecured presentation tokens are not accepted");
        }
        try {
            if (!algorithm().equals(signed.getHeader().getAlgorithm()) || !signed.verify(verifier())) {
                throw new PresentationSigningException("Presentation signature is invalid");
            }
            JWTClaimsSet claims = signed.getJWTClaimsSet();
            checkValidity(claims);
            return claims;
        } catch (JOSEException | ParseException e) {
            throw new PresentationSigningException("Failed to verify presentation", e);
        }
    }

    public JWSAlgorithm algorithm() {
        if (signingKey instanceof ECKey ecKey) {
            Curve curve = ecKey.getCurve();
            if (Curve.P_384.equals(curve)) {
                return JWSAlgorithm.ES384;
            } else if (Curve.P_521.equals(curve)) {
                return JWSAlgorithm.ES512;
            }
            return JWSAlgorithm.ES256;
        }
        return JWSAlgorithm.RS256;
    }

    private void checkValidity(JWTClaimsSet claims) {
        Date now = Date.from(Instant.now(clock));
        if (claims.getExpirationTime() != null && !now.before(claims.getExpirationTime())) {
            throw new PresentationSigningException("Presentation token has expired");
        }
        if (claims.getNotBeforeTime() != null && now.before(claims.getNotBeforeTime())) {
            throw new PresentationSigningException("Presentation token is not yet valid");
        }
    }

    private JWSSigner signer() throws JOSEException {
        if (signingKey instanceof ECKey ecKey) {
            return new ECDSASigner(ecKey);
        }
        return new RSASSASigner((RSAKey) signingKey);
    }

    private JWSVerifier verifier() throws JOSEException {
        if (signingKey instanceof ECKey ecKey) {
            return new ECDSAVerifier(ecKey.toPublicJWK());
        }
        return new RSASSAVerifier(((RSAKey) signingKey).toPublicJWK());
    }
}
