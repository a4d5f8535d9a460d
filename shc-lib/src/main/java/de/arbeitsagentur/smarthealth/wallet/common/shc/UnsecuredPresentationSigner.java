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

import com.nimbusds.jwt.JWT;
import com.nimbusds.jwt.JWTClaimsSet;
import com.nimbusds.jwt.JWTParser;
import com.nimbusds.jwt.PlainJWT;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.text.ParseException;

/**
 * Produces {@code alg=none} presentations for demonstrations against verifiers that
 * declare {@code jwt_vp_json: {alg: ["none"]}}. Must be enabled explicitly.
 */
public class UnsecuredPresentationSigner implements PresentationSigner {
    private static final Logger LOG = LoggerFactory.getLogger(UnsecuredPresentationSigner.class);

    public UnsecuredPresentationSigner(boolean allowUnsecured) {
        if (!allowUnsecured) {
            throw new IllegalStateException("Unsecured presentations are disabled");
        }
        LOG.warn("Unsecured (alg=none) presentation tokens are enabled; do not use this outside demonstrations");
    }

    @Override
    public String sign(JWTClaimsSet claims) {
        return new PlainJWT(claims).serialize();
    }

    @Override
    public JWTClaimsSet verify(String token) {
        try {
            JWT parsed = JWTParser.parse(token);
            if (!(parsed instanceof PlainJWT plain)) {
                throw new PresentationSigningException("Expected an unsecured presentation token");
            }
            return plain.getJWTClaimsSet();
        } catch (ParseException e) {
            throw new PresentationSigningException("Presentation token is not a JWT", e);
        }
    }
}
