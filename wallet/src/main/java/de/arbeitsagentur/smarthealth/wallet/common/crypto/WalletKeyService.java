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
package de.arbeitsagentur.smarthealth.wallet.common.crypto;

import com.nimbusds.jose.JOSEException;
import com.nimbusds.jose.JWSAlgorithm;
import com.nimbusds.jose.jwk.Curve;
import com.nimbusds.jose.jwk.ECKey;
import com.nimbusds.jose.jwk.KeyUse;
import com.nimbusds.jose.jwk.gen.ECKeyGenerator;
import de.arbeitsagentur.smarthealth.wallet.config.WalletProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import tools.jackson.core.JacksonException;
import tools.jackson.databind.JsonNode;
import tools.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.text.ParseException;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Holds the wallet's presentation signing key, creating an ES256 key file on first use.
 */
@Component
public class WalletKeyService {
    private static final Logger LOG = LoggerFactory.getLogger(WalletKeyService.class);

    private final WalletProperties properties;
    private final ObjectMapper objectMapper;
    private volatile ECKey cachedKey;

    public WalletKeyService(WalletProperties properties, ObjectMapper objectMapper) {
        this.properties = properties;
        this.objectMapper = objectMapper;
    }

    public ECKey loadOrCreateKey() {
        if (cachedKey != null) {
            return cachedKey;
        }
        synchronized (this) {
            if (cachedKey != null) {
                return cachedKey;
            }
            Path file = properties.walletKeyFile();
            try {
                if (Files.exists(file)) {
                    cachedKey = parseExistingKey(Files.readString(file));
                } else {
                    cachedKey = createKey(file);
                }
            } catch (IOException | ParseException | JOSEException | JacksonException e) {
                throw new IllegalStateException("Unable to load wallet key from " + file, e);
            }
            return cachedKey;
        }
    }

    private ECKey createKey(Path file) throws IOException, JOSEException {
        if (file.getParent() != null) {
            Files.createDirectories(file.getParent());
        }
        ECKey newKey = new ECKeyGenerator(Curve.P_256)
                .algorithm(JWSAlgorithm.ES256)
                .keyUse(KeyUse.SIGNATURE)
                .keyID("wallet-es256")
                .generate();
        Map<String, JsonNode> payload = new LinkedHashMap<>();
        payload.put("privateJwk", objectMapper.readTree(newKey.toJSONString()));
        payload.put("publicJwk", objectMapper.readTree(newKey.toPublicJWK().toJSONString()));
        objectMapper.writerWithDefaultPrettyPrinter().writeValue(file.toFile(), payload);
        LOG.info("Generated new wallet signing key {} at {}", newKey.getKeyID(), file);
        return newKey;
    }

    private ECKey parseExistingKey(String json) throws ParseException {
        try {
            return ECKey.parse(json);
        } catch (ParseException parseException) {
            JsonNode node = objectMapper.readTree(json);
            if (node.has("privateJwk")) {
                return ECKey.parse(node.get("privateJwk").toString());
            }
            throw parseException;
        }
    }
}
