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

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Presentation formats the requesting client supports, keyed by format name.
 */
public record ClientMetadata(@JsonProperty("vp_formats") Map<String, FormatAlgorithms> vpFormats) {
    public static final String FORMAT_JWT_VP_JSON = "jwt_vp_json";
    public static final String FORMAT_SHC_VC = "shc_vc";

    public ClientMetadata {
        vpFormats = vpFormats == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(vpFormats));
    }

    /**
     * The wallet's own declaration: unsecured JWT presentations wrapping ES256-signed health cards.
     */
    public static ClientMetadata walletDefault() {
        return forPresentationAlgorithm("none");
    }

    public static ClientMetadata forPresentationAlgorithm(String presentationAlg) {
        Map<String, FormatAlgorithms> formats = new LinkedHashMap<>();
        formats.put(FORMAT_JWT_VP_JSON, FormatAlgorithms.of(presentationAlg));
        formats.put(FORMAT_SHC_VC, FormatAlgorithms.of("ES256"));
        return new ClientMetadata(formats);
    }
}
