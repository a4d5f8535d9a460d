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

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * A stored credential plus the metadata used for matching. The credential itself is an
 * opaque compact JWS and is never inspected during matching.
 */
public record ManifestEntry(@JsonProperty("credential") @JsonAlias("shc") String credential,
                            @JsonProperty("fhirVersion") String fhirVersion,
                            @JsonProperty("fhirBundleContains") List<BundleContent> fhirBundleContains) {
    public ManifestEntry {
        fhirBundleContains = fhirBundleContains == null ? List.of() : List.copyOf(fhirBundleContains);
    }
}
