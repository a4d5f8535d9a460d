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

import com.fasterxml.jackson.annotation.JsonFormat;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Matching constraints of an input descriptor. {@code fhirVersion} accepts a single
 * string or an array on input; {@code *} in a version is a wildcard.
 */
public record Constraints(
        @JsonProperty("fhirVersion")
        @JsonFormat(with = JsonFormat.Feature.ACCEPT_SINGLE_VALUE_AS_ARRAY)
        List<String> fhirVersion,
        @JsonProperty("fhirBundleContains") List<BundleContent> fhirBundleContains,
        @JsonProperty("optional") Boolean optional
) {
    public Constraints {
        fhirVersion = fhirVersion == null ? List.of() : List.copyOf(fhirVersion);
        fhirBundleContains = fhirBundleContains == null ? List.of() : List.copyOf(fhirBundleContains);
        optional = Boolean.TRUE.equals(optional);
    }
}
