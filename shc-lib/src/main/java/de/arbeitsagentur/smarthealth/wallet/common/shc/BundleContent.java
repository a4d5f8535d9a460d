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

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * A FHIR resource that a credential's bundle contains (manifest side) or must contain
 * (definition side). A {@code null} profile list leaves the profile unconstrained.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record BundleContent(@JsonProperty("resourceType") String resourceType,
                            @JsonProperty("profile") List<String> profile) {
    public BundleContent {
        profile = profile == null ? null : List.copyOf(profile);
    }

    public static BundleContent of(String resourceType) {
        return new BundleContent(resourceType, null);
    }

    public static BundleContent of(String resourceType, String... profile) {
        return new BundleContent(resourceType, List.of(profile));
    }
}
