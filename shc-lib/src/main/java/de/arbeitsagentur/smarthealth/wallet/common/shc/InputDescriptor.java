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

import java.util.Map;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record InputDescriptor(@JsonProperty("id") String id,
                              @JsonProperty("name") String name,
                              @JsonProperty("purpose") String purpose,
                              @JsonProperty("format") Map<String, FormatAlgorithms> format,
                              @JsonProperty("constraints") Constraints constraints) {
    public InputDescriptor {
        format = format == null ? Map.of() : Map.copyOf(format);
    }
}
