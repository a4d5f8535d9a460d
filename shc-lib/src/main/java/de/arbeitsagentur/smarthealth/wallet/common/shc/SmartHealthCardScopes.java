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

import java.util.List;
import java.util.Map;

/**
 * Well-known SMART Health Card scopes and their presentation definitions.
 */
public final class SmartHealthCardScopes {
    public static final String INSURANCE = "https://smarthealth.cards/scope#insurance";
    public static final String COVID_VACCINE = "https://smarthealth.cards/scope#covid-vaccine";
    /** Advertised by the demo provider without a registered definition. */
    public static final String COVID_TEST = "https://smarthealth.cards/scope#covid-test";

    public static final String VACCINATION_PROFILE =
            "http://hl7.org/fhir/uv/shc-vaccination/StructureDefinition/shc-vaccination-ad";

    public static final PresentationDefinition INSURANCE_DEFINITION = new PresentationDefinition(INSURANCE, List.of(
            new InputDescriptor(
                    "insurance",
                    "SMART Health Insurance Card",
                    "Access Health Insurance Card",
                    shcFormat(),
                    new Constraints(
                            List.of("4.*"),
                            List.of(BundleContent.of("Patient"), BundleContent.of("Coverage")),
                            false))));

    public static final PresentationDefinition COVID_VACCINE_DEFINITION = new PresentationDefinition(COVID_VACCINE, List.of(
            new InputDescriptor(
                    "covid-vaccine",
                    "COVID-19 Vaccine Card",
                    "Access COVID-19 Vaccine Card",
                    shcFormat(),
                    new Constraints(
                            List.of("4.*"),
                            List.of(BundleContent.of("Patient"), BundleContent.of("Observation", VACCINATION_PROFILE)),
                            false))));

    private SmartHealthCardScopes() {
    }

    public static List<PresentationDefinition> definitions() {
        return List.of(INSURANCE_DEFINITION, COVID_VACCINE_DEFINITION);
    }

    public static ScopeRegistry registry(ConstraintMatcher matcher) {
        return ScopeRegistry.of(definitions(), matcher);
    }

    private static Map<String, FormatAlgorithms> shcFormat() {
        return Map.of(ClientMetadata.FORMAT_SHC_VC, FormatAlgorithms.of("ES256"));
    }
}
