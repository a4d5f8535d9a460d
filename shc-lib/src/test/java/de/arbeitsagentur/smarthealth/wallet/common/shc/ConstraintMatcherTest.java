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

import org.junit.jupiter.api.Test;
import tools.jackson.databind.ObjectMapper;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ConstraintMatcherTest {

    private final ConstraintMatcher matcher = new ConstraintMatcher();

    private static PresentationDefinition insurance() {
        return SmartHealthCardScopes.INSURANCE_DEFINITION;
    }

    private static ManifestEntry entry(String credential, String version, BundleContent... contents) {
        return new ManifestEntry(credential, version, List.of(contents));
    }

    @Test
    void includesEntryWithMatchingVersionAndBundle() {
        ManifestEntry card = entry("shcA", "4.0.1", BundleContent.of("Patient"), BundleContent.of("Coverage"));

        assertThat(matcher.match(insurance(), List.of(card))).containsExactly(card);
    }

    @Test
    void excludesEntryWithOtherMajorVersion() {
        ManifestEntry card = entry("shcA", "5.0.0", BundleContent.of("Patient"), BundleContent.of("Coverage"));

        assertThat(matcher.match(insurance(), List.of(card))).isEmpty();
    }

    @Test
    void excludesEntryMissingRequiredResource() {
        ManifestEntry card = entry("shcA", "4.0.1", BundleContent.of("Patient"));

        assertThat(matcher.match(insurance(), List.of(card))).isEmpty();
    }

    @Test
    void optionalDescriptorIsSatisfiedRegardlessOfEntryContent() {
        PresentationDefinition definition = new PresentationDefinition("urn:test:optional", List.of(
                new InputDescriptor("anything", "Anything", null, null,
                        new Constraints(List.of("9.*"), List.of(BundleContent.of("Immunization")), true))));
        ManifestEntry unrelated = entry("shcA", "1.0.0", BundleContent.of("Coverage"));

        assertThat(matcher.match(definition, List.of(unrelated))).containsExactly(unrelated);
    }

    @Test
    void optionalDescriptorDoesNotRelaxOtherDescriptors() {
        PresentationDefinition definition = new PresentationDefinition("urn:test:mixed", List.of(
                new InputDescriptor("optional", "Optional", null, null,
                        new Constraints(List.of("4.*"), List.of(BundleContent.of("Immunization")), true)),
                insurance().inputDescriptors().get(0)));
        ManifestEntry insuranceCard = entry("shcA", "4.0.1", BundleContent.of("Patient"), BundleContent.of("Coverage"));
        ManifestEntry patientOnly = entry("shcB", "4.0.1", BundleContent.of("Patient"));

        assertThat(matcher.match(definition, List.of(insuranceCard, patientOnly))).containsExactly(insuranceCard);
    }

    @Test
    void profileRequirementNeedsSharedProfile() {
        PresentationDefinition definition = SmartHealthCardScopes.COVID_VACCINE_DEFINITION;
        ManifestEntry vaccinated = entry("shcA", "4.0.1",
                BundleContent.of("Patient"),
                BundleContent.of("Observation", "http://example.org/other", SmartHealthCardScopes.VACCINATION_PROFILE));
        ManifestEntry noProfile = entry("shcB", "4.0.1",
                BundleContent.of("Patient"), BundleContent.of("Observation"));
        ManifestEntry wrongProfile = entry("shcC", "4.0.1",
                BundleContent.of("Patient"), BundleContent.of("Observation", "http://example.org/other"));

        assertThat(matcher.match(definition, List.of(vaccinated, noProfile, wrongProfile)))
                .containsExactly(vaccinated);
    }

    @Test
    void requirementWithoutProfileAcceptsAnyProfile() {
        ManifestEntry card = entry("shcA", "4.0.1",
                BundleContent.of("Patient", "http://hl7.org/fhir/StructureDefinition/Patient"),
                BundleContent.of("Coverage", "http://hl7.org/fhir/us/insurance-card/StructureDefinition/C4DIC-Coverage"));

        assertThat(matcher.match(insurance(), List.of(card))).containsExactly(card);
    }

    @Test
    void everyDescriptorMustBeSatisfiedByTheSameEntry() {
        PresentationDefinition both = new PresentationDefinition("urn:test:both", List.of(
                insurance().inputDescriptors().get(0),
                SmartHealthCardScopes.COVID_VACCINE_DEFINITION.inputDescriptors().get(0)));
        ManifestEntry insuranceCard = entry("shcA", "4.0.1", BundleContent.of("Patient"), BundleContent.of("Coverage"));
        ManifestEntry vaccineCard = entry("shcB", "4.0.1", BundleContent.of("Patient"),
                BundleContent.of("Observation", SmartHealthCardScopes.VACCINATION_PROFILE));
        ManifestEntry combined = entry("shcC", "4.0.3", BundleContent.of("Patient"), BundleContent.of("Coverage"),
                BundleContent.of("Observation", SmartHealthCardScopes.VACCINATION_PROFILE));

        assertThat(matcher.match(both, List.of(insuranceCard, vaccineCard, combined))).containsExactly(combined);
    }

    @Test
    void keepsManifestOrder() {
        ManifestEntry first = entry("shc1", "4.0.1", BundleContent.of("Coverage"), BundleContent.of("Patient"));
        ManifestEntry skipped = entry("shc2", "3.0.2", BundleContent.of("Patient"), BundleContent.of("Coverage"));
        ManifestEntry second = entry("shc3", "4.3.0", BundleContent.of("Patient"), BundleContent.of("Coverage"));

        assertThat(matcher.match(insurance(), List.of(first, skipped, second)))
                .extracting(ManifestEntry::credential)
                .containsExactly("shc1", "shc3");
    }

    @Test
    void definitionWithoutDescriptorsKeepsEveryEntry() {
        ManifestEntry card = entry("shcA", "1.0.0");

        assertThat(matcher.match(new PresentationDefinition("urn:test:empty", List.of()), List.of(card)))
                .containsExactly(card);
    }

    @Test
    void emptyManifestYieldsEmptyResult() {
        assertThat(matcher.match(insurance(), List.of())).isEmpty();
        assertThat(matcher.match(insurance(), null)).isEmpty();
    }

    @Test
    void anyOfSeveralVersionPatternsMatches() {
        PresentationDefinition definition = new PresentationDefinition("urn:test:versions", List.of(
                new InputDescriptor("v", "Versions", null, null,
                        new Constraints(List.of("3.0.*", "4.0.1"), List.of(), false))));

        assertThat(matcher.match(definition, List.of(
                entry("a", "3.0.2"), entry("b", "4.0.1"), entry("c", "4.0.2"))))
                .extracting(ManifestEntry::credential)
                .containsExactly("a", "b");
    }

    @Test
    void acceptsSingleVersionStringInJson() {
        String json = """
                {
                  "id": "urn:test:json",
                  "input_descriptors": [{
                    "id": "insurance",
                    "name": "Insurance",
                    "format": { "shc_vc": { "alg": ["ES256"] } },
                    "constraints": {
                      "fhirVersion": "4.0.*",
                      "fhirBundleContains": [{ "resourceType": "Coverage" }],
                      "optional": false
                    }
                  }]
                }
                """;
        PresentationDefinition definition = new ObjectMapper().readValue(json, PresentationDefinition.class);

        assertThat(definition.inputDescriptors().get(0).constraints().fhirVersion()).containsExactly("4.0.*");
        assertThat(matcher.match(definition, List.of(entry("a", "4.0.1", BundleContent.of("Coverage"))))).hasSize(1);
    }

    @Test
    void rejectsBlankVersionPatternAtCompileTime() {
        PresentationDefinition definition = new PresentationDefinition("urn:test:blank", List.of(
                new InputDescriptor("v", "Blank", null, null,
                        new Constraints(List.of(" "), List.of(), false))));

        assertThatThrownBy(() -> matcher.compile(definition))
                .isInstanceOf(DefinitionCompilationException.class)
                .hasMessageContaining("blank");
    }

    @Test
    void rejectsDescriptorWithoutConstraints() {
        PresentationDefinition definition = new PresentationDefinition("urn:test:none", List.of(
                new InputDescriptor("v", "No constraints", null, null, null)));

        assertThatThrownBy(() -> matcher.match(definition, List.of(entry("a", "4.0.1"))))
                .isInstanceOf(DefinitionCompilationException.class);
    }

    @Test
    void rejectsBundleRequirementWithoutResourceType() {
        PresentationDefinition definition = new PresentationDefinition("urn:test:resource", List.of(
                new InputDescriptor("v", "Missing type", null, null,
                        new Constraints(List.of("4.*"), List.of(new BundleContent(null, null)), false))));

        assertThatThrownBy(() -> matcher.compile(definition))
                .isInstanceOf(DefinitionCompilationException.class)
                .hasMessageContaining("resourceType");
    }

    @Test
    void lenientMatcherKeepsLegacyPatternSemantics() {
        ConstraintMatcher lenient = new ConstraintMatcher(VersionMatching.LENIENT);
        ManifestEntry oddVersion = entry("shcA", "4x0", BundleContent.of("Patient"), BundleContent.of("Coverage"));

        assertThat(lenient.match(insurance(), List.of(oddVersion))).containsExactly(oddVersion);
        assertThat(matcher.match(insurance(), List.of(oddVersion))).isEmpty();
    }
}
