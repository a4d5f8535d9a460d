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

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * A presentation definition translated into per-descriptor predicates.
 */
public final class CompiledDefinition {
    private final PresentationDefinition definition;
    private final List<CompiledDescriptor> descriptors;

    private CompiledDefinition(PresentationDefinition definition, List<CompiledDescriptor> descriptors) {
        this.definition = definition;
        this.descriptors = descriptors;
    }

    public static CompiledDefinition compile(PresentationDefinition definition, VersionMatching matching) {
        if (definition == null) {
            throw new DefinitionCompilationException("Presentation definition is missing");
        }
        List<CompiledDescriptor> compiled = new ArrayList<>();
        for (InputDescriptor descriptor : definition.inputDescriptors()) {
            compiled.add(CompiledDescriptor.compile(definition.id(), descriptor, matching));
        }
        return new CompiledDefinition(definition, List.copyOf(compiled));
    }

    public PresentationDefinition definition() {
        return definition;
    }

    public List<CompiledDescriptor> descriptors() {
        return descriptors;
    }

    /**
     * An entry qualifies only if it satisfies every descriptor on its own.
     */
    public boolean isSatisfiedBy(ManifestEntry entry) {
        return descriptors.stream().allMatch(d -> d.isSatisfiedBy(entry));
    }

    public record CompiledDescriptor(String id,
                                     boolean optional,
                                     List<VersionPattern> versions,
                                     List<BundleContent> requiredContents) {

        static CompiledDescriptor compile(String definitionId, InputDescriptor descriptor, VersionMatching matching) {
            if (descriptor == null) {
                throw new DefinitionCompilationException("Definition %s contains an empty input descriptor"
                        .formatted(definitionId));
            }
            Constraints constraints = descriptor.constraints();
            if (constraints == null) {
                throw new DefinitionCompilationException("Input descriptor %s of %s has no constraints"
                        .formatted(descriptor.id(), definitionId));
            }
            if (constraints.fhirVersion().isEmpty() && !constraints.optional()) {
                throw new DefinitionCompilationException("Input descriptor %s of %s declares no fhirVersion"
                        .formatted(descriptor.id(), definitionId));
            }
            List<VersionPattern> versions = constraints.fhirVersion().stream()
                    .map(v -> VersionPattern.compile(v, matching))
                    .toList();
            for (BundleContent content : constraints.fhirBundleContains()) {
                if (content == null || content.resourceType() == null || content.resourceType().isBlank()) {
                    throw new DefinitionCompilationException("Input descriptor %s of %s has a bundle requirement without resourceType"
                            .formatted(descriptor.id(), definitionId));
                }
            }
            return new CompiledDescriptor(descriptor.id(), constraints.optional(), versions,
                    constraints.fhirBundleContains());
        }

        public boolean isSatisfiedBy(ManifestEntry entry) {
            // optional descriptors are not checked against the entry at all
            if (optional) {
                return true;
            }
            return matchesVersion(entry.fhirVersion()) && containsAll(entry.fhirBundleContains());
        }

        boolean matchesVersion(String version) {
            return versions.stream().anyMatch(p -> p.matches(version));
        }

        boolean containsAll(List<BundleContent> bundle) {
            return requiredContents.stream()
                    .allMatch(required -> bundle.stream().anyMatch(item -> satisfies(item, required)));
        }

        private static boolean satisfies(BundleContent item, BundleContent required) {
            if (item == null || !Objects.equals(required.resourceType(), item.resourceType())) {
                return false;
            }
            if (required.profile() == null) {
                return true;
            }
            List<String> itemProfiles = item.profile() != null ? item.profile() : List.of();
            return required.profile().stream().anyMatch(itemProfiles::contains);
        }
    }
}
