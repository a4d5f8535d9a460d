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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Selects the manifest entries that satisfy a presentation definition.
 * Matching is pure and keeps the order of the given entries.
 */
public class ConstraintMatcher {
    private static final Logger LOG = LoggerFactory.getLogger(ConstraintMatcher.class);

    private final VersionMatching versionMatching;

    public ConstraintMatcher() {
        this(VersionMatching.STRICT);
    }

    public ConstraintMatcher(VersionMatching versionMatching) {
        this.versionMatching = versionMatching != null ? versionMatching : VersionMatching.STRICT;
    }

    public CompiledDefinition compile(PresentationDefinition definition) {
        return CompiledDefinition.compile(definition, versionMatching);
    }

    public List<ManifestEntry> match(PresentationDefinition definition, List<ManifestEntry> entries) {
        return match(compile(definition), entries);
    }

    public List<ManifestEntry> match(CompiledDefinition definition, List<ManifestEntry> entries) {
        if (entries == null || entries.isEmpty()) {
            return List.of();
        }
        List<ManifestEntry> matches = new ArrayList<>();
        for (ManifestEntry entry : entries) {
            if (entry == null) {
                continue;
            }
            if (definition.isSatisfiedBy(entry)) {
                matches.add(entry);
            } else if (LOG.isDebugEnabled()) {
                LOG.debug("Manifest entry (fhirVersion={}) rejected for definition {}",
                        entry.fhirVersion(), definition.definition().id());
            }
        }
        LOG.debug("Definition {} matched {} of {} manifest entries",
                definition.definition().id(), matches.size(), entries.size());
        return List.copyOf(matches);
    }
}
