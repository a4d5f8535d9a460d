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

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Immutable mapping from scope URI to presentation definition. Definitions are compiled
 * when the registry is built so that broken patterns fail at startup.
 */
public final class ScopeRegistry {
    private final Map<String, CompiledDefinition> definitions;

    private ScopeRegistry(Map<String, CompiledDefinition> definitions) {
        this.definitions = definitions;
    }

    public static ScopeRegistry of(List<PresentationDefinition> definitions, ConstraintMatcher matcher) {
        Map<String, CompiledDefinition> byScope = new LinkedHashMap<>();
        for (PresentationDefinition definition : definitions) {
            if (definition == null || definition.id() == null || definition.id().isBlank()) {
                throw new DefinitionCompilationException("Registered presentation definitions need a scope id");
            }
            if (byScope.containsKey(definition.id())) {
                throw new DefinitionCompilationException("Scope %s is registered twice".formatted(definition.id()));
            }
            byScope.put(definition.id(), matcher.compile(definition));
        }
        return new ScopeRegistry(Collections.unmodifiableMap(byScope));
    }

    public Optional<CompiledDefinition> find(String scope) {
        if (scope == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(definitions.get(scope));
    }

    /**
     * Looks up a scope by exact key.
     *
     * @throws UnknownScopeException if nothing is registered under {@code scope}
     */
    public CompiledDefinition resolve(String scope) {
        return find(scope).orElseThrow(() -> new UnknownScopeException(scope));
    }

    public Set<String> scopes() {
        return definitions.keySet();
    }
}
