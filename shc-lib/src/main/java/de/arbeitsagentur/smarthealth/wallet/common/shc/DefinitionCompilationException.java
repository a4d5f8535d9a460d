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

/**
 * A presentation definition could not be turned into matching predicates.
 * Raised at registration or when an inline definition is resolved, never per entry.
 */
public class DefinitionCompilationException extends PresentationExchangeException {
    public DefinitionCompilationException(String message) {
        super(message);
    }

    public DefinitionCompilationException(String message, Throwable cause) {
        super(message, cause);
    }
}
