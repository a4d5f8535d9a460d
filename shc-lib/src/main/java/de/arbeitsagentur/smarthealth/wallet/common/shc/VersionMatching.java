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
 * How {@code fhirVersion} wildcard patterns are interpreted.
 */
public enum VersionMatching {
    /**
     * {@code *} matches any sequence, every other character matches itself and the
     * pattern must cover the whole version string.
     */
    STRICT,
    /**
     * Legacy interpretation: only {@code *} is rewritten, so {@code .} matches any single
     * character and the pattern may match anywhere inside the version string.
     */
    LENIENT
}
