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

import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * A compiled {@code fhirVersion} glob such as {@code 4.*} or {@code 4.0.*}.
 */
public final class VersionPattern {
    private final String source;
    private final Pattern pattern;
    private final VersionMatching matching;

    private VersionPattern(String source, Pattern pattern, VersionMatching matching) {
        this.source = source;
        this.pattern = pattern;
        this.matching = matching;
    }

    public static VersionPattern compile(String glob, VersionMatching matching) {
        if (glob == null || glob.isBlank()) {
            throw new DefinitionCompilationException("fhirVersion pattern must not be blank");
        }
        VersionMatching mode = matching != null ? matching : VersionMatching.STRICT;
        try {
            Pattern compiled = mode == VersionMatching.STRICT
                    ? Pattern.compile(strictRegex(glob))
                    : Pattern.compile(glob.replace("*", ".*"));
            return new VersionPattern(glob, compiled, mode);
        } catch (PatternSyntaxException e) {
            throw new DefinitionCompilationException("Invalid fhirVersion pattern '%s'".formatted(glob), e);
        }
    }

    public boolean matches(String version) {
        if (version == null) {
            return false;
        }
        return matching == VersionMatching.STRICT
                ? pattern.matcher(version).matches()
                : pattern.matcher(version).find();
    }

    private static String strictRegex(String glob) {
        StringBuilder regex = new StringBuilder();
        int start = 0;
        int star;
        while ((star = glob.indexOf('*', start)) >= 0) {
            if (star > start) {
                regex.append(Pattern.quote(glob.substring(start, star)));
            }
            regex.append(".*");
            start = star + 1;
        }
        if (start < glob.length()) {
            regex.append(Pattern.quote(glob.substring(start)));
        }
        return regex.toString();
    }

    @Override
    public String toString() {
        return source;
    }
}
