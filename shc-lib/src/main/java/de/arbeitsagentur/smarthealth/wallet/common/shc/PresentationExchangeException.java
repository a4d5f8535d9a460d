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
 * Base type for failures of the presentation exchange. Every subtype stops the
 * pipeline at the point where it is raised.
 */
public class PresentationExchangeException extends RuntimeException {
    public PresentationExchangeException(String message) {
        super(message);
    }

    public PresentationExchangeException(String message, Throwable cause) {
        super(message, cause);
    }
}
