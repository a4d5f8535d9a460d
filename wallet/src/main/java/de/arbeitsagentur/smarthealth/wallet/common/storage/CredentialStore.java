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
package de.arbeitsagentur.smarthealth.wallet.common.storage;

import de.arbeitsagentur.smarthealth.wallet.common.shc.ManifestEntry;
import de.arbeitsagentur.smarthealth.wallet.config.WalletProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import tools.jackson.core.JacksonException;
import tools.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HexFormat;
import java.util.List;
import java.util.UUID;

/**
 * File-backed manifest of a holder's health cards. Each entry is one JSON file named
 * {@code <owner>-<millis>-<uuid>.json}, where the owner part is the hex encoded UTF-8
 * owner id so that distinct owners never share a prefix. Reads return copies so
 * matching works on a stable snapshot.
 */
@Component
public class CredentialStore {
    private static final Logger LOG = LoggerFactory.getLogger(CredentialStore.class);

    private final WalletProperties properties;
    private final ObjectMapper objectMapper;

    public CredentialStore(WalletProperties properties, ObjectMapper objectMapper) {
        this.properties = properties;
        this.objectMapper = objectMapper;
    }

    public synchronized Path saveEntry(String ownerId, ManifestEntry entry) {
        if (entry == null || entry.credential() == null || entry.credential().isBlank()) {
            throw new IllegalArgumentException("Manifest entry needs a credential");
        }
        try {
            Files.createDirectories(properties.storageDir());
            Path file = properties.storageDir()
                    .resolve("%s-%d-%s.json".formatted(safeOwner(ownerId), System.currentTimeMillis(), UUID.randomUUID()));
            objectMapper.writeValue(file.toFile(), entry);
            return file;
        } catch (IOException | JacksonException e) {
            throw new IllegalStateException("Failed to store credential", e);
        }
    }

    /**
     * Copy-on-read view of the owner's manifest.
     */
    public synchronized List<ManifestEntry> snapshot(String ownerId) {
        return listEntries(ownerId).stream().map(Entry::manifest).toList();
    }

    public synchronized List<Entry> listEntries(String ownerId) {
        String prefix = safeOwner(ownerId) + "-";
        List<Entry> items = new ArrayList<>();
        for (Path path : listFiles()) {
            String fileName = path.getFileName().toString();
            if (!fileName.startsWith(prefix)) {
                continue;
            }
            ManifestEntry manifest;
            try {
                manifest = objectMapper.readValue(path.toFile(), ManifestEntry.class);
            } catch (JacksonException e) {
                LOG.warn("Skipping unreadable manifest entry {}: {}", fileName, e.getMessage());
                continue;
            }
            if (manifest == null || manifest.credential() == null || manifest.credential().isBlank()) {
                LOG.warn("Skipping manifest entry {}: no credential", fileName);
                continue;
            }
            items.add(new Entry(fileName, manifest));
        }
        return List.copyOf(items);
    }

    public synchronized boolean deleteEntry(String ownerId, String fileName) {
        if (fileName == null || fileName.isBlank() || !fileName.startsWith(safeOwner(ownerId) + "-")) {
            return false;
        }
        Path target = properties.storageDir().resolve(fileName).normalize();
        if (!properties.storageDir().normalize().equals(target.getParent())) {
            return false;
        }
        try {
            return Files.deleteIfExists(target);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to delete credential " + fileName, e);
        }
    }

    public record Entry(String fileName, ManifestEntry manifest) {
    }

    private List<Path> listFiles() {
        if (!Files.exists(properties.storageDir())) {
            return List.of();
        }
        try (var stream = Files.list(properties.storageDir())) {
            return stream
                    .filter(Files::isRegularFile)
                    .filter(p -> p.getFileName().toString().endsWith(".json"))
                    .sorted(Comparator.naturalOrder())
                    .toList();
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read credential store", e);
        }
    }

    private String safeOwner(String ownerId) {
        if (ownerId == null || ownerId.isBlank()) {
            return "anon";
        }
        return HexFormat.of().formatHex(ownerId.getBytes(StandardCharsets.UTF_8));
    }
}
