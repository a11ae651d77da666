package com.netlink.osp.config;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;

import lombok.extern.log4j.Log4j2;

/**
 * Reads and writes {@link SessionPreferences} as a JSON file.
 *
 * <p>
 * Loading never fails: a missing file yields the defaults, an unreadable one
 * yields the defaults plus a warning, and a partial file is merged over the
 * defaults. Saving does fail, since the caller must know the write did not
 * happen.
 */
@Log4j2
public final class PreferencesLoader {
    private final ObjectMapper mapper;

    public PreferencesLoader() {
        this(new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT));
    }

    public PreferencesLoader(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    public SessionPreferences load(Path file) {
        SessionPreferences prefs = SessionPreferences.defaults();
        if (!Files.exists(file))
            return prefs;
        try {
            return mapper.readerForUpdating(prefs).readValue(file.toFile());
        } catch (IOException | IllegalArgumentException e) {
            log.warn("Failed to load preferences from {}, using defaults: {}", file, e.getMessage());
            return SessionPreferences.defaults();
        }
    }

    public void save(Path file, SessionPreferences prefs) {
        try {
            Path parent = file.toAbsolutePath().getParent();
            if (parent != null)
                Files.createDirectories(parent);
            mapper.writeValue(file.toFile(), prefs);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to save preferences to " + file, e);
        }
    }
}
