package io.fetchbox.config;

import io.fetchbox.util.Jsons;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;

/**
 * Loads {@code fetchbox-settings.json} and reloads it when its modification time
 * changes. A missing file means defaults. An invalid file is rejected and the
 * previous settings stay in effect, except on the first load where the error
 * propagates.
 */
public final class SettingsLoader {
    private static final Logger log = LoggerFactory.getLogger(SettingsLoader.class);

    private final Path settingsFile;
    private volatile FetchBoxSettings current;
    private volatile long fileMtimeMs;
    private volatile long lastCheckMs;
    private boolean loadedOnce;

    public SettingsLoader(Path settingsFile) {
        this.settingsFile = settingsFile;
        this.current = FetchBoxSettings.defaults();
        this.fileMtimeMs = Long.MIN_VALUE;
        this.lastCheckMs = 0L;
    }

    public FetchBoxSettings current() {
        return current;
    }

    public Path settingsFile() {
        return settingsFile;
    }

    public synchronized ReloadOutcome load() {
        return load(true);
    }

    public synchronized ReloadOutcome maybeReload(long minIntervalMs) {
        long nowMs = Instant.now().toEpochMilli();
        if ((nowMs - lastCheckMs) < Math.max(0L, minIntervalMs)) {
            return new ReloadOutcome(false, fileMtimeMs >= 0L, settingsFile.toString(), "skip_interval", nowMs);
        }
        return load(false);
    }

    private ReloadOutcome load(boolean force) {
        long checkedAtMs = Instant.now().toEpochMilli();
        lastCheckMs = checkedAtMs;
        long mtime = resolveFileMtimeMs(settingsFile);
        if (!force && mtime == fileMtimeMs) {
            return new ReloadOutcome(false, mtime >= 0L, settingsFile.toString(), "unchanged", checkedAtMs);
        }
        if (mtime < 0L) {
            FetchBoxSettings defaults = FetchBoxSettings.defaults();
            boolean changed = !defaults.equals(current);
            current = defaults;
            fileMtimeMs = -1L;
            loadedOnce = true;
            if (changed) {
                log.info("Settings file {} not found, using defaults", settingsFile);
            }
            return new ReloadOutcome(changed, false, settingsFile.toString(), "defaults", checkedAtMs);
        }
        FetchBoxSettings resolved;
        try {
            SettingsFile file = Jsons.mapper().readValue(settingsFile.toFile(), SettingsFile.class);
            SettingsValidator.validateRaw(file);
            resolved = FetchBoxSettings.fromFile(file, FetchBoxSettings.defaults());
            SettingsValidator.validate(resolved);
        } catch (IOException | RuntimeException e) {
            if (!loadedOnce) {
                if (e instanceof ConfigValidationException) {
                    throw (ConfigValidationException) e;
                }
                throw new RuntimeException("Failed to load settings: " + settingsFile, e);
            }
            fileMtimeMs = mtime;
            log.warn("Rejected settings reload from {}, keeping previous settings: {}", settingsFile, e.getMessage());
            return new ReloadOutcome(false, true, settingsFile.toString(), "invalid", checkedAtMs);
        }
        boolean changed = !resolved.equals(current);
        current = resolved;
        fileMtimeMs = mtime;
        loadedOnce = true;
        if (changed) {
            log.info("Loaded settings from {}", settingsFile);
        }
        return new ReloadOutcome(changed, true, settingsFile.toString(), changed ? "reloaded" : "ok", checkedAtMs);
    }

    private static long resolveFileMtimeMs(Path path) {
        try {
            if (!Files.exists(path)) {
                return -1L;
            }
            return Files.getLastModifiedTime(path).toMillis();
        } catch (IOException e) {
            return -1L;
        }
    }

    public record ReloadOutcome(boolean changed, boolean fileExists, String path, String reason, long checkedAtMs) {
    }
}
