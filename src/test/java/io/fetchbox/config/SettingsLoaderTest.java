package io.fetchbox.config;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.stream.Stream;

final class SettingsLoaderTest {

    @Test
    void missingFileMeansDefaults() throws Exception {
        Path root = Files.createTempDirectory("fetchbox-test-settings-missing-");
        try {
            SettingsLoader loader = new SettingsLoader(root.resolve("fetchbox-settings.json"));
            SettingsLoader.ReloadOutcome out = loader.load();

            Assertions.assertFalse(out.fileExists());
            Assertions.assertEquals("defaults", out.reason());
            Assertions.assertEquals(FetchBoxSettings.defaults(), loader.current());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void loadsAndClampsFileValues() throws Exception {
        Path root = Files.createTempDirectory("fetchbox-test-settings-load-");
        try {
            Path file = root.resolve("fetchbox-settings.json");
            Files.writeString(file, """
                    {
                      "workerCount": 0,
                      "queueCapacity": 50,
                      "downloadRetryLimit": 5,
                      "baseBackoffMs": 200,
                      "maxBackoffMs": 1000,
                      "storageBucket": " media ",
                      "proxyPools": {
                        "main": {"primary": ["http://proxy-a:3128"], "fallbacks": ["pools/backup"],
                                 "retryBackoffMs": 9000, "maxRetries": 9},
                        "backup": {"primary": ["direct"]}
                      },
                      "handlers": {
                        "images": {"storageBucket": "img", "defaultHeaders": {"Accept": "image/*"}, "proxyPool": "main"}
                      },
                      "someFutureField": true
                    }
                    """, StandardCharsets.UTF_8);
            SettingsLoader loader = new SettingsLoader(file);
            SettingsLoader.ReloadOutcome out = loader.load();
            FetchBoxSettings settings = loader.current();

            Assertions.assertTrue(out.changed());
            Assertions.assertEquals(1, settings.workerCount());
            Assertions.assertEquals(50, settings.queueCapacity());
            Assertions.assertEquals(5, settings.retryLimits().downloadRetryLimit());
            Assertions.assertEquals(FetchBoxConfig.DEFAULT_STORAGE_RETRY_LIMIT, settings.storageRetryLimit());
            Assertions.assertEquals("media", settings.storageBucket());
            Assertions.assertEquals(2, settings.proxyPools().size());
            ProxyPoolConfig main = settings.proxyPools().get("main");
            Assertions.assertEquals(List.of("http://proxy-a:3128"), main.primary());
            Assertions.assertEquals(List.of("pools/backup"), main.fallbacks());
            Assertions.assertEquals(200L, settings.retryLimits().baseBackoffMs());
            Assertions.assertEquals(5, settings.retryLimits().downloadRetryLimit());
            Assertions.assertEquals("img", settings.handler("images").orElseThrow().storageBucket());
            Assertions.assertTrue(settings.handler("video").isEmpty());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void invalidFirstLoadFails() throws Exception {
        Path root = Files.createTempDirectory("fetchbox-test-settings-invalid-");
        try {
            Path file = root.resolve("fetchbox-settings.json");
            Files.writeString(file, """
                    {"proxyPools": {"main": {"primary": ["socks5://p:1"], "fallbacks": ["ghost"]}}, "jobTtlDays": 0}
                    """, StandardCharsets.UTF_8);
            SettingsLoader loader = new SettingsLoader(file);

            ConfigValidationException e = Assertions.assertThrows(ConfigValidationException.class, loader::load);
            Assertions.assertEquals(1, e.errors().size());
            Assertions.assertTrue(e.errors().get(0).contains("jobTtlDays"));

            Files.writeString(file, """
                    {"proxyPools": {"main": {"primary": ["socks5://p:1"], "fallbacks": ["ghost"]}}}
                    """, StandardCharsets.UTF_8);
            ConfigValidationException graph = Assertions.assertThrows(ConfigValidationException.class, loader::load);
            Assertions.assertEquals(2, graph.errors().size());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void invalidReloadKeepsPreviousSettings() throws Exception {
        Path root = Files.createTempDirectory("fetchbox-test-settings-reload-");
        try {
            Path file = root.resolve("fetchbox-settings.json");
            Files.writeString(file, "{\"queueCapacity\": 7}", StandardCharsets.UTF_8);
            SettingsLoader loader = new SettingsLoader(file);
            loader.load();
            Assertions.assertEquals(7, loader.current().queueCapacity());

            Files.writeString(file, "{\"queueCapacity\": ", StandardCharsets.UTF_8);
            SettingsLoader.ReloadOutcome broken = loader.load();
            Assertions.assertFalse(broken.changed());
            Assertions.assertEquals("invalid", broken.reason());
            Assertions.assertEquals(7, loader.current().queueCapacity());

            Files.writeString(file, "{\"queueCapacity\": 9}", StandardCharsets.UTF_8);
            SettingsLoader.ReloadOutcome fixed = loader.load();
            Assertions.assertTrue(fixed.changed());
            Assertions.assertEquals(9, loader.current().queueCapacity());

            Files.delete(file);
            loader.load();
            Assertions.assertEquals(FetchBoxSettings.defaults(), loader.current());
        } finally {
            deleteRecursively(root);
        }
    }

    private static void deleteRecursively(Path root) throws IOException {
        if (root == null || !Files.exists(root)) {
            return;
        }
        try (Stream<Path> walk = Files.walk(root)) {
            for (Path path : walk.sorted((a, b) -> Integer.compare(b.getNameCount(), a.getNameCount())).toList()) {
                Files.deleteIfExists(path);
            }
        }
    }
}
