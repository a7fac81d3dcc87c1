package com.gentoro.twinsync.config;

import com.gentoro.twinsync.exception.ConfigException;
import com.gentoro.twinsync.exception.SerializationException;
import java.io.BufferedReader;
import java.io.File;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;
import org.apache.commons.configuration2.Configuration;
import org.apache.commons.configuration2.YAMLConfiguration;
import org.apache.commons.configuration2.builder.FileBasedConfigurationBuilder;
import org.apache.commons.configuration2.builder.fluent.Parameters;
import org.apache.commons.configuration2.ex.ConfigurationException;
import org.apache.commons.configuration2.interpol.Lookup;

/**
 * Loads the YAML configuration into a Commons Configuration instance.
 *
 * <p>Accepted locations: {@code classpath:application.yaml}, {@code file:/etc/twinsync.yaml} or a
 * plain relative/absolute path. {@code ${env:NAME}} references resolve from the process
 * environment first and then from a {@code .env.local} file, if one exists.
 */
public final class ConfigurationProvider {
  private static final org.slf4j.Logger log =
      com.gentoro.twinsync.logging.LoggingService.getLogger(ConfigurationProvider.class);

  public static final String DEFAULT_LOCATION = "classpath:application.yaml";

  private final Configuration configuration;

  public ConfigurationProvider(String location) {
    this.configuration = load(location);
  }

  public Configuration config() {
    return configuration;
  }

  static Configuration load(String location) {
    String loc = location == null || location.isBlank() ? DEFAULT_LOCATION : location.trim();
    if (loc.startsWith("classpath:")) {
      return fromClasspath(loc.substring("classpath:".length()));
    }
    if (loc.startsWith("file:")) {
      return fromFile(new File(java.net.URI.create(loc)));
    }
    return fromFile(new File(loc));
  }

  private static Configuration fromClasspath(String resourceName) {
    ClassLoader cl = Thread.currentThread().getContextClassLoader();
    try (InputStream input = cl.getResourceAsStream(resourceName)) {
      if (input == null) {
        log.warn("Configuration resource '{}' not found; using defaults", resourceName);
        return withEnvLookup(new YAMLConfiguration());
      }
      log.info("Loading configuration from classpath resource: {}", resourceName);
      YAMLConfiguration config = new YAMLConfiguration();
      try (Reader reader = new InputStreamReader(input, StandardCharsets.UTF_8)) {
        config.read(reader);
      }
      return withEnvLookup(config);
    } catch (IOException | ConfigurationException e) {
      throw new SerializationException(
          "Failed to read YAML from classpath resource: " + resourceName, e);
    }
  }

  private static Configuration fromFile(File file) {
    if (!file.isFile()) {
      throw new ConfigException("Configuration file does not exist: " + file.getAbsolutePath());
    }
    log.info("Loading configuration from file: {}", file.getAbsolutePath());
    try {
      FileBasedConfigurationBuilder<YAMLConfiguration> builder =
          new FileBasedConfigurationBuilder<>(YAMLConfiguration.class)
              .configure(new Parameters().fileBased().setFile(file));
      return withEnvLookup(builder.getConfiguration());
    } catch (ConfigurationException e) {
      throw new ConfigException("Failed to load YAML file: " + file, e);
    }
  }

  private static Configuration withEnvLookup(Configuration config) {
    config.getInterpolator().registerLookup("env", new EnvLookup(List.of(Paths.get(".env.local"))));
    return config;
  }

  /** Environment lookup with a lazily loaded KEY=VALUE file as fallback. */
  static final class EnvLookup implements Lookup {
    private final List<Path> candidates;
    private volatile Map<String, String> fallback;

    EnvLookup(List<Path> candidates) {
      this.candidates = candidates;
    }

    @Override
    public Object lookup(String key) {
      String val = System.getenv(key);
      if (val != null && !val.isEmpty()) {
        return val;
      }
      return fallback().get(key);
    }

    private Map<String, String> fallback() {
      Map<String, String> current = fallback;
      if (current == null) {
        synchronized (this) {
          if (fallback == null) {
            fallback = candidates.stream()
                .filter(Files::isRegularFile)
                .findFirst()
                .map(EnvLookup::readKeyValueFile)
                .orElse(Collections.emptyMap());
          }
          current = fallback;
        }
      }
      return current;
    }

    static Map<String, String> readKeyValueFile(Path path) {
      log.info("Reading environment fallback file: {}", path.toAbsolutePath());
      try (BufferedReader br = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
        return br.lines()
            .map(String::trim)
            .filter(line -> !line.isEmpty() && !line.startsWith("#") && line.indexOf('=') > 0)
            .collect(
                Collectors.toMap(
                    line -> line.substring(0, line.indexOf('=')).trim(),
                    line -> unquote(line.substring(line.indexOf('=') + 1).trim()),
                    (a, b) -> b));
      } catch (IOException e) {
        throw new ConfigException("Failed to read environment file: " + path, e);
      }
    }

    private static String unquote(String val) {
      if (val.length() >= 2
          && ((val.startsWith("\"") && val.endsWith("\""))
              || (val.startsWith("'") && val.endsWith("'")))) {
        return val.substring(1, val.length() - 1);
      }
      return val;
    }
  }
}
