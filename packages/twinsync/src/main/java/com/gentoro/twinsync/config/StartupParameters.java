package com.gentoro.twinsync.config;

import com.gentoro.twinsync.exception.ConfigException;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/** Command line flags: {@code --mode scheduled|once|help} and {@code --config-file <location>}. */
public class StartupParameters {
  public static final String MODE_SCHEDULED = "scheduled";
  public static final String MODE_ONCE = "once";
  public static final String MODE_HELP = "help";

  private static final Set<String> MODES = Set.of(MODE_SCHEDULED, MODE_ONCE, MODE_HELP);

  private final Map<String, String> parameters = new HashMap<>();

  public StartupParameters(String[] arguments) {
    parameters.put("config-file", ConfigurationProvider.DEFAULT_LOCATION);
    parameters.put("mode", MODE_SCHEDULED);
    parameters.putAll(parse(arguments));
    validate();
  }

  private static Map<String, String> parse(String[] arguments) {
    Map<String, String> result = new HashMap<>();
    for (int p = 0; p < arguments.length; p++) {
      if (!arguments[p].startsWith("--")) {
        continue;
      }
      String name = arguments[p].substring(2);
      String value = null;
      if (p + 1 < arguments.length && !arguments[p + 1].startsWith("--")) {
        value = arguments[++p];
      }
      result.put(name, value);
    }
    return result;
  }

  private void validate() {
    String mode = parameters.get("mode");
    if (mode == null || !MODES.contains(mode)) {
      throw new ConfigException("Invalid mode: " + mode, Map.of("allowed", MODES.toString()));
    }
    String config = parameters.get("config-file");
    if (config == null || config.isBlank()) {
      throw new ConfigException("Missing config file location");
    }
  }

  public String mode() {
    return parameters.get("mode");
  }

  public String configFile() {
    return parameters.get("config-file");
  }

  public Optional<String> get(String name) {
    return Optional.ofNullable(parameters.get(name));
  }

  public boolean isPresent(String name) {
    return parameters.containsKey(name);
  }
}
