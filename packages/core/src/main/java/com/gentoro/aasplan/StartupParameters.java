package com.gentoro.aasplan;

import com.gentoro.aasplan.exception.ConfigException;
import java.util.Collections;
import java.util.HashMap;
import java.util.Map;

/**
 * Command-line arguments of the compiler.
 *
 * <p>Supported options: {@code --config|-c <file>}, {@code --input|-i <path>} and {@code
 * --output|-o <dir>}. Values given here take precedence over the YAML configuration.
 */
public class StartupParameters {
  private static final Map<String, String> ALIASES =
      Map.of("-c", "config", "-i", "input", "-o", "output");

  private final Map<String, String> parameters = new HashMap<>();

  public StartupParameters(String[] args) {
    if (args == null) {
      return;
    }
    for (int i = 0; i < args.length; i++) {
      String arg = args[i];
      String name;
      if (arg.startsWith("--")) {
        name = arg.substring(2);
        int eq = name.indexOf('=');
        if (eq > 0) {
          parameters.put(name.substring(0, eq), name.substring(eq + 1));
          continue;
        }
      } else if (ALIASES.containsKey(arg)) {
        name = ALIASES.get(arg);
      } else {
        throw new ConfigException("Unexpected argument: " + arg);
      }
      if (i + 1 >= args.length) {
        throw new ConfigException("Missing value for argument: " + arg);
      }
      parameters.put(name, args[++i]);
    }
  }

  public <T> T getParameter(String name, Class<T> type) {
    String value = parameters.get(name);
    if (value == null) {
      return null;
    }
    if (type == String.class) {
      return type.cast(value);
    }
    if (type == Boolean.class) {
      return type.cast(Boolean.valueOf(value));
    }
    if (type == Integer.class) {
      try {
        return type.cast(Integer.valueOf(value));
      } catch (NumberFormatException e) {
        throw new ConfigException("Argument '" + name + "' is not a number: " + value, e);
      }
    }
    throw new IllegalArgumentException("Unsupported parameter type: " + type.getName());
  }

  public boolean hasParameter(String name) {
    return parameters.containsKey(name);
  }

  public String configFile() {
    return parameters.getOrDefault("config", ConfigurationProvider.DEFAULT_LOCATION);
  }

  public Map<String, String> asMap() {
    return Collections.unmodifiableMap(parameters);
  }
}
