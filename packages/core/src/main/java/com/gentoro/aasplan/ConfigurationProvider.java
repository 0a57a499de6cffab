package com.gentoro.aasplan;

import com.gentoro.aasplan.exception.ConfigException;
import java.net.URL;
import java.nio.file.Files;
import java.nio.file.Path;
import org.apache.commons.configuration2.Configuration;
import org.apache.commons.configuration2.YAMLConfiguration;
import org.apache.commons.configuration2.builder.FileBasedConfigurationBuilder;
import org.apache.commons.configuration2.builder.fluent.Parameters;
import org.apache.commons.configuration2.ex.ConfigurationException;

/**
 * Loads the YAML application configuration.
 *
 * <p>The location is either a filesystem path or a {@code classpath:} resource name.
 */
public class ConfigurationProvider {
  private static final org.slf4j.Logger log =
      com.gentoro.aasplan.logging.LoggingService.getLogger(ConfigurationProvider.class);

  public static final String DEFAULT_LOCATION = "classpath:application.yaml";

  private final Configuration config;

  public ConfigurationProvider(String location) {
    String resolved = location == null || location.isBlank() ? DEFAULT_LOCATION : location.trim();
    this.config = load(resolved);
  }

  public Configuration config() {
    return config;
  }

  private static Configuration load(String location) {
    Parameters params = new Parameters();
    FileBasedConfigurationBuilder<YAMLConfiguration> builder =
        new FileBasedConfigurationBuilder<>(YAMLConfiguration.class);

    if (location.startsWith("classpath:")) {
      String resource = location.substring("classpath:".length());
      if (resource.startsWith("/")) {
        resource = resource.substring(1);
      }
      ClassLoader cl = Thread.currentThread().getContextClassLoader();
      if (cl == null) cl = ConfigurationProvider.class.getClassLoader();
      URL url = cl.getResource(resource);
      if (url == null) {
        throw new ConfigException("Classpath configuration not found: " + location);
      }
      builder.configure(params.fileBased().setURL(url));
    } else {
      Path path = Path.of(location);
      if (!Files.isRegularFile(path)) {
        throw new ConfigException("Configuration file does not exist: " + path);
      }
      builder.configure(params.fileBased().setFile(path.toFile()));
    }

    try {
      Configuration configuration = builder.getConfiguration();
      log.debug("Loaded configuration from {}", location);
      return configuration;
    } catch (ConfigurationException e) {
      throw new ConfigException("Failed to load configuration: " + location, e);
    }
  }
}
