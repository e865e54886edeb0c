package com.gentoro.graphsync.config;

import com.gentoro.graphsync.exception.ConfigException;
import com.gentoro.graphsync.logging.LoggingService;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import org.apache.commons.configuration2.CompositeConfiguration;
import org.apache.commons.configuration2.Configuration;
import org.apache.commons.configuration2.SystemConfiguration;
import org.apache.commons.configuration2.YAMLConfiguration;

/**
 * Loads the application configuration. JVM system properties take precedence over the YAML file,
 * so any key can be overridden with {@code -Dgraph.driver=neo4j-bolt} and friends.
 *
 * <p>The YAML source is either an explicit file or {@code application.yaml} on the classpath.
 */
public class ConfigurationProvider {
  private static final org.slf4j.Logger log =
      LoggingService.getLogger(ConfigurationProvider.class);

  public static final String DEFAULT_RESOURCE = "application.yaml";

  private final CompositeConfiguration config;

  /** Classpath {@code application.yaml}. */
  public ConfigurationProvider() {
    this((Path) null);
  }

  /**
   * @param configFile YAML file to load; when null the classpath default is used
   */
  public ConfigurationProvider(Path configFile) {
    this.config = new CompositeConfiguration();
    this.config.addConfiguration(new SystemConfiguration());
    this.config.addConfiguration(configFile == null ? loadResource() : loadFile(configFile));
  }

  public Configuration config() {
    return config;
  }

  private static YAMLConfiguration loadFile(Path configFile) {
    if (!Files.isRegularFile(configFile)) {
      throw new ConfigException("Configuration file not found: " + configFile.toAbsolutePath());
    }
    log.info("Loading configuration from {}", configFile.toAbsolutePath());
    try (Reader reader = Files.newBufferedReader(configFile, StandardCharsets.UTF_8)) {
      return read(reader, configFile.toString());
    } catch (IOException e) {
      throw new ConfigException("Unable to read configuration file " + configFile, e);
    }
  }

  private static YAMLConfiguration loadResource() {
    InputStream in =
        ConfigurationProvider.class.getClassLoader().getResourceAsStream(DEFAULT_RESOURCE);
    if (in == null) {
      log.debug("No {} on classpath, using built-in defaults", DEFAULT_RESOURCE);
      return new YAMLConfiguration();
    }
    try (Reader reader = new InputStreamReader(in, StandardCharsets.UTF_8)) {
      return read(reader, "classpath:" + DEFAULT_RESOURCE);
    } catch (IOException e) {
      throw new ConfigException("Unable to read classpath resource " + DEFAULT_RESOURCE, e);
    }
  }

  private static YAMLConfiguration read(Reader reader, String source) {
    YAMLConfiguration yaml = new YAMLConfiguration();
    try {
      yaml.read(reader);
    } catch (org.apache.commons.configuration2.ex.ConfigurationException e) {
      throw new ConfigException("Invalid YAML configuration in " + source, e);
    }
    return yaml;
  }
}
