package com.gentoro.graphsync.logging;

import static org.junit.jupiter.api.Assertions.*;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.LoggerContext;
import com.gentoro.graphsync.config.ConfigurationProvider;
import java.nio.file.Path;
import org.apache.commons.configuration2.BaseConfiguration;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;

class LoggingServiceTest {
  private static final String NAME = "com.gentoro.graphsync.sample";

  private static Logger logback(String name) {
    return (Logger) LoggerFactory.getLogger(name);
  }

  @AfterEach
  void reset() {
    logback(NAME).setLevel(null);
    logback("com.gentoro.graphsync.graph").setLevel(null);
  }

  @Test
  @DisplayName("Loggers are served by Logback")
  void boundToLogback() {
    assertInstanceOf(LoggerContext.class, LoggerFactory.getILoggerFactory());
    assertInstanceOf(Logger.class, LoggingService.getLogger(LoggingServiceTest.class));
  }

  @Test
  @DisplayName("Configured levels are applied to Logback loggers")
  void appliesLevels() {
    BaseConfiguration config = new BaseConfiguration();
    config.setProperty("logging.level." + NAME, "TRACE");

    LoggingService.applyConfiguration(config);

    assertEquals(Level.TRACE, logback(NAME).getLevel());
  }

  @Test
  @DisplayName("Unknown level names fall back to INFO")
  void unknownLevel() {
    BaseConfiguration config = new BaseConfiguration();
    config.setProperty("logging.level." + NAME, "chatty");

    LoggingService.applyConfiguration(config);

    assertEquals(Level.INFO, logback(NAME).getLevel());
  }

  @Test
  @DisplayName("Dotted logger names from YAML files are unescaped")
  void yamlLoggerNames() throws Exception {
    ClassLoader loader = LoggingServiceTest.class.getClassLoader();
    Path yaml = Path.of(loader.getResource("application-test.yaml").toURI());

    LoggingService.applyConfiguration(new ConfigurationProvider(yaml).config());

    assertEquals(Level.DEBUG, logback("com.gentoro.graphsync.graph").getLevel());
    assertEquals("a.b.c", LoggingService.loggerName("a..b..c"));
  }

  @Test
  @DisplayName("A missing configuration is ignored")
  void nullConfiguration() {
    assertDoesNotThrow(() -> LoggingService.applyConfiguration(null));
  }
}
