package com.codeheadsystems.compliance.configuration;

import com.codeheadsystems.compliance.common.json.ObjectMapperFactory;
import com.codeheadsystems.compliance.exception.InvalidConfigurationException;
import com.codeheadsystems.compliance.model.ComplianceConfiguration;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Path;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Reads the process configuration from JSON. Every policy table left out of the file keeps its default.
 */
public class ConfigurationLoader {

  private static final Logger LOGGER = LoggerFactory.getLogger(ConfigurationLoader.class);

  private final ObjectMapper objectMapper;

  /**
   * Instantiates a new Configuration loader with the shared mapper settings.
   */
  public ConfigurationLoader() {
    this(ObjectMapperFactory.objectMapper());
  }

  /**
   * Instantiates a new Configuration loader.
   *
   * @param objectMapper the object mapper
   */
  public ConfigurationLoader(final ObjectMapper objectMapper) {
    this.objectMapper = objectMapper;
  }

  /**
   * Load from a file.
   *
   * @param path the path
   * @return the compliance configuration
   */
  public ComplianceConfiguration load(final Path path) {
    LOGGER.info("load({})", path);
    try {
      return objectMapper.readValue(path.toFile(), ComplianceConfiguration.class);
    } catch (IOException | IllegalStateException e) {
      throw new InvalidConfigurationException("Unable to load configuration from " + path, e);
    }
  }

  /**
   * Load from the classpath.
   *
   * @param resource the resource name
   * @return the compliance configuration
   */
  public ComplianceConfiguration loadResource(final String resource) {
    LOGGER.info("loadResource({})", resource);
    try (InputStream in = ConfigurationLoader.class.getClassLoader().getResourceAsStream(resource)) {
      if (in == null) {
        throw new InvalidConfigurationException("No such configuration resource: " + resource, null);
      }
      return objectMapper.readValue(in, ComplianceConfiguration.class);
    } catch (IOException | IllegalStateException e) {
      throw new InvalidConfigurationException("Unable to load configuration from " + resource, e);
    }
  }

}
