package com.quantori.csp.core.configuration;

import com.quantori.csp.api.model.ParseOptions;
import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import lombok.experimental.UtilityClass;
import lombok.extern.slf4j.Slf4j;

import java.util.HashMap;
import java.util.Map;

/**
 * Loads parse options from the {@code csp.parser} section of the application configuration.
 * <p>
 * Keys are the option names, e.g. {@code csp.parser.enable-rings}; defaults come from {@code reference.conf}.
 */
@Slf4j
@UtilityClass
public class ParserConfiguration {
  public static final String CONFIG_PATH = "csp.parser";
  static final String MAX_BRANCH_DEPTH = "max-branch-depth";
  static final String MAX_RING_PATHS = "max-ring-paths";

  public static ParseOptions load() {
    return fromConfig(ConfigFactory.load());
  }

  /**
   * Loads parse options with some keys replaced.
   *
   * @param overrides values keyed by full path, e.g. {@code csp.parser.add-implicit-hydrogens}
   * @return the options
   */
  public static ParseOptions load(Map<String, Object> overrides) {
    Config config = ConfigFactory.parseMap(overrides)
        .withFallback(ConfigFactory.load());
    return fromConfig(config);
  }

  public static ParseOptions fromConfig(Config config) {
    Config parser = config.getConfig(CONFIG_PATH);
    Map<String, Boolean> switches = new HashMap<>();
    for (String name : ParseOptions.optionNames()) {
      switches.put(name, parser.getBoolean(name));
    }
    ParseOptions options = ParseOptions.builder()
        .maxBranchDepth(parser.getInt(MAX_BRANCH_DEPTH))
        .maxRingPaths(parser.getInt(MAX_RING_PATHS))
        .build()
        .withOverrides(switches);
    log.debug("{} = {}", CONFIG_PATH, options);
    return options;
  }
}
