package dev.talentmatch.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import dev.talentmatch.model.ScreeningScenario;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.io.File;
import java.io.IOException;

/**
 * Loads the screening scenario from the configured JSON file.
 */
@Slf4j
@Configuration
public class ScenarioConfig {

  @Bean
  public ScreeningScenario screeningScenario(ObjectMapper objectMapper, ScreeningConfig screeningConfig) {
    return load(objectMapper, new File(screeningConfig.getScenarioFile()));
  }

  static ScreeningScenario load(ObjectMapper objectMapper, File file) {
    if (!file.exists()) {
      log.warn("{} not found. Nothing will be screened.", file.getPath());
      return ScreeningScenario.builder().build();
    }

    try {
      ScreeningScenario scenario = objectMapper.readValue(file, ScreeningScenario.class);
      log.info("Loaded screening scenario with {} candidates", scenario.getCandidates().size());
      return scenario;
    } catch (IOException e) {
      log.error("Failed to load {}. Ensure it matches the scenario structure.", file.getPath(), e);
      throw new IllegalStateException("Could not load screening scenario", e);
    }
  }
}
