package dev.talentmatch.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Settings of the command-line screening run.
 */
@Data
@Configuration
@ConfigurationProperties(prefix = "screening")
public class ScreeningConfig {

    private String scenarioFile = "scenario.json";
    private String systemUser = "system";
    private boolean publish = true;
}
