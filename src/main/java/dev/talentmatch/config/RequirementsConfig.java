package dev.talentmatch.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

@Data
@Configuration
@ConfigurationProperties(prefix = "requirements")
public class RequirementsConfig {

    private int defaultWeight = 5;
    private int minWeight = 1;
    private int maxWeight = 10;
}
