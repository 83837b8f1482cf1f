package dev.talentmatch.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Skill name aliases: canonical name to the variations folded onto it.
 */
@Data
@Configuration
@ConfigurationProperties(prefix = "skills")
public class SkillsConfig {

    private Map<String, List<String>> aliases = new HashMap<>();
}
