package dev.talentmatch.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Fit scoring weights, gate and reporting limits.
 * Loaded from scoring.yml under 'scoring' prefix.
 */
@Data
@Configuration
@ConfigurationProperties(prefix = "scoring")
public class ScoringConfig {

    // Overall = must * mustWeight + should * shouldWeight + nice * niceWeight
    private double mustWeight = 0.5;
    private double shouldWeight = 0.3;
    private double niceWeight = 0.2;

    // Any must-have below gateThreshold caps the overall score at gateCap
    private double gateThreshold = 0.3;
    private int gateCap = 60;

    // Skill degree: proficiency >= strongProficiency is a full match,
    // weaker ones scale from weakMatchFloor up to weakMatchCeiling
    private double strongProficiency = 6.0;
    private double weakMatchFloor = 0.5;
    private double weakMatchCeiling = 0.9;
    private double technologyOnlyDegree = 0.5;

    private double matchedThreshold = 0.7;
    private double strengthThreshold = 0.8;
    private double gapThreshold = 0.5;
    private int maxStrengths = 5;
    private int maxGaps = 5;
    private int maxRecommendations = 3;

    // Ranking of screened candidates
    private int minFitScore = 60;
    private int maxResults = 50;
}
