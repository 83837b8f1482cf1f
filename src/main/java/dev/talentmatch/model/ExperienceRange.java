package dev.talentmatch.model;

/**
 * Years of experience expected for a template, inclusive.
 */
public record ExperienceRange(int min, int max) {
}
