package dev.talentmatch.model;

import java.math.BigDecimal;

public record SalaryRange(BigDecimal min, BigDecimal max, String currency) {
}
