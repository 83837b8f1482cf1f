package dev.talentmatch.service;

import dev.talentmatch.model.CompanyProfile;
import dev.talentmatch.model.RequirementCategory;
import dev.talentmatch.model.RequirementItem;
import dev.talentmatch.model.ResolvedJobSpec;
import dev.talentmatch.model.SalaryRange;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.text.NumberFormat;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Renders a resolved job spec as the Markdown text stored with a JD version.
 */
@Component
public class JobDescriptionRenderer {

    public String render(ResolvedJobSpec spec) {
        List<String> lines = new ArrayList<>();
        CompanyProfile company = spec.getCompany();

        lines.add("# " + spec.getTitle());
        if (company != null) {
            lines.add("**Company:** " + company.getName());
            if (hasText(company.getIndustry())) {
                lines.add("**Industry:** " + company.getIndustry());
            }
        }
        if (hasText(spec.getLocation())) {
            lines.add("**Location:** " + spec.getLocation());
        }
        if (spec.getWorkArrangement() != null) {
            lines.add("**Work Arrangement:** " + spec.getWorkArrangement().displayName());
        }

        lines.add("");
        lines.add("## Job Description");
        lines.add(spec.getDescription());

        if (!spec.getRequirements().isEmpty()) {
            lines.add("");
            lines.add("## Requirements");
            addRequirements(lines, "Required Qualifications", spec.requirementsIn(RequirementCategory.MUST));
            addRequirements(lines, "Preferred Qualifications", spec.requirementsIn(RequirementCategory.SHOULD));
            addRequirements(lines, "Nice to Have", spec.requirementsIn(RequirementCategory.NICE));
        }

        SalaryRange salary = spec.getSalaryRange();
        if (salary != null) {
            lines.add("");
            lines.add("## Compensation");
            lines.add("**Salary Range:** " + format(salary.min()) + " - " + format(salary.max())
                    + (hasText(salary.currency()) ? " " + salary.currency() : ""));
        }

        addList(lines, "Benefits", spec.getBenefits());
        if (company != null) {
            addList(lines, "Company Culture", company.getCulture());
        }

        return String.join("\n", lines);
    }

    private void addRequirements(List<String> lines, String heading, List<RequirementItem> requirements) {
        if (requirements.isEmpty()) {
            return;
        }
        lines.add("");
        lines.add("### " + heading);
        requirements.forEach(r -> lines.add("- " + r.getDescription()));
    }

    private void addList(List<String> lines, String heading, List<String> items) {
        if (items == null || items.isEmpty()) {
            return;
        }
        lines.add("");
        lines.add("## " + heading);
        items.forEach(item -> lines.add("- " + item));
    }

    private static String format(BigDecimal amount) {
        return amount == null ? "?" : NumberFormat.getNumberInstance(Locale.US).format(amount);
    }

    private static boolean hasText(String value) {
        return value != null && !value.isBlank();
    }
}
