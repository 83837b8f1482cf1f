package dev.talentmatch.model;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.List;

@Value
public class CompanyPreferences {

    List<String> prioritySkills;
    List<String> dealBreakers;
    List<String> niceToHave;

    @Jacksonized
    @Builder
    public CompanyPreferences(List<String> prioritySkills, List<String> dealBreakers, List<String> niceToHave) {
        this.prioritySkills = ModelLists.present(prioritySkills);
        this.dealBreakers = ModelLists.present(dealBreakers);
        this.niceToHave = ModelLists.present(niceToHave);
    }
}
