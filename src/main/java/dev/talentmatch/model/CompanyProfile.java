package dev.talentmatch.model;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.List;

/**
 * Company a variant belongs to. List fields are copied on construction so a
 * resolved spec never sees later changes to the caller's lists.
 */
@Value
public class CompanyProfile {

    String id;
    String name;
    String industry;
    CompanySize size;
    List<String> culture;
    List<String> benefits;
    WorkArrangement workArrangement;
    String location;
    CompanyPreferences preferences;

    @Jacksonized
    @Builder(toBuilder = true)
    public CompanyProfile(String id, String name, String industry, CompanySize size, List<String> culture,
                          List<String> benefits, WorkArrangement workArrangement, String location,
                          CompanyPreferences preferences) {
        this.id = id;
        this.name = name;
        this.industry = industry;
        this.size = size;
        this.culture = ModelLists.present(culture);
        this.benefits = ModelLists.present(benefits);
        this.workArrangement = workArrangement;
        this.location = location;
        this.preferences = preferences;
    }
}
