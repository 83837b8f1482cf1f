package dev.talentmatch.model;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

@Value
@Jacksonized
@Builder
public class Education {

    String institution;
    String degree;
    String fieldOfStudy;
}
