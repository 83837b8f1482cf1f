package dev.talentmatch.model;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

@Value
@Jacksonized
@Builder
public class Certification {

    String name;
    String issuer;
}
