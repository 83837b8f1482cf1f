package dev.talentmatch.exception;

public class ResourceNotFoundException extends RecruitingException {

    public static final String RESOURCE_NOT_FOUND = "RESOURCE_NOT_FOUND";

    public ResourceNotFoundException(String resource) {
        super(resource + " was not supplied", RESOURCE_NOT_FOUND);
    }

    public ResourceNotFoundException(String resource, String id) {
        super(resource + " with id " + id + " not found", RESOURCE_NOT_FOUND);
    }
}
