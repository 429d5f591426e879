package com.umitunal.cronrelay.validation;

import java.util.List;

/**
 * Gate for one side-effecting action on a sensitive resource, backed by a per-actor allow-list.
 */
public interface ResourceValidator {

    /**
     * Action this validator is registered under, e.g. {@code message_send}.
     */
    String getAction();

    /**
     * Kind of resource being checked, e.g. {@code phone_number}.
     */
    String getResourceType();

    /**
     * Normalized resources {@code actorId} may act on.
     */
    List<String> whitelist(String actorId);

    boolean isAllowed(String resource, String actorId);

    ValidationResult validate(String resource, ValidationContext context);

    /**
     * Canonical form of a resource identifier. Identity unless overridden.
     */
    default String normalize(String resource) {
        return resource;
    }
}
