package com.umitunal.cronrelay.validation;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Normalizes the resource and checks it against the actor's whitelist. Subclasses
 * supply the whitelist and the normalization rule.
 */
public abstract class AbstractWhitelistValidator implements ResourceValidator {
    protected final Logger logger = LoggerFactory.getLogger(getClass());

    @Override
    public boolean isAllowed(String resource, String actorId) {
        return whitelist(actorId).contains(normalize(resource));
    }

    @Override
    public ValidationResult validate(String resource, ValidationContext context) {
        if (resource == null || resource.isBlank()) {
            return ValidationResult.rejected(getResourceType() + " is required", details(resource, context));
        }
        try {
            String normalized = normalize(resource);
            logger.debug("Validating {} {} for actor {} (action={}, dryRun={})",
                    getResourceType(), normalized, context.getActorId(), getAction(), context.isDryRun());

            if (!isAllowed(normalized, context.getActorId())) {
                logger.warn("Validation failed: {} {} is not whitelisted for actor {} (action={})",
                        getResourceType(), normalized, context.getActorId(), getAction());
                return ValidationResult.rejected(
                        String.format("%s \"%s\" is not in whitelist for user %s",
                                getResourceType(), normalized, context.getActorId()),
                        details(normalized, context));
            }

            if (context.isDryRun()) {
                logger.info("Dry-run validation passed: {} {} for actor {}",
                        getResourceType(), normalized, context.getActorId());
            }
            return ValidationResult.allowed();
        } catch (RuntimeException e) {
            logger.error("Validation error for {} {} (action={})", getResourceType(), resource, getAction(), e);
            Map<String, Object> details = details(resource, context);
            details.put("cause", e.getClass().getName());
            return ValidationResult.rejected(e.getMessage() == null ? "Validation failed" : e.getMessage(), details);
        }
    }

    private Map<String, Object> details(String resource, ValidationContext context) {
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("resource", resource);
        details.put("actorId", context.getActorId());
        details.put("resourceType", getResourceType());
        return details;
    }
}
