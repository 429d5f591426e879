package com.umitunal.cronrelay.validation;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Validators keyed by action name.
 *
 * Actions without a registered validator are allowed. Gating is opt-in: registering a
 * validator for an action is what turns the check on.
 */
public class ValidatorRegistry {
    private static final Logger logger = LoggerFactory.getLogger(ValidatorRegistry.class);

    private final Map<String, ResourceValidator> validators = new ConcurrentHashMap<>();

    /**
     * Register {@code validator} under its action, replacing any earlier one.
     */
    public void register(ResourceValidator validator) {
        ResourceValidator previous = validators.put(validator.getAction(), validator);
        if (previous != null) {
            logger.warn("Validator for action {} already registered, overwriting", validator.getAction());
        }
        logger.info("Validator registered: action={}, resourceType={}",
                validator.getAction(), validator.getResourceType());
    }

    public Optional<ResourceValidator> validator(String action) {
        return Optional.ofNullable(validators.get(action));
    }

    public boolean hasValidator(String action) {
        return validators.containsKey(action);
    }

    public ValidationResult validate(String action, String resource, ValidationContext context) {
        ResourceValidator validator = validators.get(action);
        if (validator == null) {
            logger.debug("No validator for action {}, allowing by default", action);
            return ValidationResult.allowed();
        }
        return validator.validate(resource, context);
    }

    /**
     * The actor's whitelist for {@code action}; empty when the action has no validator.
     */
    public List<String> whitelist(String action, String actorId) {
        ResourceValidator validator = validators.get(action);
        return validator == null ? Collections.emptyList() : validator.whitelist(actorId);
    }

    public List<ResourceValidator> validators() {
        return new ArrayList<>(validators.values());
    }

    public Stats stats() {
        Map<String, String> resourceTypes = new TreeMap<>();
        validators.forEach((action, validator) -> resourceTypes.put(action, validator.getResourceType()));
        return new Stats(resourceTypes);
    }

    /**
     * Registered actions and the resource type each one checks.
     */
    public static final class Stats {
        private final Map<String, String> resourceTypes;

        private Stats(Map<String, String> resourceTypes) {
            this.resourceTypes = Collections.unmodifiableMap(resourceTypes);
        }

        public int getTotalValidators() {
            return resourceTypes.size();
        }

        public Map<String, String> getResourceTypes() {
            return resourceTypes;
        }

        @Override
        public String toString() {
            return "ValidatorStats{total=" + resourceTypes.size() + ", validators=" + resourceTypes + "}";
        }
    }
}
