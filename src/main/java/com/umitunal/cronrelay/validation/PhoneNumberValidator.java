package com.umitunal.cronrelay.validation;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Whitelist of phone numbers a user may send messages to.
 *
 * Numbers are compared in normalized form: any {@code @...} messaging suffix, spaces,
 * dashes and parentheses are removed, a leading {@code +} is dropped, and a leading
 * {@code 0} is replaced by the country prefix. Every actor may message their own number;
 * further numbers come from the configured allow-lists, keyed by normalized actor number.
 */
public class PhoneNumberValidator extends AbstractWhitelistValidator {
    public static final String DEFAULT_ACTION = "message_send";
    public static final String RESOURCE_TYPE = "phone_number";
    public static final String DEFAULT_COUNTRY_PREFIX = "62";

    private final String action;
    private final String countryPrefix;
    private final Map<String, List<String>> allowLists;

    public PhoneNumberValidator() {
        this(DEFAULT_ACTION, DEFAULT_COUNTRY_PREFIX, Collections.emptyMap());
    }

    public PhoneNumberValidator(Map<String, List<String>> allowLists) {
        this(DEFAULT_ACTION, DEFAULT_COUNTRY_PREFIX, allowLists);
    }

    public PhoneNumberValidator(String action, String countryPrefix, Map<String, List<String>> allowLists) {
        this.action = Objects.requireNonNull(action, "action");
        this.countryPrefix = Objects.requireNonNull(countryPrefix, "countryPrefix");
        Map<String, List<String>> normalized = new HashMap<>();
        allowLists.forEach((actor, numbers) -> {
            List<String> list = new ArrayList<>();
            for (String number : numbers) {
                list.add(normalize(number));
            }
            normalized.merge(normalize(actor), list, (a, b) -> {
                List<String> merged = new ArrayList<>(a);
                merged.addAll(b);
                return merged;
            });
        });
        this.allowLists = normalized;
    }

    @Override
    public String getAction() {
        return action;
    }

    @Override
    public String getResourceType() {
        return RESOURCE_TYPE;
    }

    @Override
    public List<String> whitelist(String actorId) {
        String self = normalize(actorId);
        Set<String> whitelist = new LinkedHashSet<>();
        whitelist.add(self);
        whitelist.addAll(allowLists.getOrDefault(self, Collections.emptyList()));
        logger.debug("Whitelist for actor {} has {} entries", self, whitelist.size());
        return new ArrayList<>(whitelist);
    }

    @Override
    public String normalize(String phoneNumber) {
        String normalized = phoneNumber;
        int at = normalized.indexOf('@');
        if (at >= 0) {
            normalized = normalized.substring(0, at);
        }
        normalized = normalized.replaceAll("[\\s\\-()]", "");
        if (normalized.startsWith("+")) {
            normalized = normalized.substring(1);
        }
        if (normalized.startsWith("0")) {
            normalized = countryPrefix + normalized.substring(1);
        }
        return normalized;
    }
}
