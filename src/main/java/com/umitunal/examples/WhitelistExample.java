package com.umitunal.examples;

import com.umitunal.cronrelay.validation.PhoneNumberValidator;
import com.umitunal.cronrelay.validation.ValidationContext;
import com.umitunal.cronrelay.validation.ValidationResult;
import com.umitunal.cronrelay.validation.ValidatorRegistry;

import java.util.List;
import java.util.Map;

/**
 * Whitelist example - dry-run checks before scheduling a message to a recipient.
 */
public class WhitelistExample {

    public static void main(String[] args) {
        System.out.println("=== Whitelist Example ===\n");

        ValidatorRegistry registry = new ValidatorRegistry();
        registry.register(new PhoneNumberValidator(Map.of("628123456789", List.of("0811-1111-111"))));
        System.out.println(registry.stats());

        String actor = "+62 812 3456 789@c.us";
        for (String recipient : List.of("08123456789", "628111111111", "628999000111")) {
            ValidationResult result = registry.validate(PhoneNumberValidator.DEFAULT_ACTION, recipient,
                    ValidationContext.dryRun(actor));
            System.out.println("  " + recipient + " -> " + (result.isValid() ? "allowed" : result.getError()));
        }

        ValidationResult ungated = registry.validate("calendar_create", "anything", ValidationContext.of(actor));
        System.out.println("  ungated action -> " + (ungated.isValid() ? "allowed" : ungated.getError()));
        System.out.println("\nWhitelist: " + registry.whitelist(PhoneNumberValidator.DEFAULT_ACTION, actor));
    }
}
