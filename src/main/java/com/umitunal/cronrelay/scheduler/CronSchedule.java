package com.umitunal.cronrelay.scheduler;

import com.cronutils.model.Cron;
import com.cronutils.model.CronType;
import com.cronutils.model.definition.CronDefinitionBuilder;
import com.cronutils.model.time.ExecutionTime;
import com.cronutils.parser.CronParser;
import com.umitunal.cronrelay.exception.ValidationException;

import java.time.ZonedDateTime;
import java.util.Optional;

/**
 * Five-field Unix cron expression (minute, hour, day of month, month, day of week).
 */
public final class CronSchedule {
    private static final CronParser PARSER =
            new CronParser(CronDefinitionBuilder.instanceDefinitionFor(CronType.UNIX));

    private final String expression;
    private final ExecutionTime executionTime;

    private CronSchedule(String expression, Cron cron) {
        this.expression = expression;
        this.executionTime = ExecutionTime.forCron(cron);
    }

    /**
     * @throws ValidationException on a missing or malformed expression
     */
    public static CronSchedule parse(String expression) {
        if (expression == null || expression.isBlank()) {
            throw new ValidationException("schedule", "Recurring jobs require a schedule (cron expression)");
        }
        try {
            Cron cron = PARSER.parse(expression.trim());
            cron.validate();
            return new CronSchedule(expression.trim(), cron);
        } catch (RuntimeException e) {
            throw new ValidationException("schedule", "Invalid cron expression: " + expression, e);
        }
    }

    public static boolean isValid(String expression) {
        try {
            parse(expression);
            return true;
        } catch (ValidationException e) {
            return false;
        }
    }

    /**
     * First matching instant strictly after {@code after}, or empty if the schedule never fires again.
     */
    public Optional<ZonedDateTime> nextFireAfter(ZonedDateTime after) {
        return executionTime.nextExecution(after);
    }

    public String getExpression() {
        return expression;
    }

    @Override
    public String toString() {
        return expression;
    }
}
