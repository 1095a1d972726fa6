package com.taskweave.core.scheduler;

import com.taskweave.core.model.ScheduleConfig;
import com.taskweave.core.model.ScheduleKind;
import org.springframework.scheduling.support.CronExpression;

import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.util.Optional;

/**
 * Computes the fire times of a validated {@link ScheduleConfig}.
 * <p>
 * One-time schedules fire once at {@code startAt}, immediately when that lies in
 * the past. Recurring schedules fire every {@code interval} starting at
 * {@code startAt}, or one interval from now when no start is given. Cron
 * schedules fire at each instant matching the expression in the configured zone,
 * the first one being the earliest match at or after the start. No fire is
 * produced after {@code endAt}.
 */
public final class ScheduleTrigger {

    private final ScheduleConfig config;
    private final CronExpression cron;
    private final ZoneId zone;

    private ScheduleTrigger(ScheduleConfig config, CronExpression cron, ZoneId zone) {
        this.config = config;
        this.cron = cron;
        this.zone = zone;
    }

    /**
     * Validate {@code config} and build its trigger.
     *
     * @throws InvalidScheduleException if a required field is missing, a field that
     *                                  belongs to another kind is set, the interval
     *                                  is not positive, the bounds are inverted or
     *                                  the cron expression does not parse
     */
    public static ScheduleTrigger of(ScheduleConfig config, ZoneId zone) {
        if (config == null || config.kind() == null) {
            throw new InvalidScheduleException("Schedule kind is required");
        }
        if (config.startAt() != null && config.endAt() != null && config.endAt().isBefore(config.startAt())) {
            throw new InvalidScheduleException("end_at " + config.endAt() + " is before start_at " + config.startAt());
        }
        if (config.maxRetries() < 0) {
            throw new InvalidScheduleException("max_retries must not be negative: " + config.maxRetries());
        }
        if (config.retryOnFailure() && (config.retryDelay() == null || config.retryDelay().isNegative())) {
            throw new InvalidScheduleException("retry_delay must be zero or positive");
        }
        return switch (config.kind()) {
            case ONE_TIME -> {
                require(config.startAt() != null, "One-time schedule requires start_at");
                forbid(config.interval() != null, "One-time schedule must not set interval");
                forbid(config.cronExpression() != null, "One-time schedule must not set cron_expression");
                yield new ScheduleTrigger(config, null, zone);
            }
            case RECURRING -> {
                require(config.interval() != null, "Recurring schedule requires interval");
                forbid(config.cronExpression() != null, "Recurring schedule must not set cron_expression");
                if (config.interval().isZero() || config.interval().isNegative()) {
                    throw new InvalidScheduleException("interval must be positive: " + config.interval());
                }
                yield new ScheduleTrigger(config, null, zone);
            }
            case CRON -> {
                require(config.cronExpression() != null && !config.cronExpression().isBlank(),
                        "Cron schedule requires cron_expression");
                forbid(config.interval() != null, "Cron schedule must not set interval");
                yield new ScheduleTrigger(config, parseCron(config.cronExpression()), zone);
            }
        };
    }

    /**
     * Parse a crontab expression. Classic five-field expressions get a leading
     * seconds field of {@code 0}; six-field expressions and {@code @} macros are
     * passed to Spring as they are.
     */
    static CronExpression parseCron(String expression) {
        String trimmed = expression.trim();
        String normalized = trimmed;
        if (!trimmed.startsWith("@")) {
            int fields = trimmed.split("\\s+").length;
            if (fields == 5) {
                normalized = "0 " + trimmed;
            } else if (fields != 6) {
                throw new InvalidScheduleException("Cron expression must have 5 or 6 fields: " + expression);
            }
        }
        try {
            return CronExpression.parse(normalized);
        } catch (IllegalArgumentException e) {
            throw new InvalidScheduleException("Invalid cron expression '" + expression + "': " + e.getMessage(), e);
        }
    }

    public ScheduleKind kind() {
        return config.kind();
    }

    /**
     * First fire time for a job registered at {@code now}.
     */
    public Optional<Instant> firstFire(Instant now) {
        Instant candidate = switch (config.kind()) {
            case ONE_TIME -> config.startAt().isBefore(now) ? now : config.startAt();
            case RECURRING -> firstRecurring(now);
            case CRON -> cronAtOrAfter(latest(config.startAt(), now));
        };
        return bounded(candidate);
    }

    /**
     * Fire time that follows {@code previous}, or empty when the schedule is exhausted.
     */
    public Optional<Instant> nextFire(Instant previous) {
        Instant candidate = switch (config.kind()) {
            case ONE_TIME -> null;
            case RECURRING -> previous.plus(config.interval());
            case CRON -> cronAfter(previous);
        };
        return bounded(candidate);
    }

    private Instant firstRecurring(Instant now) {
        Duration interval = config.interval();
        Instant start = config.startAt();
        if (start == null) {
            return now.plus(interval);
        }
        if (!start.isBefore(now)) {
            return start;
        }
        // skip the periods that elapsed before registration
        long elapsed = Duration.between(start, now).toNanos();
        long periods = (elapsed + interval.toNanos() - 1) / interval.toNanos();
        return start.plus(interval.multipliedBy(periods));
    }

    private Instant cronAtOrAfter(Instant instant) {
        return cronAfter(instant.minusNanos(1));
    }

    private Instant cronAfter(Instant instant) {
        ZonedDateTime next = cron.next(instant.atZone(zone));
        return next == null ? null : next.toInstant();
    }

    private Optional<Instant> bounded(Instant candidate) {
        if (candidate == null) {
            return Optional.empty();
        }
        if (config.endAt() != null && candidate.isAfter(config.endAt())) {
            return Optional.empty();
        }
        return Optional.of(candidate);
    }

    private static Instant latest(Instant a, Instant b) {
        if (a == null) return b;
        return a.isAfter(b) ? a : b;
    }

    private static void require(boolean condition, String message) {
        if (!condition) {
            throw new InvalidScheduleException(message);
        }
    }

    private static void forbid(boolean condition, String message) {
        if (condition) {
            throw new InvalidScheduleException(message);
        }
    }
}
