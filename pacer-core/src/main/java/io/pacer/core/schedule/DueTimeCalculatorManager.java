package io.pacer.core.schedule;

import java.util.Map;
import java.util.Set;
import com.google.common.base.Optional;
import com.google.common.collect.ImmutableMap;
import com.google.inject.Inject;
import io.pacer.commons.config.Config;
import io.pacer.commons.config.ConfigException;
import io.pacer.commons.config.ConfigFactory;
import io.pacer.spi.DueTimeCalculator;
import io.pacer.spi.DueTimeCalculatorFactory;

/**
 * Builds the calculator of a stored schedule using the factory registered for its kind.
 */
public class DueTimeCalculatorManager
{
    private final Map<String, DueTimeCalculatorFactory> factories;
    private final ConfigFactory cf;
    private final ScheduleConfig config;

    @Inject
    public DueTimeCalculatorManager(Set<DueTimeCalculatorFactory> factories, ConfigFactory cf, ScheduleConfig config)
    {
        ImmutableMap.Builder<String, DueTimeCalculatorFactory> builder = ImmutableMap.builder();
        for (DueTimeCalculatorFactory factory : factories) {
            builder.put(factory.getType(), factory);
        }
        this.factories = builder.build();
        this.cf = cf;
        this.config = config;
    }

    /**
     * @throws ConfigException if the kind is unknown or the rule fields are malformed
     */
    public DueTimeCalculator getCalculator(StoredSchedule schedule)
    {
        ScheduleKind kind = ScheduleKind.fromType(schedule.getKind());
        DueTimeCalculatorFactory factory = factories.get(kind.getType());
        if (factory == null) {
            throw new ConfigException("No due-time calculator is registered for schedule kind: " + kind.getType());
        }
        return factory.newCalculator(toRule(schedule), config.getTimeZone());
    }

    Config toRule(StoredSchedule schedule)
    {
        Config rule = cf.create();
        switch (ScheduleKind.fromType(schedule.getKind())) {
        case INTERVAL:
            if (hasCrontabField(schedule)) {
                throw new ConfigException("Interval schedule must not have crontab fields");
            }
            rule.setOptional("interval_seconds", schedule.getIntervalSeconds());
            break;
        case CRONTAB:
            if (schedule.getIntervalSeconds().isPresent()) {
                throw new ConfigException("Crontab schedule must not have interval_seconds");
            }
            rule.setOptional("minute", schedule.getCronMinute());
            rule.setOptional("hour", schedule.getCronHour());
            rule.setOptional("day_of_month", schedule.getCronDayOfMonth());
            rule.setOptional("month_of_year", schedule.getCronMonthOfYear());
            rule.setOptional("day_of_week", schedule.getCronDayOfWeek());
            break;
        default:
            throw new AssertionError("Unknown schedule kind: " + schedule.getKind());
        }
        return rule;
    }

    /**
     * Text form of the rule for logs and listings.
     */
    public String describeRule(StoredSchedule schedule)
    {
        if (ScheduleKind.fromType(schedule.getKind()) == ScheduleKind.INTERVAL) {
            return "every " + schedule.getIntervalSeconds().or(0L) + "s";
        }
        return String.join(" ",
                schedule.getCronMinute().or("?"),
                schedule.getCronHour().or("?"),
                schedule.getCronDayOfMonth().or("?"),
                schedule.getCronMonthOfYear().or("?"),
                schedule.getCronDayOfWeek().or("?"));
    }

    private static boolean hasCrontabField(StoredSchedule schedule)
    {
        for (Optional<String> field : new Optional[] {
                    schedule.getCronMinute(), schedule.getCronHour(), schedule.getCronDayOfMonth(),
                    schedule.getCronMonthOfYear(), schedule.getCronDayOfWeek() }) {
            if (field.isPresent()) {
                return true;
            }
        }
        return false;
    }
}
