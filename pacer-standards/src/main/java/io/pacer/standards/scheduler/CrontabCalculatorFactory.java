package io.pacer.standards.scheduler;

import java.time.Instant;
import java.time.ZoneId;
import com.google.common.base.Optional;
import io.pacer.commons.config.Config;
import io.pacer.spi.DueTimeCalculator;
import io.pacer.spi.DueTimeCalculatorFactory;

public class CrontabCalculatorFactory
        implements DueTimeCalculatorFactory
{
    @Override
    public String getType()
    {
        return "crontab";
    }

    @Override
    public DueTimeCalculator newCalculator(Config rule, ZoneId timeZone)
    {
        CrontabExpression expression = CrontabExpression.parse(
                rule.get(CronFieldType.MINUTE.getKey(), String.class),
                rule.get(CronFieldType.HOUR.getKey(), String.class),
                rule.get(CronFieldType.DAY_OF_MONTH.getKey(), String.class),
                rule.get(CronFieldType.MONTH_OF_YEAR.getKey(), String.class),
                rule.get(CronFieldType.DAY_OF_WEEK.getKey(), String.class));
        return new CrontabCalculator(expression, timeZone);
    }

    static class CrontabCalculator
            implements DueTimeCalculator
    {
        private final CrontabExpression expression;
        private final ZoneId timeZone;

        CrontabCalculator(CrontabExpression expression, ZoneId timeZone)
        {
            this.expression = expression;
            this.timeZone = timeZone;
        }

        CrontabExpression getExpression()
        {
            return expression;
        }

        // Searches from the last run so that an occurrence missed while the scheduler
        // was down fires once. Older misses collapse into that single occurrence.
        @Override
        public Instant nextDueTime(Optional<Instant> lastRunAt, Instant referenceTime)
        {
            return expression.nextAfter(lastRunAt.or(referenceTime), timeZone);
        }

        @Override
        public String toString()
        {
            return "crontab(" + expression + ", " + timeZone + ")";
        }
    }
}
