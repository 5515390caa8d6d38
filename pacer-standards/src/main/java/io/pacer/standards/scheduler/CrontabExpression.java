package io.pacer.standards.scheduler;

import java.time.DayOfWeek;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.time.Month;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.time.temporal.ChronoUnit;
import java.util.Objects;
import io.pacer.commons.config.ConfigException;

import static java.util.Locale.ENGLISH;

/**
 * Five parsed crontab fields: minute, hour, day of month, month and day of week.
 *
 * Day matching follows the Vixie cron rule. When both day of month and day of week
 * are restricted, a day matches if EITHER of them matches ({@code 0 0 1 * mon} fires
 * on the 1st and on every Monday). When only one of them is restricted, only that one
 * is checked.
 */
public class CrontabExpression
{
    // long enough to reach Feb 29 from any date, including across 2100
    private static final int MAX_SEARCH_YEARS = 8;

    private final CronField minute;
    private final CronField hour;
    private final CronField dayOfMonth;
    private final CronField monthOfYear;
    private final CronField dayOfWeek;

    public CrontabExpression(CronField minute, CronField hour, CronField dayOfMonth,
            CronField monthOfYear, CronField dayOfWeek)
    {
        this.minute = minute;
        this.hour = hour;
        this.dayOfMonth = dayOfMonth;
        this.monthOfYear = monthOfYear;
        this.dayOfWeek = dayOfWeek;
        validateReachable();
    }

    public static CrontabExpression parse(String minute, String hour, String dayOfMonth,
            String monthOfYear, String dayOfWeek)
    {
        return new CrontabExpression(
                CronFieldType.MINUTE.parse(minute),
                CronFieldType.HOUR.parse(hour),
                CronFieldType.DAY_OF_MONTH.parse(dayOfMonth),
                CronFieldType.MONTH_OF_YEAR.parse(monthOfYear),
                CronFieldType.DAY_OF_WEEK.parse(dayOfWeek));
    }

    public static CrontabExpression parse(String fiveFields)
    {
        String[] fields = fiveFields.trim().split("\\s+");
        if (fields.length != 5) {
            throw new ConfigException("Crontab expression must have 5 fields but got " + fields.length + ": '" + fiveFields + "'");
        }
        return parse(fields[0], fields[1], fields[2], fields[3], fields[4]);
    }

    public CronField getMinute()
    {
        return minute;
    }

    public CronField getHour()
    {
        return hour;
    }

    public CronField getDayOfMonth()
    {
        return dayOfMonth;
    }

    public CronField getMonthOfYear()
    {
        return monthOfYear;
    }

    public CronField getDayOfWeek()
    {
        return dayOfWeek;
    }

    public boolean matches(LocalDateTime time)
    {
        return matchesDate(time.toLocalDate())
            && hour.matches(time.getHour())
            && minute.matches(time.getMinute());
    }

    boolean matchesDate(LocalDate date)
    {
        if (!monthOfYear.matches(date.getMonthValue())) {
            return false;
        }
        boolean domMatches = dayOfMonth.matches(date.getDayOfMonth());
        boolean dowMatches = matchesDayOfWeek(date.getDayOfWeek());
        if (dayOfMonth.isRestricted() && dayOfWeek.isRestricted()) {
            return domMatches || dowMatches;
        }
        return domMatches && dowMatches;
    }

    private boolean matchesDayOfWeek(DayOfWeek dow)
    {
        int value = dow.getValue() % 7;  // java.time: Monday=1 .. Sunday=7; crontab: Sunday=0
        return dayOfWeek.matches(value) || (value == 0 && dayOfWeek.matches(7));
    }

    /**
     * Returns the first matching minute strictly after {@code referenceTime}, with the
     * fields evaluated as wall-clock time of {@code timeZone}. A wall-clock time skipped
     * by a daylight saving gap fires at the shifted time; a repeated one fires once, at
     * its earlier offset.
     */
    public Instant nextAfter(Instant referenceTime, ZoneId timeZone)
    {
        LocalDateTime start = LocalDateTime.ofInstant(referenceTime, timeZone)
            .truncatedTo(ChronoUnit.MINUTES)
            .plusMinutes(1);
        LocalDate lastDate = start.toLocalDate().plusYears(MAX_SEARCH_YEARS);

        for (LocalDate date = start.toLocalDate(); !date.isAfter(lastDate); date = date.plusDays(1)) {
            if (!matchesDate(date)) {
                continue;
            }
            LocalTime from = date.equals(start.toLocalDate()) ? start.toLocalTime() : LocalTime.MIDNIGHT;
            for (int h = from.getHour(); h < 24; h++) {
                if (!hour.matches(h)) {
                    continue;
                }
                int firstMinute = (h == from.getHour()) ? from.getMinute() : 0;
                for (int m = firstMinute; m < 60; m++) {
                    if (!minute.matches(m)) {
                        continue;
                    }
                    Instant candidate = ZonedDateTime.ofLocal(date.atTime(h, m), timeZone, null).toInstant();
                    if (candidate.isAfter(referenceTime)) {
                        return candidate;
                    }
                }
            }
        }
        throw new ConfigException(String.format(ENGLISH,
                    "Crontab expression '%s' has no match within %d years after %s", this, MAX_SEARCH_YEARS, referenceTime));
    }

    private void validateReachable()
    {
        checkNonEmpty(CronFieldType.MINUTE, minute);
        checkNonEmpty(CronFieldType.HOUR, hour);
        checkNonEmpty(CronFieldType.MONTH_OF_YEAR, monthOfYear);

        // with the OR rule any matching weekday is enough
        if (dayOfWeek.isRestricted() && !dayOfMonth.isRestricted()) {
            checkNonEmpty(CronFieldType.DAY_OF_WEEK, dayOfWeek);
            return;
        }
        if (dayOfWeek.isRestricted() && hasAnyValue(CronFieldType.DAY_OF_WEEK, dayOfWeek)) {
            return;
        }
        for (Month month : Month.values()) {
            if (!monthOfYear.matches(month.getValue())) {
                continue;
            }
            for (int day = 1; day <= month.maxLength(); day++) {
                if (dayOfMonth.matches(day)) {
                    return;
                }
            }
        }
        throw new ConfigException("Crontab expression '" + this + "' never matches any date");
    }

    private static void checkNonEmpty(CronFieldType type, CronField field)
    {
        if (!hasAnyValue(type, field)) {
            throw new ConfigException("Crontab " + type.getKey() + " field '" + field + "' matches no value");
        }
    }

    private static boolean hasAnyValue(CronFieldType type, CronField field)
    {
        int upper = type == CronFieldType.DAY_OF_WEEK ? 7 : type.getMax();
        for (int v = type.getMin(); v <= upper; v++) {
            if (field.matches(v)) {
                return true;
            }
        }
        return false;
    }

    @Override
    public boolean equals(Object o)
    {
        if (!(o instanceof CrontabExpression)) {
            return false;
        }
        CrontabExpression other = (CrontabExpression) o;
        return minute.equals(other.minute)
            && hour.equals(other.hour)
            && dayOfMonth.equals(other.dayOfMonth)
            && monthOfYear.equals(other.monthOfYear)
            && dayOfWeek.equals(other.dayOfWeek);
    }

    @Override
    public int hashCode()
    {
        return Objects.hash(minute, hour, dayOfMonth, monthOfYear, dayOfWeek);
    }

    @Override
    public String toString()
    {
        return minute + " " + hour + " " + dayOfMonth + " " + monthOfYear + " " + dayOfWeek;
    }
}
