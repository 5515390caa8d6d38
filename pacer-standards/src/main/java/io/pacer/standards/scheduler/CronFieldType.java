package io.pacer.standards.scheduler;

import java.util.ArrayList;
import java.util.List;
import com.google.common.collect.ImmutableList;
import io.pacer.commons.config.ConfigException;

import static java.util.Locale.ENGLISH;

/**
 * The five crontab fields with their value ranges and the parser of their text form.
 */
public enum CronFieldType
{
    MINUTE("minute", 0, 59, 59, ImmutableList.of()),
    HOUR("hour", 0, 23, 23, ImmutableList.of()),
    DAY_OF_MONTH("day_of_month", 1, 31, 31, ImmutableList.of()),
    MONTH_OF_YEAR("month_of_year", 1, 12, 12, ImmutableList.of(
                "jan", "feb", "mar", "apr", "may", "jun", "jul", "aug", "sep", "oct", "nov", "dec")),
    // 0 and 7 are both Sunday
    DAY_OF_WEEK("day_of_week", 0, 6, 7, ImmutableList.of(
                "sun", "mon", "tue", "wed", "thu", "fri", "sat"));

    private final String key;
    private final int min;
    private final int max;
    private final int maxAccepted;
    private final List<String> names;

    CronFieldType(String key, int min, int max, int maxAccepted, List<String> names)
    {
        this.key = key;
        this.min = min;
        this.max = max;
        this.maxAccepted = maxAccepted;
        this.names = names;
    }

    /**
     * Name of the field in a schedule definition, such as {@code day_of_month}.
     */
    public String getKey()
    {
        return key;
    }

    public int getMin()
    {
        return min;
    }

    public int getMax()
    {
        return max;
    }

    public CronField parse(String text)
    {
        String spec = text.trim().toLowerCase(ENGLISH);
        if (spec.isEmpty()) {
            throw invalid(text, "field is empty");
        }
        if (spec.equals("*")) {
            return CronField.wildcard();
        }

        String[] parts = spec.split(",", -1);
        if (parts.length == 1) {
            return parseElement(text, parts[0]);
        }
        List<CronField> elements = new ArrayList<>();
        for (String part : parts) {
            elements.add(parseElement(text, part));
        }
        return CronField.list(elements);
    }

    private CronField parseElement(String text, String element)
    {
        if (element.isEmpty()) {
            throw invalid(text, "empty list element");
        }

        String rangePart = element;
        Integer step = null;
        int slash = element.indexOf('/');
        if (slash >= 0) {
            rangePart = element.substring(0, slash);
            step = parseNumber(text, element.substring(slash + 1));
            if (step <= 0) {
                throw invalid(text, "step must be a positive integer");
            }
        }

        int start;
        int end;
        if (rangePart.equals("*")) {
            start = min;
            end = max;
        }
        else {
            int dash = rangePart.indexOf('-');
            if (dash >= 0) {
                start = parseValue(text, rangePart.substring(0, dash));
                end = parseValue(text, rangePart.substring(dash + 1));
                if (start > end) {
                    throw invalid(text, "range " + rangePart + " is reversed");
                }
            }
            else {
                start = parseValue(text, rangePart);
                if (step == null) {
                    return CronField.single(start);
                }
                // "N/S" starts at N and runs to the end of the field
                end = Math.max(start, max);
            }
        }

        return CronField.step(start, end, step == null ? 1 : step);
    }

    private int parseValue(String text, String token)
    {
        int index = names.indexOf(token);
        int value = index >= 0 ? index + min : parseNumber(text, token);
        if (value < min || value > maxAccepted) {
            throw invalid(text, String.format(ENGLISH, "%d is out of range %d-%d", value, min, maxAccepted));
        }
        return value;
    }

    private int parseNumber(String text, String token)
    {
        if (token.isEmpty() || !token.chars().allMatch(Character::isDigit)) {
            throw invalid(text, "'" + token + "' is not a number");
        }
        try {
            return Integer.parseInt(token);
        }
        catch (NumberFormatException ex) {
            throw invalid(text, "'" + token + "' is too large");
        }
    }

    private ConfigException invalid(String text, String reason)
    {
        return new ConfigException(String.format(ENGLISH,
                    "Invalid crontab %s field '%s': %s", key, text, reason));
    }
}
