package io.pacer.core.schedule;

import io.pacer.commons.config.ConfigException;

public enum ScheduleKind
{
    INTERVAL("interval"),
    CRONTAB("crontab");

    private final String type;

    ScheduleKind(String type)
    {
        this.type = type;
    }

    /**
     * Value of the kind column and the type of the matching DueTimeCalculatorFactory.
     */
    public String getType()
    {
        return type;
    }

    public static ScheduleKind fromType(String type)
    {
        for (ScheduleKind kind : values()) {
            if (kind.type.equals(type)) {
                return kind;
            }
        }
        throw new ConfigException("Unknown schedule kind: " + type);
    }
}
