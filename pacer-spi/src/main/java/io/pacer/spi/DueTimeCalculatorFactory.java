package io.pacer.spi;

import java.time.ZoneId;
import io.pacer.commons.config.Config;

public interface DueTimeCalculatorFactory
{
    /**
     * Kind of schedules this factory handles, as stored in the kind column.
     */
    String getType();

    /**
     * Validates the rule fields of a definition and builds its calculator.
     *
     * @throws io.pacer.commons.config.ConfigException if the fields are malformed
     */
    DueTimeCalculator newCalculator(Config rule, ZoneId timeZone);
}
