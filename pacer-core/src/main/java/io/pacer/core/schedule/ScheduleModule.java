package io.pacer.core.schedule;

import com.google.inject.Binder;
import com.google.inject.Module;
import com.google.inject.Provides;
import com.google.inject.Scopes;
import com.google.inject.Singleton;
import com.google.inject.multibindings.Multibinder;
import io.pacer.commons.config.Config;
import io.pacer.spi.DueTimeCalculatorFactory;

public class ScheduleModule
        implements Module
{
    @Override
    public void configure(Binder binder)
    {
        binder.bind(DueTimeCalculatorManager.class).in(Scopes.SINGLETON);
        binder.bind(ScheduleCache.class).in(Scopes.SINGLETON);
        Multibinder.newSetBinder(binder, DueTimeCalculatorFactory.class);
    }

    @Provides
    @Singleton
    public ScheduleConfig provideScheduleConfig(Config systemConfig)
    {
        return ScheduleConfig.convertFrom(systemConfig);
    }
}
