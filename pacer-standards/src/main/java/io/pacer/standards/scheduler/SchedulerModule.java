package io.pacer.standards.scheduler;

import com.google.inject.Binder;
import com.google.inject.Module;
import com.google.inject.Scopes;
import com.google.inject.multibindings.Multibinder;
import io.pacer.spi.DueTimeCalculatorFactory;

public class SchedulerModule
    implements Module
{
    @Override
    public void configure(Binder binder)
    {
        addStandardCalculatorFactory(binder, IntervalCalculatorFactory.class);
        addStandardCalculatorFactory(binder, CrontabCalculatorFactory.class);
    }

    protected void addStandardCalculatorFactory(Binder binder, Class<? extends DueTimeCalculatorFactory> factory)
    {
        Multibinder.newSetBinder(binder, DueTimeCalculatorFactory.class)
            .addBinding().to(factory).in(Scopes.SINGLETON);
    }
}
