package io.pacer.core.schedule;

import com.google.inject.Binder;
import com.google.inject.Module;
import com.google.inject.Scopes;

public class ScheduleExecutorModule
        implements Module
{
    @Override
    public void configure(Binder binder)
    {
        binder.bind(RunRecorder.class).in(Scopes.SINGLETON);
        binder.bind(ScheduleDispatcher.class).in(Scopes.SINGLETON);
        binder.bind(ScheduleExecutor.class).in(Scopes.SINGLETON);
    }
}
