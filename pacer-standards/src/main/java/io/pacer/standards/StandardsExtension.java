package io.pacer.standards;

import java.util.List;
import com.google.common.collect.ImmutableList;
import com.google.inject.Module;
import io.pacer.spi.Extension;
import io.pacer.standards.scheduler.SchedulerModule;

public class StandardsExtension
        implements Extension
{
    @Override
    public List<Module> getModules()
    {
        return ImmutableList.of(
                new SchedulerModule()
                );
    }
}
