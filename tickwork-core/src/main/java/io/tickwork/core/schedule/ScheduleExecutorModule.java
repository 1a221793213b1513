package io.tickwork.core.schedule;

import com.google.inject.Binder;
import com.google.inject.Module;
import com.google.inject.Scopes;

public class ScheduleExecutorModule
        implements Module
{
    @Override
    public void configure(Binder binder)
    {
        binder.bind(ScheduleClaimConfig.class).toProvider(ScheduleClaimConfigProvider.class).in(Scopes.SINGLETON);
        binder.bind(ScheduleClaimExecutor.class).in(Scopes.SINGLETON);
    }
}
