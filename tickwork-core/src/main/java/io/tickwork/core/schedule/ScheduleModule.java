package io.tickwork.core.schedule;

import com.google.inject.Binder;
import com.google.inject.Module;
import com.google.inject.Scopes;

public class ScheduleModule
        implements Module
{
    @Override
    public void configure(Binder binder)
    {
        binder.bind(ScheduleClaimQueue.class).in(Scopes.SINGLETON);
    }
}
