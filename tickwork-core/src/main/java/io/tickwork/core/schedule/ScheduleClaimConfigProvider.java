package io.tickwork.core.schedule;

import com.google.inject.Inject;
import com.google.inject.Provider;
import io.tickwork.client.config.Config;

public class ScheduleClaimConfigProvider
    implements Provider<ScheduleClaimConfig>
{
    private final ScheduleClaimConfig config;

    @Inject
    public ScheduleClaimConfigProvider(Config systemConfig)
    {
        this.config = ScheduleClaimConfig.convertFrom(systemConfig);
    }

    @Override
    public ScheduleClaimConfig get()
    {
        return config;
    }
}
