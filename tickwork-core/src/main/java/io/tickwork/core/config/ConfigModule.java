package io.tickwork.core.config;

import com.google.inject.Binder;
import com.google.inject.Module;
import com.google.inject.Scopes;
import io.tickwork.client.config.ConfigFactory;

public class ConfigModule
        implements Module
{
    @Override
    public void configure(Binder binder)
    {
        binder.bind(ConfigFactory.class).in(Scopes.SINGLETON);
    }
}
