package io.tickwork.core.database;

import com.google.common.base.Optional;
import org.immutables.value.Value;

@Value.Immutable
public interface RemoteDatabaseConfig
{
    String getUser();

    String getPassword();

    String getHost();

    Optional<Integer> getPort();

    String getDatabase();

    int getLoginTimeout();  // seconds

    int getSocketTimeout();  // seconds

    boolean getSsl();

    String getSslfactory();

    Optional<String> getSslmode();

    static ImmutableRemoteDatabaseConfig.Builder builder()
    {
        return ImmutableRemoteDatabaseConfig.builder();
    }
}
