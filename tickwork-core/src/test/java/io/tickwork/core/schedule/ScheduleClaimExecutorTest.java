package io.tickwork.core.schedule;

import com.google.common.collect.ImmutableList;
import org.junit.Before;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.mockito.Mock;
import org.mockito.junit.MockitoJUnitRunner;

import java.time.Clock;
import java.time.Instant;
import java.util.List;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.is;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@RunWith(MockitoJUnitRunner.class)
public class ScheduleClaimExecutorTest
{
    private static final Instant NOW = Instant.parse("2024-03-01T12:00:00Z");

    @Mock ScheduleClaimQueue queue;
    @Mock ClaimedScheduleHandler handler;
    @Mock ClaimedSchedule item;

    private ScheduleClaimExecutor executor;

    @Before
    public void setUp()
    {
        ScheduleClaimConfig config = ScheduleClaimConfig.defaultBuilder()
            .batchSize(2)
            .build();
        executor = new ScheduleClaimExecutor(queue, handler, config, Clock.systemUTC());
    }

    @Test
    public void repeatsUntilNothingIsDue()
    {
        List<ClaimedSchedule> full = ImmutableList.of(item, item);
        when(queue.claimDue(2, NOW, handler))
            .thenReturn(full)
            .thenReturn(full)
            .thenReturn(ImmutableList.of());

        executor.runClaims(NOW);

        verify(queue, times(3)).claimDue(2, NOW, handler);
    }

    @Test
    public void shortBatchIsNotTreatedAsDrained()
    {
        // a schedule with two links doesn't fit next to one claimed item
        when(queue.claimDue(2, NOW, handler))
            .thenReturn(ImmutableList.of(item))
            .thenReturn(ImmutableList.of(item, item))
            .thenReturn(ImmutableList.of());

        assertThat(executor.claimOnce(NOW), is(true));
        executor.runClaims(NOW);

        verify(queue, times(3)).claimDue(2, NOW, handler);
    }

    @Test
    public void stopsWhenNothingIsDue()
    {
        when(queue.claimDue(2, NOW, handler)).thenReturn(ImmutableList.of());

        assertThat(executor.claimOnce(NOW), is(false));
        verify(queue, times(1)).claimDue(eq(2), eq(NOW), any(ClaimedScheduleHandler.class));
    }

    @Test
    public void failureIsLoggedAndNextPollRetries()
    {
        when(queue.claimDue(2, NOW, handler))
            .thenThrow(new IllegalStateException("database is down"))
            .thenReturn(ImmutableList.of(item))
            .thenReturn(ImmutableList.of());

        executor.runClaims(NOW);
        executor.runClaims(NOW);

        verify(queue, times(3)).claimDue(2, NOW, handler);
    }

    @Test
    public void disabledExecutorDoesNotStart()
    {
        ScheduleClaimExecutor disabled = new ScheduleClaimExecutor(queue, handler,
                ScheduleClaimConfig.defaultBuilder().enabled(false).build(),
                Clock.systemUTC());
        disabled.start();
        assertThat(disabled.isStarted(), is(false));
        disabled.shutdown();
        verify(queue, never()).claimDue(anyInt(), any(Instant.class), any(ClaimedScheduleHandler.class));
    }

    @Test
    public void startAndShutdown()
    {
        executor.start();
        assertThat(executor.isStarted(), is(true));
        executor.shutdown();
        assertThat(executor.isStarted(), is(false));
    }
}
