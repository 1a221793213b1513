package io.tickwork.core.database;

import com.google.common.collect.ImmutableList;
import io.tickwork.core.repository.ResourceNotFoundException;
import io.tickwork.core.schedule.ClaimedSchedule;
import io.tickwork.core.schedule.Schedule;
import io.tickwork.core.schedule.ScheduleClaimQueue;
import io.tickwork.core.schedule.ScheduleStore;
import io.tickwork.core.schedule.StoredSchedule;
import io.tickwork.core.schedule.WorkflowScheduleStore;
import org.junit.After;
import org.junit.Before;
import org.junit.Test;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.stream.Collectors;

import static io.tickwork.core.database.DatabaseTestingUtils.createConfig;
import static io.tickwork.core.database.DatabaseTestingUtils.deleteWorkflow;
import static io.tickwork.core.database.DatabaseTestingUtils.insertWorkflow;
import static io.tickwork.core.database.DatabaseTestingUtils.setupDatabase;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.empty;
import static org.hamcrest.Matchers.hasSize;
import static org.hamcrest.Matchers.is;
import static org.hamcrest.Matchers.lessThanOrEqualTo;
import static org.junit.Assert.fail;

public class DatabaseScheduleClaimTest
{
    private static final Instant T0 = Instant.parse("2024-03-01T00:00:00Z");

    private DatabaseFactory factory;
    private TestingClock clock;
    private DatabaseScheduleStoreManager manager;
    private ScheduleStore store;
    private WorkflowScheduleStore links;
    private ScheduleClaimQueue queue;

    @Before
    public void setUp()
    {
        factory = setupDatabase();
        clock = new TestingClock(T0);
        manager = factory.getScheduleStoreManager(clock);
        store = manager.getScheduleStore();
        links = manager.getWorkflowScheduleStore();
        queue = new ScheduleClaimQueue(factory.get(), manager);
    }

    @After
    public void destroy()
    {
        factory.close();
    }

    private StoredSchedule createLinked(int updateInterval, long... workflowIds)
        throws ResourceNotFoundException
    {
        StoredSchedule sched = store.createSchedule(
                Schedule.of(UUID.randomUUID(), updateInterval, createConfig()));
        for (long wf : workflowIds) {
            Set<Long> ids = new HashSet<>(links.getScheduleIdsOfWorkflow(wf));
            ids.add(sched.getId());
            links.replaceWorkflowSchedules(wf, ids);
        }
        return sched;
    }

    private long workflow(String name)
    {
        return insertWorkflow(factory.getJdbi(), name, T0);
    }

    @Test
    public void onlyDueSchedulesAreClaimed()
        throws Exception
    {
        long wf = workflow("wf");
        StoredSchedule s60 = createLinked(60, wf);
        createLinked(120, wf);

        List<ClaimedSchedule> claimed = queue.claimDue(10, T0.plusSeconds(90));
        assertThat(scheduleIds(claimed), contains(s60.getId()));
        assertThat(claimed.get(0).getWorkflowId(), is(wf));
        // snapshot is taken before the claim advanced it
        assertThat(claimed.get(0).getSchedule().getUpdatedAt(), is(T0));
    }

    @Test
    public void nothingDueReturnsEmpty()
        throws Exception
    {
        long wf = workflow("wf");
        createLinked(60, wf);

        assertThat(queue.claimDue(10, T0.plusSeconds(59)), is(empty()));
        assertThat(queue.claimDue(10, T0), is(empty()));
    }

    @Test
    public void claimAdvancesDueTime()
        throws Exception
    {
        long wf = workflow("wf");
        StoredSchedule sched = createLinked(60, wf);

        assertThat(scheduleIds(queue.claimDue(10, T0.plusSeconds(60))), contains(sched.getId()));
        StoredSchedule after = store.getScheduleById(sched.getId());
        assertThat(after.getUpdatedAt(), is(T0.plusSeconds(60)));
        assertThat(after.getDueAt(), is(T0.plusSeconds(120)));

        assertThat(queue.claimDue(10, T0.plusSeconds(61)), is(empty()));
        assertThat(scheduleIds(queue.claimDue(10, T0.plusSeconds(120))), contains(sched.getId()));
    }

    @Test
    public void batchSizeOneTakesEarliestDue()
        throws Exception
    {
        long wf = workflow("wf");
        StoredSchedule s1 = createLinked(60, wf);
        StoredSchedule s2 = createLinked(60, wf);
        StoredSchedule early = createLinked(30, wf);

        Instant now = T0.plusSeconds(100);
        assertThat(scheduleIds(queue.claimDue(1, now)), contains(early.getId()));
        // tie on due time is broken by id
        assertThat(scheduleIds(queue.claimDue(1, now)), contains(s1.getId()));
        assertThat(scheduleIds(queue.claimDue(1, now)), contains(s2.getId()));
        assertThat(queue.claimDue(1, now), is(empty()));
    }

    @Test
    public void resultsAreOrderedByDueTimeThenId()
        throws Exception
    {
        long wf = workflow("wf");
        StoredSchedule a = createLinked(90, wf);
        StoredSchedule b = createLinked(30, wf);
        StoredSchedule c = createLinked(60, wf);
        StoredSchedule d = createLinked(30, wf);

        List<ClaimedSchedule> claimed = queue.claimDue(10, T0.plusSeconds(100));
        assertThat(scheduleIds(claimed), contains(b.getId(), d.getId(), c.getId(), a.getId()));
    }

    @Test
    public void batchIsBounded()
        throws Exception
    {
        long wf = workflow("wf");
        for (int i = 0; i < 7; i++) {
            createLinked(10, wf);
        }

        Instant now = T0.plusSeconds(10);
        assertThat(queue.claimDue(3, now), hasSize(3));
        assertThat(queue.claimDue(3, now), hasSize(3));
        assertThat(queue.claimDue(3, now), hasSize(1));
        assertThat(queue.claimDue(3, now), is(empty()));
    }

    @Test
    public void softDeletedSchedulesAndWorkflowsAreExcluded()
        throws Exception
    {
        long live = workflow("live");
        long dead = workflow("dead");
        StoredSchedule deletedSchedule = createLinked(60, live);
        StoredSchedule orphaned = createLinked(60, dead);
        StoredSchedule shared = createLinked(60, live, dead);
        createLinked(60);  // no links

        store.deleteScheduleById(deletedSchedule.getId());
        deleteWorkflow(factory.getJdbi(), dead, T0);

        List<ClaimedSchedule> claimed = queue.claimDue(10, T0.plusSeconds(3600));
        assertThat(scheduleIds(claimed), contains(shared.getId()));
        assertThat(claimed.get(0).getWorkflowId(), is(live));

        // not claimed, so still at its original due time
        assertThat(store.getScheduleById(orphaned.getId()).getUpdatedAt(), is(T0));
    }

    @Test
    public void fanOutTouchesScheduleOnce()
        throws Exception
    {
        long wf1 = workflow("wf1");
        long wf2 = workflow("wf2");
        long wf3 = workflow("wf3");
        StoredSchedule sched = createLinked(60, wf3, wf1, wf2);

        List<ClaimedSchedule> claimed = queue.claimDue(10, T0.plusSeconds(60));
        assertThat(claimed.stream().map(ClaimedSchedule::getWorkflowId).collect(Collectors.toList()),
                contains(wf1, wf2, wf3));
        for (ClaimedSchedule c : claimed) {
            assertThat(c.getScheduleId(), is(sched.getId()));
            assertThat(c.getSchedule(), is(claimed.get(0).getSchedule()));
        }
        assertThat(store.getScheduleById(sched.getId()).getUpdatedAt(), is(T0.plusSeconds(60)));
    }

    @Test
    public void schedulesAreNotSplitAcrossBatches()
        throws Exception
    {
        long wf1 = workflow("wf1");
        long wf2 = workflow("wf2");
        StoredSchedule single = createLinked(30, wf1);
        StoredSchedule pair = createLinked(60, wf1, wf2);

        Instant now = T0.plusSeconds(60);
        // the pair doesn't fit after the single one
        List<ClaimedSchedule> first = queue.claimDue(2, now);
        assertThat(scheduleIds(first), contains(single.getId()));

        List<ClaimedSchedule> second = queue.claimDue(2, now);
        assertThat(scheduleIds(second), contains(pair.getId(), pair.getId()));
    }

    @Test
    public void oversizedFirstScheduleIsTruncated()
        throws Exception
    {
        long wf1 = workflow("wf1");
        long wf2 = workflow("wf2");
        long wf3 = workflow("wf3");
        StoredSchedule sched = createLinked(60, wf1, wf2, wf3);

        List<ClaimedSchedule> claimed = queue.claimDue(2, T0.plusSeconds(60));
        assertThat(claimed, hasSize(2));
        assertThat(claimed.stream().map(ClaimedSchedule::getWorkflowId).collect(Collectors.toList()),
                contains(wf1, wf2));
        assertThat(store.getScheduleById(sched.getId()).getUpdatedAt(), is(T0.plusSeconds(60)));
    }

    @Test
    public void abortedClaimLeavesSchedulesDue()
        throws Exception
    {
        long wf = workflow("wf");
        StoredSchedule s1 = createLinked(60, wf);
        StoredSchedule s2 = createLinked(60, wf);
        Instant now = T0.plusSeconds(60);

        try {
            queue.claimDue(10, now, (claimed) -> {
                assertThat(scheduleIds(claimed), contains(s1.getId(), s2.getId()));
                throw new IllegalStateException("dispatch failed");
            });
            fail();
        }
        catch (IllegalStateException ex) {
            assertThat(ex.getMessage(), containsString("dispatch failed"));
        }

        assertThat(store.getScheduleById(s1.getId()).getUpdatedAt(), is(T0));
        assertThat(scheduleIds(queue.claimDue(10, now)), contains(s1.getId(), s2.getId()));
    }

    @Test
    public void handlerIsNotCalledForEmptyBatch()
    {
        queue.claimDue(10, T0, (claimed) -> fail());
    }

    @Test
    public void claimRequiresTransaction()
    {
        try {
            manager.claimDueSchedules(T0, 10);
            fail();
        }
        catch (IllegalStateException ex) {
            assertThat(ex.getMessage(), containsString("Not in transaction"));
        }
    }

    @Test
    public void nonPositiveBatchSizeIsRejected()
    {
        try {
            queue.claimDue(0, T0);
            fail();
        }
        catch (IllegalArgumentException ex) {
            assertThat(ex.getMessage(), containsString("maxBatchSize"));
        }
    }

    @Test
    public void concurrentClaimersNeverShareSchedules()
        throws Exception
    {
        long wf = workflow("wf");
        Set<Long> all = new HashSet<>();
        for (int i = 0; i < 20; i++) {
            all.add(createLinked(60, wf).getId());
        }
        Instant now = T0.plusSeconds(60);

        int threads = 10;
        ExecutorService executor = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);
        try {
            List<Future<List<Long>>> futures = new ArrayList<>();
            for (int i = 0; i < threads; i++) {
                Callable<List<Long>> claimer = () -> {
                    start.await();
                    List<Long> mine = new ArrayList<>();
                    for (int round = 0; round < 10; round++) {
                        List<ClaimedSchedule> claimed = claimWithRetry(5, now);
                        assertThat(claimed.size(), lessThanOrEqualTo(5));
                        mine.addAll(scheduleIds(claimed));
                    }
                    return mine;
                };
                futures.add(executor.submit(claimer));
            }
            start.countDown();

            List<Long> union = new ArrayList<>();
            for (Future<List<Long>> future : futures) {
                union.addAll(future.get(60, TimeUnit.SECONDS));
            }
            // drain what contention left over
            List<ClaimedSchedule> rest;
            while (!(rest = queue.claimDue(5, now)).isEmpty()) {
                union.addAll(scheduleIds(rest));
            }
            Collections.sort(union);
            assertThat(union, hasSize(20));
            assertThat(new HashSet<>(union), is(all));
        }
        finally {
            executor.shutdownNow();
        }
    }

    // H2 reports a lock wait over its timeout as a retryable error
    private List<ClaimedSchedule> claimWithRetry(int batchSize, Instant now)
        throws InterruptedException
    {
        while (true) {
            try {
                return queue.claimDue(batchSize, now);
            }
            catch (DatabaseAccessException ex) {
                if (!ex.isRetryable()) {
                    throw ex;
                }
                Thread.sleep(10);
            }
        }
    }

    @Test
    public void fillBatchKeepsWholeSchedules()
    {
        StoredSchedule s1 = store.createSchedule(Schedule.of(UUID.randomUUID(), 60, createConfig()));
        StoredSchedule s2 = store.createSchedule(Schedule.of(UUID.randomUUID(), 60, createConfig()));
        List<ClaimedSchedule> candidates = ImmutableList.of(
                ClaimedSchedule.of(1L, s1),
                ClaimedSchedule.of(1L, s2),
                ClaimedSchedule.of(2L, s2));

        assertThat(DatabaseScheduleStoreManager.fillBatch(candidates, 3), is(candidates));
        assertThat(DatabaseScheduleStoreManager.fillBatch(candidates, 2), contains(candidates.get(0)));
        assertThat(DatabaseScheduleStoreManager.fillBatch(candidates.subList(1, 3), 1), contains(candidates.get(1)));
        assertThat(DatabaseScheduleStoreManager.fillBatch(ImmutableList.<ClaimedSchedule>of(), 5), is(empty()));
    }

    private static List<Long> scheduleIds(List<ClaimedSchedule> claimed)
    {
        return claimed.stream().map(ClaimedSchedule::getScheduleId).collect(Collectors.toList());
    }
}
