package io.tickwork.core.database;

import com.google.common.base.Optional;
import com.google.common.collect.ImmutableList;
import com.google.inject.Inject;
import io.tickwork.client.config.Config;
import io.tickwork.core.repository.ResourceNotFoundException;
import io.tickwork.core.schedule.ClaimedSchedule;
import io.tickwork.core.schedule.ImmutableStoredSchedule;
import io.tickwork.core.schedule.Schedule;
import io.tickwork.core.schedule.ScheduleStore;
import io.tickwork.core.schedule.ScheduleStoreManager;
import io.tickwork.core.schedule.ScheduleUpdate;
import io.tickwork.core.schedule.StoredSchedule;
import io.tickwork.core.schedule.WorkflowScheduleStore;
import org.jdbi.v3.core.mapper.RowMapper;
import org.jdbi.v3.core.statement.StatementContext;
import org.jdbi.v3.sqlobject.customizer.Bind;
import org.jdbi.v3.sqlobject.customizer.BindList;
import org.jdbi.v3.sqlobject.statement.GetGeneratedKeys;
import org.jdbi.v3.sqlobject.statement.SqlBatch;
import org.jdbi.v3.sqlobject.statement.SqlQuery;
import org.jdbi.v3.sqlobject.statement.SqlUpdate;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.stream.Collectors;

import static com.google.common.base.Preconditions.checkArgument;

public class DatabaseScheduleStoreManager
        extends BasicDatabaseStoreManager<DatabaseScheduleStoreManager.Dao>
        implements ScheduleStoreManager
{
    private final Clock clock;

    @Inject
    public DatabaseScheduleStoreManager(TransactionManager transactionManager, ConfigMapper cfm, DatabaseConfig config, Clock clock)
    {
        super(config.getType(), dao(config.getType()), transactionManager, cfm);
        this.clock = clock;
    }

    private static Class<? extends Dao> dao(String type)
    {
        switch (type) {
        case "postgresql":
            return PgDao.class;
        case "h2":
            return H2Dao.class;
        default:
            throw new IllegalArgumentException("Unknown database type: " + type);
        }
    }

    @Override
    public ScheduleStore getScheduleStore()
    {
        return new DatabaseScheduleStore();
    }

    @Override
    public WorkflowScheduleStore getWorkflowScheduleStore()
    {
        return new DatabaseWorkflowScheduleStore();
    }

    @Override
    public List<ClaimedSchedule> claimDueSchedules(Instant now, int maxBatchSize)
    {
        checkArgument(maxBatchSize > 0, "maxBatchSize must be positive: %s", maxBatchSize);

        return transaction((handle, dao) -> {
            List<Long> lockedIds;
            if (dao instanceof PgDao) {
                // rows locked by other claimers are skipped, not waited for
                lockedIds = ((PgDao) dao).lockDueScheduleIdsSkipLocked(now, maxBatchSize);
            }
            else {
                lockedIds = ((H2Dao) dao).lockDueScheduleIds(now, maxBatchSize);
            }
            if (lockedIds.isEmpty()) {
                return ImmutableList.of();
            }

            // Re-read after locking. A claimer that waited for a lock sees
            // the updated_at committed by the previous holder here.
            List<ClaimedSchedule> candidates;
            if (dao instanceof PgDao) {
                candidates = ((PgDao) dao).getDueClaimsOf(lockedIds, now);
            }
            else {
                candidates = ((H2Dao) dao).getDueClaimsOf(lockedIds, now);
            }

            List<ClaimedSchedule> batch = fillBatch(candidates, maxBatchSize);
            if (batch.isEmpty()) {
                return ImmutableList.of();
            }

            List<Long> claimedIds = batch.stream()
                .map(ClaimedSchedule::getScheduleId)
                .distinct()
                .collect(Collectors.toList());
            int touched = dao.touchSchedules(claimedIds, now);
            if (touched != claimedIds.size()) {
                // rows are locked by this transaction. This doesn't happen unless
                // something bypasses the locks
                throw new IllegalStateException(String.format(
                            "Claimed %d schedules but advanced %d: %s", claimedIds.size(), touched, claimedIds));
            }

            logger.debug("Claimed {} schedules ({} items) at {}", claimedIds.size(), batch.size(), now);
            return ImmutableList.copyOf(batch);
        });
    }

    /**
     * Takes whole schedules in order while they fit. The first schedule is
     * truncated if it alone has more links than the limit.
     */
    static List<ClaimedSchedule> fillBatch(List<ClaimedSchedule> candidates, int maxBatchSize)
    {
        Map<Long, List<ClaimedSchedule>> bySchedule = new LinkedHashMap<>();
        for (ClaimedSchedule c : candidates) {
            bySchedule.computeIfAbsent(c.getScheduleId(), (key) -> new ArrayList<>()).add(c);
        }

        List<ClaimedSchedule> batch = new ArrayList<>();
        for (List<ClaimedSchedule> items : bySchedule.values()) {
            if (batch.isEmpty() && items.size() > maxBatchSize) {
                batch.addAll(items.subList(0, maxBatchSize));
                break;
            }
            if (batch.size() + items.size() > maxBatchSize) {
                break;
            }
            batch.addAll(items);
        }
        return batch;
    }

    private class DatabaseScheduleStore
            implements ScheduleStore
    {
        @Override
        public StoredSchedule createSchedule(Schedule schedule)
        {
            Instant now = clock.instant();
            return inTransaction((handle, dao) -> {
                long id = dao.insertSchedule(schedule.getOwnerId(), schedule.getUpdateInterval(), schedule.getMetadata(), now);
                return dao.getScheduleById(id);
            }, RuntimeException.class);
        }

        @Override
        public StoredSchedule getScheduleById(long schedId)
            throws ResourceNotFoundException
        {
            return requiredResource(
                    (handle, dao) -> dao.getScheduleById(schedId),
                    "schedule id=%d", schedId);
        }

        @Override
        public List<StoredSchedule> getSchedulesByOwnerId(UUID ownerId, int pageSize, Optional<Long> lastId)
        {
            return autoCommit((handle, dao) -> dao.getSchedulesByOwnerId(ownerId, pageSize, lastId.or(0L)));
        }

        @Override
        public StoredSchedule updateScheduleById(long schedId, ScheduleUpdate update)
            throws ResourceNotFoundException
        {
            if (update.isEmpty()) {
                return getScheduleById(schedId);
            }
            return inTransaction((handle, dao) -> {
                int n = dao.updateSchedule(schedId,
                        update.getUpdateInterval().orNull(),
                        update.getMetadata().orNull());
                if (n <= 0) {
                    throw new ResourceNotFoundException("schedule id=" + schedId);
                }
                return requiredResource(dao.getScheduleById(schedId), "schedule id=%d", schedId);
            }, ResourceNotFoundException.class);
        }

        @Override
        public void deleteScheduleById(long schedId)
        {
            Instant now = clock.instant();
            int n = autoCommit((handle, dao) -> dao.deleteSchedule(schedId, now));
            if (n > 0) {
                logger.debug("Deleted schedule id={}", schedId);
            }
        }

        @Override
        public int deleteSchedulesByOwnerId(UUID ownerId)
        {
            Instant now = clock.instant();
            return autoCommit((handle, dao) -> dao.deleteSchedulesByOwnerId(ownerId, now));
        }
    }

    private class DatabaseWorkflowScheduleStore
            implements WorkflowScheduleStore
    {
        @Override
        public void replaceWorkflowSchedules(long workflowId, Set<Long> scheduleIds)
            throws ResourceNotFoundException
        {
            Instant now = clock.instant();
            List<Long> ids = scheduleIds.stream().sorted().collect(Collectors.toList());
            inTransaction((handle, dao) -> {
                if (dao.lockActiveWorkflowById(workflowId) == null) {
                    throw new ResourceNotFoundException("workflow id=" + workflowId);
                }
                if (!ids.isEmpty()) {
                    List<Long> found = dao.getActiveScheduleIds(ids);
                    if (found.size() != ids.size()) {
                        List<Long> missing = new ArrayList<>(ids);
                        missing.removeAll(found);
                        throw new ResourceNotFoundException("schedule ids=" + missing);
                    }
                }
                dao.deleteWorkflowSchedules(workflowId);
                if (!ids.isEmpty()) {
                    catchForeignKeyNotFound(
                            () -> dao.insertWorkflowSchedules(workflowId, ids, now),
                            "workflow id=%d or schedule ids=%s", workflowId, ids);
                }
                return true;
            }, ResourceNotFoundException.class);
        }

        @Override
        public List<Long> getScheduleIdsOfWorkflow(long workflowId)
        {
            return autoCommit((handle, dao) -> dao.getScheduleIdsOfWorkflow(workflowId));
        }
    }

    public interface H2Dao
            extends Dao
    {
        // plain FOR UPDATE. H2 waits for the holder up to its lock timeout.
        @SqlQuery("select s.id from schedules s" +
                " where s.deleted_at is null" +
                " and :now >= dateadd(second, s.update_interval, s.updated_at)" +
                " and exists (" +
                    "select 1 from workflow_schedules ws" +
                    " join workflows w on w.id = ws.workflow_id" +
                    " where ws.schedule_id = s.id" +
                    " and w.deleted_at is null" +
                ")" +
                " order by dateadd(second, s.update_interval, s.updated_at) asc, s.id asc" +
                " limit :limit" +
                " for update")
        List<Long> lockDueScheduleIds(@Bind("now") Instant now, @Bind("limit") int limit);

        @SqlQuery("select s.*, ws.workflow_id from schedules s" +
                " join workflow_schedules ws on ws.schedule_id = s.id" +
                " join workflows w on w.id = ws.workflow_id" +
                " where s.id in (<ids>)" +
                " and s.deleted_at is null" +
                " and w.deleted_at is null" +
                " and :now >= dateadd(second, s.update_interval, s.updated_at)" +
                " order by dateadd(second, s.update_interval, s.updated_at) asc, s.id asc, ws.workflow_id asc")
        List<ClaimedSchedule> getDueClaimsOf(@BindList("ids") List<Long> ids, @Bind("now") Instant now);
    }

    public interface PgDao
            extends Dao
    {
        @SqlQuery("select s.id from schedules s" +
                " where s.deleted_at is null" +
                " and :now >= s.updated_at + s.update_interval * interval '1 second'" +
                " and exists (" +
                    "select 1 from workflow_schedules ws" +
                    " join workflows w on w.id = ws.workflow_id" +
                    " where ws.schedule_id = s.id" +
                    " and w.deleted_at is null" +
                ")" +
                " order by s.updated_at + s.update_interval * interval '1 second' asc, s.id asc" +
                " limit :limit" +
                " for update skip locked")
        List<Long> lockDueScheduleIdsSkipLocked(@Bind("now") Instant now, @Bind("limit") int limit);

        @SqlQuery("select s.*, ws.workflow_id from schedules s" +
                " join workflow_schedules ws on ws.schedule_id = s.id" +
                " join workflows w on w.id = ws.workflow_id" +
                " where s.id in (<ids>)" +
                " and s.deleted_at is null" +
                " and w.deleted_at is null" +
                " and :now >= s.updated_at + s.update_interval * interval '1 second'" +
                " order by s.updated_at + s.update_interval * interval '1 second' asc, s.id asc, ws.workflow_id asc")
        List<ClaimedSchedule> getDueClaimsOf(@BindList("ids") List<Long> ids, @Bind("now") Instant now);
    }

    public interface Dao
    {
        @SqlUpdate("update schedules" +
                " set updated_at = :now" +
                " where id in (<ids>)" +
                " and deleted_at is null")
        int touchSchedules(@BindList("ids") List<Long> ids, @Bind("now") Instant now);

        @SqlUpdate("insert into schedules" +
                " (owner_id, update_interval, metadata, created_at, updated_at)" +
                " values (:ownerId, :updateInterval, :metadata, :now, :now)")
        @GetGeneratedKeys
        long insertSchedule(@Bind("ownerId") UUID ownerId, @Bind("updateInterval") int updateInterval,
                @Bind("metadata") Config metadata, @Bind("now") Instant now);

        @SqlQuery("select * from schedules" +
                " where id = :id" +
                " and deleted_at is null")
        StoredSchedule getScheduleById(@Bind("id") long id);

        @SqlQuery("select * from schedules" +
                " where owner_id = :ownerId" +
                " and deleted_at is null" +
                " and id > :lastId" +
                " order by id asc" +
                " limit :limit")
        List<StoredSchedule> getSchedulesByOwnerId(@Bind("ownerId") UUID ownerId, @Bind("limit") int limit, @Bind("lastId") long lastId);

        @SqlUpdate("update schedules" +
                " set update_interval = coalesce(:updateInterval, update_interval)," +
                " metadata = coalesce(:metadata, metadata)" +
                " where id = :id" +
                " and deleted_at is null")
        int updateSchedule(@Bind("id") long id, @Bind("updateInterval") Integer updateInterval, @Bind("metadata") Config metadata);

        // greatest() keeps deleted_at >= updated_at when a claim stamped a later time
        @SqlUpdate("update schedules" +
                " set deleted_at = greatest(:now, updated_at)" +
                " where id = :id" +
                " and deleted_at is null")
        int deleteSchedule(@Bind("id") long id, @Bind("now") Instant now);

        @SqlUpdate("update schedules" +
                " set deleted_at = greatest(:now, updated_at)" +
                " where owner_id = :ownerId" +
                " and deleted_at is null")
        int deleteSchedulesByOwnerId(@Bind("ownerId") UUID ownerId, @Bind("now") Instant now);

        @SqlQuery("select id from workflows" +
                " where id = :id" +
                " and deleted_at is null" +
                " for update")
        Long lockActiveWorkflowById(@Bind("id") long workflowId);

        @SqlQuery("select id from schedules" +
                " where id in (<ids>)" +
                " and deleted_at is null")
        List<Long> getActiveScheduleIds(@BindList("ids") List<Long> ids);

        @SqlUpdate("delete from workflow_schedules" +
                " where workflow_id = :workflowId")
        int deleteWorkflowSchedules(@Bind("workflowId") long workflowId);

        @SqlBatch("insert into workflow_schedules" +
                " (workflow_id, schedule_id, created_at)" +
                " values (:workflowId, :scheduleId, :now)")
        int[] insertWorkflowSchedules(@Bind("workflowId") long workflowId, @Bind("scheduleId") List<Long> scheduleIds, @Bind("now") Instant now);

        @SqlQuery("select schedule_id from workflow_schedules" +
                " where workflow_id = :workflowId" +
                " order by schedule_id asc")
        List<Long> getScheduleIdsOfWorkflow(@Bind("workflowId") long workflowId);
    }

    static class StoredScheduleMapper
            implements RowMapper<StoredSchedule>
    {
        private final ConfigMapper cfm;

        public StoredScheduleMapper(ConfigMapper cfm)
        {
            this.cfm = cfm;
        }

        @Override
        public StoredSchedule map(ResultSet r, StatementContext ctx)
                throws SQLException
        {
            return ImmutableStoredSchedule.builder()
                .id(r.getLong("id"))
                .ownerId(getUuid(r, "owner_id"))
                .updateInterval(r.getInt("update_interval"))
                .metadata(cfm.fromResultSetOrEmpty(r, "metadata"))
                .createdAt(getTimestampInstant(r, "created_at"))
                .updatedAt(getTimestampInstant(r, "updated_at"))
                .deletedAt(getOptionalTimestampInstant(r, "deleted_at"))
                .build();
        }
    }

    static class ClaimedScheduleMapper
            implements RowMapper<ClaimedSchedule>
    {
        private final StoredScheduleMapper scheduleMapper;

        public ClaimedScheduleMapper(ConfigMapper cfm)
        {
            this.scheduleMapper = new StoredScheduleMapper(cfm);
        }

        @Override
        public ClaimedSchedule map(ResultSet r, StatementContext ctx)
                throws SQLException
        {
            return ClaimedSchedule.of(r.getLong("workflow_id"), scheduleMapper.map(r, ctx));
        }
    }
}
