package io.tickwork.core.database;

import io.tickwork.core.repository.ResourceNotFoundException;
import io.tickwork.core.schedule.Schedule;
import io.tickwork.core.schedule.ScheduleStore;
import io.tickwork.core.schedule.StoredSchedule;
import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.Proxy;
import java.sql.Connection;
import java.sql.SQLException;
import java.time.Instant;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import javax.sql.DataSource;
import org.junit.After;
import org.junit.Before;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.ExpectedException;
import static io.tickwork.core.database.DatabaseTestingUtils.createConfig;
import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.is;
import static org.hamcrest.Matchers.instanceOf;
import static org.hamcrest.Matchers.notNullValue;
import static org.hamcrest.Matchers.nullValue;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.junit.Assert.fail;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

public class ThreadLocalTransactionManagerTest
{
    private DatabaseFactory factory;
    private ScheduleStore store;

    @Rule
    public final ExpectedException exception = ExpectedException.none();

    @Before
    public void setUp()
    {
        factory = DatabaseTestingUtils.setupDatabase();
        store = factory.getScheduleStoreManager(new TestingClock(Instant.parse("2024-03-01T00:00:00Z")))
            .getScheduleStore();
    }

    @After
    public void destroy()
    {
        factory.close();
    }

    @Test
    public void nestedTransactionIsNotAllowed()
            throws Exception
    {
        exception.expectMessage(containsString("Nested transaction is not allowed"));
        exception.expect(IllegalStateException.class);
        factory.get().begin(() -> {
            return factory.get().begin(() -> {
                fail();
                return null;
            });
        });
    }

    @Test
    public void getHandleOutsideTransaction()
    {
        exception.expectMessage(containsString("Not in transaction"));
        exception.expect(IllegalStateException.class);
        factory.get().getHandle(DatabaseTestingUtils.createConfigMapper());
    }

    @Test
    public void reuseTransaction()
            throws Exception
    {
        StoredSchedule created = factory.get().begin(() -> {
            StoredSchedule sched = store.createSchedule(Schedule.of(UUID.randomUUID(), 60, createConfig()));

            // This transaction can read the stored schedule
            assertThat(store.getScheduleById(sched.getId()), is(notNullValue()));

            // Another transaction can't read it until committed
            StoredSchedule other = CompletableFuture.supplyAsync(() -> findSchedule(sched.getId())).join();
            assertThat(other, is(nullValue()));

            return sched;
        }, ResourceNotFoundException.class);

        // Another transaction can read after commit
        StoredSchedule other = CompletableFuture.supplyAsync(() -> findSchedule(created.getId())).join();
        assertThat(other, is(created));
    }

    @Test
    public void exceptionRollsBack()
            throws Exception
    {
        long[] id = new long[1];
        try {
            factory.get().begin(() -> {
                id[0] = store.createSchedule(Schedule.of(UUID.randomUUID(), 60, createConfig())).getId();
                throw new ResourceNotFoundException("rollback");
            }, ResourceNotFoundException.class);
            fail();
        }
        catch (ResourceNotFoundException ex) {
            assertThat(ex.getMessage(), is("rollback"));
        }
        assertThat(findSchedule(id[0]), is(nullValue()));
    }

    @Test
    public void statementFailureIsTranslated()
    {
        try {
            factory.get().begin(() -> {
                factory.get().getHandle(DatabaseTestingUtils.createConfigMapper())
                    .execute("select * from no_such_table");
                return null;
            });
            fail();
        }
        catch (DatabaseAccessException ex) {
            assertThat(ex.getKind(), is(DatabaseAccessException.Kind.QUERY));
            assertThat(ex.isRetryable(), is(false));
        }
    }

    @Test
    public void checkConstraintViolationIsQueryError()
    {
        try {
            factory.get().autoCommit(() -> {
                return factory.get().getHandle(DatabaseTestingUtils.createConfigMapper())
                    .execute("insert into schedules (owner_id, update_interval, metadata, created_at, updated_at)" +
                            " values (?, 0, '{}', ?, ?)",
                            UUID.randomUUID(), Instant.EPOCH, Instant.EPOCH);
            });
            fail();
        }
        catch (DatabaseAccessException ex) {
            assertThat(ex.getKind(), is(DatabaseAccessException.Kind.QUERY));
            assertThat(ex.getMessage(), containsString("SQLState"));
            assertThat(ex.getCause(), is(instanceOf(RuntimeException.class)));
        }
    }

    @Test
    public void committedTransactionReturnsResult()
    {
        TransactionManager tm = factory.get();
        for (int i = 0; i < 3; i++) {
            String result = tm.begin(() -> {
                insertWorkflow(tm);
                return "committed";
            });
            assertThat(result, is("committed"));
        }
        assertThat(countWorkflows(), is(3L));
    }

    @Test
    public void failedRollbackKeepsOriginalException()
            throws Exception
    {
        TransactionManager tm = new ThreadLocalTransactionManager(
                connectionFailingOn("rollback"), factory.getConfig().getType());
        try {
            tm.begin(() -> {
                insertWorkflow(tm);
                throw new IllegalArgumentException("handler failed");
            });
            fail();
        }
        catch (IllegalArgumentException ex) {
            assertThat(ex.getMessage(), is("handler failed"));
            assertThat(ex.getSuppressed().length, is(1));
        }
    }

    @Test
    public void failedCloseAfterCommitReturnsResult()
            throws Exception
    {
        TransactionManager tm = new ThreadLocalTransactionManager(
                connectionFailingOn("close"), factory.getConfig().getType());
        String result = tm.begin(() -> {
            insertWorkflow(tm);
            return "committed";
        });
        assertThat(result, is("committed"));
        assertThat(countWorkflows(), is(1L));

        // the thread is free for the next transaction
        assertThat(tm.begin(() -> "next"), is("next"));
    }

    @Test
    public void failedCloseAfterErrorKeepsOriginalException()
            throws Exception
    {
        TransactionManager tm = new ThreadLocalTransactionManager(
                connectionFailingOn("close"), factory.getConfig().getType());
        try {
            tm.begin(() -> {
                tm.getHandle(DatabaseTestingUtils.createConfigMapper())
                    .execute("select * from no_such_table");
                return null;
            });
            fail();
        }
        catch (DatabaseAccessException ex) {
            assertThat(ex.getKind(), is(DatabaseAccessException.Kind.QUERY));
            assertThat(ex.getSuppressed().length, is(1));
        }
    }

    private static void insertWorkflow(TransactionManager tm)
    {
        tm.getHandle(DatabaseTestingUtils.createConfigMapper())
            .execute("insert into workflows (owner_id, name, created_at, updated_at) values (?, ?, ?, ?)",
                    UUID.randomUUID(), "report", Instant.EPOCH, Instant.EPOCH);
    }

    private long countWorkflows()
    {
        return factory.getJdbi().withHandle(h ->
                h.createQuery("select count(*) from workflows").mapTo(long.class).one());
    }

    // Connections that run the named method and then report a broken connection
    private DataSource connectionFailingOn(String methodName)
            throws SQLException
    {
        DataSource ds = factory.getDataSource();
        DataSource failing = mock(DataSource.class);
        when(failing.getConnection()).thenAnswer(invocation -> {
            Connection delegate = ds.getConnection();
            return (Connection) Proxy.newProxyInstance(Connection.class.getClassLoader(), new Class<?>[] {Connection.class},
                    (proxy, method, args) -> {
                        Object value;
                        try {
                            value = method.invoke(delegate, args);
                        }
                        catch (InvocationTargetException ex) {
                            throw ex.getCause();
                        }
                        if (method.getName().equals(methodName)) {
                            throw new SQLException("Connection reset", "08006");
                        }
                        return value;
                    });
        });
        return failing;
    }

    private StoredSchedule findSchedule(long id)
    {
        return factory.get().autoCommit(() -> {
            try {
                return store.getScheduleById(id);
            }
            catch (ResourceNotFoundException ex) {
                return null;
            }
        });
    }
}
