package io.github.goodees.sync.store.jdbc;

/*-
 * #%L
 * sync-sourcing
 * %%
 * Copyright (C) 2017 Patrik Duditš
 * %%
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 * 
 *      http://www.apache.org/licenses/LICENSE-2.0
 * 
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 * #L%
 */

import io.github.goodees.sync.Event;
import io.github.goodees.sync.store.EventLog;
import io.github.goodees.sync.store.EventStoreException;
import io.github.goodees.sync.store.Serialization;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.SQLIntegrityConstraintViolationException;
import java.util.UUID;
import java.util.function.BiFunction;
import java.util.function.Consumer;

/**
 * Event log backed by schema and serialization.
 *
 * <p>Append is a single transaction, that inserts the event and moves the aggregate's row in version table from
 * previous version to the event's version. When another writer already stored the version, either the version
 * update matches no row, or the insert violates primary key of event table. Both are reported as
 * {@linkplain EventStoreException.Fault#OPTIMISTIC_LOCK optimistic lock}.</p>
 *
 * @param <E> base type of events the serialization handles
 */
public class JdbcEventLog<E extends Event> implements EventLog {
    private static final Logger logger = LoggerFactory.getLogger(JdbcEventLog.class);

    private final DataSource ds;
    private final JdbcSchema schema;
    private final Serialization<E> serialization;
    private final boolean strict;
    private final TxHandler txHandler;

    /**
     * Create instance that will read from provided datasource, delegating queries to JdbcSchema, deserializing events
     * by serialization, while being or not being strict. Transactions are left to the container managing the
     * datasource.
     *
     * <p>When event log is in strict mode, it will throw an exception when an event being read cannot be deserialized.
     * This can usually happen in two cases: Either there was an error in payload serialization, or an event could have
     * belong to a future version of the system, code was rolled back and currently running code doesn't yet know such
     * event.
     * <p>When {@code strict} is false, such event is skipped. Replaying such history fails on the version gap, so
     * non-strict mode only suits readers that tolerate incomplete history.
     *
     * @param ds the datasource
     * @param schema statements for the tables
     * @param serialization serialization of the payloads
     * @param strict whether undeserializable event fails the read
     */
    public JdbcEventLog(DataSource ds, JdbcSchema schema, Serialization<E> serialization, boolean strict) {
        this(ds, schema, serialization, strict, TxHandler.CONTAINER);
    }

    public JdbcEventLog(DataSource ds, JdbcSchema schema, Serialization<E> serialization, boolean strict,
            TxHandler txHandler) {
        this.ds = ds;
        this.schema = schema;
        this.serialization = serialization;
        this.strict = strict;
        this.txHandler = txHandler;
    }

    /**
     * Indicate whether failure to deserialize event causes exception to be thrown.
     * @return true in strict mode
     */
    public boolean isStrict() {
        return strict;
    }

    protected E checkCast(Event event) throws EventStoreException {
        E cast = serialization.toSerializable(event);
        if (cast == null) {
            throw EventStoreException.unsupported(event);
        } else {
            return cast;
        }
    }

    @Override
    public void append(Event event) throws EventStoreException {
        E serializable = checkCast(event);
        UUID aggregateId = event.aggregateId();
        long startVersion = event.aggregateVersion() - 1;
        try (Connection connection = txHandler.enroll(ds.getConnection())) {
            try {
                checkSourceVersion(connection, event);
                try (PreparedStatement insertEvent = schema.insertEvent(connection, aggregateId);
                        PreparedStatement updateVersion = schema.updateAggregateVersion(connection, aggregateId,
                            startVersion, event.aggregateVersion())) {
                    schema.prepareInsert(insertEvent, event, serialization.payloadVersion(serializable),
                        serialization.serialize(serializable));
                    insertEvent.executeUpdate();
                    if (updateVersion.executeUpdate() != 1) {
                        throw EventStoreException.optimisticLock(aggregateId, event.aggregateVersion(),
                            event.aggregateVersion());
                    }
                }
                txHandler.commit(connection);
            } catch (SQLException | EventStoreException | RuntimeException e) {
                txHandler.rollback(connection);
                throw e;
            }
        } catch (SQLIntegrityConstraintViolationException e) {
            logger.debug("{} version {} was concurrently stored", aggregateId, event.aggregateVersion(), e);
            throw EventStoreException.optimisticLock(aggregateId, event.aggregateVersion(), event.aggregateVersion());
        } catch (SQLException e) {
            throw EventStoreException.storeFailed(aggregateId, e);
        }
        logger.debug("Stored {}", event);
    }

    private void checkSourceVersion(Connection connection, Event event) throws SQLException, EventStoreException {
        UUID aggregateId = event.aggregateId();
        try (PreparedStatement selectVersion = schema.selectAggregateVersion(connection, aggregateId);
                ResultSet rs = selectVersion.executeQuery()) {
            long storedVersion = rs.next() ? schema.readAggregateVersion(rs) : -1;
            if (storedVersion < 0) {
                if (event.aggregateVersion() != 1) {
                    throw EventStoreException.nonMonotonic(aggregateId, 1, event);
                }
                // first event of an aggregate, the version row starts before it
                try (PreparedStatement createVersion = schema.createAggregateVersion(connection, aggregateId, 0)) {
                    createVersion.executeUpdate();
                }
            } else if (storedVersion >= event.aggregateVersion()) {
                throw EventStoreException.optimisticLock(aggregateId, storedVersion, event.aggregateVersion());
            } else if (storedVersion != event.aggregateVersion() - 1) {
                throw EventStoreException.nonMonotonic(aggregateId, storedVersion + 1, event);
            }
        }
    }

    @Override
    public long lastVersion(UUID aggregateId) {
        try (Connection connection = ds.getConnection();
                PreparedStatement selectVersion = schema.selectAggregateVersion(connection, aggregateId);
                ResultSet rs = selectVersion.executeQuery()) {
            return rs.next() ? schema.readAggregateVersion(rs) : 0;
        } catch (SQLException e) {
            throw new IllegalStateException("Cannot access storage", e);
        }
    }

    @Override
    public StoredEvents<E> readEvents(UUID aggregateId, long afterVersion) {
        try {
            return new JdbcStoredEvents(aggregateId, afterVersion);
        } catch (SQLException e) {
            throw new IllegalStateException("Cannot access storage", e);
        }
    }

    /**
     * Transaction demarcation around an append.
     */
    public interface TxHandler {

        Connection enroll(Connection connection) throws SQLException;

        void commit(Connection connection) throws SQLException;

        void rollback(Connection connection) throws SQLException;

        /**
         * Connections participate in transaction managed by the container.
         */
        TxHandler CONTAINER = new TxHandler() {
            @Override
            public Connection enroll(Connection connection) {
                return connection;
            }

            @Override
            public void commit(Connection connection) {
            }

            @Override
            public void rollback(Connection connection) {
            }
        };

        /**
         * Every append runs in its own local transaction.
         */
        TxHandler LOCAL = new TxHandler() {
            @Override
            public Connection enroll(Connection connection) throws SQLException {
                connection.setAutoCommit(false);
                return connection;
            }

            @Override
            public void commit(Connection connection) throws SQLException {
                connection.commit();
            }

            @Override
            public void rollback(Connection connection) throws SQLException {
                connection.rollback();
            }
        };
    }

    class JdbcStoredEvents implements EventLog.StoredEvents<E> {
        private final UUID aggregateId;
        private Connection connection;
        private PreparedStatement statement;
        private ResultSet resultSet;
        private boolean iterating;
        private boolean stop;

        JdbcStoredEvents(UUID aggregateId, long afterVersion) throws SQLException {
            this.aggregateId = aggregateId;
            try {
                connection = ds.getConnection();
                statement = schema.selectEvents(connection, aggregateId, afterVersion);
                resultSet = statement.executeQuery();
            } catch (SQLException e) {
                close();
                throw e;
            }
        }

        @Override
        public void foreach(Consumer<? super E> consumer) {
            startIteration();
            E event;
            while ((event = next()) != null) {
                consumer.accept(event);
            }
        }

        @Override
        public <R> R reduce(R initial, BiFunction<R, ? super E, R> reducer) {
            startIteration();
            R result = initial;
            E event;
            while ((event = next()) != null) {
                result = reducer.apply(result, event);
            }
            return result;
        }

        private void startIteration() {
            if (iterating) {
                throw new IllegalStateException("Iteration has already been done");
            }
            iterating = true;
        }

        private E next() {
            try {
                while (!stop && resultSet.next()) {
                    String type = schema.readEventType(resultSet);
                    int payloadVersion = schema.readEventPayloadVersion(resultSet);
                    E event = serialization.deserialize(payloadVersion, schema.readEventPayload(resultSet), type);
                    if (event != null) {
                        return event;
                    }
                    long version = schema.readEventVersion(resultSet);
                    if (isStrict()) {
                        throw new IllegalArgumentException(aggregateId + " Could not deserialize event " + version
                                + " of type " + type);
                    } else {
                        logger.error("{} Could not deserialize event {} of type {}", aggregateId, version, type);
                    }
                }
                return null;
            } catch (SQLException e) {
                throw new IllegalStateException("Cannot access datastore", e);
            }
        }

        @Override
        public void stop() {
            stop = true;
        }

        @Override
        public void close() {
            cleanup(resultSet);
            cleanup(statement);
            cleanup(connection);
        }

        protected void cleanup(AutoCloseable resource) {
            if (resource != null) {
                try {
                    resource.close();
                } catch (Exception e) {
                    logger.warn("Suppressing cleanup exception", e);
                }
            }
        }
    }
}
