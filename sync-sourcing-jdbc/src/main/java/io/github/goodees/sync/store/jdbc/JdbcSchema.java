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

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.UUID;

/**
 * Statements the JDBC event log needs, and mapping of their results. Subclasses decide on table layout and SQL
 * dialect. The log closes all statements it obtains.
 *
 * @see DefaultJdbcSchema
 */
public abstract class JdbcSchema {

    /**
     * Query for the last stored version of an aggregate, returning no rows for unknown aggregate.
     */
    protected abstract PreparedStatement selectAggregateVersion(Connection connection, UUID aggregateId)
            throws SQLException;

    protected abstract PreparedStatement createAggregateVersion(Connection connection, UUID aggregateId,
            long startVersion) throws SQLException;

    protected abstract long readAggregateVersion(ResultSet rs) throws SQLException;

    /**
     * Update of stored version, that only succeeds when the stored version is {@code startVersion}.
     */
    protected abstract PreparedStatement updateAggregateVersion(Connection connection, UUID aggregateId,
            long startVersion, long endVersion) throws SQLException;

    protected abstract PreparedStatement insertEvent(Connection connection, UUID aggregateId) throws SQLException;

    protected abstract void prepareInsert(PreparedStatement insertEvent, Event event, int payloadVersion,
            String payload) throws SQLException;

    /**
     * Query for events of an aggregate with version greater than {@code afterVersion}, in ascending version order.
     */
    protected abstract PreparedStatement selectEvents(Connection connection, UUID aggregateId, long afterVersion)
            throws SQLException;

    protected abstract long readEventVersion(ResultSet rs) throws SQLException;

    protected abstract String readEventType(ResultSet rs) throws SQLException;

    protected abstract int readEventPayloadVersion(ResultSet rs) throws SQLException;

    protected abstract String readEventPayload(ResultSet rs) throws SQLException;
}
