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
import java.sql.Timestamp;
import java.util.UUID;

/**
 * JDBC schema for separate tables per aggregate type. Following tables are expected to exist:
 * <ul>
 * <li><em>eventTable</em>(ID, VERSION, TIMESTAMP, TYPE, PAYLOAD_VERSION, PAYLOAD) primary key (ID, VERSION)</li>
 * <li><em>versionTable</em>(ID, VERSION) primary key (ID)</li>
 * </ul>
 * Aggregate ids are stored in their string form.
 */
public class DefaultJdbcSchema extends JdbcSchema {

    private final String eventTable;
    private final String versionTable;

    public DefaultJdbcSchema(String eventTable, String versionTable) {
        this.eventTable = eventTable;
        this.versionTable = versionTable;
    }

    protected String getEventTable() {
        return eventTable;
    }

    protected String getVersionTable() {
        return versionTable;
    }

    @Override
    protected PreparedStatement selectAggregateVersion(Connection connection, UUID aggregateId) throws SQLException {
        PreparedStatement st = connection.prepareStatement("SELECT VERSION FROM " + getVersionTable() + " WHERE ID=?");
        st.setString(1, aggregateId.toString());
        return st;
    }

    @Override
    protected PreparedStatement createAggregateVersion(Connection connection, UUID aggregateId, long startVersion)
            throws SQLException {
        PreparedStatement st = connection.prepareStatement("INSERT INTO " + getVersionTable()
                + " (ID, VERSION) VALUES (?, ?)");
        st.setString(1, aggregateId.toString());
        st.setLong(2, startVersion);
        return st;
    }

    @Override
    protected long readAggregateVersion(ResultSet rs) throws SQLException {
        return rs.getLong(1);
    }

    @Override
    protected PreparedStatement updateAggregateVersion(Connection connection, UUID aggregateId, long startVersion,
            long endVersion) throws SQLException {
        PreparedStatement st = connection.prepareStatement("UPDATE " + getVersionTable()
                + " SET VERSION=? WHERE ID=? AND VERSION=?");
        st.setLong(1, endVersion);
        st.setString(2, aggregateId.toString());
        st.setLong(3, startVersion);
        return st;
    }

    @Override
    protected PreparedStatement insertEvent(Connection connection, UUID aggregateId) throws SQLException {
        return connection.prepareStatement("INSERT INTO " + getEventTable()
                + " (ID, VERSION, TIMESTAMP, TYPE, PAYLOAD_VERSION, PAYLOAD) VALUES (?,?,?,?,?,?)");
    }

    @Override
    protected void prepareInsert(PreparedStatement insertEvent, Event event, int payloadVersion, String payload)
            throws SQLException {
        insertEvent.setString(1, event.aggregateId().toString());
        insertEvent.setLong(2, event.aggregateVersion());
        insertEvent.setTimestamp(3, Timestamp.from(event.getTimestamp()));
        insertEvent.setString(4, event.getType());
        insertEvent.setInt(5, payloadVersion);
        insertEvent.setString(6, payload);
    }

    @Override
    protected PreparedStatement selectEvents(Connection connection, UUID aggregateId, long afterVersion)
            throws SQLException {
        PreparedStatement st = connection.prepareStatement("SELECT ID, VERSION, TYPE, PAYLOAD_VERSION, PAYLOAD "
                + "FROM " + getEventTable() + " WHERE ID=? AND VERSION > ? ORDER BY VERSION");
        st.setString(1, aggregateId.toString());
        st.setLong(2, afterVersion);
        return st;
    }

    @Override
    protected long readEventVersion(ResultSet rs) throws SQLException {
        return rs.getLong(2);
    }

    @Override
    protected String readEventType(ResultSet rs) throws SQLException {
        return rs.getString(3);
    }

    @Override
    protected int readEventPayloadVersion(ResultSet rs) throws SQLException {
        return rs.getInt(4);
    }

    @Override
    protected String readEventPayload(ResultSet rs) throws SQLException {
        return rs.getString(5);
    }
}
