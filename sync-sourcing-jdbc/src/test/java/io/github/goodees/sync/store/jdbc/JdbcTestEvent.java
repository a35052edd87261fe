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

import java.time.Instant;
import java.util.UUID;

public class JdbcTestEvent implements Event {
    private final UUID aggregateId;
    private final long version;
    private final Instant timestamp;
    private final int payload;

    public JdbcTestEvent(UUID aggregateId, long version, Instant timestamp, int payload) {
        this.aggregateId = aggregateId;
        this.version = version;
        this.timestamp = timestamp;
        this.payload = payload;
    }

    public JdbcTestEvent(UUID aggregateId, long version, int payload) {
        this(aggregateId, version, Instant.now(), payload);
    }

    @Override
    public UUID aggregateId() {
        return aggregateId;
    }

    @Override
    public Instant getTimestamp() {
        return timestamp;
    }

    @Override
    public long aggregateVersion() {
        return version;
    }

    public int getPayload() {
        return payload;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (o == null || getClass() != o.getClass())
            return false;

        JdbcTestEvent that = (JdbcTestEvent) o;

        if (version != that.version)
            return false;
        if (payload != that.payload)
            return false;
        if (!aggregateId.equals(that.aggregateId))
            return false;
        return timestamp.equals(that.timestamp);
    }

    @Override
    public int hashCode() {
        int result = aggregateId.hashCode();
        result = 31 * result + (int) version;
        return result;
    }

    @Override
    public String toString() {
        return "JdbcTestEvent{" + aggregateId + "@" + version + ", payload=" + payload + '}';
    }
}
