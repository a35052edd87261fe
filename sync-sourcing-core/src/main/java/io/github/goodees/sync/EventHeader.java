package io.github.goodees.sync;

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

import java.time.Instant;
import java.util.Objects;
import java.util.UUID;

/**
 * Metadata of the event a command is about to produce. Commands receive it from the runtime and copy it into the
 * event they build, e. g. via {@code new ItemAddedEvent.Builder().from(header)}.
 */
public class EventHeader implements Event {
    private final UUID aggregateId;
    private final long aggregateVersion;
    private final Instant timestamp;

    public EventHeader(UUID aggregateId, long aggregateVersion, Instant timestamp) {
        this.aggregateId = Objects.requireNonNull(aggregateId, "Aggregate id must be specified");
        this.timestamp = Objects.requireNonNull(timestamp, "Timestamp must be specified");
        if (aggregateVersion < 1) {
            throw new IllegalArgumentException("Event version must be positive, was " + aggregateVersion);
        }
        this.aggregateVersion = aggregateVersion;
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
        return aggregateVersion;
    }

    /**
     * Check that given event was built from this header.
     * @param event event produced by a command
     * @return true if aggregate id and version match
     */
    public boolean matches(Event event) {
        return event != null && aggregateId.equals(event.aggregateId()) && aggregateVersion == event.aggregateVersion();
    }

    @Override
    public String toString() {
        return getType() + "{" + "aggregateId=" + aggregateId + ", aggregateVersion=" + aggregateVersion
                + ", timestamp=" + timestamp + '}';
    }
}
