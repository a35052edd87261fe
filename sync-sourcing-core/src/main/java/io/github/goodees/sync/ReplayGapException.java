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

import java.util.UUID;

/**
 * Integrity fault found while replaying the history of an aggregate: the versions of its events do not form the
 * sequence {@code 1..N}, or an event of other aggregate appeared in the history. The state of such aggregate
 * cannot be reconstructed, and the history needs to be investigated.
 */
public class ReplayGapException extends IllegalStateException {
    private final UUID aggregateId;
    private final long expectedVersion;
    private final long actualVersion;

    protected ReplayGapException(UUID aggregateId, long expectedVersion, long actualVersion, String message) {
        super(message);
        this.aggregateId = aggregateId;
        this.expectedVersion = expectedVersion;
        this.actualVersion = actualVersion;
    }

    public UUID getAggregateId() {
        return aggregateId;
    }

    public long getExpectedVersion() {
        return expectedVersion;
    }

    public long getActualVersion() {
        return actualVersion;
    }

    public static ReplayGapException missingVersion(UUID aggregateId, long expectedVersion, Event found) {
        return new ReplayGapException(aggregateId, expectedVersion, found.aggregateVersion(),
            "History of " + aggregateId + " is missing version " + expectedVersion + ", found "
                    + found.aggregateVersion() + " instead");
    }

    public static ReplayGapException repeatedVersion(UUID aggregateId, long expectedVersion, Event found) {
        return new ReplayGapException(aggregateId, expectedVersion, found.aggregateVersion(),
            "History of " + aggregateId + " repeats version " + found.aggregateVersion() + " where "
                    + expectedVersion + " was expected");
    }

    public static ReplayGapException foreignEvent(UUID aggregateId, long expectedVersion, Event found) {
        return new ReplayGapException(aggregateId, expectedVersion, found.aggregateVersion(),
            "History of " + aggregateId + " contains event of aggregate " + found.aggregateId() + ": " + found);
    }
}
