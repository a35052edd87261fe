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
 * Resident state of single aggregate, the source of truth for reads. The state is only ever replaced by the
 * runtime, after the entry's {@link VersionGate} accepted the transition and the event was appended to the log.
 *
 * <p>State, version and timestamp of the last event are published together as one {@link Snapshot}, so readers
 * never observe a mix of two versions.</p>
 *
 * @param <S> type of aggregate state
 */
public final class AggregateCache<S extends AggregateState> {
    private final UUID aggregateId;
    private final VersionGate gate;
    private volatile Snapshot<S> snapshot;

    AggregateCache(S state, Instant lastTimestamp) {
        this.aggregateId = state.getId();
        this.snapshot = new Snapshot<>(state, lastTimestamp);
        this.gate = new VersionGate(state.getVersion());
    }

    public UUID getAggregateId() {
        return aggregateId;
    }

    /**
     * Current state. The snapshot may be stale by the time it is used, it is only safe to base a change on it when
     * its version is presented to the gate.
     * @return latest published snapshot
     */
    public Snapshot<S> snapshot() {
        return snapshot;
    }

    VersionGate.Transition tryAdvance(long expectedVersion) {
        return gate.tryAdvance(expectedVersion);
    }

    /**
     * Publish state of an accepted transition. Only the winner of the gate for the version calls this, so
     * publications are totally ordered.
     */
    void publish(S state, Instant timestamp) {
        if (state.getVersion() != gate.currentVersion()) {
            throw new IllegalStateException("Publishing version " + state.getVersion() + " of " + aggregateId
                    + " while gate is at " + gate.currentVersion());
        }
        this.snapshot = new Snapshot<>(state, timestamp);
    }

    @Override
    public String toString() {
        return "AggregateCache{" + "aggregateId=" + aggregateId + ", gate=" + gate + ", version="
                + snapshot.getVersion() + '}';
    }

    public static final class Snapshot<S extends AggregateState> {
        private final S state;
        private final Instant lastTimestamp;

        Snapshot(S state, Instant lastTimestamp) {
            this.state = Objects.requireNonNull(state);
            this.lastTimestamp = lastTimestamp;
        }

        public S getState() {
            return state;
        }

        public long getVersion() {
            return state.getVersion();
        }

        /**
         * @return timestamp of the last applied event, null if there was none
         */
        public Instant getLastTimestamp() {
            return lastTimestamp;
        }
    }
}
