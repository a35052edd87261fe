package io.github.goodees.sync.store;

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

import java.util.UUID;
import java.util.function.BiFunction;
import java.util.function.Consumer;

/**
 * Append-only log of events, ordered by version per aggregate.
 *
 * <p>The runtime appends to the log only after the aggregate's version gate accepted a transition, and reads from it
 * only to recover an aggregate that is not cached.</p>
 */
public interface EventLog {

    /**
     * Persist an event synchronously. The event must directly follow the last stored event of its aggregate, i. e.
     * its version must be exactly one greater than {@link #lastVersion(UUID)}.
     * @param event event to store
     * @throws EventStoreException when storing fails, or the version does not follow the stored sequence
     */
    void append(Event event) throws EventStoreException;

    /**
     * Read all events for an aggregate that happened after specified version.
     * @param aggregateId the id of an aggregate
     * @param afterVersion events that happened after this version. 0 will return entire history
     * @return accessor for the events in ascending version order
     */
    StoredEvents<? extends Event> readEvents(UUID aggregateId, long afterVersion);

    /**
     * Read entire history of an aggregate.
     * @param aggregateId the id of an aggregate
     * @return accessor for the events in ascending version order
     */
    default StoredEvents<? extends Event> readAll(UUID aggregateId) {
        return readEvents(aggregateId, 0);
    }

    /**
     * Version of the last stored event of an aggregate.
     * @param aggregateId the id of an aggregate
     * @return last version, 0 when no events are stored
     */
    long lastVersion(UUID aggregateId);

    /**
     * Accessor that enables single iteration over found events.
     * The underlying idea is, that the events need not be materialized at once, rather it could for example wrap a
     * JDBC ResultSet. This also means that only one of methods foreach and reduce may be called on single instance,
     * and only once.
     */
    interface StoredEvents<E extends Event> extends AutoCloseable {
        /**
         * Iterate over all found events. Consumer may call {@link #stop()} to stop the iteration.
         * @param consumer consumer that will receive the events
         */
        void foreach(Consumer<? super E> consumer);

        /**
         * Perform a reduction over all found events. Reducer may call {@link #stop()} to stop the process.
         * @param initial Initial value for reduction
         * @param reducer the reducer function
         * @param <R> type of result
         * @return result of reduction.
         */
        <R> R reduce(R initial, BiFunction<R, ? super E, R> reducer);

        /**
         * Can be called from within the lambda functions to stop the iteration after current step.
         */
        void stop();

        // will not throw exception
        @Override
        void close();
    }
}
