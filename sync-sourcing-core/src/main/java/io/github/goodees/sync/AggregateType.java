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

import java.util.Objects;
import java.util.UUID;

/**
 * Definition of an aggregate: its zero state and the way its state evolves with events.
 *
 * <p>The state can <strong>only</strong> change by application of an event in {@link #apply(AggregateState, Event)},
 * both when a command is executed by {@link SyncSourcingRuntime} and when past events are replayed by
 * {@link ReplayEngine}. Both paths use the very same function, which is what keeps the cache and the log
 * equivalent.</p>
 *
 * @param <S> type of the aggregate state
 */
public abstract class AggregateType<S extends AggregateState> {
    private final String name;

    protected AggregateType(String name) {
        this.name = Objects.requireNonNull(name, "Aggregate type name must be specified");
    }

    public final String getName() {
        return name;
    }

    /**
     * The state of an aggregate before any event happened.
     * @param aggregateId the aggregate identity
     * @return state with given id and version 0
     */
    public abstract S initialState(UUID aggregateId);

    /**
     * Derive next domain state from an event. Must be pure and deterministic, and must not throw for any event.
     * Events the aggregate does not know must be passed through by returning {@code state} unchanged.
     * The version is maintained by the caller.
     *
     * @param state current state
     * @param event event to apply
     * @return the new state
     */
    protected abstract S updateState(S state, Event event);

    /**
     * Copy of the state with different version.
     * @param state the state
     * @param version the version to set
     * @return state with given version
     */
    protected abstract S withVersion(S state, long version);

    /**
     * Apply single event to the state. The resulting state has the version of the event.
     * @param state state before the event
     * @param event the event
     * @return state after the event
     * @throws IllegalArgumentException when the event belongs to different aggregate
     */
    public final S apply(S state, Event event) {
        if (!state.getId().equals(event.aggregateId())) {
            throw new IllegalArgumentException("Event " + event + " does not belong to " + name + " "
                    + state.getId());
        }
        return withVersion(updateState(state, event), event.aggregateVersion());
    }

    @Override
    public String toString() {
        return "AggregateType[" + name + "]";
    }
}
