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

import io.github.goodees.sync.store.EventLog;

import java.time.Clock;
import java.util.Objects;

/**
 * Runtime configuration with dependencies passed to constructor.
 *
 * @param <S> type of aggregate state
 */
public class SimpleRuntimeConfiguration<S extends AggregateState> implements RuntimeConfiguration<S> {
    private final String name;
    private final AggregateType<S> aggregateType;
    private final EventLog eventLog;
    private final Clock clock;

    /**
     * Create runtime configuration.
     * @param name the name of the runtime
     * @param aggregateType aggregate the runtime handles
     * @param eventLog event log to use
     * @param clock clock to stamp events with
     */
    public SimpleRuntimeConfiguration(String name, AggregateType<S> aggregateType, EventLog eventLog, Clock clock) {
        this.name = Objects.requireNonNull(name, "Name must be specified");
        this.aggregateType = Objects.requireNonNull(aggregateType, "Aggregate type must be specified");
        this.eventLog = Objects.requireNonNull(eventLog, "Event log must be specified");
        this.clock = Objects.requireNonNull(clock, "Clock must be specified");
    }

    /**
     * Create runtime configuration named after the aggregate type, using UTC system clock.
     * @param aggregateType aggregate the runtime handles
     * @param eventLog event log to use
     */
    public SimpleRuntimeConfiguration(AggregateType<S> aggregateType, EventLog eventLog) {
        this(aggregateType.getName(), aggregateType, eventLog, Clock.systemUTC());
    }

    @Override
    public String runtimeName() {
        return name;
    }

    @Override
    public AggregateType<S> aggregateType() {
        return aggregateType;
    }

    @Override
    public EventLog eventLog() {
        return eventLog;
    }

    @Override
    public Clock clock() {
        return clock;
    }
}
