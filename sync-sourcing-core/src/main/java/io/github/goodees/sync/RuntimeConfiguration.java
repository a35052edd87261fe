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

/**
 * Dependencies of {@link SyncSourcingRuntime}.
 *
 * @param <S> type of aggregate state
 */
public interface RuntimeConfiguration<S extends AggregateState> {

    /**
     * Name of the runtime, used to name its logger.
     * @return the name
     */
    String runtimeName();

    AggregateType<S> aggregateType();

    /**
     * The log events are appended to, and aggregates are recovered from. Each aggregate type should have a log
     * of its own, or share one where aggregate ids are unique across types.
     * @return the event log
     */
    EventLog eventLog();

    /**
     * Clock stamping the events.
     * @return the clock
     */
    Clock clock();
}
