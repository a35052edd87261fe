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
import java.util.UUID;

/**
 * Immutable fact about a change of single aggregate.
 *
 * <p>Every aggregate type defines its own closed set of events. An event is created exactly once, by a command
 * whose transition was accepted by the aggregate's {@link VersionGate}, and it is never modified or deleted
 * afterwards.</p>
 *
 * <p>The serialization format is not prescribed, but events may define annotations to support specific
 * serialization kinds, e. g. Jackson annotations. The actual serialization is the task of the
 * {@link io.github.goodees.sync.store.EventLog} implementation in use.</p>
 *
 * <p>The methods provided in this interface define metadata that is stored outside the journaled payload to enable
 * querying and deserialization.</p>
 *
 * Support for events based on <a href="http://immutables.github.io">Immutables</a> is in package
 * {@link io.github.goodees.sync.immutables}.
 */
public interface Event {
    /**
     * The type of event. For every aggregate type this must uniquely identify the event to be created.
     * @return textual description of the type of event, uses class name by default, see {@link EventType}
     */
    default String getType() {
        return EventType.of(getClass());
    }

    /**
     * The id of the aggregate this event relates to.
     * @return the aggregate id
     */
    UUID aggregateId();

    /**
     * The time when an event occurred. Within a stream of single aggregate timestamps never decrease.
     * @return the instant of event creation
     */
    Instant getTimestamp();

    /**
     * The version of the aggregate after this event is applied. Versions of an aggregate start at 1 and grow by one
     * with every event.
     * @return the version the aggregate transitions to
     */
    long aggregateVersion();

}
