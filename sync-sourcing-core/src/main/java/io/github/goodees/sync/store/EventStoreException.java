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

/**
 * Exception generated when appending an event to the log fails.
 */
public class EventStoreException extends Exception {
    private final Fault fault;

    public enum Fault {
        /**
         * The log already contains the version being appended.
         */
        OPTIMISTIC_LOCK,
        /**
         * The underlying storage failed.
         */
        TX_ERROR,
        /**
         * The event cannot be stored as it is, e. g. it skips a version or is not supported by serialization.
         */
        PROGRAMMATIC_ERROR
    }

    protected EventStoreException(Fault type, String message, Throwable cause) {
        super(message, cause);
        this.fault = type;
    }

    public Fault getFault() {
        return fault;
    }

    public static EventStoreException optimisticLock(UUID aggregateId, long storedVersion, long eventVersion) {
        return new EventStoreException(Fault.OPTIMISTIC_LOCK, "Aggregate " + aggregateId + " storing event version "
                + eventVersion + " attempted while last stored version is " + storedVersion, null);
    }

    public static EventStoreException storeFailed(UUID aggregateId, Throwable cause) {
        return new EventStoreException(Fault.TX_ERROR,
            "Store of aggregate " + aggregateId + " failed. " + cause.getMessage(), cause);
    }

    public static EventStoreException nonMonotonic(UUID aggregateId, long expectedVersion, Event violating) {
        return new EventStoreException(Fault.PROGRAMMATIC_ERROR, "Event for aggregate " + aggregateId
                + " does not follow sequence. Expected: " + expectedVersion + " actual: "
                + violating.aggregateVersion(), null);
    }

    public static EventStoreException unsupported(Event event) {
        return new EventStoreException(Fault.PROGRAMMATIC_ERROR, "Unsupported event type: " + event, null);
    }
}
