package io.github.goodees.sync.store.inmemory;

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
import io.github.goodees.sync.store.EventLog;
import io.github.goodees.sync.store.EventStoreException;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.function.BiFunction;
import java.util.function.Consumer;

import static java.util.stream.Collectors.toList;

/**
 * Event log held in memory. Suits tests, and aggregates whose history need not survive the process.
 */
public class InMemoryEventLog implements EventLog {
    private final ConcurrentMap<UUID, List<Event>> storage = new ConcurrentHashMap<>();

    private List<Event> aggregateLog(UUID aggregateId) {
        return storage.computeIfAbsent(aggregateId, (i) -> Collections.synchronizedList(new ArrayList<>()));
    }

    // reads must not register the aggregate
    private List<Event> existingLog(UUID aggregateId) {
        return storage.getOrDefault(aggregateId, Collections.emptyList());
    }

    /**
     * Number of aggregates events were appended to.
     * @return count of aggregates
     */
    public int aggregateCount() {
        return storage.size();
    }

    private static long lastVersionOf(List<Event> log) {
        return log.isEmpty() ? 0 : log.get(log.size() - 1).aggregateVersion();
    }

    @Override
    public void append(Event event) throws EventStoreException {
        List<Event> log = aggregateLog(event.aggregateId());
        synchronized (log) {
            long lastVersion = lastVersionOf(log);
            if (event.aggregateVersion() <= lastVersion) {
                throw EventStoreException.optimisticLock(event.aggregateId(), lastVersion, event.aggregateVersion());
            } else if (event.aggregateVersion() != lastVersion + 1) {
                throw EventStoreException.nonMonotonic(event.aggregateId(), lastVersion + 1, event);
            }
            log.add(event);
        }
    }

    @Override
    public long lastVersion(UUID aggregateId) {
        List<Event> log = existingLog(aggregateId);
        synchronized (log) {
            return lastVersionOf(log);
        }
    }

    /**
     * Number of events stored for an aggregate.
     * @param aggregateId the aggregate
     * @return count of events
     */
    public int size(UUID aggregateId) {
        return existingLog(aggregateId).size();
    }

    @Override
    public StoredEvents<Event> readEvents(UUID aggregateId, long afterVersion) {
        return new StoredEvents<Event>() {
            final List<Event> filteredEvents;
            boolean stop = false;

            {
                List<Event> events = existingLog(aggregateId);
                // a synchronized list must be manually synchronized on when iterating over it
                synchronized (events) {
                    filteredEvents = events.stream().filter(e -> e.aggregateVersion() > afterVersion).collect(toList());
                }
            }

            @Override
            public void foreach(Consumer<? super Event> consumer) {
                for (Event event : filteredEvents) {
                    if (stop) {
                        break;
                    }
                    consumer.accept(event);
                }
            }

            @Override
            public <R> R reduce(R initial, BiFunction<R, ? super Event, R> reducer) {
                R result = initial;
                for (Event event : filteredEvents) {
                    if (stop) {
                        break;
                    }
                    result = reducer.apply(result, event);
                }
                return result;
            }

            @Override
            public void stop() {
                stop = true;
            }

            @Override
            public void close() {
            }
        };
    }
}
