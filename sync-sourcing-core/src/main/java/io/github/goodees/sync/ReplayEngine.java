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
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.Objects;
import java.util.UUID;

/**
 * Reconstructs aggregate state from its history. The state is a left fold of {@link AggregateType#apply} over the
 * events, starting at {@linkplain AggregateType#initialState(UUID) initial state}.
 *
 * <p>The history must be exactly versions {@code 1..N} in ascending order. Anything else is reported as
 * {@link ReplayGapException}; the engine never skips or reorders events. The engine holds no position, replaying
 * same history again gives equal state.</p>
 *
 * @param <S> type of aggregate state
 */
public class ReplayEngine<S extends AggregateState> {
    private static final Logger logger = LoggerFactory.getLogger(ReplayEngine.class);

    private final AggregateType<S> aggregateType;

    public ReplayEngine(AggregateType<S> aggregateType) {
        this.aggregateType = Objects.requireNonNull(aggregateType);
    }

    public S rebuild(UUID aggregateId, Iterable<? extends Event> events) {
        Progress<S> progress = new Progress<>(aggregateType.initialState(aggregateId), null);
        for (Event event : events) {
            progress = step(progress, event);
        }
        return progress.state;
    }

    public S rebuild(UUID aggregateId, EventLog.StoredEvents<? extends Event> events) {
        return replay(aggregateId, events).state;
    }

    /**
     * Rebuild the state from entire history in the log.
     * @param aggregateId the aggregate
     * @param log log to read from
     * @return current state according to the log
     */
    public S rebuild(UUID aggregateId, EventLog log) {
        try (EventLog.StoredEvents<? extends Event> events = log.readAll(aggregateId)) {
            return rebuild(aggregateId, events);
        }
    }

    Progress<S> replay(UUID aggregateId, EventLog.StoredEvents<? extends Event> events) {
        Progress<S> result = events.reduce(new Progress<>(aggregateType.initialState(aggregateId), null), this::step);
        logger.debug("Replayed {} {} up to version {}", aggregateType.getName(), aggregateId,
            result.state.getVersion());
        return result;
    }

    private Progress<S> step(Progress<S> progress, Event event) {
        S state = progress.state;
        long expected = state.getVersion() + 1;
        if (!state.getId().equals(event.aggregateId())) {
            logger.error("Foreign event in history of {} {}: {}", aggregateType.getName(), state.getId(), event);
            throw ReplayGapException.foreignEvent(state.getId(), expected, event);
        }
        if (event.aggregateVersion() != expected) {
            logger.error("Broken history of {} {}: expected version {}, got {}", aggregateType.getName(),
                state.getId(), expected, event.aggregateVersion());
            throw event.aggregateVersion() < expected
                    ? ReplayGapException.repeatedVersion(state.getId(), expected, event)
                    : ReplayGapException.missingVersion(state.getId(), expected, event);
        }
        return new Progress<>(aggregateType.apply(state, event), event.getTimestamp());
    }

    static final class Progress<S> {
        final S state;
        final Instant lastTimestamp;

        Progress(S state, Instant lastTimestamp) {
            this.state = state;
            this.lastTimestamp = lastTimestamp;
        }
    }
}
