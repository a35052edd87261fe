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
import io.github.goodees.sync.store.EventStoreException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.Objects;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Facade for executing commands against aggregates of one type. The runtime keeps every aggregate it has seen
 * resident as {@link AggregateCache}, and updates it synchronously with appending the event to the log.
 *
 * <h2>Command lifecycle</h2>
 * {@link #execute(UUID, long, Command)} performs following steps:
 * <ol>
 *     <li>Obtain the cache entry, recovering it from the log if it is not resident, and read its snapshot.
 *         If the snapshot is not at the version the caller expects, the result is a conflict.</li>
 *     <li>Let the command decide on an event, given the snapshot state and the header of next version.
 *         A {@link DomainRuleViolationException} results in domain rule violation.</li>
 *     <li>Present the expected version to the entry's {@link VersionGate}. If it is rejected, another writer was
 *         faster, and the result is a conflict. Nothing is stored and the state does not change.</li>
 *     <li>Append the event to the log, and publish the state with the event applied. The state is published only
 *         after the append succeeded.</li>
 * </ol>
 *
 * <p>No locks are held during the process. Conflicting commands are not retried, that is left to the caller, who
 * should read the state again before retrying.</p>
 *
 * <h2>Failure of the log</h2>
 * When the append fails, the entry is evicted and the exception is rethrown. The gate of such entry is already
 * ahead of its published state, so any caller still holding it gets a conflict, and the next lookup recovers the
 * aggregate from what the log really contains. When the log reports
 * {@linkplain EventStoreException.Fault#OPTIMISTIC_LOCK optimistic lock}, the version was written by someone else,
 * the entry is evicted as well and the command results in conflict.
 *
 * @param <S> type of the aggregate state
 */
public class SyncSourcingRuntime<S extends AggregateState> {
    private final Logger logger;
    private final RuntimeConfiguration<S> conf;
    private final ReplayEngine<S> replayEngine;
    private final ConcurrentMap<UUID, AggregateCache<S>> aggregates = new ConcurrentHashMap<>();

    public SyncSourcingRuntime(RuntimeConfiguration<S> conf) {
        this.conf = Objects.requireNonNull(conf, "Configuration must be specified");
        this.replayEngine = new ReplayEngine<>(conf.aggregateType());
        this.logger = LoggerFactory.getLogger(getClass().getName() + "." + conf.runtimeName());
    }

    /**
     * Current state of an aggregate. Aggregates without history are in initial state.
     * @param aggregateId the aggregate
     * @return current state
     * @throws ReplayGapException when recovery finds the history broken
     */
    public S get(UUID aggregateId) {
        return lookup(aggregateId).snapshot().getState();
    }

    /**
     * Obtain resident entry of an aggregate, recovering it from the log when necessary. There is at most one entry per
     * aggregate, and it is recovered once.
     * @param aggregateId the aggregate
     * @return the entry
     * @throws ReplayGapException when recovery finds the history broken
     */
    public AggregateCache<S> lookup(UUID aggregateId) {
        Objects.requireNonNull(aggregateId, "Aggregate id must be specified");
        return aggregates.computeIfAbsent(aggregateId, this::recover);
    }

    /**
     * Rebuild the state of an aggregate from the log, bypassing the cache.
     * @param aggregateId the aggregate
     * @return state according to the log
     */
    public S rebuild(UUID aggregateId) {
        return replayEngine.rebuild(aggregateId, conf.eventLog());
    }

    /**
     * Drop resident entry of an aggregate. Next access will recover it from the log.
     * @param aggregateId the aggregate
     */
    public void evict(UUID aggregateId) {
        if (aggregates.remove(aggregateId) != null) {
            logger.debug("Evicted {}", aggregateId);
        }
    }

    public boolean isResident(UUID aggregateId) {
        return aggregates.containsKey(aggregateId);
    }

    /**
     * Execute command based on current state of the aggregate.
     * @see #execute(UUID, long, Command)
     */
    public CommandResult<S> execute(UUID aggregateId, Command<S> command) throws EventStoreException {
        return execute(aggregateId, lookup(aggregateId).snapshot().getVersion(), command);
    }

    /**
     * Execute command based on the version of the aggregate the caller has read.
     * @param aggregateId the aggregate
     * @param expectedVersion version the caller read, and intends to change
     * @param command the command
     * @return accepted result with new state, conflict, or domain rule violation
     * @throws EventStoreException when the event could not be appended to the log
     * @throws ReplayGapException when recovery finds the history broken
     */
    public CommandResult<S> execute(UUID aggregateId, long expectedVersion, Command<S> command)
            throws EventStoreException {
        Objects.requireNonNull(command, "Command must be specified");
        AggregateCache<S> entry = lookup(aggregateId);
        AggregateCache.Snapshot<S> snapshot = entry.snapshot();
        if (snapshot.getVersion() != expectedVersion) {
            logger.debug("{} is at version {}, command expected {}", aggregateId, snapshot.getVersion(),
                expectedVersion);
            return CommandResult.conflict(expectedVersion);
        }

        EventHeader header = new EventHeader(aggregateId, expectedVersion + 1, timestamp(snapshot));
        Event event;
        try {
            event = command.decide(snapshot.getState(), header);
        } catch (DomainRuleViolationException e) {
            logger.debug("Command on {} at version {} violates domain rule: {}", aggregateId, expectedVersion,
                e.getMessage());
            return CommandResult.domainRuleViolation(expectedVersion, e.getMessage());
        }
        if (!header.matches(event)) {
            throw new IllegalStateException("Command " + command + " produced event " + event
                    + " that does not match " + header);
        }

        VersionGate.Transition transition = entry.tryAdvance(expectedVersion);
        if (!transition.isAccepted()) {
            logger.debug("Version gate of {} rejected version {}", aggregateId, expectedVersion);
            return CommandResult.conflict(expectedVersion);
        }
        return commit(entry, snapshot.getState(), event);
    }

    private CommandResult<S> commit(AggregateCache<S> entry, S state, Event event) throws EventStoreException {
        S next;
        try {
            next = conf.aggregateType().apply(state, event);
            conf.eventLog().append(event);
        } catch (EventStoreException e) {
            aggregates.remove(entry.getAggregateId(), entry);
            if (e.getFault() == EventStoreException.Fault.OPTIMISTIC_LOCK) {
                logger.info("Log already contains version {} of {}, evicting stale entry",
                    event.aggregateVersion(), entry.getAggregateId());
                return CommandResult.conflict(event.aggregateVersion() - 1);
            }
            logger.warn("Appending {} failed, evicting {}", event, entry.getAggregateId(), e);
            throw e;
        } catch (RuntimeException e) {
            aggregates.remove(entry.getAggregateId(), entry);
            logger.error("Committing {} failed, evicting {}", event, entry.getAggregateId(), e);
            throw e;
        }
        entry.publish(next, event.getTimestamp());
        logger.debug("{} advanced to version {} by {}", entry.getAggregateId(), next.getVersion(), event.getType());
        return CommandResult.accepted(next, event);
    }

    private AggregateCache<S> recover(UUID aggregateId) {
        EventLog log = conf.eventLog();
        try (EventLog.StoredEvents<? extends Event> events = log.readAll(aggregateId)) {
            ReplayEngine.Progress<S> recovered = replayEngine.replay(aggregateId, events);
            logger.debug("Recovered {} at version {}", aggregateId, recovered.state.getVersion());
            return new AggregateCache<>(recovered.state, recovered.lastTimestamp);
        }
    }

    private Instant timestamp(AggregateCache.Snapshot<S> snapshot) {
        Instant now = conf.clock().instant();
        Instant last = snapshot.getLastTimestamp();
        return last != null && now.isBefore(last) ? last : now;
    }

    @Override
    public String toString() {
        return "SyncSourcingRuntime[" + conf.runtimeName() + ", resident=" + aggregates.size() + "]";
    }
}
