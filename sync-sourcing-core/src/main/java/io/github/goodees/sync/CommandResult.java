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

/**
 * Outcome of command execution. Conflicts and domain rule violations are ordinary results, not errors.
 *
 * @param <S> type of aggregate state
 */
public final class CommandResult<S extends AggregateState> {

    public enum Outcome {
        /**
         * The event was appended and the state updated.
         */
        ACCEPTED,
        /**
         * The state the command was based on was stale. Caller should read the state again and retry.
         */
        CONFLICT,
        /**
         * The command is not valid for the state of the aggregate.
         */
        DOMAIN_RULE_VIOLATION
    }

    private final Outcome outcome;
    private final long attemptedVersion;
    private final S state;
    private final Event event;
    private final String reason;

    private CommandResult(Outcome outcome, long attemptedVersion, S state, Event event, String reason) {
        this.outcome = outcome;
        this.attemptedVersion = attemptedVersion;
        this.state = state;
        this.event = event;
        this.reason = reason;
    }

    static <S extends AggregateState> CommandResult<S> accepted(S state, Event event) {
        return new CommandResult<>(Outcome.ACCEPTED, event.aggregateVersion() - 1, state, event, null);
    }

    static <S extends AggregateState> CommandResult<S> conflict(long attemptedVersion) {
        return new CommandResult<>(Outcome.CONFLICT, attemptedVersion, null, null, null);
    }

    static <S extends AggregateState> CommandResult<S> domainRuleViolation(long attemptedVersion, String reason) {
        return new CommandResult<>(Outcome.DOMAIN_RULE_VIOLATION, attemptedVersion, null, null, reason);
    }

    public Outcome getOutcome() {
        return outcome;
    }

    public boolean isAccepted() {
        return outcome == Outcome.ACCEPTED;
    }

    public boolean isConflict() {
        return outcome == Outcome.CONFLICT;
    }

    public boolean isDomainRuleViolation() {
        return outcome == Outcome.DOMAIN_RULE_VIOLATION;
    }

    /**
     * The version the command was based on.
     * @return expected version presented to the gate
     */
    public long getAttemptedVersion() {
        return attemptedVersion;
    }

    /**
     * @return the new state
     * @throws IllegalStateException when command was not accepted
     */
    public S getState() {
        requireAccepted();
        return state;
    }

    /**
     * @return the appended event
     * @throws IllegalStateException when command was not accepted
     */
    public Event getEvent() {
        requireAccepted();
        return event;
    }

    /**
     * @return reason of domain rule violation, null for other outcomes
     */
    public String getReason() {
        return reason;
    }

    private void requireAccepted() {
        if (outcome != Outcome.ACCEPTED) {
            throw new IllegalStateException("Command was not accepted: " + this);
        }
    }

    @Override
    public String toString() {
        switch (outcome) {
            case ACCEPTED:
                return "Accepted{" + state + "}";
            case CONFLICT:
                return "Conflict{attemptedVersion=" + attemptedVersion + "}";
            default:
                return "DomainRuleViolation{attemptedVersion=" + attemptedVersion + ", reason=" + reason + "}";
        }
    }
}
