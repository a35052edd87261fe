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
 * Intent to change an aggregate. The command validates the intent against the state it is given, and describes the
 * change as single event. It must not have any side effects, as it may be called with state that is already stale;
 * in such case the event it produced is discarded.
 *
 * @param <S> type of aggregate state
 */
@FunctionalInterface
public interface Command<S extends AggregateState> {

    /**
     * Decide on the event.
     * @param state state the decision is based on
     * @param next the metadata the produced event must carry
     * @return event with aggregate id and version of {@code next}
     * @throws DomainRuleViolationException when the intent is not valid for the state
     */
    Event decide(S state, EventHeader next) throws DomainRuleViolationException;
}
