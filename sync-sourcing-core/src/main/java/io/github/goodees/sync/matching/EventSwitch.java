package io.github.goodees.sync.matching;

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

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.function.BiFunction;

/**
 * Typesafe and boilerplate-free state transition by type of event, for aggregates whose events do not warrant a
 * visitor. The first branch whose class matches the event is applied. Events no branch matches are passed to the
 * fallback, which by default returns the state unchanged.
 *
 * <pre>
 * EventSwitch&lt;Product&gt; transitions = EventSwitch.&lt;Product&gt;builder()
 *         .on(PriceUpdatedEvent.class, (product, e) -&gt; product.withPrice(e.getNewPrice()))
 *         .build();
 * </pre>
 *
 * @param <S> type of state
 */
public class EventSwitch<S> {
    private final List<Branch<S, ?>> branches;
    private final BiFunction<S, Event, S> fallback;

    private EventSwitch(Builder<S> b) {
        this.branches = new ArrayList<>(b.branches);
        this.fallback = b.fallback;
    }

    /**
     * Apply first matching branch.
     * @param state state to transition
     * @param event event to match against
     * @return the result of first matching branch, or of fallback if nothing matches
     */
    public S apply(S state, Event event) {
        for (Branch<S, ?> branch : branches) {
            if (branch.matches(event)) {
                return branch.apply(state, event);
            }
        }
        return fallback.apply(state, event);
    }

    public static <S> Builder<S> builder() {
        return new Builder<>();
    }

    public static class Builder<S> {
        private final List<Branch<S, ?>> branches = new ArrayList<>();
        private BiFunction<S, Event, S> fallback = (state, event) -> state;

        public <T extends Event> Builder<S> on(Class<T> eventClass, BiFunction<S, ? super T, S> transition) {
            branches.add(new Branch<>(eventClass, transition));
            return this;
        }

        public Builder<S> otherwise(BiFunction<S, Event, S> fallback) {
            this.fallback = Objects.requireNonNull(fallback, "Fallback cannot be null");
            return this;
        }

        public EventSwitch<S> build() {
            return new EventSwitch<>(this);
        }
    }

    private static class Branch<S, T extends Event> {
        private final Class<T> eventClass;
        private final BiFunction<S, ? super T, S> transition;

        Branch(Class<T> eventClass, BiFunction<S, ? super T, S> transition) {
            this.eventClass = Objects.requireNonNull(eventClass, "Event class cannot be null");
            this.transition = Objects.requireNonNull(transition, "Transition cannot be null");
        }

        boolean matches(Event event) {
            return eventClass.isInstance(event);
        }

        S apply(S state, Event event) {
            return transition.apply(state, eventClass.cast(event));
        }
    }
}
