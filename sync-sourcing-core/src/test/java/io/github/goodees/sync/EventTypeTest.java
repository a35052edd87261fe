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

import org.junit.Test;

import java.util.UUID;

import static org.junit.Assert.assertEquals;

public class EventTypeTest {

    static class ItemAddedEvent {
    }

    static class ImmutableItemAddedEvent {
    }

    static class Immutables {
    }

    static class Event {
    }

    @Test
    public void generated_prefix_and_suffix_are_stripped() {
        assertEquals("ItemAdded", EventType.of(ItemAddedEvent.class));
        assertEquals("ItemAdded", EventType.of(ImmutableItemAddedEvent.class));
    }

    @Test
    public void prefix_is_stripped_only_before_capital() {
        assertEquals("Immutables", EventType.of(Immutables.class));
    }

    @Test
    public void bare_suffix_is_kept() {
        assertEquals("Event", EventType.of(Event.class));
    }

    @Test
    public void events_without_suffix_use_class_name() {
        assertEquals("Incremented", EventType.of(Counter.Incremented.class));
        assertEquals("Incremented", new Counter.Incremented(UUID.randomUUID(), 1, 1).getType());
    }

    @Test
    public void generated_class_name_is_inverse() {
        assertEquals("io.github.goodees.sync.ImmutableItemAddedEvent",
            EventType.generatedClassName("io.github.goodees.sync", "ItemAdded"));
    }
}
