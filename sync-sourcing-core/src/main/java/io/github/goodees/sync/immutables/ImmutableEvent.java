package io.github.goodees.sync.immutables;

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

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.fasterxml.jackson.annotation.JsonTypeInfo;
import com.fasterxml.jackson.databind.annotation.JsonTypeIdResolver;
import io.github.goodees.sync.Event;
import io.github.goodees.sync.EventType;

/**
 * Base interface for aggregate events using <a href="http://immutables.github.io">Immutables library</a>.
 * An aggregate that wants to use this approach for event serialization defines its base interface of events, that
 * extends ImmutableEvent.
 * <p><strong>All events of an aggregate need to be defined in same package!</strong>
 * <p>The package they reside in must have annotation {@link ImmutablesSupport} in its {@code package-info.java}.
 * Every event then declares nested {@code Builder} extending the generated one, and builds from the header it
 * is given by the runtime:
 * <pre>
 * new ItemAddedEvent.Builder().from(header).item(item).build()
 * </pre>
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.CUSTOM, include = JsonTypeInfo.As.PROPERTY, property = "type")
@JsonTypeIdResolver(ImmutableEventTypeResolver.class)
// allow for future changes in an event
@JsonIgnoreProperties(ignoreUnknown = true)
// Put key values at the front
@JsonPropertyOrder({ "aggregateId", "aggregateVersion", "timestamp" })
@JsonInclude(JsonInclude.Include.NON_ABSENT)
public interface ImmutableEvent extends Event {

    @Override
    @JsonIgnore
    // type property is written by resolver, and requires default naming scheme
    default String getType() {
        return EventType.of(getClass());
    }

}
