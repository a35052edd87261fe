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

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jdk8.Jdk8Module;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import io.github.goodees.sync.store.Serialization;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.Objects;

/**
 * JSON serialization of events of one aggregate, sharing a base interface extending {@link ImmutableEvent}. The
 * type of an event is part of the payload, so the type column of the store is not needed for deserialization.
 *
 * @param <E> base interface of the events
 */
public class JsonEventSerialization<E extends ImmutableEvent> implements Serialization<E> {
    private static final Logger logger = LoggerFactory.getLogger(JsonEventSerialization.class);

    private final Class<E> baseType;
    private final ObjectMapper mapper;

    public JsonEventSerialization(Class<E> baseType) {
        this.baseType = Objects.requireNonNull(baseType, "Base event type must be specified");
        this.mapper = createMapper();
    }

    protected ObjectMapper createMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModules(new Jdk8Module(), new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        return mapper;
    }

    @Override
    public int payloadVersion(E object) {
        return 1;
    }

    @Override
    public String serialize(E object) {
        try {
            return mapper.writeValueAsString(object);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Cannot serialize " + object, e);
        }
    }

    @Override
    public E deserialize(int payloadVersion, String payload, String type) {
        try {
            return mapper.readValue(payload, baseType);
        } catch (IOException | RuntimeException e) {
            logger.error("Cannot deserialize {} event of type {}", baseType.getSimpleName(), type, e);
            return null;
        }
    }

    @Override
    public E toSerializable(Object o) {
        return baseType.isInstance(o) ? baseType.cast(o) : null;
    }
}
