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

import com.fasterxml.jackson.annotation.JsonTypeInfo;
import com.fasterxml.jackson.databind.DatabindContext;
import com.fasterxml.jackson.databind.JavaType;
import com.fasterxml.jackson.databind.jsontype.impl.TypeIdResolverBase;
import com.fasterxml.jackson.databind.type.TypeFactory;
import io.github.goodees.sync.Event;
import io.github.goodees.sync.EventType;

/**
 * Jackson type id resolver for the events of one aggregate. The id written to JSON is {@link Event#getType()}, and
 * reading it back looks the generated class up in the package of the aggregate's base event interface, so every
 * event of an aggregate lives next to its base interface and is named {@code <Type>Event}.
 */
public class ImmutableEventTypeResolver extends TypeIdResolverBase {

    private String eventPackage;

    @Override
    public void init(JavaType baseType) {
        this.eventPackage = baseType.getRawClass().getPackage().getName();
    }

    @Override
    public JavaType typeFromId(DatabindContext context, String id) {
        return typeFromId(id, context.getTypeFactory());
    }

    JavaType typeFromId(String id, TypeFactory typeFactory) {
        String className = EventType.generatedClassName(eventPackage, id);
        try {
            return typeFactory.constructType(typeFactory.findClass(className));
        } catch (ClassNotFoundException ex) {
            throw new IllegalStateException("No event class " + className + " for type " + id, ex);
        }
    }

    @Override
    public String idFromValue(Object value) {
        return typeOf(value);
    }

    @Override
    public String idFromValueAndType(Object value, Class<?> suggestedType) {
        if (suggestedType != null && !ImmutableEvent.class.isAssignableFrom(suggestedType)) {
            throw new IllegalArgumentException(suggestedType.getName() + " is not an ImmutableEvent");
        }
        return typeOf(value);
    }

    private static String typeOf(Object value) {
        if (!(value instanceof ImmutableEvent)) {
            throw new IllegalArgumentException("Cannot resolve event type of " + value);
        }
        return ((Event) value).getType();
    }

    @Override
    public JsonTypeInfo.Id getMechanism() {
        return JsonTypeInfo.Id.CUSTOM;
    }
}
