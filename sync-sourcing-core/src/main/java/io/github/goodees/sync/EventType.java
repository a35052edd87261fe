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
 * Naming convention for event types. A type name is the simple class name without the prefix {@code Immutable}
 * generated classes carry and without the suffix {@code Event}, so {@code ImmutableItemAddedEvent} and
 * {@code ItemAddedEvent} both are of type {@code ItemAdded}.
 */
public final class EventType {
    static final String GENERATED_PREFIX = "Immutable";
    static final String SUFFIX = "Event";

    private EventType() {
    }

    public static String of(Class<?> eventClass) {
        return strip(eventClass.getSimpleName(), GENERATED_PREFIX, SUFFIX);
    }

    /**
     * Inverse of {@link #of(Class)} for generated event classes.
     * @param packageName package the events of an aggregate live in
     * @param type the type name
     * @return fully qualified name of the generated implementation
     */
    public static String generatedClassName(String packageName, String type) {
        return packageName + "." + GENERATED_PREFIX + type + SUFFIX;
    }

    static String strip(String simpleClassName, String prefix, String suffix) {
        int start = simpleClassName.startsWith(prefix) && simpleClassName.length() > prefix.length()
                && Character.isUpperCase(simpleClassName.charAt(prefix.length())) ? prefix.length() : 0;
        int end = simpleClassName.endsWith(suffix) && simpleClassName.length() - suffix.length() > start
                ? simpleClassName.length() - suffix.length() : simpleClassName.length();
        return simpleClassName.substring(start, end);
    }
}
