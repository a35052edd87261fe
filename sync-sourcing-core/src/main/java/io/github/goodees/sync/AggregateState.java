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

import java.util.UUID;

/**
 * Materialized state of single aggregate instance. Implementations are immutable values with field-by-field
 * {@code equals}, so that state obtained by replay can be compared to state maintained by the runtime.
 */
public interface AggregateState {

    UUID getId();

    /**
     * The version of the last event applied to this state.
     * @return version, 0 for the state no event was applied to yet
     */
    long getVersion();
}
