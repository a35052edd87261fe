package io.github.goodees.sync.commerce.product;

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

import io.github.goodees.sync.AggregateState;
import org.immutables.value.Value;

import java.math.BigDecimal;

/**
 * Priced product. A product without history costs nothing.
 */
@Value.Immutable
@Value.Style(get = { "get*", "is*" })
public interface Product extends AggregateState {
    BigDecimal getPrice();
}
