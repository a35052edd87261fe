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

import io.github.goodees.sync.AggregateType;
import io.github.goodees.sync.Event;
import io.github.goodees.sync.commerce.product.event.PriceUpdatedEvent;
import io.github.goodees.sync.matching.EventSwitch;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.util.UUID;

public class ProductType extends AggregateType<Product> {
    private static final Logger logger = LoggerFactory.getLogger(ProductType.class);

    private final EventSwitch<Product> transitions = EventSwitch.<Product>builder()
            .on(PriceUpdatedEvent.class, (product, e) -> ImmutableProduct.copyOf(product).withPrice(e.getNewPrice()))
            .otherwise((product, e) -> {
                logger.warn("Product {} passes unknown event {} through", product.getId(), e);
                return product;
            })
            .build();

    public ProductType() {
        super("Product");
    }

    @Override
    public Product initialState(UUID aggregateId) {
        return ImmutableProduct.builder().id(aggregateId).version(0).price(BigDecimal.ZERO).build();
    }

    @Override
    protected Product updateState(Product state, Event event) {
        return transitions.apply(state, event);
    }

    @Override
    protected Product withVersion(Product state, long version) {
        return ImmutableProduct.copyOf(state).withVersion(version);
    }
}
