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

import io.github.goodees.sync.Command;
import io.github.goodees.sync.CommandResult;
import io.github.goodees.sync.DomainRuleViolationException;
import io.github.goodees.sync.RuntimeConfiguration;
import io.github.goodees.sync.SimpleRuntimeConfiguration;
import io.github.goodees.sync.SyncSourcingRuntime;
import io.github.goodees.sync.commerce.product.event.PriceUpdatedEvent;
import io.github.goodees.sync.store.EventLog;
import io.github.goodees.sync.store.EventStoreException;

import java.math.BigDecimal;
import java.util.Objects;
import java.util.UUID;

/**
 * Price maintenance. Concurrent price updates based on the same version have single winner, the others get a
 * conflict.
 */
public class ProductService {
    private final SyncSourcingRuntime<Product> runtime;

    public ProductService(EventLog eventLog) {
        this(new SimpleRuntimeConfiguration<>(new ProductType(), eventLog));
    }

    public ProductService(RuntimeConfiguration<Product> configuration) {
        this.runtime = new SyncSourcingRuntime<>(configuration);
    }

    public CommandResult<Product> updatePrice(UUID productId, long expectedVersion, BigDecimal newPrice)
            throws EventStoreException {
        return runtime.execute(productId, expectedVersion, updatePrice(newPrice));
    }

    public Product getProduct(UUID productId) {
        return runtime.get(productId);
    }

    public Product rebuildProduct(UUID productId) {
        return runtime.rebuild(productId);
    }

    static Command<Product> updatePrice(BigDecimal newPrice) {
        Objects.requireNonNull(newPrice, "Price must be specified");
        return (product, next) -> {
            if (newPrice.signum() < 0) {
                throw new DomainRuleViolationException("Price must not be negative, was " + newPrice);
            }
            return new PriceUpdatedEvent.Builder().from(next).newPrice(newPrice).build();
        };
    }
}
