package io.github.goodees.sync.commerce.cart;

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

import io.github.goodees.sync.CommandResult;
import io.github.goodees.sync.RuntimeConfiguration;
import io.github.goodees.sync.SimpleRuntimeConfiguration;
import io.github.goodees.sync.SyncSourcingRuntime;
import io.github.goodees.sync.store.EventLog;
import io.github.goodees.sync.store.EventStoreException;

import java.math.BigDecimal;
import java.util.UUID;

/**
 * Operations on shopping carts. Every change takes the version of the cart the caller has read. When the cart has
 * moved on in the meantime, the result is a conflict and the caller should read the cart again.
 */
public class CartService {
    private final SyncSourcingRuntime<ShoppingCart> runtime;

    public CartService(EventLog eventLog) {
        this(new SimpleRuntimeConfiguration<>(new ShoppingCartType(), eventLog));
    }

    public CartService(RuntimeConfiguration<ShoppingCart> configuration) {
        this.runtime = new SyncSourcingRuntime<>(configuration);
    }

    public CommandResult<ShoppingCart> create(UUID cartId, long expectedVersion) throws EventStoreException {
        return runtime.execute(cartId, expectedVersion, CartCommands.create());
    }

    public CommandResult<ShoppingCart> authenticateUser(UUID cartId, long expectedVersion, String userId,
            String fullName, String email) throws EventStoreException {
        return runtime.execute(cartId, expectedVersion, CartCommands.authenticateUser(userId, fullName, email));
    }

    public CommandResult<ShoppingCart> collectUserInfo(UUID cartId, long expectedVersion, String identityNumber,
            String address) throws EventStoreException {
        return runtime.execute(cartId, expectedVersion, CartCommands.collectUserInfo(identityNumber, address));
    }

    public CommandResult<ShoppingCart> verifyKyc(UUID cartId, long expectedVersion, boolean verified,
            String riskLevel) throws EventStoreException {
        return runtime.execute(cartId, expectedVersion, CartCommands.verifyKyc(verified, riskLevel));
    }

    public CommandResult<ShoppingCart> addItem(UUID cartId, long expectedVersion, String productId, int quantity,
            BigDecimal price) throws EventStoreException {
        return runtime.execute(cartId, expectedVersion, CartCommands.addItem(productId, quantity, price));
    }

    public CommandResult<ShoppingCart> removeItem(UUID cartId, long expectedVersion, UUID itemId)
            throws EventStoreException {
        return runtime.execute(cartId, expectedVersion, CartCommands.removeItem(itemId));
    }

    public CommandResult<ShoppingCart> updateTotal(UUID cartId, long expectedVersion, BigDecimal amount)
            throws EventStoreException {
        return runtime.execute(cartId, expectedVersion, CartCommands.updateTotal(amount));
    }

    public CommandResult<ShoppingCart> recalculateTotal(UUID cartId, long expectedVersion)
            throws EventStoreException {
        return runtime.execute(cartId, expectedVersion, CartCommands.recalculateTotal());
    }

    public CommandResult<ShoppingCart> cancel(UUID cartId, long expectedVersion, String reason)
            throws EventStoreException {
        return runtime.execute(cartId, expectedVersion, CartCommands.cancel(reason));
    }

    public CommandResult<ShoppingCart> close(UUID cartId, long expectedVersion) throws EventStoreException {
        return runtime.execute(cartId, expectedVersion, CartCommands.close());
    }

    /**
     * Current state of a cart, as held in memory.
     */
    public ShoppingCart getCart(UUID cartId) {
        return runtime.get(cartId);
    }

    /**
     * State of a cart replayed from the event log, without touching the cached state.
     */
    public ShoppingCart rebuildCart(UUID cartId) {
        return runtime.rebuild(cartId);
    }

    SyncSourcingRuntime<ShoppingCart> runtime() {
        return runtime;
    }
}
