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

import io.github.goodees.sync.Command;
import io.github.goodees.sync.DomainRuleViolationException;
import io.github.goodees.sync.Event;
import io.github.goodees.sync.commerce.cart.event.CartCancelledEvent;
import io.github.goodees.sync.commerce.cart.event.CartClosedEvent;
import io.github.goodees.sync.commerce.cart.event.CartCreatedEvent;
import io.github.goodees.sync.commerce.cart.event.ItemAddedEvent;
import io.github.goodees.sync.commerce.cart.event.ItemRemovedEvent;
import io.github.goodees.sync.commerce.cart.event.TotalAmountUpdatedEvent;
import io.github.goodees.sync.commerce.cart.event.UserAuthenticatedEvent;
import io.github.goodees.sync.commerce.cart.event.UserInfoCollectedEvent;
import io.github.goodees.sync.commerce.cart.event.UserKycVerifiedEvent;

import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;
import java.util.Objects;
import java.util.UUID;

/**
 * Commands of the shopping cart. Each checks the rules of the cart against the state it is given and decides on
 * single event.
 */
public final class CartCommands {
    static final String RECALCULATED = "Recalculated based on items";
    static final String SET_BY_CALLER = "Set by caller";

    private CartCommands() {
    }

    public static Command<ShoppingCart> create() {
        return (cart, next) -> {
            if (cart.getStatus() != CartStatus.UNINITIALIZED) {
                throw new DomainRuleViolationException("Cart " + cart.getId() + " already exists");
            }
            return new CartCreatedEvent.Builder().from(next).build();
        };
    }

    public static Command<ShoppingCart> authenticateUser(String userId, String fullName, String email) {
        Objects.requireNonNull(fullName, "Full name must be specified");
        Objects.requireNonNull(email, "Email must be specified");
        return (cart, next) -> {
            requireOpen(cart);
            if (userId == null || userId.trim().isEmpty()) {
                throw new DomainRuleViolationException("User id must not be empty");
            }
            return new UserAuthenticatedEvent.Builder().from(next)
                    .userId(userId)
                    .fullName(fullName)
                    .email(email)
                    .build();
        };
    }

    public static Command<ShoppingCart> collectUserInfo(String identityNumber, String address) {
        Objects.requireNonNull(identityNumber, "Identity number must be specified");
        Objects.requireNonNull(address, "Address must be specified");
        return (cart, next) -> {
            requireOpen(cart);
            return new UserInfoCollectedEvent.Builder().from(next)
                    .identityNumber(identityNumber)
                    .address(address)
                    .build();
        };
    }

    public static Command<ShoppingCart> verifyKyc(boolean verified, String riskLevel) {
        Objects.requireNonNull(riskLevel, "Risk level must be specified");
        return (cart, next) -> {
            requireOpen(cart);
            return new UserKycVerifiedEvent.Builder().from(next).verified(verified).riskLevel(riskLevel).build();
        };
    }

    /**
     * Add an item. Its id is derived from the cart and the version the event is written to, so deciding again on
     * the same state yields the same item. The id can be read from the resulting {@link ItemAddedEvent}.
     */
    public static Command<ShoppingCart> addItem(String productId, int quantity, BigDecimal price) {
        Objects.requireNonNull(productId, "Product id must be specified");
        Objects.requireNonNull(price, "Price must be specified");
        return (cart, next) -> {
            requireOpen(cart);
            if (quantity <= 0) {
                throw new DomainRuleViolationException("Quantity must be positive, was " + quantity);
            }
            requireNonNegative("Price", price);
            OrderItem item = new OrderItem.Builder()
                    .id(itemId(next))
                    .productId(productId)
                    .quantity(quantity)
                    .price(price)
                    .build();
            return new ItemAddedEvent.Builder().from(next).item(item).build();
        };
    }

    public static Command<ShoppingCart> removeItem(UUID itemId) {
        Objects.requireNonNull(itemId, "Item id must be specified");
        return (cart, next) -> {
            requireOpen(cart);
            if (!cart.findItem(itemId).isPresent()) {
                throw new DomainRuleViolationException("Cart " + cart.getId() + " has no item " + itemId);
            }
            return new ItemRemovedEvent.Builder().from(next).itemId(itemId).build();
        };
    }

    public static Command<ShoppingCart> updateTotal(BigDecimal amount) {
        Objects.requireNonNull(amount, "Amount must be specified");
        return (cart, next) -> {
            requireOpen(cart);
            requireNonNegative("Total amount", amount);
            return new TotalAmountUpdatedEvent.Builder().from(next).amount(amount).message(SET_BY_CALLER).build();
        };
    }

    public static Command<ShoppingCart> recalculateTotal() {
        return (cart, next) -> {
            requireOpen(cart);
            return new TotalAmountUpdatedEvent.Builder().from(next)
                    .amount(cart.itemsTotal())
                    .message(RECALCULATED)
                    .build();
        };
    }

    public static Command<ShoppingCart> cancel(String reason) {
        Objects.requireNonNull(reason, "Reason must be specified");
        return (cart, next) -> {
            requireOpen(cart);
            return new CartCancelledEvent.Builder().from(next).reason(reason).build();
        };
    }

    public static Command<ShoppingCart> close() {
        return (cart, next) -> {
            requireOpen(cart);
            if (cart.isTotalNeedsRecalculation()) {
                throw new DomainRuleViolationException("Total of cart " + cart.getId() + " needs recalculation");
            }
            return new CartClosedEvent.Builder().from(next).build();
        };
    }

    static UUID itemId(Event next) {
        String name = next.aggregateId() + ":" + next.aggregateVersion();
        return UUID.nameUUIDFromBytes(name.getBytes(StandardCharsets.UTF_8));
    }

    static void requireOpen(ShoppingCart cart) throws DomainRuleViolationException {
        if (cart.getStatus() != CartStatus.OPEN) {
            throw new DomainRuleViolationException("Cart " + cart.getId() + " is " + cart.getStatus());
        }
    }

    static void requireNonNegative(String what, BigDecimal value) throws DomainRuleViolationException {
        if (value.signum() < 0) {
            throw new DomainRuleViolationException(what + " must not be negative, was " + value);
        }
    }
}
