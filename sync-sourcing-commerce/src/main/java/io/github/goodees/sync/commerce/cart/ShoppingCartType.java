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

import io.github.goodees.sync.AggregateType;
import io.github.goodees.sync.Event;
import io.github.goodees.sync.commerce.cart.event.CartCancelledEvent;
import io.github.goodees.sync.commerce.cart.event.CartClosedEvent;
import io.github.goodees.sync.commerce.cart.event.CartCreatedEvent;
import io.github.goodees.sync.commerce.cart.event.CartEvent;
import io.github.goodees.sync.commerce.cart.event.ItemAddedEvent;
import io.github.goodees.sync.commerce.cart.event.ItemRemovedEvent;
import io.github.goodees.sync.commerce.cart.event.TotalAmountUpdatedEvent;
import io.github.goodees.sync.commerce.cart.event.UserAuthenticatedEvent;
import io.github.goodees.sync.commerce.cart.event.UserInfoCollectedEvent;
import io.github.goodees.sync.commerce.cart.event.UserKycVerifiedEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.UUID;

import static java.util.stream.Collectors.toList;

/**
 * Shopping cart aggregate. Its fold is a {@link CartEvent.Visitor}.
 */
public class ShoppingCartType extends AggregateType<ShoppingCart> {
    private static final Logger logger = LoggerFactory.getLogger(ShoppingCartType.class);

    public ShoppingCartType() {
        super("ShoppingCart");
    }

    @Override
    public ShoppingCart initialState(UUID aggregateId) {
        return ImmutableShoppingCart.builder()
                .id(aggregateId)
                .version(0)
                .status(CartStatus.UNINITIALIZED)
                .totalAmount(BigDecimal.ZERO)
                .totalNeedsRecalculation(false)
                .kycVerified(false)
                .build();
    }

    @Override
    protected ShoppingCart updateState(ShoppingCart state, Event event) {
        if (event instanceof CartEvent) {
            return ((CartEvent) event).accept(new Transition(state));
        }
        logger.warn("Cart {} passes unknown event {} through", state.getId(), event);
        return state;
    }

    @Override
    protected ShoppingCart withVersion(ShoppingCart state, long version) {
        return ImmutableShoppingCart.copyOf(state).withVersion(version);
    }

    static class Transition implements CartEvent.Visitor<ShoppingCart> {
        private final ImmutableShoppingCart cart;

        Transition(ShoppingCart cart) {
            this.cart = ImmutableShoppingCart.copyOf(cart);
        }

        @Override
        public ShoppingCart visit(CartCreatedEvent event) {
            return cart.withStatus(CartStatus.OPEN)
                    .withItems(Collections.<OrderItem>emptyList())
                    .withTotalAmount(BigDecimal.ZERO)
                    .withTotalNeedsRecalculation(false);
        }

        @Override
        public ShoppingCart visit(ItemAddedEvent event) {
            List<OrderItem> items = new ArrayList<>(cart.getItems());
            items.add(event.getItem());
            return cart.withItems(items).withTotalNeedsRecalculation(true);
        }

        @Override
        public ShoppingCart visit(ItemRemovedEvent event) {
            List<OrderItem> items = cart.getItems().stream()
                    .filter(item -> !item.getId().equals(event.getItemId()))
                    .collect(toList());
            return cart.withItems(items).withTotalNeedsRecalculation(true);
        }

        @Override
        public ShoppingCart visit(TotalAmountUpdatedEvent event) {
            return cart.withTotalAmount(event.getAmount()).withTotalNeedsRecalculation(false);
        }

        @Override
        public ShoppingCart visit(CartCancelledEvent event) {
            return cart.withStatus(CartStatus.CANCELLED).withCancellationReason(event.getReason());
        }

        @Override
        public ShoppingCart visit(CartClosedEvent event) {
            return cart.withStatus(CartStatus.CLOSED);
        }

        @Override
        public ShoppingCart visit(UserAuthenticatedEvent event) {
            return cart.withCustomerName(event.getFullName()).withCustomerEmail(event.getEmail());
        }

        @Override
        public ShoppingCart visit(UserInfoCollectedEvent event) {
            return cart.withCustomerIdentity(event.getIdentityNumber());
        }

        @Override
        public ShoppingCart visit(UserKycVerifiedEvent event) {
            return cart.withKycVerified(event.isVerified());
        }
    }
}
