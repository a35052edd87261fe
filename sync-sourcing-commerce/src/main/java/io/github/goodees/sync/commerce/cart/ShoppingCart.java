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

import io.github.goodees.sync.AggregateState;
import org.immutables.value.Value;

import java.math.BigDecimal;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * State of a shopping cart. Customer details are optional, as they are collected while the cart is open.
 */
@Value.Immutable
@Value.Style(get = { "get*", "is*" })
public interface ShoppingCart extends AggregateState {

    CartStatus getStatus();

    List<OrderItem> getItems();

    BigDecimal getTotalAmount();

    /**
     * Items changed since the total was last set.
     */
    boolean isTotalNeedsRecalculation();

    Optional<String> getCustomerName();

    Optional<String> getCustomerEmail();

    Optional<String> getCustomerIdentity();

    boolean isKycVerified();

    Optional<String> getCancellationReason();

    default Optional<OrderItem> findItem(UUID itemId) {
        return getItems().stream().filter(item -> item.getId().equals(itemId)).findFirst();
    }

    /**
     * Sum of price times quantity over all items.
     */
    default BigDecimal itemsTotal() {
        return getItems().stream().map(OrderItem::lineTotal).reduce(BigDecimal.ZERO, BigDecimal::add);
    }
}
