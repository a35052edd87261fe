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

import io.github.goodees.sync.Event;
import io.github.goodees.sync.EventHeader;
import io.github.goodees.sync.ReplayEngine;
import io.github.goodees.sync.commerce.cart.event.CartCancelledEvent;
import io.github.goodees.sync.commerce.cart.event.CartCreatedEvent;
import io.github.goodees.sync.commerce.cart.event.CartEvent;
import io.github.goodees.sync.commerce.cart.event.ItemAddedEvent;
import io.github.goodees.sync.commerce.product.event.PriceUpdatedEvent;
import org.junit.Test;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.Arrays;
import java.util.List;
import java.util.UUID;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNotEquals;
import static org.junit.Assert.assertTrue;

public class ShoppingCartTypeTest {
    private final UUID cartId = UUID.randomUUID();
    private final ShoppingCartType type = new ShoppingCartType();

    EventHeader header(long version) {
        return new EventHeader(cartId, version, Instant.now());
    }

    OrderItem item(String productId) {
        return new OrderItem.Builder()
                .id(UUID.randomUUID())
                .productId(productId)
                .quantity(3)
                .price(new BigDecimal("2.50"))
                .build();
    }

    @Test
    public void created_cart_is_open_and_empty() {
        ShoppingCart cart = type.apply(type.initialState(cartId),
            new CartCreatedEvent.Builder().from(header(1)).build());
        assertEquals(CartStatus.OPEN, cart.getStatus());
        assertEquals(1, cart.getVersion());
        assertTrue(cart.getItems().isEmpty());
    }

    @Test
    public void item_total_is_price_times_quantity() {
        OrderItem item = item("A");
        assertEquals(new BigDecimal("7.50"), item.lineTotal());
        ShoppingCart cart = type.apply(type.initialState(cartId),
            new ItemAddedEvent.Builder().from(header(1)).item(item).build());
        assertEquals(new BigDecimal("7.50"), cart.itemsTotal());
        assertEquals(item, cart.findItem(item.getId()).get());
    }

    @Test
    public void foreign_event_kind_only_advances_version() {
        ShoppingCart created = type.apply(type.initialState(cartId),
            new CartCreatedEvent.Builder().from(header(1)).build());
        ShoppingCart after = type.apply(created,
            new PriceUpdatedEvent.Builder().from(header(2)).newPrice(BigDecimal.ONE).build());
        assertEquals(2, after.getVersion());
        assertEquals(ImmutableShoppingCart.copyOf(created).withVersion(2), after);
    }

    @Test
    public void replay_folds_cart_history() {
        List<CartEvent> history = Arrays.asList(
            new CartCreatedEvent.Builder().from(header(1)).build(),
            new ItemAddedEvent.Builder().from(header(2)).item(item("A")).build(),
            new CartCancelledEvent.Builder().from(header(3)).reason("duplicate").build());
        ShoppingCart cart = new ReplayEngine<>(type).rebuild(cartId, history);
        assertEquals(3, cart.getVersion());
        assertEquals(CartStatus.CANCELLED, cart.getStatus());
        assertEquals(1, cart.getItems().size());
        assertEquals("duplicate", cart.getCancellationReason().get());
    }

    @Test
    public void adding_item_decides_same_event_for_same_state() throws Exception {
        ShoppingCart open = type.apply(type.initialState(cartId),
            new CartCreatedEvent.Builder().from(header(1)).build());
        EventHeader next = header(2);
        Event first = CartCommands.addItem("A", 1, new BigDecimal("100.00")).decide(open, next);
        Event second = CartCommands.addItem("A", 1, new BigDecimal("100.00")).decide(open, next);
        assertEquals(first, second);

        ShoppingCart withItem = type.apply(open, first);
        Event other = CartCommands.addItem("A", 1, new BigDecimal("100.00")).decide(withItem, header(3));
        assertNotEquals(((ItemAddedEvent) first).getItem().getId(), ((ItemAddedEvent) other).getItem().getId());
    }
}
