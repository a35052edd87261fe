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

import io.github.goodees.sync.EventHeader;
import io.github.goodees.sync.commerce.cart.event.CartEvent;
import io.github.goodees.sync.commerce.cart.event.ItemAddedEvent;
import io.github.goodees.sync.commerce.cart.event.UserKycVerifiedEvent;
import io.github.goodees.sync.commerce.product.event.PriceUpdatedEvent;
import org.junit.Test;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

import static org.hamcrest.CoreMatchers.containsString;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNull;

public class CartEventSerializationTest {
    private final CartEventSerialization serialization = new CartEventSerialization();
    private final EventHeader header = new EventHeader(UUID.randomUUID(), 2,
            Instant.parse("2024-03-01T10:15:30.123456Z"));

    @Test
    public void item_is_nested_in_payload() {
        OrderItem item = new OrderItem.Builder()
                .id(UUID.randomUUID())
                .productId("Laptop")
                .quantity(1)
                .price(new BigDecimal("1500.00"))
                .build();
        CartEvent event = new ItemAddedEvent.Builder().from(header).item(item).build();
        String payload = serialization.serialize(event);
        assertThat(payload, containsString("\"type\":\"ItemAdded\""));
        assertThat(payload, containsString("\"productId\":\"Laptop\""));
        assertEquals(event, serialization.deserialize(serialization.payloadVersion(event), payload, "ItemAdded"));
    }

    @Test
    public void boolean_attributes_survive() {
        CartEvent event = new UserKycVerifiedEvent.Builder().from(header).verified(true).riskLevel("LOW").build();
        assertEquals(event, serialization.deserialize(1, serialization.serialize(event), event.getType()));
    }

    @Test
    public void unknown_type_is_not_deserialized() {
        String payload = "{\"type\":\"CartMerged\",\"aggregateId\":\"" + header.aggregateId()
                + "\",\"aggregateVersion\":2,\"timestamp\":\"2024-03-01T10:15:30Z\"}";
        assertNull(serialization.deserialize(1, payload, "CartMerged"));
    }

    @Test
    public void only_cart_events_are_supported() {
        assertNull(serialization.toSerializable(
            new PriceUpdatedEvent.Builder().from(header).newPrice(BigDecimal.ONE).build()));
        assertNull(serialization.toSerializable(header));
    }
}
