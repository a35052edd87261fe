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

import io.github.goodees.sync.EventHeader;
import io.github.goodees.sync.commerce.product.event.PriceUpdatedEvent;
import io.github.goodees.sync.commerce.product.event.ProductEvent;
import org.junit.Test;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

import static org.junit.Assert.assertEquals;

public class ProductEventSerializationTest {
    private final ProductEventSerialization serialization = new ProductEventSerialization();

    @Test
    public void price_update_is_read_back() {
        ProductEvent event = new PriceUpdatedEvent.Builder()
                .from(new EventHeader(UUID.randomUUID(), 7, Instant.parse("2024-03-01T10:15:30Z")))
                .newPrice(new BigDecimal("1499.90"))
                .build();
        ProductEvent read = serialization.deserialize(1, serialization.serialize(event), "PriceUpdated");
        assertEquals(event, read);
        assertEquals("PriceUpdated", read.getType());
    }
}
