package io.github.goodees.sync.immutables;

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

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jdk8.Jdk8Module;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import io.github.goodees.sync.EventHeader;
import io.github.goodees.sync.immutables.events.AccountClosedEvent;
import io.github.goodees.sync.immutables.events.AccountEvent;
import io.github.goodees.sync.immutables.events.DepositedEvent;
import org.junit.Test;

import java.io.IOException;
import java.math.BigDecimal;
import java.time.Instant;
import java.util.Iterator;
import java.util.UUID;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

public class ImmutableEventTest {
    private final EventHeader header = new EventHeader(UUID.fromString("9a1c2e3f-0000-4000-8000-000000000001"), 3,
            Instant.parse("2017-11-13T20:18:40.439Z"));

    ObjectMapper createMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModules(new Jdk8Module(), new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        return mapper;
    }

    @Test
    public void builder_copies_header() {
        AccountClosedEvent event = new AccountClosedEvent.Builder().from(header).reason("moved away").build();
        assertTrue(header.matches(event));
        assertEquals(header.getTimestamp(), event.getTimestamp());
        assertEquals("AccountClosed", event.getType());
    }

    @Test
    public void type_and_key_values_lead_the_json() throws IOException {
        DepositedEvent event = new DepositedEvent.Builder().from(header).amount(new BigDecimal("12.5")).build();
        JsonNode json = createMapper().readTree(createMapper().writeValueAsString(event));
        Iterator<String> fields = json.fieldNames();
        assertEquals("type", fields.next());
        assertEquals("aggregateId", fields.next());
        assertEquals("aggregateVersion", fields.next());
        assertEquals("timestamp", fields.next());
        assertEquals("Deposited", json.get("type").asText());
        assertFalse("absent optional is omitted", json.has("reference"));
    }

    @Test
    public void events_deserialize_from_json() throws IOException {
        String json = "{\n"
                + "  \"type\" : \"Deposited\",\n"
                + "  \"aggregateId\" : \"9a1c2e3f-0000-4000-8000-000000000001\",\n"
                + "  \"aggregateVersion\" : 3,\n"
                + "  \"timestamp\" : \"2017-11-13T20:18:40.439Z\",\n"
                + "  \"amount\" : 12.5,\n"
                + "  \"note\" : \"added in later release\"\n"
                + "}";
        AccountEvent event = createMapper().readValue(json, AccountEvent.class);
        assertTrue(event instanceof DepositedEvent);
        assertTrue(header.matches(event));
        assertEquals(0, new BigDecimal("12.5").compareTo(((DepositedEvent) event).getAmount()));
        assertFalse(((DepositedEvent) event).getReference().isPresent());
    }

    @Test
    public void events_survive_serialization() throws IOException {
        ObjectMapper mapper = createMapper();
        AccountEvent event = new DepositedEvent.Builder().from(header)
                .amount(new BigDecimal("12.5"))
                .reference("INV-2017-23")
                .build();
        assertEquals(event, mapper.readValue(mapper.writeValueAsString(event), AccountEvent.class));
    }
}
