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

import com.fasterxml.jackson.databind.type.TypeFactory;
import io.github.goodees.sync.EventHeader;
import io.github.goodees.sync.immutables.events.AccountClosedEvent;
import io.github.goodees.sync.immutables.events.AccountEvent;
import io.github.goodees.sync.immutables.events.DepositedEvent;
import org.junit.Before;
import org.junit.Test;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;

public class ImmutableEventTypeResolverTest {

    private ImmutableEventTypeResolver resolver;
    private TypeFactory tf;

    @Before
    public void setUp() {
        resolver = new ImmutableEventTypeResolver();
        tf = TypeFactory.defaultInstance();
        resolver.init(tf.constructType(AccountEvent.class));
    }

    @Test
    public void type_id_generated_for_supported_types() {
        DepositedEvent event = new DepositedEvent.Builder()
                .from(new EventHeader(UUID.randomUUID(), 1, Instant.now()))
                .amount(BigDecimal.TEN)
                .build();
        assertEquals("Deposited", resolver.idFromValueAndType(event, DepositedEvent.class));
        assertEquals("Deposited", resolver.idFromValue(event));
    }

    @Test(expected = IllegalArgumentException.class)
    public void type_id_generation_fails_on_unsupported_types() {
        resolver.idFromValue(13);
    }

    @Test(expected = IllegalArgumentException.class)
    public void type_id_generation_fails_on_non_event_type() {
        DepositedEvent event = new DepositedEvent.Builder()
                .from(new EventHeader(UUID.randomUUID(), 1, Instant.now()))
                .amount(BigDecimal.TEN)
                .build();
        resolver.idFromValueAndType(event, String.class);
    }

    @Test
    public void class_is_instantiated_for_supported_types() {
        assertTrue(DepositedEvent.class.isAssignableFrom(resolver.typeFromId("Deposited", tf).getRawClass()));
        assertTrue(AccountClosedEvent.class.isAssignableFrom(resolver.typeFromId("AccountClosed", tf)
                .getRawClass()));
    }

    @Test(expected = IllegalStateException.class)
    public void unknown_type_id_fails() {
        resolver.typeFromId("Withdrawn", tf);
    }
}
