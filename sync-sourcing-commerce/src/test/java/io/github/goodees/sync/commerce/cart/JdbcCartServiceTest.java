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
import io.github.goodees.sync.store.jdbc.DefaultJdbcSchema;
import io.github.goodees.sync.store.jdbc.JdbcEventLog;
import org.h2.jdbcx.JdbcDataSource;
import org.junit.AfterClass;
import org.junit.Before;
import org.junit.BeforeClass;
import org.junit.Test;
import org.springframework.jdbc.core.JdbcTemplate;

import java.math.BigDecimal;
import java.util.List;
import java.util.UUID;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;

/**
 * Carts stored as JSON in H2.
 */
public class JdbcCartServiceTest {
    private static JdbcDataSource ds;
    private static JdbcTemplate template;

    private final UUID cartId = UUID.randomUUID();
    private JdbcEventLog<?> eventLog;
    private CartService service;

    @BeforeClass
    public static void initDb() {
        ds = new JdbcDataSource();
        ds.setURL("jdbc:h2:mem:commerce;DB_CLOSE_DELAY=-1");
        ds.setUser("sa");
        template = new JdbcTemplate(ds);
        template.execute("create table cart_event (ID varchar, VERSION int, TIMESTAMP timestamp, TYPE varchar, "
                + "PAYLOAD_VERSION int, PAYLOAD clob, primary key (ID, VERSION))");
        template.execute("create table cart_version (ID varchar primary key, VERSION int)");
    }

    @AfterClass
    public static void dropDb() {
        template.execute("drop table cart_event");
        template.execute("drop table cart_version");
    }

    @Before
    public void setUp() {
        eventLog = newEventLog();
        service = new CartService(eventLog);
    }

    JdbcEventLog<?> newEventLog() {
        return new JdbcEventLog<>(ds, new DefaultJdbcSchema("cart_event", "cart_version"),
                new CartEventSerialization(), true, JdbcEventLog.TxHandler.LOCAL);
    }

    @Test
    public void events_are_stored_with_their_type() throws Exception {
        service.create(cartId, 0);
        service.addItem(cartId, 1, "A", 1, new BigDecimal("100.00"));
        List<String> types = template.queryForList("select type from cart_event where id = ? order by version",
            String.class, cartId.toString());
        assertEquals(2, types.size());
        assertEquals("CartCreated", types.get(0));
        assertEquals("ItemAdded", types.get(1));
        assertEquals(2, eventLog.lastVersion(cartId));
    }

    @Test
    public void cart_is_recovered_from_database() throws Exception {
        service.create(cartId, 0);
        service.authenticateUser(cartId, 1, "user_123", "Jane Doe", "jane@example.com");
        CommandResult<ShoppingCart> addA = service.addItem(cartId, 2, "A", 1, new BigDecimal("100.00"));
        service.addItem(cartId, 3, "B", 1, new BigDecimal("50.00"));
        service.recalculateTotal(cartId, 4);
        service.verifyKyc(cartId, 5, true, "LOW");
        ShoppingCart cached = service.removeItem(cartId, 6, CartServiceTest.itemId(addA)).getState();

        assertEquals(cached, service.rebuildCart(cartId));
        CartService restarted = new CartService(newEventLog());
        assertEquals(cached, restarted.getCart(cartId));
        assertEquals(new BigDecimal("150.00"), restarted.getCart(cartId).getTotalAmount());
    }

    @Test
    public void write_of_other_instance_is_conflict() throws Exception {
        service.create(cartId, 0);
        CartService other = new CartService(newEventLog());
        assertEquals(1, other.getCart(cartId).getVersion());

        assertTrue(service.addItem(cartId, 1, "A", 1, BigDecimal.TEN).isAccepted());
        CommandResult<ShoppingCart> stale = other.addItem(cartId, 1, "B", 1, BigDecimal.ONE);
        assertTrue(stale.isConflict());
        assertEquals(1, stale.getAttemptedVersion());

        ShoppingCart recovered = other.getCart(cartId);
        assertEquals(2, recovered.getVersion());
        assertEquals("A", recovered.getItems().get(0).getProductId());
        assertTrue(other.addItem(cartId, 2, "B", 1, BigDecimal.ONE).isAccepted());
    }
}
