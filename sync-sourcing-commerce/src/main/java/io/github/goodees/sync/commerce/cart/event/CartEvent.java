package io.github.goodees.sync.commerce.cart.event;

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

import io.github.goodees.sync.immutables.ImmutableEvent;

/**
 * Base of all shopping cart events. The set of cart events is closed, every event dispatches itself to
 * {@link Visitor}, so a new event cannot be added without the cart handling it.
 */
public interface CartEvent extends ImmutableEvent {

    <R> R accept(Visitor<R> visitor);

    interface Visitor<R> {
        R visit(CartCreatedEvent event);

        R visit(ItemAddedEvent event);

        R visit(ItemRemovedEvent event);

        R visit(TotalAmountUpdatedEvent event);

        R visit(CartCancelledEvent event);

        R visit(CartClosedEvent event);

        R visit(UserAuthenticatedEvent event);

        R visit(UserInfoCollectedEvent event);

        R visit(UserKycVerifiedEvent event);
    }
}
