/**
 * Events of the shopping cart. All of them implement {@link io.github.goodees.sync.commerce.cart.event.CartEvent}
 * and are serialized to JSON with their type name.
 */
@ImmutablesSupport
package io.github.goodees.sync.commerce.cart.event;

import io.github.goodees.sync.immutables.ImmutablesSupport;
