@ImmutablesSupport
package io.github.goodees.sync.commerce.product.event;

import io.github.goodees.sync.immutables.ImmutablesSupport;
