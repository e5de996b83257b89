/**
 * Copyright (C) 2026 Hal Hildebrand. All rights reserved.
 *
 * This file is part of the Lamina.
 *
 * This program is free software: you can redistribute it and/or modify it under the terms of the GNU Affero General
 * Public License as published by the Free Software Foundation, either version 3 of the License, or (at your option) any
 * later version.
 *
 * This program is distributed in the hope that it will be useful, but WITHOUT ANY WARRANTY; without even the implied
 * warranty of MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE. See the GNU Affero General Public License for more
 * details.
 *
 * You should have received a copy of the GNU Affero General Public License along with this program. If not, see
 * <http://www.gnu.org/licenses/>.
 */
package com.hellblazer.lamina.entity.event;

import java.util.HashSet;
import java.util.Objects;
import java.util.Set;

/**
 * Ordering constraints for a subscription. A subscription is identified by {@code name}; {@code before} and
 * {@code after} list names of other subscriptions to the same event that it must run ahead of, or behind. Names that
 * match no subscription are ignored.
 *
 * @param name   this subscription's name, may be null for anonymous subscriptions
 * @param before names this subscription must run before
 * @param after  names this subscription must run after
 */
public record SubscriptionOrder(String name, Set<String> before, Set<String> after) {

    public static final SubscriptionOrder NONE = new SubscriptionOrder(null, Set.of(), Set.of());

    public SubscriptionOrder {
        before = Set.copyOf(Objects.requireNonNull(before, "before cannot be null"));
        after = Set.copyOf(Objects.requireNonNull(after, "after cannot be null"));
    }

    public static SubscriptionOrder named(String name) {
        return new SubscriptionOrder(Objects.requireNonNull(name, "name cannot be null"), Set.of(), Set.of());
    }

    public SubscriptionOrder before(String... names) {
        var merged = new HashSet<>(before);
        merged.addAll(Set.of(names));
        return new SubscriptionOrder(name, merged, after);
    }

    public SubscriptionOrder after(String... names) {
        var merged = new HashSet<>(after);
        merged.addAll(Set.of(names));
        return new SubscriptionOrder(name, before, merged);
    }
}
