// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package scribe.graph;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;
import scribe.unit.Unit;

/**
 * The participants of the channel of a unit declaring producer or consumer symbols.
 * <p>
 * Producers are the units referencing one of the owner's producer symbols, consumers those referencing one of its
 * consumer symbols. Every consumer is evaluated after every producer, even though they never reference each other.
 */
public final class DataChannel {
    DataChannel(final Unit owner) {
        this.owner = owner;
    }

    public Unit owner() {
        return owner;
    }

    public Set<Unit> producers() {
        return Collections.unmodifiableSet(producers);
    }

    public Set<Unit> consumers() {
        return Collections.unmodifiableSet(consumers);
    }

    void addProducer(final Unit unit) {
        producers.add(unit);
    }

    void addConsumer(final Unit unit) {
        consumers.add(unit);
    }

    private final Unit owner;
    private final LinkedHashSet<Unit> producers = new LinkedHashSet<>();
    private final LinkedHashSet<Unit> consumers = new LinkedHashSet<>();
}
