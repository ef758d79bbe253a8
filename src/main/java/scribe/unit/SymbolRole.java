// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package scribe.unit;

/**
 * The role of a declared symbol in data channels.
 */
public enum SymbolRole {
    /**
     * An ordinary symbol: referencing it only makes the referencing unit depend on the declaring unit.
     */
    PLAIN,
    /**
     * A symbol marked with {@code @producer}: units referencing it contribute to the declaring unit's channel.
     */
    PRODUCER,
    /**
     * A symbol marked with {@code @consumer}: units referencing it drain the declaring unit's channel, so they're
     * evaluated after every contributor.
     */
    CONSUMER,
}
