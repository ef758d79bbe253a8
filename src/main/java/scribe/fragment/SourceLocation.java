// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package scribe.fragment;

/**
 * A position in a unit's source file.
 */
public record SourceLocation(String sourceName, int lineNumber) {
    @Override
    public String toString() {
        return "In " + sourceName + ", line " + lineNumber;
    }
}
