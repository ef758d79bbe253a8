// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package scribe.fragment;

import java.util.List;

/**
 * A parsed fragment: the top-level statements, and the name of the source they came from.
 */
public record Program(String sourceName, List<Statement> body) {
}
