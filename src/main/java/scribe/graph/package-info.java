// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later

/**
 * The project-wide view of units: the symbol table, the dependency graph between units and the order units are
 * evaluated in.
 */
@ParametersAreNonnullByDefault
package scribe.graph;

import javax.annotation.ParametersAreNonnullByDefault;
