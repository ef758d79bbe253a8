// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later

/**
 * Units: the source files of a project, split into literal text and fragments, with the symbols they declare and
 * reference.
 */
@ParametersAreNonnullByDefault
package scribe.unit;

import javax.annotation.ParametersAreNonnullByDefault;
