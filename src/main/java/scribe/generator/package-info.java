// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later

/**
 * The generation pipeline: evaluating units in dependency order, and deploying their output only where it
 * changed.
 */
@ParametersAreNonnullByDefault
package scribe.generator;

import javax.annotation.ParametersAreNonnullByDefault;
