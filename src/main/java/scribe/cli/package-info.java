// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later

/**
 * Entry point of the {@code scribe} command line tool.
 */
@ParametersAreNonnullByDefault
package scribe.cli;

import javax.annotation.ParametersAreNonnullByDefault;
