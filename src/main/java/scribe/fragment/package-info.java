// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later

/**
 * The fragment language: the small indentation-structured language of code embedded in units, its lexer, syntax
 * tree and parser.
 */
@ParametersAreNonnullByDefault
package scribe.fragment;

import javax.annotation.ParametersAreNonnullByDefault;
