// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later

/**
 * The tree-walking interpreter of the fragment language, and its runtime values.
 * <p>
 * Runtime values are plain Java objects where possible: {@code null} for {@code None}, {@link java.lang.Boolean},
 * {@link java.lang.Long}, {@link java.lang.Double}, {@link java.lang.String}, {@link java.util.ArrayList} for lists
 * and {@link java.util.LinkedHashMap} for dicts. Tuples, functions, classes and instances have their own types.
 */
@ParametersAreNonnullByDefault
package scribe.fragment.interpreter;

import javax.annotation.ParametersAreNonnullByDefault;
