// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later

/**
 * A condition and restart system in the manner of Common Lisp, used for every error the generator reports.
 * <p>
 * A failure is <em>signaled</em> as a {@link scribe.util.condition.Condition}. Established
 * {@link scribe.util.condition.Handler}s see it before anything is unwound, while the operation
 * {@link scribe.util.Trace}s that explain it are still active, and may then transfer control to a
 * {@link scribe.util.condition.Restart} point.
 */
@ParametersAreNonnullByDefault
package scribe.util.condition;

import javax.annotation.ParametersAreNonnullByDefault;
