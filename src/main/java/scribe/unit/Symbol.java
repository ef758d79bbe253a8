// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package scribe.unit;

import java.nio.file.Path;

/**
 * A project-wide name declared by a unit.
 *
 * @param name  The symbol name. Always starts with an upper-case letter.
 * @param owner The source path of the declaring unit.
 * @param role  The role of the symbol in data channels.
 */
public record Symbol(String name, Path owner, SymbolRole role) {
}
