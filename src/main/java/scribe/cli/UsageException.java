// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package scribe.cli;

/**
 * Thrown when the command line arguments are malformed.
 */
final class UsageException extends Exception {
    UsageException(final String message) {
        super(message);
    }
}
