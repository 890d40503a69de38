/*
 * PDF-Auto-Tag - In-place PDF Accessibility Tagging
 * Copyright (C) 2025 Richard Boyechko
 *
 * This program is free software: you can redistribute it and/or modify
 * it under the terms of the GNU Affero General Public License as published
 * by the Free Software Foundation, either version 3 of the License, or
 * (at your option) any later version.
 *
 * This program is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 * GNU Affero General Public License for more details.
 *
 * You should have received a copy of the GNU Affero General Public License
 * along with this program.  If not, see <https://www.gnu.org/licenses/>.
 */
package net.boyechko.pdf.autotag.core;

import ch.qos.logback.classic.Level;

/**
 * How much of a write session the console reporter shows, and which root logger level goes with
 * it. Declared from least to most talkative; comparisons use declaration order.
 */
public enum VerbosityLevel {
    /** Fatal errors and the one-line outcome. Library logging limited to errors. */
    QUIET(Level.ERROR),

    /** Applied changes, warnings and the summary box. */
    NORMAL(Level.WARN),

    /** Adds phase headers and per-phase notes. */
    VERBOSE(Level.INFO),

    /** Everything, routed through SLF4J instead of the boxed reporter. */
    DEBUG(Level.DEBUG);

    private final Level logLevel;

    VerbosityLevel(Level logLevel) {
        this.logLevel = logLevel;
    }

    /** Root logger level matching this verbosity. */
    public Level logLevel() {
        return logLevel;
    }

    /** True when this level shows at least as much as {@code other}. */
    public boolean isAtLeast(VerbosityLevel other) {
        return compareTo(other) >= 0;
    }
}
