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
package net.boyechko.pdf.autotag.fixes;

import net.boyechko.pdf.autotag.core.WriteContext;

/**
 * One kind of change a write session applies. Fixes run in ascending {@link #priority()} order.
 * Failures thrown from {@link #apply} are recorded as warnings and do not stop the session.
 */
public interface PdfFix {
    int priority();

    /**
     * Tier 2 fixes edit content streams and go through visual verification. Tier 1 fixes touch
     * only metadata and the structure tree.
     */
    default boolean editsContent() {
        return false;
    }

    void apply(WriteContext ctx) throws Exception;

    default String describe() {
        return getClass().getSimpleName();
    }
}
