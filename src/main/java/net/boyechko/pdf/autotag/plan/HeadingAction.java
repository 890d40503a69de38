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
package net.boyechko.pdf.autotag.plan;

/**
 * Request to tag the text run showing {@code text} on {@code page} (0-based) as a heading.
 *
 * @param bbox optional location hint, used when the text itself cannot be found
 */
public record HeadingAction(
        String elementId, int level, String text, int page, BoundingBox bbox) {

    /** Returns the structure role for this heading; levels outside 1..6 are clamped. */
    public String tagName() {
        return "H" + Math.max(1, Math.min(6, level));
    }
}
