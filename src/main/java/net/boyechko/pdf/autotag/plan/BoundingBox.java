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
 * Rectangle in page points with a top-left origin (y grows downward), as produced by the upstream
 * document parser.
 */
public record BoundingBox(double x0, double y0, double x1, double y1) {

    /** Creates a box from a four-element array, or returns null for anything else. */
    public static BoundingBox of(double[] values) {
        if (values == null || values.length != 4) {
            return null;
        }
        return new BoundingBox(values[0], values[1], values[2], values[3]);
    }

    /** Converts to PDF user space (bottom-left origin) as {x0, y0, x1, y1}. */
    public double[] toPdfSpace(double pageHeight) {
        return new double[] {x0, pageHeight - y1, x1, pageHeight - y0};
    }
}
