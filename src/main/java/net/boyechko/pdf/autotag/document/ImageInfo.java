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
package net.boyechko.pdf.autotag.document;

/**
 * An image as known to the caller.
 *
 * @param id caller-assigned identifier, e.g. {@code img_0}
 * @param xref object number of the image XObject, or null if unknown
 * @param pageIndex 0-based page the image is drawn on, or null if unknown
 */
public record ImageInfo(String id, Integer xref, Integer pageIndex) {

    public boolean hasXref() {
        return xref != null && xref > 0;
    }
}
