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
package net.boyechko.pdf.autotag.render;

import com.itextpdf.kernel.pdf.PdfPage;
import java.awt.image.BufferedImage;
import java.io.IOException;

/**
 * Rasterizes a single page of an open document without modifying it. The page's current content
 * streams are drawn over the rest of {@code base}, so unsaved edits show up in the image.
 */
public interface PageRenderer {
    BufferedImage render(BaseDocument base, PdfPage page, int dpi) throws IOException;
}
