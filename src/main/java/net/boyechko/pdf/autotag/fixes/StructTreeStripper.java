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

import java.io.IOException;
import java.nio.file.Path;
import org.apache.pdfbox.Loader;
import org.apache.pdfbox.cos.COSName;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.pdmodel.PDDocumentCatalog;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Writes a copy of a PDF without its structure tree, so that an external tagger can build one
 * from scratch without duplicating existing Figure elements. The catalog's {@code
 * StructTreeRoot} and {@code MarkInfo} entries are removed; the unreferenced tree is dropped on
 * save.
 */
public final class StructTreeStripper {
    private static final Logger logger = LoggerFactory.getLogger(StructTreeStripper.class);

    private StructTreeStripper() {}

    /**
     * @return true if the copy was written, whether or not there was a tree to remove
     */
    public static boolean strip(Path source, Path output) {
        return strip(source, output, null);
    }

    public static boolean strip(Path source, Path output, String password) {
        try (PDDocument document =
                password == null
                        ? Loader.loadPDF(source.toFile())
                        : Loader.loadPDF(source.toFile(), password)) {
            PDDocumentCatalog catalog = document.getDocumentCatalog();
            if (catalog.getCOSObject().containsKey(COSName.STRUCT_TREE_ROOT)) {
                catalog.getCOSObject().removeItem(COSName.STRUCT_TREE_ROOT);
                logger.info("Stripped existing StructTreeRoot from {}", source);
            }
            catalog.getCOSObject().removeItem(COSName.MARK_INFO);
            document.save(output.toFile());
            return true;
        } catch (IOException | RuntimeException e) {
            logger.warn("Failed to strip structure tree from {}: {}", source, e.getMessage());
            return false;
        }
    }
}
