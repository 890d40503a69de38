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

import com.itextpdf.kernel.pdf.PdfBoolean;
import com.itextpdf.kernel.pdf.PdfCatalog;
import com.itextpdf.kernel.pdf.PdfDictionary;
import com.itextpdf.kernel.pdf.PdfDocumentInfo;
import com.itextpdf.kernel.pdf.PdfName;
import com.itextpdf.kernel.pdf.PdfString;
import net.boyechko.pdf.autotag.content.PdfStrings;
import net.boyechko.pdf.autotag.core.WriteContext;
import net.boyechko.pdf.autotag.plan.DocumentMetadata;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Sets the document title (with {@code DisplayDocTitle}) and the catalog {@code /Lang}. Values
 * already in place are left alone and produce no change entry.
 */
public class MetadataFixer implements PdfFix {
    private static final Logger logger = LoggerFactory.getLogger(MetadataFixer.class);
    private static final int P_METADATA = 10;

    private final DocumentMetadata metadata;

    public MetadataFixer(DocumentMetadata metadata) {
        this.metadata = metadata;
    }

    @Override
    public int priority() {
        return P_METADATA;
    }

    @Override
    public void apply(WriteContext ctx) {
        PdfCatalog catalog = ctx.doc().getCatalog();

        if (metadata.hasTitle()) {
            String title = metadata.title().strip();
            PdfDocumentInfo info = ctx.doc().getDocumentInfo();
            if (!title.equals(info.getTitle())) {
                info.setTitle(title);
                ctx.change("Set PDF title: " + title);
            } else {
                logger.debug("Title already set to '{}'", title);
            }
            showTitleInWindow(catalog);
        }

        if (metadata.hasLanguage()) {
            String language = metadata.language().strip();
            PdfString current = catalog.getPdfObject().getAsString(PdfName.Lang);
            if (current == null || !language.equals(PdfStrings.text(current))) {
                catalog.put(PdfName.Lang, PdfStrings.encode(language));
                catalog.getPdfObject().setModified();
                ctx.change("Set PDF language: " + language);
            } else {
                logger.debug("Language already set to '{}'", language);
            }
        }
    }

    private static void showTitleInWindow(PdfCatalog catalog) {
        PdfDictionary prefs = catalog.getPdfObject().getAsDictionary(PdfName.ViewerPreferences);
        if (prefs == null) {
            prefs = new PdfDictionary();
            catalog.put(PdfName.ViewerPreferences, prefs);
        } else if (Boolean.TRUE.equals(prefs.getAsBool(PdfName.DisplayDocTitle))) {
            return;
        }
        prefs.put(PdfName.DisplayDocTitle, PdfBoolean.TRUE);
        prefs.setModified();
        catalog.getPdfObject().setModified();
    }

    @Override
    public String describe() {
        return "Metadata";
    }
}
