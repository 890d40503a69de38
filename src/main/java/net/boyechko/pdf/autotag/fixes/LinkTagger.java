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

import com.itextpdf.kernel.pdf.PdfDictionary;
import com.itextpdf.kernel.pdf.PdfDocument;
import com.itextpdf.kernel.pdf.PdfName;
import com.itextpdf.kernel.pdf.PdfPage;
import com.itextpdf.kernel.pdf.annot.PdfAnnotation;
import com.itextpdf.kernel.pdf.tagging.PdfObjRef;
import com.itextpdf.kernel.pdf.tagging.PdfStructElem;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import net.boyechko.pdf.autotag.content.PdfStrings;
import net.boyechko.pdf.autotag.core.WriteContext;
import net.boyechko.pdf.autotag.document.StructureTree;
import net.boyechko.pdf.autotag.plan.LinkAction;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Adds a Link element carrying descriptive text as {@code Alt} and {@code ActualText}. When the
 * page has a link annotation pointing at the same URI, the element also gets an object reference
 * to that annotation.
 */
public class LinkTagger implements PdfFix {
    private static final Logger logger = LoggerFactory.getLogger(LinkTagger.class);
    private static final int P_LINKS = 40;
    private static final int MESSAGE_TEXT_LENGTH = 60;

    private final List<LinkAction> links;

    public LinkTagger(List<LinkAction> links) {
        this.links = links;
    }

    @Override
    public int priority() {
        return P_LINKS;
    }

    @Override
    public void apply(WriteContext ctx) {
        PdfDocument doc = ctx.doc();
        Set<PdfDictionary> claimed = new HashSet<>();
        for (LinkAction link : links) {
            int pageNum = link.page() + 1;
            if (pageNum < 1 || pageNum > doc.getNumberOfPages()) {
                ctx.warn("Page " + pageNum + " out of range, skipping link " + link.linkId());
                continue;
            }
            tag(ctx, link, doc.getPage(pageNum), pageNum, claimed);
        }
    }

    private void tag(
            WriteContext ctx,
            LinkAction link,
            PdfPage page,
            int pageNum,
            Set<PdfDictionary> claimed) {
        PdfDocument doc = ctx.doc();
        PdfDictionary root = StructureTree.ensureStructTree(doc);

        String text = link.linkText() != null ? link.linkText() : "";
        PdfStructElem linkElem = new PdfStructElem(doc, PdfName.Link, page);
        linkElem.getPdfObject().put(PdfName.P, root);
        linkElem.getPdfObject().put(PdfName.Alt, PdfStrings.encode(text));
        linkElem.getPdfObject().put(PdfName.ActualText, PdfStrings.encode(text));
        StructureTree.appendKid(root, linkElem.getPdfObject());

        PdfAnnotation annotation = findAnnotation(page, link.linkUrl(), claimed);
        if (annotation != null) {
            claimed.add(annotation.getPdfObject());
            if (StructureTree.hasParentTree(doc)) {
                int structParentIndex = doc.getNextStructParentIndex();
                linkElem.addKid(new PdfObjRef(annotation, linkElem, structParentIndex));
                annotation.getPdfObject().setModified();
                logger.debug(
                        "Link {} references annotation obj #{} with StructParent {}",
                        link.linkId(),
                        StructureTree.objNumber(annotation.getPdfObject()),
                        structParentIndex);
            } else {
                PdfDictionary objr = new PdfDictionary();
                objr.put(PdfName.Type, PdfName.OBJR);
                objr.put(PdfName.Obj, annotation.getPdfObject());
                objr.put(PdfName.Pg, page.getPdfObject());
                StructureTree.appendKid(linkElem.getPdfObject(), objr);
            }
        }
        linkElem.getPdfObject().setModified();

        ctx.change(
                "Set link text on "
                        + (link.linkId() != null ? link.linkId() : "link")
                        + " page "
                        + pageNum
                        + ": "
                        + FixMessages.head(text, MESSAGE_TEXT_LENGTH));
    }

    /** Finds an unclaimed link annotation whose URI action targets {@code url}. */
    private static PdfAnnotation findAnnotation(
            PdfPage page, String url, Set<PdfDictionary> claimed) {
        if (url == null || url.isBlank()) {
            return null;
        }
        for (PdfAnnotation annotation : page.getAnnotations()) {
            PdfDictionary annotDict = annotation.getPdfObject();
            if (!PdfName.Link.equals(annotDict.getAsName(PdfName.Subtype))
                    || claimed.contains(annotDict)) {
                continue;
            }
            PdfDictionary action = annotDict.getAsDictionary(PdfName.A);
            if (action == null || !PdfName.URI.equals(action.getAsName(PdfName.S))) {
                continue;
            }
            String target = PdfStrings.text(action.getAsString(PdfName.URI));
            if (url.strip().equals(target.strip())) {
                return annotation;
            }
        }
        return null;
    }

    @Override
    public String describe() {
        return "Link tags";
    }
}
