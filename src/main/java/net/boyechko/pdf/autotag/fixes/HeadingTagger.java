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
import com.itextpdf.kernel.pdf.PdfNumber;
import com.itextpdf.kernel.pdf.PdfPage;
import com.itextpdf.kernel.pdf.PdfStream;
import com.itextpdf.kernel.pdf.tagging.PdfMcrDictionary;
import com.itextpdf.kernel.pdf.tagging.PdfStructElem;
import java.awt.image.BufferedImage;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import net.boyechko.pdf.autotag.content.ContentTokenizer;
import net.boyechko.pdf.autotag.content.TextSpan;
import net.boyechko.pdf.autotag.content.Token;
import net.boyechko.pdf.autotag.content.TokenStreamEditor;
import net.boyechko.pdf.autotag.core.RevertFailedException;
import net.boyechko.pdf.autotag.core.WriteContext;
import net.boyechko.pdf.autotag.document.StructureTree;
import net.boyechko.pdf.autotag.plan.HeadingAction;
import net.boyechko.pdf.autotag.render.VisualVerifier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Wraps the text that shows a heading in {@code /Hn <</MCID n>> BDC ... EMC} and links a matching
 * heading element into the structure tree.
 *
 * <p>Each attempt edits one located occurrence of the text, renders the page, and keeps the edit
 * only if the page looks the same as before within {@code headingDiffTolerance}. A rejected edit
 * is undone by restoring the stream's saved bytes, and the next attempt moves on to the next
 * occurrence with a fresh MCID. The structure element is created only for an accepted edit.
 */
public class HeadingTagger implements PdfFix {
    private static final Logger logger = LoggerFactory.getLogger(HeadingTagger.class);
    private static final int P_HEADINGS = 50;
    private static final int MESSAGE_TEXT_LENGTH = 40;

    private final List<HeadingAction> headings;

    public HeadingTagger(List<HeadingAction> headings) {
        this.headings = headings;
    }

    @Override
    public int priority() {
        return P_HEADINGS;
    }

    @Override
    public boolean editsContent() {
        return true;
    }

    @Override
    public void apply(WriteContext ctx) {
        for (HeadingAction heading : headings) {
            tag(ctx, heading);
        }
    }

    /** A located occurrence: which content stream of the page, and which tokens in it. */
    private record Candidate(int streamIndex, List<Token> tokens, TextSpan span) {}

    private void tag(WriteContext ctx, HeadingAction heading) {
        PdfDocument doc = ctx.doc();
        String text = heading.text() == null ? "" : heading.text().strip();
        String label = FixMessages.head(text, MESSAGE_TEXT_LENGTH);
        if (text.isEmpty() && heading.bbox() == null) {
            logger.debug("Skipping heading {} with no text and no bbox", heading.elementId());
            return;
        }
        if (heading.page() < 0 || heading.page() >= doc.getNumberOfPages()) {
            ctx.warn(
                    "Heading '"
                            + label
                            + "' not tagged: page "
                            + (heading.page() + 1)
                            + " does not exist");
            return;
        }

        PdfPage page = doc.getPage(heading.page() + 1);
        List<Candidate> candidates = locate(ctx, page, heading, text);
        if (candidates.isEmpty()) {
            ctx.warn(
                    "Heading '"
                            + label
                            + "' not found on page "
                            + (heading.page() + 1));
            return;
        }

        Optional<VisualVerifier> verifier = ctx.verifier();
        BufferedImage baseline = null;
        if (verifier.isPresent()) {
            try {
                baseline = verifier.get().snapshot(page);
            } catch (IOException | RuntimeException e) {
                ctx.warn(
                        "Heading '"
                                + label
                                + "' not tagged: could not render page "
                                + (heading.page() + 1)
                                + " ("
                                + e.getMessage()
                                + ")");
                return;
            }
        }

        PdfDictionary root = StructureTree.ensureStructTree(doc);
        String tag = heading.tagName();
        int maxAttempts = Math.min(ctx.settings().maxHeadingAttempts(), candidates.size());
        int firstFree = highestMcidInContent(page) + 1;

        for (int attempt = 0; attempt < maxAttempts; attempt++) {
            Candidate candidate = candidates.get(attempt);
            PdfStream stream = page.getContentStream(candidate.streamIndex());
            byte[] original = stream.getBytes();
            int mcid = nextMcid(doc, page, firstFree);
            firstFree = mcid + 1;

            List<Token> wrapped =
                    TokenStreamEditor.injectMarkedContent(
                            candidate.tokens(), candidate.span(), tag, mcid);
            stream.setData(ContentTokenizer.join(wrapped));

            double diff =
                    verifier.isPresent() ? verifier.get().diffAgainst(baseline, page) : 0.0;
            if (diff <= ctx.settings().headingDiffTolerance()) {
                stream.setModified();
                page.getPdfObject().setModified();
                linkHeadingElement(doc, root, page, tag, mcid);
                ctx.result().headingTagApplied();
                ctx.change("Tagged '" + label + "' as " + tag + " on page " + (heading.page() + 1));
                return;
            }

            restore(stream, original, heading);
            logger.warn(
                    "Heading tag reverted ({}% diff) for {} on page {}, attempt {}",
                    String.format("%.1f", diff),
                    heading.elementId(),
                    heading.page() + 1,
                    attempt + 1);
        }

        ctx.warn(
                "Could not tag heading '"
                        + label
                        + "' on page "
                        + (heading.page() + 1)
                        + " after "
                        + maxAttempts
                        + " attempt(s)");
    }

    private List<Candidate> locate(
            WriteContext ctx, PdfPage page, HeadingAction heading, String text) {
        List<Candidate> candidates = new ArrayList<>();
        List<List<Token>> streams = new ArrayList<>();
        for (int i = 0; i < page.getContentStreamCount(); i++) {
            streams.add(ContentTokenizer.tokenize(page.getContentStream(i).getBytes()));
        }

        if (!text.isEmpty()) {
            for (int i = 0; i < streams.size(); i++) {
                for (TextSpan span : TokenStreamEditor.locateText(streams.get(i), text)) {
                    candidates.add(new Candidate(i, streams.get(i), span));
                }
            }
        }

        if (candidates.isEmpty() && heading.bbox() != null) {
            double pageHeight = page.getPageSize().getHeight();
            double[] box = heading.bbox().toPdfSpace(pageHeight);
            for (int i = 0; i < streams.size(); i++) {
                TextSpan span =
                        TokenStreamEditor.locateTextBlocks(
                                streams.get(i), box, ctx.settings().bboxTolerance());
                if (span != null) {
                    logger.debug(
                            "Heading {} located by bbox in stream {}", heading.elementId(), i);
                    candidates.add(new Candidate(i, streams.get(i), span));
                }
            }
        }
        return candidates;
    }

    /**
     * iText's per-page counter only knows MCIDs reachable from a loaded structure tree, so it is
     * raised above any MCID already written in the page's content.
     */
    private static int nextMcid(PdfDocument doc, PdfPage page, int firstFree) {
        int fromTree = doc.isTagged() ? page.getNextMcid() : 0;
        return Math.max(fromTree, firstFree);
    }

    private static int highestMcidInContent(PdfPage page) {
        int highest = -1;
        for (int i = 0; i < page.getContentStreamCount(); i++) {
            List<Token> tokens = ContentTokenizer.tokenize(page.getContentStream(i).getBytes());
            highest = Math.max(highest, TokenStreamEditor.highestMcid(tokens));
        }
        return highest;
    }

    /**
     * Creates {@code <</Type/StructElem /S/Hn /P root /Pg page /K <</Type/MCR /MCID n /Pg
     * page>>>>} and appends it to the root's kids.
     */
    private static void linkHeadingElement(
            PdfDocument doc, PdfDictionary root, PdfPage page, String tag, int mcid) {
        PdfStructElem heading = new PdfStructElem(doc, new PdfName(tag), page);
        heading.getPdfObject().put(PdfName.P, root);

        PdfDictionary mcr = new PdfDictionary();
        mcr.put(PdfName.Type, PdfName.MCR);
        mcr.put(PdfName.MCID, new PdfNumber(mcid));
        mcr.put(PdfName.Pg, page.getPdfObject());
        if (StructureTree.hasParentTree(doc)) {
            heading.addKid(new PdfMcrDictionary(mcr, heading));
        } else {
            StructureTree.appendKid(heading.getPdfObject(), mcr);
        }

        heading.getPdfObject().setModified();
        StructureTree.appendKid(root, heading.getPdfObject());
        logger.debug(
                "Linked {} obj #{} with MCID {}",
                tag,
                StructureTree.objNumber(heading.getPdfObject()),
                mcid);
    }

    private static void restore(PdfStream stream, byte[] original, HeadingAction heading) {
        try {
            stream.setData(original);
        } catch (RuntimeException e) {
            throw new RevertFailedException(
                    "Could not restore content stream after rejected heading "
                            + heading.elementId(),
                    e);
        }
    }

    @Override
    public String describe() {
        return "Heading tags";
    }
}
