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

import com.itextpdf.kernel.pdf.PdfArray;
import com.itextpdf.kernel.pdf.PdfBoolean;
import com.itextpdf.kernel.pdf.PdfDictionary;
import com.itextpdf.kernel.pdf.PdfDocument;
import com.itextpdf.kernel.pdf.PdfIndirectReference;
import com.itextpdf.kernel.pdf.PdfName;
import com.itextpdf.kernel.pdf.PdfObject;
import com.itextpdf.kernel.pdf.tagging.PdfStructTreeRoot;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Low-level access to the logical structure tree, working on the raw dictionaries so that trees
 * written by other producers (single-reference {@code /K}, inline kids, shared nodes) are handled
 * as found.
 *
 * <p>All writers mark what they touch as modified, which is required for the change to reach an
 * append-mode revision.
 */
public final class StructureTree {
    private static final Logger logger = LoggerFactory.getLogger(StructureTree.class);

    public static final PdfName A11Y_XREF = new PdfName("A11yXref");

    private StructureTree() {}

    /** Returns whether the catalog references a structure tree root. */
    public static boolean isTagged(PdfDocument doc) {
        return catalogRoot(doc) != null;
    }

    /** The catalog's {@code StructTreeRoot} dictionary, or {@code null} if there is none. */
    public static PdfDictionary catalogRoot(PdfDocument doc) {
        return doc.getCatalog().getPdfObject().getAsDictionary(PdfName.StructTreeRoot);
    }

    /**
     * Returns whether iText loaded the structure tree, so new marked-content and object references
     * can be registered in its parent tree. A root iText could not parse is still in the catalog,
     * but has no parent tree handler.
     */
    public static boolean hasParentTree(PdfDocument doc) {
        return doc.getStructTreeRoot() != null;
    }

    /**
     * Returns the catalog's structure tree root as-is, or creates a minimal one if the document has
     * none. A new root gets an empty {@code /K} array and the catalog is marked with {@code
     * MarkInfo/Marked true}.
     */
    public static PdfDictionary ensureStructTree(PdfDocument doc) {
        PdfDictionary existing = catalogRoot(doc);
        if (existing != null) {
            if (!hasParentTree(doc)) {
                logger.debug(
                        "Structure tree root obj #{} was not loaded by iText; editing it directly",
                        objNumber(existing));
            }
            return existing;
        }

        doc.setTagged();
        PdfStructTreeRoot root = doc.getStructTreeRoot();
        if (root == null) {
            throw new IllegalStateException("Could not create a structure tree root");
        }
        PdfDictionary rootDict = root.getPdfObject();
        if (rootDict.get(PdfName.K) == null) {
            rootDict.put(PdfName.K, new PdfArray());
        }
        markTagged(doc);
        rootDict.setModified();
        doc.getCatalog().getPdfObject().setModified();
        logger.debug("Created structure tree root obj #{}", objNumber(rootDict));
        return rootDict;
    }

    private static void markTagged(PdfDocument doc) {
        PdfDictionary catalog = doc.getCatalog().getPdfObject();
        PdfDictionary markInfo = catalog.getAsDictionary(PdfName.MarkInfo);
        if (markInfo == null) {
            markInfo = new PdfDictionary();
            catalog.put(PdfName.MarkInfo, markInfo);
        }
        markInfo.put(PdfName.Marked, PdfBoolean.TRUE);
        if (markInfo.getIndirectReference() != null) {
            markInfo.setModified();
        }
    }

    /**
     * Collects every structure element under {@code node} (the node included) whose {@code /S}
     * is {@code type}. Traversal stops {@code maxDepth} levels below the start and visits each
     * object at most once, so cyclic or shared subtrees terminate.
     */
    public static List<PdfDictionary> findElementsByType(
            PdfDictionary node, PdfName type, int maxDepth) {
        List<PdfDictionary> found = new ArrayList<>();
        Set<Integer> visitedRefs = new HashSet<>();
        Set<PdfDictionary> visitedInline = Collections.newSetFromMap(new IdentityHashMap<>());
        collect(node, type, maxDepth, found, visitedRefs, visitedInline);
        return found;
    }

    private static void collect(
            PdfDictionary node,
            PdfName type,
            int remaining,
            List<PdfDictionary> found,
            Set<Integer> visitedRefs,
            Set<PdfDictionary> visitedInline) {
        if (remaining <= 0) {
            return;
        }
        int objNum = objNumber(node);
        boolean firstVisit = objNum >= 0 ? visitedRefs.add(objNum) : visitedInline.add(node);
        if (!firstVisit) {
            return;
        }

        if (type.equals(node.getAsName(PdfName.S))) {
            found.add(node);
        }

        for (PdfDictionary kid : kidDictionaries(node)) {
            if (isStructElem(kid)) {
                collect(kid, type, remaining - 1, found, visitedRefs, visitedInline);
            }
        }
    }

    /** Returns the dictionary children of {@code /K}, whether it is one object or an array. */
    public static List<PdfDictionary> kidDictionaries(PdfDictionary node) {
        List<PdfDictionary> kids = new ArrayList<>();
        PdfObject k = node.get(PdfName.K);
        if (k instanceof PdfArray array) {
            for (int i = 0; i < array.size(); i++) {
                if (array.get(i) instanceof PdfDictionary dict) {
                    kids.add(dict);
                }
            }
        } else if (k instanceof PdfDictionary dict) {
            kids.add(dict);
        }
        return kids;
    }

    /** Marked-content and object references live in /K too, but are not elements. */
    private static boolean isStructElem(PdfDictionary dict) {
        PdfName type = dict.getAsName(PdfName.Type);
        return !PdfName.MCR.equals(type) && !PdfName.OBJR.equals(type);
    }

    /**
     * Appends {@code kid} to the {@code /K} of {@code parent}. A missing {@code /K} becomes a
     * one-element array, an array grows at the end, and a single existing child is promoted to
     * an array holding that child first and {@code kid} second.
     */
    public static void appendKid(PdfDictionary parent, PdfObject kid) {
        PdfObject entry = asEntry(kid);
        PdfObject existing = parent.get(PdfName.K, false);

        if (existing == null || existing.isNull()) {
            PdfArray kids = new PdfArray();
            kids.add(entry);
            parent.put(PdfName.K, kids);
        } else if (existing.isArray()) {
            ((PdfArray) existing).add(entry);
            if (existing.getIndirectReference() != null) {
                existing.setModified();
            }
        } else {
            PdfObject resolved = parent.get(PdfName.K);
            if (resolved instanceof PdfArray array) {
                array.add(entry);
                array.setModified();
            } else {
                PdfArray kids = new PdfArray();
                kids.add(existing);
                kids.add(entry);
                parent.put(PdfName.K, kids);
            }
        }
        parent.setModified();
    }

    private static PdfObject asEntry(PdfObject kid) {
        PdfIndirectReference ref = kid.getIndirectReference();
        return ref != null ? ref : kid;
    }

    /** Returns the PDF object number of {@code obj}, or -1 for a direct object. */
    public static int objNumber(PdfObject obj) {
        PdfIndirectReference ref = obj.getIndirectReference();
        return ref != null ? ref.getObjNumber() : -1;
    }

    /**
     * Returns the 0-based page of a structure element, from its {@code /Pg} or else from the
     * first marked-content reference among its kids, or -1 if neither names a page.
     */
    public static int pageIndexOf(PdfDocument doc, PdfDictionary elem) {
        PdfDictionary pg = elem.getAsDictionary(PdfName.Pg);
        if (pg == null) {
            for (PdfDictionary kid : kidDictionaries(elem)) {
                if (PdfName.MCR.equals(kid.getAsName(PdfName.Type))) {
                    pg = kid.getAsDictionary(PdfName.Pg);
                    if (pg != null) {
                        break;
                    }
                }
            }
        }
        if (pg == null) {
            return -1;
        }
        int pageNum = doc.getPageNumber(pg);
        return pageNum > 0 ? pageNum - 1 : -1;
    }
}
