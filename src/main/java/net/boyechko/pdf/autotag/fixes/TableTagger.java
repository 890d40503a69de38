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
import com.itextpdf.kernel.pdf.tagging.PdfStructElem;
import java.util.List;
import net.boyechko.pdf.autotag.content.PdfStrings;
import net.boyechko.pdf.autotag.core.WriteContext;
import net.boyechko.pdf.autotag.document.StructureTree;
import net.boyechko.pdf.autotag.plan.TableAction;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Describes tables in the structure tree as {@code Table → TR → TH | TD}. Cells carry their text
 * as {@code ActualText}; header cells get a Table attribute object with {@code Scope /Column}.
 * The content stream is not touched.
 */
public class TableTagger implements PdfFix {
    private static final Logger logger = LoggerFactory.getLogger(TableTagger.class);
    private static final int P_TABLES = 30;

    private static final PdfName TR = new PdfName("TR");
    private static final PdfName SCOPE = new PdfName("Scope");
    private static final PdfName COLUMN = new PdfName("Column");
    private static final PdfName COL_SPAN = new PdfName("ColSpan");

    private final List<TableAction> tables;

    public TableTagger(List<TableAction> tables) {
        this.tables = tables;
    }

    @Override
    public int priority() {
        return P_TABLES;
    }

    @Override
    public void apply(WriteContext ctx) {
        PdfDocument doc = ctx.doc();
        for (TableAction table : tables) {
            int pageNum = table.page() + 1;
            if (pageNum < 1 || pageNum > doc.getNumberOfPages()) {
                ctx.warn("Page " + pageNum + " out of range, skipping table " + table.tableId());
                continue;
            }
            tag(ctx, table, pageNum);
        }
    }

    private void tag(WriteContext ctx, TableAction table, int pageNum) {
        PdfDocument doc = ctx.doc();
        PdfDictionary root = StructureTree.ensureStructTree(doc);

        PdfStructElem tableElem = new PdfStructElem(doc, PdfName.Table, doc.getPage(pageNum));
        tableElem.getPdfObject().put(PdfName.P, root);
        StructureTree.appendKid(root, tableElem.getPdfObject());

        int headerRows = Math.max(0, table.headerRows());
        int rowCount = 0;
        int cellCount = 0;
        List<TableAction.Row> rows = table.rows();
        for (int rowIdx = 0; rowIdx < rows.size(); rowIdx++) {
            TableAction.Row row = rows.get(rowIdx);
            if (row.cells().isEmpty()) {
                continue;
            }
            boolean isHeaderRow = rowIdx < headerRows;
            PdfStructElem trElem = tableElem.addKid(new PdfStructElem(doc, TR));

            for (TableAction.Cell cell : row.cells()) {
                PdfName role = isHeaderRow ? PdfName.TH : PdfName.TD;
                PdfStructElem cellElem = trElem.addKid(new PdfStructElem(doc, role));
                String text = cell.text() == null ? "" : cell.text();
                cellElem.getPdfObject().put(PdfName.ActualText, PdfStrings.encode(text));

                PdfDictionary attributes = tableAttributes(isHeaderRow, cell.gridSpan());
                if (attributes != null) {
                    cellElem.getPdfObject().put(PdfName.A, attributes);
                }
                cellCount++;
            }
            rowCount++;
        }
        tableElem.getPdfObject().setModified();

        if (rowCount == 0) {
            ctx.warn("Table " + table.tableId() + " on page " + pageNum + " has no row data");
        }
        logger.debug(
                "Table {} obj #{}: {} rows, {} cells",
                table.tableId(),
                StructureTree.objNumber(tableElem.getPdfObject()),
                rowCount,
                cellCount);
        ctx.change(
                "Tagged table "
                        + (table.tableId() != null ? table.tableId() : "")
                        + " on page "
                        + pageNum
                        + " with "
                        + headerRows
                        + " header row(s) ("
                        + rowCount
                        + " rows, "
                        + cellCount
                        + " cells)");
    }

    /** Returns {@code <</O /Table /Scope /Column /ColSpan n>>} as applicable, or null if empty. */
    private static PdfDictionary tableAttributes(boolean header, int gridSpan) {
        if (!header && gridSpan <= 1) {
            return null;
        }
        PdfDictionary attributes = new PdfDictionary();
        attributes.put(PdfName.O, PdfName.Table);
        if (header) {
            attributes.put(SCOPE, COLUMN);
        }
        if (gridSpan > 1) {
            attributes.put(COL_SPAN, new PdfNumber(gridSpan));
        }
        return attributes;
    }

    @Override
    public String describe() {
        return "Table tags";
    }
}
