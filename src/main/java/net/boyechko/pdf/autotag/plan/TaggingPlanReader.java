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

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import net.boyechko.pdf.autotag.document.ImageInfo;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Reads the JSON tagging plan exchanged with external taggers:
 *
 * <pre>
 * { "input_path": ..., "output_path": ...,
 *   "metadata": { "title": ..., "language": ... },
 *   "elements": [ { "type": "heading" | "image_alt" | "table" | "link", ... } ] }
 * </pre>
 *
 * An {@code image_alt} element with an empty {@code alt_text} marks the image as decorative.
 * Elements of any other type are skipped with a warning.
 */
public final class TaggingPlanReader {
    private static final Logger logger = LoggerFactory.getLogger(TaggingPlanReader.class);

    private final ObjectMapper mapper;

    public TaggingPlanReader() {
        this(new ObjectMapper());
    }

    public TaggingPlanReader(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    public TaggingPlan read(Path path) throws IOException {
        if (!Files.isRegularFile(path)) {
            throw new IOException("Tagging plan not found: " + path);
        }
        try (InputStream in = Files.newInputStream(path)) {
            return read(in);
        } catch (IOException e) {
            throw new IOException(path + ": " + e.getMessage(), e);
        }
    }

    public TaggingPlan read(InputStream in) throws IOException {
        PlanJson json;
        try {
            json = mapper.readValue(in, PlanJson.class);
        } catch (JsonProcessingException e) {
            throw new IOException("Invalid tagging plan: " + e.getOriginalMessage(), e);
        }
        if (json == null) {
            throw new IOException("Invalid tagging plan: empty document");
        }
        return toPlan(json);
    }

    private TaggingPlan toPlan(PlanJson json) {
        List<HeadingAction> headings = new ArrayList<>();
        List<AltTextAction> altTexts = new ArrayList<>();
        List<DecorativeAction> decoratives = new ArrayList<>();
        List<ImageInfo> images = new ArrayList<>();
        List<TableAction> tables = new ArrayList<>();
        List<LinkAction> links = new ArrayList<>();
        List<String> warnings = new ArrayList<>();

        List<ElementJson> elements = json.elements() == null ? List.of() : json.elements();
        for (int i = 0; i < elements.size(); i++) {
            ElementJson e = elements.get(i);
            String type = e.type() == null ? "" : e.type();
            switch (type) {
                case "heading" -> headings.add(
                        new HeadingAction(
                                e.elementId(),
                                e.level() == null ? 1 : e.level(),
                                e.text(),
                                page(e),
                                BoundingBox.of(e.bbox())));
                case "image_alt" -> {
                    if (e.imageId() == null || e.imageId().isBlank()) {
                        warnings.add("Element " + i + ": image_alt without image_id");
                        continue;
                    }
                    Integer xref = e.xref() != null && e.xref() > 0 ? e.xref() : null;
                    images.add(new ImageInfo(e.imageId(), xref, e.page()));
                    if (e.altText() == null || e.altText().isEmpty()) {
                        decoratives.add(new DecorativeAction(e.imageId()));
                    } else {
                        altTexts.add(new AltTextAction(e.imageId(), e.altText()));
                    }
                }
                case "table" -> tables.add(
                        new TableAction(
                                e.tableId(),
                                page(e),
                                e.headerRows() == null ? 1 : e.headerRows(),
                                rows(e.rows()),
                                BoundingBox.of(e.bbox())));
                case "link" -> links.add(
                        new LinkAction(e.linkId(), page(e), e.linkText(), e.linkUrl()));
                default -> warnings.add("Element " + i + ": unknown type '" + type + "'");
            }
        }

        DocumentMetadata metadata =
                json.metadata() == null
                        ? null
                        : new DocumentMetadata(json.metadata().title(), json.metadata().language());

        logger.debug(
                "Read plan: {} headings, {} alt texts, {} decorative, {} tables, {} links",
                headings.size(),
                altTexts.size(),
                decoratives.size(),
                tables.size(),
                links.size());

        return new TaggingPlan(
                json.inputPath(),
                json.outputPath(),
                metadata,
                headings,
                altTexts,
                decoratives,
                images,
                tables,
                links,
                warnings);
    }

    private static int page(ElementJson e) {
        return e.page() == null ? 0 : e.page();
    }

    private static List<TableAction.Row> rows(List<RowJson> rows) {
        List<TableAction.Row> result = new ArrayList<>();
        if (rows == null) {
            return result;
        }
        for (RowJson row : rows) {
            List<TableAction.Cell> cells = new ArrayList<>();
            if (row.cells() != null) {
                for (CellJson cell : row.cells()) {
                    int span = cell.gridSpan() == null ? 1 : Math.max(1, cell.gridSpan());
                    cells.add(new TableAction.Cell(cell.text() == null ? "" : cell.text(), span));
                }
            }
            result.add(new TableAction.Row(cells));
        }
        return result;
    }

    // ── JSON shapes ─────────────────────────────────────────────────────

    @JsonIgnoreProperties(ignoreUnknown = true)
    record PlanJson(
            @JsonProperty("input_path") String inputPath,
            @JsonProperty("output_path") String outputPath,
            @JsonProperty("metadata") MetadataJson metadata,
            @JsonProperty("elements") List<ElementJson> elements) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    record MetadataJson(
            @JsonProperty("title") String title, @JsonProperty("language") String language) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    record ElementJson(
            @JsonProperty("type") String type,
            @JsonProperty("element_id") String elementId,
            @JsonProperty("level") Integer level,
            @JsonProperty("text") String text,
            @JsonProperty("alt_text") String altText,
            @JsonProperty("image_id") String imageId,
            @JsonProperty("table_id") String tableId,
            @JsonProperty("header_rows") Integer headerRows,
            @JsonProperty("rows") List<RowJson> rows,
            @JsonProperty("page") Integer page,
            @JsonProperty("bbox") double[] bbox,
            @JsonProperty("xref") Integer xref,
            @JsonProperty("link_id") String linkId,
            @JsonProperty("link_text") String linkText,
            @JsonProperty("link_url") String linkUrl) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    record RowJson(@JsonProperty("cells") List<CellJson> cells) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    record CellJson(
            @JsonProperty("text") String text, @JsonProperty("grid_span") Integer gridSpan) {}
}
