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
package net.boyechko.pdf.autotag.core;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import net.boyechko.pdf.autotag.document.ImageInfo;
import net.boyechko.pdf.autotag.plan.AltTextAction;
import net.boyechko.pdf.autotag.plan.ColorFix;
import net.boyechko.pdf.autotag.plan.DecorativeAction;
import net.boyechko.pdf.autotag.plan.DocumentMetadata;
import net.boyechko.pdf.autotag.plan.HeadingAction;
import net.boyechko.pdf.autotag.plan.LinkAction;
import net.boyechko.pdf.autotag.plan.TableAction;
import net.boyechko.pdf.autotag.plan.TaggingPlan;

/**
 * Everything one write session applies to one PDF.
 *
 * @param output where the remediated copy goes; null means {@code <stem>_remediated.pdf} next to
 *     the source
 * @param altTexts alt text by image id, in insertion order
 * @param notes messages to carry into the result's warnings, such as plan reading problems
 */
public record PdfWriteRequest(
        Path source,
        Path output,
        String password,
        DocumentMetadata metadata,
        List<ImageInfo> images,
        Map<String, String> altTexts,
        Set<String> decorativeIds,
        List<HeadingAction> headings,
        List<ColorFix> colorFixes,
        List<TableAction> tables,
        List<LinkAction> links,
        List<String> notes) {

    public PdfWriteRequest {
        if (source == null) {
            throw new IllegalArgumentException("source must not be null");
        }
        images = List.copyOf(images);
        altTexts = Collections.unmodifiableMap(new LinkedHashMap<>(altTexts));
        decorativeIds = Collections.unmodifiableSet(new LinkedHashSet<>(decorativeIds));
        headings = List.copyOf(headings);
        colorFixes = List.copyOf(colorFixes);
        tables = List.copyOf(tables);
        links = List.copyOf(links);
        notes = List.copyOf(notes);
    }

    public static Builder builder(Path source) {
        return new Builder(source);
    }

    public boolean hasTier2Work() {
        return !headings.isEmpty() || !colorFixes.isEmpty();
    }

    public static final class Builder {
        private final Path source;
        private Path output;
        private String password;
        private DocumentMetadata metadata;
        private final List<ImageInfo> images = new ArrayList<>();
        private final Map<String, String> altTexts = new LinkedHashMap<>();
        private final Set<String> decorativeIds = new LinkedHashSet<>();
        private final List<HeadingAction> headings = new ArrayList<>();
        private final List<ColorFix> colorFixes = new ArrayList<>();
        private final List<TableAction> tables = new ArrayList<>();
        private final List<LinkAction> links = new ArrayList<>();
        private final List<String> notes = new ArrayList<>();

        private Builder(Path source) {
            this.source = source;
        }

        public Builder output(Path output) {
            this.output = output;
            return this;
        }

        public Builder password(String password) {
            this.password = password;
            return this;
        }

        public Builder metadata(String title, String language) {
            this.metadata = new DocumentMetadata(title, language);
            return this;
        }

        public Builder metadata(DocumentMetadata metadata) {
            this.metadata = metadata;
            return this;
        }

        public Builder image(ImageInfo image) {
            images.add(image);
            return this;
        }

        public Builder images(List<ImageInfo> images) {
            this.images.addAll(images);
            return this;
        }

        public Builder altText(AltTextAction action) {
            altTexts.put(action.imageId(), action.altText());
            return this;
        }

        public Builder altText(String imageId, String altText) {
            return altText(new AltTextAction(imageId, altText));
        }

        public Builder decorative(DecorativeAction action) {
            decorativeIds.add(action.imageId());
            return this;
        }

        public Builder decorative(String imageId) {
            return decorative(new DecorativeAction(imageId));
        }

        public Builder heading(HeadingAction action) {
            headings.add(action);
            return this;
        }

        public Builder colorFix(ColorFix fix) {
            colorFixes.add(fix);
            return this;
        }

        public Builder table(TableAction action) {
            tables.add(action);
            return this;
        }

        public Builder link(LinkAction action) {
            links.add(action);
            return this;
        }

        public Builder note(String message) {
            notes.add(message);
            return this;
        }

        /** Adds every action of {@code plan}; explicit metadata already set wins. */
        public Builder plan(TaggingPlan plan) {
            if (metadata == null) {
                metadata = plan.metadata();
            }
            images.addAll(plan.images());
            plan.altTexts().forEach(this::altText);
            plan.decoratives().forEach(this::decorative);
            headings.addAll(plan.headings());
            tables.addAll(plan.tables());
            links.addAll(plan.links());
            notes.addAll(plan.warnings());
            return this;
        }

        public PdfWriteRequest build() {
            return new PdfWriteRequest(
                    source,
                    output,
                    password,
                    metadata,
                    images,
                    altTexts,
                    decorativeIds,
                    headings,
                    colorFixes,
                    tables,
                    links,
                    notes);
        }
    }
}
