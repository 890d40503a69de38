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

import java.util.List;
import net.boyechko.pdf.autotag.document.ImageInfo;

/**
 * Typed form of a tagging plan document: the set of fixes to apply to one PDF, grouped by kind.
 *
 * @param warnings problems found while reading the plan, such as elements of an unknown type
 */
public record TaggingPlan(
        String inputPath,
        String outputPath,
        DocumentMetadata metadata,
        List<HeadingAction> headings,
        List<AltTextAction> altTexts,
        List<DecorativeAction> decoratives,
        List<ImageInfo> images,
        List<TableAction> tables,
        List<LinkAction> links,
        List<String> warnings) {

    public TaggingPlan {
        headings = List.copyOf(headings);
        altTexts = List.copyOf(altTexts);
        decoratives = List.copyOf(decoratives);
        images = List.copyOf(images);
        tables = List.copyOf(tables);
        links = List.copyOf(links);
        warnings = List.copyOf(warnings);
    }

    public boolean isEmpty() {
        return (metadata == null || (!metadata.hasTitle() && !metadata.hasLanguage()))
                && headings.isEmpty()
                && altTexts.isEmpty()
                && decoratives.isEmpty()
                && tables.isEmpty()
                && links.isEmpty();
    }
}
