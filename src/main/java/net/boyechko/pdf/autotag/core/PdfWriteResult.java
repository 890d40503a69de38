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

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import java.util.ArrayList;
import java.util.List;

/**
 * Outcome of one write session. Partial application is normal: fixes that could not be applied
 * show up in {@code warnings} while {@code success} stays true. {@code success} is false only for
 * input and fatal errors.
 */
@JsonPropertyOrder({
    "success",
    "output_path",
    "changes",
    "warnings",
    "errors",
    "heading_tags_applied",
    "contrast_fixes_applied"
})
public record PdfWriteResult(
        @JsonProperty("success") boolean success,
        @JsonProperty("output_path") String outputPath,
        @JsonProperty("changes") List<String> changes,
        @JsonProperty("warnings") List<String> warnings,
        @JsonProperty("errors") List<String> errors,
        @JsonProperty("heading_tags_applied") int headingTagsApplied,
        @JsonProperty("contrast_fixes_applied") int contrastFixesApplied) {

    public PdfWriteResult {
        changes = List.copyOf(changes);
        warnings = List.copyOf(warnings);
        errors = List.copyOf(errors);
    }

    public static PdfWriteResult failure(String error) {
        return new PdfWriteResult(false, null, List.of(), List.of(), List.of(error), 0, 0);
    }

    public boolean hasWarnings() {
        return !warnings.isEmpty();
    }

    /** Accumulates a result while a session runs. */
    public static final class Builder {
        private String outputPath;
        private final List<String> changes = new ArrayList<>();
        private final List<String> warnings = new ArrayList<>();
        private final List<String> errors = new ArrayList<>();
        private int headingTagsApplied;
        private int contrastFixesApplied;

        public Builder outputPath(String outputPath) {
            this.outputPath = outputPath;
            return this;
        }

        public Builder addChange(String change) {
            changes.add(change);
            return this;
        }

        public Builder addWarning(String warning) {
            warnings.add(warning);
            return this;
        }

        public Builder addError(String error) {
            errors.add(error);
            return this;
        }

        /** Records a fatal error ahead of any others. */
        public Builder addFatalError(String error) {
            errors.add(0, error);
            return this;
        }

        public Builder headingTagApplied() {
            headingTagsApplied++;
            return this;
        }

        public Builder contrastFixesApplied(int count) {
            contrastFixesApplied += count;
            return this;
        }

        public int changeCount() {
            return changes.size();
        }

        public PdfWriteResult build(boolean success) {
            return new PdfWriteResult(
                    success,
                    outputPath,
                    changes,
                    warnings,
                    errors,
                    headingTagsApplied,
                    contrastFixesApplied);
        }
    }
}
