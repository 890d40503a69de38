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

import com.itextpdf.kernel.pdf.PdfDocument;
import java.util.Optional;
import net.boyechko.pdf.autotag.render.VisualVerifier;

/** State shared by the fixes of one write session. */
public class WriteContext {
    private final PdfDocument doc;
    private final RemediationSettings settings;
    private final VisualVerifier verifier;
    private final PdfWriteResult.Builder result;
    private final ProcessingListener listener;

    public WriteContext(
            PdfDocument doc,
            RemediationSettings settings,
            VisualVerifier verifier,
            PdfWriteResult.Builder result,
            ProcessingListener listener) {
        this.doc = doc;
        this.settings = settings;
        this.verifier = verifier;
        this.result = result;
        this.listener = listener != null ? listener : ProcessingListener.NONE;
    }

    public PdfDocument doc() {
        return doc;
    }

    public RemediationSettings settings() {
        return settings;
    }

    /** The verifier, or empty when visual verification is turned off. */
    public Optional<VisualVerifier> verifier() {
        return Optional.ofNullable(verifier);
    }

    public PdfWriteResult.Builder result() {
        return result;
    }

    public void change(String message) {
        result.addChange(message);
        listener.onChange(message);
    }

    public void warn(String message) {
        result.addWarning(message);
        listener.onWarning(message);
    }
}
