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

import com.itextpdf.kernel.pdf.PdfDocument;
import com.itextpdf.kernel.pdf.PdfReader;
import com.itextpdf.kernel.pdf.PdfWriter;
import com.itextpdf.kernel.pdf.ReaderProperties;
import com.itextpdf.kernel.pdf.StampingProperties;
import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Opens one PDF file the two ways a write session needs it: read-only for inspection, and in
 * append mode so every edit lands in a single new revision after the original bytes.
 */
public final class PdfCustodian {
    private static final Logger logger = LoggerFactory.getLogger(PdfCustodian.class);

    private final Path inputPath;
    private final String password;
    private Boolean encrypted;

    public PdfCustodian(Path inputPath, String password) {
        this.inputPath = inputPath;
        this.password = password;
    }

    public PdfCustodian(Path inputPath) {
        this(inputPath, null);
    }

    public Path inputPath() {
        return inputPath;
    }

    public PdfDocument openForReading() throws IOException {
        return new PdfDocument(new PdfReader(inputPath.toString(), readerProperties()));
    }

    /**
     * Opens the input for an incremental update whose bytes go to {@code sink}. The input is read
     * fully into memory first, so {@code sink} may end up overwriting the same file. The written
     * revision keeps the original's encryption.
     */
    public PdfDocument openForIncrementalUpdate(OutputStream sink) throws IOException {
        detectEncryption();

        byte[] original = Files.readAllBytes(inputPath);
        PdfReader pdfReader =
                new PdfReader(new ByteArrayInputStream(original), readerProperties());
        PdfWriter pdfWriter = new PdfWriter(sink);
        return new PdfDocument(pdfReader, pdfWriter, new StampingProperties().useAppendMode());
    }

    /** Returns whether the input is encrypted. */
    boolean isEncrypted() throws IOException {
        return detectEncryption();
    }

    private ReaderProperties readerProperties() {
        ReaderProperties props = new ReaderProperties();
        if (password != null) {
            props.setPassword(password.getBytes(StandardCharsets.UTF_8));
        }
        return props;
    }

    /** Opens the file once to learn whether it is encrypted; a wrong password fails here. */
    private boolean detectEncryption() throws IOException {
        if (encrypted == null) {
            try (PdfReader reader = new PdfReader(inputPath.toString(), readerProperties());
                    PdfDocument ignored = new PdfDocument(reader)) {
                encrypted = reader.isEncrypted();
                if (encrypted) {
                    logger.debug(
                            "{} is encrypted (crypto mode {}, permissions {})",
                            inputPath.getFileName(),
                            reader.getCryptoMode(),
                            reader.getPermissions());
                }
            }
        }
        return encrypted;
    }
}
