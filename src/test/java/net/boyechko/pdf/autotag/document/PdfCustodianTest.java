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

import static org.junit.jupiter.api.Assertions.*;

import com.itextpdf.kernel.exceptions.BadPasswordException;
import com.itextpdf.kernel.pdf.EncryptionConstants;
import com.itextpdf.kernel.pdf.PdfDocument;
import com.itextpdf.kernel.pdf.PdfReader;
import com.itextpdf.kernel.pdf.PdfWriter;
import com.itextpdf.kernel.pdf.ReaderProperties;
import com.itextpdf.kernel.pdf.WriterProperties;
import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import net.boyechko.pdf.autotag.PdfTestBase;
import org.junit.jupiter.api.Test;

class PdfCustodianTest extends PdfTestBase {
    private static final String PASSWORD = "password";

    private static Path createEncryptedPdf(Path output, String ownerPassword) throws IOException {
        WriterProperties props = new WriterProperties();
        props.setStandardEncryption(
                null,
                ownerPassword.getBytes(StandardCharsets.UTF_8),
                EncryptionConstants.ALLOW_PRINTING | EncryptionConstants.ALLOW_SCREENREADERS,
                EncryptionConstants.ENCRYPTION_AES_256
                        | EncryptionConstants.DO_NOT_ENCRYPT_METADATA);
        try (PdfDocument doc = new PdfDocument(new PdfWriter(output.toString(), props))) {
            doc.addNewPage();
        }
        return output;
    }

    @Test
    void incrementalUpdateKeepsOriginalBytesAsPrefix() throws Exception {
        Path pdf = createUntaggedPdf(testOutputPath(), textAt("Original", 72, 700));
        byte[] original = Files.readAllBytes(pdf);

        ByteArrayOutputStream revision = new ByteArrayOutputStream();
        try (PdfDocument doc = new PdfCustodian(pdf).openForIncrementalUpdate(revision)) {
            doc.getDocumentInfo().setTitle("Updated");
        }

        byte[] updated = revision.toByteArray();
        assertTrue(updated.length > original.length);
        assertArrayEquals(original, Arrays.copyOf(updated, original.length));
        try (PdfDocument reread =
                new PdfDocument(new PdfReader(new ByteArrayInputStream(updated)))) {
            assertEquals("Updated", reread.getDocumentInfo().getTitle());
        }
    }

    @Test
    void encryptedInputStaysEncrypted() throws Exception {
        Path pdf = createEncryptedPdf(testOutputPath(), PASSWORD);
        PdfCustodian custodian = new PdfCustodian(pdf, PASSWORD);
        assertTrue(custodian.isEncrypted());

        ByteArrayOutputStream revision = new ByteArrayOutputStream();
        try (PdfDocument doc = custodian.openForIncrementalUpdate(revision)) {
            doc.getDocumentInfo().setTitle("Protected");
        }

        ReaderProperties props =
                new ReaderProperties().setPassword(PASSWORD.getBytes(StandardCharsets.UTF_8));
        try (PdfReader reader =
                        new PdfReader(new ByteArrayInputStream(revision.toByteArray()), props);
                PdfDocument reread = new PdfDocument(reader)) {
            assertTrue(reader.isEncrypted());
            assertEquals("Protected", reread.getDocumentInfo().getTitle());
        }
    }

    @Test
    void wrongPasswordCannotOpenForUpdate() throws Exception {
        Path pdf = createEncryptedPdf(testOutputPath(), PASSWORD);
        PdfCustodian custodian = new PdfCustodian(pdf, "not-it");

        assertThrows(
                BadPasswordException.class,
                () -> custodian.openForIncrementalUpdate(new ByteArrayOutputStream()));
    }

    @Test
    void plainInputIsNotEncrypted() throws Exception {
        Path pdf = createUntaggedPdf(testOutputPath(), textAt("Open", 72, 700));

        assertFalse(new PdfCustodian(pdf).isEncrypted());
        try (PdfDocument doc = new PdfCustodian(pdf).openForReading()) {
            assertEquals(1, doc.getNumberOfPages());
        }
    }
}
