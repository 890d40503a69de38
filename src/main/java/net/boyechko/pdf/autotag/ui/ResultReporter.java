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
package net.boyechko.pdf.autotag.ui;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import java.io.PrintStream;
import net.boyechko.pdf.autotag.core.PdfWriteResult;
import net.boyechko.pdf.autotag.core.ProcessingListener;
import net.boyechko.pdf.autotag.core.VerbosityLevel;

/**
 * Prints session progress and the final result for a human reader, or the result alone as JSON.
 */
public class ResultReporter implements ProcessingListener {
    private static final String SUCCESS = "✓";
    private static final String ERROR = "⛔️";
    private static final String WARNING = "✗";
    private static final String INFO = "○";

    private static final String INDENT = "│ ";
    private static final int HEADER_WIDTH = 68;

    private final PrintStream output;
    private final VerbosityLevel verbosity;
    private final boolean json;
    private final ObjectMapper mapper;

    private boolean phaseOpen = false;

    public ResultReporter(PrintStream output, VerbosityLevel verbosity) {
        this(output, verbosity, false);
    }

    public ResultReporter(PrintStream output, VerbosityLevel verbosity, boolean json) {
        this.output = output;
        this.verbosity = verbosity;
        this.json = json;
        this.mapper = new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);
    }

    @Override
    public void onPhaseStart(String phaseName) {
        if (showText(VerbosityLevel.VERBOSE)) {
            closePhaseBoxIfOpen();
            printBoxHeader(phaseName);
            phaseOpen = true;
        }
    }

    @Override
    public void onChange(String message) {
        if (showText(VerbosityLevel.VERBOSE)) {
            printLine(message, SUCCESS);
        }
    }

    @Override
    public void onWarning(String message) {
        if (showText(VerbosityLevel.VERBOSE)) {
            printLine(message, WARNING);
        }
    }

    @Override
    public void onInfo(String message) {
        if (showText(VerbosityLevel.VERBOSE)) {
            printLine(message, INFO);
        }
    }

    @Override
    public void onSummary(PdfWriteResult result) {
        if (json) {
            output.println(toJson(result));
            return;
        }
        closePhaseBoxIfOpen();
        if (!showText(VerbosityLevel.NORMAL)) {
            for (String error : result.errors()) {
                printLine(error, ERROR);
            }
            return;
        }

        printBoxHeader("Summary");
        for (String error : result.errors()) {
            printLine(error, ERROR);
        }
        if (!verbosity.isAtLeast(VerbosityLevel.VERBOSE)) {
            result.changes().forEach(change -> printLine(change, SUCCESS));
            result.warnings().forEach(warning -> printLine(warning, WARNING));
        }
        printLine("Changes applied: " + result.changes().size(), INFO);
        printLine("Heading tags: " + result.headingTagsApplied(), INFO);
        printLine("Contrast fixes: " + result.contrastFixesApplied(), INFO);
        if (result.success() && result.outputPath() != null) {
            printLine("Output saved to " + result.outputPath(), SUCCESS);
        }
        printBoxFooter();
    }

    /** Serializes {@code result} with its snake_case keys. */
    public String toJson(PdfWriteResult result) {
        try {
            return mapper.writeValueAsString(result);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Could not serialize result", e);
        }
    }

    private boolean showText(VerbosityLevel level) {
        return !json && verbosity.isAtLeast(level);
    }

    private void closePhaseBoxIfOpen() {
        if (phaseOpen) {
            printBoxFooter();
            phaseOpen = false;
        }
    }

    private void printBoxHeader(String title) {
        String prefix = "╭── " + title + " ";
        output.println(prefix + "─".repeat(Math.max(0, HEADER_WIDTH - prefix.length())));
    }

    private void printBoxFooter() {
        output.println("╰" + "─".repeat(HEADER_WIDTH - 1));
        output.println();
    }

    private void printLine(String message, String marker) {
        output.println(INDENT + marker + " " + message);
    }
}
