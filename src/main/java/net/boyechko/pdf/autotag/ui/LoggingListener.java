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

import ch.qos.logback.classic.LoggerContext;
import ch.qos.logback.classic.encoder.PatternLayoutEncoder;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.ConsoleAppender;
import net.boyechko.pdf.autotag.core.PdfWriteResult;
import net.boyechko.pdf.autotag.core.ProcessingListener;
import org.slf4j.LoggerFactory;

/** A {@link ProcessingListener} that routes all session events through SLF4J. */
public class LoggingListener implements ProcessingListener {

    static final String LOGGER_NAME = "net.boyechko.pdf.autotag.processing";

    private static final String CONSOLE_APPENDER_NAME = "AUTOTAG_CONSOLE";

    private static final org.slf4j.Logger logger = LoggerFactory.getLogger(LOGGER_NAME);

    /**
     * Creates a {@link LoggingListener} and ensures logs are emitted to stdout. A console appender
     * is added only when the root logger has no appender of its own.
     */
    public static LoggingListener withConsoleOutput() {
        ensureConsoleAppender();
        return new LoggingListener();
    }

    private static void ensureConsoleAppender() {
        LoggerContext ctx = (LoggerContext) LoggerFactory.getILoggerFactory();
        ch.qos.logback.classic.Logger root = ctx.getLogger(org.slf4j.Logger.ROOT_LOGGER_NAME);

        if (root.getAppender(CONSOLE_APPENDER_NAME) != null
                || root.iteratorForAppenders().hasNext()) {
            return;
        }

        PatternLayoutEncoder encoder = new PatternLayoutEncoder();
        encoder.setContext(ctx);
        encoder.setPattern("%-30logger{0} [%-5level] %msg%n");
        encoder.start();

        ConsoleAppender<ILoggingEvent> console = new ConsoleAppender<>();
        console.setName(CONSOLE_APPENDER_NAME);
        console.setContext(ctx);
        console.setEncoder(encoder);
        console.start();

        root.addAppender(console);
    }

    @Override
    public void onPhaseStart(String phaseName) {
        logger.info("PHASE {}", phaseName);
    }

    @Override
    public void onChange(String message) {
        logger.info("CHANGED {}", message);
    }

    @Override
    public void onWarning(String message) {
        logger.warn("{}", message);
    }

    @Override
    public void onError(String message) {
        logger.error("{}", message);
    }

    @Override
    public void onInfo(String message) {
        logger.info("{}", message);
    }

    @Override
    public void onSummary(PdfWriteResult result) {
        logger.info(
                "SUMMARY success={} changes={} warnings={} errors={} headings={} contrast={}",
                result.success(),
                result.changes().size(),
                result.warnings().size(),
                result.errors().size(),
                result.headingTagsApplied(),
                result.contrastFixesApplied());
    }
}
