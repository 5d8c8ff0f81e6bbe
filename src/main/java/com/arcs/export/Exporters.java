package com.arcs.export;

import com.arcs.config.ArcsConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.Locale;
import java.util.function.Predicate;

/**
 * Picks the exporter once at startup: PDF when PDFBox can be loaded, the HTML
 * page otherwise. A PDF that fails to render is reported, not retried as HTML.
 */
public final class Exporters {

    private static final Logger log = LoggerFactory.getLogger(Exporters.class);

    static final String PDF_PROBE_CLASS = "org.apache.pdfbox.pdmodel.PDDocument";

    private Exporters() {
    }

    public static QuoteExporter select(ArcsConfig config) {
        return select(config, Exporters::classPresent);
    }

    static QuoteExporter select(ArcsConfig config, Predicate<String> classPresent) {
        if (classPresent.test(PDF_PROBE_CLASS)) {
            log.debug("PDF library found, exporting quotes as PDF");
            return new StructuredExporter(config);
        }
        log.info("PDF library not available, exporting quotes as HTML");
        return new HtmlExporter(config);
    }

    private static boolean classPresent(String className) {
        try {
            Class.forName(className, false, Exporters.class.getClassLoader());
            return true;
        } catch (ClassNotFoundException | LinkageError e) {
            return false;
        }
    }

    /**
     * {@code quote.pdf} becomes {@code quote.html} for the HTML exporter and the
     * other way round; any other name just gets the extension appended.
     */
    static Path withExtension(Path target, String extension) {
        String name = target.getFileName().toString();
        String lower = name.toLowerCase(Locale.ROOT);
        if (lower.endsWith("." + extension)) {
            return target;
        }
        for (String known : new String[] {".pdf", ".html", ".htm"}) {
            if (lower.endsWith(known)) {
                return target.resolveSibling(name.substring(0, name.length() - known.length()) + "." + extension);
            }
        }
        return target.resolveSibling(name + "." + extension);
    }
}
