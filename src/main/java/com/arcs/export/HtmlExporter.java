package com.arcs.export;

import com.arcs.config.ArcsConfig;
import com.arcs.model.Quote;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * Static HTML page for a quote, meant to be opened in a browser and printed.
 * Used when the PDF library isn't available.
 */
public class HtmlExporter implements QuoteExporter {

    private static final Logger log = LoggerFactory.getLogger(HtmlExporter.class);

    private final ArcsConfig config;

    public HtmlExporter(ArcsConfig config) {
        this.config = config;
    }

    @Override
    public String extension() {
        return "html";
    }

    @Override
    public Path export(Quote quote, Path target) throws QuoteExportException {
        Path out = Exporters.withExtension(target, extension());
        try {
            Path parent = out.toAbsolutePath().getParent();
            Files.createDirectories(parent);
            Files.writeString(out, render(quote), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new QuoteExportException("Couldn't write HTML quote to " + out, e);
        }
        log.info("Exported quote id={} as HTML to {}", quote.id(), out);
        return out;
    }

    String render(Quote quote) {
        QuoteDocument doc = QuoteDocument.of(quote, config);

        StringBuilder sb = new StringBuilder();
        sb.append("<!DOCTYPE html>\n");
        sb.append("<html><head><meta charset=\"utf-8\"><title>").append(escape(doc.title())).append("</title>\n");
        sb.append("<style>table{border-collapse:collapse}th,td{border:1px solid #444;padding:4px}"
                + "td.num{text-align:right}</style>\n");
        sb.append("</head><body>\n");
        sb.append("<h1>").append(escape(doc.heading())).append("</h1>\n");
        sb.append("<h2>").append(escape(doc.title())).append("</h2>\n");
        for (String line : doc.details()) {
            sb.append("<p>").append(escape(line)).append("</p>\n");
        }

        sb.append("<table>\n<tr>");
        for (String col : QuoteDocument.COLUMNS) {
            sb.append("<th>").append(escape(col)).append("</th>");
        }
        sb.append("</tr>\n");
        for (List<String> row : doc.rows()) {
            sb.append("<tr>");
            for (int i = 0; i < row.size(); i++) {
                // Qty, Unit, List, Line
                boolean numeric = i == 2 || i == 3 || i == 4 || i == 6;
                sb.append(numeric ? "<td class=\"num\">" : "<td>").append(escape(row.get(i))).append("</td>");
            }
            sb.append("</tr>\n");
        }
        sb.append("</table>\n");

        sb.append("<p><strong>").append(escape(doc.total())).append("</strong></p>\n");
        if (!doc.notes().isEmpty()) {
            sb.append("<h3>Notes</h3>\n<p>")
              .append(escape(doc.notes()).replace("\n", "<br>\n"))
              .append("</p>\n");
        }
        sb.append("</body></html>\n");
        return sb.toString();
    }

    // basic HTML text escaper
    static String escape(String raw) {
        if (raw == null) return "";
        StringBuilder sb = new StringBuilder(raw.length());
        for (int i = 0; i < raw.length(); i++) {
            char c = raw.charAt(i);
            switch (c) {
                case '&': sb.append("&amp;"); break;
                case '<': sb.append("&lt;"); break;
                case '>': sb.append("&gt;"); break;
                case '"': sb.append("&quot;"); break;
                case '\'': sb.append("&#39;"); break;
                default: sb.append(c);
            }
        }
        return sb.toString();
    }
}
