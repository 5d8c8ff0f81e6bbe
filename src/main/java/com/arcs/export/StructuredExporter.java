package com.arcs.export;

import com.arcs.config.ArcsConfig;
import com.arcs.model.Quote;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.pdmodel.PDPage;
import org.apache.pdfbox.pdmodel.PDPageContentStream;
import org.apache.pdfbox.pdmodel.common.PDRectangle;
import org.apache.pdfbox.pdmodel.font.PDFont;
import org.apache.pdfbox.pdmodel.font.PDType1Font;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Tabular PDF for a quote, drawn with PDFBox on US Letter pages: a heading,
 * the quote name and details, one table row per line item, then the total and
 * any notes. Long tables continue on new pages with the column header repeated.
 */
public class StructuredExporter implements QuoteExporter {

    private static final Logger log = LoggerFactory.getLogger(StructuredExporter.class);

    private static final PDFont REGULAR = PDType1Font.HELVETICA;
    private static final PDFont BOLD = PDType1Font.HELVETICA_BOLD;

    private static final float MARGIN = 54f;
    private static final float TOP = PDRectangle.LETTER.getHeight() - MARGIN;
    private static final float BOTTOM = 72f;
    private static final float ROW_HEIGHT = 14f;
    private static final float TABLE_FONT_SIZE = 9f;
    private static final float CELL_PADDING = 3f;

    // Part, Description, Qty, Unit, List, Source, Line -- adds up to the printable width (504pt)
    private static final float[] COLUMN_WIDTHS = {72f, 130f, 32f, 52f, 52f, 104f, 62f};

    private final ArcsConfig config;

    public StructuredExporter(ArcsConfig config) {
        this.config = config;
    }

    @Override
    public String extension() {
        return "pdf";
    }

    @Override
    public Path export(Quote quote, Path target) throws QuoteExportException {
        Path out = Exporters.withExtension(target, extension());
        QuoteDocument doc = QuoteDocument.of(quote, config);
        try (PDDocument pdf = new PDDocument()) {
            Path parent = out.toAbsolutePath().getParent();
            Files.createDirectories(parent);
            render(pdf, doc);
            pdf.save(out.toFile());
        } catch (IOException | IllegalArgumentException e) {
            throw new QuoteExportException("Couldn't render PDF quote to " + out, e);
        }
        log.info("Exported quote id={} as PDF to {} ({} rows)", quote.id(), out, doc.rows().size());
        return out;
    }

    private void render(PDDocument pdf, QuoteDocument doc) throws IOException {
        try (PageWriter page = new PageWriter(pdf)) {
            page.text(BOLD, 16f, MARGIN, doc.heading());
            page.advance(25f);
            page.text(BOLD, 14f, MARGIN, doc.title());
            page.advance(18f);
            for (String line : doc.details()) {
                page.text(REGULAR, 10f, MARGIN, line);
                page.advance(13f);
            }
            page.advance(10f);

            page.tableHeader();
            for (List<String> row : doc.rows()) {
                if (page.needsBreak(ROW_HEIGHT)) {
                    page.newPage();
                    page.tableHeader();
                }
                page.tableRow(REGULAR, row);
            }

            page.advance(10f);
            if (page.needsBreak(ROW_HEIGHT * 2)) {
                page.newPage();
            }
            page.text(BOLD, 12f, MARGIN, doc.total());
            page.advance(22f);

            if (!doc.notes().isEmpty()) {
                page.text(BOLD, 10f, MARGIN, "Notes");
                page.advance(13f);
                for (String line : wrap(doc.notes(), REGULAR, 10f, PDRectangle.LETTER.getWidth() - 2 * MARGIN)) {
                    if (page.needsBreak(13f)) {
                        page.newPage();
                    }
                    page.text(REGULAR, 10f, MARGIN, line);
                    page.advance(13f);
                }
            }
        }
    }

    // ---- Text helpers ----

    // Helvetica only covers WinAnsi; anything else would make showText throw
    static String printable(PDFont font, String raw) {
        StringBuilder sb = new StringBuilder(raw.length());
        raw.codePoints().forEach(cp -> {
            if (Character.isWhitespace(cp) || Character.isISOControl(cp)) {
                sb.append(' ');
            } else if (canEncode(font, cp)) {
                sb.appendCodePoint(cp);
            } else {
                sb.append('?');
            }
        });
        return sb.toString();
    }

    private static boolean canEncode(PDFont font, int codePoint) {
        try {
            font.encode(new String(Character.toChars(codePoint)));
            return true;
        } catch (IllegalArgumentException | IOException e) {
            return false;
        }
    }

    private static float width(PDFont font, float size, String text) throws IOException {
        return font.getStringWidth(text) / 1000f * size;
    }

    // cuts the text down to fit, ending it with "..."
    static String fit(PDFont font, float size, String text, float maxWidth) throws IOException {
        if (width(font, size, text) <= maxWidth) {
            return text;
        }
        String cut = text;
        while (!cut.isEmpty() && width(font, size, cut + "...") > maxWidth) {
            cut = cut.substring(0, cut.length() - 1);
        }
        return cut + "...";
    }

    static List<String> wrap(String text, PDFont font, float size, float maxWidth) throws IOException {
        List<String> lines = new ArrayList<>();
        for (String paragraph : text.split("\\R", -1)) {
            StringBuilder line = new StringBuilder();
            for (String word : printable(font, paragraph).split(" +")) {
                String candidate = line.length() == 0 ? word : line + " " + word;
                if (line.length() > 0 && width(font, size, candidate) > maxWidth) {
                    lines.add(line.toString());
                    line = new StringBuilder(word);
                } else {
                    line = new StringBuilder(candidate);
                }
            }
            lines.add(fit(font, size, line.toString(), maxWidth));
        }
        return lines;
    }

    // ---- Page handling ----

    /** Owns the open content stream and the current baseline, starting pages as needed. */
    private static final class PageWriter implements AutoCloseable {

        private final PDDocument pdf;
        private PDPageContentStream stream;
        private float y;

        PageWriter(PDDocument pdf) throws IOException {
            this.pdf = pdf;
            newPage();
        }

        void newPage() throws IOException {
            if (stream != null) {
                stream.close();
            }
            PDPage page = new PDPage(PDRectangle.LETTER);
            pdf.addPage(page);
            stream = new PDPageContentStream(pdf, page);
            y = TOP;
        }

        boolean needsBreak(float height) {
            return y - height < BOTTOM;
        }

        void advance(float height) {
            y -= height;
        }

        void text(PDFont font, float size, float x, String raw) throws IOException {
            String text = fit(font, size, printable(font, raw), PDRectangle.LETTER.getWidth() - MARGIN - x);
            stream.beginText();
            stream.setFont(font, size);
            stream.newLineAtOffset(x, y);
            stream.showText(text);
            stream.endText();
        }

        void tableHeader() throws IOException {
            tableRow(BOLD, QuoteDocument.COLUMNS);
            rule();
        }

        void tableRow(PDFont font, List<String> cells) throws IOException {
            float x = MARGIN;
            for (int i = 0; i < cells.size(); i++) {
                float cellWidth = COLUMN_WIDTHS[i] - 2 * CELL_PADDING;
                String text = fit(font, TABLE_FONT_SIZE, printable(font, cells.get(i)), cellWidth);
                stream.beginText();
                stream.setFont(font, TABLE_FONT_SIZE);
                stream.newLineAtOffset(x + CELL_PADDING, y);
                stream.showText(text);
                stream.endText();
                x += COLUMN_WIDTHS[i];
            }
            advance(ROW_HEIGHT);
        }

        private void rule() throws IOException {
            float lineY = y + ROW_HEIGHT - 3f;
            stream.setLineWidth(0.5f);
            stream.moveTo(MARGIN, lineY);
            stream.lineTo(PDRectangle.LETTER.getWidth() - MARGIN, lineY);
            stream.stroke();
        }

        @Override
        public void close() throws IOException {
            stream.close();
        }
    }
}
