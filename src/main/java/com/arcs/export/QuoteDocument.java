package com.arcs.export;

import com.arcs.config.ArcsConfig;
import com.arcs.model.LineItem;
import com.arcs.model.Quote;

import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;

/**
 * The printable content of a quote as plain strings, laid out the same way
 * whichever exporter draws it.
 */
final class QuoteDocument {

    static final List<String> COLUMNS =
            List.of("Part", "Description", "Qty", "Unit", "List", "Source", "Line");

    private final String heading;
    private final String title;
    private final List<String> details;
    private final List<List<String>> rows;
    private final String total;
    private final String notes;

    private QuoteDocument(String heading, String title, List<String> details,
                          List<List<String>> rows, String total, String notes) {
        this.heading = heading;
        this.title = title;
        this.details = details;
        this.rows = rows;
        this.total = total;
        this.notes = notes;
    }

    static QuoteDocument of(Quote quote, ArcsConfig config) {
        String currency = config.currencySymbol();

        List<String> details = new ArrayList<>();
        if (quote.hasPoNumber()) {
            details.add("PO: " + quote.poNumber());
        }
        if (quote.createdAt() != null) {
            details.add("Date: " + DateTimeFormatter.ISO_LOCAL_DATE.format(quote.createdAt()));
        }

        List<List<String>> rows = new ArrayList<>();
        for (LineItem item : quote.items()) {
            rows.add(List.of(
                    item.partNumber(),
                    item.description(),
                    Integer.toString(item.quantity()),
                    amount(item.unitCost()),
                    amount(item.listPrice()),
                    item.sourceLabel(),
                    amount(item.extendedPrice())));
        }

        return new QuoteDocument(
                config.companyName(),
                quote.name(),
                Collections.unmodifiableList(details),
                Collections.unmodifiableList(rows),
                "Total: " + currency + amount(quote.totalPrice()),
                quote.notes() == null ? "" : quote.notes().strip());
    }

    static String amount(double value) {
        return String.format(Locale.ROOT, "%.2f", value);
    }

    String heading() {
        return heading;
    }

    String title() {
        return title;
    }

    List<String> details() {
        return details;
    }

    List<List<String>> rows() {
        return rows;
    }

    String total() {
        return total;
    }

    String notes() {
        return notes;
    }
}
