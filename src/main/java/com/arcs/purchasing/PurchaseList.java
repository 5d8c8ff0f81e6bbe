package com.arcs.purchasing;

import com.arcs.model.LineItem;
import com.arcs.model.Quote;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * What has to be bought for one quote. Rows are grouped by (part number, source);
 * quantities add up and the cheapest unit cost and list price win.
 */
public class PurchaseList {

    static final String UNKNOWN = Quote.UNKNOWN_SUPPLIER;

    private static final Comparator<PurchaseLine> ORDER =
            Comparator.comparing(PurchaseLine::partNumber).thenComparing(PurchaseLine::source);

    private final String quoteName;
    private final String poNumber;
    private final List<PurchaseLine> lines;

    private PurchaseList(String quoteName, String poNumber, List<PurchaseLine> lines) {
        this.quoteName = quoteName;
        this.poNumber = poNumber;
        this.lines = lines;
    }

    /** One list per quote, in quote order. Nothing is aggregated across quotes. */
    public static List<PurchaseList> perQuote(List<Quote> quotes) {
        List<PurchaseList> lists = new ArrayList<>();
        for (int i = 0; i < quotes.size(); i++) {
            lists.add(of(quotes.get(i), i + 1));
        }
        return lists;
    }

    /** @param position 1-based, used to name quotes that have no name */
    public static PurchaseList of(Quote quote, int position) {
        Map<String, PurchaseLine> byKey = new LinkedHashMap<>();
        for (LineItem item : quote.items()) {
            String part = orUnknown(item.partNumber());
            String source = Quote.supplierKey(item.source());
            String key = part + '\u0000' + source;
            PurchaseLine line = byKey.get(key);
            if (line == null) {
                byKey.put(key, new PurchaseLine(part, source, item.quantity(), item.unitCost(), item.listPrice()));
            } else {
                line.merge(item.quantity(), item.unitCost(), item.listPrice());
            }
        }

        List<PurchaseLine> lines = new ArrayList<>(byKey.values());
        lines.sort(ORDER);

        String name = quote.name() == null || quote.name().isBlank()
                ? "Quote " + position + " (id: " + quote.id() + ")"
                : quote.name();
        return new PurchaseList(name, quote.poNumber(), lines);
    }

    private static String orUnknown(String value) {
        String trimmed = value == null ? "" : value.trim();
        return trimmed.isEmpty() ? UNKNOWN : trimmed;
    }

    public String quoteName() {
        return quoteName;
    }

    /** may be null */
    public String poNumber() {
        return poNumber;
    }

    public List<PurchaseLine> lines() {
        return lines;
    }

    public boolean isEmpty() {
        return lines.isEmpty();
    }
}
