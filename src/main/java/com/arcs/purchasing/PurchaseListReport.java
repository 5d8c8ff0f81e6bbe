package com.arcs.purchasing;

import org.json.JSONArray;
import org.json.JSONObject;

import java.util.List;
import java.util.Locale;

/**
 * Prints purchase lists as a fixed-width text table or as JSON.
 *
 * <p>Text layout, one block per quote:
 * <pre>
 * ============================================================
 * ARCS 2024-12-18   [PO: PO-999]
 * ------------------------------------------------------------
 * Part          Qty           Source        Unit Cost     List Price
 * ------------------------------------------------------------------
 * A-1           2             Acme          3.50          5.00
 * </pre>
 */
public final class PurchaseListReport {

    private static final String[] COLUMNS = {"Part", "Qty", "Source", "Unit Cost", "List Price"};
    private static final int MIN_WIDTH = 12;

    private PurchaseListReport() {
    }

    public static String text(List<PurchaseList> lists) {
        if (lists.isEmpty()) {
            return "No quotes to show.\n";
        }
        StringBuilder sb = new StringBuilder();
        for (PurchaseList list : lists) {
            if (list.isEmpty()) {
                sb.append('\n').append(list.quoteName()).append(": (no items)\n");
                continue;
            }
            sb.append('\n').append("=".repeat(60)).append('\n');
            sb.append(list.quoteName());
            if (list.poNumber() != null && !list.poNumber().isBlank()) {
                sb.append("   [PO: ").append(list.poNumber()).append(']');
            }
            sb.append('\n').append("-".repeat(60)).append('\n');
            table(sb, list.lines());
        }
        sb.append('\n');
        return sb.toString();
    }

    private static void table(StringBuilder sb, List<PurchaseLine> lines) {
        int[] widths = new int[COLUMNS.length];
        for (int i = 0; i < COLUMNS.length; i++) {
            widths[i] = Math.max(COLUMNS[i].length(), MIN_WIDTH);
        }
        // only the text-ish columns grow; prices always fit in 12
        for (PurchaseLine line : lines) {
            widths[0] = Math.max(widths[0], line.partNumber().length());
            widths[1] = Math.max(widths[1], Integer.toString(line.quantity()).length());
            widths[2] = Math.max(widths[2], line.source().length());
        }

        row(sb, widths, COLUMNS);
        int total = 2 * (widths.length - 1);
        for (int w : widths) {
            total += w;
        }
        sb.append("-".repeat(total)).append('\n');

        for (PurchaseLine line : lines) {
            row(sb, widths, new String[] {
                    line.partNumber(),
                    Integer.toString(line.quantity()),
                    line.source(),
                    money(line.unitCost()),
                    money(line.listPrice())});
        }
    }

    private static void row(StringBuilder sb, int[] widths, String[] cells) {
        StringBuilder row = new StringBuilder();
        for (int i = 0; i < cells.length; i++) {
            if (i > 0) {
                row.append("  ");
            }
            row.append(String.format("%-" + widths[i] + "s", cells[i]));
        }
        sb.append(row).append('\n');
    }

    public static String json(List<PurchaseList> lists) {
        JSONArray out = new JSONArray();
        for (PurchaseList list : lists) {
            JSONArray parts = new JSONArray();
            for (PurchaseLine line : list.lines()) {
                parts.put(new JSONObject()
                        .put("part_number", line.partNumber())
                        .put("source", line.source())
                        .put("quantity", line.quantity())
                        .put("unit_cost", line.unitCost())
                        .put("list_price", line.listPrice()));
            }
            out.put(new JSONObject()
                    .put("quote", list.quoteName())
                    .put("po", list.poNumber() != null ? list.poNumber() : JSONObject.NULL)
                    .put("parts", parts));
        }
        return out.toString(2);
    }

    private static String money(double value) {
        return String.format(Locale.ROOT, "%.2f", value);
    }
}
