package com.arcs.purchasing;

import com.arcs.model.LineItem;
import com.arcs.model.Quote;
import com.arcs.model.QuoteValidationException;
import org.json.JSONArray;
import org.junit.jupiter.api.Test;

import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class PurchaseListTest {

    private static final OffsetDateTime CREATED = OffsetDateTime.of(2024, 12, 18, 10, 40, 0, 0, ZoneOffset.UTC);

    private static Quote quote() throws QuoteValidationException {
        var q = new Quote("1", "ARCS 2024-12-18", CREATED);
        q.setPoNumber("PO-5");
        q.addItem(LineItem.of("B-7", "Hinge", 4, 1.10, 2.25, "Bolt Co"));
        q.addItem(LineItem.of("A-1", "Bracket", 2, 3.50, 5.00, "Acme"));
        q.addItem(LineItem.of(" A-1 ", "Bracket again", 3, 3.20, 5.50, "Acme"));
        q.addItem(LineItem.of("A-1", "Other supplier", 1, 4.00, 6.00, "Zed"));
        q.addItem(LineItem.of("", "No part number", 1, 1.00, 1.00, ""));
        return q;
    }

    @Test
    void groups_by_part_and_source_summing_quantity_and_keeping_lowest_prices() throws Exception {
        var list = PurchaseList.of(quote(), 1);

        assertThat(list.lines()).extracting(PurchaseLine::partNumber, PurchaseLine::source)
                .containsExactly(
                        org.assertj.core.groups.Tuple.tuple("<unknown>", "<unknown>"),
                        org.assertj.core.groups.Tuple.tuple("A-1", "Acme"),
                        org.assertj.core.groups.Tuple.tuple("A-1", "Zed"),
                        org.assertj.core.groups.Tuple.tuple("B-7", "Bolt Co"));

        var acme = list.lines().get(1);
        assertThat(acme.quantity()).isEqualTo(5);
        assertThat(acme.unitCost()).isEqualTo(3.20);
        assertThat(acme.listPrice()).isEqualTo(5.00);
        assertThat(list.poNumber()).isEqualTo("PO-5");
    }

    @Test
    void lists_stay_per_quote() throws Exception {
        var second = new Quote("2", "", CREATED);
        second.addItem(LineItem.of("A-1", "", 10, 1, 1, "Acme"));

        var lists = PurchaseList.perQuote(List.of(quote(), second));

        assertThat(lists).hasSize(2);
        assertThat(lists.get(0).lines().get(1).quantity()).isEqualTo(5);
        assertThat(lists.get(1).lines().get(0).quantity()).isEqualTo(10);
        assertThat(lists.get(1).quoteName()).isEqualTo("Quote 2 (id: 2)");
    }

    @Test
    void text_report_has_header_table_and_empty_quotes() throws Exception {
        var empty = new Quote("3", "ARCS empty", CREATED);

        var text = PurchaseListReport.text(PurchaseList.perQuote(List.of(quote(), empty)));

        assertThat(text).contains("ARCS 2024-12-18   [PO: PO-5]");
        assertThat(text).contains("Part          Qty           Source        Unit Cost     List Price");
        assertThat(text).contains("A-1           5             Acme          3.20          5.00");
        assertThat(text).contains("ARCS empty: (no items)");
    }

    @Test
    void text_report_without_quotes() {
        assertThat(PurchaseListReport.text(List.of())).isEqualTo("No quotes to show.\n");
    }

    @Test
    void json_report_lists_parts_per_quote() throws Exception {
        var json = new JSONArray(PurchaseListReport.json(PurchaseList.perQuote(List.of(quote()))));

        assertThat(json.length()).isEqualTo(1);
        var entry = json.getJSONObject(0);
        assertThat(entry.getString("quote")).isEqualTo("ARCS 2024-12-18");
        assertThat(entry.getString("po")).isEqualTo("PO-5");
        var parts = entry.getJSONArray("parts");
        assertThat(parts.length()).isEqualTo(4);
        assertThat(parts.getJSONObject(1).getString("part_number")).isEqualTo("A-1");
        assertThat(parts.getJSONObject(1).getInt("quantity")).isEqualTo(5);
        assertThat(parts.getJSONObject(1).getDouble("unit_cost")).isEqualTo(3.20);
    }

    @Test
    void json_report_uses_null_for_missing_po() throws Exception {
        var q = new Quote("1", "x", CREATED);

        var json = new JSONArray(PurchaseListReport.json(PurchaseList.perQuote(List.of(q))));

        assertThat(json.getJSONObject(0).isNull("po")).isTrue();
        assertThat(json.getJSONObject(0).getJSONArray("parts").length()).isZero();
    }
}
