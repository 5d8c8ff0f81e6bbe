package com.arcs.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.fasterxml.jackson.annotation.JsonSetter;
import com.fasterxml.jackson.annotation.Nulls;

import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.OptionalDouble;
import java.util.Set;
import java.util.TreeSet;

/**
 * A customer-facing price proposal: header fields plus an ordered list of line items.
 *
 * <p>Totals are never stored; they are computed from the items every time they're asked for.
 * Item operations validate first and only then touch the list, so a failed call leaves
 * the quote exactly as it was.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonPropertyOrder({"id", "name", "po_number", "notes", "created_at", "modified_at", "suppliers", "items"})
public class Quote {

    /** Supplier key for rows with a blank source. */
    public static final String UNKNOWN_SUPPLIER = "<unknown>";

    @JsonProperty("id")
    private String id;                  // e.g. "1734518400"

    @JsonProperty("name")
    @JsonSetter(nulls = Nulls.AS_EMPTY)
    private String name = "";           // e.g. "ARCS 2024-12-18 [PO:PO-999]"

    @JsonProperty("po_number")
    @JsonInclude(JsonInclude.Include.NON_NULL)
    private String poNumber;            // optional

    @JsonProperty("notes")
    @JsonSetter(nulls = Nulls.AS_EMPTY)
    private String notes = "";

    @JsonProperty("created_at")
    private OffsetDateTime createdAt;

    @JsonProperty("modified_at")
    private OffsetDateTime modifiedAt;

    @JsonProperty("suppliers")
    @JsonSetter(nulls = Nulls.AS_EMPTY)
    @JsonInclude(JsonInclude.Include.NON_EMPTY)
    private Map<String, SupplierTerms> suppliers = new LinkedHashMap<>();

    @JsonProperty("items")
    @JsonSetter(nulls = Nulls.AS_EMPTY)
    private List<LineItem> items = new ArrayList<>();

    // for Jackson
    private Quote() {
    }

    public Quote(String id, String name, OffsetDateTime createdAt) {
        this.id = Objects.requireNonNull(id, "id");
        this.name = name == null ? "" : name;
        this.createdAt = createdAt;
        this.modifiedAt = createdAt;
    }

    /** Deep enough copy that edits to the copy never show up in this quote. */
    public Quote copy() {
        Quote q = new Quote();
        q.id = id;
        q.name = name;
        q.poNumber = poNumber;
        q.notes = notes;
        q.createdAt = createdAt;
        q.modifiedAt = modifiedAt;
        q.suppliers = new LinkedHashMap<>(suppliers);
        q.items = new ArrayList<>(items);
        return q;
    }

    // ---- Line items ----

    // Rows whose supplier has saved terms take the supplier's tax status.

    public void addItem(LineItem item) {
        Objects.requireNonNull(item, "item");
        items.add(withSupplierTerms(item, item.taxExempt()));
    }

    /** Parses the raw form values and appends the row. */
    public LineItem addItem(String partNumber, String description, String quantity,
                            String unitCost, String listPrice, String source) throws QuoteValidationException {
        LineItem item = LineItem.parse(partNumber, description, quantity, unitCost, listPrice, source);
        item = withSupplierTerms(item, false);
        items.add(item);
        return item;
    }

    /** Replaces the row at {@code index} (0-based). */
    public void editItem(int index, LineItem item) throws QuoteValidationException {
        checkIndex(index);
        Objects.requireNonNull(item, "item");
        items.set(index, withSupplierTerms(item, item.taxExempt()));
    }

    // a row keeps its tax status as long as its source doesn't change
    public LineItem editItem(int index, String partNumber, String description, String quantity,
                             String unitCost, String listPrice, String source) throws QuoteValidationException {
        checkIndex(index);
        LineItem old = items.get(index);
        LineItem item = LineItem.parse(partNumber, description, quantity, unitCost, listPrice, source);
        boolean sameSource = supplierKey(old.source()).equals(supplierKey(item.source()));
        item = withSupplierTerms(item, sameSource && old.taxExempt());
        items.set(index, item);
        return item;
    }

    private LineItem withSupplierTerms(LineItem item, boolean fallback) {
        SupplierTerms terms = suppliers.get(supplierKey(item.source()));
        return item.withTaxExempt(terms != null ? terms.taxExempt() : fallback);
    }

    public LineItem removeItem(int index) throws QuoteValidationException {
        checkIndex(index);
        return items.remove(index);
    }

    private void checkIndex(int index) throws QuoteValidationException {
        if (index < 0 || index >= items.size()) {
            throw new QuoteValidationException(
                    "No line item at position " + (index + 1) + " (quote has " + items.size() + ")");
        }
    }

    public List<LineItem> items() {
        return Collections.unmodifiableList(items);
    }

    // ---- Totals ----

    /** Sum of quantity x list price over all rows. */
    public double totalPrice() {
        double total = 0.0;
        for (LineItem item : items) {
            total += item.extendedPrice();
        }
        return total;
    }

    /** Sum of quantity x unit cost over all rows. */
    public double totalCost() {
        double total = 0.0;
        for (LineItem item : items) {
            total += item.extendedCost();
        }
        return total;
    }

    public double margin() {
        return totalPrice() - totalCost();
    }

    /**
     * Margin as a percentage of the total price. Empty when nothing is charged
     * but something is spent, where a percentage means nothing.
     */
    public OptionalDouble marginPercent() {
        double price = totalPrice();
        if (price == 0.0) {
            return totalCost() == 0.0 ? OptionalDouble.of(0.0) : OptionalDouble.empty();
        }
        return OptionalDouble.of(margin() / price * 100.0);
    }

    // ---- Suppliers ----

    /** Trimmed source, or {@link #UNKNOWN_SUPPLIER} when blank. */
    public static String supplierKey(String source) {
        String key = source == null ? "" : source.trim();
        return key.isEmpty() ? UNKNOWN_SUPPLIER : key;
    }

    /** Distinct supplier keys of the current rows, sorted. */
    public Set<String> supplierNames() {
        Set<String> names = new TreeSet<>();
        for (LineItem item : items) {
            names.add(supplierKey(item.source()));
        }
        return names;
    }

    public Map<String, SupplierTerms> suppliers() {
        return Collections.unmodifiableMap(suppliers);
    }

    public boolean isTaxExempt(String supplier) {
        SupplierTerms terms = suppliers.get(supplierKey(supplier));
        return terms != null && terms.taxExempt();
    }

    /**
     * Records the supplier's tax status and applies it to every row from that supplier.
     *
     * @return how many rows come from {@code supplier}
     */
    public int setTaxExempt(String supplier, boolean exempt) {
        String key = supplierKey(supplier);
        suppliers.put(key, SupplierTerms.of(exempt));
        int matched = 0;
        for (int i = 0; i < items.size(); i++) {
            LineItem item = items.get(i);
            if (supplierKey(item.source()).equals(key)) {
                items.set(i, item.withTaxExempt(exempt));
                matched++;
            }
        }
        return matched;
    }

    // ---- Header ----

    public String id() {
        return id;
    }

    // not a bean setter: ids missing from a file are repaired by QuoteDatabase, not rejected by Jackson
    public void assignId(String id) {
        this.id = Objects.requireNonNull(id, "id");
    }

    public String name() {
        return name;
    }

    public void setName(String name) {
        this.name = name == null ? "" : name;
    }

    public String poNumber() {
        return poNumber;
    }

    public boolean hasPoNumber() {
        return poNumber != null && !poNumber.isBlank();
    }

    /** Trims the value; blank clears the PO number. */
    public void setPoNumber(String poNumber) {
        this.poNumber = (poNumber == null || poNumber.isBlank()) ? null : poNumber.trim();
    }

    public String notes() {
        return notes;
    }

    public void setNotes(String notes) {
        this.notes = notes == null ? "" : notes;
    }

    public OffsetDateTime createdAt() {
        return createdAt;
    }

    public OffsetDateTime modifiedAt() {
        return modifiedAt;
    }

    public void setModifiedAt(OffsetDateTime modifiedAt) {
        this.modifiedAt = modifiedAt;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Quote)) {
            return false;
        }
        Quote other = (Quote) o;
        return Objects.equals(id, other.id)
                && Objects.equals(name, other.name)
                && Objects.equals(poNumber, other.poNumber)
                && Objects.equals(notes, other.notes)
                && Objects.equals(createdAt, other.createdAt)
                && Objects.equals(modifiedAt, other.modifiedAt)
                && suppliers.equals(other.suppliers)
                && items.equals(other.items);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, name, poNumber, notes, createdAt, modifiedAt, suppliers, items);
    }

    @Override
    public String toString() {
        return "Quote[" + id + " '" + name + "', " + items.size() + " items]";
    }
}
