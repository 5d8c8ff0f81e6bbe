package com.arcs.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.Objects;

/**
 * One part / quantity / price row of a quote.
 *
 * <p>Instances are immutable and always valid: quantity and both prices are
 * non-negative. Editing a row means replacing it.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonPropertyOrder({"part_number", "description", "quantity", "unit_cost", "list_price", "source", "tax_exempt", "line_total"})
public final class LineItem {

    @JsonProperty("part_number")
    private final String partNumber;    // e.g. "A-1042"

    @JsonProperty("description")
    private final String description;

    @JsonProperty("quantity")
    private final int quantity;

    @JsonProperty("unit_cost")
    private final double unitCost;      // what we pay

    @JsonProperty("list_price")
    private final double listPrice;     // what the customer pays

    @JsonProperty("source")
    private final String source;        // supplier / vendor

    @JsonProperty("tax_exempt")
    private final boolean taxExempt;    // set per supplier, see Quote#setTaxExempt

    private LineItem(String partNumber, String description, int quantity,
                     double unitCost, double listPrice, String source, boolean taxExempt) {
        this.partNumber = partNumber;
        this.description = description;
        this.quantity = quantity;
        this.unitCost = unitCost;
        this.listPrice = listPrice;
        this.source = source;
        this.taxExempt = taxExempt;
    }

    /**
     * Builds a row from numeric values.
     *
     * @throws QuoteValidationException if the quantity or a price is negative or not finite
     */
    public static LineItem of(String partNumber, String description, int quantity,
                              double unitCost, double listPrice, String source) throws QuoteValidationException {
        String problem = problemWith(quantity, unitCost, listPrice);
        if (problem != null) {
            throw new QuoteValidationException(problem);
        }
        return new LineItem(clean(partNumber), clean(description), quantity, unitCost, listPrice, clean(source), false);
    }

    /**
     * Builds a row from raw form input, the way a user types it.
     *
     * @throws QuoteValidationException if quantity isn't a whole number &ge; 0 or a price isn't a number &ge; 0
     */
    public static LineItem parse(String partNumber, String description, String quantity,
                                 String unitCost, String listPrice, String source) throws QuoteValidationException {
        return of(partNumber, description,
                parseQuantity(quantity),
                parsePrice("Unit cost", unitCost),
                parsePrice("List price", listPrice),
                source);
    }

    // Jackson entry point. Missing values read as empty / zero; bad ones fail the whole document.
    @JsonCreator
    static LineItem fromJson(@JsonProperty("part_number") String partNumber,
                             @JsonProperty("description") String description,
                             @JsonProperty("quantity") Integer quantity,
                             @JsonProperty("unit_cost") Double unitCost,
                             @JsonProperty("list_price") Double listPrice,
                             @JsonProperty("source") String source,
                             @JsonProperty("tax_exempt") Boolean taxExempt) {
        int qty = quantity != null ? quantity : 0;
        double unit = unitCost != null ? unitCost : 0.0;
        double list = listPrice != null ? listPrice : 0.0;
        String problem = problemWith(qty, unit, list);
        if (problem != null) {
            throw new IllegalArgumentException(problem);
        }
        return new LineItem(clean(partNumber), clean(description), qty, unit, list, clean(source),
                taxExempt != null && taxExempt);
    }

    private static String problemWith(int quantity, double unitCost, double listPrice) {
        if (quantity < 0) {
            return "Quantity must not be negative: " + quantity;
        }
        if (!Double.isFinite(unitCost) || unitCost < 0) {
            return "Unit cost must be a non-negative number: " + unitCost;
        }
        if (!Double.isFinite(listPrice) || listPrice < 0) {
            return "List price must be a non-negative number: " + listPrice;
        }
        return null;
    }

    private static int parseQuantity(String raw) throws QuoteValidationException {
        String text = raw == null ? "" : raw.trim();
        try {
            return Integer.parseInt(text);
        } catch (NumberFormatException e) {
            throw new QuoteValidationException("Quantity must be a whole number: '" + text + "'");
        }
    }

    private static double parsePrice(String label, String raw) throws QuoteValidationException {
        String text = raw == null ? "" : raw.trim();
        // allow "$12.50" and "1,200.00" as typed in the form
        String digits = text.replace("$", "").replace(",", "");
        try {
            return Double.parseDouble(digits);
        } catch (NumberFormatException e) {
            throw new QuoteValidationException(label + " must be a number: '" + text + "'");
        }
    }

    private static String clean(String value) {
        return value == null ? "" : value.trim();
    }

    // ---- Derived values ----

    /** quantity x list price */
    @JsonProperty(value = "line_total", access = JsonProperty.Access.READ_ONLY)
    public double extendedPrice() {
        return quantity * listPrice;
    }

    /** quantity x unit cost */
    public double extendedCost() {
        return quantity * unitCost;
    }

    public LineItem withTaxExempt(boolean exempt) {
        if (exempt == taxExempt) {
            return this;
        }
        return new LineItem(partNumber, description, quantity, unitCost, listPrice, source, exempt);
    }

    /** Source as shown to people: "Acme (Tax Exempt)" for exempt rows. */
    public String sourceLabel() {
        return taxExempt ? source + " (Tax Exempt)" : source;
    }

    // ---- Accessors ----

    public String partNumber() {
        return partNumber;
    }

    public String description() {
        return description;
    }

    public int quantity() {
        return quantity;
    }

    public double unitCost() {
        return unitCost;
    }

    public double listPrice() {
        return listPrice;
    }

    public String source() {
        return source;
    }

    public boolean taxExempt() {
        return taxExempt;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof LineItem)) {
            return false;
        }
        LineItem other = (LineItem) o;
        return quantity == other.quantity
                && taxExempt == other.taxExempt
                && Double.compare(unitCost, other.unitCost) == 0
                && Double.compare(listPrice, other.listPrice) == 0
                && partNumber.equals(other.partNumber)
                && description.equals(other.description)
                && source.equals(other.source);
    }

    @Override
    public int hashCode() {
        return Objects.hash(partNumber, description, quantity, unitCost, listPrice, source, taxExempt);
    }

    @Override
    public String toString() {
        return partNumber + " x" + quantity + " @ " + listPrice + " (" + source + ")";
    }
}
