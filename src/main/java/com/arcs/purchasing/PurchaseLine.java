package com.arcs.purchasing;

/**
 * One part to buy: every row of a quote with the same part number and source,
 * folded together.
 */
public class PurchaseLine {

    private final String partNumber;
    private final String source;
    private int quantity;
    private double unitCost;     // lowest seen
    private double listPrice;    // lowest seen

    PurchaseLine(String partNumber, String source, int quantity, double unitCost, double listPrice) {
        this.partNumber = partNumber;
        this.source = source;
        this.quantity = quantity;
        this.unitCost = unitCost;
        this.listPrice = listPrice;
    }

    void merge(int moreQuantity, double otherUnitCost, double otherListPrice) {
        quantity += moreQuantity;
        unitCost = Math.min(unitCost, otherUnitCost);
        listPrice = Math.min(listPrice, otherListPrice);
    }

    public String partNumber() {
        return partNumber;
    }

    public String source() {
        return source;
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
}
