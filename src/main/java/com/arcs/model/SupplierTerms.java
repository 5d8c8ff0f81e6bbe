package com.arcs.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Per-supplier settings kept on a quote, e.g. {@code "Acme": {"tax_exempt": true}}.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public final class SupplierTerms {

    public static final SupplierTerms TAX_EXEMPT = new SupplierTerms(true);
    public static final SupplierTerms TAXABLE = new SupplierTerms(false);

    @JsonProperty("tax_exempt")
    private final boolean taxExempt;

    private SupplierTerms(boolean taxExempt) {
        this.taxExempt = taxExempt;
    }

    @JsonCreator(mode = JsonCreator.Mode.PROPERTIES)
    static SupplierTerms fromJson(@JsonProperty("tax_exempt") Boolean taxExempt) {
        return of(taxExempt != null && taxExempt);
    }

    public static SupplierTerms of(boolean taxExempt) {
        return taxExempt ? TAX_EXEMPT : TAXABLE;
    }

    public boolean taxExempt() {
        return taxExempt;
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof SupplierTerms && ((SupplierTerms) o).taxExempt == taxExempt;
    }

    @Override
    public int hashCode() {
        return Boolean.hashCode(taxExempt);
    }

    @Override
    public String toString() {
        return taxExempt ? "tax exempt" : "taxable";
    }
}
