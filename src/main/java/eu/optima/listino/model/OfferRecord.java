package eu.optima.listino.model;

import java.math.BigDecimal;

/**
 * Promotional view of one price list row. {@code discount} and
 * {@code promoPrice} are null when the list price is not a number.
 */
public record OfferRecord(String code, String description, String listPrice, BigDecimal discount,
        BigDecimal promoPrice) {
}
