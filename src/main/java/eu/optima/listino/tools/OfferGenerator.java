package eu.optima.listino.tools;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;

import eu.optima.listino.model.OfferRecord;
import eu.optima.listino.model.TabularData;

/**
 * Promotional prices derived from the reconciled price list: a flat discount
 * rate on the list price. Amounts are rounded to two decimals, half away from
 * zero ({@link RoundingMode#HALF_UP}); the promo price is computed from the
 * already rounded discount.
 */
public class OfferGenerator {

    public static final BigDecimal DEFAULT_DISCOUNT_RATE = new BigDecimal("0.10");
    public static final String COL_DISCOUNT = "Sconto Offerta";
    public static final String COL_PROMO_PRICE = "Prezzo Promo";

    private static final int SCALE = 2;
    private static final RoundingMode ROUNDING = RoundingMode.HALF_UP;

    public List<OfferRecord> generate(CanonicalStore store) {
        return generate(store, FieldVocabulary.FIELD_LIST_PRICE, DEFAULT_DISCOUNT_RATE);
    }

    public List<OfferRecord> generate(CanonicalStore store, String priceField, BigDecimal discountRate) {
        if (discountRate == null || discountRate.signum() < 0 || discountRate.compareTo(BigDecimal.ONE) > 0)
            throw new IllegalArgumentException("discount rate must be within 0..1, got " + discountRate);
        if (priceField == null || priceField.isBlank())
            throw new IllegalArgumentException("price field is required");
        requireFields(store, priceField);

        List<OfferRecord> offers = new ArrayList<>(store.size());
        for (int r = 0; r < store.size(); r++) {
            String rawPrice = store.get(r, priceField);
            Double price = ValueNormalizer.normalizeNumber(rawPrice);
            BigDecimal discount = null;
            BigDecimal promo = null;
            if (price != null && !price.isNaN() && !price.isInfinite()) {
                BigDecimal p = BigDecimal.valueOf(price);
                discount = p.multiply(discountRate).setScale(SCALE, ROUNDING);
                promo = p.subtract(discount).setScale(SCALE, ROUNDING);
            }
            offers.add(new OfferRecord(store.get(r, FieldVocabulary.FIELD_CODE),
                    store.get(r, FieldVocabulary.FIELD_DESCRIPTION), rawPrice, discount, promo));
        }
        return offers;
    }

    public static TabularData toTabular(List<OfferRecord> offers, String priceField) {
        List<String> cols = List.of(FieldVocabulary.FIELD_CODE, FieldVocabulary.FIELD_DESCRIPTION, priceField,
                COL_DISCOUNT, COL_PROMO_PRICE);
        List<List<Object>> rows = new ArrayList<>(offers.size());
        for (OfferRecord o : offers) {
            List<Object> row = new ArrayList<>(5);
            row.add(o.code());
            row.add(o.description());
            row.add(o.listPrice());
            row.add(o.discount());
            row.add(o.promoPrice());
            rows.add(row);
        }
        return new TabularData(cols, rows);
    }

    private static void requireFields(CanonicalStore store, String priceField) {
        var required = new LinkedHashSet<String>();
        required.add(FieldVocabulary.FIELD_CODE);
        required.add(FieldVocabulary.FIELD_DESCRIPTION);
        required.add(priceField);
        List<String> missing = required.stream().filter(f -> !store.hasField(f)).toList();
        if (!missing.isEmpty())
            throw new MissingFieldException(missing);
    }
}
