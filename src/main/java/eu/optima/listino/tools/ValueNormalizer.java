package eu.optima.listino.tools;

import java.text.Normalizer;
import java.util.Locale;
import java.util.regex.Pattern;

/** Raw cell text -> typed values. Never throws on bad input. */
public final class ValueNormalizer {

    private static final Pattern CURRENCY_AND_SPACE = Pattern.compile("[\\p{Sc}\\s\\u00A0\\u202F]");
    // '.' followed by exactly three digits and then a non-digit or the end: thousands separator
    private static final Pattern THOUSANDS_DOT = Pattern.compile("\\.(?=\\d{3}(?:\\D|$))");
    private static final Pattern PLAIN_DECIMAL = Pattern.compile("^[+-]?(\\d+(\\.\\d*)?|\\.\\d+)$");

    private static final Pattern DIACRITICS = Pattern.compile("\\p{M}+");
    private static final Pattern NON_ALNUM_RUN = Pattern.compile("[^a-z0-9]+");

    private ValueNormalizer() {
    }

    public static Double normalizeNumber(Object raw) {
        if (raw == null)
            return null;
        if (raw instanceof Number n)
            return n.doubleValue();
        String x = CURRENCY_AND_SPACE.matcher(String.valueOf(raw)).replaceAll("");
        x = THOUSANDS_DOT.matcher(x).replaceAll("");
        x = x.replace(',', '.');
        if (!PLAIN_DECIMAL.matcher(x).matches())
            return null;
        try {
            double d = Double.parseDouble(x);
            return Double.isInfinite(d) ? null : d;
        } catch (NumberFormatException e) {
            return null;
        }
    }

    /** Comparison form: trimmed, null and empty both become "". */
    public static String normalizeText(String raw) {
        return raw == null ? "" : raw.trim();
    }

    /** Storage form: trimmed, but null stays null so "absent" and "empty" remain distinct. */
    public static String storageText(String raw) {
        return raw == null ? null : raw.trim();
    }

    public static boolean isBlank(String raw) {
        return raw == null || raw.isBlank();
    }

    public static boolean sameText(String a, String b) {
        return normalizeText(a).equals(normalizeText(b));
    }

    /** Header form used for vocabulary and similarity checks: "Cod. Articolo" -> "cod articolo". */
    public static String normalizeHeader(String raw) {
        if (raw == null)
            return "";
        String s = Normalizer.normalize(raw.trim().toLowerCase(Locale.ROOT), Normalizer.Form.NFD);
        s = DIACRITICS.matcher(s).replaceAll("");
        return NON_ALNUM_RUN.matcher(s).replaceAll(" ").trim();
    }
}
