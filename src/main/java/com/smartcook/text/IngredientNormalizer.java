package com.smartcook.text;

import java.util.Locale;
import java.util.regex.Pattern;

public final class IngredientNormalizer {
    private static final String QUANTITY = "[\\d\\u00BC-\\u00BE\\u2150-\\u215E]+(?:[./]\\d+)?";
    private static final String UNITS = "tablespoons?|tbsps?|tbs|teaspoons?|tsps?|cups?|c"
            + "|ounces?|oz|kilograms?|kg|grams?|g"
            + "|milliliters?|millilitres?|ml|liters?|litres?|l"
            + "|pounds?|lbs?";
    private static final Pattern LEADING_MEASUREMENT = Pattern.compile(
            "^\\s*" + QUANTITY + "(?:\\s*" + QUANTITY + ")*(?:\\s*-\\s*" + QUANTITY + ")?\\s*(?:(?:" + UNITS + ")(?:\\.|\\b))?\\s*");
    private static final Pattern PARENTHETICAL = Pattern.compile("\\(.*?\\)");
    private static final Pattern NON_ALPHANUMERIC = Pattern.compile("[^\\p{L}\\p{Nd}\\s]");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    private IngredientNormalizer() {
    }

    public static String normalize(Object value) {
        String current = String.valueOf(value);
        String previous;
        do {
            previous = current;
            current = singlePass(current);
        } while (!current.equals(previous));
        return current;
    }

    private static String singlePass(String text) {
        String lowered = text.toLowerCase(Locale.ROOT);
        String withoutMeasurement = LEADING_MEASUREMENT.matcher(lowered).replaceFirst("");
        String withoutNotes = PARENTHETICAL.matcher(withoutMeasurement).replaceAll("");
        String alphanumeric = NON_ALPHANUMERIC.matcher(withoutNotes).replaceAll("");
        return WHITESPACE.matcher(alphanumeric).replaceAll(" ").strip();
    }
}
