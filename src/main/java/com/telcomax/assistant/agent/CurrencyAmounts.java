package com.telcomax.assistant.agent;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Finds dollar amounts such as {@code $49}, {@code $1,234} and {@code $137.14}.
 */
public final class CurrencyAmounts {

    static final Pattern AMOUNT = Pattern.compile("\\$\\d+(?:,\\d{3})*(?:\\.\\d{2})?");

    private CurrencyAmounts() {
    }

    public static List<String> find(String text) {
        List<String> amounts = new ArrayList<>();
        if (text == null) {
            return amounts;
        }
        Matcher m = AMOUNT.matcher(text);
        while (m.find()) {
            if (!amounts.contains(m.group())) {
                amounts.add(m.group());
            }
        }
        return amounts;
    }

    public static boolean containsAny(String text) {
        return text != null && AMOUNT.matcher(text).find();
    }
}
