package com.adsagent.patterns.service;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Well-known brand names that must never reach a stored pattern and that make an upload ineligible.
 * Matching is case-insensitive and bounded by non-letters so "hp" does not match "shape".
 */
public final class BrandBlocklist {

    public static final Set<String> BRANDS = Set.of(
            // Tech
            "apple", "google", "microsoft", "amazon", "meta", "facebook", "instagram", "twitter", "tiktok",
            "snapchat", "netflix", "spotify", "adobe", "salesforce", "oracle", "ibm", "intel", "nvidia", "amd",
            "dell", "hp", "lenovo", "samsung", "sony", "lg", "huawei",
            // Consumer
            "nike", "adidas", "puma", "reebok", "coca-cola", "pepsi", "mcdonalds", "starbucks", "burger king",
            "kfc", "subway", "walmart", "target", "costco", "ikea", "home depot",
            // Automotive
            "tesla", "ford", "chevrolet", "toyota", "honda", "bmw", "mercedes", "audi", "porsche",
            // Finance
            "visa", "mastercard", "paypal", "stripe", "square", "american express", "chase",
            // Media
            "disney", "warner", "paramount", "universal", "nbc", "cbs", "fox", "hbo"
    );

    private static final Pattern BRAND_PATTERN = Pattern.compile(
            "(?i)(?<![\\p{L}])(" + BRANDS.stream()
                    .sorted((a, b) -> Integer.compare(b.length(), a.length()))
                    .map(Pattern::quote)
                    .collect(Collectors.joining("|")) + ")(?![\\p{L}])");

    private BrandBlocklist() {
    }

    /**
     * Brands mentioned in the text, lowercase, in order of first appearance.
     */
    public static List<String> findMentions(String text) {
        List<String> found = new ArrayList<>();
        if (text == null || text.isEmpty()) {
            return found;
        }
        Matcher matcher = BRAND_PATTERN.matcher(text);
        while (matcher.find()) {
            String brand = matcher.group(1).toLowerCase(Locale.ROOT);
            if (!found.contains(brand)) {
                found.add(brand);
            }
        }
        return found;
    }

    /**
     * Replaces every brand mention with the given placeholder.
     */
    public static String redact(String text, String placeholder) {
        if (text == null || text.isEmpty()) {
            return text;
        }
        return BRAND_PATTERN.matcher(text).replaceAll(Matcher.quoteReplacement(placeholder));
    }
}
