package com.adsagent.patterns.service;

import java.util.List;
import java.util.regex.Pattern;

/**
 * Regular expressions for literal content that identifies a business or makes a concrete claim.
 * Shared by the privacy gate (to detect) and the sanitizer (to strip).
 */
final class ContactPatterns {

    static final Pattern URL = Pattern.compile(
            "(?i)\\b(?:https?://|www\\.)[^\\s\"'<>]+");
    static final Pattern EMAIL = Pattern.compile(
            "(?i)\\b[a-z0-9._%+-]+@[a-z0-9.-]+\\.[a-z]{2,}\\b");
    // Bare domains with any alphabetic TLD, such as "shop.example.dev" or "brand.xyz/offer".
    // Vocabulary terms never contain a dot, so they cannot match.
    static final Pattern DOMAIN = Pattern.compile(
            "(?i)\\b(?:[a-z0-9](?:[a-z0-9-]{0,61}[a-z0-9])?\\.)+[a-z]{2,63}\\b(?:/[^\\s\"'<>]*)?");
    // Phone-like runs: at least 7 digits, optionally separated by spaces, dots, dashes or parentheses
    static final Pattern PHONE = Pattern.compile(
            "\\+?\\(?\\d[\\d\\s().-]{5,}\\d");
    static final Pattern PRICE = Pattern.compile(
            "(?:[$€£¥]\\s?\\d[\\d,.]*|\\d[\\d,.]*\\s?(?:usd|eur|gbp|dollars?|euros?))", Pattern.CASE_INSENSITIVE);
    static final Pattern PERCENT = Pattern.compile("\\d[\\d,.]*\\s?%");
    static final Pattern DIGIT_RUN = Pattern.compile("\\d{2,}");

    static final List<Pattern> CONTACT = List.of(URL, EMAIL, DOMAIN, PHONE);

    private ContactPatterns() {
    }

    static boolean containsContactInfo(String text) {
        if (text == null || text.isEmpty()) {
            return false;
        }
        for (Pattern pattern : CONTACT) {
            if (pattern.matcher(text).find()) {
                return true;
            }
        }
        return false;
    }
}
