package com.gpsr.registry.normalize;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Canonicalizes searchable fields before they are written.
 * All methods are pure and return {@code null} for null or blank optional input.
 */
public class Normalizer {
    private static final Logger log = LoggerFactory.getLogger(Normalizer.class);

    /**
     * Legal form suffixes removed from company names, applied in order.
     */
    private static final List<Pattern> LEGAL_FORM_RULES = List.of(
            Pattern.compile("\\bsp\\.?\\s*z\\.?\\s*o\\.?\\s*o\\.?(?=\\s|$)", Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE),
            Pattern.compile("\\bs\\.?\\s*a\\.?(?=\\s|$)", Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE),
            Pattern.compile("\\b(ltd|gmbh|inc|corp|llc|co|plc|ag|bv|nv|sarl|srl|oy|ab)\\.?(?=\\s|$)",
                    Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE)
    );

    private static final Pattern WHITESPACE = Pattern.compile("\\s+");
    private static final Pattern STRAY_PERIOD = Pattern.compile("\\s*\\.\\s*");
    private static final Pattern VAT_SEPARATORS = Pattern.compile("[\\s.\\-]");
    private static final Pattern NON_DIGIT = Pattern.compile("\\D");

    /**
     * Normalizes a company name: drops legal form suffixes and stray periods,
     * collapses whitespace and capitalizes each word.
     * {@code "  ACME Corp.  sp. z o.o. "} becomes {@code "Acme"}.
     */
    public String name(String name) {
        if (name == null || name.isBlank()) {
            return "";
        }
        String result = name.trim().toLowerCase(Locale.ROOT);
        for (Pattern rule : LEGAL_FORM_RULES) {
            result = rule.matcher(result).replaceAll(" ");
        }
        result = STRAY_PERIOD.matcher(result).replaceAll(" ");
        result = WHITESPACE.matcher(result).replaceAll(" ").trim();
        String capitalized = WHITESPACE.splitAsStream(result)
                .filter(word -> !word.isEmpty())
                .map(Normalizer::capitalize)
                .collect(Collectors.joining(" "));
        if (!capitalized.equals(name)) {
            log.trace("Normalized name '{}' -> '{}'", name, capitalized);
        }
        return capitalized;
    }

    /**
     * Removes spaces, dots and dashes and upper-cases: {@code "PL 123-456-78-90"} becomes
     * {@code "PL1234567890"}.
     */
    public String vatId(String vatId) {
        if (isBlank(vatId)) {
            return null;
        }
        return VAT_SEPARATORS.matcher(vatId.trim().toUpperCase(Locale.ROOT)).replaceAll("");
    }

    /**
     * Normalizes an identifier value for the dedup index: trimmed, upper case.
     */
    public String identifierValue(String value) {
        if (value == null) {
            return null;
        }
        return value.trim().toUpperCase(Locale.ROOT);
    }

    public String email(String email) {
        if (isBlank(email)) {
            return null;
        }
        return email.trim().toLowerCase(Locale.ROOT);
    }

    /**
     * Keeps digits and a leading plus sign: {@code "+48 123 456 789"} becomes {@code "+48123456789"}.
     */
    public String phone(String phone) {
        if (isBlank(phone)) {
            return null;
        }
        String cleaned = phone.trim();
        if (cleaned.startsWith("+")) {
            return "+" + NON_DIGIT.matcher(cleaned.substring(1)).replaceAll("");
        }
        return NON_DIGIT.matcher(cleaned).replaceAll("");
    }

    /**
     * Lower-cases, adds {@code https://} when no scheme is given and drops a trailing slash.
     */
    public String website(String website) {
        if (isBlank(website)) {
            return null;
        }
        String url = website.trim().toLowerCase(Locale.ROOT);
        if (!url.startsWith("http://") && !url.startsWith("https://")) {
            url = "https://" + url;
        }
        return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
    }

    /**
     * Upper-case ISO 3166-1 alpha-2 country code.
     */
    public String country(String country) {
        if (country == null) {
            return null;
        }
        return country.trim().toUpperCase(Locale.ROOT);
    }

    /**
     * Lower-case ISO 639-1 language code.
     */
    public String language(String language) {
        if (language == null) {
            return null;
        }
        return language.trim().toLowerCase(Locale.ROOT);
    }

    /**
     * Collapses whitespace and capitalizes the first letter of every word.
     */
    public String address(String address) {
        if (isBlank(address)) {
            return null;
        }
        String collapsed = WHITESPACE.matcher(address.trim()).replaceAll(" ");
        StringBuilder result = new StringBuilder(collapsed.length());
        boolean wordStart = true;
        for (int i = 0; i < collapsed.length(); ) {
            int codePoint = collapsed.codePointAt(i);
            if (Character.isLetterOrDigit(codePoint)) {
                result.appendCodePoint(wordStart ? Character.toUpperCase(codePoint) : codePoint);
                wordStart = false;
            } else {
                result.appendCodePoint(codePoint);
                wordStart = true;
            }
            i += Character.charCount(codePoint);
        }
        return result.toString();
    }

    private static String capitalize(String word) {
        int first = word.codePointAt(0);
        return new StringBuilder(word.length())
                .appendCodePoint(Character.toUpperCase(first))
                .append(word.substring(Character.charCount(first)))
                .toString();
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
