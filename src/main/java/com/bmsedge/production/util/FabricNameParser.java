package com.bmsedge.production.util;

import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Derives the code and short display name from a full fabric name, e.g.
 * {@code "[FC-101] جاكار قطن (  )"} gives code {@code FC-101} and short name {@code "قطن"}.
 */
public final class FabricNameParser {

    private static final Pattern CODE_PREFIX = Pattern.compile("^\\[(.*?)]");
    private static final Pattern EMPTY_PARENTHESES = Pattern.compile("\\(\\s*\\)");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    // jacquard, raw, lycra, without
    private static final List<String> KEYWORDS = List.of("جاكار ", "خام", "ليكرا ", "بدون ");

    private FabricNameParser() {}

    public static ParsedName parse(String fullName) {
        if (fullName == null || fullName.isBlank()) {
            return new ParsedName("", "");
        }

        String code = "";
        String shortName = fullName;

        Matcher codeMatcher = CODE_PREFIX.matcher(fullName);
        if (codeMatcher.find()) {
            code = codeMatcher.group(1);
            shortName = fullName.substring(codeMatcher.end()).trim();
        }

        for (String keyword : KEYWORDS) {
            shortName = shortName.replace(keyword, "").trim();
        }

        shortName = EMPTY_PARENTHESES.matcher(shortName).replaceAll("").trim();
        shortName = WHITESPACE.matcher(shortName).replaceAll(" ").trim();

        return new ParsedName(code, shortName);
    }

    public static final class ParsedName {
        private final String code;
        private final String shortName;

        public ParsedName(String code, String shortName) {
            this.code = code;
            this.shortName = shortName;
        }

        public String getCode() { return code; }

        public String getShortName() { return shortName; }
    }
}
