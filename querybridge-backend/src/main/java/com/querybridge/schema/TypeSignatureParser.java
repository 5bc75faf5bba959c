package com.querybridge.schema;

import com.querybridge.model.type.ArrayType;
import com.querybridge.model.type.ColumnType;
import com.querybridge.model.type.MapType;
import com.querybridge.model.type.PrimitiveType;
import com.querybridge.model.type.RowType;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Parses Trino type expressions as reported by {@code information_schema.columns} and
 * {@code SHOW COLUMNS}, e.g. {@code row(city varchar, geo row(lat double, lon double))}.
 */
public final class TypeSignatureParser {

    private static final Set<String> MULTI_WORD_TYPES = Set.of(
            "double precision",
            "time with time zone",
            "time without time zone",
            "timestamp with time zone",
            "timestamp without time zone",
            "interval day to second",
            "interval year to month"
    );

    private TypeSignatureParser() {
    }

    /**
     * Parse a type expression.
     *
     * @param expression type expression
     * @return parsed type
     * @throws IllegalArgumentException if the expression is blank or unbalanced
     */
    public static ColumnType parse(String expression) {
        if (expression == null || expression.isBlank()) {
            throw new IllegalArgumentException("type expression is required");
        }
        String s = expression.trim();
        String head = leadingWord(s).toLowerCase(Locale.ROOT);
        int open = indexOfOpenParenAfter(s, head.length());

        if (open > 0 && ("row".equals(head) || "array".equals(head) || "map".equals(head))) {
            int close = findMatchingParen(s, open);
            if (close != s.length() - 1) {
                throw new IllegalArgumentException("Unbalanced type expression: " + expression);
            }
            String inner = s.substring(open + 1, close);
            switch (head) {
                case "row":
                    return parseRow(inner);
                case "array":
                    return new ArrayType(parse(inner));
                default:
                    List<String> kv = splitTopLevel(inner);
                    if (kv.size() != 2) {
                        throw new IllegalArgumentException("map type requires key and value: " + expression);
                    }
                    return new MapType(parse(kv.get(0)), parse(kv.get(1)));
            }
        }
        return parsePrimitive(s);
    }

    private static RowType parseRow(String inner) {
        List<RowType.Field> fields = new ArrayList<>();
        for (String entry : splitTopLevel(inner)) {
            String e = entry.trim();
            if (e.isEmpty()) {
                continue;
            }
            if (e.charAt(0) == '"') {
                int end = findClosingQuote(e, 0);
                String name = e.substring(1, end).replace("\"\"", "\"");
                fields.add(new RowType.Field(name, parse(e.substring(end + 1))));
            } else if (isTypeOnly(e)) {
                fields.add(new RowType.Field(null, parse(e)));
            } else {
                String name = leadingWord(e);
                fields.add(new RowType.Field(name, parse(e.substring(name.length()))));
            }
        }
        return new RowType(fields);
    }

    private static PrimitiveType parsePrimitive(String s) {
        StringBuilder base = new StringBuilder();
        List<String> parameters = new ArrayList<>();
        int i = 0;
        while (i < s.length()) {
            char c = s.charAt(i);
            if (c == '(') {
                int close = findMatchingParen(s, i);
                if (parameters.isEmpty()) {
                    for (String p : splitTopLevel(s.substring(i + 1, close))) {
                        parameters.add(p.trim());
                    }
                }
                i = close + 1;
                continue;
            }
            base.append(c);
            i++;
        }
        String baseName = base.toString().trim().replaceAll("\\s+", " ");
        if (baseName.isEmpty()) {
            throw new IllegalArgumentException("Invalid type expression: " + s);
        }
        return new PrimitiveType(baseName, parameters, s.replaceAll("\\s+", " "));
    }

    private static boolean isTypeOnly(String entry) {
        String head = leadingWord(entry).toLowerCase(Locale.ROOT);
        if (("row".equals(head) || "array".equals(head) || "map".equals(head))
                && indexOfOpenParenAfter(entry, head.length()) > 0) {
            return true;
        }
        String normalized = stripParenGroups(entry).trim().replaceAll("\\s+", " ").toLowerCase(Locale.ROOT);
        return !normalized.contains(" ") || MULTI_WORD_TYPES.contains(normalized);
    }

    private static String stripParenGroups(String s) {
        StringBuilder out = new StringBuilder();
        int i = 0;
        while (i < s.length()) {
            if (s.charAt(i) == '(') {
                i = findMatchingParen(s, i) + 1;
                continue;
            }
            out.append(s.charAt(i));
            i++;
        }
        return out.toString();
    }

    private static String leadingWord(String s) {
        int i = 0;
        while (i < s.length() && !Character.isWhitespace(s.charAt(i)) && s.charAt(i) != '(') {
            i++;
        }
        return s.substring(0, i);
    }

    private static int indexOfOpenParenAfter(String s, int from) {
        int i = from;
        while (i < s.length() && Character.isWhitespace(s.charAt(i))) {
            i++;
        }
        return i < s.length() && s.charAt(i) == '(' ? i : -1;
    }

    static List<String> splitTopLevel(String s) {
        List<String> parts = new ArrayList<>();
        int depth = 0;
        boolean quoted = false;
        int start = 0;
        for (int i = 0; i < s.length(); i++) {
            char c = s.charAt(i);
            if (c == '"') {
                quoted = !quoted;
            } else if (!quoted && c == '(') {
                depth++;
            } else if (!quoted && c == ')') {
                depth--;
            } else if (!quoted && depth == 0 && c == ',') {
                parts.add(s.substring(start, i));
                start = i + 1;
            }
        }
        parts.add(s.substring(start));
        return parts;
    }

    private static int findMatchingParen(String s, int open) {
        int depth = 0;
        boolean quoted = false;
        for (int i = open; i < s.length(); i++) {
            char c = s.charAt(i);
            if (c == '"') {
                quoted = !quoted;
            } else if (!quoted && c == '(') {
                depth++;
            } else if (!quoted && c == ')') {
                depth--;
                if (depth == 0) {
                    return i;
                }
            }
        }
        throw new IllegalArgumentException("Unbalanced parentheses in type expression: " + s);
    }

    private static int findClosingQuote(String s, int open) {
        int i = open + 1;
        while (i < s.length()) {
            if (s.charAt(i) == '"') {
                if (i + 1 < s.length() && s.charAt(i + 1) == '"') {
                    i += 2;
                    continue;
                }
                return i;
            }
            i++;
        }
        throw new IllegalArgumentException("Unterminated quoted identifier: " + s);
    }
}
