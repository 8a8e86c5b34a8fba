package com.sankeydsl.loader;

import java.util.ArrayList;
import java.util.List;

/**
 * Splits one row of comma-separated text. Double quotes toggle a quoted section in which commas are
 * literal; the quote characters themselves are dropped and there is no escape sequence. Every field
 * is trimmed.
 */
public final class CsvLineSplitter {

    private CsvLineSplitter() {}

    public static List<String> split(String line) {
        List<String> fields = new ArrayList<>();
        StringBuilder current = new StringBuilder();
        boolean inQuotes = false;
        for (int i = 0; i < line.length(); i++) {
            char ch = line.charAt(i);
            if (ch == '"') {
                inQuotes = !inQuotes;
            } else if (ch == ',' && !inQuotes) {
                fields.add(current.toString().trim());
                current.setLength(0);
            } else {
                current.append(ch);
            }
        }
        fields.add(current.toString().trim());
        return fields;
    }

    /** Splits on tab characters, trimming every field. */
    public static List<String> splitTabs(String line) {
        List<String> fields = new ArrayList<>();
        int start = 0;
        for (int i = 0; i <= line.length(); i++) {
            if (i == line.length() || line.charAt(i) == '\t') {
                fields.add(line.substring(start, i).trim());
                start = i + 1;
            }
        }
        return fields;
    }
}
