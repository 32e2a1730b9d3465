package com.sqlbridge.util;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;

/**
 * Lexical scanner that reduces SQL text to the upper-cased keywords of each statement.
 *
 * <p>Comments, string literals, quoted identifiers and dollar-quoted bodies are skipped, and
 * statements are split on {@code ;}. No grammar is applied: the output is only good for
 * deciding which verbs a text contains.
 *
 * <p>Literals are scanned with the standard {@code ''} escape only. A backslash inside a
 * quoted string ends it early on MySQL and in PostgreSQL {@code E'..'} strings, so a scan
 * that met one is flagged ambiguous.
 */
public final class SqlStatementScanner {

    private SqlStatementScanner() {
    }

    /**
     * Result of a scan.
     */
    public static final class ScanResult {
        private final List<List<String>> statements;
        private final boolean complete;
        private final boolean ambiguous;

        private ScanResult(List<List<String>> statements, boolean complete, boolean ambiguous) {
            this.statements = Collections.unmodifiableList(statements);
            this.complete = complete;
            this.ambiguous = ambiguous;
        }

        /**
         * Keywords of each non-empty statement, in source order.
         */
        public List<List<String>> getStatements() {
            return statements;
        }

        /**
         * False when the text ends inside a literal, quoted identifier or comment.
         */
        public boolean isComplete() {
            return complete;
        }

        /**
         * True when a quoted string contains a backslash, so where it ends depends on the
         * backend's escape rules.
         */
        public boolean isAmbiguous() {
            return ambiguous;
        }
    }

    public static ScanResult scan(String sql) {
        List<List<String>> statements = new ArrayList<>();
        if (sql == null) {
            return new ScanResult(statements, true, false);
        }

        boolean ambiguous = false;
        List<String> current = new ArrayList<>();
        int n = sql.length();
        int i = 0;
        while (i < n) {
            char c = sql.charAt(i);

            if (c == '-' && i + 1 < n && sql.charAt(i + 1) == '-') {
                int eol = sql.indexOf('\n', i + 2);
                i = eol < 0 ? n : eol + 1;
            } else if (c == '/' && i + 1 < n && sql.charAt(i + 1) == '*') {
                i = skipBlockComment(sql, i);
                if (i < 0) {
                    return incomplete(statements, current);
                }
            } else if (c == '\'' || c == '"') {
                int end = skipQuoted(sql, i, c);
                if (end < 0) {
                    return incomplete(statements, current);
                }
                ambiguous |= containsBackslash(sql, i + 1, end);
                i = end;
            } else if (c == '`') {
                i = skipQuoted(sql, i, c);
                if (i < 0) {
                    return incomplete(statements, current);
                }
            } else if (c == '[') {
                i = skipQuoted(sql, i, ']');
                if (i < 0) {
                    return incomplete(statements, current);
                }
            } else if (c == '$' && dollarTagEnd(sql, i) > 0) {
                i = skipDollarQuoted(sql, i);
                if (i < 0) {
                    return incomplete(statements, current);
                }
            } else if (c == ';') {
                flush(statements, current);
                current = new ArrayList<>();
                i++;
            } else if (isWordStart(c)) {
                int start = i;
                while (i < n && isWordPart(sql.charAt(i))) {
                    i++;
                }
                current.add(sql.substring(start, i).toUpperCase(Locale.ROOT));
            } else {
                i++;
            }
        }
        flush(statements, current);
        return new ScanResult(statements, true, ambiguous);
    }

    private static ScanResult incomplete(List<List<String>> statements, List<String> current) {
        flush(statements, current);
        return new ScanResult(statements, false, false);
    }

    private static boolean containsBackslash(String sql, int from, int to) {
        for (int i = from; i < to; i++) {
            if (sql.charAt(i) == '\\') {
                return true;
            }
        }
        return false;
    }

    private static void flush(List<List<String>> statements, List<String> current) {
        if (!current.isEmpty()) {
            statements.add(Collections.unmodifiableList(current));
        }
    }

    /**
     * @return index just past the closing quote, or -1 if unterminated. A doubled closing
     *         character is an escaped one.
     */
    private static int skipQuoted(String sql, int open, char close) {
        int n = sql.length();
        int i = open + 1;
        while (i < n) {
            if (sql.charAt(i) == close) {
                if (i + 1 < n && sql.charAt(i + 1) == close) {
                    i += 2;
                    continue;
                }
                return i + 1;
            }
            i++;
        }
        return -1;
    }

    // Block comments nest in SQL Server and PostgreSQL.
    private static int skipBlockComment(String sql, int open) {
        int n = sql.length();
        int depth = 0;
        int i = open;
        while (i < n) {
            if (sql.startsWith("/*", i)) {
                depth++;
                i += 2;
            } else if (sql.startsWith("*/", i)) {
                depth--;
                i += 2;
                if (depth == 0) {
                    return i;
                }
            } else {
                i++;
            }
        }
        return -1;
    }

    /**
     * @return index of the closing {@code $} of a dollar-quote tag starting at {@code i}, or -1.
     */
    private static int dollarTagEnd(String sql, int i) {
        int n = sql.length();
        int j = i + 1;
        if (j < n && Character.isDigit(sql.charAt(j))) {
            // $1 is a positional parameter, not a tag
            return -1;
        }
        while (j < n && (Character.isLetterOrDigit(sql.charAt(j)) || sql.charAt(j) == '_')) {
            j++;
        }
        if (j < n && sql.charAt(j) == '$') {
            return j;
        }
        return -1;
    }

    private static int skipDollarQuoted(String sql, int open) {
        int tagEnd = dollarTagEnd(sql, open);
        String tag = sql.substring(open, tagEnd + 1);
        int close = sql.indexOf(tag, tagEnd + 1);
        return close < 0 ? -1 : close + tag.length();
    }

    private static boolean isWordStart(char c) {
        return Character.isLetter(c) || c == '_' || c == '@' || c == '#';
    }

    private static boolean isWordPart(char c) {
        return Character.isLetterOrDigit(c) || c == '_' || c == '@' || c == '#' || c == '$';
    }
}
