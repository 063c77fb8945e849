package com.agentmesh.core.parser;

import java.util.List;

/**
 * Repairs for JSON-like model output. Each repair is pure and, apart from punctuation normalization,
 * leaves the contents of quoted strings untouched.
 */
public final class JsonRepairs {

    /** Applied in order by the repaired pass of {@link ProposalParser}. */
    public static final List<TextRepair> CHAIN = List.of(
            new TextRepair("normalize-punctuation", JsonRepairs::normalizePunctuation),
            new TextRepair("strip-comments", JsonRepairs::stripComments),
            new TextRepair("single-to-double-quotes", JsonRepairs::singleToDoubleQuotes),
            new TextRepair("quote-bare-keys", JsonRepairs::quoteBareKeys),
            new TextRepair("strip-trailing-commas", JsonRepairs::stripTrailingCommas)
    );

    private JsonRepairs() {}

    public static String applyAll(String text) {
        String result = text;
        for (TextRepair repair : CHAIN) {
            result = repair.apply(result);
        }
        return result.trim();
    }

    /**
     * Byte-order mark, curly quotes, full-width punctuation and CR/CRLF line endings.
     */
    public static String normalizePunctuation(String text) {
        String result = text.startsWith("\uFEFF") ? text.substring(1) : text;
        return result
                .replace('\u201C', '"')
                .replace('\u201D', '"')
                .replace('\u2018', '\'')
                .replace('\u2019', '\'')
                .replace('\uFF0C', ',')
                .replace('\uFF1A', ':')
                .replace('\uFF1B', ';')
                .replace('\uFF5B', '{')
                .replace('\uFF5D', '}')
                .replace('\uFF3B', '[')
                .replace('\uFF3D', ']')
                .replace("\r\n", "\n")
                .replace('\r', '\n');
    }

    /**
     * Removes line and block comments outside quoted strings.
     * An unterminated block comment swallows the rest of the text.
     */
    public static String stripComments(String text) {
        var out = new StringBuilder(text.length());
        char quote = 0;
        int len = text.length();
        for (int i = 0; i < len; i++) {
            char c = text.charAt(i);
            if (quote != 0) {
                out.append(c);
                if (c == '\\' && i + 1 < len) {
                    out.append(text.charAt(++i));
                } else if (c == quote) {
                    quote = 0;
                }
                continue;
            }
            if (c == '"' || c == '\'') {
                quote = c;
                out.append(c);
                continue;
            }
            if (c == '/' && i + 1 < len) {
                char next = text.charAt(i + 1);
                if (next == '/') {
                    int end = text.indexOf('\n', i);
                    if (end < 0) {
                        break;
                    }
                    i = end - 1;
                    continue;
                }
                if (next == '*') {
                    int end = text.indexOf("*/", i + 2);
                    if (end < 0) {
                        break;
                    }
                    i = end + 1;
                    continue;
                }
            }
            out.append(c);
        }
        return out.toString();
    }

    /**
     * Rewrites single-quoted strings as double-quoted ones, escaping embedded double quotes.
     * Double-quoted strings pass through unchanged, so apostrophes inside them survive.
     */
    public static String singleToDoubleQuotes(String text) {
        var out = new StringBuilder(text.length());
        boolean inDouble = false;
        boolean inSingle = false;
        int len = text.length();
        for (int i = 0; i < len; i++) {
            char c = text.charAt(i);
            if (inDouble) {
                out.append(c);
                if (c == '\\' && i + 1 < len) {
                    out.append(text.charAt(++i));
                } else if (c == '"') {
                    inDouble = false;
                }
                continue;
            }
            if (inSingle) {
                if (c == '\\' && i + 1 < len) {
                    char escaped = text.charAt(++i);
                    if (escaped == '\'') {
                        out.append('\'');
                    } else {
                        out.append('\\').append(escaped);
                    }
                } else if (c == '\'') {
                    out.append('"');
                    inSingle = false;
                } else if (c == '"') {
                    out.append("\\\"");
                } else {
                    out.append(c);
                }
                continue;
            }
            if (c == '"') {
                inDouble = true;
                out.append(c);
            } else if (c == '\'') {
                inSingle = true;
                out.append('"');
            } else {
                out.append(c);
            }
        }
        return out.toString();
    }

    /**
     * Quotes identifier keys that follow an opening brace or a comma and precede a colon.
     */
    public static String quoteBareKeys(String text) {
        var out = new StringBuilder(text.length() + 16);
        boolean inString = false;
        char lastSignificant = 0;
        int len = text.length();
        for (int i = 0; i < len; i++) {
            char c = text.charAt(i);
            if (inString) {
                out.append(c);
                if (c == '\\' && i + 1 < len) {
                    out.append(text.charAt(++i));
                } else if (c == '"') {
                    inString = false;
                    lastSignificant = '"';
                }
                continue;
            }
            if (c == '"') {
                inString = true;
                out.append(c);
                continue;
            }
            if ((lastSignificant == '{' || lastSignificant == ',') && isIdentifierStart(c)) {
                int end = i;
                while (end < len && isIdentifierPart(text.charAt(end))) {
                    end++;
                }
                int colon = end;
                while (colon < len && Character.isWhitespace(text.charAt(colon))) {
                    colon++;
                }
                if (colon < len && text.charAt(colon) == ':') {
                    out.append('"').append(text, i, end).append('"');
                    i = end - 1;
                    lastSignificant = '"';
                    continue;
                }
            }
            out.append(c);
            if (!Character.isWhitespace(c)) {
                lastSignificant = c;
            }
        }
        return out.toString();
    }

    /**
     * Drops commas directly (modulo whitespace) before a closing brace or bracket.
     */
    public static String stripTrailingCommas(String text) {
        var out = new StringBuilder(text.length());
        boolean inString = false;
        int len = text.length();
        for (int i = 0; i < len; i++) {
            char c = text.charAt(i);
            if (inString) {
                out.append(c);
                if (c == '\\' && i + 1 < len) {
                    out.append(text.charAt(++i));
                } else if (c == '"') {
                    inString = false;
                }
                continue;
            }
            if (c == '"') {
                inString = true;
            } else if (c == ',') {
                int next = i + 1;
                while (next < len && Character.isWhitespace(text.charAt(next))) {
                    next++;
                }
                if (next < len && (text.charAt(next) == '}' || text.charAt(next) == ']')) {
                    continue;
                }
            }
            out.append(c);
        }
        return out.toString();
    }

    private static boolean isIdentifierStart(char c) {
        return Character.isLetter(c) || c == '_' || c == '$';
    }

    private static boolean isIdentifierPart(char c) {
        return Character.isLetterOrDigit(c) || c == '_' || c == '$' || c == '-';
    }
}
