package com.asmblr.dag.value;

import java.util.ArrayList;
import java.util.List;

/**
 * Recursive descent parser for the literal text carried by the {@code other}
 * wire tag.
 *
 * <p>
 * Understands {@code None}/{@code null}, {@code True}/{@code False} (any case),
 * integers, floating point numbers, single- or double-quoted strings, and
 * parenthesised or bracketed sequences of those (which become tuples). A
 * trailing comma inside a sequence is allowed, so {@code (1,)} is a one-element
 * tuple.
 */
final class LiteralParser {
    private final String input;
    private int pos;

    private LiteralParser(String input) {
        this.input = input;
    }

    /**
     * Parses {@code text} as a single literal.
     *
     * @throws IllegalArgumentException if the text is not a literal or has
     *                                  trailing content.
     */
    static Value parse(String text) {
        LiteralParser p = new LiteralParser(text);
        Value v = p.parseValue();
        p.skipWS();
        if (p.pos != p.input.length())
            throw p.err("Trailing content");
        return v;
    }

    private Value parseValue() {
        skipWS();
        if (pos >= input.length())
            throw err("Unexpected end of input");
        char c = input.charAt(pos);
        return switch (c) {
            case '"', '\'' -> new StringValue(parseString(c));
            case '(' -> parseSequence('(', ')');
            case '[' -> parseSequence('[', ']');
            default -> {
                if (c == '-' || c == '+' || c == '.' || (c >= '0' && c <= '9'))
                    yield parseNumber();
                if (Character.isLetter(c))
                    yield parseWord();
                throw err("Unexpected: " + c);
            }
        };
    }

    private String parseString(char quote) {
        expect(quote);
        StringBuilder sb = new StringBuilder();
        while (pos < input.length()) {
            char c = input.charAt(pos++);
            if (c == quote)
                return sb.toString();
            if (c == '\\') {
                if (pos >= input.length())
                    break;
                char e = input.charAt(pos++);
                switch (e) {
                    case 'n' -> sb.append('\n');
                    case 't' -> sb.append('\t');
                    case 'r' -> sb.append('\r');
                    default -> sb.append(e);
                }
            } else
                sb.append(c);
        }
        throw err("Unterminated string");
    }

    private TupleValue parseSequence(char open, char close) {
        expect(open);
        List<Value> elements = new ArrayList<>();
        while (true) {
            skipWS();
            if (pos < input.length() && input.charAt(pos) == close) {
                pos++;
                return new TupleValue(elements);
            }
            elements.add(parseValue());
            skipWS();
            if (pos < input.length() && input.charAt(pos) == ',') {
                pos++;
            } else {
                expect(close);
                return new TupleValue(elements);
            }
        }
    }

    private Value parseNumber() {
        int s = pos;
        if (input.charAt(pos) == '-' || input.charAt(pos) == '+')
            pos++;
        boolean fp = false;
        while (pos < input.length()) {
            char c = input.charAt(pos);
            if (c >= '0' && c <= '9' || c == '_') {
                pos++;
            } else if (c == '.' || c == 'e' || c == 'E') {
                fp = true;
                pos++;
                if ((c == 'e' || c == 'E') && pos < input.length()
                        && (input.charAt(pos) == '+' || input.charAt(pos) == '-'))
                    pos++;
            } else {
                break;
            }
        }
        String ns = input.substring(s, pos).replace("_", "");
        try {
            return fp ? NumberValue.of(Double.parseDouble(ns)) : NumberValue.of(Long.parseLong(ns));
        } catch (NumberFormatException e) {
            throw err("Bad number '" + ns + "'");
        }
    }

    private Value parseWord() {
        int s = pos;
        while (pos < input.length() && Character.isLetter(input.charAt(pos)))
            pos++;
        String word = input.substring(s, pos);
        return switch (word.toLowerCase()) {
            case "none", "null" -> Values.none();
            case "true" -> Values.of(true);
            case "false" -> Values.of(false);
            case "nan" -> NumberValue.of(Double.NaN);
            case "inf", "infinity" -> NumberValue.of(Double.POSITIVE_INFINITY);
            default -> throw err("Not a literal: " + word);
        };
    }

    private void expect(char c) {
        skipWS();
        if (pos >= input.length() || input.charAt(pos) != c)
            throw err("Expected '" + c + "'");
        pos++;
    }

    private void skipWS() {
        while (pos < input.length() && Character.isWhitespace(input.charAt(pos)))
            pos++;
    }

    private IllegalArgumentException err(String msg) {
        return new IllegalArgumentException(msg + " at pos " + pos);
    }
}
