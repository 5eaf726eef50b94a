package com.fitting.eqn.dsl;

import com.fitting.eqn.error.EquationSyntaxException;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Recursive descent parser for the equation language.
 *
 * <pre>
 * expression := term (('+' | '-') term)*
 * term       := unary (('*' | '/' | '%') unary)*
 * unary      := ('-' | '+') unary | power
 * power      := primary ('**' unary)?
 * primary    := number | name | name '(' arguments? ')' | '(' expression ')'
 * arguments  := argument (',' argument)*
 * argument   := name '=' expression | expression
 * </pre>
 *
 * {@code **} is right associative and binds tighter than unary minus, so
 * {@code -x**2} is {@code -(x**2)}. Positional arguments may not follow
 * keyword arguments.
 */
public final class EquationParser {
    private final String input;
    private int pos;

    private EquationParser(String input) {
        this.input = input;
    }

    /**
     * Parses equation text.
     *
     * @throws EquationSyntaxException if the text is malformed.
     */
    public static Syntax parse(String text) {
        if (text == null || text.isBlank())
            throw new EquationSyntaxException("Empty equation", String.valueOf(text), 0);
        EquationParser parser = new EquationParser(text);
        Syntax syntax = parser.parseExpression();
        parser.skipWS();
        if (parser.pos < text.length())
            throw parser.err("Unexpected '" + text.charAt(parser.pos) + "'");
        return syntax;
    }

    private Syntax parseExpression() {
        Syntax left = parseTerm();
        while (true) {
            skipWS();
            if (peek('+')) {
                pos++;
                left = new Syntax.Binary("+", left, parseTerm());
            } else if (peek('-')) {
                pos++;
                left = new Syntax.Binary("-", left, parseTerm());
            } else {
                return left;
            }
        }
    }

    private Syntax parseTerm() {
        Syntax left = parseUnary();
        while (true) {
            skipWS();
            if (peek('*') && !input.startsWith("**", pos)) {
                pos++;
                left = new Syntax.Binary("*", left, parseUnary());
            } else if (peek('/')) {
                pos++;
                left = new Syntax.Binary("/", left, parseUnary());
            } else if (peek('%')) {
                pos++;
                left = new Syntax.Binary("%", left, parseUnary());
            } else {
                return left;
            }
        }
    }

    private Syntax parseUnary() {
        skipWS();
        if (peek('-')) {
            pos++;
            return new Syntax.Negate(parseUnary());
        }
        if (peek('+')) {
            pos++;
            return parseUnary();
        }
        return parsePower();
    }

    private Syntax parsePower() {
        Syntax base = parsePrimary();
        skipWS();
        if (input.startsWith("**", pos)) {
            pos += 2;
            return new Syntax.Binary("**", base, parseUnary());
        }
        return base;
    }

    private Syntax parsePrimary() {
        skipWS();
        if (pos >= input.length())
            throw err("Unexpected end");
        char c = input.charAt(pos);
        if (c == '(') {
            pos++;
            Syntax inner = parseExpression();
            skipWS();
            expect(')');
            return inner;
        }
        if (Character.isDigit(c) || c == '.')
            return parseNumber();
        if (isIdentifierStart(c)) {
            int start = pos;
            String id = parseIdentifier();
            skipWS();
            if (peek('('))
                return parseCall(id, start);
            return new Syntax.Name(id, start);
        }
        throw err("Unexpected '" + c + "'");
    }

    private Syntax parseCall(String function, int start) {
        expect('(');
        List<Syntax> args = new ArrayList<>();
        Map<String, Syntax> keywords = new LinkedHashMap<>();
        skipWS();
        if (peek(')')) {
            pos++;
            return new Syntax.Call(function, start, args, keywords);
        }
        while (true) {
            skipWS();
            String keyword = tryKeyword();
            if (keyword != null) {
                if (keywords.containsKey(keyword))
                    throw err("Duplicate keyword '" + keyword + "'");
                keywords.put(keyword, parseExpression());
            } else {
                if (!keywords.isEmpty())
                    throw err("Positional argument after keyword argument");
                args.add(parseExpression());
            }
            skipWS();
            if (peek(',')) {
                pos++;
            } else {
                expect(')');
                return new Syntax.Call(function, start, args, keywords);
            }
        }
    }

    // Consumes "name =" if present (but not "name =="), otherwise leaves pos untouched.
    private String tryKeyword() {
        if (pos >= input.length() || !isIdentifierStart(input.charAt(pos)))
            return null;
        int mark = pos;
        String id = parseIdentifier();
        skipWS();
        if (peek('=') && !input.startsWith("==", pos)) {
            pos++;
            return id;
        }
        pos = mark;
        return null;
    }

    private Syntax parseNumber() {
        int start = pos;
        while (pos < input.length() && Character.isDigit(input.charAt(pos)))
            pos++;
        if (peek('.')) {
            pos++;
            while (pos < input.length() && Character.isDigit(input.charAt(pos)))
                pos++;
        }
        if (peek('e') || peek('E')) {
            int mark = pos;
            pos++;
            if (peek('+') || peek('-'))
                pos++;
            if (pos < input.length() && Character.isDigit(input.charAt(pos))) {
                while (pos < input.length() && Character.isDigit(input.charAt(pos)))
                    pos++;
            } else {
                pos = mark;
            }
        }
        String text = input.substring(start, pos);
        try {
            return new Syntax.Constant(Double.parseDouble(text));
        } catch (NumberFormatException e) {
            throw new EquationSyntaxException("Invalid number '" + text + "'", input, start);
        }
    }

    private String parseIdentifier() {
        int start = pos;
        pos++;
        while (pos < input.length() && isIdentifierPart(input.charAt(pos)))
            pos++;
        return input.substring(start, pos);
    }

    private static boolean isIdentifierStart(char c) {
        return Character.isLetter(c) || c == '_';
    }

    private static boolean isIdentifierPart(char c) {
        return Character.isLetterOrDigit(c) || c == '_';
    }

    private boolean peek(char c) {
        return pos < input.length() && input.charAt(pos) == c;
    }

    private void expect(char c) {
        if (!peek(c))
            throw err(pos < input.length() ? "Expected '" + c + "' but found '" + input.charAt(pos) + "'"
                    : "Expected '" + c + "'");
        pos++;
    }

    private void skipWS() {
        while (pos < input.length() && Character.isWhitespace(input.charAt(pos)))
            pos++;
    }

    private EquationSyntaxException err(String msg) {
        return new EquationSyntaxException(msg, input, pos);
    }
}
