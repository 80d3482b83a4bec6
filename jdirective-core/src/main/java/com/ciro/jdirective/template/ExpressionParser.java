package com.ciro.jdirective.template;

import com.ciro.jdirective.error.ExpressionException;
import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Parser recursivo descendente de expresiones.
 *
 * <pre>
 * expr     := or ( "?" expr ":" expr )?
 * or       := and ( "||" and )*
 * and      := equality ( "&amp;&amp;" equality )*
 * equality := relation ( ("==" | "!=") relation )*
 * relation := sum ( ("&lt;" | "&lt;=" | "&gt;" | "&gt;=") sum )*
 * sum      := product ( ("+" | "-") product )*
 * product  := unary ( ("*" | "/" | "%") unary )*
 * unary    := ("!" | "-") unary | postfix
 * postfix  := primary ( "." IDENT | "[" expr "]" )*
 * primary  := NUMBER | STRING | true | false | null | IDENT "(" args ")" | IDENT | "(" expr ")"
 * </pre>
 */
public final class ExpressionParser {

    private static final Set<String> FUNCTIONS = Set.of("len", "empty", "upper", "lower");

    private enum Kind { NUMBER, STRING, IDENT, OP, END }

    private record Tok(Kind kind, String text, Object value, int pos) {}

    private final String source;
    private final List<Tok> tokens;
    private int pos = 0;

    private ExpressionParser(String source) {
        this.source = source;
        this.tokens = tokenize(source);
    }

    public static Expr parse(String source) {
        if (source == null || source.isBlank()) {
            throw new ExpressionException("Empty expression", source);
        }
        ExpressionParser p = new ExpressionParser(source);
        Expr e = p.expr();
        if (p.peek().kind() != Kind.END) {
            throw p.error("Unexpected '" + p.peek().text() + "'");
        }
        return e;
    }

    // ------------------------------------------------------------------ gramática

    private Expr expr() {
        Expr test = or();
        if (match("?")) {
            Expr then = expr();
            expect(":");
            Expr otherwise = expr();
            return new Expr.Conditional(test, then, otherwise);
        }
        return test;
    }

    private Expr or() {
        Expr e = and();
        while (match("||")) e = new Expr.Binary("||", e, and(), source);
        return e;
    }

    private Expr and() {
        Expr e = equality();
        while (match("&&")) e = new Expr.Binary("&&", e, equality(), source);
        return e;
    }

    private Expr equality() {
        Expr e = relation();
        while (true) {
            if (match("==")) e = new Expr.Binary("==", e, relation(), source);
            else if (match("!=")) e = new Expr.Binary("!=", e, relation(), source);
            else return e;
        }
    }

    private Expr relation() {
        Expr e = sum();
        while (true) {
            String op = peekOp("<", "<=", ">", ">=");
            if (op == null) return e;
            pos++;
            e = new Expr.Binary(op, e, sum(), source);
        }
    }

    private Expr sum() {
        Expr e = product();
        while (true) {
            String op = peekOp("+", "-");
            if (op == null) return e;
            pos++;
            e = new Expr.Binary(op, e, product(), source);
        }
    }

    private Expr product() {
        Expr e = unary();
        while (true) {
            String op = peekOp("*", "/", "%");
            if (op == null) return e;
            pos++;
            e = new Expr.Binary(op, e, unary(), source);
        }
    }

    private Expr unary() {
        if (match("!")) return new Expr.Not(unary());
        if (match("-")) return new Expr.Negate(unary(), source);
        return postfix();
    }

    private Expr postfix() {
        Expr e = primary();
        while (true) {
            if (match(".")) {
                Tok name = next();
                if (name.kind() != Kind.IDENT && name.kind() != Kind.NUMBER) {
                    throw error("Expected property name after '.'");
                }
                e = new Expr.Member(e, name.text());
            } else if (match("[")) {
                Expr key = expr();
                expect("]");
                e = new Expr.Index(e, key);
            } else {
                return e;
            }
        }
    }

    private Expr primary() {
        Tok t = next();
        switch (t.kind()) {
            case NUMBER:
            case STRING:
                return new Expr.Literal(t.value());
            case IDENT:
                switch (t.text()) {
                    case "true": return new Expr.Literal(Boolean.TRUE);
                    case "false": return new Expr.Literal(Boolean.FALSE);
                    case "null":
                    case "nil": return new Expr.Literal(null);
                    default: break;
                }
                if (match("(")) {
                    if (!FUNCTIONS.contains(t.text())) {
                        throw error("Unknown function '" + t.text() + "'");
                    }
                    List<Expr> args = new ArrayList<>();
                    if (!match(")")) {
                        do { args.add(expr()); } while (match(","));
                        expect(")");
                    }
                    return new Expr.Call(t.text(), args, source);
                }
                return new Expr.Variable(t.text());
            case OP:
                if (t.text().equals("(")) {
                    Expr inner = expr();
                    expect(")");
                    return inner;
                }
                throw error("Unexpected '" + t.text() + "'");
            default:
                throw error("Unexpected end of expression");
        }
    }

    // ------------------------------------------------------------------ cursor

    private Tok peek() {
        return tokens.get(pos);
    }

    private Tok next() {
        Tok t = tokens.get(pos);
        if (t.kind() != Kind.END) pos++;
        return t;
    }

    private boolean match(String op) {
        Tok t = peek();
        if (t.kind() == Kind.OP && t.text().equals(op)) {
            pos++;
            return true;
        }
        return false;
    }

    private String peekOp(String... ops) {
        Tok t = peek();
        if (t.kind() != Kind.OP) return null;
        for (String op : ops) {
            if (t.text().equals(op)) return op;
        }
        return null;
    }

    private void expect(String op) {
        if (!match(op)) throw error("Expected '" + op + "'");
    }

    private ExpressionException error(String message) {
        return new ExpressionException(message + " at position " + peek().pos() + " in '" + source + "'", source);
    }

    // ------------------------------------------------------------------ tokens

    private static final String[] OPERATORS = {
        "==", "!=", "<=", ">=", "&&", "||",
        "<", ">", "!", "+", "-", "*", "/", "%", "(", ")", "[", "]", ".", ",", "?", ":"
    };

    // Enteros fuera de rango de long pasan a BigDecimal
    private static Object integer(String text) {
        try {
            return Long.parseLong(text);
        } catch (NumberFormatException e) {
            return new BigDecimal(text);
        }
    }

    private static List<Tok> tokenize(String src) {
        List<Tok> out = new ArrayList<>();
        int i = 0;
        int len = src.length();
        while (i < len) {
            char c = src.charAt(i);
            if (Character.isWhitespace(c)) {
                i++;
                continue;
            }
            int start = i;
            if (Character.isDigit(c)) {
                while (i < len && Character.isDigit(src.charAt(i))) i++;
                boolean decimal = false;
                if (i + 1 < len && src.charAt(i) == '.' && Character.isDigit(src.charAt(i + 1))) {
                    decimal = true;
                    i++;
                    while (i < len && Character.isDigit(src.charAt(i))) i++;
                }
                String text = src.substring(start, i);
                Object value = decimal ? (Object) Double.parseDouble(text) : integer(text);
                out.add(new Tok(Kind.NUMBER, text, value, start));
                continue;
            }
            if (c == '\'' || c == '"') {
                StringBuilder sb = new StringBuilder();
                i++;
                boolean closed = false;
                while (i < len) {
                    char d = src.charAt(i);
                    if (d == '\\' && i + 1 < len) {
                        sb.append(src.charAt(i + 1));
                        i += 2;
                        continue;
                    }
                    if (d == c) {
                        closed = true;
                        i++;
                        break;
                    }
                    sb.append(d);
                    i++;
                }
                if (!closed) {
                    throw new ExpressionException("Unterminated string at position " + start + " in '" + src + "'", src);
                }
                out.add(new Tok(Kind.STRING, src.substring(start, i), sb.toString(), start));
                continue;
            }
            if (Character.isLetter(c) || c == '_' || c == '$') {
                while (i < len && (Character.isLetterOrDigit(src.charAt(i)) || src.charAt(i) == '_' || src.charAt(i) == '$')) i++;
                out.add(new Tok(Kind.IDENT, src.substring(start, i), null, start));
                continue;
            }
            String op = null;
            for (String candidate : OPERATORS) {
                if (src.startsWith(candidate, i)) {
                    op = candidate;
                    break;
                }
            }
            if (op == null) {
                throw new ExpressionException("Unexpected character '" + c + "' at position " + i + " in '" + src + "'", src);
            }
            out.add(new Tok(Kind.OP, op, null, start));
            i += op.length();
        }
        out.add(new Tok(Kind.END, "<end>", null, len));
        return out;
    }
}
