package com.ciro.jdirective.template;

import com.ciro.jdirective.error.ExpressionException;
import java.util.List;
import java.util.Locale;

/** Nodo compilado de una expresión. Inmutable: se puede evaluar contra cualquier contexto. */
public interface Expr {

    Object eval(DataContext ctx);

    record Literal(Object value) implements Expr {
        @Override public Object eval(DataContext ctx) { return value; }
    }

    record Variable(String name) implements Expr {
        @Override public Object eval(DataContext ctx) { return ctx.get(name); }
    }

    record Member(Expr target, String name) implements Expr {
        @Override public Object eval(DataContext ctx) { return Values.property(target.eval(ctx), name); }
    }

    record Index(Expr target, Expr key) implements Expr {
        @Override public Object eval(DataContext ctx) { return Values.index(target.eval(ctx), key.eval(ctx)); }
    }

    record Not(Expr operand) implements Expr {
        @Override public Object eval(DataContext ctx) { return !Values.isTruthy(operand.eval(ctx)); }
    }

    record Negate(Expr operand, String source) implements Expr {
        @Override public Object eval(DataContext ctx) { return Values.negate(operand.eval(ctx), source); }
    }

    record Binary(String op, Expr left, Expr right, String source) implements Expr {
        @Override
        public Object eval(DataContext ctx) {
            switch (op) {
                case "&&": return Values.isTruthy(left.eval(ctx)) && Values.isTruthy(right.eval(ctx));
                case "||": return Values.isTruthy(left.eval(ctx)) || Values.isTruthy(right.eval(ctx));
                default: break;
            }
            Object l = left.eval(ctx);
            Object r = right.eval(ctx);
            return switch (op) {
                case "==" -> Values.equal(l, r);
                case "!=" -> !Values.equal(l, r);
                case "<" -> Values.compare(l, r, source) < 0;
                case "<=" -> Values.compare(l, r, source) <= 0;
                case ">" -> Values.compare(l, r, source) > 0;
                case ">=" -> Values.compare(l, r, source) >= 0;
                default -> Values.arithmetic(op.charAt(0), l, r, source);
            };
        }
    }

    record Conditional(Expr test, Expr then, Expr otherwise) implements Expr {
        @Override
        public Object eval(DataContext ctx) {
            return Values.isTruthy(test.eval(ctx)) ? then.eval(ctx) : otherwise.eval(ctx);
        }
    }

    record Call(String function, List<Expr> args, String source) implements Expr {
        @Override
        public Object eval(DataContext ctx) {
            if (args.size() != 1) {
                throw new ExpressionException(function + "() expects 1 argument, got " + args.size(), source);
            }
            Object v = args.get(0).eval(ctx);
            return switch (function) {
                case "len" -> Values.size(v);
                case "empty" -> !Values.isTruthy(v);
                case "upper" -> Values.stringify(v).toUpperCase(Locale.ROOT);
                case "lower" -> Values.stringify(v).toLowerCase(Locale.ROOT);
                default -> throw new ExpressionException("Unknown function '" + function + "'", source);
            };
        }
    }
}
