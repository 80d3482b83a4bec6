package com.ciro.jdirective.template;

import com.ciro.jdirective.error.ExpressionException;
import java.util.ArrayList;
import java.util.List;

/**
 * Evaluador por defecto: rutas de variables ({@code user.name}, {@code items[0]}),
 * literales, operadores lógicos, de comparación y aritméticos, ternario y un
 * puñado de funciones ({@code len}, {@code empty}, {@code upper}, {@code lower}).
 *
 * <p>Sin estado: se puede compartir entre renders.
 */
public class PathExpressionGateway implements ExpressionGateway {

    @Override
    public Object exec(String expression, DataContext ctx) {
        if (expression == null) {
            throw new ExpressionException("Empty expression", null);
        }
        List<StatementLexer.Token> tokens = StatementLexer.lex(expression.trim());

        // Expresión desnuda: "score > 50"
        if (tokens.stream().noneMatch(t -> t.type() == StatementLexer.TokenType.STMT)) {
            return evaluate(expression.trim(), ctx);
        }

        // Un único bloque: "{{ score > 50 }}"
        if (tokens.size() == 1) {
            return evaluate(tokens.get(0).content(), ctx);
        }

        // Texto mixto: se interpola y el resultado es texto
        Interpolation res = replace(expression, ctx);
        if (res.hasErrors()) throw res.errors().get(0);
        return res.text();
    }

    @Override
    public Interpolation replace(String text, DataContext ctx) {
        if (text == null || !text.contains("{{")) return Interpolation.unchanged(text);

        List<StatementLexer.Token> tokens = StatementLexer.lex(text);
        List<ExpressionException> errors = new ArrayList<>();
        StringBuilder sb = new StringBuilder();
        boolean hadExpression = false;
        int statements = 0;
        boolean blankAround = true;
        Object lastValue = null;

        for (StatementLexer.Token t : tokens) {
            if (t.type() == StatementLexer.TokenType.TEXT) {
                if (!t.content().isBlank()) blankAround = false;
                sb.append(t.content());
                continue;
            }
            hadExpression = true;
            statements++;
            try {
                lastValue = evaluate(t.content(), ctx);
                sb.append(Values.stringify(lastValue));
            } catch (ExpressionException e) {
                errors.add(e);
                lastValue = null;
                sb.append(t.source());
            }
        }

        if (!hadExpression) return Interpolation.unchanged(text);

        boolean single = statements == 1 && blankAround && errors.isEmpty();
        return new Interpolation(sb.toString(), true, single, single ? lastValue : null, errors);
    }

    protected Object evaluate(String source, DataContext ctx) {
        try {
            return ExpressionParser.parse(source).eval(ctx);
        } catch (ExpressionException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new ExpressionException(e.getClass().getSimpleName() + ": " + e.getMessage(), source, e);
        }
    }
}
