package com.ciro.jdirective.template;

import java.util.ArrayList;
import java.util.List;

/**
 * Lexer de un solo paso para texto con bloques {@code {{ ... }}}.
 * Ignora las llaves {@code }}} que aparecen dentro de literales entre comillas.
 */
public final class StatementLexer {

    public enum TokenType {
        TEXT,   // texto plano
        STMT    // bloque {{ expr }}
    }

    /**
     * @param content contenido (para STMT, la expresión ya recortada)
     * @param source  texto original tal y como aparece en la plantilla
     */
    public record Token(TokenType type, String content, String source) {}

    private StatementLexer() {}

    public static boolean hasStatement(String text) {
        for (Token t : lex(text)) {
            if (t.type() == TokenType.STMT) return true;
        }
        return false;
    }

    public static List<Token> lex(String template) {
        List<Token> tokens = new ArrayList<>();
        if (template == null || template.isEmpty()) return tokens;

        int i = 0;
        int len = template.length();
        StringBuilder buffer = new StringBuilder();

        while (i < len) {
            if (i + 1 < len && template.charAt(i) == '{' && template.charAt(i + 1) == '{') {
                int start = i;
                i += 2;

                boolean inSingleQuote = false;
                boolean inDoubleQuote = false;
                boolean closed = false;
                StringBuilder stmt = new StringBuilder();

                while (i < len) {
                    char c = template.charAt(i);

                    if (c == '\\' && (inSingleQuote || inDoubleQuote)) {
                        stmt.append(c);
                        i++;
                        if (i < len) {
                            stmt.append(template.charAt(i));
                            i++;
                        }
                        continue;
                    }

                    if (c == '\'' && !inDoubleQuote) inSingleQuote = !inSingleQuote;
                    else if (c == '"' && !inSingleQuote) inDoubleQuote = !inDoubleQuote;
                    else if (!inSingleQuote && !inDoubleQuote && c == '}' && i + 1 < len && template.charAt(i + 1) == '}') {
                        i += 2;
                        closed = true;
                        break;
                    }

                    stmt.append(c);
                    i++;
                }

                if (!closed) {
                    // Bloque sin cerrar: es texto
                    buffer.append(template, start, len);
                    break;
                }

                if (buffer.length() > 0) {
                    tokens.add(new Token(TokenType.TEXT, buffer.toString(), buffer.toString()));
                    buffer.setLength(0);
                }
                tokens.add(new Token(TokenType.STMT, stmt.toString().trim(), template.substring(start, i)));
            } else {
                buffer.append(template.charAt(i));
                i++;
            }
        }

        if (buffer.length() > 0) {
            tokens.add(new Token(TokenType.TEXT, buffer.toString(), buffer.toString()));
        }
        return tokens;
    }
}
