package com.ciro.jdirective.template;

import static org.assertj.core.api.Assertions.assertThat;

import com.ciro.jdirective.template.StatementLexer.Token;
import com.ciro.jdirective.template.StatementLexer.TokenType;
import java.util.List;
import org.junit.jupiter.api.Test;

class StatementLexerTest {

    @Test
    void splitsTextAndStatements() {
        List<Token> tokens = StatementLexer.lex("Hola {{ user.name }}!");

        assertThat(tokens).extracting(Token::type).containsExactly(TokenType.TEXT, TokenType.STMT, TokenType.TEXT);
        assertThat(tokens.get(1).content()).isEqualTo("user.name");
        assertThat(tokens.get(1).source()).isEqualTo("{{ user.name }}");
    }

    @Test
    void bracesInsideQuotesDoNotCloseTheStatement() {
        List<Token> tokens = StatementLexer.lex("{{ '}}' + \"}}\" }}");

        assertThat(tokens).singleElement().extracting(Token::content).isEqualTo("'}}' + \"}}\"");
    }

    @Test
    void unclosedStatementIsText() {
        List<Token> tokens = StatementLexer.lex("a {{ b");

        assertThat(tokens).singleElement().extracting(Token::type).isEqualTo(TokenType.TEXT);
        assertThat(StatementLexer.hasStatement("a {{ b")).isFalse();
    }

    @Test
    void emptyInput() {
        assertThat(StatementLexer.lex("")).isEmpty();
        assertThat(StatementLexer.lex(null)).isEmpty();
        assertThat(StatementLexer.hasStatement("{{x}}")).isTrue();
    }
}
