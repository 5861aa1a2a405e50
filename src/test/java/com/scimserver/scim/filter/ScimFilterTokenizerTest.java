package com.scimserver.scim.filter;

import com.scimserver.scim.exceptions.InvalidFilterException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.stream.Collectors;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.catchThrowableOfType;

/**
 * Unit tests for ScimFilterTokenizer.
 */
class ScimFilterTokenizerTest {

    private static List<TokenType> types(List<Token> tokens) {
        return tokens.stream().map(Token::getType).collect(Collectors.toList());
    }

    @Test
    @DisplayName("Should tokenize a simple comparison and end with EOF")
    void testTokenize_SimpleComparison() throws InvalidFilterException {
        // Given: A simple equality filter
        String filter = "userName eq \"john\"";

        // When: Tokenizing
        List<Token> tokens = ScimFilterTokenizer.tokenize(filter);

        // Then: ATTR OP STRING EOF with values and positions
        assertThat(types(tokens)).containsExactly(TokenType.ATTR, TokenType.OP, TokenType.STRING, TokenType.EOF);
        assertThat(tokens.get(0).getValue()).isEqualTo("userName");
        assertThat(tokens.get(1).getValue()).isEqualTo("eq");
        assertThat(tokens.get(2).getValue()).isEqualTo("john");
        assertThat(tokens.get(2).getPosition()).isEqualTo(12);
        assertThat(tokens.get(3).getPosition()).isEqualTo(filter.length());
    }

    @Test
    @DisplayName("Should match keywords and operators case-insensitively but keep attribute casing")
    void testTokenize_KeywordCaseInsensitive() throws InvalidFilterException {
        List<Token> tokens = ScimFilterTokenizer.tokenize("Title PR AND Active EQ TRUE OR NOT (x Ne NULL)");

        assertThat(types(tokens)).containsExactly(
                TokenType.ATTR, TokenType.PR, TokenType.AND,
                TokenType.ATTR, TokenType.OP, TokenType.BOOLEAN,
                TokenType.OR, TokenType.NOT, TokenType.LPAREN,
                TokenType.ATTR, TokenType.OP, TokenType.NULL, TokenType.RPAREN,
                TokenType.EOF);
        assertThat(tokens.get(0).getValue()).isEqualTo("Title");
        assertThat(tokens.get(4).getValue()).isEqualTo("eq");
        assertThat(tokens.get(5).getValue()).isEqualTo("true");
        assertThat(tokens.get(10).getValue()).isEqualTo("ne");
    }

    @Test
    @DisplayName("Should lex URN-qualified and dotted paths as a single attribute token")
    void testTokenize_UrnAttribute() throws InvalidFilterException {
        List<Token> tokens = ScimFilterTokenizer.tokenize(
                "urn:ietf:params:scim:schemas:extension:enterprise:2.0:User:department eq \"Sales\"");

        assertThat(types(tokens)).containsExactly(TokenType.ATTR, TokenType.OP, TokenType.STRING, TokenType.EOF);
        assertThat(tokens.get(0).getValue())
                .isEqualTo("urn:ietf:params:scim:schemas:extension:enterprise:2.0:User:department");
    }

    @Test
    @DisplayName("Should tokenize brackets of a value path")
    void testTokenize_ValuePath() throws InvalidFilterException {
        List<Token> tokens = ScimFilterTokenizer.tokenize("emails[type eq \"work\"]");

        assertThat(types(tokens)).containsExactly(
                TokenType.ATTR, TokenType.LBRACKET, TokenType.ATTR, TokenType.OP, TokenType.STRING,
                TokenType.RBRACKET, TokenType.EOF);
    }

    @Test
    @DisplayName("Should tokenize integers, negatives and decimals as numbers")
    void testTokenize_Numbers() throws InvalidFilterException {
        List<Token> tokens = ScimFilterTokenizer.tokenize("a gt 10 and b lt -2.5 and (c eq 3)");

        assertThat(tokens.get(2).getType()).isEqualTo(TokenType.NUMBER);
        assertThat(tokens.get(2).getValue()).isEqualTo("10");
        assertThat(tokens.get(6).getType()).isEqualTo(TokenType.NUMBER);
        assertThat(tokens.get(6).getValue()).isEqualTo("-2.5");
        assertThat(tokens.get(11).getType()).isEqualTo(TokenType.NUMBER);
        assertThat(tokens.get(11).getValue()).isEqualTo("3");
    }

    @Test
    @DisplayName("Should treat a backslash as escaping the next character")
    void testTokenize_EscapedQuote() throws InvalidFilterException {
        List<Token> tokens = ScimFilterTokenizer.tokenize("displayName eq \"say \\\"hi\\\" \\\\ ok\"");

        assertThat(tokens.get(2).getType()).isEqualTo(TokenType.STRING);
        assertThat(tokens.get(2).getValue()).isEqualTo("say \"hi\" \\ ok");
    }

    @Test
    @DisplayName("Should reject an unterminated string with its start position")
    void testTokenize_UnterminatedString() {
        InvalidFilterException error = catchThrowableOfType(
                () -> ScimFilterTokenizer.tokenize("userName eq \"john"), InvalidFilterException.class);

        assertThat(error).hasMessageContaining("Unterminated string at position 12");
        assertThat(error.getPosition()).isEqualTo(12);
    }

    @Test
    @DisplayName("Should reject an unexpected character")
    void testTokenize_UnexpectedCharacter() {
        assertThatThrownBy(() -> ScimFilterTokenizer.tokenize("userName eq 'john'"))
                .isInstanceOf(InvalidFilterException.class)
                .hasMessageContaining("Unexpected character ''' at position 12");
    }

    @Test
    @DisplayName("Should not lex a number running into identifier characters")
    void testTokenize_NumberFollowedByLetters() {
        assertThatThrownBy(() -> ScimFilterTokenizer.tokenize("a eq 12abc"))
                .isInstanceOf(InvalidFilterException.class)
                .hasMessageContaining("Unexpected character '1'");
    }

    @Test
    @DisplayName("Should return only EOF for whitespace input")
    void testTokenize_Whitespace() throws InvalidFilterException {
        List<Token> tokens = ScimFilterTokenizer.tokenize("   ");

        assertThat(types(tokens)).containsExactly(TokenType.EOF);
        assertThat(tokens.get(0).getPosition()).isEqualTo(3);
    }
}
