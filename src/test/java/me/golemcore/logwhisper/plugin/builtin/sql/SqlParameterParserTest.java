package me.golemcore.logwhisper.plugin.builtin.sql;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class SqlParameterParserTest {

    // ===== Splitting =====

    @Test
    void shouldReturnNoParametersForBlankText() {
        assertTrue(SqlParameterParser.parse("").isEmpty());
        assertTrue(SqlParameterParser.parse(null).isEmpty());
    }

    @Test
    void shouldSplitTypedValues() {
        List<SqlParameter> params = SqlParameterParser.parse("1(Integer), alice(String), true(Boolean)");

        assertEquals(3, params.size());
        assertEquals(new SqlParameter("1", "Integer"), params.get(0));
        assertEquals(new SqlParameter("alice", "String"), params.get(1));
        assertEquals(new SqlParameter("true", "Boolean"), params.get(2));
    }

    @Test
    void shouldKeepCommasInsideQuotedValues() {
        List<SqlParameter> params = SqlParameterParser.parse("'a, b', \"c, d\", 3");

        assertEquals(3, params.size());
        assertEquals("'a, b'", params.get(0).value());
        assertEquals("\"c, d\"", params.get(1).value());
        assertEquals("3", params.get(2).value());
    }

    @Test
    void shouldTreatDoubledQuoteAsEscape() {
        List<SqlParameter> params = SqlParameterParser.parse("'it''s, fine', 2");

        assertEquals(2, params.size());
        assertEquals("'it''s, fine'", params.get(0).value());
    }

    @Test
    void shouldTreatApostropheInsideUnquotedValueAsText() {
        List<SqlParameter> params = SqlParameterParser.parse("O'Brien(String), 5(Integer)");

        assertEquals(2, params.size());
        assertEquals(new SqlParameter("O'Brien", "String"), params.get(0));
        assertEquals(new SqlParameter("5", "Integer"), params.get(1));
        assertEquals("'O''Brien'", params.get(0).toSqlLiteral());
    }

    @Test
    void shouldNotReadTypeHintFromQuotedValue() {
        SqlParameter param = SqlParameterParser.parse("'value(String)'").get(0);

        assertFalse(param.hasTypeHint());
        assertNull(param.typeHint());
    }

    @Test
    void shouldAcceptQualifiedTypeHint() {
        SqlParameter param = SqlParameterParser.parse("2024-01-15 10:00:00.0(java.sql.Timestamp)").get(0);

        assertEquals("2024-01-15 10:00:00.0", param.value());
        assertEquals("java.sql.Timestamp", param.typeHint());
    }

    // ===== Literals =====

    @Test
    void shouldRenderNumbersAndBooleansBare() {
        assertEquals("42", new SqlParameter("42", "Long").toSqlLiteral());
        assertEquals("-1.5", new SqlParameter("-1.5", null).toSqlLiteral());
        assertEquals("true", new SqlParameter("true", "Boolean").toSqlLiteral());
    }

    @Test
    void shouldQuoteNumericTextWithStringType() {
        assertEquals("'42'", new SqlParameter("42", "String").toSqlLiteral());
    }

    @Test
    void shouldRenderNullKeyword() {
        assertEquals("NULL", new SqlParameter("null", null).toSqlLiteral());
    }

    @Test
    void shouldDoubleEmbeddedQuotes() {
        assertEquals("'O''Brien'", new SqlParameter("O'Brien", "String").toSqlLiteral());
    }

    @Test
    void shouldConvertDoubleQuotedValueToSingleQuotes() {
        assertEquals("'abc'", new SqlParameter("\"abc\"", null).toSqlLiteral());
    }

    @Test
    void shouldKeepSingleQuotedValueAsIs() {
        assertEquals("'x'", new SqlParameter("'x'", null).toSqlLiteral());
    }
}
