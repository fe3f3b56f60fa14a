package reportflow.engine.validation;

import reportflow.engine.exception.ValidationException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class QueryValidatorTest {

    @Test
    void acceptsPlainSelect() {
        assertDoesNotThrow(() -> QueryValidator.validate("SELECT id, name FROM customers"));
        assertDoesNotThrow(() -> QueryValidator.validate("select * from t where x = 1;"));
        assertDoesNotThrow(() -> QueryValidator.validate("  \n  SELECT 1"));
    }

    @Test
    void acceptsCommonTableExpression() {
        assertDoesNotThrow(() -> QueryValidator.validate(
                "WITH recent AS (SELECT * FROM orders) SELECT count(*) FROM recent"));
    }

    @Test
    void acceptsLeadingComments() {
        assertDoesNotThrow(() -> QueryValidator.validate("-- daily totals\nSELECT 1"));
        assertDoesNotThrow(() -> QueryValidator.validate("/* report */ SELECT 1"));
    }

    @Test
    @DisplayName("DELETE is rejected before it can reach the data source")
    void rejectsDelete() {
        ValidationException e = assertThrows(ValidationException.class,
                () -> QueryValidator.validate("DELETE FROM reports"));
        assertEquals("query", e.field());
    }

    @Test
    void rejectsDeniedKeywordsAnywhere() {
        ValidationException e = assertThrows(ValidationException.class,
                () -> QueryValidator.validate("SELECT * FROM t; DROP TABLE t"));
        assertTrue(e.getMessage().contains("DROP"));

        assertThrows(ValidationException.class,
                () -> QueryValidator.validate("WITH x AS (DELETE FROM t RETURNING *) SELECT * FROM x"));
        assertThrows(ValidationException.class,
                () -> QueryValidator.validate("select * from t where exists (select 1) and 1 = 1 union select merge from m"));
    }

    @Test
    void keywordMatchingIsCaseInsensitiveWholeWord() {
        assertThrows(ValidationException.class, () -> QueryValidator.validate("SELECT 1; update t set a = 1"));
        // substrings of identifiers are fine
        assertDoesNotThrow(() -> QueryValidator.validate("SELECT created_at, updated_by, dropped FROM audit"));
    }

    @Test
    void keywordsInsideLiteralsAreIgnored() {
        assertDoesNotThrow(() -> QueryValidator.validate("SELECT * FROM log WHERE action = 'DELETE'"));
        assertDoesNotThrow(() -> QueryValidator.validate("SELECT 'it''s a DROP' AS note"));
        assertDoesNotThrow(() -> QueryValidator.validate("SELECT 1 -- never DROP anything"));
    }

    @Test
    void rejectsNonSelectOpening() {
        ValidationException e = assertThrows(ValidationException.class,
                () -> QueryValidator.validate("SHOW TABLES"));
        assertEquals("Only SELECT queries are allowed", e.getMessage());
    }

    @Test
    void rejectsMultipleStatements() {
        assertThrows(ValidationException.class, () -> QueryValidator.validate("SELECT 1; SELECT 2"));
        assertThrows(ValidationException.class, () -> QueryValidator.validate("SELECT 1;;"));
    }

    @Test
    void rejectsBlank() {
        assertThrows(ValidationException.class, () -> QueryValidator.validate(null));
        assertThrows(ValidationException.class, () -> QueryValidator.validate("   "));
        assertThrows(ValidationException.class, () -> QueryValidator.validate("-- only a comment"));
    }

    @Test
    void isValid() {
        assertTrue(QueryValidator.isValid("SELECT 1"));
        assertFalse(QueryValidator.isValid("TRUNCATE t"));
    }
}
