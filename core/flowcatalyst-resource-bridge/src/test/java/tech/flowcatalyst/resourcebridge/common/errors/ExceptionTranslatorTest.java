package tech.flowcatalyst.resourcebridge.common.errors;

import jakarta.persistence.PersistenceException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.sql.SQLException;
import java.sql.SQLIntegrityConstraintViolationException;
import java.sql.SQLTransientConnectionException;

import static org.assertj.core.api.Assertions.*;

/**
 * Tests for ExceptionTranslator.
 */
class ExceptionTranslatorTest {

    private static PersistenceException wrapped(SQLException cause) {
        return new PersistenceException("could not execute statement", cause);
    }

    @Test
    @DisplayName("translate should map unique violations to duplicate_entry")
    void translate_shouldMapUniqueViolation() {
        UseCaseError error = ExceptionTranslator.translate(
            wrapped(new SQLIntegrityConstraintViolationException("duplicate key value violates \"author_email_key\"", "23505")),
            "create");

        assertThat(error.code()).isEqualTo(ErrorCode.DUPLICATE_ENTRY);
        assertThat(error.message()).doesNotContain("author_email_key");
    }

    @Test
    @DisplayName("translate should map foreign key violations to invalid_reference")
    void translate_shouldMapForeignKeyViolation() {
        UseCaseError error = ExceptionTranslator.translate(wrapped(new SQLException("fk", "23503")), "delete");

        assertThat(error.code()).isEqualTo(ErrorCode.INVALID_REFERENCE);
    }

    @Test
    @DisplayName("translate should map other integrity violations to constraint_error")
    void translate_shouldMapOtherIntegrityViolation() {
        UseCaseError error = ExceptionTranslator.translate(new SQLException("not null", "23502"), "create");

        assertThat(error.code()).isEqualTo(ErrorCode.CONSTRAINT_ERROR);
    }

    @Test
    @DisplayName("translate should map connection failures to database_unavailable")
    void translate_shouldMapConnectionFailure() {
        assertThat(ExceptionTranslator.translate(wrapped(new SQLException("refused", "08006")), "list").code())
            .isEqualTo(ErrorCode.DATABASE_UNAVAILABLE);
        assertThat(ExceptionTranslator.translate(new SQLTransientConnectionException("pool exhausted"), "list").code())
            .isEqualTo(ErrorCode.DATABASE_UNAVAILABLE);
    }

    @Test
    @DisplayName("translate should map argument errors to invalid_input without leaking the message")
    void translate_shouldMapInvalidInput() {
        UseCaseError error = ExceptionTranslator.translate(new NumberFormatException("For input string: \"x\""), "get");

        assertThat(error.code()).isEqualTo(ErrorCode.INVALID_INPUT);
        assertThat(error.message()).isEqualTo("Invalid input provided");
    }

    @Test
    @DisplayName("translate should map unexpected failures to internal_error")
    void translate_shouldMapUnexpected() {
        UseCaseError error = ExceptionTranslator.translate(new IllegalStateException("host db-1.internal"), "get");

        assertThat(error.code()).isEqualTo(ErrorCode.INTERNAL_ERROR);
        assertThat(error.message()).doesNotContain("db-1");
    }
}
