package com.sprout.database;

import static org.assertj.core.api.Assertions.assertThat;

import java.sql.SQLException;
import java.sql.SQLRecoverableException;
import java.sql.SQLTransactionRollbackException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

@DisplayName("SqlErrorClassifier")
class SqlErrorClassifierTest {

    @Nested
    @DisplayName("classify")
    class Classify {

        @ParameterizedTest(name = "SQLState {0} is CONNECTION_LOST")
        @ValueSource(strings = {"08001", "08006", "57P01", "57P03"})
        void connectionStates(String state) {
            assertThat(SqlErrorClassifier.classify(new SQLException("x", state))).isEqualTo(ErrorKind.CONNECTION_LOST);
        }

        @ParameterizedTest(name = "SQLState {0} is TRANSACTION_CONFLICT")
        @ValueSource(strings = {"40001", "40P01", "HYT00"})
        void conflictStates(String state) {
            assertThat(SqlErrorClassifier.classify(new SQLException("x", state)))
                    .isEqualTo(ErrorKind.TRANSACTION_CONFLICT);
        }

        @Test
        @DisplayName("falls back to the JDBC exception subclass without a SQLState")
        void fallsBackToSubclass() {
            assertThat(SqlErrorClassifier.classify(new SQLRecoverableException("gone")))
                    .isEqualTo(ErrorKind.CONNECTION_LOST);
            assertThat(SqlErrorClassifier.classify(new SQLTransactionRollbackException("deadlock")))
                    .isEqualTo(ErrorKind.TRANSACTION_CONFLICT);
        }

        @Test
        @DisplayName("treats constraint violations as DATA_ACCESS")
        void constraintViolation() {
            assertThat(SqlErrorClassifier.classify(new SQLException("duplicate key", "23505")))
                    .isEqualTo(ErrorKind.DATA_ACCESS);
        }

        @Test
        @DisplayName("finds the SQLState of a wrapped cause")
        void wrappedCause() {
            var e = new SQLException("outer", null, new SQLException("inner", "08003"));

            assertThat(SqlErrorClassifier.sqlState(e)).isEqualTo("08003");
            assertThat(SqlErrorClassifier.classify(e)).isEqualTo(ErrorKind.CONNECTION_LOST);
        }
    }

    @Nested
    @DisplayName("translate")
    class Translate {

        @Test
        @DisplayName("produces the matching exception type")
        void matchingType() {
            assertThat(SqlErrorClassifier.translate("Update", new SQLException("x", "08006")))
                    .isInstanceOf(ConnectionLostException.class);
            assertThat(SqlErrorClassifier.translate("Update", new SQLException("x", "40001")))
                    .isInstanceOf(TransactionConflictException.class)
                    .satisfies(e -> assertThat(((TransactionConflictException) e).sqlState()).isEqualTo("40001"));
            assertThat(SqlErrorClassifier.translate("Update", new SQLException("x", "42601")))
                    .isInstanceOf(PersistenceException.class);
        }

        @Test
        @DisplayName("keeps the operation and driver message")
        void keepsMessage() {
            DatabaseException e = SqlErrorClassifier.translate("Insert", new SQLException("value too long", "22001"));

            assertThat(e.getMessage()).contains("Insert", "22001", "value too long");
            assertThat(e.getCause()).isInstanceOf(SQLException.class);
            assertThat(e.retriable()).isFalse();
        }
    }
}
