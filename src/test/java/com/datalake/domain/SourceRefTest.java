package com.datalake.domain;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("SourceRef Tests")
class SourceRefTest {

    @Test
    @DisplayName("Should parse kind-qualified identifiers")
    void shouldParseQualifiedIdentifiers() {
        Optional<SourceRef> file = SourceRef.parse("file:TRANSACTIONS_CLEANED");
        Optional<SourceRef> table = SourceRef.parse("TABLE:sql_transactions");

        assertThat(file).contains(SourceRef.of(SourceKind.FILE, "TRANSACTIONS_CLEANED"));
        assertThat(table).contains(SourceRef.of(SourceKind.TABLE, "sql_transactions"));
        assertThat(table.get().toString()).isEqualTo("table:sql_transactions");
    }

    @Test
    @DisplayName("Should leave the kind of a bare name unresolved")
    void shouldParseBareName() {
        SourceRef ref = SourceRef.parse("  TRANSACTIONS_CLEANED ").orElseThrow();

        assertThat(ref.getKind()).isEmpty();
        assertThat(ref.getName()).isEqualTo("TRANSACTIONS_CLEANED");
    }

    @Test
    @DisplayName("Should reject blank identifiers and unknown kinds")
    void shouldRejectInvalidIdentifiers() {
        assertThat(SourceRef.parse(null)).isEmpty();
        assertThat(SourceRef.parse("   ")).isEmpty();
        assertThat(SourceRef.parse("file:")).isEmpty();
        assertThat(SourceRef.parse("bucket:TX")).isEmpty();
    }
}
