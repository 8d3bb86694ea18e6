package eu.optima.listino.tools;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Set;

import org.junit.jupiter.api.Test;

import eu.optima.listino.model.RawTable;
import eu.optima.listino.model.ReconciliationOutcome;
import eu.optima.listino.model.SupplierRecord;

class ReconciliationEngineTest {

    private static final List<String> KEYS = List.of("codice", "codice fornitore", "Codice EAN");
    private static final Set<String> INPUT = Set.of("Descrizione articolo", "prezzo di listino", "costo fornitore");

    private final ReconciliationEngine engine = new ReconciliationEngine();

    private static CanonicalStore store() {
        return CanonicalStore.fromTable(new RawTable(
                List.of("codice", "codice fornitore", "Descrizione articolo", "prezzo di listino", "costo fornitore", "M"),
                List.of(
                        Arrays.asList("A1", "F1", "Vite", "1,50", "1,00", "=E2*2"),
                        Arrays.asList("A2", "F2", "Dado", "0,80", "0,50", "=E3*2"),
                        Arrays.asList("A3", null, "Rondella", "0,10", "0,05", "=E4*2"),
                        Arrays.asList("A3", null, "Rondella bis", "0,12", "0,06", "=E5*2"))));
    }

    private static SupplierRecord row(int sourceRow, String... pairs) {
        var values = new LinkedHashMap<String, String>();
        for (int i = 0; i < pairs.length; i += 2)
            values.put(pairs[i], pairs[i + 1]);
        return SupplierRecord.of(sourceRow, FieldVocabulary.defaults().fields(), values);
    }

    private static List<SupplierRecord> batch() {
        return List.of(
                row(0, "codice", "A1", "prezzo di listino", "1,60", "costo fornitore", "1,10"),
                row(1, "codice", "NEW", "codice fornitore", "F9", "Descrizione articolo", "Nuovo",
                        "prezzo di listino", "5"),
                row(2, "codice fornitore", "F2", "Descrizione articolo", "Dado"));
    }

    @Test
    void updatesInsertsAndLeavesUnchangedRowsAlone() {
        var store = store();
        var report = new ReconciliationReport();

        List<ReconciliationOutcome> outcomes = engine.apply(batch(), KEYS, INPUT, store, report);

        assertThat(outcomes).hasSize(3);
        assertThat(outcomes.get(0).kind()).isEqualTo(ReconciliationOutcome.Kind.UPDATED);
        assertThat(outcomes.get(0).changedFields()).containsExactly("prezzo di listino", "costo fornitore");
        assertThat(outcomes.get(1).kind()).isEqualTo(ReconciliationOutcome.Kind.INSERTED);
        assertThat(outcomes.get(1).rowIndex()).isEqualTo(4);
        assertThat(outcomes.get(2).changed()).isFalse();

        assertThat(store.get(0, "prezzo di listino")).isEqualTo("1,60");
        assertThat(report.updated()).isEqualTo(1);
        assertThat(report.inserted()).isEqualTo(1);
        assertThat(report.unchanged()).isEqualTo(1);
        assertThat(report.summaryLines().get(0))
                .isEqualTo("Rows updated: 1 | unchanged: 1 | inserted: 1 | ambiguous: 0");
    }

    @Test
    void reapplyingTheSameBatchChangesNothing() {
        var store = store();
        engine.apply(batch(), KEYS, INPUT, store);
        var before = store.toTabular();

        var again = engine.apply(batch(), KEYS, INPUT, store);

        assertThat(again).noneMatch(ReconciliationOutcome::changed);
        assertThat(store.toTabular()).isEqualTo(before);
    }

    @Test
    void insertedRowCarriesItsKeysAndNothingOutsideInputFields() {
        var store = store();

        engine.apply(List.of(row(0, "codice", "NEW", "codice fornitore", "F9", "Descrizione articolo", "Nuovo",
                "marca", "ACME")), KEYS, INPUT, store);

        var added = store.record(4);
        assertThat(added.get("codice")).isEqualTo("NEW");
        assertThat(added.get("codice fornitore")).isEqualTo("F9");
        assertThat(added.get("Descrizione articolo")).isEqualTo("Nuovo");
        assertThat(added.get("prezzo di listino")).isNull();
        assertThat(added.get("M")).isNull();
        assertThat(store.find("codice", "NEW")).containsExactly(4);
    }

    @Test
    void nonInputFieldsOfMatchedRowsAreNeverTouched() {
        var store = store();

        var out = engine.apply(List.of(row(0, "codice fornitore", "F2", "codice", "A2-X", "prezzo di listino", "0,90")),
                KEYS, INPUT, store);

        assertThat(out.get(0).changedFields()).containsExactly("prezzo di listino");
        assertThat(store.get(1, "codice")).isEqualTo("A2");
        assertThat(store.get(1, "M")).isEqualTo("=E3*2");
    }

    @Test
    void withoutInputFieldsEverySuppliedFieldIsWritable() {
        var store = store();

        var out = engine.apply(List.of(row(0, "codice", "A1", "Descrizione articolo", "Vite zincata")),
                KEYS, null, store);

        assertThat(out.get(0).changedFields()).containsExactly("Descrizione articolo");
        assertThat(store.get(0, "prezzo di listino")).isEqualTo("1,50");
        assertThat(store.get(0, "M")).isEqualTo("=E2*2");
    }

    @Test
    void ambiguousMatchUpdatesOnlyTheFirstRow() {
        var store = store();
        var report = new ReconciliationReport();

        var out = engine.apply(List.of(row(7, "codice", "A3", "prezzo di listino", "0,20")), KEYS, INPUT, store,
                report);

        assertThat(out.get(0).rowIndex()).isEqualTo(2);
        assertThat(out.get(0).ambiguous()).isTrue();
        assertThat(store.get(2, "prezzo di listino")).isEqualTo("0,20");
        assertThat(store.get(3, "prezzo di listino")).isEqualTo("0,12");
        assertThat(report.ambiguous()).isEqualTo(1);
        assertThat(report.samples()).singleElement().asString().contains("supplierRow:7", "candidates:2");
    }

    @Test
    void insertsAppendInBatchOrderAndLaterRowsSeeThem() {
        var store = store();

        var out = engine.apply(List.of(
                row(0, "codice", "N1", "prezzo di listino", "1"),
                row(1, "codice", "N2", "prezzo di listino", "2"),
                row(2, "codice", "N1", "prezzo di listino", "3")), KEYS, INPUT, store);

        assertThat(out).extracting(ReconciliationOutcome::rowIndex).containsExactly(4, 5, 4);
        assertThat(out.get(2).kind()).isEqualTo(ReconciliationOutcome.Kind.UPDATED);
        assertThat(store.size()).isEqualTo(6);
        assertThat(store.get(4, "prezzo di listino")).isEqualTo("3");
    }

    @Test
    void rowWithoutAnyKeyIsInserted() {
        var store = store();

        var out = engine.apply(List.of(row(0, "Descrizione articolo", "Anonimo")), KEYS, INPUT, store);

        assertThat(out.get(0).kind()).isEqualTo(ReconciliationOutcome.Kind.INSERTED);
        assertThat(store.get(4, "codice")).isNull();
    }

    @Test
    void previewSplitsWithoutWriting() {
        var store = store();
        var before = store.toTabular();

        var preview = engine.preview(batch(), KEYS, store);

        assertThat(preview.updates()).hasSize(2);
        assertThat(preview.inserts()).singleElement()
                .satisfies(p -> assertThat(p.row().get("codice")).isEqualTo("NEW"));
        assertThat(store.toTabular()).isEqualTo(before);
    }

    @Test
    void secondWriterIsRefused() {
        var store = store();

        try (var writer = store.acquireWriter()) {
            assertThatThrownBy(() -> engine.apply(batch(), KEYS, INPUT, store))
                    .isInstanceOf(IllegalStateException.class);
        }
        assertThat(store.size()).isEqualTo(4);
        assertThat(engine.apply(batch(), KEYS, INPUT, store)).hasSize(3);
    }

    @Test
    void keysAreRequired() {
        assertThatThrownBy(() -> engine.apply(batch(), List.of(), INPUT, store()))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
