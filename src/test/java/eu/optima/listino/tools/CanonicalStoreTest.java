package eu.optima.listino.tools;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.Arrays;
import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.Test;

import eu.optima.listino.model.RawTable;

class CanonicalStoreTest {

    static CanonicalStore sample() {
        var table = new RawTable(List.of("codice ", "Descrizione articolo", "prezzo di listino", "M"),
                List.of(
                        Arrays.asList("A1", "Vite", "1,50", "=J2*2"),
                        Arrays.asList("A2", "Dado", "0,80", "=J3*2"),
                        Arrays.asList("A1", "Vite bis", "1,55", null),
                        Arrays.asList(null, "Senza codice", "9", null)));
        return CanonicalStore.fromTable(table);
    }

    @Test
    void headersAreTrimmedIntoFieldNames() {
        var store = sample();

        assertThat(store.fields()).containsExactly("codice", "Descrizione articolo", "prezzo di listino", "M");
        assertThat(store.size()).isEqualTo(4);
        assertThat(store.get(1, "Descrizione articolo")).isEqualTo("Dado");
    }

    @Test
    void findReturnsAllRowsInStoreOrder() {
        var store = sample();

        assertThat(store.find("codice", "A1")).containsExactly(0, 2);
        assertThat(store.find("codice", " A2 ")).containsExactly(1);
        assertThat(store.find("codice", "a2")).isEmpty();
    }

    @Test
    void blankValuesAreNeverFound() {
        var store = sample();

        assertThat(store.find("codice", "")).isEmpty();
        assertThat(store.find("codice", "   ")).isEmpty();
        assertThat(store.find("codice", null)).isEmpty();
        assertThat(store.find("Codice EAN", "A1")).isEmpty();
    }

    @Test
    void indexFollowsWritesAndAppends() {
        var store = sample();
        assertThat(store.find("codice", "A1")).containsExactly(0, 2);

        store.set(2, "codice", "A3");
        int added = store.append(Map.of("codice", "A1", "Descrizione articolo", "Vite ter"));

        assertThat(added).isEqualTo(4);
        assertThat(store.find("codice", "A1")).containsExactly(0, 4);
        assertThat(store.find("codice", "A3")).containsExactly(2);
        assertThat(store.get(4, "prezzo di listino")).isNull();
    }

    @Test
    void recordIsDetachedFromTheStore() {
        var store = sample();

        var rec = store.record(0);
        rec.put("codice", "Z9");

        assertThat(store.get(0, "codice")).isEqualTo("A1");
        assertThat(store.find("codice", "Z9")).isEmpty();
    }

    @Test
    void unknownFieldsAndRowsAreRejected() {
        var store = sample();

        assertThatThrownBy(() -> store.get(0, "marca")).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> store.set(0, "marca", "x")).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> store.append(Map.of("marca", "x"))).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> store.get(4, "codice")).isInstanceOf(IndexOutOfBoundsException.class);
        assertThatThrownBy(() -> new CanonicalStore(List.of("a", "a"))).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void copyIsIndependent() {
        var store = sample();
        var copy = store.copy();

        copy.set(0, "prezzo di listino", "2,00");
        copy.append(Map.of("codice", "NEW"));

        assertThat(store.get(0, "prezzo di listino")).isEqualTo("1,50");
        assertThat(store.size()).isEqualTo(4);
        assertThat(copy.find("codice", "NEW")).containsExactly(4);
    }

    @Test
    void toTabularKeepsFieldOrderAndNulls() {
        var data = sample().toTabular();

        assertThat(data.fields()).containsExactly("codice", "Descrizione articolo", "prezzo di listino", "M");
        assertThat(data.rows()).hasSize(4);
        assertThat(data.rows().get(3)).containsExactly(null, "Senza codice", "9", null);
    }

    @Test
    void onlyOneWriterAtATime() {
        var store = sample();

        try (var writer = store.acquireWriter()) {
            assertThatThrownBy(store::acquireWriter)
                    .isInstanceOf(IllegalStateException.class)
                    .hasMessageContaining("sequentially");
        }
        try (var again = store.acquireWriter()) {
            assertThat(again).isNotNull();
        }
    }
}
