package eu.optima.listino.main;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.DriverManager;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import eu.optima.listino.SchemaMigrator;
import eu.optima.listino.dao.SupplierMappingsDao;
import eu.optima.listino.jpa.HibernateUtil;
import eu.optima.listino.tools.TableJson;

class RunReconcileTest {

    @TempDir
    Path dir;

    private Path base;

    @BeforeEach
    void writeBase() throws IOException {
        base = dir.resolve("listino.json");
        Files.writeString(base, """
                {"headers": ["codice", "codice fornitore", "Descrizione articolo", "prezzo di listino", "M"],
                 "rows": [["A1", "F1", "Vite", "1,50", "=D2*2"],
                          ["A2", "F2", "Dado", "0,80", "=D3*2"]]}
                """);
    }

    private Path supplier(String name, String json) throws IOException {
        Path p = dir.resolve(name);
        Files.writeString(p, json);
        return p;
    }

    private String mappings() {
        return "--mappings=" + dir.resolve("mappings");
    }

    @Test
    void presetRunUpdatesInsertsAndWritesOutputs() throws IOException {
        Path s = supplier("essebidue.json", """
                {"headers": ["Codice", "Cod.Fornitore", "Descrizione", "Prezzo"],
                 "rows": [["A1", "F1", "Vite", "1,60"],
                          ["A9", "F9", "Bullone", "2,00"]]}
                """);
        Path out = dir.resolve("out/listino.json");
        Path offers = dir.resolve("out/offerte.json");

        var result = RunReconcile.run(new String[] {
                "--base=" + base, "--suppliers=" + s, "--preset=Essebidue", mappings(),
                "--input-fields=Descrizione articolo|prezzo di listino",
                "--out=" + out, "--offers=" + offers });

        assertThat(result.store().size()).isEqualTo(3);
        assertThat(result.store().get(0, "prezzo di listino")).isEqualTo("1,60");
        assertThat(result.store().get(0, "M")).isEqualTo("=D2*2");
        assertThat(result.store().get(2, "codice")).isEqualTo("A9");
        assertThat(result.report().updated()).isEqualTo(1);
        assertThat(result.report().inserted()).isEqualTo(1);
        assertThat(result.offers()).hasSize(3);
        assertThat(result.offers().get(0).promoPrice()).isEqualByComparingTo("1.44");

        assertThat(TableJson.read(out).size()).isEqualTo(3);
        assertThat(TableJson.read(offers).headers()).contains("Sconto Offerta", "Prezzo Promo");
    }

    @Test
    void unconfirmedSuggestionSkipsTheSupplier() throws IOException {
        Path s = supplier("acme.json", """
                {"headers": ["COD.", "Descrizione", "Prezzo"],
                 "rows": [["A1", "Vite", "9,99"]]}
                """);

        var result = RunReconcile.run(new String[] { "--base=" + base, "--suppliers=" + s, mappings() });

        assertThat(result.report().skippedSuppliers()).isEqualTo(1);
        assertThat(result.report().unmapped()).containsKey("acme");
        assertThat(result.store().get(0, "prezzo di listino")).isEqualTo("1,50");
        assertThat(Files.exists(dir.resolve("mappings/acme/mapping.json"))).isFalse();
    }

    @Test
    void acceptedSuggestionIsSavedAndReused() throws IOException {
        Path s = supplier("acme.json", """
                {"headers": ["COD.", "Descrizione", "Prezzo"],
                 "rows": [["A1", "Vite", "2,00"]]}
                """);

        var first = RunReconcile.run(new String[] {
                "--base=" + base, "--suppliers=" + s, mappings(), "--accept-suggestions=true" });

        assertThat(first.store().get(0, "prezzo di listino")).isEqualTo("2,00");
        assertThat(Files.isRegularFile(dir.resolve("mappings/acme/mapping.json"))).isTrue();

        var second = RunReconcile.run(new String[] { "--base=" + base, "--suppliers=" + s, mappings() });

        assertThat(second.report().skippedSuppliers()).isZero();
        assertThat(second.report().updated()).isEqualTo(1);
    }

    @Test
    void databaseMappingStoreKeepsAcceptedSuggestion() throws Exception {
        String url = "jdbc:h2:mem:listino-cli;DB_CLOSE_DELAY=-1";
        try (var conn = DriverManager.getConnection(url, "sa", "")) {
            SchemaMigrator.apply(conn);
        }
        HibernateUtil.configure(url, "sa", "", "none");
        try {
            Path s = supplier("acme.json", """
                    {"headers": ["COD.", "Descrizione", "Prezzo"],
                     "rows": [["A2", "Dado", "0,85"]]}
                    """);

            var first = RunReconcile.run(new String[] {
                    "--base=" + base, "--suppliers=" + s, "--mapping-store=db", "--accept-suggestions=true" });

            assertThat(first.report().updated()).isEqualTo(1);
            assertThat(SupplierMappingsDao.find("acme").confirmed).isTrue();

            var second = RunReconcile.run(new String[] { "--base=" + base, "--suppliers=" + s, "--mapping-store=db" });

            assertThat(second.report().skippedSuppliers()).isZero();
            assertThat(second.store().get(1, "prezzo di listino")).isEqualTo("0,85");
        } finally {
            HibernateUtil.shutdown();
        }
    }

    @Test
    void offersAreSkippedWhenThePriceColumnIsMissing() {
        var result = RunReconcile.run(new String[] { "--base=" + base, mappings(), "--price-field=costo fornitore" });

        assertThat(result.offers()).isEmpty();
        assertThat(result.store().size()).isEqualTo(2);
    }

    @Test
    void badArgumentsAreRejected() {
        assertThatThrownBy(() -> RunReconcile.run(new String[] {})).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> RunReconcile.run(new String[] { "--base=" + base, "--preset=nope" }))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("nope");
        assertThatThrownBy(() -> RunReconcile.run(new String[] { "--base=" + base, "--discount=ten" }))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> RunReconcile.run(new String[] { "--base=" + base, "--mapping-store=s3" }))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("s3");
    }

    @Test
    void supplierKeyIsTheFileNameWithoutExtension() {
        assertThat(RunReconcile.supplierKey(Path.of("in", "Essebidue.v2.json"))).isEqualTo("Essebidue.v2");
        assertThat(RunReconcile.supplierKey(Path.of("acme"))).isEqualTo("acme");
    }
}
