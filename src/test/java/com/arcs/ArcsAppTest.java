package com.arcs;

import com.arcs.config.ArcsConfig;
import com.arcs.storage.QuoteStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;

class ArcsAppTest {

    @TempDir
    Path dir;

    private ArcsConfig config;
    private StringWriter out;
    private StringWriter err;

    @BeforeEach
    void setUp() {
        config = ArcsConfig.load()
                           .withDataDir(dir.resolve("data"))
                           .withBundledQuotesFile(dir.resolve("missing/quotes.json"));
    }

    private int run(String... args) {
        out = new StringWriter();
        err = new StringWriter();
        var cmd = ArcsApp.commandLine(new ArcsApp(config));
        cmd.setOut(new PrintWriter(out, true));
        cmd.setErr(new PrintWriter(err, true));
        return cmd.execute(args);
    }

    private String newQuote(String... options) {
        String[] args = new String[options.length + 1];
        args[0] = "new";
        System.arraycopy(options, 0, args, 1, options.length);
        assertThat(run(args)).isZero();
        return out.toString().trim();
    }

    @Test
    void new_quote_is_saved_and_listed() {
        var id = newQuote("--po", "PO-1");

        assertThat(run("list")).isZero();
        assertThat(out.toString()).contains(id, "[PO:PO-1]", "0 items", "$0.00");
    }

    @Test
    void first_run_warns_about_missing_file_but_succeeds() {
        assertThat(run("list")).isZero();

        assertThat(err.toString()).contains("Warning:", "No quote file");
        assertThat(out.toString()).contains("No saved quotes found.");
    }

    @Test
    void items_can_be_added_edited_and_removed() {
        var id = newQuote();

        assertThat(run("add-item", id, "--part", "A-1", "--desc", "Bracket", "--qty", "2",
                "--unit-cost", "3.50", "--list-price", "5.00", "--source", "Acme")).isZero();
        assertThat(run("add-item", id, "--part", "B-7", "--qty", "4", "--list-price", "2.25")).isZero();
        assertThat(run("edit-item", id, "1", "--qty", "3")).isZero();

        assertThat(run("show", id)).isZero();
        assertThat(out.toString()).contains("Bracket", "Total:  $24.00", "Cost:   $10.50", "Margin: $13.50");

        assertThat(run("remove-item", id, "2")).isZero();
        assertThat(run("show", id)).isZero();
        assertThat(out.toString()).contains("Total:  $15.00").doesNotContain("B-7");
    }

    @Test
    void invalid_input_is_reported_and_nothing_changes() throws Exception {
        var id = newQuote();

        assertThat(run("add-item", id, "--part", "A-1", "--qty", "-2")).isEqualTo(1);
        assertThat(err.toString()).contains("Error:", "Quantity");

        assertThat(run("remove-item", id, "1")).isEqualTo(1);
        assertThat(err.toString()).contains("No line item at position 1");

        var saved = new QuoteStore(config.quotesFile()).load();
        assertThat(saved).hasSize(1);
        assertThat(saved.get(0).items()).isEmpty();
    }

    @Test
    void suppliers_command_marks_rows_tax_exempt() throws Exception {
        var id = newQuote();
        run("add-item", id, "--part", "A-1", "--qty", "2", "--list-price", "5", "--source", "Acme");
        run("add-item", id, "--part", "B-7", "--qty", "1", "--list-price", "3", "--source", "Bolt Co");

        assertThat(run("suppliers", id, "--exempt", "Acme")).isZero();
        assertThat(out.toString()).contains("Acme", "Tax Exempt", "Bolt Co", "Taxable");

        assertThat(run("show", id)).isZero();
        assertThat(out.toString()).contains("Acme (Tax Exempt)", "Total:  $13.00");

        // rows added later pick up the supplier's status
        run("add-item", id, "--part", "A-2", "--source", "Acme");
        var saved = new QuoteStore(config.quotesFile()).load().get(0);
        assertThat(saved.items()).extracting(i -> i.taxExempt()).containsExactly(true, false, true);

        assertThat(run("suppliers", id, "--taxable", "Acme")).isZero();
        saved = new QuoteStore(config.quotesFile()).load().get(0);
        assertThat(saved.items()).noneMatch(i -> i.taxExempt());
    }

    @Test
    void margin_percent_shows_na_when_nothing_is_charged() {
        var id = newQuote();
        run("add-item", id, "--part", "F-1", "--qty", "1", "--unit-cost", "4", "--list-price", "0");

        assertThat(run("show", id)).isZero();

        assertThat(out.toString()).contains("Margin: $-4.00 (N/A)");
    }

    @Test
    void unknown_quote_is_an_error() {
        assertThat(run("show", "nope")).isEqualTo(1);
        assertThat(err.toString()).contains("No quote with id nope");

        assertThat(run("delete", "nope")).isEqualTo(1);
    }

    @Test
    void update_and_delete() throws Exception {
        var keep = newQuote();
        var gone = newQuote();

        assertThat(run("update", keep, "--po", "PO-77", "--notes", "call first")).isZero();
        assertThat(out.toString()).contains("[PO:PO-77]");
        assertThat(run("delete", gone)).isZero();

        var saved = new QuoteStore(config.quotesFile()).load();
        assertThat(saved).hasSize(1);
        assertThat(saved.get(0).id()).isEqualTo(keep);
        assertThat(saved.get(0).notes()).isEqualTo("call first");
    }

    @Test
    void export_writes_pdf() {
        var id = newQuote();
        var target = dir.resolve("exports/quote.pdf");

        assertThat(run("export", id, target.toString())).isZero();

        assertThat(out.toString()).contains("Quote exported to " + target);
        assertThat(target).exists().isNotEmptyFile();
    }

    @Test
    void default_export_file_is_named_after_the_quote() throws Exception {
        var id = newQuote("--po", "PO 7/B");
        var quote = new QuoteStore(config.quotesFile()).load().get(0);

        assertThat(quote.id()).isEqualTo(id);
        assertThat(ArcsApp.suggestedFile(quote, "pdf").toString())
                .startsWith("ARCS_")
                .endsWith("__PO_PO_7_B_.pdf");
    }

    @Test
    void json_export_then_import_adds_a_copy() throws Exception {
        var id = newQuote("--po", "PO-3");
        var file = dir.resolve("quote.json");

        assertThat(run("export-json", id, file.toString())).isZero();
        assertThat(run("import", file.toString())).isZero();
        assertThat(out.toString()).contains("Imported quote 'ARCS ", "[PO:PO-3]'");

        assertThat(new QuoteStore(config.quotesFile()).load()).hasSize(2);
    }

    @Test
    void import_of_non_quote_file_fails() throws Exception {
        var file = dir.resolve("bad.json");
        Files.writeString(file, "{\"hello\": 1}");

        assertThat(run("import", file.toString())).isEqualTo(1);
        assertThat(err.toString()).contains("does not appear to be a valid quote JSON");
    }

    @Test
    void purchase_list_prints_table_and_json() {
        var id = newQuote("--po", "PO-9");
        run("add-item", id, "--part", "A-1", "--qty", "2", "--unit-cost", "1", "--list-price", "2", "--source", "Acme");
        run("add-item", id, "--part", "A-1", "--qty", "3", "--unit-cost", "0.5", "--list-price", "2", "--source", "Acme");

        assertThat(run("purchase-list")).isZero();
        assertThat(out.toString()).contains("[PO: PO-9]", "A-1           5             Acme          0.50");

        assertThat(run("purchase-list", "--json")).isZero();
        assertThat(out.toString()).contains("\"part_number\": \"A-1\"", "\"po\": \"PO-9\"");
    }

    @Test
    void purchase_list_with_missing_file_exits_2() {
        assertThat(run("purchase-list", "--file", dir.resolve("nope.json").toString())).isEqualTo(2);
        assertThat(err.toString()).contains("not found");

        assertThat(run("purchase-list")).isEqualTo(2);
        assertThat(err.toString()).contains("No quotes file found");
    }

    @Test
    void data_dir_option_overrides_configuration() {
        var other = dir.resolve("elsewhere");

        assertThat(run("--data-dir", other.toString(), "new")).isZero();

        assertThat(other.resolve("quotes.json")).exists();
        assertThat(config.quotesFile()).doesNotExist();
    }

    @Test
    void no_command_prints_usage() {
        assertThat(run()).isZero();
        assertThat(out.toString()).contains("Usage: arcs", "purchase-list");
    }
}
