package com.arcs.storage;

import com.arcs.config.ArcsConfig;
import com.arcs.model.LineItem;
import com.arcs.model.Quote;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.FileSystems;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.PosixFilePermissions;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.stream.Collectors;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.junit.jupiter.api.Assumptions.assumeFalse;
import static org.junit.jupiter.api.Assumptions.assumeTrue;

class QuoteDatabaseTest {

    private static final Instant NOW = Instant.parse("2025-03-04T09:15:30Z");

    @TempDir
    Path dir;

    private ArcsConfig config;
    private Clock clock;

    @BeforeEach
    void setUp() {
        config = ArcsConfig.load()
                           .withDataDir(dir.resolve("user"))
                           .withBundledQuotesFile(dir.resolve("bundled/quotes.json"));
        clock = Clock.fixed(NOW, ZoneOffset.UTC);
    }

    private QuoteDatabase open() {
        return new QuoteDatabase(config, new QuoteStore(config.quotesFile()), clock).open();
    }

    @Test
    void opens_empty_with_warning_when_no_file_exists() {
        var db = open();

        assertThat(db.quotes()).isEmpty();
        assertThat(db.loadWarning()).hasValueSatisfying(w -> assertThat(w).contains("No quote file"));
    }

    @Test
    void new_quote_gets_unique_ids_and_default_name() {
        var db = open();

        var first = db.newQuote();
        var second = db.newQuote();

        assertThat(first.id()).isEqualTo(Long.toString(NOW.getEpochSecond()));
        assertThat(second.id()).isNotEqualTo(first.id());
        assertThat(first.name()).isEqualTo("ARCS 2025-03-04");
        assertThat(first.createdAt().toInstant()).isEqualTo(NOW);
        assertThat(db.size()).isZero();
    }

    @Test
    void save_persists_and_normalizes_name() throws Exception {
        var db = open();
        var q = db.newQuote();
        q.setPoNumber("PO-42");
        q.addItem(LineItem.of("A-1", "Bracket", 2, 3.5, 5.0, "Acme"));

        db.save(q);

        assertThat(q.name()).isEqualTo("ARCS 2025-03-04 [PO:PO-42]");
        var reopened = open();
        assertThat(reopened.loadWarning()).isEmpty();
        assertThat(reopened.quotes()).containsExactly(q);
    }

    @Test
    void save_replaces_existing_quote_in_place() throws Exception {
        var db = open();
        var a = db.newQuote();
        var b = db.newQuote();
        var c = db.newQuote();
        db.save(a);
        db.save(b);
        db.save(c);

        var edited = db.require(b.id());
        edited.setNotes("rush order");
        db.save(edited);

        assertThat(open().quotes()).extracting(Quote::id).containsExactly(a.id(), b.id(), c.id());
        assertThat(open().require(b.id()).notes()).isEqualTo("rush order");
    }

    @Test
    void edits_to_returned_quotes_do_not_leak_without_save() throws Exception {
        var db = open();
        var q = db.newQuote();
        db.save(q);

        db.require(q.id()).setNotes("not saved");

        assertThat(db.require(q.id()).notes()).isEmpty();
    }

    @Test
    void delete_removes_exactly_one_and_keeps_order() throws Exception {
        var db = open();
        var ids = new java.util.ArrayList<String>();
        for (int i = 0; i < 4; i++) {
            var q = db.newQuote();
            db.save(q);
            ids.add(q.id());
        }

        assertThat(db.delete(ids.get(1))).isTrue();
        assertThat(db.delete("no-such-id")).isFalse();

        var expected = List.of(ids.get(0), ids.get(2), ids.get(3));
        assertThat(db.quotes()).extracting(Quote::id).containsExactlyElementsOf(expected);
        assertThat(open().quotes()).extracting(Quote::id).containsExactlyElementsOf(expected);
    }

    @Test
    void require_reports_missing_quote() {
        var db = open();

        assertThatThrownBy(() -> db.require("404"))
                .isInstanceOf(QuoteNotFoundException.class)
                .hasMessageContaining("404");
    }

    @Test
    void falls_back_to_bundled_quotes_when_user_has_none() throws Exception {
        var bundled = new QuoteStore(config.bundledQuotesFile());
        bundled.save(List.of(QuoteStoreTest.sampleQuote("10")));

        var db = open();

        assertThat(db.loadWarning()).isEmpty();
        assertThat(db.quotes()).extracting(Quote::id).containsExactly("10");
    }

    @Test
    void user_file_wins_over_bundled() throws Exception {
        new QuoteStore(config.bundledQuotesFile()).save(List.of(QuoteStoreTest.sampleQuote("10")));
        new QuoteStore(config.quotesFile()).save(List.of(QuoteStoreTest.sampleQuote("20")));

        assertThat(open().quotes()).extracting(Quote::id).containsExactly("20");
    }

    @Test
    void unreadable_file_starts_empty_and_is_kept_aside() throws Exception {
        Files.createDirectories(config.dataDir());
        Files.writeString(config.quotesFile(), "{ not json");

        var db = open();

        assertThat(db.quotes()).isEmpty();
        assertThat(db.loadWarning()).hasValueSatisfying(w -> assertThat(w).contains("Malformed JSON"));
        assertThat(config.dataDir().resolve("quotes.json.unreadable")).hasContent("{ not json");
    }

    @Test
    void duplicate_and_missing_ids_are_repaired_on_open() throws Exception {
        Files.createDirectories(config.dataDir());
        Files.writeString(config.quotesFile(),
                "[{\"id\": \"7\", \"items\": []}, {\"id\": \"7\", \"items\": []}, {\"items\": []}]");

        var ids = open().quotes().stream().map(Quote::id).collect(Collectors.toList());

        assertThat(ids).hasSize(3).doesNotHaveDuplicates().doesNotContainNull();
        assertThat(ids.get(0)).isEqualTo("7");
    }

    @Test
    void repaired_id_never_takes_a_valid_id_from_later_in_the_file() throws Exception {
        var clockId = Long.toString(NOW.getEpochSecond());
        Files.createDirectories(config.dataDir());
        Files.writeString(config.quotesFile(),
                "[{\"name\": \"no id\", \"items\": []}, {\"id\": \"" + clockId + "\", \"name\": \"kept\", \"items\": []}]");

        var quotes = open().quotes();

        assertThat(quotes.get(1).id()).isEqualTo(clockId);
        assertThat(quotes.get(0).id()).isNotEqualTo(clockId).isNotBlank();
    }

    @Test
    void save_keeps_supplier_terms_and_tax_exempt_rows() throws Exception {
        var db = open();
        var q = db.newQuote();
        q.addItem(LineItem.of("A-1", "Bracket", 2, 3.5, 5.0, "Acme"));
        q.setTaxExempt("Acme", true);

        db.save(q);

        var reloaded = open().require(q.id());
        assertThat(reloaded.suppliers()).containsKey("Acme");
        assertThat(reloaded.items().get(0).taxExempt()).isTrue();
        assertThat(Files.readString(config.quotesFile())).contains("\"tax_exempt\" : true");
    }

    @Test
    void exported_quote_imports_as_equal_quote() throws Exception {
        var source = open();
        var q = source.newQuote();
        q.addItem(LineItem.of("A-1", "Bracket", 2, 3.5, 5.0, "Acme"));
        q.setNotes("line one\nline two");
        source.save(q);
        var file = dir.resolve("transfer/quote.json");
        source.exportQuote(q.id(), file);

        config = config.withDataDir(dir.resolve("other-user"));
        var target = open();
        var imported = target.importQuote(file);

        assertThat(imported).isEqualTo(q);
        assertThat(open().quotes()).containsExactly(q);
    }

    @Test
    void import_with_clashing_id_gets_fresh_id() throws Exception {
        var db = open();
        var q = db.newQuote();
        db.save(q);
        var file = dir.resolve("quote.json");
        db.exportQuote(q.id(), file);

        var imported = db.importQuote(file);

        assertThat(imported.id()).isNotEqualTo(q.id());
        assertThat(db.quotes()).extracting(Quote::id).containsExactly(q.id(), imported.id());
    }

    @Test
    void export_of_unknown_quote_fails() {
        var db = open();

        assertThatThrownBy(() -> db.exportQuote("nope", dir.resolve("x.json")))
                .isInstanceOf(QuoteNotFoundException.class);
    }

    @Test
    void failed_save_keeps_memory_unchanged_and_leaves_no_temp_file() throws Exception {
        var db = open();
        var q = db.newQuote();
        db.save(q);

        // a directory where the temp file would be renamed to makes the move fail
        Files.delete(config.quotesFile());
        Files.createDirectories(config.quotesFile().resolve("blocker"));

        var other = db.newQuote();
        assertThatThrownBy(() -> db.save(other)).isInstanceOf(QuoteStorageException.class);
        assertThat(db.quotes()).extracting(Quote::id).containsExactly(q.id());
        try (var files = Files.list(config.dataDir())) {
            assertThat(files).containsExactly(config.quotesFile());
        }
    }

    @Test
    void failed_save_leaves_previous_file_untouched() throws Exception {
        assumeTrue(FileSystems.getDefault().supportedFileAttributeViews().contains("posix"));
        var db = open();
        var q = db.newQuote();
        db.save(q);
        var before = Files.readString(config.quotesFile());

        Files.setPosixFilePermissions(config.dataDir(), PosixFilePermissions.fromString("r-xr-xr-x"));
        try {
            // root ignores directory permissions
            assumeFalse(Files.isWritable(config.dataDir()));

            q.setNotes("never written");
            assertThatThrownBy(() -> db.save(q)).isInstanceOf(QuoteStorageException.class);

            assertThat(Files.readString(config.quotesFile())).isEqualTo(before);
            assertThat(db.require(q.id()).notes()).isEmpty();
        } finally {
            Files.setPosixFilePermissions(config.dataDir(), PosixFilePermissions.fromString("rwxr-xr-x"));
        }
    }
}
