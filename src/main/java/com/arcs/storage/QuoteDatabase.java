package com.arcs.storage;

import com.arcs.config.ArcsConfig;
import com.arcs.model.Quote;
import com.arcs.model.QuoteNames;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Clock;
import java.time.OffsetDateTime;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * All quotes known to the application, held in memory.
 *
 * <p>Loaded once by {@link #open()} and written back whole through the
 * {@link QuoteStore} after every save, delete and import.
 */
public class QuoteDatabase {

    private static final Logger log = LoggerFactory.getLogger(QuoteDatabase.class);

    private final ArcsConfig config;
    private final QuoteStore store;
    private final Clock clock;

    private List<Quote> quotes = new ArrayList<>();
    private final Set<String> issuedIds = new HashSet<>();   // handed out by newQuote(), maybe not saved yet
    private String loadWarning;

    public QuoteDatabase(ArcsConfig config) {
        this(config, new QuoteStore(config.quotesFile()), Clock.systemUTC());
    }

    public QuoteDatabase(ArcsConfig config, QuoteStore store, Clock clock) {
        this.config = config;
        this.store = store;
        this.clock = clock;
    }

    // ---- Load from disk ----

    /**
     * Loads the user's quote file, or the bundled one when the user has none yet.
     * A file that can't be read leaves the database empty; the reason is kept in
     * {@link #loadWarning()} and the unreadable file is copied aside so the next
     * save doesn't destroy it.
     */
    public QuoteDatabase open() {
        loadWarning = null;
        try {
            if (store.exists() || !Files.isRegularFile(config.bundledQuotesFile())) {
                quotes = store.load();
            } else {
                log.debug("No user quotes at {}, using bundled {}", store.file(), config.bundledQuotesFile());
                quotes = new QuoteStore(config.bundledQuotesFile()).load();
            }
        } catch (QuoteParseException e) {
            quotes = new ArrayList<>();
            loadWarning = e.getMessage();
            if (store.exists()) {
                loadWarning = loadWarning + " (kept a copy at " + backUpUnreadable() + ")";
            }
            log.warn("Starting with an empty quote list: {}", loadWarning);
        }
        repairIds();
        return this;
    }

    public Optional<String> loadWarning() {
        return Optional.ofNullable(loadWarning);
    }

    // quotes from hand-edited or merged files may lack an id or share one.
    // Fresh ids avoid every id in the file, including valid ones further down.
    private void repairIds() {
        Set<String> taken = new HashSet<>();
        for (Quote q : quotes) {
            if (q.id() != null && !q.id().isBlank()) {
                taken.add(q.id());
            }
        }
        Set<String> seen = new HashSet<>();
        for (Quote q : quotes) {
            if (q.id() == null || q.id().isBlank() || !seen.add(q.id())) {
                String old = q.id();
                q.assignId(nextId(taken));
                taken.add(q.id());
                seen.add(q.id());
                log.warn("Quote '{}' had missing or duplicate id '{}', now {}", q.name(), old, q.id());
            }
        }
    }

    private Path backUpUnreadable() {
        Path backup = store.file().resolveSibling(store.file().getFileName() + ".unreadable");
        try {
            Files.copy(store.file(), backup, StandardCopyOption.REPLACE_EXISTING);
        } catch (IOException e) {
            log.error("Couldn't back up unreadable {}", store.file(), e);
        }
        return backup;
    }

    // ---- Queries ----

    // Callers get copies; edits only count once they go through save().

    public List<Quote> quotes() {
        List<Quote> copies = new ArrayList<>(quotes.size());
        for (Quote q : quotes) {
            copies.add(q.copy());
        }
        return Collections.unmodifiableList(copies);
    }

    public Optional<Quote> find(String id) {
        int index = indexOf(id);
        return index < 0 ? Optional.empty() : Optional.of(quotes.get(index).copy());
    }

    /** Like {@link #find} but a missing quote is an error. */
    public Quote require(String id) throws QuoteNotFoundException {
        return find(id).orElseThrow(() -> new QuoteNotFoundException(id));
    }

    public int size() {
        return quotes.size();
    }

    // ---- Editing ----

    /** A fresh, unsaved quote with a unique id and today's default name. */
    public Quote newQuote() {
        OffsetDateTime now = now();
        Set<String> taken = ids();
        taken.addAll(issuedIds);
        Quote q = new Quote(nextId(taken), QuoteNames.defaultName(config.appName(), now), now);
        issuedIds.add(q.id());
        log.debug("Created quote id={}", q.id());
        return q;
    }

    /**
     * Stamps, names and stores {@code quote}, replacing any saved quote with the
     * same id in place. The database keeps its own copy.
     */
    public void save(Quote quote) throws QuoteStorageException {
        Quote copy = quote.copy();
        copy.setModifiedAt(now());
        copy.setName(QuoteNames.normalizedName(config.appName(), copy));

        List<Quote> updated = new ArrayList<>(quotes);
        int index = indexOf(copy.id());
        if (index >= 0) {
            updated.set(index, copy);
        } else {
            updated.add(copy);
        }
        flush(updated);

        quote.setModifiedAt(copy.modifiedAt());
        quote.setName(copy.name());
        log.info("Saved quote id={} name={}", copy.id(), copy.name());
    }

    /**
     * Permanently removes the quote with {@code id}.
     * @return true if we actually deleted it, false if it wasn't there.
     */
    public boolean delete(String id) throws QuoteStorageException {
        int index = indexOf(id);
        if (index < 0) {
            return false;
        }
        List<Quote> updated = new ArrayList<>(quotes);
        Quote removed = updated.remove(index);
        flush(updated);
        log.info("Deleted quote id={} name={}", removed.id(), removed.name());
        return true;
    }

    // ---- Transfer files ----

    public void exportQuote(String id, Path target) throws QuoteNotFoundException, QuoteStorageException {
        int index = indexOf(id);
        if (index < 0) {
            throw new QuoteNotFoundException(id);
        }
        store.writeQuote(quotes.get(index), target);
    }

    /**
     * Adds the quote in {@code source} to the database. A clashing id is
     * replaced by a fresh one; the name is normalized.
     *
     * @return the quote as stored
     */
    public Quote importQuote(Path source) throws QuoteParseException, QuoteStorageException {
        Quote q = store.readQuote(source);
        Set<String> ids = ids();
        ids.addAll(issuedIds);
        if (q.id() == null || q.id().isBlank() || ids.contains(q.id())) {
            q.assignId(nextId(ids));
        }
        q.setName(QuoteNames.normalizedName(config.appName(), q));

        List<Quote> updated = new ArrayList<>(quotes);
        updated.add(q);
        flush(updated);
        log.info("Imported quote id={} from {}", q.id(), source);
        return q.copy();
    }

    // ---- Helpers ----

    // in-memory state only changes once the file write went through
    private void flush(List<Quote> updated) throws QuoteStorageException {
        store.save(updated);
        quotes = updated;
    }

    private int indexOf(String id) {
        for (int i = 0; i < quotes.size(); i++) {
            if (quotes.get(i).id().equals(id)) {
                return i;
            }
        }
        return -1;
    }

    private Set<String> ids() {
        Set<String> ids = new HashSet<>();
        for (Quote q : quotes) {
            ids.add(q.id());
        }
        return ids;
    }

    // epoch seconds, bumped until unused
    private String nextId(Set<String> taken) {
        long candidate = clock.instant().getEpochSecond();
        while (taken.contains(Long.toString(candidate))) {
            candidate++;
        }
        return Long.toString(candidate);
    }

    private OffsetDateTime now() {
        return OffsetDateTime.now(clock).truncatedTo(ChronoUnit.SECONDS);
    }
}
