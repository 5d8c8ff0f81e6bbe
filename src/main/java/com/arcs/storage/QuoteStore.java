package com.arcs.storage;

import com.arcs.model.Quote;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectReader;
import com.fasterxml.jackson.databind.ObjectWriter;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.attribute.PosixFileAttributeView;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * Reads and writes quotes.json, and single-quote transfer files.
 *
 * <p>File shape (quotes.json):
 * <pre>
 * [
 *   {
 *     "id": "1734518400",
 *     "name": "ARCS 2024-12-18 [PO:PO-999]",
 *     "po_number": "PO-999",
 *     "notes": "",
 *     "created_at": "2024-12-18T10:40:00Z",
 *     "modified_at": "2024-12-18T10:45:00Z",
 *     "suppliers": { "Acme": { "tax_exempt": true } },
 *     "items": [
 *       { "part_number": "A-1", "description": "Bracket", "quantity": 2,
 *         "unit_cost": 3.5, "list_price": 5.0, "source": "Acme", "tax_exempt": true, "line_total": 10.0 }
 *     ]
 *   }
 * ]
 * </pre>
 * {@code line_total} is written for people reading the file and ignored on the way back in.
 * The older {@code {"quotes": [...]}} wrapper is still accepted on read.
 */
public class QuoteStore {

    private static final Logger log = LoggerFactory.getLogger(QuoteStore.class);

    private static final TypeReference<List<Quote>> QUOTE_LIST = new TypeReference<>() {
    };

    private static final ObjectMapper mapper = new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .enable(SerializationFeature.INDENT_OUTPUT)
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
            .disable(DeserializationFeature.ADJUST_DATES_TO_CONTEXT_TIME_ZONE)
            // "[...]garbage" or two documents back to back is a broken file, not the first document
            .enable(DeserializationFeature.FAIL_ON_TRAILING_TOKENS)
            // quantity 2.9 must not quietly become 2
            .disable(DeserializationFeature.ACCEPT_FLOAT_AS_INT);

    private static final ObjectReader listReader = mapper.readerFor(QUOTE_LIST);
    private static final ObjectWriter listWriter = mapper.writerFor(QUOTE_LIST);

    private final Path file;

    public QuoteStore(Path file) {
        this.file = file;
    }

    public Path file() {
        return file;
    }

    public boolean exists() {
        return Files.isRegularFile(file);
    }

    // ---- Load from disk ----

    /**
     * Reads every saved quote, in file order.
     *
     * @throws QuoteParseException if the file is missing or isn't a quote document
     */
    public List<Quote> load() throws QuoteParseException {
        String json = readText(file);
        if (json.isBlank()) {
            // freshly created, nothing saved yet
            return new ArrayList<>();
        }

        JsonNode root;
        try {
            root = mapper.readTree(json);
        } catch (JsonProcessingException e) {
            throw new QuoteParseException("Malformed JSON in " + file + ": " + e.getOriginalMessage(), e);
        }

        JsonNode array = root;
        if (root.isObject() && root.has("quotes")) {
            array = root.get("quotes");
        }
        if (!array.isArray()) {
            throw new QuoteParseException(file + " does not contain a list of quotes");
        }

        List<Quote> quotes;
        try {
            quotes = listReader.readValue(array);
        } catch (IOException e) {
            throw new QuoteParseException("Invalid quote data in " + file + ": " + e.getMessage(), e);
        }
        if (quotes.contains(null)) {
            throw new QuoteParseException(file + " contains an empty quote entry");
        }
        log.debug("Loaded {} quotes from {}", quotes.size(), file);
        return quotes;
    }

    // ---- Save to disk ----

    /**
     * Replaces the whole file with {@code quotes}. The new content goes to a temp
     * file in the same directory first and is then moved over the old one, so a
     * failure leaves the previous file untouched.
     */
    public void save(List<Quote> quotes) throws QuoteStorageException {
        writeAtomically(file, listWriter, quotes);
        log.debug("Saved {} quotes to {}", quotes.size(), file);
    }

    // ---- Single-quote transfer files ----

    public void writeQuote(Quote quote, Path target) throws QuoteStorageException {
        writeAtomically(target, mapper.writerFor(Quote.class), quote);
        log.info("Exported quote id={} to {}", quote.id(), target);
    }

    /**
     * Reads a file written by {@link #writeQuote}.
     *
     * @throws QuoteParseException if the file isn't a JSON object with an {@code items} field
     */
    public Quote readQuote(Path source) throws QuoteParseException {
        String json = readText(source);
        JsonNode root;
        try {
            root = mapper.readTree(json);
        } catch (JsonProcessingException e) {
            throw new QuoteParseException("Malformed JSON in " + source + ": " + e.getOriginalMessage(), e);
        }
        if (root == null || !root.isObject() || !root.has("items")) {
            throw new QuoteParseException(source + " does not appear to be a valid quote JSON");
        }
        try {
            return mapper.treeToValue(root, Quote.class);
        } catch (JsonProcessingException e) {
            throw new QuoteParseException("Invalid quote data in " + source + ": " + e.getOriginalMessage(), e);
        }
    }

    // ---- Helpers ----

    private static String readText(Path path) throws QuoteParseException {
        try {
            return Files.readString(path, StandardCharsets.UTF_8);
        } catch (NoSuchFileException e) {
            throw new QuoteParseException("No quote file at " + path, e);
        } catch (IOException e) {
            throw new QuoteParseException("Couldn't read " + path + ": " + e.getMessage(), e);
        }
    }

    private static void writeAtomically(Path target, ObjectWriter writer, Object value) throws QuoteStorageException {
        Path dir = target.toAbsolutePath().getParent();
        Path tmp = null;
        try {
            Files.createDirectories(dir);
            // not createTempFile: its owner-only permissions would carry over to the target
            tmp = Files.createFile(dir.resolve("." + target.getFileName() + "." + UUID.randomUUID() + ".tmp"));
            keepPermissions(target, tmp);
            writer.writeValue(tmp.toFile(), value);
            try {
                Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING);
            }
        } catch (IOException e) {
            throw new QuoteStorageException("Couldn't write " + target + ": " + e.getMessage(), e);
        } finally {
            if (tmp != null) {
                deleteQuietly(tmp);
            }
        }
    }

    private static void keepPermissions(Path target, Path tmp) throws IOException {
        if (Files.exists(target)
                && Files.getFileStore(tmp).supportsFileAttributeView(PosixFileAttributeView.class)) {
            Files.setPosixFilePermissions(tmp, Files.getPosixFilePermissions(target));
        }
    }

    private static void deleteQuietly(Path tmp) {
        try {
            Files.deleteIfExists(tmp);
        } catch (IOException e) {
            log.warn("Couldn't remove temp file {}", tmp, e);
        }
    }
}
