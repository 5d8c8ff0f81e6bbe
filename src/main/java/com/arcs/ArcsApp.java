package com.arcs;

import com.arcs.config.ArcsConfig;
import com.arcs.export.Exporters;
import com.arcs.export.QuoteExporter;
import com.arcs.model.LineItem;
import com.arcs.model.Quote;
import com.arcs.model.QuoteNames;
import com.arcs.purchasing.PurchaseList;
import com.arcs.purchasing.PurchaseListReport;
import com.arcs.storage.QuoteDatabase;
import com.arcs.storage.QuoteParseException;
import com.arcs.storage.QuoteStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.ParentCommand;
import picocli.CommandLine.Spec;

import java.io.PrintWriter;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.OptionalDouble;
import java.util.TreeMap;
import java.util.concurrent.Callable;

/**
 * ARCS quote manager command line.
 *
 * <p>Usage examples:
 * <pre>
 * arcs new --po PO-999
 * arcs add-item 1734518400 --part A-1 --desc Bracket --qty 2 --unit-cost 3.50 --list-price 5.00 --source Acme
 * arcs show 1734518400
 * arcs export 1734518400 ~/Desktop/quote.pdf
 * arcs purchase-list --json
 * </pre>
 */
@Command(name = "arcs",
         mixinStandardHelpOptions = true,
         versionProvider = ArcsApp.VersionProvider.class,
         description = "Create, manage and export sales quotes",
         subcommands = {
                 ArcsApp.ListCommand.class,
                 ArcsApp.ShowCommand.class,
                 ArcsApp.NewCommand.class,
                 ArcsApp.UpdateCommand.class,
                 ArcsApp.AddItemCommand.class,
                 ArcsApp.EditItemCommand.class,
                 ArcsApp.RemoveItemCommand.class,
                 ArcsApp.SuppliersCommand.class,
                 ArcsApp.DeleteCommand.class,
                 ArcsApp.ExportCommand.class,
                 ArcsApp.ExportJsonCommand.class,
                 ArcsApp.ImportCommand.class,
                 ArcsApp.PurchaseListCommand.class
         })
public class ArcsApp implements Runnable {

    private static final Logger log = LoggerFactory.getLogger(ArcsApp.class);

    @Option(names = {"-d", "--data-dir"},
            description = "Directory holding quotes.json (default: ~/.arcsoftware or $ARCS_DATA_DIR)")
    private Path dataDir;

    @Spec
    private CommandSpec spec;

    private final ArcsConfig baseConfig;
    private QuoteDatabase database;

    public ArcsApp() {
        this(ArcsConfig.load());
    }

    ArcsApp(ArcsConfig baseConfig) {
        this.baseConfig = baseConfig;
    }

    public static void main(String[] args) {
        System.exit(commandLine(new ArcsApp()).execute(args));
    }

    static CommandLine commandLine(ArcsApp app) {
        CommandLine cmd = new CommandLine(app);
        cmd.setExecutionExceptionHandler((ex, commandLine, parseResult) -> {
            if (ex instanceof ArcsException) {
                log.debug("Command failed", ex);
                commandLine.getErr().println("Error: " + ex.getMessage());
                return 1;
            }
            throw ex;
        });
        return cmd;
    }

    @Override
    public void run() {
        // no subcommand: show help
        spec.commandLine().usage(spec.commandLine().getOut());
    }

    // ---- Shared state for subcommands ----

    ArcsConfig config() {
        return dataDir != null ? baseConfig.withDataDir(dataDir) : baseConfig;
    }

    // opened on first use so help/version never touch the disk
    QuoteDatabase database() {
        if (database == null) {
            ArcsConfig config = config();
            log.debug("Starting {}", config);
            database = new QuoteDatabase(config).open();
            database.loadWarning().ifPresent(w -> err().println("Warning: " + w));
        }
        return database;
    }

    PrintWriter out() {
        return spec.commandLine().getOut();
    }

    PrintWriter err() {
        return spec.commandLine().getErr();
    }

    String money(double value) {
        return config().currencySymbol() + String.format(Locale.ROOT, "%.2f", value);
    }

    // e.g. ARCS_2024-12-18__PO_PO-999_.pdf in the working directory
    static Path suggestedFile(Quote quote, String extension) {
        return Path.of(QuoteNames.safeFileName(quote.name()) + "." + extension);
    }

    static class VersionProvider implements CommandLine.IVersionProvider {
        @Override
        public String[] getVersion() {
            ArcsConfig config = ArcsConfig.load();
            return new String[] {config.appTitle() + " " + config.version()};
        }
    }

    // ---- Commands ----

    @Command(name = "list", description = "List saved quotes")
    static class ListCommand implements Callable<Integer> {
        @ParentCommand
        private ArcsApp app;

        @Override
        public Integer call() {
            List<Quote> quotes = app.database().quotes();
            if (quotes.isEmpty()) {
                app.out().println("No saved quotes found.");
                return 0;
            }
            for (Quote q : quotes) {
                app.out().printf("%-12s %-40s %3d items  %12s%n",
                        q.id(), q.name(), q.items().size(), app.money(q.totalPrice()));
            }
            return 0;
        }
    }

    @Command(name = "show", description = "Show a quote with its line items and totals")
    static class ShowCommand implements Callable<Integer> {
        @ParentCommand
        private ArcsApp app;

        @Parameters(index = "0", description = "Quote id")
        private String id;

        @Override
        public Integer call() throws ArcsException {
            Quote q = app.database().require(id);
            PrintWriter out = app.out();
            out.println(q.name() + "  (id: " + q.id() + ")");
            if (q.hasPoNumber()) {
                out.println("PO: " + q.poNumber());
            }
            out.printf("%-3s %-14s %-28s %5s %10s %10s %-14s %11s%n",
                    "#", "Part", "Description", "Qty", "Unit", "List", "Source", "Line");
            List<LineItem> items = q.items();
            for (int i = 0; i < items.size(); i++) {
                LineItem it = items.get(i);
                out.printf(Locale.ROOT, "%-3d %-14s %-28s %5d %10.2f %10.2f %-14s %11.2f%n",
                        i + 1, it.partNumber(), it.description(), it.quantity(),
                        it.unitCost(), it.listPrice(), it.sourceLabel(), it.extendedPrice());
            }
            out.println("Total:  " + app.money(q.totalPrice()));
            out.println("Cost:   " + app.money(q.totalCost()));
            OptionalDouble percent = q.marginPercent();
            out.println("Margin: " + app.money(q.margin()) + " ("
                    + (percent.isPresent() ? String.format(Locale.ROOT, "%.1f%%", percent.getAsDouble()) : "N/A") + ")");
            if (!q.notes().isBlank()) {
                out.println("Notes:");
                out.println(q.notes());
            }
            return 0;
        }
    }

    @Command(name = "new", description = "Create and save an empty quote, printing its id")
    static class NewCommand implements Callable<Integer> {
        @ParentCommand
        private ArcsApp app;

        @Option(names = "--po", description = "PO number")
        private String po;

        @Option(names = "--notes", description = "Free-text notes")
        private String notes;

        @Override
        public Integer call() throws ArcsException {
            QuoteDatabase db = app.database();
            Quote q = db.newQuote();
            q.setPoNumber(po);
            q.setNotes(notes);
            db.save(q);
            app.out().println(q.id());
            return 0;
        }
    }

    @Command(name = "update", description = "Change the PO number or notes of a quote")
    static class UpdateCommand implements Callable<Integer> {
        @ParentCommand
        private ArcsApp app;

        @Parameters(index = "0", description = "Quote id")
        private String id;

        @Option(names = "--po", description = "PO number (empty to clear)")
        private String po;

        @Option(names = "--notes", description = "Free-text notes")
        private String notes;

        @Override
        public Integer call() throws ArcsException {
            QuoteDatabase db = app.database();
            Quote q = db.require(id);
            if (po != null) {
                q.setPoNumber(po);
            }
            if (notes != null) {
                q.setNotes(notes);
            }
            db.save(q);
            app.out().println("Saved " + q.name());
            return 0;
        }
    }

    /** Raw form fields of a line item, as typed. */
    static class ItemFields {
        @Option(names = "--part", description = "Part number")
        String part;

        @Option(names = "--desc", description = "Description")
        String description;

        @Option(names = "--qty", description = "Quantity (whole number >= 0)")
        String quantity;

        @Option(names = "--unit-cost", description = "Unit cost")
        String unitCost;

        @Option(names = "--list-price", description = "List price")
        String listPrice;

        @Option(names = "--source", description = "Supplier / vendor")
        String source;

        static String or(String value, String fallback) {
            return value != null ? value : fallback;
        }
    }

    @Command(name = "add-item", description = "Add a line item to a quote")
    static class AddItemCommand implements Callable<Integer> {
        @ParentCommand
        private ArcsApp app;

        @Parameters(index = "0", description = "Quote id")
        private String id;

        @CommandLine.Mixin
        private ItemFields fields = new ItemFields();

        @Override
        public Integer call() throws ArcsException {
            QuoteDatabase db = app.database();
            Quote q = db.require(id);
            LineItem item = q.addItem(
                    ItemFields.or(fields.part, ""),
                    ItemFields.or(fields.description, ""),
                    ItemFields.or(fields.quantity, "1"),
                    ItemFields.or(fields.unitCost, "0.00"),
                    ItemFields.or(fields.listPrice, "0.00"),
                    ItemFields.or(fields.source, ""));
            db.save(q);
            app.out().println("Added " + item + " -> total " + app.money(q.totalPrice()));
            return 0;
        }
    }

    @Command(name = "edit-item", description = "Change a line item; options left out keep their value")
    static class EditItemCommand implements Callable<Integer> {
        @ParentCommand
        private ArcsApp app;

        @Parameters(index = "0", description = "Quote id")
        private String id;

        @Parameters(index = "1", description = "Line number, starting at 1")
        private int position;

        @CommandLine.Mixin
        private ItemFields fields = new ItemFields();

        @Override
        public Integer call() throws ArcsException {
            QuoteDatabase db = app.database();
            Quote q = db.require(id);
            int index = position - 1;
            LineItem old = index >= 0 && index < q.items().size() ? q.items().get(index) : null;
            LineItem item = q.editItem(index,
                    ItemFields.or(fields.part, old != null ? old.partNumber() : ""),
                    ItemFields.or(fields.description, old != null ? old.description() : ""),
                    ItemFields.or(fields.quantity, old != null ? Integer.toString(old.quantity()) : "1"),
                    ItemFields.or(fields.unitCost, old != null ? Double.toString(old.unitCost()) : "0"),
                    ItemFields.or(fields.listPrice, old != null ? Double.toString(old.listPrice()) : "0"),
                    ItemFields.or(fields.source, old != null ? old.source() : ""));
            db.save(q);
            app.out().println("Updated line " + position + ": " + item);
            return 0;
        }
    }

    @Command(name = "remove-item", description = "Remove a line item from a quote")
    static class RemoveItemCommand implements Callable<Integer> {
        @ParentCommand
        private ArcsApp app;

        @Parameters(index = "0", description = "Quote id")
        private String id;

        @Parameters(index = "1", description = "Line number, starting at 1")
        private int position;

        @Override
        public Integer call() throws ArcsException {
            QuoteDatabase db = app.database();
            Quote q = db.require(id);
            LineItem removed = q.removeItem(position - 1);
            db.save(q);
            app.out().println("Removed " + removed);
            return 0;
        }
    }

    @Command(name = "suppliers",
             description = "List a quote's suppliers, or mark them tax exempt / taxable for all their rows")
    static class SuppliersCommand implements Callable<Integer> {
        @ParentCommand
        private ArcsApp app;

        @Parameters(index = "0", description = "Quote id")
        private String id;

        @Option(names = "--exempt", paramLabel = "SOURCE", description = "Mark this source tax exempt (repeatable)")
        private List<String> exempt = new ArrayList<>();

        @Option(names = "--taxable", paramLabel = "SOURCE", description = "Mark this source taxable again (repeatable)")
        private List<String> taxable = new ArrayList<>();

        @Override
        public Integer call() throws ArcsException {
            QuoteDatabase db = app.database();
            Quote q = db.require(id);
            if (!exempt.isEmpty() || !taxable.isEmpty()) {
                for (String source : exempt) {
                    q.setTaxExempt(source, true);
                }
                for (String source : taxable) {
                    q.setTaxExempt(source, false);
                }
                db.save(q);
            }

            // suppliers on the rows plus any with saved terms, sorted
            Map<String, Boolean> status = new TreeMap<>();
            for (String supplier : q.supplierNames()) {
                status.put(supplier, q.isTaxExempt(supplier));
            }
            q.suppliers().forEach((supplier, terms) -> status.putIfAbsent(supplier, terms != null && terms.taxExempt()));
            if (status.isEmpty()) {
                app.out().println("No suppliers on this quote.");
                return 0;
            }
            for (Map.Entry<String, Boolean> e : status.entrySet()) {
                app.out().printf("%-30s %s%n", e.getKey(), e.getValue() ? "Tax Exempt" : "Taxable");
            }
            return 0;
        }
    }

    @Command(name = "delete", description = "Delete a saved quote")
    static class DeleteCommand implements Callable<Integer> {
        @ParentCommand
        private ArcsApp app;

        @Parameters(index = "0", description = "Quote id")
        private String id;

        @Override
        public Integer call() throws ArcsException {
            if (!app.database().delete(id)) {
                app.err().println("No quote with id " + id);
                return 1;
            }
            app.out().println("Deleted " + id);
            return 0;
        }
    }

    @Command(name = "export", description = "Export a quote as PDF (or HTML when PDF output isn't available)")
    static class ExportCommand implements Callable<Integer> {
        @ParentCommand
        private ArcsApp app;

        @Parameters(index = "0", description = "Quote id")
        private String id;

        @Parameters(index = "1", arity = "0..1", description = "Target file (default: <quote name>.pdf)")
        private Path target;

        @Override
        public Integer call() throws ArcsException {
            Quote q = app.database().require(id);
            QuoteExporter exporter = Exporters.select(app.config());
            Path written = exporter.export(q, target != null ? target : suggestedFile(q, "pdf"));
            app.out().println("Quote exported to " + written);
            return 0;
        }
    }

    @Command(name = "export-json", description = "Write one quote to a JSON file that can be imported again")
    static class ExportJsonCommand implements Callable<Integer> {
        @ParentCommand
        private ArcsApp app;

        @Parameters(index = "0", description = "Quote id")
        private String id;

        @Parameters(index = "1", arity = "0..1", description = "Target .json file (default: <quote name>.json)")
        private Path target;

        @Override
        public Integer call() throws ArcsException {
            QuoteDatabase db = app.database();
            Path out = target != null ? target : suggestedFile(db.require(id), "json");
            db.exportQuote(id, out);
            app.out().println("Quote exported to " + out);
            return 0;
        }
    }

    @Command(name = "import", description = "Add a quote from a JSON file written by export-json")
    static class ImportCommand implements Callable<Integer> {
        @ParentCommand
        private ArcsApp app;

        @Parameters(index = "0", description = "Source .json file")
        private Path source;

        @Override
        public Integer call() throws ArcsException {
            Quote q = app.database().importQuote(source);
            app.out().println("Imported quote '" + q.name() + "' as " + q.id());
            return 0;
        }
    }

    @Command(name = "purchase-list", description = "Show the parts to buy, per quote")
    static class PurchaseListCommand implements Callable<Integer> {
        @ParentCommand
        private ArcsApp app;

        @Option(names = {"-f", "--file"}, description = "quotes.json to read (overrides the defaults)")
        private Path file;

        @Option(names = "--json", description = "Output JSON instead of a table")
        private boolean json;

        @Override
        public Integer call() {
            Path source = findQuotesFile();
            if (source == null) {
                return 2;
            }

            List<Quote> quotes;
            try {
                quotes = new QuoteStore(source).load();
            } catch (QuoteParseException e) {
                log.warn("Couldn't read {}", source, e);
                app.err().println("Warning: " + e.getMessage());
                quotes = new ArrayList<>();
            }

            List<PurchaseList> lists = PurchaseList.perQuote(quotes);
            app.out().print(json ? PurchaseListReport.json(lists) + "\n" : PurchaseListReport.text(lists));
            app.out().flush();
            return 0;
        }

        private Path findQuotesFile() {
            if (file != null) {
                if (Files.isRegularFile(file)) {
                    return file;
                }
                app.err().println("Warning: requested file " + file + " not found.");
                return null;
            }
            ArcsConfig config = app.config();
            if (Files.isRegularFile(config.quotesFile())) {
                return config.quotesFile();
            }
            if (Files.isRegularFile(config.bundledQuotesFile())) {
                return config.bundledQuotesFile();
            }
            app.err().println("No quotes file found (tried user data and bundled data). Create a quote first.");
            return null;
        }
    }
}
