package com.arcs.config;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Map;
import java.util.Properties;

/**
 * Everything the store, the database and the exporters need to know about
 * where files live and how quotes are branded.
 *
 * <p>Built once at startup and handed to constructors. Values come from, in
 * increasing precedence: built-in defaults, the classpath resource
 * {@code arcs.properties}, the {@code ARCS_DATA_DIR} environment variable and
 * {@code arcs.*} system properties.
 */
public final class ArcsConfig {

    public static final String RESOURCE = "arcs.properties";
    public static final String DATA_DIR_ENV = "ARCS_DATA_DIR";
    public static final String QUOTES_FILE_NAME = "quotes.json";

    // ---- Keys ----

    static final String APP_NAME = "arcs.appName";
    static final String APP_TITLE = "arcs.appTitle";
    static final String VERSION = "arcs.version";
    static final String COMPANY_NAME = "arcs.companyName";
    static final String CURRENCY_SYMBOL = "arcs.currencySymbol";
    static final String DATA_DIR = "arcs.dataDir";
    static final String BUNDLED_QUOTES_FILE = "arcs.bundledQuotesFile";

    // ---- Fields ----

    private final String appName;          // prefix of every normalized quote name, e.g. "ARCS"
    private final String appTitle;
    private final String version;
    private final String companyName;      // heading on exported documents
    private final String currencySymbol;
    private final Path dataDir;            // user data, e.g. ~/.arcsoftware
    private final Path bundledQuotesFile;  // read-only fallback shipped with the app

    private ArcsConfig(String appName,
                       String appTitle,
                       String version,
                       String companyName,
                       String currencySymbol,
                       Path dataDir,
                       Path bundledQuotesFile) {
        this.appName = appName;
        this.appTitle = appTitle;
        this.version = version;
        this.companyName = companyName;
        this.currencySymbol = currencySymbol;
        this.dataDir = dataDir;
        this.bundledQuotesFile = bundledQuotesFile;
    }

    /** Configuration from the classpath resource, the environment and system properties. */
    public static ArcsConfig load() {
        return load(readResource(), System.getenv(), System.getProperties());
    }

    static ArcsConfig load(Properties resource, Map<String, String> env, Properties system) {
        Properties merged = new Properties();
        merged.putAll(resource);

        String envDataDir = env.get(DATA_DIR_ENV);
        if (envDataDir != null && !envDataDir.isBlank()) {
            merged.setProperty(DATA_DIR, envDataDir);
        }
        for (String key : system.stringPropertyNames()) {
            if (key.startsWith("arcs.")) {
                merged.setProperty(key, system.getProperty(key));
            }
        }

        String home = system.getProperty("user.home", System.getProperty("user.home"));
        return new ArcsConfig(
                merged.getProperty(APP_NAME, "ARCS"),
                merged.getProperty(APP_TITLE, "ARCS Quote Manager"),
                merged.getProperty(VERSION, "v1.0.6-Beta"),
                merged.getProperty(COMPANY_NAME, "ARC-Works"),
                merged.getProperty(CURRENCY_SYMBOL, "$"),
                Paths.get(merged.getProperty(DATA_DIR, Paths.get(home, ".arcsoftware").toString())),
                Paths.get(merged.getProperty(BUNDLED_QUOTES_FILE, Paths.get("data", QUOTES_FILE_NAME).toString())));
    }

    private static Properties readResource() {
        Properties props = new Properties();
        try (InputStream in = ArcsConfig.class.getClassLoader().getResourceAsStream(RESOURCE)) {
            if (in != null) {
                props.load(in);
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Could not read " + RESOURCE, e);
        }
        return props;
    }

    // ---- Copies ----

    public ArcsConfig withDataDir(Path dataDir) {
        return new ArcsConfig(appName, appTitle, version, companyName, currencySymbol, dataDir, bundledQuotesFile);
    }

    public ArcsConfig withBundledQuotesFile(Path bundledQuotesFile) {
        return new ArcsConfig(appName, appTitle, version, companyName, currencySymbol, dataDir, bundledQuotesFile);
    }

    // ---- Accessors ----

    public String appName() {
        return appName;
    }

    public String appTitle() {
        return appTitle;
    }

    public String version() {
        return version;
    }

    public String companyName() {
        return companyName;
    }

    public String currencySymbol() {
        return currencySymbol;
    }

    public Path dataDir() {
        return dataDir;
    }

    public Path quotesFile() {
        return dataDir.resolve(QUOTES_FILE_NAME);
    }

    public Path bundledQuotesFile() {
        return bundledQuotesFile;
    }

    @Override
    public String toString() {
        return appTitle + " " + version + " (data: " + dataDir + ")";
    }
}
