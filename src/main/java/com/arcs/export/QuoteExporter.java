package com.arcs.export;

import com.arcs.model.Quote;

import java.nio.file.Path;

/**
 * Renders one quote to one file.
 *
 * @see Exporters#select
 */
public interface QuoteExporter {

    /** File extension this exporter produces, without the dot. */
    String extension();

    /**
     * Writes {@code quote} to {@code target}, or next to it when {@code target}
     * carries another exporter's extension.
     *
     * @return the file actually written
     * @throws QuoteExportException if rendering or writing fails
     */
    Path export(Quote quote, Path target) throws QuoteExportException;
}
