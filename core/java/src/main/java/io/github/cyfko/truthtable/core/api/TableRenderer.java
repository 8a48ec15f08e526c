package io.github.cyfko.truthtable.core.api;

import io.github.cyfko.truthtable.core.model.TruthTable;

/**
 * Turns a {@link TruthTable} into text.
 * <p>
 * Rendering is pure formatting: the table already holds every row and result.
 * </p>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
@FunctionalInterface
public interface TableRenderer {

    /**
     * @param table the table to render
     * @return a header line followed by one line per row, in row order
     */
    String render(TruthTable table);
}
