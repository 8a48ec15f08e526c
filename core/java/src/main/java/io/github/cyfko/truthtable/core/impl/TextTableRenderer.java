package io.github.cyfko.truthtable.core.impl;

import io.github.cyfko.truthtable.core.api.TableRenderer;
import io.github.cyfko.truthtable.core.config.CellFormat;
import io.github.cyfko.truthtable.core.config.TablePolicy;
import io.github.cyfko.truthtable.core.model.TruthTable;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Plain-text {@link TableRenderer}.
 * <p>
 * Columns are the variables in table order followed by the result column. Cells are
 * left-aligned, padded to the wider of header and cell, separated by one space; trailing
 * blanks are stripped and every line ends with {@code \n}.
 * </p>
 *
 * <pre>
 * a b out
 * 0 0 0
 * 0 1 1
 * 1 0 1
 * 1 1 1
 * </pre>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public class TextTableRenderer implements TableRenderer {

    private final CellFormat cellFormat;
    private final String outputHeader;

    public TextTableRenderer() {
        this(TablePolicy.defaults());
    }

    public TextTableRenderer(TablePolicy tablePolicy) {
        this(tablePolicy.cellFormat(), tablePolicy.outputHeader());
    }

    public TextTableRenderer(CellFormat cellFormat, String outputHeader) {
        this.cellFormat = Objects.requireNonNull(cellFormat, "cellFormat");
        this.outputHeader = Objects.requireNonNull(outputHeader, "outputHeader");
    }

    @Override
    public String render(TruthTable table) {
        Objects.requireNonNull(table, "table");

        List<String> headers = new ArrayList<>(table.variables().size() + 1);
        for (Character variable : table.variables()) {
            headers.add(String.valueOf(variable));
        }
        headers.add(outputHeader);

        int[] widths = new int[headers.size()];
        for (int i = 0; i < widths.length; i++) {
            widths[i] = Math.max(headers.get(i).length(), cellFormat.width());
        }

        StringBuilder sb = new StringBuilder();
        appendLine(sb, headers, widths);

        List<String> cells = new ArrayList<>(widths.length);
        for (TruthTable.Row row : table.rows()) {
            cells.clear();
            for (Character variable : table.variables()) {
                cells.add(cellFormat.format(row.binding().valueOf(variable).orElseThrow()));
            }
            cells.add(cellFormat.format(row.result()));
            appendLine(sb, cells, widths);
        }
        return sb.toString();
    }

    private static void appendLine(StringBuilder sb, List<String> cells, int[] widths) {
        StringBuilder line = new StringBuilder();
        for (int i = 0; i < cells.size(); i++) {
            if (i > 0) {
                line.append(' ');
            }
            line.append(cells.get(i));
            line.append(" ".repeat(widths[i] - cells.get(i).length()));
        }
        sb.append(line.toString().stripTrailing()).append('\n');
    }
}
