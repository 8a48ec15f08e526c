package io.github.cyfko.truthtable.cli;

import io.github.cyfko.truthtable.core.config.CellFormat;
import io.github.cyfko.truthtable.core.config.TablePolicy;

import java.util.ArrayList;
import java.util.List;

/**
 * Parsed command line.
 *
 * @param expression   the expression words joined with a space, or {@code null} to read standard input
 * @param cellFormat   how cells are printed
 * @param printAst     whether to print the parsed tree before the table
 * @param maxVariables variable limit passed to the {@link TablePolicy}
 * @param help         whether usage was requested
 */
record CliOptions(String expression, CellFormat cellFormat, boolean printAst, int maxVariables, boolean help) {

    static final String USAGE = String.join(System.lineSeparator(),
            "Usage: truthtable [--boolean] [--print-ast] [--max-variables=N] <expression...>",
            "Reads the expression from standard input when none is given.",
            "Example: truthtable \"a + bc'\"");

    /**
     * @throws IllegalArgumentException on an unknown option or a malformed value
     */
    static CliOptions parse(String[] args) {
        CellFormat cellFormat = CellFormat.BINARY;
        boolean printAst = false;
        boolean help = false;
        int maxVariables = TablePolicy.defaults().maxVariables();
        List<String> words = new ArrayList<>();

        boolean optionsEnded = false;
        for (String arg : args) {
            if (optionsEnded || !arg.startsWith("--")) {
                words.add(arg);
                continue;
            }
            if (arg.equals("--")) {
                optionsEnded = true;
            } else if (arg.equals("--boolean")) {
                cellFormat = CellFormat.BOOLEAN;
            } else if (arg.equals("--print-ast")) {
                printAst = true;
            } else if (arg.equals("--help")) {
                help = true;
            } else if (arg.startsWith("--max-variables=")) {
                maxVariables = parseMaxVariables(arg.substring("--max-variables=".length()));
            } else {
                throw new IllegalArgumentException("Unknown option: " + arg);
            }
        }

        String expression = words.isEmpty() ? null : String.join(" ", words);
        return new CliOptions(expression, cellFormat, printAst, maxVariables, help);
    }

    TablePolicy tablePolicy() {
        return TablePolicy.builder()
                .maxVariables(maxVariables)
                .cellFormat(cellFormat)
                .build();
    }

    private static int parseMaxVariables(String value) {
        int parsed;
        try {
            parsed = Integer.parseInt(value);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("--max-variables expects an integer, got: " + value, e);
        }
        if (parsed < 0 || parsed > TablePolicy.HARD_MAX_VARIABLES) {
            throw new IllegalArgumentException(String.format(
                    "--max-variables must be between 0 and %d, got: %d", TablePolicy.HARD_MAX_VARIABLES, parsed));
        }
        return parsed;
    }
}
