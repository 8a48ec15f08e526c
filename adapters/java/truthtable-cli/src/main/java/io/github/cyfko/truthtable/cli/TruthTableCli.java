package io.github.cyfko.truthtable.cli;

import io.github.cyfko.truthtable.core.TruthTableGenerator;
import io.github.cyfko.truthtable.core.exception.ExpressionSyntaxException;
import io.github.cyfko.truthtable.core.exception.VariableLimitException;
import io.github.cyfko.truthtable.core.impl.BasicExpressionParser;
import io.github.cyfko.truthtable.core.model.TruthTable;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.PrintStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.Objects;
import java.util.function.Function;
import java.util.logging.Logger;

/**
 * Command-line front end: prints the truth table of one expression.
 * <p>
 * On a syntax error a single diagnostic line goes to standard error and nothing is
 * printed on standard output.
 * </p>
 *
 * <h3>Exit status</h3>
 * <ul>
 *   <li>{@code 0}: table printed</li>
 *   <li>{@code 1}: the expression was rejected (syntax error or too many variables)</li>
 *   <li>{@code 2}: usage error</li>
 * </ul>
 */
public final class TruthTableCli {

    static final int EXIT_OK = 0;
    static final int EXIT_REJECTED = 1;
    static final int EXIT_USAGE = 2;

    private static final Logger log = Logger.getLogger(TruthTableCli.class.getName());

    private final Function<CliOptions, TruthTableGenerator> generatorFactory;

    TruthTableCli() {
        this(options -> new TruthTableGenerator(new BasicExpressionParser(), options.tablePolicy()));
    }

    TruthTableCli(Function<CliOptions, TruthTableGenerator> generatorFactory) {
        this.generatorFactory = Objects.requireNonNull(generatorFactory, "generatorFactory");
    }

    public static void main(String[] args) {
        BufferedReader stdin = new BufferedReader(new InputStreamReader(System.in, StandardCharsets.UTF_8));
        int status = new TruthTableCli().run(args, stdin, System.out, System.err);
        if (status != EXIT_OK) {
            System.exit(status);
        }
    }

    /**
     * Runs one invocation.
     *
     * @return the exit status
     */
    int run(String[] args, BufferedReader in, PrintStream out, PrintStream err) {
        CliOptions options;
        try {
            options = CliOptions.parse(args);
        } catch (IllegalArgumentException e) {
            err.println("error: " + e.getMessage());
            err.println(CliOptions.USAGE);
            return EXIT_USAGE;
        }

        if (options.help()) {
            out.println(CliOptions.USAGE);
            return EXIT_OK;
        }

        String expression = options.expression() != null ? options.expression() : readLine(in);
        if (expression == null) {
            err.println("error: no expression given");
            err.println(CliOptions.USAGE);
            return EXIT_USAGE;
        }

        TruthTableGenerator generator = generatorFactory.apply(options);
        try {
            TruthTable table = generator.generate(expression);
            String rendered = generator.getRenderer().render(table);
            if (options.printAst()) {
                out.println(table.expression());
            }
            out.print(rendered);
            out.flush();
            return EXIT_OK;
        } catch (ExpressionSyntaxException | VariableLimitException e) {
            log.fine(() -> String.format("Rejected expression '%s': %s", expression, e.getMessage()));
            err.println("error: " + e.getMessage());
            return EXIT_REJECTED;
        }
    }

    private static String readLine(BufferedReader in) {
        try {
            return in.readLine();
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read expression from standard input", e);
        }
    }
}
