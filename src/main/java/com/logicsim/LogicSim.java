package com.logicsim;

import com.logicsim.expr.Assignment;
import com.logicsim.expr.ExpressionNode;
import com.logicsim.expr.ExpressionParser;
import com.logicsim.expr.ExpressionPrinter;
import com.logicsim.json.AssignmentJsonReader;
import com.logicsim.output.OutputFormat;
import com.logicsim.output.TableWriter;
import com.logicsim.shell.InteractiveShell;
import com.logicsim.store.FileLastExpressionStore;
import com.logicsim.store.LastExpressionStore;
import com.logicsim.table.TruthTableGenerator;
import com.logicsim.table.TruthTableRow;
import org.eclipse.collections.api.list.ImmutableList;
import org.eclipse.collections.api.set.sorted.ImmutableSortedSet;
import org.tinylog.Logger;
import picocli.CommandLine;
import picocli.CommandLine.ArgGroup;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.ParameterException;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.Spec;

import java.io.BufferedReader;
import java.io.FileInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.PrintWriter;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.stream.Stream;

@Command(name = "logicsim", mixinStandardHelpOptions = true, version = "1.0",
         description = "Evaluate Boolean expressions built from AND, OR, NOT, NAND, NOR, XOR "
                 + "and single-letter variables, and print their truth tables")
public class LogicSim implements Callable<Integer> {
    @Spec
    private CommandSpec spec;

    @Parameters(index = "0", arity = "0..1",
                description = "The expression, e.g. \"(A AND B) OR (NOT C)\" (default: the last one used)")
    private String expression;

    @ArgGroup(exclusive = true, multiplicity = "0..1")
    private Inputs inputs;

    static class Inputs {
        @Option(names = {"-s", "--set"}, split = ",", paramLabel = "NAME=VALUE",
                description = "Evaluate once with these values (0, 1, false, true) instead of printing the whole table")
        private Map<String, String> values;

        @Option(names = {"-a", "--assignments"}, paramLabel = "FILE",
                description = "Evaluate each assignment of a JSON object or array (- for stdin)")
        private String assignmentsFile;
    }

    @Option(names = {"-f", "--format"},
            description = "Output format: ${COMPLETION-CANDIDATES} (default: ${DEFAULT-VALUE})")
    private OutputFormat format = OutputFormat.TABLE;

    @Option(names = {"-o", "--output"}, paramLabel = "FILE", description = "Write the output to a file")
    private Path outputFile;

    @Option(names = {"-b", "--booleans"}, description = "Show True/False instead of 1/0 in tables")
    private boolean booleanWords = false;

    @Option(names = {"-c", "--compact"}, description = "Compact JSON output without whitespace")
    private boolean compact = false;

    @Option(names = {"-t", "--tree"}, description = "Print the fully parenthesized expression first")
    private boolean showTree = false;

    @Option(names = {"-i", "--interactive"}, description = "Read expressions from stdin until 'quit'")
    private boolean interactive = false;

    @Option(names = "--state-file", paramLabel = "FILE",
            description = "Where the last expression is kept (default: ${DEFAULT-VALUE})")
    private Path stateFile = Path.of(FileLastExpressionStore.DEFAULT_FILE_NAME);

    @Option(names = "--no-save", description = "Do not remember the expression")
    private boolean noSave = false;

    private final InputStream stdin;
    private final ExpressionParser parser = new ExpressionParser();
    private final TruthTableGenerator generator = new TruthTableGenerator();

    public LogicSim() {
        this(System.in);
    }

    LogicSim(InputStream stdin) {
        this.stdin = stdin;
    }

    public static void main(String[] args) {
        int exitCode = createCommandLine(new LogicSim()).execute(args);
        System.exit(exitCode);
    }

    static CommandLine createCommandLine(LogicSim app) {
        return new CommandLine(app).setCaseInsensitiveEnumValuesAllowed(true);
    }

    @Override
    public Integer call() throws Exception {
        PrintWriter out = spec.commandLine().getOut();
        PrintWriter err = spec.commandLine().getErr();
        LastExpressionStore store = new FileLastExpressionStore(stateFile);
        TableWriter writer = format.createWriter(booleanWords, compact);

        try {
            if (interactive) {
                InteractiveShell shell = new InteractiveShell(parser, generator, writer, noSave ? null : store);
                shell.run(new BufferedReader(new InputStreamReader(stdin, StandardCharsets.UTF_8)), out);
                return 0;
            }

            // Parse the expression
            String text = expression != null ? expression : store.loadOrDefault();
            ExpressionNode tree = parser.parse(text);
            ImmutableSortedSet<String> variables = tree.variables();
            if (variables.isEmpty()) {
                err.println("No variables detected in expression");
                return 1;
            }

            if (showTree) {
                out.println(new ExpressionPrinter().print(tree));
            }

            // Evaluate and write the rows
            Stream<TruthTableRow> rows = rows(tree, variables);
            if (outputFile != null) {
                try (Writer file = Files.newBufferedWriter(outputFile, StandardCharsets.UTF_8)) {
                    writer.write(text, variables, rows, file);
                }
                out.println("Exported to: " + outputFile.getFileName());
            } else {
                writer.write(text, variables, rows, out);
            }

            if (!noSave) {
                remember(store, text);
            }
            return 0;
        } catch (ParameterException e) {
            throw e;
        } catch (Exception e) {
            Logger.debug(e, "Command failed");
            err.println("Error: " + e.getMessage());
            return 1;
        }
    }

    private Stream<TruthTableRow> rows(ExpressionNode tree, ImmutableSortedSet<String> variables) throws IOException {
        ImmutableList<String> columns = variables.toList().toImmutable();
        if (inputs != null && inputs.values != null) {
            return Stream.of(generator.row(tree, columns, assignmentFromOptions(variables)));
        }
        if (inputs != null && inputs.assignmentsFile != null) {
            ImmutableList<Assignment> assignments = readAssignments();
            assignments.forEachWithIndex((assignment, i) -> requireComplete(assignment, i + 1, variables));
            return assignments.stream().map(assignment -> generator.row(tree, columns, assignment));
        }
        return generator.stream(tree, variables);
    }

    // Checked up front so nothing is written for a file that fails halfway
    private static void requireComplete(Assignment assignment, int number, ImmutableSortedSet<String> variables) {
        ImmutableSortedSet<String> missing = variables.reject(assignment::covers);
        if (missing.notEmpty()) {
            throw new IllegalArgumentException(
                    "Assignment " + number + " " + assignment + " has no value for " + missing.makeString(", "));
        }
    }

    private Assignment assignmentFromOptions(ImmutableSortedSet<String> variables) {
        Assignment assignment = Assignment.empty();
        for (Map.Entry<String, String> entry : inputs.values.entrySet()) {
            String name = entry.getKey().strip().toUpperCase(Locale.ROOT);
            if (!variables.contains(name)) {
                throw new ParameterException(spec.commandLine(),
                        "Unknown variable '" + entry.getKey() + "', expression has " + variables.makeString(", "));
            }
            assignment = assignment.with(name, parseValue(name, entry.getValue()));
        }

        ImmutableSortedSet<String> missing = variables.reject(assignment::covers);
        if (missing.notEmpty()) {
            throw new ParameterException(spec.commandLine(), "Missing value for " + missing.makeString(", "));
        }
        return assignment;
    }

    private boolean parseValue(String name, String value) {
        return switch (value.strip().toLowerCase(Locale.ROOT)) {
            case "1", "true" -> true;
            case "0", "false" -> false;
            default -> throw new ParameterException(spec.commandLine(),
                    "Invalid value for " + name + ": '" + value + "' (expected 0, 1, false or true)");
        };
    }

    private ImmutableList<Assignment> readAssignments() throws IOException {
        AssignmentJsonReader reader = new AssignmentJsonReader();
        if ("-".equals(inputs.assignmentsFile)) {
            return reader.read(stdin);
        }
        try (InputStream input = new FileInputStream(inputs.assignmentsFile)) {
            return reader.read(input);
        }
    }

    private static void remember(LastExpressionStore store, String text) {
        try {
            store.save(text);
        } catch (IOException e) {
            Logger.warn(e, "Could not save the last expression");
        }
    }
}
