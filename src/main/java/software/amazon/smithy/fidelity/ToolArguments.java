/*
 * Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
 * SPDX-License-Identifier: Apache-2.0
 */

package software.amazon.smithy.fidelity;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.function.Consumer;
import software.amazon.smithy.cli.AnsiColorFormatter;
import software.amazon.smithy.cli.ArgumentReceiver;
import software.amazon.smithy.cli.Arguments;
import software.amazon.smithy.cli.CliError;
import software.amazon.smithy.cli.CliPrinter;
import software.amazon.smithy.cli.HelpPrinter;
import software.amazon.smithy.fidelity.syntax.PrintOptions;

/**
 * Options and params of the syntax test tool.
 */
final class ToolArguments implements ArgumentReceiver {
    static final String NAME = "syntax-fidelity-test";

    private static final String HELP = "--help";
    private static final String HELP_SHORT = "-h";
    private static final String VISUAL = "--visual";
    private static final String VISUAL_SHORT = "-v";
    private static final String PRINT_VISUAL_REUSE_INFO = "--print-visual-reuse-info";
    private static final String PRINT_NODE_KIND = "--print-node-kind";
    private static final String PRINT_TRIVIAL_NODE_KIND = "--print-trivial-node-kind";
    private static final String NO_VERIFY_SYNTAX_TREE = "--no-verify-syntax-tree";
    private static final String INPUT_SOURCE_FILENAME = "--input-source-filename";
    private static final String INPUT_SOURCE_DIRECTORY = "--input-source-directory";
    private static final String OLD_SYNTAX_TREE_FILENAME = "--old-syntax-tree-filename";
    private static final String INCREMENTAL_EDIT = "--incremental-edit";
    private static final String INCREMENTAL_REUSE_LOG = "--incremental-reuse-log";
    private static final String OUTPUT_FILENAME = "--output-filename";

    private Action action;
    private boolean help = false;
    private boolean visual = false;
    private boolean printVisualReuseInfo = false;
    private boolean printNodeKind = false;
    private boolean printTrivialNodeKind = false;
    private boolean verifySyntaxTree = true;
    private Path inputSourceFilename;
    private Path inputSourceDirectory;
    private Path oldSyntaxTreeFilename;
    private final List<String> incrementalEdits = new ArrayList<>();
    private Path incrementalReuseLog;
    private Path outputFilename;

    static ToolArguments create(String[] args) {
        Arguments arguments = Arguments.of(args);
        var toolArguments = new ToolArguments();
        arguments.addReceiver(toolArguments);
        List<String> positional = arguments.getPositional();
        if (!positional.isEmpty()) {
            throw new CliError("Unexpected positional arguments: " + String.join(" ", positional));
        }
        return toolArguments;
    }

    @Override
    public void registerHelp(HelpPrinter printer) {
        for (Action candidate : Action.values()) {
            printer.option(candidate.flag(), null, candidate.description());
        }
        printer.option(HELP, HELP_SHORT, "Print this help output.");
        printer.option(VISUAL, VISUAL_SHORT, "Print colored output.");
        printer.option(PRINT_VISUAL_REUSE_INFO, null,
                "Print the new source with the reused parts told apart from the re-parsed parts.");
        printer.option(PRINT_NODE_KIND, null, "Wrap nodes in tags naming their kind when printing with --parse-gen.");
        printer.option(PRINT_TRIVIAL_NODE_KIND, null, "Also tag trivial nodes, like lists, with --print-node-kind.");
        printer.option(NO_VERIFY_SYNTAX_TREE, null, "Don't warn about unknown tokens and statements in the tree.");
        printer.param(INPUT_SOURCE_FILENAME, null, "FILE", "The source file to run the action on.");
        printer.param(INPUT_SOURCE_DIRECTORY, null, "DIR",
                "A directory to run the action on every .calc file of, recursively.");
        printer.param(OLD_SYNTAX_TREE_FILENAME, null, "FILE",
                "A JSON syntax tree of the source before the incremental edits.");
        printer.param(INCREMENTAL_EDIT, null, "L:C-L:C=TEXT",
                "An edit of the old source, replacing the range with TEXT. Can be repeated, in source order.");
        printer.param(INCREMENTAL_REUSE_LOG, null, "FILE", "Where to write the ranges of reused syntax.");
        printer.param(OUTPUT_FILENAME, null, "FILE", "Where to write output instead of standard out.");
    }

    @Override
    public boolean testOption(String name) {
        Action candidate = Action.fromFlag(name);
        if (candidate != null) {
            if (action != null && action != candidate) {
                throw new CliError("Only one action can be given, found " + action.flag() + " and " + name);
            }
            action = candidate;
            return true;
        }

        switch (name) {
            case HELP:
            case HELP_SHORT:
                help = true;
                return true;
            case VISUAL:
            case VISUAL_SHORT:
                visual = true;
                return true;
            case PRINT_VISUAL_REUSE_INFO:
                printVisualReuseInfo = true;
                return true;
            case PRINT_NODE_KIND:
                printNodeKind = true;
                return true;
            case PRINT_TRIVIAL_NODE_KIND:
                printTrivialNodeKind = true;
                return true;
            case NO_VERIFY_SYNTAX_TREE:
                verifySyntaxTree = false;
                return true;
            default:
                return false;
        }
    }

    @Override
    public Consumer<String> testParameter(String name) {
        switch (name) {
            case INPUT_SOURCE_FILENAME:
                return value -> inputSourceFilename = Paths.get(value);
            case INPUT_SOURCE_DIRECTORY:
                return value -> inputSourceDirectory = Paths.get(value);
            case OLD_SYNTAX_TREE_FILENAME:
                return value -> oldSyntaxTreeFilename = Paths.get(value);
            case INCREMENTAL_EDIT:
                return incrementalEdits::add;
            case INCREMENTAL_REUSE_LOG:
                return value -> incrementalReuseLog = Paths.get(value);
            case OUTPUT_FILENAME:
                return value -> outputFilename = Paths.get(value);
            default:
                return null;
        }
    }

    /**
     * Checks the combination of arguments, which the individual receiver
     * callbacks can't.
     *
     * @throws CliError If the arguments don't make sense together
     */
    void validate() {
        if (action == null) {
            throw new CliError("An action is required");
        }
        if ((inputSourceFilename == null) == (inputSourceDirectory == null)) {
            throw new CliError("Exactly one of " + INPUT_SOURCE_FILENAME + " and " + INPUT_SOURCE_DIRECTORY
                    + " is required");
        }
        if (!incrementalEdits.isEmpty() && oldSyntaxTreeFilename == null) {
            throw new CliError(INCREMENTAL_EDIT + " requires " + OLD_SYNTAX_TREE_FILENAME);
        }
        if (printTrivialNodeKind && !printNodeKind) {
            throw new CliError(PRINT_TRIVIAL_NODE_KIND + " requires " + PRINT_NODE_KIND);
        }
    }

    void printHelp(CliPrinter printer) {
        HelpPrinter helpPrinter = new HelpPrinter(NAME);
        helpPrinter.summary("Checks that syntax trees reproduce their source exactly.");
        registerHelp(helpPrinter);
        helpPrinter.print(AnsiColorFormatter.NO_COLOR, printer);
    }

    PrintOptions toPrintOptions() {
        return PrintOptions.builder()
                .showKindTags(printNodeKind)
                .showTrivialKinds(printTrivialNodeKind)
                .visual(visual)
                .build();
    }

    Action action() {
        return action;
    }

    boolean help() {
        return help;
    }

    boolean visual() {
        return visual;
    }

    boolean printVisualReuseInfo() {
        return printVisualReuseInfo;
    }

    boolean verifySyntaxTree() {
        return verifySyntaxTree;
    }

    Path inputSourceFilename() {
        return inputSourceFilename;
    }

    Path inputSourceDirectory() {
        return inputSourceDirectory;
    }

    Path oldSyntaxTreeFilename() {
        return oldSyntaxTreeFilename;
    }

    List<String> incrementalEdits() {
        return Collections.unmodifiableList(incrementalEdits);
    }

    Path incrementalReuseLog() {
        return incrementalReuseLog;
    }

    Path outputFilename() {
        return outputFilename;
    }
}
