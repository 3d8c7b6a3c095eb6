/*
 * Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
 * SPDX-License-Identifier: Apache-2.0
 */

package software.amazon.smithy.fidelity;

import java.io.IOException;
import java.io.OutputStream;
import java.util.logging.Logger;
import software.amazon.smithy.cli.CliError;
import software.amazon.smithy.cli.CliPrinter;
import software.amazon.smithy.fidelity.syntax.Syntax;

/**
 * Main launcher for the syntax test tool.
 */
public final class Main {
    private static final Logger LOGGER = Logger.getLogger(Main.class.getName());

    private Main() {
    }

    /**
     * Main entry point for the syntax test tool.
     * @param args Arguments passed to the tool.
     */
    public static void main(String[] args) {
        System.exit(run(args, System.out, CliPrinter.fromOutputStream(System.err)));
    }

    static int run(String[] args, OutputStream out, CliPrinter err) {
        try {
            ToolArguments arguments = ToolArguments.create(args);
            if (arguments.help()) {
                arguments.printHelp(err);
                err.flush();
                return 0;
            }
            return new SyntaxTestTool(arguments, Syntax.parser()).run(out);
        } catch (CliError e) {
            err.println(e.getMessage());
            new ToolArguments().printHelp(err);
            err.flush();
            return 1;
        } catch (IOException e) {
            LOGGER.severe("Couldn't run the syntax test tool: " + e.getMessage());
            return 1;
        }
    }
}
