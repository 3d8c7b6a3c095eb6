/*
 * Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
 * SPDX-License-Identifier: Apache-2.0
 */

package software.amazon.smithy.fidelity;

/**
 * What {@link SyntaxTestTool} does with each input file.
 */
enum Action {
    DUMP_FULL_TOKENS("--dump-full-tokens", "Lex the source file and dump the tokens with their positions."),
    ROUND_TRIP_LEX("--round-trip-lex", "Lex the source file and print it back out."),
    ROUND_TRIP_PARSE("--round-trip-parse", "Parse the source file and print it back out."),
    PARSE_ONLY("--parse-only", "Parse the source file without printing anything."),
    PARSE_GEN("--parse-gen", "Parse the source file and print it with the node kind options."),
    SERIALIZE_RAW_TREE("--serialize-raw-tree", "Parse the source file and print its syntax tree as JSON."),
    DESERIALIZE_RAW_TREE("--deserialize-raw-tree", "Read a JSON syntax tree and print the source it describes."),
    EOF("--eof", "Parse the source file, check the position of the eof token, and print the "
            + "source up to it.");

    private final String flag;
    private final String description;

    Action(String flag, String description) {
        this.flag = flag;
        this.description = description;
    }

    String flag() {
        return flag;
    }

    String description() {
        return description;
    }

    static Action fromFlag(String flag) {
        for (Action action : values()) {
            if (action.flag.equals(flag)) {
                return action;
            }
        }
        return null;
    }
}
