/*
 * Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
 * SPDX-License-Identifier: Apache-2.0
 */

package software.amazon.smithy.fidelity;

import java.io.IOException;
import java.io.OutputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.logging.Level;
import java.util.logging.Logger;
import java.util.stream.Collectors;
import java.util.stream.Stream;
import software.amazon.smithy.cli.AnsiColorFormatter;
import software.amazon.smithy.cli.ColorFormatter;
import software.amazon.smithy.fidelity.document.SourceBuffer;
import software.amazon.smithy.fidelity.incremental.MalformedEditException;
import software.amazon.smithy.fidelity.incremental.ParsingCache;
import software.amazon.smithy.fidelity.incremental.ReuseRange;
import software.amazon.smithy.fidelity.incremental.ReuseReport;
import software.amazon.smithy.fidelity.incremental.SourceEdit;
import software.amazon.smithy.fidelity.serialization.MalformedDocumentException;
import software.amazon.smithy.fidelity.serialization.SyntaxDeserializer;
import software.amazon.smithy.fidelity.serialization.SyntaxSerializer;
import software.amazon.smithy.fidelity.syntax.AbsolutePosition;
import software.amazon.smithy.fidelity.syntax.PositionedToken;
import software.amazon.smithy.fidelity.syntax.RawSyntax;
import software.amazon.smithy.fidelity.syntax.RoundTrip;
import software.amazon.smithy.fidelity.syntax.SyntaxIntegrityException;
import software.amazon.smithy.fidelity.syntax.SyntaxKind;
import software.amazon.smithy.fidelity.syntax.SyntaxParser;
import software.amazon.smithy.fidelity.syntax.SyntaxPositions;
import software.amazon.smithy.fidelity.syntax.SyntaxPrinter;
import software.amazon.smithy.fidelity.syntax.Trivia;
import software.amazon.smithy.fidelity.syntax.TriviaPiece;

/**
 * Runs one {@link Action} over an input file, or every source file of an
 * input directory.
 *
 * <p>Source text is written out as the raw bytes it was read as. Interchange
 * documents are read and written as UTF-8.
 */
final class SyntaxTestTool {
    private static final Logger LOGGER = Logger.getLogger(SyntaxTestTool.class.getName());
    private static final String SOURCE_EXTENSION = ".calc";

    private final ToolArguments arguments;
    private final SyntaxParser parser;

    SyntaxTestTool(ToolArguments arguments, SyntaxParser parser) {
        this.arguments = arguments;
        this.parser = parser;
    }

    /**
     * @param standardOut Where to write output when no output file is given
     * @return The exit status, {@code 0} if the action succeeded for every file
     * @throws IOException If the inputs can't be listed or the output file can't be opened
     */
    int run(OutputStream standardOut) throws IOException {
        arguments.validate();
        List<Path> inputs = inputs();
        if (arguments.outputFilename() == null) {
            return run(inputs, standardOut);
        }
        try (OutputStream out = Files.newOutputStream(arguments.outputFilename())) {
            return run(inputs, out);
        }
    }

    private int run(List<Path> inputs, OutputStream out) throws IOException {
        int failures = 0;
        for (Path input : inputs) {
            if (!invokeCommand(input, out)) {
                failures++;
            }
        }
        out.flush();
        if (failures > 0) {
            LOGGER.warning("Action failed for " + failures + " of " + inputs.size() + " files");
            return 1;
        }
        return 0;
    }

    private List<Path> inputs() throws IOException {
        if (arguments.inputSourceFilename() != null) {
            return List.of(arguments.inputSourceFilename());
        }
        try (Stream<Path> paths = Files.walk(arguments.inputSourceDirectory())) {
            return paths.filter(Files::isRegularFile)
                    .filter(path -> path.getFileName().toString().endsWith(SOURCE_EXTENSION))
                    .sorted()
                    .collect(Collectors.toList());
        }
    }

    /**
     * @param input The file to run the action on
     * @param out Where to write output
     * @return Whether the action succeeded
     */
    boolean invokeCommand(Path input, OutputStream out) {
        try {
            invoke(input, out);
            return true;
        } catch (IOException | UncheckedIOException e) {
            LOGGER.severe(() -> "Couldn't process " + input + ": " + e.getMessage());
        } catch (MalformedEditException e) {
            LOGGER.severe(() -> "Malformed edit for " + input + ": " + e.getMessage());
        } catch (MalformedDocumentException e) {
            LOGGER.severe(() -> "Malformed syntax tree document for " + input + ": " + e.getMessage());
        } catch (SyntaxIntegrityException e) {
            LOGGER.log(Level.SEVERE, "Syntax tree of " + input + " doesn't match its source", e);
        }
        return false;
    }

    private void invoke(Path input, OutputStream out) throws IOException {
        switch (arguments.action()) {
            case DUMP_FULL_TOKENS:
                dumpFullTokens(input, out);
                break;
            case ROUND_TRIP_LEX:
                roundTripLex(input, out);
                break;
            case ROUND_TRIP_PARSE:
                roundTripParse(input, out);
                break;
            case PARSE_ONLY:
                parseFile(input, out);
                break;
            case PARSE_GEN:
                parseGen(input, out);
                break;
            case SERIALIZE_RAW_TREE:
                serializeRawTree(input, out);
                break;
            case DESERIALIZE_RAW_TREE:
                deserializeRawTree(input, out);
                break;
            case EOF:
                eof(input, out);
                break;
            default:
                throw new IllegalStateException("Unhandled action " + arguments.action());
        }
    }

    private void dumpFullTokens(Path input, OutputStream out) throws IOException {
        SourceBuffer source = readSource(input);
        StringBuilder builder = new StringBuilder();
        int offset = 0;
        for (RawSyntax.Token token : parser.tokenize(source)) {
            builder.append(source.positionAtOffset(offset).lineAndColumn()).append('\n');
            dumpToken(token, builder);
            builder.append('\n');
            offset += token.width();
        }
        writeSource(builder, out);
    }

    private void roundTripLex(Path input, OutputStream out) throws IOException {
        SourceBuffer source = readSource(input);
        StringBuilder builder = new StringBuilder(source.length());
        for (RawSyntax.Token token : RoundTrip.verifyLex(source, parser)) {
            token.print(builder);
        }
        writeSource(builder, out);
    }

    private void roundTripParse(Path input, OutputStream out) throws IOException {
        Parsed parsed = parseFile(input, out);
        String printed = parsed.root.print();
        RoundTrip.verifyPrinted(parsed.source, printed);
        writeSource(printed, out);
    }

    private void parseGen(Path input, OutputStream out) throws IOException {
        Parsed parsed = parseFile(input, out);
        writeSource(SyntaxPrinter.create(arguments.toPrintOptions()).print(parsed.root), out);
    }

    private void serializeRawTree(Path input, OutputStream out) throws IOException {
        Parsed parsed = parseFile(input, out);
        String json = SyntaxSerializer.serialize(parsed.root) + "\n";
        out.write(json.getBytes(StandardCharsets.UTF_8));
    }

    private void deserializeRawTree(Path input, OutputStream out) throws IOException {
        RawSyntax root = readSyntaxTree(input);
        writeSource(root.print(), out);
    }

    private void eof(Path input, OutputStream out) throws IOException {
        Parsed parsed = parseFile(input, out);
        PositionedToken eof = SyntaxPositions.lastToken(parsed.root);
        if (eof == null || eof.token().kind() != SyntaxKind.EOF) {
            throw new IllegalStateException("Syntax tree of " + input + " doesn't end with an eof token");
        }
        AbsolutePosition position = eof.textPosition();
        RoundTrip.verifyPosition(parsed.source, position);
        writeSource(parsed.source.copySpan(0, position.offset()), out);
    }

    private Parsed parseFile(Path input, OutputStream out) throws IOException {
        SourceBuffer source = readSource(input);
        ParsingCache cache = createCache(source);
        RawSyntax root = parser.parse(source, cache);

        if (cache != null) {
            List<ReuseRange> ranges = cache.computeReuseRanges();
            if (arguments.printVisualReuseInfo()) {
                writeSource(ReuseReport.renderVisual(source, ranges, colors()), out);
            }
            if (arguments.incrementalReuseLog() != null) {
                Files.write(arguments.incrementalReuseLog(), SourceBuffer.toBytes(ReuseReport.renderLog(source, ranges)));
            }
        }

        if (arguments.verifySyntaxTree()) {
            warnAboutUnknownSyntax(input, root);
        }
        return new Parsed(source, root);
    }

    private ParsingCache createCache(SourceBuffer newSource) throws IOException {
        if (arguments.oldSyntaxTreeFilename() == null) {
            return null;
        }

        RawSyntax oldTree = readSyntaxTree(arguments.oldSyntaxTreeFilename());
        SourceBuffer oldSource = SourceBuffer.of(oldTree.print());
        ParsingCache cache = new ParsingCache(oldTree);
        int delta = 0;
        for (String pattern : arguments.incrementalEdits()) {
            SourceEdit edit = SourceEdit.parse(pattern, oldSource);
            cache.addEdit(edit);
            delta += edit.delta();
        }
        cache.checkEdits();

        if (oldSource.length() + delta != newSource.length()) {
            throw new MalformedEditException(String.format(
                    "Edits change the length of the old source from %d to %d bytes, but the new source is %d bytes",
                    oldSource.length(), oldSource.length() + delta, newSource.length()));
        }
        return cache;
    }

    private void warnAboutUnknownSyntax(Path input, RawSyntax root) {
        for (PositionedToken token : SyntaxPositions.tokens(root)) {
            if (token.token().kind() == SyntaxKind.UNKNOWN) {
                LOGGER.warning(() -> String.format("%s:%s: unknown token `%s`",
                        input, token.textPosition().lineAndColumn(), token.token().text()));
            }
        }
    }

    private ColorFormatter colors() {
        return arguments.visual() ? AnsiColorFormatter.FORCE_COLOR : AnsiColorFormatter.NO_COLOR;
    }

    private static SourceBuffer readSource(Path path) throws IOException {
        return SourceBuffer.fromBytes(Files.readAllBytes(path));
    }

    private static RawSyntax readSyntaxTree(Path path) throws IOException {
        return SyntaxDeserializer.deserialize(Files.readString(path, StandardCharsets.UTF_8));
    }

    private static void writeSource(CharSequence text, OutputStream out) throws IOException {
        out.write(SourceBuffer.toBytes(text));
    }

    private static void dumpToken(RawSyntax.Token token, StringBuilder builder) {
        builder.append(token.kind().serializedName()).append(' ');
        appendQuoted(token.text(), builder);
        builder.append(" leading=");
        dumpTrivia(token.leadingTrivia(), builder);
        builder.append(" trailing=");
        dumpTrivia(token.trailingTrivia(), builder);
    }

    private static void dumpTrivia(Trivia trivia, StringBuilder builder) {
        builder.append('[');
        boolean first = true;
        for (TriviaPiece piece : trivia.pieces()) {
            if (!first) {
                builder.append(", ");
            }
            first = false;
            builder.append(piece.kind().serializedName());
            if (piece.kind().isCounted()) {
                builder.append(" x").append(piece.count());
            } else {
                builder.append(' ');
                appendQuoted(piece.text(), builder);
            }
        }
        builder.append(']');
    }

    private static void appendQuoted(String text, StringBuilder builder) {
        builder.append('"');
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            switch (c) {
                case '\n':
                    builder.append("\\n");
                    break;
                case '\r':
                    builder.append("\\r");
                    break;
                case '\t':
                    builder.append("\\t");
                    break;
                case '"':
                    builder.append("\\\"");
                    break;
                case '\\':
                    builder.append("\\\\");
                    break;
                default:
                    if (c < 0x20 || c >= 0x7f) {
                        builder.append(String.format("\\x%02X", (int) c));
                    } else {
                        builder.append(c);
                    }
            }
        }
        builder.append('"');
    }

    private static final class Parsed {
        private final SourceBuffer source;
        private final RawSyntax root;

        private Parsed(SourceBuffer source, RawSyntax root) {
            this.source = source;
            this.root = root;
        }
    }
}
