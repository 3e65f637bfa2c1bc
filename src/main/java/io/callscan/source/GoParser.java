package io.callscan.source;

import org.treesitter.TSNode;
import org.treesitter.TSParser;
import org.treesitter.TSTree;
import org.treesitter.TreeSitterGo;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Parses Go files with tree-sitter.
 * <p>
 * TSParser is not thread-safe: each worker task creates its own GoParser.
 */
public class GoParser {

    private final TSParser parser;

    public GoParser() {
        this.parser = new TSParser();
        if (!parser.setLanguage(new TreeSitterGo())) {
            throw new IllegalStateException("Failed to load the tree-sitter Go grammar");
        }
    }

    /**
     * Reads and parses a file.
     *
     * @throws SourceParseException if the file cannot be read, has syntax errors or lacks a package clause
     */
    public GoSourceFile parse(Path file) throws SourceParseException {
        byte[] raw;
        try {
            raw = Files.readAllBytes(file);
        } catch (IOException e) {
            throw new SourceParseException(file, "cannot read file: " + e.getMessage(), e);
        }
        return parse(file, new String(raw, StandardCharsets.UTF_8));
    }

    /**
     * Parses source text that claims to come from {@code file}.
     */
    public GoSourceFile parse(Path file, String text) throws SourceParseException {
        // Re-encode so byte offsets match even when the input held malformed UTF-8
        byte[] source = text.getBytes(StandardCharsets.UTF_8);
        TSTree tree = parser.parseString(null, text);
        TSNode root = tree.getRootNode();
        if (GoSourceFile.isAbsent(root)) {
            throw new SourceParseException(file, "parser produced no syntax tree");
        }
        if (root.hasError()) {
            throw new SourceParseException(file, "syntax error at line " + (firstErrorRow(root) + 1));
        }

        GoSourceFile parsed = new GoSourceFile(file, source, tree, root);
        if (parsed.packageName().isEmpty()) {
            throw new SourceParseException(file, "missing package clause");
        }
        return parsed;
    }

    /**
     * Descends towards the innermost node carrying an error.
     */
    private static int firstErrorRow(TSNode node) {
        TSNode current = node;
        boolean descended = true;
        while (descended) {
            descended = false;
            int count = current.getChildCount();
            for (int i = 0; i < count; i++) {
                TSNode child = current.getChild(i);
                if (!GoSourceFile.isAbsent(child) && child.hasError()) {
                    current = child;
                    descended = true;
                    break;
                }
            }
        }
        return current.getStartPoint().getRow();
    }
}
