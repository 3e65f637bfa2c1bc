package io.callscan.source;

import org.treesitter.TSNode;
import org.treesitter.TSTree;

import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * A parsed Go file: the syntax tree plus the UTF-8 bytes its offsets refer to.
 * <p>
 * The tree is held here so its native memory outlives every node handed out.
 */
public final class GoSourceFile {

    static final String COMMENT = "comment";

    private final Path path;
    private final byte[] source;
    private final TSTree tree;
    private final TSNode root;
    private final String packageName;

    GoSourceFile(Path path, byte[] source, TSTree tree, TSNode root) {
        this.path = path;
        this.source = source;
        this.tree = tree;
        this.root = root;
        this.packageName = readPackageName();
    }

    public Path path() {
        return path;
    }

    public TSNode root() {
        return root;
    }

    public String packageName() {
        return packageName;
    }

    /**
     * Source text covered by a node.
     */
    public String text(TSNode node) {
        if (isAbsent(node)) {
            return "";
        }
        int start = node.getStartByte();
        int end = Math.min(node.getEndByte(), source.length);
        return new String(source, start, end - start, StandardCharsets.UTF_8);
    }

    /**
     * 1-based line a node starts on.
     */
    public int line(TSNode node) {
        return node.getStartPoint().getRow() + 1;
    }

    /**
     * 1-based line a node ends on.
     */
    public int endLine(TSNode node) {
        return node.getEndPoint().getRow() + 1;
    }

    /**
     * Top-level function and method declarations, in source order.
     */
    public List<TSNode> functionDeclarations() {
        List<TSNode> result = new ArrayList<>();
        for (TSNode child : namedChildren(root)) {
            String type = child.getType();
            if ("function_declaration".equals(type) || "method_declaration".equals(type)) {
                result.add(child);
            }
        }
        return result;
    }

    /**
     * The declaration of {@code name} that starts on {@code line}.
     */
    public Optional<TSNode> findFunction(String name, int line) {
        for (TSNode decl : functionDeclarations()) {
            if (line(decl) == line && name.equals(text(field(decl, "name")))) {
                return Optional.of(decl);
            }
        }
        return Optional.empty();
    }

    /**
     * Name from the package clause, empty when the file has none.
     */
    private String readPackageName() {
        for (TSNode child : namedChildren(root)) {
            if ("package_clause".equals(child.getType())) {
                for (TSNode name : namedChildren(child)) {
                    if ("package_identifier".equals(name.getType())) {
                        return text(name).trim();
                    }
                }
            }
        }
        return "";
    }

    public static boolean isAbsent(TSNode node) {
        return node == null || node.isNull();
    }

    /**
     * Child stored under a grammar field, or null.
     */
    public static TSNode field(TSNode node, String fieldName) {
        if (isAbsent(node)) {
            return null;
        }
        TSNode child = node.getChildByFieldName(fieldName);
        return isAbsent(child) ? null : child;
    }

    /**
     * Named children, comments excluded.
     */
    public static List<TSNode> namedChildren(TSNode node) {
        List<TSNode> children = new ArrayList<>();
        if (isAbsent(node)) {
            return children;
        }
        int count = node.getNamedChildCount();
        for (int i = 0; i < count; i++) {
            TSNode child = node.getNamedChild(i);
            if (!isAbsent(child) && !COMMENT.equals(child.getType())) {
                children.add(child);
            }
        }
        return children;
    }
}
