package io.callscan.source;

import io.callscan.model.FunctionDescriptor;
import org.treesitter.TSNode;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;

/**
 * Reads a function's source text together with the doc comment directly above it.
 */
public class FunctionSourceReader {

    /**
     * @param function Descriptor the text was read for
     * @param comment  Doc comment lines with comment markers removed, empty if there is none
     * @param source   Declaration text from {@code func} to the closing brace
     */
    public record FunctionSource(FunctionDescriptor function, List<String> comment, String source) {
        public FunctionSource {
            comment = List.copyOf(comment);
        }

        public String render() {
            StringBuilder sb = new StringBuilder();
            for (String line : comment) {
                sb.append("// ").append(line).append('\n');
            }
            return sb.append(source).toString();
        }
    }

    private final GoParser parser = new GoParser();

    public FunctionSource read(FunctionDescriptor function) throws SourceParseException {
        GoSourceFile file = parser.parse(function.file());
        TSNode decl = file.findFunction(function.name(), function.startLine())
            .orElseThrow(() -> new FunctionReparseException(function.file(), function.identity(),
                "declaration not found at line " + function.startLine()));
        return new FunctionSource(function, docComment(file, decl), file.text(decl));
    }

    /**
     * Comment nodes immediately preceding {@code decl}, with no blank line in between.
     */
    static List<String> docComment(GoSourceFile file, TSNode decl) {
        Deque<String> lines = new ArrayDeque<>();
        int expectedEnd = file.line(decl) - 1;
        TSNode previous = decl.getPrevNamedSibling();
        while (!GoSourceFile.isAbsent(previous)
            && GoSourceFile.COMMENT.equals(previous.getType())
            && file.endLine(previous) == expectedEnd) {
            List<String> block = stripMarkers(file.text(previous));
            for (int i = block.size() - 1; i >= 0; i--) {
                lines.addFirst(block.get(i));
            }
            expectedEnd = file.line(previous) - 1;
            previous = previous.getPrevNamedSibling();
        }
        return List.copyOf(lines);
    }

    static List<String> stripMarkers(String comment) {
        String text = comment.strip();
        if (text.startsWith("//")) {
            return List.of(text.substring(2).strip());
        }
        if (text.startsWith("/*")) {
            text = text.substring(2);
            if (text.endsWith("*/")) {
                text = text.substring(0, text.length() - 2);
            }
        }
        return text.strip().lines()
            .map(String::strip)
            .map(line -> line.startsWith("*") ? line.substring(1).strip() : line)
            .toList();
    }
}
