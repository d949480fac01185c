package co.fanki.reexportmap.analysis.domain.python;

import co.fanki.reexportmap.analysis.domain.ExportExtractor;
import co.fanki.reexportmap.analysis.domain.ExtractionResult;
import co.fanki.reexportmap.analysis.domain.ImportBinding;
import co.fanki.reexportmap.analysis.domain.SourceSyntaxException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.treesitter.TSNode;
import org.treesitter.TSParser;
import org.treesitter.TSTree;
import org.treesitter.TreeSitterPython;

import java.nio.charset.StandardCharsets;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Set;

/**
 * Python implementation of {@link ExportExtractor}, backed by the
 * tree-sitter Python grammar.
 *
 * <p>A module whose syntax tree holds an error or missing node is
 * rejected with a {@link SourceSyntaxException}. Otherwise the tree is
 * walked once, collecting:</p>
 * <ul>
 *   <li>{@code from <upstream>[.sub] import name [as alias]} bindings, at
 *       any depth, including {@code def} and {@code class} bodies.
 *       Relative and star imports are ignored.</li>
 *   <li>String literals of list or tuple displays assigned to
 *       {@code __all__}, through plain, chained, annotated or {@code +=}
 *       assignments. Repeated assignments append to the list.</li>
 * </ul>
 *
 * <p>{@code __all__} assignments count only outside {@code def} and
 * {@code class} bodies; module-level {@code if}, {@code try},
 * {@code with} and loop blocks are visited.</p>
 *
 * <p>Elements of {@code __all__} that are not string literals (names,
 * calls, f-strings, starred expressions) are skipped: lists built at
 * runtime are under-approximated.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public class PythonExportExtractor extends ExportExtractor {

    private static final Logger LOG = LoggerFactory.getLogger(
            PythonExportExtractor.class);

    /** The module-level name that declares the public surface. */
    static final String PUBLIC_EXPORTS = "__all__";

    private static final String BYTE_ORDER_MARK = "\uFEFF";

    /** Nodes whose bodies bind local names. */
    private static final Set<String> LOCAL_SCOPES = Set.of(
            "function_definition", "class_definition");

    /** Displays whose elements may declare exports. */
    private static final Set<String> SEQUENCES = Set.of(
            "list", "tuple", "expression_list");

    /**
     * Creates an extractor for imports from the given upstream package.
     *
     * @param upstreamPackage the upstream package identifier
     */
    public PythonExportExtractor(final String upstreamPackage) {
        super(upstreamPackage);
    }

    /** {@inheritDoc} */
    @Override
    public String language() {
        return "python";
    }

    /** {@inheritDoc} */
    @Override
    public ExtractionResult extract(final String source) {
        final String text = source.startsWith(BYTE_ORDER_MARK)
                ? source.substring(1) : source;

        // TSParser is not thread safe, one per call.
        final TSParser parser = new TSParser();
        if (!parser.setLanguage(new TreeSitterPython())) {
            throw new IllegalStateException(
                    "Cannot load the tree-sitter Python grammar");
        }
        final TSTree tree = parser.parseString(null, text);
        final TSNode root = tree.getRootNode();

        final byte[] bytes = text.getBytes(StandardCharsets.UTF_8);
        checkSyntax(root, bytes);

        final Collector collector = new Collector(bytes);
        collector.visit(root, true);
        return new ExtractionResult(collector.bindings, collector.exports);
    }

    /**
     * Rejects trees with error or missing nodes, and implicit
     * concatenations that mix bytes and text literals.
     */
    private static void checkSyntax(final TSNode root, final byte[] bytes) {
        final Deque<TSNode> pending = new ArrayDeque<>();
        pending.push(root);
        while (!pending.isEmpty()) {
            final TSNode node = pending.pop();
            if ("ERROR".equals(node.getType()) || node.isMissing()) {
                throw syntaxError("invalid syntax", node);
            }
            if ("concatenated_string".equals(node.getType())
                    && mixesBytesAndText(node, bytes)) {
                throw syntaxError("cannot mix bytes and nonbytes literals",
                        node);
            }
            for (int i = node.getChildCount() - 1; i >= 0; i--) {
                pending.push(node.getChild(i));
            }
        }
        if (root.hasError()) {
            throw syntaxError("invalid syntax", root);
        }
    }

    private static boolean mixesBytesAndText(final TSNode concatenation,
            final byte[] bytes) {
        boolean sawBytes = false;
        boolean sawText = false;
        for (int i = 0; i < concatenation.getNamedChildCount(); i++) {
            final TSNode part = concatenation.getNamedChild(i);
            if (!"string".equals(part.getType())) {
                continue;
            }
            if (PythonStringLiteral.kindOf(textOf(part, bytes))
                    == PythonStringLiteral.Kind.BYTES) {
                sawBytes = true;
            } else {
                sawText = true;
            }
        }
        return sawBytes && sawText;
    }

    private static SourceSyntaxException syntaxError(final String reason,
            final TSNode node) {
        return new SourceSyntaxException(reason,
                node.getStartPoint().getRow() + 1,
                node.getStartPoint().getColumn() + 1);
    }

    /** Returns the source text a node spans. */
    private static String textOf(final TSNode node, final byte[] bytes) {
        return new String(bytes, node.getStartByte(),
                node.getEndByte() - node.getStartByte(),
                StandardCharsets.UTF_8);
    }

    /** Collects bindings and exports while walking the tree once. */
    private final class Collector {

        private final byte[] bytes;

        private final List<ImportBinding> bindings = new ArrayList<>();

        private final List<String> exports = new ArrayList<>();

        private Collector(final byte[] theBytes) {
            bytes = theBytes;
        }

        private void visit(final TSNode node, final boolean moduleLevel) {
            final String type = node.getType();
            if ("import_from_statement".equals(type)) {
                visitImportFrom(node);
                return;
            }
            if ("expression_statement".equals(type)) {
                if (moduleLevel) {
                    visitExpressionStatement(node);
                }
                return;
            }
            final boolean childrenAtModuleLevel = moduleLevel
                    && !LOCAL_SCOPES.contains(type);
            for (int i = 0; i < node.getNamedChildCount(); i++) {
                visit(node.getNamedChild(i), childrenAtModuleLevel);
            }
        }

        private void visitImportFrom(final TSNode statement) {
            final TSNode moduleNode = statement.getChildByFieldName(
                    "module_name");
            if (moduleNode == null || moduleNode.isNull()
                    || !"dotted_name".equals(moduleNode.getType())
                    || isStarImport(statement)) {
                return;
            }
            final String module = dottedName(moduleNode);
            if (!isUpstream(module)) {
                return;
            }
            final int line = statement.getStartPoint().getRow() + 1;
            // the first named child is the module name
            for (int i = 1; i < statement.getNamedChildCount(); i++) {
                final TSNode imported = statement.getNamedChild(i);
                final ImportBinding binding;
                if ("dotted_name".equals(imported.getType())) {
                    final String name = dottedName(imported);
                    binding = new ImportBinding(name, module, name);
                } else if ("aliased_import".equals(imported.getType())) {
                    binding = new ImportBinding(
                            textOf(imported.getChildByFieldName("alias"),
                                    bytes),
                            module,
                            dottedName(imported.getChildByFieldName("name")));
                } else {
                    continue;
                }
                if (binding.isAliased()) {
                    LOG.debug("Line {}: {}.{} imported as {}", line,
                            binding.originModule(), binding.originalName(),
                            binding.localName());
                }
                bindings.add(binding);
            }
        }

        private boolean isStarImport(final TSNode statement) {
            for (int i = 0; i < statement.getNamedChildCount(); i++) {
                if ("wildcard_import".equals(
                        statement.getNamedChild(i).getType())) {
                    return true;
                }
            }
            return false;
        }

        /** Joins the identifiers of a dotted name, dropping whitespace. */
        private String dottedName(final TSNode node) {
            final StringBuilder name = new StringBuilder();
            for (int i = 0; i < node.getNamedChildCount(); i++) {
                final TSNode part = node.getNamedChild(i);
                if (!"identifier".equals(part.getType())) {
                    continue;
                }
                if (name.length() > 0) {
                    name.append('.');
                }
                name.append(textOf(part, bytes));
            }
            return name.toString();
        }

        private void visitExpressionStatement(final TSNode statement) {
            for (int i = 0; i < statement.getNamedChildCount(); i++) {
                final TSNode child = statement.getNamedChild(i);
                if ("assignment".equals(child.getType())) {
                    visitAssignment(child);
                } else if ("augmented_assignment".equals(child.getType())) {
                    visitAugmentedAssignment(child);
                }
            }
        }

        /** Plain, annotated and chained assignments. */
        private void visitAssignment(final TSNode assignment) {
            boolean exportsTarget = false;
            TSNode current = assignment;
            while ("assignment".equals(current.getType())) {
                exportsTarget |= isPublicExports(
                        current.getChildByFieldName("left"));
                final TSNode right = current.getChildByFieldName("right");
                if (right == null || right.isNull()) {
                    // annotation without a value
                    return;
                }
                current = right;
            }
            if (exportsTarget) {
                collectExports(current, assignment);
            }
        }

        private void visitAugmentedAssignment(final TSNode assignment) {
            if (!isPublicExports(assignment.getChildByFieldName("left"))) {
                return;
            }
            final TSNode operator = assignment.getChildByFieldName(
                    "operator");
            if (operator == null || operator.isNull()
                    || !"+=".equals(textOf(operator, bytes))) {
                return;
            }
            collectExports(assignment.getChildByFieldName("right"),
                    assignment);
        }

        private boolean isPublicExports(final TSNode target) {
            return target != null && !target.isNull()
                    && "identifier".equals(target.getType())
                    && PUBLIC_EXPORTS.equals(textOf(target, bytes));
        }

        private void collectExports(final TSNode value,
                final TSNode statement) {
            final int line = statement.getStartPoint().getRow() + 1;
            final TSNode sequence = unwrapParentheses(value);
            if (!SEQUENCES.contains(sequence.getType())) {
                LOG.debug("Skipping non-literal {} on line {}",
                        PUBLIC_EXPORTS, line);
                return;
            }
            for (int i = 0; i < sequence.getNamedChildCount(); i++) {
                final TSNode element = sequence.getNamedChild(i);
                if ("comment".equals(element.getType())) {
                    continue;
                }
                final String literal = stringValue(unwrapParentheses(
                        element));
                if (literal != null) {
                    exports.add(literal);
                } else {
                    LOG.debug("Skipping non-literal {} element on line {}",
                            PUBLIC_EXPORTS, line);
                }
            }
        }

        private TSNode unwrapParentheses(final TSNode node) {
            TSNode current = node;
            while ("parenthesized_expression".equals(current.getType())
                    && current.getNamedChildCount() > 0) {
                current = firstNonComment(current);
            }
            return current;
        }

        private TSNode firstNonComment(final TSNode node) {
            for (int i = 0; i < node.getNamedChildCount(); i++) {
                final TSNode child = node.getNamedChild(i);
                if (!"comment".equals(child.getType())) {
                    return child;
                }
            }
            return node.getNamedChild(0);
        }

        /**
         * Returns the value of a text string literal, or null for anything
         * else, bytes and f-strings included.
         */
        private String stringValue(final TSNode node) {
            if ("string".equals(node.getType())) {
                final String raw = textOf(node, bytes);
                return PythonStringLiteral.kindOf(raw)
                        == PythonStringLiteral.Kind.TEXT
                        ? PythonStringLiteral.decode(raw) : null;
            }
            if (!"concatenated_string".equals(node.getType())) {
                return null;
            }
            final StringBuilder value = new StringBuilder();
            for (int i = 0; i < node.getNamedChildCount(); i++) {
                final TSNode part = node.getNamedChild(i);
                if (!"string".equals(part.getType())) {
                    continue;
                }
                final String partValue = stringValue(part);
                if (partValue == null) {
                    return null;
                }
                value.append(partValue);
            }
            return value.toString();
        }
    }

}
