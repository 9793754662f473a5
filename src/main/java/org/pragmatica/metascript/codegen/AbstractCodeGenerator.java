package org.pragmatica.metascript.codegen;

import org.pragmatica.metascript.error.UnsupportedConstructError;
import org.pragmatica.metascript.macro.ExpanderConfig;
import org.pragmatica.metascript.macro.MacroExpander;
import org.pragmatica.metascript.tree.Expression;
import org.pragmatica.metascript.tree.Pattern;
import org.pragmatica.metascript.tree.Program;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.function.Function;

/**
 * Lowering steps shared by the target generators: macro expansion up front, the
 * unsupported-construct policy, counting-loop detection and match-case tests.
 */
public abstract class AbstractCodeGenerator implements CodeGenerator {
    private static final Logger LOG = LoggerFactory.getLogger(AbstractCodeGenerator.class);

    protected static final String MATCH_TEMPORARY = "__ms_match_val";

    protected final GeneratorConfig config;
    protected final ExpanderConfig expanderConfig;

    protected AbstractCodeGenerator(GeneratorConfig config, ExpanderConfig expanderConfig) {
        this.config = config;
        this.expanderConfig = expanderConfig;
    }

    /**
     * Expand macros, then lower the expanded program.
     */
    @Override
    public final String generate(Program program) {
        var expanded = MacroExpander.expand(program, expanderConfig);
        var text = lower(expanded);
        LOG.debug("Generated {} source for {} top-level statements", target(), expanded.statements().size());
        return text;
    }

    protected abstract String lower(Program expanded);

    protected abstract String placeholder(String construct);

    protected abstract String isList(String subject);

    protected abstract String hasLength(String subject, int length);

    protected abstract String isEqual(String subject, String literal);

    protected abstract String alwaysTrue();

    protected abstract String conjunction();

    /**
     * Apply the configured policy to a construct this target cannot lower.
     */
    protected void unsupported(CodeWriter writer, String construct) {
        if (config.unsupported() == UnsupportedPolicy.FAIL) {
            throw new UnsupportedConstructError(target(), construct);
        }
        LOG.warn("{} target: emitting placeholder for unsupported {}", target(), construct);
        writer.comment(placeholder(construct));
    }

    /**
     * Name of the temporary holding the subject of the {@code ordinal}-th match (1-based).
     */
    protected static String matchTemporary(int ordinal) {
        return ordinal == 1 ? MATCH_TEMPORARY : MATCH_TEMPORARY + "_" + ordinal;
    }

    /**
     * Arguments of a counting loop: an integer literal stands for {@code range(n)}; a
     * {@code range} call with one to three arguments is used as is. Empty for anything
     * that must be iterated.
     */
    protected static Optional<List<Expression>> countingRange(Expression end) {
        if (end instanceof Expression.IntLiteral) {
            return Optional.of(List.of(end));
        }
        if (end instanceof Expression.FunctionCall call
            && call.name().equals("range")
            && !call.arguments().isEmpty()
            && call.arguments().size() <= 3) {
            return Optional.of(call.arguments());
        }
        return Optional.empty();
    }

    /**
     * Condition and bindings testing one match case against the subject temporary.
     */
    protected CaseTest caseTest(Pattern pattern, String subject, Function<Expression, String> literal, CodeWriter writer) {
        var lowering = new PatternLowering(subject, literal, writer, false);
        pattern.accept(lowering);
        var condition = lowering.checks.isEmpty()
                        ? alwaysTrue()
                        : String.join(conjunction(), lowering.checks);
        return new CaseTest(condition, lowering.bindings);
    }

    protected record CaseTest(String condition, List<Binding> bindings) {}

    protected record Binding(String name, String value) {}

    private final class PatternLowering implements Pattern.Visitor<Void> {
        private final String subject;
        private final Function<Expression, String> literal;
        private final CodeWriter writer;
        private final boolean nested;
        private final List<String> checks;
        private final List<Binding> bindings;

        private PatternLowering(String subject, Function<Expression, String> literal, CodeWriter writer, boolean nested) {
            this(subject, literal, writer, nested, new ArrayList<>(), new ArrayList<>());
        }

        private PatternLowering(String subject,
                                Function<Expression, String> literal,
                                CodeWriter writer,
                                boolean nested,
                                List<String> checks,
                                List<Binding> bindings) {
            this.subject = subject;
            this.literal = literal;
            this.writer = writer;
            this.nested = nested;
            this.checks = checks;
            this.bindings = bindings;
        }

        @Override
        public Void visitWildcard(Pattern.Wildcard wildcard) {
            return null;
        }

        @Override
        public Void visitName(Pattern.NamePattern name) {
            bindings.add(new Binding(name.name(), subject));
            return null;
        }

        @Override
        public Void visitLiteral(Pattern.LiteralPattern pattern) {
            checks.add(isEqual(subject, literal.apply(pattern.literal())));
            return null;
        }

        @Override
        public Void visitList(Pattern.ListPattern list) {
            if (nested) {
                unsupported(writer, "nested list pattern");
                return null;
            }
            checks.add(isList(subject));
            checks.add(hasLength(subject, list.elements().size()));
            for (int i = 0; i < list.elements().size(); i++) {
                var element = new PatternLowering(subject + "[" + i + "]", literal, writer, true, checks, bindings);
                list.elements().get(i).accept(element);
            }
            return null;
        }
    }
}
