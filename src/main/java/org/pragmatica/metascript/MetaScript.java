package org.pragmatica.metascript;

import org.pragmatica.metascript.codegen.GeneratorConfig;
import org.pragmatica.metascript.codegen.JavaScriptGenerator;
import org.pragmatica.metascript.codegen.PythonGenerator;
import org.pragmatica.metascript.codegen.UnsupportedPolicy;
import org.pragmatica.metascript.codegen.Unparser;
import org.pragmatica.metascript.macro.ExpanderConfig;
import org.pragmatica.metascript.macro.MacroExpander;
import org.pragmatica.metascript.parser.Layout;
import org.pragmatica.metascript.parser.Parser;
import org.pragmatica.metascript.parser.ParserConfig;
import org.pragmatica.metascript.tree.Program;

/**
 * Entry point for compiling MetaScript.
 *
 * <p>Example usage:
 * <pre>{@code
 * var compiler = MetaScript.create();
 * var python = compiler.toPython("""
 *     macro twice(x):
 *         say x
 *         say x
 *     @twice("Hi")
 *     """);
 * }</pre>
 *
 * <p>Instances are immutable and may be shared between threads.
 */
public final class MetaScript {
    private final ParserConfig parserConfig;
    private final ExpanderConfig expanderConfig;
    private final PythonGenerator python;
    private final JavaScriptGenerator javaScript;

    private MetaScript(ParserConfig parserConfig, ExpanderConfig expanderConfig, GeneratorConfig generatorConfig) {
        this.parserConfig = parserConfig;
        this.expanderConfig = expanderConfig;
        this.python = PythonGenerator.create(generatorConfig, expanderConfig);
        this.javaScript = JavaScriptGenerator.create(generatorConfig, expanderConfig);
    }

    /**
     * Compiler with default configuration: block layout, expansion depth 64, failing on
     * unsupported constructs.
     */
    public static MetaScript create() {
        return new MetaScript(ParserConfig.DEFAULT, ExpanderConfig.DEFAULT, GeneratorConfig.DEFAULT);
    }

    public Program parse(String source) {
        return Parser.parse(source, parserConfig);
    }

    public Program expand(Program program) {
        return MacroExpander.expand(program, expanderConfig);
    }

    /**
     * Parse and expand.
     */
    public Program expand(String source) {
        return expand(parse(source));
    }

    public String toPython(String source) {
        return python.generate(parse(source));
    }

    public String toPython(Program program) {
        return python.generate(program);
    }

    public String toJavaScript(String source) {
        return javaScript.generate(parse(source));
    }

    public String toJavaScript(Program program) {
        return javaScript.generate(program);
    }

    public String unparse(Program program) {
        return Unparser.unparse(program);
    }

    /**
     * Create a builder for more complex compiler configuration.
     */
    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private Layout layout = Layout.BLOCK;
        private int maxExpansionDepth = ExpanderConfig.DEFAULT.maxDepth();
        private UnsupportedPolicy unsupported = UnsupportedPolicy.FAIL;
        private String pythonAgentEntryPoint = GeneratorConfig.DEFAULT.pythonAgentEntryPoint();
        private String javaScriptAgentEntryPoint = GeneratorConfig.DEFAULT.javaScriptAgentEntryPoint();

        private Builder() {}

        public Builder layout(Layout layout) {
            this.layout = layout;
            return this;
        }

        public Builder maxExpansionDepth(int depth) {
            this.maxExpansionDepth = depth;
            return this;
        }

        public Builder unsupported(UnsupportedPolicy policy) {
            this.unsupported = policy;
            return this;
        }

        public Builder pythonAgentEntryPoint(String name) {
            this.pythonAgentEntryPoint = name;
            return this;
        }

        public Builder javaScriptAgentEntryPoint(String name) {
            this.javaScriptAgentEntryPoint = name;
            return this;
        }

        public MetaScript build() {
            return new MetaScript(new ParserConfig(layout),
                                  new ExpanderConfig(maxExpansionDepth),
                                  new GeneratorConfig(unsupported, pythonAgentEntryPoint, javaScriptAgentEntryPoint));
        }
    }
}
