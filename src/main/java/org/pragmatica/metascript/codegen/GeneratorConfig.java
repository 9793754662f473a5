package org.pragmatica.metascript.codegen;

/**
 * Code generator configuration options.
 *
 * @param unsupported                policy for constructs a target cannot express
 * @param pythonAgentEntryPoint      function the Python target calls for {@code agent} statements
 * @param javaScriptAgentEntryPoint  function the JavaScript target calls for {@code agent} statements
 */
public record GeneratorConfig(
    UnsupportedPolicy unsupported,
    String pythonAgentEntryPoint,
    String javaScriptAgentEntryPoint
) {
    public static final GeneratorConfig DEFAULT = new GeneratorConfig(
        UnsupportedPolicy.FAIL,
        "agent_call",
        "agentCall"
    );

    public GeneratorConfig withUnsupported(UnsupportedPolicy policy) {
        return new GeneratorConfig(policy, pythonAgentEntryPoint, javaScriptAgentEntryPoint);
    }
}
