package com.openforge.streamkit.llm.stream;

import java.util.Map;

/**
 * Per-tool handling rules for provider-executed ("server") tools.
 *
 * Keeps vendor naming quirks out of the session state machine:
 *
 *   raw name                     displayed as      argument framing
 *   ───────────────────────────  ────────────────  ──────────────────────────────
 *   bash_code_execution          code_execution    inject {"type":"bash_code_execution",
 *   text_editor_code_execution   code_execution    inject {"type":"text_editor_code_execution",
 *   anything else                unchanged         none
 *
 * The code-execution sub-tools stream their input without a type
 * discriminator; injecting it lets the assembled arguments decode as one
 * tagged union under the public "code_execution" name.
 */
public final class ServerToolRegistry {

    /** How one raw provider tool is surfaced. */
    public record ServerToolStrategy(String displayName, boolean injectTypeDiscriminator) {}

    private static final String CODE_EXECUTION = "code_execution";

    private static final Map<String, ServerToolStrategy> STRATEGIES = Map.of(
            "bash_code_execution",        new ServerToolStrategy(CODE_EXECUTION, true),
            "text_editor_code_execution", new ServerToolStrategy(CODE_EXECUTION, true)
    );

    private ServerToolRegistry() {}

    public static ServerToolStrategy strategyFor(String providerToolName) {
        ServerToolStrategy strategy = providerToolName == null ? null : STRATEGIES.get(providerToolName);
        return strategy != null ? strategy : new ServerToolStrategy(providerToolName, false);
    }

    public static String displayName(String providerToolName) {
        return strategyFor(providerToolName).displayName();
    }
}
