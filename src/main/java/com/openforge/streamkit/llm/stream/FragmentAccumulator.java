package com.openforge.streamkit.llm.stream;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectReader;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Appends input_json_delta fragments to tool-call blocks and turns the
 * finished buffer into an argument map.
 *
 * Empty fragments are skipped, never appended: providers use an empty first
 * delta to signal that the opening character of the payload is being
 * replaced, and the discriminator rewrite below must only see real content.
 */
public class FragmentAccumulator {

    private static final TypeReference<LinkedHashMap<String, Object>> ARGUMENTS_TYPE =
            new TypeReference<>() {};

    /** Rejects content after the closing brace. */
    private final ObjectReader argumentsReader;

    public FragmentAccumulator(ObjectMapper objectMapper) {
        this.argumentsReader = objectMapper.readerFor(ARGUMENTS_TYPE)
                .with(DeserializationFeature.FAIL_ON_TRAILING_TOKENS);
    }

    /**
     * Appends one fragment to a buffering block.
     *
     * @return false when the fragment was empty and skipped
     */
    public boolean append(BlockState block, String fragment) {
        if (fragment == null || fragment.isEmpty()) return false;

        String piece = fragment;
        if (block.isFirstFragment()
                && block.getKind() == BlockKind.PROVIDER_TOOL_CALL
                && piece.charAt(0) == '{'
                && ServerToolRegistry.strategyFor(block.getProviderToolName()).injectTypeDiscriminator()) {
            piece = "{\"type\":\"" + block.getProviderToolName() + "\"," + piece.substring(1);
        }
        block.append(piece);
        return true;
    }

    /**
     * Parses the accumulated buffer as exactly one JSON object. An empty
     * buffer is an empty argument map.
     *
     * @throws StreamDecodeException if the buffer is not a single JSON object
     */
    public Map<String, Object> finish(BlockState block) {
        String json = block.bufferedText();
        if (json.isBlank()) return new LinkedHashMap<>();
        try {
            Map<String, Object> arguments = argumentsReader.readValue(json);
            if (arguments == null) {
                throw StreamDecodeException.malformedToolArguments(block.getToolName(),
                        new IllegalArgumentException("arguments are JSON null"));
            }
            return arguments;
        } catch (JsonProcessingException e) {
            throw StreamDecodeException.malformedToolArguments(block.getToolName(), e);
        }
    }
}
