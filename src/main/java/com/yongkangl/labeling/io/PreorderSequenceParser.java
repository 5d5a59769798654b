package com.yongkangl.labeling.io;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.apache.commons.lang3.StringUtils;

public class PreorderSequenceParser {
    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final String input;

    public PreorderSequenceParser(String input) {
        this.input = input;
    }

    /**
     * Parses either a JSON array ({@code [0,1,1,2]}) or a comma / whitespace separated list
     * ({@code 0,1,1,2}) and validates the result as a pre-order traversal.
     */
    public int[] parse() {
        if (StringUtils.isBlank(input)) {
            throw new InvalidTreeDescriptionException("Empty tree description");
        }
        String trimmed = input.trim();
        int[] sequence = trimmed.startsWith("[") || trimmed.startsWith("{") || trimmed.startsWith("\"")
                ? parseJson(trimmed)
                : parseList(trimmed);
        return SequenceValidator.requireValidSequence(sequence);
    }

    private int[] parseJson(String json) {
        JsonNode root;
        try {
            root = MAPPER.readTree(json);
        } catch (JsonProcessingException e) {
            throw new InvalidTreeDescriptionException("Malformed tree description: " + json, e);
        }
        if (root == null || !root.isArray()) {
            throw new InvalidTreeDescriptionException("Tree description should be an array: " + json);
        }
        int[] sequence = new int[root.size()];
        for (int i = 0; i < root.size(); i++) {
            JsonNode element = root.get(i);
            if (!element.isIntegralNumber() || !element.canConvertToInt()) {
                throw new InvalidTreeDescriptionException("Depth at position " + i + " is not an integer: " + element);
            }
            sequence[i] = element.intValue();
        }
        return sequence;
    }

    private int[] parseList(String list) {
        String[] tokens = StringUtils.split(list, ", \t");
        int[] sequence = new int[tokens.length];
        for (int i = 0; i < tokens.length; i++) {
            try {
                sequence[i] = Integer.parseInt(tokens[i]);
            } catch (NumberFormatException e) {
                throw new InvalidTreeDescriptionException("Depth at position " + i + " is not an integer: " + tokens[i], e);
            }
        }
        return sequence;
    }

    public static int parseAlphabetSize(String value) {
        int maxLabel;
        try {
            maxLabel = Integer.parseInt(StringUtils.trimToEmpty(value));
        } catch (NumberFormatException e) {
            throw new InvalidAlphabetSizeException("maxLabel should be a positive integer, got '" + value + "'", e);
        }
        return SequenceValidator.requireValidAlphabetSize(maxLabel);
    }
}
