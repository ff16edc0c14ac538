package io.github.loregraph.index;

import com.fasterxml.jackson.databind.JsonNode;
import org.jetbrains.annotations.Nullable;

import java.util.function.Consumer;

/**
 * Recursive traversal helpers over untyped front-matter values.
 *
 * <p>Values are treated as a tagged variant on {@link com.fasterxml.jackson.databind.node.JsonNodeType}:
 * strings, arrays and objects are visited; numbers, booleans and nulls are leaves without text.</p>
 */
public final class FrontmatterWalker {

    private FrontmatterWalker() {
    }

    /**
     * Visits every string reachable from {@code node}, descending into array elements and object values.
     */
    public static void forEachString(@Nullable JsonNode node, Consumer<String> visitor) {
        if (node == null) {
            return;
        }
        switch (node.getNodeType()) {
            case STRING -> visitor.accept(node.textValue());
            case ARRAY, OBJECT -> {
                for (JsonNode child : node) {
                    forEachString(child, visitor);
                }
            }
            default -> {
                // numbers, booleans and nulls carry no references
            }
        }
    }

    /**
     * Visits strings in {@code node} and in nested arrays, ignoring objects.
     */
    public static void forEachListedString(@Nullable JsonNode node, Consumer<String> visitor) {
        if (node == null) {
            return;
        }
        if (node.isTextual()) {
            visitor.accept(node.textValue());
        } else if (node.isArray()) {
            for (JsonNode child : node) {
                forEachListedString(child, visitor);
            }
        }
    }

    /**
     * Returns the first value under {@code keys} that is truthy: a non-empty string, a non-zero
     * number, {@code true}, an array or an object.
     */
    @Nullable
    public static JsonNode firstTruthy(JsonNode object, String... keys) {
        for (String key : keys) {
            JsonNode value = object.get(key);
            if (isTruthy(value)) {
                return value;
            }
        }
        return null;
    }

    public static boolean isTruthy(@Nullable JsonNode value) {
        if (value == null) {
            return false;
        }
        return switch (value.getNodeType()) {
            case STRING -> !value.textValue().isEmpty();
            case NUMBER -> value.doubleValue() != 0 && !Double.isNaN(value.doubleValue());
            case BOOLEAN -> value.booleanValue();
            case ARRAY, OBJECT, POJO, BINARY -> true;
            default -> false;
        };
    }

    /**
     * Numeric reading of a confidence-like value.
     *
     * @return the number, {@code 0} for explicit nulls and empty strings, or {@code null} when the
     * value is absent or not numeric
     */
    @Nullable
    public static Double toNumber(@Nullable JsonNode value) {
        if (value == null || value.isMissingNode()) {
            return null;
        }
        switch (value.getNodeType()) {
            case NULL:
                return 0.0;
            case NUMBER:
                return value.doubleValue();
            case BOOLEAN:
                return value.booleanValue() ? 1.0 : 0.0;
            case STRING:
                String text = value.textValue().trim();
                if (text.isEmpty()) {
                    return 0.0;
                }
                try {
                    double parsed = Double.parseDouble(text);
                    return Double.isNaN(parsed) ? null : parsed;
                } catch (NumberFormatException e) {
                    return null;
                }
            default:
                return null;
        }
    }
}
