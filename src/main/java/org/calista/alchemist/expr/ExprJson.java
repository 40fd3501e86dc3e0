package org.calista.alchemist.expr;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * ExprJson — node (de)serialization on the Jackson tree model.
 *
 * <pre>
 * leaf      -> "12"
 * operator  -> {"operator": "+", "children": [ ... ]}      ("u-" for negation)
 * entries   -> [["6", {...}], ["-6", {...}], ...]
 * </pre>
 *
 * Deserialization rebuilds nodes through {@link Expr#of(Operator, Expr...)}, so sign
 * normalization applies again.
 */
public final class ExprJson {

    public static final String OPERATOR = "operator";
    public static final String CHILDREN = "children";

    private static final JsonNodeFactory F = JsonNodeFactory.instance;

    private ExprJson() {
    }

    public static JsonNode toJson(Expr expr) {
        Objects.requireNonNull(expr, "expr");
        if (expr.isLeaf()) return F.textNode(expr.numeral());

        ObjectNode o = F.objectNode();
        o.put(OPERATOR, expr.operator().symbol());
        ArrayNode children = o.putArray(CHILDREN);
        for (Expr child : expr.children()) children.add(toJson(child));
        return o;
    }

    /**
     * @throws SerializationException on any shape other than a numeral or an operator object
     */
    public static Expr fromJson(JsonNode json) {
        if (json == null || json.isNull() || json.isMissingNode()) {
            throw new SerializationException("Missing node");
        }
        if (json.isTextual() || json.isIntegralNumber()) {
            String numeral = json.asText();
            try {
                return Expr.number(numeral);
            } catch (IllegalArgumentException e) {
                throw new SerializationException("Bad numeral: '" + numeral + "'", e);
            }
        }
        if (!json.isObject()) throw new SerializationException("Unrecognized node shape: " + json.getNodeType());

        JsonNode opNode = json.get(OPERATOR);
        JsonNode childrenNode = json.get(CHILDREN);
        if (opNode == null || !opNode.isTextual()) throw new SerializationException("Missing '" + OPERATOR + "'");
        if (childrenNode == null || !childrenNode.isArray()) throw new SerializationException("Missing '" + CHILDREN + "'");

        Operator op = Operator.fromSymbol(opNode.asText());
        if (childrenNode.size() != op.arity()) {
            throw new SerializationException(op.symbol() + " expects " + op.arity() + " children, got " + childrenNode.size());
        }
        Expr[] children = new Expr[childrenNode.size()];
        for (int i = 0; i < children.length; i++) children[i] = fromJson(childrenNode.get(i));
        return Expr.of(op, children);
    }

    public static ArrayNode entriesToJson(Map<String, Expr> entries) {
        Objects.requireNonNull(entries, "entries");
        ArrayNode out = F.arrayNode();
        for (Map.Entry<String, Expr> e : entries.entrySet()) {
            out.add(entryToJson(e.getKey(), e.getValue()));
        }
        return out;
    }

    public static ArrayNode entryToJson(String key, Expr expr) {
        ArrayNode pair = F.arrayNode();
        pair.add(Objects.requireNonNull(key, "key"));
        pair.add(toJson(expr));
        return pair;
    }

    /** Insertion-ordered value -> node map. */
    public static Map<String, Expr> entriesFromJson(JsonNode json) {
        if (json == null || !json.isArray()) throw new SerializationException("Entries must be an array");
        Map<String, Expr> out = new LinkedHashMap<>();
        for (JsonNode pair : json) {
            Map.Entry<String, Expr> e = entryFromJson(pair);
            out.put(e.getKey(), e.getValue());
        }
        return out;
    }

    public static Map.Entry<String, Expr> entryFromJson(JsonNode pair) {
        if (pair == null || !pair.isArray() || pair.size() != 2 || !pair.get(0).isTextual()) {
            throw new SerializationException("Entry must be [value, node]");
        }
        return Map.entry(pair.get(0).asText(), fromJson(pair.get(1)));
    }
}
