package org.calista.alchemist.expr;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.calista.alchemist.number.Rational;
import org.junit.Assert;
import org.junit.Test;

import java.util.LinkedHashMap;
import java.util.Map;

public class ExprJsonTest {

    private final ObjectMapper mapper = new ObjectMapper();

    @Test
    public void leafIsBareNumeral() {
        JsonNode json = ExprJson.toJson(Expr.number("12"));
        Assert.assertTrue(json.isTextual());
        Assert.assertEquals("12", json.asText());
    }

    @Test
    public void operatorShape() throws Exception {
        Expr e = Expr.of(Operator.MULTIPLY, Expr.number("2"), Expr.of(Operator.ADD, Expr.number("1"), Expr.number("3")));
        Assert.assertEquals(
                "{\"operator\":\"*\",\"children\":[\"2\",{\"operator\":\"+\",\"children\":[\"1\",\"3\"]}]}",
                mapper.writeValueAsString(ExprJson.toJson(e)));

        JsonNode neg = ExprJson.toJson(Expr.negate(Expr.number("5")));
        Assert.assertEquals("u-", neg.get("operator").asText());
    }

    @Test
    public void readBackKeepsRenderingAndValue() throws Exception {
        Expr e = Expr.of(Operator.SUBTRACT,
                Expr.of(Operator.POWER, Expr.number("2"), Expr.number("10")),
                Expr.negate(Expr.of(Operator.MODULO, Expr.number("7"), Expr.number("3"))));
        Expr back = ExprJson.fromJson(mapper.readTree(mapper.writeValueAsString(ExprJson.toJson(e))));
        Assert.assertEquals(e.render(), back.render());
        Assert.assertEquals(e.evaluate(), back.evaluate());
    }

    @Test
    public void normalizationReappliesOnRead() throws Exception {
        JsonNode json = mapper.readTree(
                "{\"operator\":\"+\",\"children\":[\"1\",{\"operator\":\"u-\",\"children\":[{\"operator\":\"u-\",\"children\":[{\"operator\":\"u-\",\"children\":[\"2\"]}]}]}]}");
        Expr e = ExprJson.fromJson(json);
        Assert.assertEquals(Operator.SUBTRACT, e.operator());
        Assert.assertEquals("1-2", e.render());
    }

    @Test
    public void malformedShapesAreRejected() throws Exception {
        String[] bad = {
                "null",
                "true",
                "[1,2]",
                "{\"children\":[\"1\"]}",
                "{\"operator\":\"+\"}",
                "{\"operator\":\"?\",\"children\":[\"1\",\"2\"]}",
                "{\"operator\":\"+\",\"children\":[\"1\"]}",
                "{\"operator\":\"u-\",\"children\":[\"x\"]}",
                "\"1+1\"",
        };
        for (String s : bad) {
            try {
                ExprJson.fromJson(mapper.readTree(s));
                Assert.fail("accepted " + s);
            } catch (SerializationException expected) {
                Assert.assertNotNull(expected.getMessage());
            }
        }
    }

    @Test
    public void entriesAreOrderedPairs() throws Exception {
        Map<String, Expr> m = new LinkedHashMap<>();
        m.put("3", Expr.of(Operator.ADD, Expr.number("1"), Expr.number("2")));
        m.put("-3", Expr.negate(m.get("3")));
        m.put("12", Expr.number("12"));

        JsonNode json = ExprJson.entriesToJson(m);
        Assert.assertEquals(3, json.size());
        Assert.assertEquals("3", json.get(0).get(0).asText());
        Assert.assertEquals("-3", json.get(1).get(0).asText());

        Map<String, Expr> back = ExprJson.entriesFromJson(mapper.readTree(mapper.writeValueAsString(json)));
        Assert.assertArrayEquals(new Object[]{"3", "-3", "12"}, back.keySet().toArray());
        Assert.assertEquals("-(1+2)", back.get("-3").render());
        Assert.assertEquals(Rational.of(12), back.get("12").evaluate());
    }

    @Test(expected = SerializationException.class)
    public void entryMustBePair() throws Exception {
        ExprJson.entriesFromJson(mapper.readTree("[[\"3\"]]"));
    }
}
