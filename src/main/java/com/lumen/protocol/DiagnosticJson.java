package com.lumen.protocol;

import java.util.Locale;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.lumen.script.RunResult;
import com.lumen.script.parser.Diagnostic;

/**
 * JSON view of a {@link RunResult} for hosts that talk to the engine over a wire.
 *
 * <pre>
 * {"status":"compile_error","diagnostics":[{"category":"syntax","line":3,"where":" at ';'",
 *   "message":"Expect expression.","text":"[line 3] Error at ';': Expect expression."}]}
 * </pre>
 */
public final class DiagnosticJson {
    private static final ObjectMapper om = new ObjectMapper();

    private DiagnosticJson() {}

    public static ObjectNode toNode(RunResult result) {
        if (result == null) throw new IllegalArgumentException("result must not be null");

        ObjectNode root = om.createObjectNode();
        root.put("status", lower(result.status().name()));

        ArrayNode diagnostics = om.createArrayNode();
        for (Diagnostic d : result.diagnostics()) {
            diagnostics.add(toNode(d));
        }
        root.set("diagnostics", diagnostics);
        return root;
    }

    public static ObjectNode toNode(Diagnostic d) {
        ObjectNode n = om.createObjectNode();
        n.put("category", lower(d.category().name()));
        n.put("line", d.line());
        n.put("where", d.where());
        n.put("message", d.message());
        n.put("text", d.toString());
        return n;
    }

    public static String toJson(RunResult result) {
        try {
            return om.writeValueAsString(toNode(result));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("failed to serialise run result", e);
        }
    }

    private static String lower(String enumName) {
        return enumName.toLowerCase(Locale.ROOT);
    }
}
