package com.qmigrate.script;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.qmigrate.script.scope.Operation;
import com.qmigrate.script.scope.Scope;

/**
 * JSON view of a loaded project's scope tree.
 *
 * <pre>
 * { "file": "app.pro", "template": "app", "target": "app",
 *   "scope": { "id": 0, "file": ..., "condition": ..., "totalCondition": ...,
 *              "operations": { "KEY": [ "=(\"a\")", ... ] },
 *              "children": [ ... ], "includes": [ ... ] },
 *   "subprojects": [ { "name": ..., "condition": ..., "removal": false, "project": {...} } ] }
 * </pre>
 */
public final class ScopeJson {

    private static final ObjectMapper om = new ObjectMapper();

    private ScopeJson() {}

    public static ObjectNode toJson(Project project) {
        ObjectNode out = om.createObjectNode();
        Scope root = project.root();
        out.put("file", project.file().getFileName().toString());
        out.put("template", root.template());
        out.put("target", root.target());
        out.put("example", project.isExample());
        out.set("scope", toJson(root));

        ArrayNode subs = out.putArray("subprojects");
        for (Subproject sp : project.subprojects()) {
            ObjectNode s = subs.addObject();
            s.put("name", sp.name());
            s.put("condition", sp.condition());
            s.put("removal", sp.isRemoval());
            if (sp.project() != null) s.set("project", toJson(sp.project()));
        }
        return out;
    }

    public static ObjectNode toJson(Scope scope) {
        ObjectNode n = om.createObjectNode();
        n.put("id", scope.id());
        n.put("file", scope.file());
        n.put("condition", scope.condition());
        if (scope.totalCondition() == null) {
            n.putNull("totalCondition");
        } else {
            n.put("totalCondition", scope.totalCondition());
        }

        ObjectNode ops = n.putObject("operations");
        for (String key : scope.keys()) {
            ArrayNode chain = ops.putArray(key);
            for (Operation op : scope.operations(key)) chain.add(op.toString());
        }

        ArrayNode children = n.putArray("children");
        for (Scope c : scope.ownChildren()) children.add(toJson(c));
        ArrayNode includes = n.putArray("includes");
        for (Scope i : scope.includedScopes()) includes.add(toJson(i));
        return n;
    }

    public static String pretty(ObjectNode node) {
        try {
            return om.writerWithDefaultPrettyPrinter().writeValueAsString(node);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot render scope JSON", e);
        }
    }
}
