import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.qmigrate.script.Project;
import com.qmigrate.script.ProjectLoader;
import com.qmigrate.script.QMigrateOptions;
import com.qmigrate.script.ScopeJson;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

public class ScopeJsonTest {

    @TempDir
    Path dir;

    @Test
    public void project_renders_scope_tree() throws Exception {
        Path pro = dir.resolve("tool.pro");
        Files.writeString(pro, String.join("\n",
                "TARGET = qtool",
                "SOURCES = main.cpp",
                "win32 {",
                "    SOURCES += win.cpp",
                "}",
                "include(extra.pri)"
        ), StandardCharsets.UTF_8);
        Files.writeString(dir.resolve("extra.pri"), "DEFINES += EXTRA\n", StandardCharsets.UTF_8);

        Project project = new ProjectLoader(QMigrateOptions.defaults()).load(pro);
        JsonNode json = new ObjectMapper().readTree(ScopeJson.pretty(ScopeJson.toJson(project)));

        assertEquals("tool.pro", json.get("file").asText());
        assertEquals("app", json.get("template").asText());
        assertEquals("qtool", json.get("target").asText());
        assertFalse(json.get("example").asBoolean());
        assertEquals(0, json.get("subprojects").size());

        JsonNode scope = json.get("scope");
        assertEquals(0, scope.get("id").asInt());
        assertEquals("ON", scope.get("totalCondition").asText());
        assertEquals("=(\"main.cpp\")", scope.get("operations").get("SOURCES").get(0).asText());

        JsonNode child = scope.get("children").get(0);
        assertEquals("WIN32", child.get("condition").asText());
        assertEquals("WIN32", child.get("totalCondition").asText());
        assertEquals("+(\"win.cpp\")", child.get("operations").get("SOURCES").get(0).asText());

        JsonNode included = scope.get("includes").get(0);
        assertEquals("extra.pri", included.get("file").asText());
        assertTrue(included.get("operations").has("DEFINES"));
    }
}
