import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.qmigrate.debug.Debug;
import com.qmigrate.script.QMigrateCli;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

public class QMigrateCliTest {

    @TempDir
    Path dir;

    private final ByteArrayOutputStream out = new ByteArrayOutputStream();
    private final ByteArrayOutputStream err = new ByteArrayOutputStream();
    private PrintStream savedOut;
    private PrintStream savedErr;

    @BeforeEach
    public void captureStreams() {
        savedOut = System.out;
        savedErr = System.err;
        System.setOut(new PrintStream(out, true, StandardCharsets.UTF_8));
        System.setErr(new PrintStream(err, true, StandardCharsets.UTF_8));
    }

    @AfterEach
    public void restoreStreams() {
        System.setOut(savedOut);
        System.setErr(savedErr);
        Debug.get().setSink(null);
    }

    private String stdout() {
        return out.toString(StandardCharsets.UTF_8);
    }

    private String stderr() {
        return err.toString(StandardCharsets.UTF_8);
    }

    private Path write(String name, String... lines) throws IOException {
        Path p = dir.resolve(name);
        Files.writeString(p, String.join("\n", lines) + "\n", StandardCharsets.UTF_8);
        return p;
    }

    @Test
    public void simplify_prints_the_result() {
        assertEquals(0, QMigrateCli.run(new String[] { "--simplify", "NOT UNIX AND (WIN32 OR APPLE)" }));
        assertEquals("WIN32", stdout().trim());
    }

    @Test
    public void usage_errors() {
        assertEquals(2, QMigrateCli.run(new String[] { "--bogus" }));
        assertTrue(stderr().contains("Unknown option --bogus"));
        assertEquals(2, QMigrateCli.run(new String[0]));
        assertTrue(stderr().contains("Usage: qmigrate"));
    }

    @Test
    public void missing_file_is_an_io_error() {
        assertEquals(3, QMigrateCli.run(new String[] { dir.resolve("nope.pro").toString() }));
        assertTrue(stderr().contains("Failed to read project file"));
    }

    @Test
    public void malformed_file_is_an_error() throws IOException {
        Path pro = write("bad.pro", "A = 1", "}");
        assertEquals(1, QMigrateCli.run(new String[] { pro.toString() }));
        assertTrue(stderr().contains("[line 2, col 1]"), stderr());
    }

    @Test
    public void summary_lists_sources_per_condition() throws IOException {
        Path pro = write("app.pro",
                "SOURCES = main.cpp",
                "unix:SOURCES += posix.cpp",
                "UNUSED = 1"
        );
        assertEquals(0, QMigrateCli.run(new String[] { pro.toString() }));

        String text = stdout();
        assertTrue(text.contains("app.pro: app app"), text);
        assertTrue(text.contains("[ON] SOURCES main.cpp"), text);
        assertTrue(text.contains("[UNIX] SOURCES posix.cpp"), text);
        assertTrue(text.contains("unused keys: ") && text.contains("UNUSED"), text);
    }

    @Test
    public void json_output_is_valid() throws IOException {
        Path pro = write("lib.pro", "TEMPLATE = lib", "SOURCES = a.cpp");
        assertEquals(0, QMigrateCli.run(new String[] { "--json", pro.toString() }));

        JsonNode json = new ObjectMapper().readTree(stdout());
        assertEquals("lib", json.get("template").asText());
        assertEquals("lib", json.get("target").asText());
    }
}
