import com.qmigrate.script.condition.ConditionMapper;
import com.qmigrate.script.condition.ConditionSimplifier;
import com.qmigrate.script.parser.Parser;
import com.qmigrate.script.scope.ConditionTotaler;
import com.qmigrate.script.scope.FileSystemPathResolver;
import com.qmigrate.script.scope.Scope;
import com.qmigrate.script.scope.ScopeBuilder;
import com.qmigrate.script.scope.ScopeTree;
import com.qmigrate.script.scope.StructuralError;

import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class ConditionTotalingTest {

    private final ConditionSimplifier simplifier = new ConditionSimplifier();

    private Scope buildUntotaled(String... lines) {
        ScopeTree tree = new ScopeTree(new FileSystemPathResolver(Path.of(".")));
        ScopeBuilder builder = new ScopeBuilder(tree, new ConditionMapper());
        return builder.build(null, "test.pro", new Parser(String.join("\n", lines)).parse(), "", true);
    }

    private Scope build(String... lines) {
        Scope root = buildUntotaled(lines);
        new ConditionTotaler(simplifier).total(root);
        return root;
    }

    @Test
    public void else_branch_negates_previous_sibling() {
        Scope root = build(
                "win32 {",
                "    A = 1",
                "} else {",
                "    A = 2",
                "}"
        );
        List<Scope> children = root.children();

        assertEquals("ON", root.totalCondition());
        assertEquals("WIN32", children.get(0).totalCondition());
        assertEquals("UNIX", children.get(1).totalCondition());
    }

    @Test
    public void orphan_else_is_structural_error() {
        Scope root = buildUntotaled(
                "else {",
                "    A = 1",
                "}"
        );
        ConditionTotaler totaler = new ConditionTotaler(simplifier);
        assertThrows(StructuralError.class, () -> totaler.total(root));
    }

    @Test
    public void total_condition_is_cached_once() {
        Scope root = build("A = 1");
        ConditionTotaler totaler = new ConditionTotaler(simplifier);
        assertThrows(IllegalStateException.class, () -> totaler.total(root));
    }

    @Test
    public void settling_collapses_operation_free_wrapper() {
        Scope root = build(
                "unix {",
                "    linux {",
                "        A = 1",
                "    }",
                "}"
        );

        List<Scope> children = root.children();
        assertEquals(1, children.size());
        assertEquals("(UNIX) AND (LINUX)", children.get(0).condition());
        assertEquals("LINUX", children.get(0).totalCondition());
    }

    @Test
    public void settling_keeps_else_of_collapsed_wrapper_on_its_condition() {
        Scope root = build(
                "unix {",
                "    linux {",
                "        A = 1",
                "    }",
                "} else {",
                "    B = 1",
                "}"
        );

        List<Scope> children = root.children();
        assertEquals(2, children.size());
        assertEquals("LINUX", children.get(0).totalCondition());
        assertEquals("WIN32", children.get(1).totalCondition());
    }

    @Test
    public void settling_rewrites_inner_else_explicitly() {
        Scope root = build(
                "unix {",
                "    linux {",
                "        A = 1",
                "    } else {",
                "        A = 2",
                "    }",
                "}"
        );

        List<Scope> children = root.children();
        assertEquals(2, children.size());
        assertEquals("(UNIX) AND NOT (LINUX)", children.get(1).condition());
        assertEquals("NOT LINUX AND UNIX", children.get(1).totalCondition());
    }

    @Test
    public void contradictory_nesting_is_dead() {
        Scope root = build(
                "win32 {",
                "    B = 0",
                "    unix {",
                "        A = 1",
                "    }",
                "}"
        );

        Scope win = root.children().get(0);
        Scope unix = win.children().get(0);
        assertFalse(win.isDead());
        assertTrue(unix.isDead());
        assertEquals("OFF", unix.totalCondition());
        assertTrue(win.liveChildren().isEmpty());
    }

    @Test
    public void child_condition_never_escapes_parent() {
        Scope root = build(
                "linux {",
                "    A = 1",
                "    contains(QT_CONFIG, foo) {",
                "        B = 1",
                "    } else {",
                "        C = 1",
                "    }",
                "}",
                "macx|ios: D = 1"
        );

        for (Scope scope : root.tree().all()) {
            Scope parent = scope.parent();
            if (parent == null) continue;
            String check = "(" + scope.totalCondition() + ") AND NOT (" + parent.totalCondition() + ")";
            assertEquals(ConditionSimplifier.FALSE, simplifier.simplify(check), scope.toString());
        }
    }

    @Test
    public void dead_scopes_are_found_under_many_features() {
        Scope root = build(
                "qtConfig(f1):qtConfig(f2):qtConfig(f3):qtConfig(f4):qtConfig(f5):qtConfig(f6) {",
                "    A = 1",
                "    qtConfig(f7)|qtConfig(f8)|qtConfig(f9)|qtConfig(f10)|qtConfig(f11)|qtConfig(f12) {",
                "        B = 1",
                "        win32 {",
                "            C = 1",
                "            unix {",
                "                D = 1",
                "            }",
                "        } else {",
                "            E = 1",
                "        }",
                "    }",
                "}"
        );

        Scope features = root.children().get(0);
        Scope anyOf = features.children().get(0);
        Scope win = anyOf.children().get(0);
        Scope otherwise = anyOf.children().get(1);
        Scope unix = win.children().get(0);

        assertFalse(anyOf.isDead());
        assertFalse(win.isDead());
        assertTrue(unix.isDead());
        assertEquals("OFF", unix.totalCondition());
        assertFalse(otherwise.isDead());
        assertTrue(otherwise.totalCondition().contains("UNIX"));

        for (Scope scope : root.tree().all()) {
            Scope parent = scope.parent();
            if (parent == null) continue;
            String check = "(" + scope.totalCondition() + ") AND NOT (" + parent.totalCondition() + ")";
            assertEquals(ConditionSimplifier.FALSE, simplifier.simplify(check), scope.toString());
        }
    }
}
