import com.qmigrate.script.QMigrate;
import com.qmigrate.script.parser.OpKind;
import com.qmigrate.script.parser.ParseError;
import com.qmigrate.script.parser.Parser;
import com.qmigrate.script.parser.Statement.Conditional;
import com.qmigrate.script.parser.Statement.Include;
import com.qmigrate.script.parser.Statement.Load;
import com.qmigrate.script.parser.Statement.Stmt;
import com.qmigrate.script.parser.Statement.VarOp;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class QMigrateParserTest {

    private static List<Stmt> parse(String... lines) {
        return new Parser(String.join("\n", lines)).parse();
    }

    @Test
    public void assignment_operators_map_to_op_kinds() {
        List<Stmt> stmts = parse(
                "SOURCES = main.cpp util.cpp",
                "QT += core gui",
                "DEFINES -= FOO",
                "CONFIG *= c++11"
        );

        assertEquals(4, stmts.size());
        VarOp set = (VarOp) stmts.get(0);
        assertEquals("SOURCES", set.key);
        assertEquals(OpKind.SET, set.opKind);
        assertEquals(List.of("main.cpp", "util.cpp"), set.values);

        assertEquals(OpKind.ADD, ((VarOp) stmts.get(1)).opKind);
        assertEquals(OpKind.REMOVE, ((VarOp) stmts.get(2)).opKind);
        assertEquals(OpKind.UNIQUE_ADD, ((VarOp) stmts.get(3)).opKind);
        assertEquals(List.of("c++11"), ((VarOp) stmts.get(3)).values);
    }

    @Test
    public void empty_assignment_has_no_values() {
        VarOp op = (VarOp) parse("TARGET =").get(0);
        assertTrue(op.values.isEmpty());
    }

    @Test
    public void values_keep_substitutions_and_quotes() {
        List<Stmt> stmts = parse(
                "DESTDIR = $$PWD/../bin",
                "NAME = lib_$${TARGET}.so $$[QT_INSTALL_LIBS]",
                "MSG = \"hello world\""
        );

        assertEquals(List.of("$$PWD/../bin"), ((VarOp) stmts.get(0)).values);
        assertEquals(List.of("lib_$${TARGET}.so", "$$[QT_INSTALL_LIBS]"), ((VarOp) stmts.get(1)).values);
        assertEquals(List.of("hello world"), ((VarOp) stmts.get(2)).values);
    }

    @Test
    public void function_values_resolved_at_parse_time() {
        List<Stmt> stmts = parse(
                "TARGET = $$qtLibraryTarget(mylib)",
                "SOURCES = $$files(*.cpp, true)",
                "X = $$replace(A, b, c)"
        );

        assertEquals(List.of("mylib"), ((VarOp) stmts.get(0)).values);
        assertEquals(List.of("*.cpp"), ((VarOp) stmts.get(1)).values);
        assertEquals(List.of("join(A,b,c)"), ((VarOp) stmts.get(2)).values);
    }

    @Test
    public void qtLibraryTarget_with_several_arguments_is_a_parse_error() {
        assertThrows(ParseError.class, () -> parse("TARGET = $$qtLibraryTarget(a b)"));
    }

    @Test
    public void block_with_else() {
        List<Stmt> stmts = parse(
                "win32 {",
                "    A = 1",
                "} else {",
                "    A = 2",
                "    B = 3",
                "}"
        );

        assertEquals(1, stmts.size());
        Conditional c = (Conditional) stmts.get(0);
        assertEquals("win32", c.condition);
        assertEquals(1, c.body.size());
        assertNotNull(c.elseBody);
        assertEquals(2, c.elseBody.size());
    }

    @Test
    public void single_line_scope_and_combined_conditions() {
        List<Stmt> stmts = parse(
                "unix: LIBS += -lm",
                "win32:!contains(CONFIG, static): DEFINES += DYN",
                "linux|macx { X = 1 }"
        );

        Conditional unix = (Conditional) stmts.get(0);
        assertEquals("unix", unix.condition);
        assertEquals(List.of("-lm"), ((VarOp) unix.body.get(0)).values);

        Conditional win = (Conditional) stmts.get(1);
        assertEquals("win32 && !contains(CONFIG,static)", win.condition);

        Conditional either = (Conditional) stmts.get(2);
        assertEquals("linux | macx", either.condition);
        assertEquals("X", ((VarOp) either.body.get(0)).key);
    }

    @Test
    public void else_chain_attaches_to_innermost_open_branch() {
        List<Stmt> stmts = parse(
                "win32 {",
                "    A = 1",
                "} else: macx {",
                "    A = 2",
                "} else {",
                "    A = 3",
                "}"
        );

        assertEquals(1, stmts.size());
        Conditional win = (Conditional) stmts.get(0);
        Conditional mac = (Conditional) win.elseBody.get(0);
        assertEquals("macx", mac.condition);
        assertNotNull(mac.elseBody);
        assertEquals(List.of("3"), ((VarOp) mac.elseBody.get(0)).values);
    }

    @Test
    public void else_after_completed_chain_is_a_parse_error() {
        ParseError e = assertThrows(ParseError.class, () -> parse(
                "win32 {",
                "    A = 1",
                "} else {",
                "    A = 2",
                "}",
                "else {",
                "    A = 3",
                "}"
        ));
        assertEquals(6, e.line());
        assertEquals(1, e.column());

        assertThrows(ParseError.class, () -> parse(
                "unix: A = 1",
                "else: A = 2",
                "else: A = 3"
        ));
    }

    @Test
    public void include_load_option_and_discarded_calls() {
        List<Stmt> stmts = parse(
                "include(common.pri)",
                "load(qt_build_config)",
                "message(hello)",
                "defineTest(check) {",
                "    return(true)",
                "}",
                "for(f, FILES): message($$f)",
                "A = 1"
        );

        assertEquals(3, stmts.size());
        assertEquals("common.pri", ((Include) stmts.get(0)).path);
        assertEquals("qt_build_config", ((Load) stmts.get(1)).name);
        assertEquals("A", ((VarOp) stmts.get(2)).key);
    }

    @Test
    public void stray_brace_reports_line_and_column() {
        ParseError e = assertThrows(ParseError.class, () -> parse("A = 1", "}"));
        assertEquals(2, e.line());
        assertEquals(1, e.column());
        assertTrue(e.getMessage().startsWith("[line 2, col 1]"));
    }

    @Test
    public void unclosed_block_is_a_parse_error() {
        assertThrows(ParseError.class, () -> parse("win32 {", "A = 1"));
    }

    @Test
    public void facade_normalizes_comments_and_continuations() {
        String src = String.join("\n",
                "SOURCES = a.cpp \\",
                "# b.cpp is gone",
                "    c.cpp",
                "HEADERS = a.h # trailing comment"
        );

        List<Stmt> stmts = new QMigrate().parse(src);

        assertEquals(2, stmts.size());
        assertEquals(List.of("a.cpp", "c.cpp"), ((VarOp) stmts.get(0)).values);
        assertEquals(List.of("a.h"), ((VarOp) stmts.get(1)).values);
    }
}
