import com.qmigrate.script.condition.ConditionSimplifier;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class ConditionSimplifierTest {

    private final ConditionSimplifier simplifier = new ConditionSimplifier();

    private String s(String condition) {
        return simplifier.simplify(condition);
    }

    @Test
    public void result_does_not_depend_on_operand_order() {
        assertEquals(s("A OR B"), s("B OR A"));
        assertEquals("A OR B", s("B OR A"));
        assertEquals(s("C AND (B OR A)"), s("(A OR B) AND C"));
    }

    @Test
    public void unix_and_windows_are_complementary() {
        assertEquals(ConditionSimplifier.FALSE, s("WIN32 AND UNIX"));
        assertEquals(ConditionSimplifier.TRUE, s("UNIX OR WIN32"));
        assertEquals("WIN32", s("NOT UNIX"));
        assertEquals("UNIX", s("NOT WIN32"));
    }

    @Test
    public void flavors_imply_their_platform() {
        assertEquals("APPLE AND NOT APPLE_IOS", s("APPLE AND NOT APPLE_IOS"));
        assertEquals(ConditionSimplifier.FALSE, s("APPLE_IOS AND NOT APPLE"));
        assertEquals("APPLE_IOS", s("APPLE AND APPLE_IOS"));
        assertEquals("APPLE", s("APPLE OR APPLE_OSX"));
        assertEquals("LINUX", s("UNIX AND LINUX"));
        assertEquals("ANDROID_EMBEDDED", s("ANDROID AND ANDROID_EMBEDDED"));
    }

    @Test
    public void platform_families_exclude_each_other() {
        assertEquals(ConditionSimplifier.FALSE, s("LINUX AND APPLE_OSX"));
        assertEquals(ConditionSimplifier.FALSE, s("QNX AND FREEBSD"));
        assertEquals(ConditionSimplifier.FALSE, s("WINRT AND ANDROID"));
        assertEquals("LINUX", s("LINUX AND NOT HAIKU"));
    }

    @Test
    public void boolean_minimization() {
        assertEquals("A AND (B OR C)", s("(A AND B) OR (A AND C)"));
        assertEquals("A", s("A OR (A AND B)"));
        assertEquals(ConditionSimplifier.TRUE, s("A OR NOT A"));
        assertEquals(ConditionSimplifier.FALSE, s("A AND NOT A"));
        assertEquals("B", s("(A AND B) OR (NOT A AND B)"));
    }

    @Test
    public void constants_and_empty_input() {
        assertEquals(ConditionSimplifier.TRUE, s(""));
        assertEquals(ConditionSimplifier.TRUE, s("  "));
        assertEquals(ConditionSimplifier.TRUE, s("ON"));
        assertEquals("A", s("A AND ON"));
        assertEquals(ConditionSimplifier.FALSE, s("A AND OFF"));
    }

    @Test
    public void multi_word_atoms_stay_whole() {
        assertEquals("TARGET Qt::Gui OR WIN32", s("WIN32 OR TARGET Qt::Gui"));
        assertEquals(ConditionSimplifier.FALSE, s("TARGET Qt::Gui AND NOT TARGET Qt::Gui"));
        assertEquals("CMAKE_BUILD_TYPE STREQUAL Debug AND UNIX", s("(CMAKE_BUILD_TYPE STREQUAL Debug) AND UNIX"));
    }

    @Test
    public void output_is_a_fixed_point() {
        String[] inputs = {
                "(A AND B) OR (A AND C)",
                "NOT (WIN32 OR APPLE) AND QT_FEATURE_dbus",
                "(LINUX OR ANDROID) AND NOT ANDROID_EMBEDDED",
                "APPLE AND NOT APPLE_IOS",
                "X OR (Y AND NOT Z) OR (NOT X AND Z)"
        };
        for (String in : inputs) {
            String once = s(in);
            assertEquals(once, s(once), in);
        }
    }

    @Test
    public void unparsable_input_is_returned_unchanged() {
        assertEquals("A AND (B", s("A AND (B"));
        assertEquals("AND A", s("  AND A "));
    }

    private static String features(String prefix, int count, String op) {
        List<String> atoms = new ArrayList<>();
        for (int i = 0; i < count; i++) atoms.add(prefix + i);
        return String.join(" " + op + " ", atoms);
    }

    @Test
    public void contradictions_are_found_in_large_conditions() {
        assertEquals(ConditionSimplifier.FALSE, s("WIN32 AND UNIX AND " + features("F", 11, "AND")));
        assertEquals(ConditionSimplifier.FALSE, s("LINUX AND " + features("F", 12, "AND") + " AND APPLE_OSX"));
        assertEquals(ConditionSimplifier.FALSE,
                s("WIN32 AND (" + features("F", 12, "OR") + ") AND APPLE_IOS"));

        String parent = features("A", 12, "AND");
        assertEquals(ConditionSimplifier.FALSE, s("(" + parent + " AND B) AND NOT (" + parent + ")"));

        String any = features("F", 13, "OR");
        assertEquals(ConditionSimplifier.TRUE, s(any + " OR NOT (" + any + ")"));
    }

    @Test
    public void large_conditions_still_get_the_platform_rules() {
        String f = features("F", 11, "AND");
        assertEquals(s("APPLE_IOS AND " + f), s("APPLE AND APPLE_IOS AND " + f));
        assertFalse(s("APPLE AND APPLE_IOS AND " + f).contains("APPLE AND"));
        assertTrue(s("NOT UNIX AND " + f).contains("WIN32"));
        assertFalse(s("NOT UNIX AND " + f).contains("UNIX"));
    }

    @Test
    public void large_conditions_are_canonical() {
        List<String> atoms = new ArrayList<>();
        for (int i = 0; i < 13; i++) atoms.add("F" + i);
        String forward = s(String.join(" OR ", atoms));

        List<String> reversed = new ArrayList<>(atoms);
        Collections.reverse(reversed);
        assertEquals(forward, s(String.join(" OR ", reversed)));
        assertEquals(forward, s(forward));
        for (String atom : atoms) {
            assertTrue((" " + forward + " ").contains(" " + atom + " "), atom);
        }
    }
}
