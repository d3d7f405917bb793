import com.qmigrate.script.parser.OpKind;
import com.qmigrate.script.scope.Operation;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class OperationTest {

    private static List<String> apply(String key, List<String> input, Operation... ops) {
        List<String> result = input;
        for (Operation op : ops) {
            result = op.process(key, result, Operation.IDENTITY);
        }
        return result;
    }

    @Test
    public void set_add_remove_chain() {
        List<String> out = apply("A", new ArrayList<>(),
                Operation.of(OpKind.SET, List.of("1", "2")),
                Operation.of(OpKind.ADD, List.of("3")),
                Operation.of(OpKind.REMOVE, List.of("1")));

        assertEquals(List.of("2", "3"), out);
    }

    @Test
    public void remove_of_absent_value_leaves_marker() {
        List<String> out = apply("A", List.of("a", "b"), Operation.of(OpKind.REMOVE, List.of("b", "c")));
        assertEquals(List.of("a", "-c"), out);
    }

    @Test
    public void unique_add_skips_known_values_and_keeps_order() {
        List<String> input = List.of("a", "b");
        List<String> out = apply("A", input, Operation.of(OpKind.UNIQUE_ADD, List.of("c", "a", "c", "d")));

        assertEquals(List.of("a", "b", "c", "d"), out);
        // the accumulated input is not modified
        assertEquals(List.of("a", "b"), input);
    }

    @Test
    public void set_splices_self_reference() {
        List<String> out = apply("A", List.of("x", "y"), Operation.of(OpKind.SET, List.of("pre", "$$A", "post")));
        assertEquals(List.of("pre", "x", "y", "post"), out);
    }

    @Test
    public void transformer_applies_to_operands_only() {
        Operation.Transformer upper = values -> {
            List<String> out = new ArrayList<>();
            for (String v : values) out.add(v.toUpperCase());
            return out;
        };

        Operation add = Operation.of(OpKind.ADD, List.of("b"));
        assertEquals(List.of("a", "B"), add.process("K", List.of("a"), upper));

        Operation set = Operation.of(OpKind.SET, List.of("$$K", "c"));
        assertEquals(List.of("a", "C"), set.process("K", List.of("a"), upper));
    }

    @Test
    public void to_string_shows_operator_and_values() {
        assertEquals("+(\"a\", <NONE>)", Operation.of(OpKind.ADD, List.of("a", "")).toString());
        assertEquals("=(<NOTHING>)", Operation.of(OpKind.SET, List.of()).toString());
        assertEquals(OpKind.REMOVE, Operation.of(OpKind.REMOVE, List.of("x")).kind());
    }
}
