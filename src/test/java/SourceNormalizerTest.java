import com.qmigrate.script.parser.SourceNormalizer;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class SourceNormalizerTest {

    @Test
    public void comment_lines_are_dropped() {
        String src = String.join("\n",
                "A = 1",
                "# one",
                "# two",
                "B = 2"
        );
        assertEquals("A = 1\nB = 2", SourceNormalizer.normalize(src));
    }

    @Test
    public void leading_comment_line_is_dropped() {
        assertEquals("X = 1", SourceNormalizer.normalize("# header\nX = 1"));
    }

    @Test
    public void comment_inside_continued_assignment_does_not_end_it() {
        String src = String.join("\n",
                "SOURCES = a.cpp\\",
                "# b.cpp\\",
                "    c.cpp"
        );
        assertEquals("SOURCES = a.cpp     c.cpp", SourceNormalizer.normalize(src));
    }

    @Test
    public void continuations_are_joined() {
        assertEquals("SOURCES = a.cpp b.cpp", SourceNormalizer.normalize("SOURCES = a.cpp\\\nb.cpp"));
        assertEquals("SOURCES = a.cpp     b.cpp", SourceNormalizer.normalize("SOURCES = a.cpp \\\n    b.cpp"));
        assertEquals("A = x y", SourceNormalizer.normalize("A = x\\  \r\ny"));
    }

    @Test
    public void null_is_empty() {
        assertEquals("", SourceNormalizer.normalize(null));
    }
}
