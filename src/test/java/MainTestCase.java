import junit.framework.TestCase;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;

public class MainTestCase extends TestCase {

    public MainTestCase(String name) {
        super(name);
    }

    private static String runWith(String... args) {
        ByteArrayOutputStream bytes = new ByteArrayOutputStream();
        PrintStream out = new PrintStream(bytes, true, StandardCharsets.UTF_8);
        Main.run(Main.CliOptions.parse(args), out);
        return bytes.toString(StandardCharsets.UTF_8);
    }

    public void testTextWithPatterns() {
        String output = runWith("--text", "banana", "--find", "ana", "--find", "xyz");
        assertTrue(output.contains("banana$ [0]"));
        assertTrue(output.contains("ana -> 2 occurrence(s) [1, 3]"));
        assertTrue(output.contains("xyz -> 0 occurrence(s) []"));
    }

    public void testRandomTextIsNotPrinted() {
        String output = runWith("--random", "500", "--alphabet", "3", "--seed", "5", "--find", "a");
        assertFalse(output.contains("Suffix tree for"));
        assertTrue(output.contains("a -> "));
    }

    public void testRequiresExactlyOneSource() {
        try {
            Main.CliOptions.parse(new String[]{"--find", "a"});
            fail("expected IllegalArgumentException");
        } catch (IllegalArgumentException expected) {
            // ok
        }
        try {
            Main.CliOptions.parse(new String[]{"--text", "a", "--random", "3"});
            fail("expected IllegalArgumentException");
        } catch (IllegalArgumentException expected) {
            // ok
        }
    }

    public void testUnknownOption() {
        try {
            Main.CliOptions.parse(new String[]{"--text", "a", "--bogus", "1"});
            fail("expected IllegalArgumentException");
        } catch (IllegalArgumentException expected) {
            // ok
        }
    }
}
