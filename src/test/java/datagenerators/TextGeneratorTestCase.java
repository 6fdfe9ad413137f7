package datagenerators;

import junit.framework.TestCase;

public class TextGeneratorTestCase extends TestCase {

    public TextGeneratorTestCase(String name) {
        super(name);
    }

    public void testUniformIsSeededAndInRange() {
        String first = TextGenerator.generateUniform(500, 'a', 3, 11L);
        assertEquals(first, TextGenerator.generateUniform(500, 'a', 3, 11L));
        assertEquals(500, first.length());
        for (char c : first.toCharArray()) {
            assertTrue(c >= 'a' && c <= 'c');
        }
    }

    public void testZipfIsSeededAndInRange() {
        String text = TextGenerator.generateZipf(1_000, 'k', 5, 1.1, 3L);
        assertEquals(text, TextGenerator.generateZipf(1_000, 'k', 5, 1.1, 3L));
        for (char c : text.toCharArray()) {
            assertTrue(c >= 'k' && c < 'k' + 5);
        }
    }

    public void testPeriodic() {
        assertEquals("abcab", TextGenerator.generatePeriodic(5, "abc"));
        assertEquals("", TextGenerator.generatePeriodic(0, "abc"));
    }

    public void testRejectsBadAlphabet() {
        try {
            TextGenerator.generateUniform(3, 'a', 0, 1L);
            fail("expected IllegalArgumentException");
        } catch (IllegalArgumentException expected) {
            // ok
        }
    }
}
