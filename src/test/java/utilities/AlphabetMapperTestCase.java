package utilities;

import junit.framework.TestCase;

public class AlphabetMapperTestCase extends TestCase {

    public AlphabetMapperTestCase(String name) {
        super(name);
    }

    public void testIdsAreDenseAndSkipReserved() {
        AlphabetMapper<String> mapper = new AlphabetMapper<>(4);
        assertEquals(1, mapper.getId("x"));
        assertEquals(2, mapper.getId("y"));
        assertEquals(1, mapper.getId("x"));
        assertEquals(2, mapper.size());
    }

    public void testLookupDoesNotInsert() {
        AlphabetMapper<String> mapper = new AlphabetMapper<>(0);
        assertEquals(AlphabetMapper.UNKNOWN, mapper.lookup("z"));
        assertEquals(0, mapper.size());
        mapper.getId("z");
        assertEquals(1, mapper.lookup("z"));
    }
}
