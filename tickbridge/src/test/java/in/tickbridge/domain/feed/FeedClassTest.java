package in.tickbridge.domain.feed;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class FeedClassTest {

    @Test
    void testWireCodesAndLabels() {
        assertEquals("d", FeedClass.DETAILED.wireCode());
        assertEquals("df", FeedClass.DETAILED.tickType());
        assertEquals("detailed", FeedClass.DETAILED.label());
        assertEquals("t", FeedClass.TOUCHLINE.wireCode());
        assertEquals("tf", FeedClass.TOUCHLINE.tickType());
        assertEquals("touchline", FeedClass.TOUCHLINE.label());
    }

    @Test
    void testFromCode() {
        assertEquals(FeedClass.DETAILED, FeedClass.fromCode("d"));
        assertEquals(FeedClass.DETAILED, FeedClass.fromCode("Detailed"));
        assertEquals(FeedClass.TOUCHLINE, FeedClass.fromCode("t"));
        assertEquals(FeedClass.TOUCHLINE, FeedClass.fromCode("touchline"));
        assertEquals(FeedClass.TOUCHLINE, FeedClass.fromCode("bogus"), "Unknown codes default to touchline");
        assertEquals(FeedClass.TOUCHLINE, FeedClass.fromCode(null));
    }

    @Test
    void testTickTypes() {
        assertTrue(FeedClass.isTickType("df"));
        assertTrue(FeedClass.isTickType("tf"));
        assertTrue(FeedClass.isTickType("d"));
        assertTrue(FeedClass.isTickType("t"));
        assertFalse(FeedClass.isTickType("ck"));
        assertFalse(FeedClass.isTickType(""));
        assertFalse(FeedClass.isTickType(null));

        assertEquals(FeedClass.DETAILED, FeedClass.fromTickType("df"));
        assertEquals(FeedClass.DETAILED, FeedClass.fromTickType("d"));
        assertEquals(FeedClass.TOUCHLINE, FeedClass.fromTickType("tf"));
        assertEquals(FeedClass.TOUCHLINE, FeedClass.fromTickType("t"));
    }
}
