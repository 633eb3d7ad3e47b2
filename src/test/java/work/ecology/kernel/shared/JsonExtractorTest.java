package work.ecology.kernel.shared;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.math.BigInteger;
import java.util.Optional;
import org.junit.jupiter.api.Test;

class JsonExtractorTest {
    @Test
    void returnsBareObject() {
        assertEquals(Optional.of("{\"a\": 1}"), JsonExtractor.extract("  {\"a\": 1}  "));
    }

    @Test
    void prefersFencedBlock() {
        String text = "Here {is} prose.\n```json\n{\"score\": 80}\n```\ntrailing }";
        assertEquals("{\"score\": 80}", JsonExtractor.extract(text).orElseThrow());
    }

    @Test
    void ignoresFenceWithoutObject() {
        String text = "```\nno json here\n```\n{\"x\": true}";
        assertEquals("{\"x\": true}", JsonExtractor.extract(text).orElseThrow());
    }

    @Test
    void emptyWhenNoObject() {
        assertTrue(JsonExtractor.extract("nothing").isEmpty());
        assertTrue(JsonExtractor.extract("} backwards {").isEmpty());
        assertTrue(JsonExtractor.extract(null).isEmpty());
    }

    @Test
    void integralsAcceptOnlyExactIntegers() {
        assertEquals(Optional.of(5L), Integrals.exact(5));
        assertEquals(Optional.of(7L), Integrals.exact(7L));
        assertEquals(Optional.of(9L), Integrals.exact(BigInteger.valueOf(9)));
        assertTrue(Integrals.exact(1.0).isEmpty());
        assertTrue(Integrals.exact("5").isEmpty());
        assertTrue(Integrals.exact(BigInteger.TWO.pow(70)).isEmpty());
        assertTrue(Integrals.exact(null).isEmpty());
    }
}
