package work.ecology.kernel.sandbox;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

class RunSignatureTest {

    @Test
    void plainParametersAreExact() {
        var signature = RunSignature.of("function run(a, b) { return a + b; }", 2);
        assertEquals(new RunSignature(2, 2), signature);
        assertTrue(signature.accepts(2));
        assertFalse(signature.accepts(1));
        assertFalse(signature.accepts(3));
    }

    @Test
    void defaultsRaiseTheUpperBound() {
        assertEquals(new RunSignature(1, 3), RunSignature.of("function run(a, b = 10, c = [1, 2]) {}", 1));
        assertEquals(new RunSignature(0, 1), RunSignature.of("async function run(opts = { x: 1, y: (2, 3) }) {}", 0));
    }

    @Test
    void restParameterRemovesTheUpperBound() {
        var signature = RunSignature.of("function run(first, ...rest) {}", 1);
        assertEquals(RunSignature.UNBOUNDED, signature.maximum());
        assertTrue(signature.accepts(40));
        assertFalse(signature.accepts(0));
    }

    @Test
    void argumentsObjectRemovesTheUpperBoundOnlyOutsideArrows() {
        assertEquals(RunSignature.UNBOUNDED, RunSignature.of("function run() { return arguments[0]; }", 0).maximum());
        assertEquals(0, RunSignature.of("function run() { return this.arguments; }", 0).maximum());
        assertEquals(1, RunSignature.of("(a) => a", 1).maximum());
    }

    @Test
    void arrowFormsAreRecognised() {
        assertEquals(new RunSignature(1, 1), RunSignature.of("x => x * 2", 1));
        assertEquals(new RunSignature(1, 1), RunSignature.of("async x => x * 2", 1));
        assertEquals(new RunSignature(0, 2), RunSignature.of("async (a = 1, b = ')') => a", 0));
    }

    @Test
    void commentsAndTrailingCommasDoNotCount() {
        assertEquals(new RunSignature(2, 2), RunSignature.of("function run(a /* first, */, b, // second, third\n) {}", 2));
    }

    @Test
    void nativeSourceFallsBackToLengthAsMinimum() {
        var signature = RunSignature.of("function () { [native code] }", 1);
        assertEquals(new RunSignature(1, RunSignature.UNBOUNDED), signature);
    }

    @Test
    void mismatchMessagesDescribeTheBounds() {
        assertEquals("Argument error: run() takes 1 positional argument but 0 were given",
            new RunSignature(1, 1).mismatch(0));
        assertEquals("Argument error: run() takes 0 positional arguments but 1 was given",
            new RunSignature(0, 0).mismatch(1));
        assertEquals("Argument error: run() takes from 1 to 2 positional arguments but 3 were given",
            new RunSignature(1, 2).mismatch(3));
        assertEquals("Argument error: run() takes at least 2 positional arguments but 1 was given",
            new RunSignature(2, RunSignature.UNBOUNDED).mismatch(1));
    }
}
