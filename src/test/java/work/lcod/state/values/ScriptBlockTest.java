package work.lcod.state.values;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

class ScriptBlockTest {
    @Test
    void unboundBlockInvokesToItsSource() {
        ScriptBlock block = ScriptBlock.of("Get-Date");
        assertFalse(block.isBound());
        assertEquals("Get-Date", block.invoke());
    }

    @Test
    void boundBlockRunsEvaluator() {
        ScriptBlock block = ScriptBlock.of("1 + 1", () -> 2);
        assertTrue(block.isBound());
        assertEquals(2, block.invoke());
        assertEquals(ScriptBlock.of("1 + 1"), block);
    }

    @Test
    void detectsTrailingComment() {
        assertTrue(ScriptBlock.of("1 # note").endsInComment());
        assertFalse(ScriptBlock.of("# note\n1").endsInComment());
    }
}
