package io.hintlite.core;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.stream.IntStream;

import static org.junit.jupiter.api.Assertions.*;

class ReductionEngineTest {

    private static final int ESC = ReductionEngine.DEFAULT_ABORT_SYMBOL;

    private final ReductionEngine engine = new ReductionEngine();
    private final List<Hint<Integer>> hints =
            new LabelAssigner(Alphabet.of("abcd")).assign(IntStream.range(0, 10).boxed().toList());

    @Test
    void typed_symbol_keeps_matching_candidates_and_strips_it() {
        // labels: a b ca cb cc cd da db dc dd
        var outcome = engine.reduce(hints, 'c');

        var reduced = assertInstanceOf(ReductionOutcome.Reduced.class, outcome);
        List<Hint<Integer>> left = ((ReductionOutcome.Reduced<Integer>) outcome).candidates();
        assertEquals(4, reduced.candidates().size());
        assertEquals(List.of("a", "b", "c", "d"), left.stream().map(h -> h.label().toString()).toList());
        assertEquals(List.of(2, 3, 4, 5), left.stream().map(Hint::target).toList());
        assertFalse(reduced.isResolved());
    }

    @Test
    void single_survivor_is_resolved() {
        var outcome = (ReductionOutcome.Reduced<Integer>) engine.reduce(hints, 'b');
        assertTrue(outcome.isResolved());
        assertEquals(1, outcome.candidates().get(0).target());
        assertTrue(outcome.candidates().get(0).label().isEmpty());
    }

    @Test
    void every_label_resolves_to_its_own_target() {
        for (var hint : hints) {
            List<Hint<Integer>> current = hints;
            Label label = hint.label();
            for (int i = 0; i < label.length(); i++) {
                var outcome = engine.reduce(current, label.symbolAt(i));
                current = ((ReductionOutcome.Reduced<Integer>) outcome).candidates();
            }
            assertEquals(1, current.size(), () -> "label " + label);
            assertEquals(hint.target(), current.get(0).target());
        }
    }

    @Test
    void unknown_symbol_yields_no_match() {
        var outcome = (ReductionOutcome.Reduced<Integer>) engine.reduce(hints, 'z');
        assertTrue(outcome.isNoMatch());
        assertTrue(outcome.candidates().isEmpty());
    }

    @Test
    void abort_symbol_cancels_regardless_of_candidates() {
        assertInstanceOf(ReductionOutcome.Cancelled.class, engine.reduce(hints, ESC));
        assertInstanceOf(ReductionOutcome.Cancelled.class, engine.reduce(List.<Hint<Integer>>of(), ESC));
    }

    @Test
    void custom_abort_symbol_replaces_escape() {
        var qEngine = new ReductionEngine('q');
        assertInstanceOf(ReductionOutcome.Cancelled.class, qEngine.reduce(hints, 'q'));
        assertInstanceOf(ReductionOutcome.Reduced.class, qEngine.reduce(hints, ESC));
    }

    @Test
    void input_candidates_are_left_untouched() {
        var before = List.copyOf(hints);
        engine.reduce(hints, 'd');
        assertEquals(before, hints);
    }

    @Test
    void abort_symbol_must_not_be_a_label_symbol() {
        var alphabet = Alphabet.of("abcd");
        assertThrows(HintConfigurationException.class, () -> new ReductionEngine('b').requireDistinctFrom(alphabet));
        assertDoesNotThrow(() -> engine.requireDistinctFrom(alphabet));
        assertTrue(alphabet.contains('c'));
        assertFalse(alphabet.contains(ESC));
    }
}
