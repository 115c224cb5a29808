package io.hintlite.cli;

import org.junit.jupiter.api.Test;

import java.io.StringReader;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class TargetReaderTest {

    @Test
    void reads_positions_and_selections_in_input_order() throws Exception {
        var targets = TargetReader.read(new StringReader("1.1 4.7\n  9.2,9.5\n\n12.40"));

        assertEquals(List.of(
                Selection.at(new Position(1, 1)),
                Selection.at(new Position(4, 7)),
                new Selection(new Position(9, 2), new Position(9, 5)),
                Selection.at(new Position(12, 40))
        ), targets);
    }

    @Test
    void malformed_entries_are_dropped_and_the_rest_kept() throws Exception {
        var targets = TargetReader.read(new StringReader("1.1 x.2 3 0.4 5.6,7 2.2,3.3,4.4 99999999999.1 8.8"));

        assertEquals(List.of(
                Selection.at(new Position(1, 1)),
                Selection.at(new Position(8, 8))
        ), targets);
    }

    @Test
    void empty_input_gives_no_targets() throws Exception {
        assertTrue(TargetReader.read(new StringReader("")).isEmpty());
        assertTrue(TargetReader.read(new StringReader("  \n \t ")).isEmpty());
    }

    @Test
    void parse_error_names_the_entry() {
        var e = assertThrows(PositionParseException.class, () -> TargetReader.parse("3.-1"));
        assertEquals("3.-1", e.entry());
        assertTrue(e.getMessage().contains("column"));

        assertThrows(PositionParseException.class, () -> TargetReader.parse(".5"));
        assertThrows(PositionParseException.class, () -> TargetReader.parse("5."));
        assertThrows(PositionParseException.class, () -> TargetReader.parse("1.2,"));
    }

    @Test
    void selection_describes_itself_in_editor_notation() throws Exception {
        assertEquals("9.2,9.5", TargetReader.parse("9.2,9.5").describe());
        assertTrue(TargetReader.parse("4.4").isCollapsed());
    }
}
