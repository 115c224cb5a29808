package io.hintlite.cli;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.Reader;
import java.util.ArrayList;
import java.util.List;
import java.util.logging.Logger;

/**
 * Reads targets from the host, one whitespace-separated entry at a time.
 * <p>
 * Accepted entries:
 *  - {@code line.column}                    a single position
 *  - {@code line.column,line.column}        a selection (anchor, cursor)
 * <p>
 * Malformed entries are dropped with a warning; the rest of the batch is kept
 * in input order.
 */
public final class TargetReader {
    private static final Logger log = Logger.getLogger(TargetReader.class.getName());

    private TargetReader() {
        // utility
    }

    public static List<Selection> read(Reader in) throws IOException {
        var out = new ArrayList<Selection>();
        var reader = new BufferedReader(in);
        String line;
        while ((line = reader.readLine()) != null) {
            for (String entry : line.trim().split("\\s+")) {
                if (entry.isEmpty()) continue;
                try {
                    out.add(parse(entry));
                } catch (PositionParseException e) {
                    log.warning(e.getMessage() + ", dropped");
                }
            }
        }
        return out;
    }

    public static Selection parse(String entry) throws PositionParseException {
        int comma = entry.indexOf(',');
        if (comma < 0) {
            return Selection.at(parsePosition(entry, entry));
        }
        if (entry.indexOf(',', comma + 1) >= 0) {
            throw new PositionParseException(entry, "more than two positions");
        }
        Position anchor = parsePosition(entry, entry.substring(0, comma));
        Position cursor = parsePosition(entry, entry.substring(comma + 1));
        return new Selection(anchor, cursor);
    }

    private static Position parsePosition(String entry, String text) throws PositionParseException {
        int dot = text.indexOf('.');
        if (dot <= 0 || dot == text.length() - 1) {
            throw new PositionParseException(entry, "expected line.column");
        }
        int line = parseCoordinate(entry, text.substring(0, dot), "line");
        int column = parseCoordinate(entry, text.substring(dot + 1), "column");
        return new Position(line, column);
    }

    private static int parseCoordinate(String entry, String digits, String what) throws PositionParseException {
        for (int i = 0; i < digits.length(); i++) {
            char c = digits.charAt(i);
            if (c < '0' || c > '9') {
                throw new PositionParseException(entry, what + " is not a number");
            }
        }
        int value;
        try {
            value = Integer.parseInt(digits);
        } catch (NumberFormatException e) {
            throw new PositionParseException(entry, what + " is out of range");
        }
        if (value == 0) {
            throw new PositionParseException(entry, what + " must be >= 1");
        }
        return value;
    }
}
