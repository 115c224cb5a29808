package io.hintlite.cli.format;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.hintlite.cli.GraphemeTruncator;
import io.hintlite.cli.Position;
import io.hintlite.cli.Selection;
import io.hintlite.cli.dto.HintView;
import io.hintlite.cli.dto.OutcomeResponse;
import io.hintlite.cli.dto.PositionView;
import io.hintlite.core.Hint;

import java.io.UncheckedIOException;
import java.util.List;

/**
 * One JSON document per invocation, see {@link OutcomeResponse}.
 */
public final class JsonFormatter implements HintFormatter {

    private final ObjectMapper mapper = new ObjectMapper();
    private final GraphemeTruncator truncator;

    public JsonFormatter(GraphemeTruncator truncator) {
        this.truncator = truncator;
    }

    @Override
    public String hints(List<Hint<Selection>> hints) {
        var resp = new OutcomeResponse();
        resp.status = "active";
        resp.hints = hints.stream()
                .map(h -> view(truncator.truncate(h.label().toString()), h.target()))
                .toList();
        return write(resp);
    }

    @Override
    public String resolved(Selection target) {
        var resp = new OutcomeResponse();
        resp.status = "resolved";
        resp.target = view(null, target);
        return write(resp);
    }

    @Override
    public String cancelled() {
        return status("cancelled");
    }

    @Override
    public String noMatch() {
        return status("no-match");
    }

    private String status(String status) {
        var resp = new OutcomeResponse();
        resp.status = status;
        return write(resp);
    }

    private static HintView view(String label, Selection selection) {
        var v = new HintView();
        v.label = label;
        v.anchor = position(selection.anchor());
        v.cursor = position(selection.cursor());
        return v;
    }

    private static PositionView position(Position p) {
        return new PositionView(p.line(), p.column());
    }

    private String write(OutcomeResponse resp) {
        try {
            return mapper.writeValueAsString(resp) + "\n";
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException("Failed to serialize " + resp.status + " response", e);
        }
    }
}
