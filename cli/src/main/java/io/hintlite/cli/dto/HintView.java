package io.hintlite.cli.dto;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * JSON form of one hint.
 * Example:
 *   {
 *     "label": "cb",
 *     "anchor": { "line": 3, "column": 1 },
 *     "cursor": { "line": 3, "column": 9 }
 *   }
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public class HintView {
    public String label;
    public PositionView anchor;
    public PositionView cursor;
}
