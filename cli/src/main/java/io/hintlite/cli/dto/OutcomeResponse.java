package io.hintlite.cli.dto;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.List;

/**
 * JSON response for every command.
 * Examples:
 *   { "status": "active", "hints": [ ... ] }
 *   { "status": "resolved", "target": { "anchor": {...}, "cursor": {...} } }
 *   { "status": "cancelled" }
 *   { "status": "no-match" }
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public class OutcomeResponse {
    public String status;
    public List<HintView> hints;
    public HintView target;   // label is left out for a resolved target
}
