package io.hintlite.cli.dto;

/**
 * JSON configuration file.
 * Example:
 *   {
 *     "keys": "asdfghjkl",
 *     "format": "kak",
 *     "maxWidth": 2,
 *     "abort": "q"
 *   }
 * Every field is optional; missing fields fall back to the built-in defaults.
 */
public class ConfigFile {
    public String keys;
    public String format;
    public Integer maxWidth;
    public String abort;   // single character or <esc>
}
