package io.hintlite.cli;

import io.hintlite.cli.format.OutputFormat;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class CliConfigTest {

    @TempDir
    Path tmp;

    @Test
    void defaults_when_only_a_command_is_given() {
        var cfg = CliConfig.fromArgs(new String[]{"generate"});

        assertEquals(CliConfig.Command.GENERATE, cfg.command());
        assertEquals("asdfghjkl", cfg.keys());
        assertEquals(OutputFormat.PLAIN, cfg.format());
        assertEquals(0, cfg.maxWidth());
        assertEquals(0x1B, cfg.abortSymbol());
        assertTrue(cfg.typed().isEmpty());
        assertFalse(cfg.verbose());
    }

    @Test
    void flags_in_long_and_short_form() {
        var cfg = CliConfig.fromArgs(new String[]{
                "-k", "abcd", "--typed", "c<esc>", "-f", "json", "--max-width", "3", "-a", "q", "-v", "reduce"});

        assertEquals(CliConfig.Command.REDUCE, cfg.command());
        assertEquals("abcd", cfg.keys());
        assertEquals(List.of((int) 'c', 0x1B), cfg.typed());
        assertEquals(OutputFormat.JSON, cfg.format());
        assertEquals(3, cfg.maxWidth());
        assertEquals('q', cfg.abortSymbol());
        assertTrue(cfg.verbose());
    }

    @Test
    void config_file_fills_in_what_the_command_line_leaves_out() throws Exception {
        Path file = tmp.resolve("hintlite.json");
        Files.writeString(file, """
                {
                  "keys": "jkl",
                  "format": "kak",
                  "maxWidth": 2,
                  "abort": "<esc>"
                }
                """);

        var cfg = CliConfig.fromArgs(new String[]{"-c", file.toString(), "--format", "plain", "generate"});

        assertEquals("jkl", cfg.keys());
        assertEquals(OutputFormat.PLAIN, cfg.format());
        assertEquals(2, cfg.maxWidth());
        assertEquals(0x1B, cfg.abortSymbol());
    }

    @Test
    void abort_key_clash_from_the_config_file_fails_the_run() throws Exception {
        Path file = tmp.resolve("clash.json");
        Files.writeString(file, "{\"keys\":\"abcd\",\"abort\":\"d\"}");

        var cfg = CliConfig.fromArgs(new String[]{"-c", file.toString(), "reduce"});
        assertEquals('d', cfg.abortSymbol());

        var err = new ByteArrayOutputStream();
        int status = Cli.run(
                new String[]{"-c", file.toString(), "-t", "da", "reduce"},
                new ByteArrayInputStream("1.1 2.2 3.3 4.4 5.5".getBytes(StandardCharsets.UTF_8)),
                new PrintStream(new ByteArrayOutputStream(), true, StandardCharsets.UTF_8),
                new PrintStream(err, true, StandardCharsets.UTF_8));
        assertEquals(1, status);
        assertTrue(err.toString(StandardCharsets.UTF_8).contains("abort key"));
    }

    @Test
    void unknown_config_fields_are_rejected() throws Exception {
        Path file = tmp.resolve("bad.json");
        Files.writeString(file, "{\"keys\":\"ab\",\"colour\":\"red\"}");

        var e = assertThrows(IllegalArgumentException.class,
                () -> CliConfig.fromArgs(new String[]{"-c", file.toString(), "generate"}));
        assertTrue(e.getMessage().contains("bad.json"));
    }

    @Test
    void usage_errors() {
        assertThrows(IllegalArgumentException.class, () -> CliConfig.fromArgs(new String[]{}));
        assertThrows(IllegalArgumentException.class, () -> CliConfig.fromArgs(new String[]{"--bogus", "generate"}));
        assertThrows(IllegalArgumentException.class, () -> CliConfig.fromArgs(new String[]{"generate", "--keys"}));
        assertThrows(IllegalArgumentException.class, () -> CliConfig.fromArgs(new String[]{"generate", "reduce"}));
        assertThrows(IllegalArgumentException.class, () -> CliConfig.fromArgs(new String[]{"-w", "wide", "generate"}));
        assertThrows(IllegalArgumentException.class, () -> CliConfig.fromArgs(new String[]{"-w", "-1", "generate"}));
        assertThrows(IllegalArgumentException.class, () -> CliConfig.fromArgs(new String[]{"-f", "xml", "generate"}));
        assertThrows(IllegalArgumentException.class, () -> CliConfig.fromArgs(new String[]{"-a", "ab", "generate"}));
    }

    @Test
    void help_needs_no_command() {
        assertTrue(CliConfig.fromArgs(new String[]{"-h"}).help());
    }
}
