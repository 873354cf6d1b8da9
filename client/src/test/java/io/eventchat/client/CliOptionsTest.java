package io.eventchat.client;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class CliOptionsTest {

    @Test
    void defaults_take_token_from_env() {
        var opts = Cli.Options.parse(new String[]{"listen", "10"}, "env-token");

        assertEquals("http://localhost:8080", opts.baseUrl());
        assertEquals("env-token", opts.token());
        assertArrayEquals(new String[]{"listen", "10"}, opts.rest());
    }

    @Test
    void flags_before_the_command_override_defaults() {
        var opts = Cli.Options.parse(
                new String[]{"--base-url", "http://chat:9000", "--token", "t1", "send", "10", "hi"}, null);

        assertEquals("http://chat:9000", opts.baseUrl());
        assertEquals("t1", opts.token());
        assertArrayEquals(new String[]{"send", "10", "hi"}, opts.rest());
    }

    @Test
    void flag_without_value_or_unknown_flag_fails() {
        assertThrows(Cli.CliException.class, () -> Cli.Options.parse(new String[]{"--token"}, null));
        assertThrows(Cli.CliException.class, () -> Cli.Options.parse(new String[]{"--verbose", "x"}, null));
    }
}
