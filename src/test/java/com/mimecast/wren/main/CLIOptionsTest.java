package com.mimecast.wren.main;

import org.apache.commons.cli.CommandLine;
import org.apache.commons.cli.DefaultParser;
import org.apache.commons.cli.ParseException;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class CLIOptionsTest {

    @Test
    void clientOptions() throws ParseException {
        CommandLine cmd = new DefaultParser().parse(ClientCLI.options(),
                new String[]{"-x", "10.0.0.1", "-p", "8080", "-n", "50", "-t", "8", "--path", "/", "--path", "/nope", "--head", "--publish"});

        assertEquals("10.0.0.1", cmd.getOptionValue("host"));
        assertEquals("8080", cmd.getOptionValue("port"));
        assertEquals("50", cmd.getOptionValue("requests"));
        assertEquals("8", cmd.getOptionValue("threads"));
        assertArrayEquals(new String[]{"/", "/nope"}, cmd.getOptionValues("path"));
        assertTrue(cmd.hasOption("head"));
        assertTrue(cmd.hasOption("publish"));
    }

    @Test
    void serverOptions() throws ParseException {
        CommandLine cmd = new DefaultParser().parse(ServerCLI.options(), new String[]{"--conf", "cfg/server.json5"});

        assertEquals("cfg/server.json5", cmd.getOptionValue("c"));
        assertFalse(cmd.hasOption("help"));
    }

    @Test
    void defaultPaths() {
        assertTrue(ClientCLI.DEFAULT_PATHS.contains("/"));
        assertTrue(ClientCLI.DEFAULT_PATHS.contains("/api/logs"));
    }
}
