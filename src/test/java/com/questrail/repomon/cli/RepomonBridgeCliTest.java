package com.questrail.repomon.cli;

import ch.qos.logback.classic.Level;
import com.questrail.repomon.config.BridgeConfig;
import com.questrail.repomon.error.BridgeErrorKind;
import com.questrail.repomon.input.InputMode;
import com.questrail.repomon.transport.TransportKind;

import org.junit.jupiter.api.Test;
import picocli.CommandLine;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.net.InetAddress;
import java.net.ServerSocket;

import static org.junit.jupiter.api.Assertions.*;

final class RepomonBridgeCliTest {

    private final StringWriter err = new StringWriter();
    private final ByteArrayOutputStream out = new ByteArrayOutputStream();

    private RepomonBridgeCli cli() {
        return new RepomonBridgeCli(new ByteArrayInputStream(new byte[0]), out);
    }

    private int execute(String... args) {
        CommandLine cmd = new CommandLine(cli());
        cmd.setErr(new PrintWriter(err, true));
        return cmd.execute(args);
    }

    @Test
    void noArgumentsSelectsDefaults() {
        RepomonBridgeCli cli = cli();
        new CommandLine(cli).parseArgs();

        BridgeConfig config = cli.toConfig();

        assertEquals(BridgeConfig.defaults(), config);
    }

    @Test
    void flagsMapOntoConfig() {
        RepomonBridgeCli cli = cli();
        new CommandLine(cli).parseArgs("--udp", "--placeholder-input", "-vv", "[::1]:9000");

        BridgeConfig config = cli.toConfig();

        assertEquals(TransportKind.DATAGRAM, config.transport());
        assertEquals(InputMode.PLACEHOLDER, config.inputMode());
        assertEquals("[0:0:0:0:0:0:0:1]:9000", config.remote().toString());
    }

    @Test
    void invalidAddressExitsWithUsageCode() {
        int code = execute("not-an-address");

        assertEquals(ExitCode.INVALID_ARGS.code(), code);
        assertTrue(err.toString().contains("not-an-address"));
    }

    @Test
    void unknownOptionIsRejectedByParser() {
        assertNotEquals(ExitCode.SUCCESS.code(), execute("--bogus"));
    }

    @Test
    void refusedConnectionExitsWithConnectionCode() throws Exception {
        int port;
        try (ServerSocket reserved = new ServerSocket(0, 1, InetAddress.getLoopbackAddress())) {
            port = reserved.getLocalPort();
        }

        int code = execute("127.0.0.1:" + port);

        assertEquals(ExitCode.CONNECTION_ERROR.code(), code);
        assertEquals(0, out.size());
    }

    @Test
    void exitCodesFollowErrorKind() {
        assertEquals(ExitCode.INVALID_ARGS, ExitCode.forError(BridgeErrorKind.ADDRESS_RESOLUTION));
        assertEquals(ExitCode.CONNECTION_ERROR, ExitCode.forError(BridgeErrorKind.CONNECTION));
        assertEquals(ExitCode.IO_ERROR, ExitCode.forError(BridgeErrorKind.BIND));
        assertEquals(ExitCode.IO_ERROR, ExitCode.forError(BridgeErrorKind.OUTPUT));
    }

    @Test
    void verbosityShiftsFromWarn() {
        assertEquals(Level.WARN, LogLevels.resolve(0, 0));
        assertEquals(Level.INFO, LogLevels.resolve(1, 0));
        assertEquals(Level.TRACE, LogLevels.resolve(5, 0));
        assertEquals(Level.ERROR, LogLevels.resolve(0, 1));
        assertEquals(Level.OFF, LogLevels.resolve(0, 4));
        assertEquals(Level.WARN, LogLevels.resolve(2, 2));
    }
}
