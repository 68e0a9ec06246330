package com.questrail.repomon.cli;

import com.questrail.repomon.config.BridgeConfig;
import com.questrail.repomon.driver.ConsoleMessageOutput;
import com.questrail.repomon.endpoint.Endpoint;
import com.questrail.repomon.error.BridgeException;
import com.questrail.repomon.input.InputMode;
import com.questrail.repomon.observability.Slf4jBridgeObservabilitySink;
import com.questrail.repomon.runtime.BridgeRuntime;
import com.questrail.repomon.transport.TransportKind;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.Spec;

import java.io.InputStream;
import java.io.OutputStream;
import java.io.PrintWriter;
import java.util.Objects;
import java.util.concurrent.Callable;

/**
 * Hooks stdin/stdout up to a remote repomon peer over TCP, or UDP with
 * {@code --udp}.
 *
 * <p>Every chunk read on stdin is sent as one message. Every message received
 * is printed as a {@code New Message} line followed by its display form.</p>
 */
@Command(
        name = "repomon-bridge",
        mixinStandardHelpOptions = true,
        version = "repomon-bridge 0.1.0",
        description = "Relay stdin/stdout to a repomon peer over TCP or UDP"
)
public final class RepomonBridgeCli implements Callable<Integer> {
    private static final Logger log = LoggerFactory.getLogger(RepomonBridgeCli.class);

    private final InputStream in;
    private final OutputStream out;

    @Spec
    private CommandSpec spec;

    @Parameters(
            index = "0",
            arity = "0..1",
            paramLabel = "ADDRESS",
            defaultValue = Endpoint.DEFAULT,
            description = "Remote ip:port (default: ${DEFAULT-VALUE})"
    )
    private String address;

    @Option(names = "--udp", description = "Use UDP instead of TCP")
    private boolean udp;

    @Option(names = "-v", description = "Increase diagnostic verbosity (repeatable)")
    private boolean[] verbose = new boolean[0];

    @Option(names = "-q", description = "Decrease diagnostic verbosity (repeatable)")
    private boolean[] quiet = new boolean[0];

    @Option(
            names = "--placeholder-input",
            description = "Send a placeholder message per input chunk instead of the chunk text"
    )
    private boolean placeholderInput;

    public RepomonBridgeCli(InputStream in, OutputStream out) {
        this.in = Objects.requireNonNull(in, "in");
        this.out = Objects.requireNonNull(out, "out");
    }

    public static void main(String[] args) {
        int exitCode = new CommandLine(new RepomonBridgeCli(System.in, System.out)).execute(args);
        System.exit(exitCode);
    }

    @Override
    public Integer call() {
        LogLevels.apply(verbose.length, quiet.length);
        PrintWriter err = spec.commandLine().getErr();

        try {
            BridgeRuntime runtime = BridgeRuntime.builder()
                    .withConfig(toConfig())
                    .withInput(in)
                    .withOutput(ConsoleMessageOutput.of(out))
                    .withObservabilitySink(new Slf4jBridgeObservabilitySink())
                    .build();
            runtime.run();
            return ExitCode.SUCCESS.code();
        } catch (BridgeException e) {
            err.println(e.getMessage());
            err.flush();
            return ExitCode.forError(e.kind()).code();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return ExitCode.INTERRUPTED.code();
        } catch (RuntimeException e) {
            log.error("Unexpected failure", e);
            err.println("Unexpected failure: " + e);
            err.flush();
            return ExitCode.RUNTIME_FAILURE.code();
        }
    }

    BridgeConfig toConfig() {
        return BridgeConfig.builder()
                .withRemote(address)
                .withTransport(udp ? TransportKind.DATAGRAM : TransportKind.STREAM)
                .withInputMode(placeholderInput ? InputMode.PLACEHOLDER : InputMode.TEXT)
                .build();
    }
}
