package com.questrail.repomon.driver;

import com.questrail.repomon.model.Message;

import java.io.IOException;
import java.io.OutputStream;
import java.io.OutputStreamWriter;
import java.io.PrintStream;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.util.Objects;
import java.util.function.BooleanSupplier;

/**
 * ConsoleMessageOutput
 * -----------------------------------------------------------------------------
 * Writes each message as
 *
 * <pre>
 *   New Message
 *   &lt;display form&gt;
 * </pre>
 *
 * and flushes after every message.
 *
 * <p>A {@link PrintStream} never throws on write failure, it only sets its
 * error flag. When the target is one, the flag is checked after each flush and
 * a set flag is reported as an {@link IOException}.</p>
 */
public final class ConsoleMessageOutput implements MessageOutput
{
    static final String HEADER_LINE = "New Message";

    private final Writer writer;
    private final BooleanSupplier failed;

    public ConsoleMessageOutput(Writer writer)
    {
        this(writer, () -> false);
    }

    private ConsoleMessageOutput(Writer writer, BooleanSupplier failed)
    {
        this.writer = Objects.requireNonNull(writer, "writer");
        this.failed = failed;
    }

    public static ConsoleMessageOutput of(OutputStream out)
    {
        Writer writer = new OutputStreamWriter(out, StandardCharsets.UTF_8);
        if (out instanceof PrintStream) {
            PrintStream printStream = (PrintStream) out;
            return new ConsoleMessageOutput(writer, printStream::checkError);
        }
        return new ConsoleMessageOutput(writer);
    }

    @Override
    public void write(Message message) throws IOException
    {
        Objects.requireNonNull(message, "message");
        writer.write(HEADER_LINE);
        writer.write('\n');
        writer.write(message.displayForm());
        writer.write('\n');
        writer.flush();
        if (failed.getAsBoolean()) {
            throw new IOException("Console output stream reported an error");
        }
    }
}
