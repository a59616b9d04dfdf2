package ca.gc.cra.funnel.infrastructure.channel;

import ca.gc.cra.funnel.application.port.ChannelHandle;
import ca.gc.cra.funnel.application.port.SendResult;
import ca.gc.cra.funnel.domain.log.LogRecord;
import java.io.BufferedWriter;
import java.io.Closeable;
import java.io.IOException;
import java.io.OutputStream;
import java.io.OutputStreamWriter;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Worker-side {@link ChannelHandle} that writes records as JSON lines to a stream.
 * <p><strong>Why:</strong> Lets a child JVM forward its records to the owner over its standard output or any
 * other local pipe; the owner reads them back with {@link PipedRecordReader}.</p>
 * <p><strong>Failure handling:</strong> The first write failure marks the handle closed; later sends return
 * {@link SendResult#CLOSED}.</p>
 * <p><strong>Thread-safety:</strong> Sends are serialized so lines never interleave.</p>
 *
 * @since 0.1.0
 */
public final class PipedRecordWriter implements ChannelHandle, Closeable {
  private static final Logger log = LoggerFactory.getLogger(PipedRecordWriter.class);

  private final Writer writer;
  private final NdjsonRecordCodec codec;
  private boolean closed;

  /**
   * @param out destination stream; owned by this writer
   */
  public PipedRecordWriter(OutputStream out) {
    this(out, new NdjsonRecordCodec());
  }

  /**
   * @param out destination stream; owned by this writer
   * @param codec record codec
   */
  public PipedRecordWriter(OutputStream out, NdjsonRecordCodec codec) {
    Objects.requireNonNull(out, "out");
    this.writer = new BufferedWriter(new OutputStreamWriter(out, StandardCharsets.UTF_8));
    this.codec = Objects.requireNonNull(codec, "codec");
  }

  @Override
  public synchronized SendResult send(LogRecord record) {
    Objects.requireNonNull(record, "record");
    if (closed) {
      return SendResult.CLOSED;
    }
    try {
      writer.write(codec.encode(record));
      writer.write('\n');
      writer.flush();
      return SendResult.ACCEPTED;
    } catch (IOException ex) {
      closed = true;
      log.debug("Pipe closed while forwarding record from channel {}", record.channelName(), ex);
      return SendResult.CLOSED;
    }
  }

  @Override
  public synchronized boolean isClosed() {
    return closed;
  }

  /**
   * Flushes and closes the underlying stream. Idempotent.
   *
   * @throws IOException if closing fails
   */
  @Override
  public synchronized void close() throws IOException {
    if (closed) {
      return;
    }
    closed = true;
    writer.close();
  }
}
