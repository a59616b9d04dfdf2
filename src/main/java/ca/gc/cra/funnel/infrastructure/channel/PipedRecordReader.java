package ca.gc.cra.funnel.infrastructure.channel;

import ca.gc.cra.funnel.application.port.ChannelHandle;
import ca.gc.cra.funnel.application.port.SendResult;
import ca.gc.cra.funnel.domain.log.LogRecord;
import ca.gc.cra.funnel.logging.Logs;
import java.io.BufferedReader;
import java.io.Closeable;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicLong;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Owner-side pump that decodes JSON lines from a stream and forwards them to a channel.
 * <p><strong>Role:</strong> Runs on its own thread (see {@code LoggerFacade#attachPipe}); stops at end of stream
 * or when {@link #close()} closes the input.</p>
 * <p><strong>Failure handling:</strong> Malformed lines are reported at {@code WARN} and skipped. Records refused
 * by a closed channel are counted as lost.</p>
 * <p><strong>Thread-safety:</strong> {@link #run()} is meant for one thread; counters may be read from any.</p>
 *
 * @since 0.1.0
 */
public final class PipedRecordReader implements Runnable, Closeable {
  private static final Logger log = LoggerFactory.getLogger(PipedRecordReader.class);
  private static final int MAX_REPORTED_LINE_BYTES = 200;

  private final String label;
  private final InputStream in;
  private final ChannelHandle target;
  private final NdjsonRecordCodec codec;
  private final AtomicLong forwarded = new AtomicLong();
  private final AtomicLong malformed = new AtomicLong();
  private final AtomicLong lost = new AtomicLong();

  /**
   * @param label name used in diagnostics, for example {@code "worker-2"}
   * @param in stream carrying JSON lines; owned by this reader
   * @param target channel receiving the decoded records
   */
  public PipedRecordReader(String label, InputStream in, ChannelHandle target) {
    this(label, in, target, new NdjsonRecordCodec());
  }

  /**
   * @param label name used in diagnostics
   * @param in stream carrying JSON lines; owned by this reader
   * @param target channel receiving the decoded records
   * @param codec record codec
   */
  public PipedRecordReader(String label, InputStream in, ChannelHandle target, NdjsonRecordCodec codec) {
    this.label = Objects.requireNonNull(label, "label");
    this.in = Objects.requireNonNull(in, "in");
    this.target = Objects.requireNonNull(target, "target");
    this.codec = Objects.requireNonNull(codec, "codec");
  }

  @Override
  public void run() {
    try (BufferedReader reader = new BufferedReader(new InputStreamReader(in, StandardCharsets.UTF_8))) {
      String line;
      while ((line = reader.readLine()) != null) {
        if (line.isBlank()) {
          continue;
        }
        forward(line);
      }
      log.debug("Pipe {} reached end of stream after {} records", label, forwarded.get());
    } catch (IOException ex) {
      log.debug("Pipe {} stopped reading: {}", label, ex.getMessage());
    }
  }

  private void forward(String line) {
    LogRecord record;
    try {
      record = codec.decode(line);
    } catch (IOException ex) {
      malformed.incrementAndGet();
      log.warn("Skipping malformed record line from {}: {} ({})",
          label, Logs.truncate(line, MAX_REPORTED_LINE_BYTES), ex.getMessage());
      return;
    }
    SendResult result = target.send(record);
    if (result.accepted()) {
      forwarded.incrementAndGet();
    } else {
      lost.incrementAndGet();
      log.debug("Record from {} not accepted by channel: {}", label, result);
    }
  }

  /** Records handed to the channel. */
  public long forwardedCount() {
    return forwarded.get();
  }

  /** Lines that could not be decoded. */
  public long malformedCount() {
    return malformed.get();
  }

  /** Decoded records the channel refused. */
  public long lostCount() {
    return lost.get();
  }

  public String label() {
    return label;
  }

  /**
   * Closes the input stream, which ends {@link #run()} once a blocked read returns.
   *
   * @throws IOException if closing fails
   */
  @Override
  public void close() throws IOException {
    in.close();
  }
}
