package ca.gc.cra.funnel.infrastructure.channel;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.funnel.application.port.SendResult;
import ca.gc.cra.funnel.domain.log.LogRecord;
import ca.gc.cra.funnel.testing.LogCapture;
import ca.gc.cra.funnel.testing.Records;
import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.io.PipedInputStream;
import java.io.PipedOutputStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.Test;

class PipedRecordChannelTest {
  @Test
  void recordsCrossThePipeIntoTheChannel() throws Exception {
    QueueRecordChannel channel = QueueRecordChannel.unbounded();
    PipedInputStream in = new PipedInputStream(1 << 16);
    PipedRecordWriter writer = new PipedRecordWriter(new PipedOutputStream(in));
    PipedRecordReader reader = new PipedRecordReader("worker-1", in, channel);
    Thread readerThread = new Thread(reader, "reader");
    readerThread.start();

    for (int i = 0; i < 20; i++) {
      assertEquals(SendResult.ACCEPTED, writer.send(Records.info("app.worker", "msg " + i)));
    }
    writer.close();
    readerThread.join(5_000);
    channel.close();

    List<String> messages = new ArrayList<>();
    Optional<LogRecord> next;
    while ((next = channel.receive()).isPresent()) {
      messages.add(next.get().message());
    }
    assertEquals(20, messages.size());
    assertEquals("msg 0", messages.get(0));
    assertEquals("msg 19", messages.get(19));
    assertEquals(20, reader.forwardedCount());
  }

  @Test
  void malformedLinesAreSkippedWithWarning() throws Exception {
    NdjsonRecordCodec codec = new NdjsonRecordCodec();
    String payload = codec.encode(Records.info("app", "before")) + "\n"
        + "{broken\n"
        + "\n"
        + codec.encode(Records.info("app", "after")) + "\n";
    QueueRecordChannel channel = QueueRecordChannel.unbounded();
    PipedRecordReader reader = new PipedRecordReader(
        "worker-2", new ByteArrayInputStream(payload.getBytes(StandardCharsets.UTF_8)), channel);

    try (LogCapture capture = LogCapture.of(PipedRecordReader.class)) {
      reader.run();

      assertEquals(1, capture.messages().stream().filter(m -> m.contains("malformed")).count());
    }

    assertEquals(2, reader.forwardedCount());
    assertEquals(1, reader.malformedCount());
    assertEquals("before", channel.receive().orElseThrow().message());
    assertEquals("after", channel.receive().orElseThrow().message());
  }

  @Test
  void recordsRefusedByClosedChannelAreCountedAsLost() throws Exception {
    NdjsonRecordCodec codec = new NdjsonRecordCodec();
    QueueRecordChannel channel = QueueRecordChannel.unbounded();
    channel.close();
    PipedRecordReader reader = new PipedRecordReader("worker-3",
        new ByteArrayInputStream((codec.encode(Records.info("app", "x")) + "\n").getBytes(StandardCharsets.UTF_8)),
        channel);

    reader.run();

    assertEquals(1, reader.lostCount());
    assertEquals(0, reader.forwardedCount());
  }

  @Test
  void writerReportsClosedAfterStreamFailure() {
    OutputStream failing = new OutputStream() {
      @Override
      public void write(int b) throws IOException {
        throw new IOException("pipe broken");
      }
    };
    PipedRecordWriter writer = new PipedRecordWriter(failing);

    assertEquals(SendResult.CLOSED, writer.send(Records.info("app", "lost")));
    assertTrue(writer.isClosed());
    assertEquals(SendResult.CLOSED, writer.send(Records.info("app", "also lost")));
  }

  @Test
  void writerEmitsOneLinePerRecord() throws Exception {
    ByteArrayOutputStream out = new ByteArrayOutputStream();
    try (PipedRecordWriter writer = new PipedRecordWriter(out)) {
      writer.send(Records.info("app", "a"));
      writer.send(Records.info("app", "b"));
    }

    String[] lines = out.toString(StandardCharsets.UTF_8).split("\n");
    assertEquals(2, lines.length);
    assertEquals("b", new NdjsonRecordCodec().decode(lines[1]).message());
  }
}
