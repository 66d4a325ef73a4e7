package com.github.adamzv.proton.adapters.output;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.github.adamzv.proton.domain.DecodedResult;
import com.github.adamzv.proton.domain.Problems;
import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class FormattedPrinterTest {

  private final ByteArrayOutputStream out = new ByteArrayOutputStream();
  private final ByteArrayOutputStream err = new ByteArrayOutputStream();
  private FormattedPrinter printer;

  @BeforeEach
  void setUp() {
    printer = new FormattedPrinter(
        RecordFormat.parse("%t %k %s", ZoneOffset.UTC),
        new PrintStream(out, true, StandardCharsets.UTF_8),
        new PrintStream(err, true, StandardCharsets.UTF_8)
    );
  }

  @Test
  void printsDecodedRecordsToOut() {
    printer.emit(new DecodedResult.Decoded("k", "{\"id\":1}", "orders", 0, 7L, Instant.EPOCH));

    assertEquals("orders k {\"id\":1}" + System.lineSeparator(), out.toString(StandardCharsets.UTF_8));
    assertEquals("", err.toString(StandardCharsets.UTF_8));
  }

  @Test
  void printsDecodeErrorsToErr() {
    printer.emit(new DecodedResult.DecodeError("orders", 1, 9L,
        Problems.decodeFailed("b00m", Map.of(), null)));

    assertEquals("orders [1] at offset 9: b00m" + System.lineSeparator(), err.toString(StandardCharsets.UTF_8));
    assertEquals("", out.toString(StandardCharsets.UTF_8));
  }

  @Test
  void concurrentEmitsWriteWholeRecords() throws Exception {
    int partitions = 8;
    int perPartition = 250;
    String padding = "x".repeat(200);
    FormattedPrinter valuesOnly = new FormattedPrinter(
        RecordFormat.parse("%p:%o %s", ZoneOffset.UTC),
        new PrintStream(out, false, StandardCharsets.UTF_8),
        new PrintStream(err, false, StandardCharsets.UTF_8)
    );
    ExecutorService pool = Executors.newFixedThreadPool(partitions);
    CountDownLatch start = new CountDownLatch(1);
    List<Future<?>> tasks = new ArrayList<>();
    Set<String> expected = new HashSet<>();
    try {
      for (int p = 0; p < partitions; p++) {
        int partition = p;
        for (int i = 0; i < perPartition; i++) {
          expected.add(partition + ":" + i + " {\"v\":\"" + padding + "\"}");
        }
        tasks.add(pool.submit(() -> {
          start.await();
          for (int i = 0; i < perPartition; i++) {
            valuesOnly.emit(new DecodedResult.Decoded(
                null, "{\"v\":\"" + padding + "\"}", "orders", partition, i, Instant.EPOCH));
          }
          return null;
        }));
      }
      start.countDown();
      for (Future<?> task : tasks) {
        task.get(10, TimeUnit.SECONDS);
      }
    } finally {
      pool.shutdownNow();
    }

    String[] lines = out.toString(StandardCharsets.UTF_8).split(System.lineSeparator());
    assertEquals(partitions * perPartition, lines.length);
    for (String line : lines) {
      assertTrue(expected.remove(line), "torn or duplicated line: " + line);
    }
    assertTrue(expected.isEmpty());
  }
}
