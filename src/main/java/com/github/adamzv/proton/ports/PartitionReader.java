package com.github.adamzv.proton.ports;

import com.github.adamzv.proton.domain.ConsumedMessage;
import java.time.Duration;
import java.util.List;
import java.util.OptionalLong;

public interface PartitionReader extends AutoCloseable {

  /**
   * Waits up to {@code timeout} for the next batch, in offset order. Returns an empty list when the
   * timeout elapses or the reader was woken up.
   */
  List<ConsumedMessage> poll(Duration timeout);

  /**
   * The offset one past the last message currently in the partition, when known.
   */
  OptionalLong highWatermark();

  void wakeup();

  @Override
  void close();
}
