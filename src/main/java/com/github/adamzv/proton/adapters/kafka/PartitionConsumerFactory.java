package com.github.adamzv.proton.adapters.kafka;

import org.apache.kafka.clients.consumer.Consumer;

@FunctionalInterface
public interface PartitionConsumerFactory {

  Consumer<byte[], byte[]> create(String topic, int partition);
}
