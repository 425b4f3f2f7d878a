// Copyright (c) 2024 Broadcom. All Rights Reserved.
// The term "Broadcom" refers to Broadcom Inc. and/or its subsidiaries.
//
// Licensed under the Apache License, Version 2.0 (the "License");
// you may not use this file except in compliance with the License.
// You may obtain a copy of the License at
//
// http://www.apache.org/licenses/LICENSE-2.0
//
// Unless required by applicable law or agreed to in writing, software
// distributed under the License is distributed on an "AS IS" BASIS,
// WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
// See the License for the specific language governing permissions and
// limitations under the License.
//
// If you have any questions regarding licensing, please contact us at
// info@rabbitmq.com.
package io.reliable.amqp.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tag;
import io.micrometer.core.instrument.Tags;
import java.util.Collections;
import java.util.concurrent.atomic.AtomicLong;

/**
 * {@link MetricsCollector} implementation using <a href="https://micrometer.io/">Micrometer</a>.
 */
public class MicrometerMetricsCollector implements MetricsCollector {

  private final AtomicLong connections;
  private final AtomicLong consumers;
  private final Counter recoveries;
  private final Counter publish, publishFlowControl, publishUnavailable;
  private final Counter consume, consumeAcknowledged, consumeRequeued, consumeDeadLettered;

  public MicrometerMetricsCollector(MeterRegistry registry) {
    this(registry, "reliable.amqp");
  }

  public MicrometerMetricsCollector(final MeterRegistry registry, final String prefix) {
    this(registry, prefix, Collections.emptyList());
  }

  public MicrometerMetricsCollector(
      final MeterRegistry registry, final String prefix, final String... tags) {
    this(registry, prefix, Tags.of(tags));
  }

  public MicrometerMetricsCollector(
      final MeterRegistry registry, final String prefix, final Iterable<Tag> tags) {
    this.connections = registry.gauge(prefix + ".connections", tags, new AtomicLong(0));
    this.consumers = registry.gauge(prefix + ".consumers", tags, new AtomicLong(0));
    this.recoveries = registry.counter(prefix + ".recoveries", tags);
    this.publish = registry.counter(prefix + ".published", tags);
    this.publishFlowControl = registry.counter(prefix + ".published_flow_control", tags);
    this.publishUnavailable = registry.counter(prefix + ".published_unavailable", tags);
    this.consume = registry.counter(prefix + ".consumed", tags);
    this.consumeAcknowledged = registry.counter(prefix + ".consumed_acknowledged", tags);
    this.consumeRequeued = registry.counter(prefix + ".consumed_requeued", tags);
    this.consumeDeadLettered = registry.counter(prefix + ".consumed_dead_lettered", tags);
  }

  @Override
  public void openConnection() {
    this.connections.incrementAndGet();
  }

  @Override
  public void closeConnection() {
    this.connections.decrementAndGet();
  }

  @Override
  public void recoverConnection() {
    this.recoveries.increment();
  }

  @Override
  public void openConsumer() {
    this.consumers.incrementAndGet();
  }

  @Override
  public void closeConsumer() {
    this.consumers.decrementAndGet();
  }

  @Override
  public void publish() {
    this.publish.increment();
  }

  @Override
  public void publishFailure(PublishFailure failure) {
    switch (failure) {
      case FLOW_CONTROL:
        this.publishFlowControl.increment();
        break;
      case UNAVAILABLE:
        this.publishUnavailable.increment();
        break;
      default:
        break;
    }
  }

  @Override
  public void consume() {
    this.consume.increment();
  }

  @Override
  public void consumeDisposition(ConsumeDisposition disposition) {
    switch (disposition) {
      case ACKNOWLEDGED:
        this.consumeAcknowledged.increment();
        break;
      case REQUEUED:
        this.consumeRequeued.increment();
        break;
      case DEAD_LETTERED:
        this.consumeDeadLettered.increment();
        break;
      default:
        break;
    }
  }
}
