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
package io.reliable.amqp.impl;

import com.rabbitmq.client.AMQP;
import com.rabbitmq.client.Channel;
import io.reliable.amqp.AmqpException;
import io.reliable.amqp.PublishOptions;
import io.reliable.amqp.metrics.MetricsCollector;
import java.io.IOException;
import java.util.HashMap;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Publishes on the current channel of the supervisor, without buffering or retry. */
final class AmqpPublisher {

  private static final Logger LOGGER = LoggerFactory.getLogger(AmqpPublisher.class);

  private static final int PERSISTENT_DELIVERY_MODE = 2;

  private final AmqpConnectionSupervisor supervisor;
  private final MetricsCollector metricsCollector;

  AmqpPublisher(AmqpConnectionSupervisor supervisor, MetricsCollector metricsCollector) {
    this.supervisor = supervisor;
    this.metricsCollector = metricsCollector;
  }

  String publish(String exchange, String routingKey, byte[] body, PublishOptions options) {
    Assert.notNull(exchange, "Exchange cannot be null, use an empty string for the default one");
    Assert.notNull(routingKey, "Routing key cannot be null");
    Assert.notNull(body, "Body cannot be null");
    Channel channel;
    try {
      channel = this.supervisor.channel();
    } catch (AmqpException e) {
      this.metricsCollector.publishFailure(MetricsCollector.PublishFailure.UNAVAILABLE);
      throw e;
    }
    if (this.supervisor.blocked()) {
      this.metricsCollector.publishFailure(MetricsCollector.PublishFailure.FLOW_CONTROL);
      throw new AmqpException.AmqpFlowControlException(
          "Connection '%s' is blocked by the broker, message to exchange '%s' not sent",
          this.supervisor.name(),
          exchange);
    }
    String messageId = UUID.randomUUID().toString();
    AMQP.BasicProperties.Builder properties = new AMQP.BasicProperties.Builder();
    properties.messageId(messageId);
    if (options.isPersistent()) {
      properties.deliveryMode(PERSISTENT_DELIVERY_MODE);
    }
    if (options.contentType() != null) {
      properties.contentType(options.contentType());
    }
    if (!options.headers().isEmpty()) {
      properties.headers(new HashMap<>(options.headers()));
    }
    try {
      channel.basicPublish(exchange, routingKey, properties.build(), body);
    } catch (IOException | RuntimeException e) {
      this.metricsCollector.publishFailure(MetricsCollector.PublishFailure.UNAVAILABLE);
      LOGGER.debug(
          "Could not publish message {} to exchange '{}': {}", messageId, exchange, e.getMessage());
      throw new AmqpException.AmqpConnectionException(
          String.format("Could not publish message to exchange '%s'", exchange), e);
    }
    this.metricsCollector.publish();
    return messageId;
  }
}
