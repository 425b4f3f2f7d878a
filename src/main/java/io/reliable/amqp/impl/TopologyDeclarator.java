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

import com.rabbitmq.client.Channel;
import io.reliable.amqp.AmqpException;
import io.reliable.amqp.ConnectionSupervisor;
import io.reliable.amqp.Topology;
import java.io.IOException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Declares a {@link Topology} on a channel.
 *
 * <p>Exchanges first, then queues with their binding, then the prefetch. Declarations are
 * idempotent on the broker side, so the declarator is safe to replay on each new channel.
 */
final class TopologyDeclarator implements ConnectionSupervisor.SetupAction {

  private static final Logger LOGGER = LoggerFactory.getLogger(TopologyDeclarator.class);

  private final Topology topology;

  TopologyDeclarator(Topology topology) {
    this.topology = topology;
  }

  @Override
  public void setup(Channel channel) throws IOException {
    declare(channel, this.topology);
  }

  static void declare(Channel channel, Topology topology) {
    LOGGER.debug("Declaring {}", topology);
    for (Topology.ExchangeSpecification exchange : topology.exchanges()) {
      try {
        channel.exchangeDeclare(
            exchange.name(),
            exchange.type(),
            exchange.durable(),
            exchange.autoDelete(),
            exchange.internal(),
            exchange.arguments());
      } catch (IOException | RuntimeException e) {
        throw failure(e, "Error while declaring exchange '%s'", exchange.name());
      }
    }
    for (Topology.QueueSpecification queue : topology.queues()) {
      try {
        channel.queueDeclare(
            queue.name(), queue.durable(), queue.exclusive(), queue.autoDelete(), queue.arguments());
      } catch (IOException | RuntimeException e) {
        throw failure(e, "Error while declaring queue '%s'", queue.name());
      }
      Topology.BindingSpecification binding = queue.binding();
      if (binding != null) {
        try {
          channel.queueBind(binding.queue(), binding.exchange(), binding.key());
        } catch (IOException | RuntimeException e) {
          throw failure(
              e,
              "Error while binding queue '%s' to exchange '%s' with key '%s'",
              binding.queue(),
              binding.exchange(),
              binding.key());
        }
      }
    }
    if (topology.prefetch() > 0) {
      try {
        channel.basicQos(topology.prefetch());
      } catch (IOException | RuntimeException e) {
        throw failure(e, "Error while setting prefetch to %d", topology.prefetch());
      }
    }
  }

  private static AmqpException failure(Exception e, String format, Object... args) {
    AmqpException converted = ExceptionUtils.convert(e, format, args);
    LOGGER.debug("Topology declaration failed: {}", converted.getMessage());
    if (converted instanceof AmqpException.AmqpSetupException) {
      return converted;
    } else {
      return new AmqpException.AmqpSetupException(converted.getMessage(), e);
    }
  }

  @Override
  public String toString() {
    return "TopologyDeclarator{" + topology + '}';
  }
}
