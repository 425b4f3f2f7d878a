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
import com.rabbitmq.client.DefaultConsumer;
import com.rabbitmq.client.Envelope;
import io.reliable.amqp.BackOffDelayPolicy;
import io.reliable.amqp.ConnectionSupervisor;
import io.reliable.amqp.Message;
import java.io.IOException;
import java.time.Duration;
import java.util.HashMap;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Broker-side delay for failed messages.
 *
 * <p>A failed message goes to the <code>&lt;prefix&gt;.delayed</code> queue with a per-message
 * expiration. When it expires, the broker dead-letters it to <code>&lt;prefix&gt;.ready</code>. The
 * relay consumer of the ready queue sends it back to the queue named in the {@link
 * Message#ORIGINAL_QUEUE_HEADER} header.
 *
 * <p>Registered as a setup action, so the queues and the relay are restored after a reconnect.
 */
final class DelayedRedelivery implements ConnectionSupervisor.SetupAction {

  private static final Logger LOGGER = LoggerFactory.getLogger(DelayedRedelivery.class);

  static final String DEFAULT_PREFIX = "reliable-amqp-retry";

  private final boolean activated;
  private final String delayedQueue;
  private final String readyQueue;

  DelayedRedelivery(boolean activated, String prefix) {
    this.activated = activated;
    String p = prefix == null ? DEFAULT_PREFIX : prefix;
    this.delayedQueue = p + ".delayed";
    this.readyQueue = p + ".ready";
  }

  @Override
  public void setup(Channel channel) throws IOException {
    if (!this.activated) {
      return;
    }
    Map<String, Object> arguments = new HashMap<>();
    arguments.put("x-dead-letter-exchange", "");
    arguments.put("x-dead-letter-routing-key", this.readyQueue);
    channel.queueDeclare(this.delayedQueue, true, false, false, arguments);
    channel.queueDeclare(this.readyQueue, true, false, false, null);
    String tag = channel.basicConsume(this.readyQueue, false, new RelayConsumer(channel));
    LOGGER.debug("Relay consumer {} started on '{}'", tag, this.readyQueue);
  }

  /**
   * Send the message back to its queue after the delay.
   *
   * <p>A zero delay, or a deactivated redelivery, publishes straight to the original queue. The
   * delay must not be {@link BackOffDelayPolicy#TIMEOUT}.
   */
  void requeue(
      Channel channel,
      String queue,
      AMQP.BasicProperties properties,
      byte[] body,
      int attempts,
      Duration delay)
      throws IOException {
    if (BackOffDelayPolicy.TIMEOUT.equals(delay)) {
      throw new IllegalArgumentException("No redelivery delay for message on queue " + queue);
    }
    Map<String, Object> headers =
        properties.getHeaders() == null
            ? new HashMap<>()
            : new HashMap<>(properties.getHeaders());
    headers.put(Message.ATTEMPTS_HEADER, attempts);
    headers.put(Message.ORIGINAL_QUEUE_HEADER, queue);
    AMQP.BasicProperties.Builder builder = properties.builder().headers(headers);
    if (!this.activated || delay.isZero() || delay.isNegative()) {
      channel.basicPublish("", queue, builder.expiration(null).build(), body);
    } else {
      channel.basicPublish(
          "",
          this.delayedQueue,
          builder.expiration(String.valueOf(delay.toMillis())).build(),
          body);
    }
  }

  private final class RelayConsumer extends DefaultConsumer {

    private RelayConsumer(Channel channel) {
      super(channel);
    }

    @Override
    public void handleDelivery(
        String consumerTag, Envelope envelope, AMQP.BasicProperties properties, byte[] body)
        throws IOException {
      Channel channel = this.getChannel();
      Object target =
          properties.getHeaders() == null
              ? null
              : properties.getHeaders().get(Message.ORIGINAL_QUEUE_HEADER);
      if (target == null) {
        LOGGER.warn(
            "Message {} on '{}' has no '{}' header, discarding it",
            properties.getMessageId(),
            readyQueue,
            Message.ORIGINAL_QUEUE_HEADER);
        channel.basicNack(envelope.getDeliveryTag(), false, false);
        return;
      }
      try {
        channel.basicPublish(
            "", target.toString(), properties.builder().expiration(null).build(), body);
        channel.basicAck(envelope.getDeliveryTag(), false);
      } catch (IOException | RuntimeException e) {
        LOGGER.warn(
            "Could not relay message {} to '{}': {}",
            properties.getMessageId(),
            target,
            e.getMessage());
        if (channel.isOpen()) {
          channel.basicNack(envelope.getDeliveryTag(), false, true);
        }
      }
    }
  }

  @Override
  public String toString() {
    return "DelayedRedelivery{"
        + "delayedQueue='"
        + delayedQueue
        + '\''
        + ", readyQueue='"
        + readyQueue
        + '\''
        + '}';
  }
}
