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

import static io.reliable.amqp.Resource.State.CLOSED;
import static io.reliable.amqp.Resource.State.CLOSING;
import static io.reliable.amqp.Resource.State.OPEN;
import static io.reliable.amqp.Resource.State.OPENING;

import com.rabbitmq.client.AMQP;
import com.rabbitmq.client.Channel;
import com.rabbitmq.client.DefaultConsumer;
import com.rabbitmq.client.Envelope;
import io.reliable.amqp.AmqpException;
import io.reliable.amqp.BackOffDelayPolicy;
import io.reliable.amqp.ConnectionSupervisor;
import io.reliable.amqp.DeadLetterPolicy;
import io.reliable.amqp.Message;
import io.reliable.amqp.Subscription;
import io.reliable.amqp.metrics.MetricsCollector;
import java.io.IOException;
import java.time.Duration;
import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Consumer that retries failed messages and dead-letters them after too many attempts.
 *
 * <p>Subscribes through a setup action, so the subscription is restored on each new channel.
 * Messages are handled on the handler executor. The outcome is settled on the channel the message
 * came from: acknowledged, requeued with a delay, or moved to the failure queue.
 */
final class RetryingConsumer extends ResourceBase implements Subscription {

  private static final Logger LOGGER = LoggerFactory.getLogger(RetryingConsumer.class);

  private static final AtomicLong ID_SEQUENCE = new AtomicLong(0);

  private final long id;
  private final String queue;
  private final String failureQueue;
  private final AsyncMessageHandler handler;
  private final int maxAttempts;
  private final BackOffDelayPolicy delayPolicy;
  private final DeadLetterPolicy deadLetterPolicy;
  private final AmqpConnectionSupervisor supervisor;
  private final DelayedRedelivery delayedRedelivery;
  private final ExecutorService handlerExecutor;
  private final MetricsCollector metricsCollector;
  private final AmqpClient client;
  private final AtomicBoolean closed = new AtomicBoolean(false);
  private volatile ConnectionSupervisor.SetupRegistration registration;
  private volatile String consumerTag;
  private volatile Channel consumerChannel;

  RetryingConsumer(AmqpConsumerBuilder builder) {
    super(builder.listeners(), OPENING);
    this.id = ID_SEQUENCE.getAndIncrement();
    this.client = builder.client();
    this.queue = builder.queue();
    this.failureQueue = builder.failureQueue();
    this.handler = builder.handler();
    this.maxAttempts = builder.maxAttempts();
    this.delayPolicy = builder.delayPolicy();
    this.deadLetterPolicy = builder.deadLetterPolicy();
    this.supervisor = this.client.supervisorImpl();
    this.delayedRedelivery = this.client.delayedRedelivery();
    this.handlerExecutor = this.client.handlerExecutor();
    this.metricsCollector = this.client.metricsCollector();
  }

  void subscribe() {
    try {
      this.registration = this.supervisor.addSetup(this::consume);
    } catch (AmqpException e) {
      this.closed.set(true);
      this.state(CLOSED, e);
      throw e;
    }
    this.metricsCollector.openConsumer();
    this.state(OPEN);
    LOGGER.debug("Consumer {} subscribed to queue '{}'", this.id, this.queue);
  }

  @Override
  public String queue() {
    return this.queue;
  }

  @Override
  public String failureQueue() {
    return this.failureQueue;
  }

  @Override
  public String consumerTag() {
    return this.consumerTag;
  }

  @Override
  public void cancel() {
    if (this.closed.compareAndSet(false, true)) {
      this.state(CLOSING);
      LOGGER.debug("Cancelling consumer {} on queue '{}'", this.id, this.queue);
      ConnectionSupervisor.SetupRegistration r = this.registration;
      if (r != null) {
        this.supervisor.removeSetup(
            r,
            channel -> {
              String tag = this.consumerTag;
              if (tag != null && channel == this.consumerChannel) {
                channel.basicCancel(tag);
              }
            });
      }
      this.client.removeSubscription(this);
      this.metricsCollector.closeConsumer();
      this.state(CLOSED);
    }
  }

  @Override
  public void close() {
    this.cancel();
  }

  // internal API

  private void consume(Channel channel) throws IOException {
    if (this.closed.get()) {
      return;
    }
    // dead-lettering publishes to the default exchange, the failure queue must exist
    channel.queueDeclarePassive(this.failureQueue);
    String tag = channel.basicConsume(this.queue, false, new DeliveryConsumer(channel));
    this.consumerChannel = channel;
    this.consumerTag = tag;
    LOGGER.debug("Consumer {} started on queue '{}' with tag {}", this.id, this.queue, tag);
  }

  private void handle(Channel channel, AmqpMessage message) {
    CompletionStage<?> outcome;
    try {
      outcome = this.handler.handle(message);
    } catch (Exception e) {
      outcome = CompletableFuture.failedFuture(e);
    }
    if (outcome == null) {
      this.acknowledge(channel, message);
    } else {
      outcome.whenComplete(
          (result, failure) -> {
            if (failure == null) {
              this.acknowledge(channel, message);
            } else {
              this.handleFailure(channel, message, unwrap(failure));
            }
          });
    }
  }

  private void acknowledge(Channel channel, AmqpMessage message) {
    try {
      channel.basicAck(message.deliveryTag(), false);
      this.metricsCollector.consumeDisposition(
          MetricsCollector.ConsumeDisposition.ACKNOWLEDGED);
    } catch (IOException | RuntimeException e) {
      LOGGER.warn(
          "Could not acknowledge message {} from queue '{}', broker will redeliver it: {}",
          message.messageId(),
          this.queue,
          e.getMessage());
    }
  }

  private void handleFailure(Channel channel, AmqpMessage message, Throwable failure) {
    int attempts = message.attempt() + 1;
    Duration delay =
        this.maxAttempts == 0 || attempts <= this.maxAttempts - 1
            ? this.delayPolicy.delay(attempts)
            : BackOffDelayPolicy.TIMEOUT;
    if (!BackOffDelayPolicy.TIMEOUT.equals(delay)) {
      LOGGER.debug(
          "Message {} from queue '{}' failed (attempt {}), requeuing in {} ms: {}",
          message.messageId(),
          this.queue,
          attempts,
          delay.toMillis(),
          failure.getMessage());
      try {
        this.delayedRedelivery.requeue(
            channel, this.queue, message.properties(), message.body(), attempts, delay);
        channel.basicAck(message.deliveryTag(), false);
        this.metricsCollector.consumeDisposition(MetricsCollector.ConsumeDisposition.REQUEUED);
      } catch (IOException | RuntimeException e) {
        LOGGER.warn(
            "Could not requeue message {} from queue '{}': {}",
            message.messageId(),
            this.queue,
            e.getMessage());
        this.nack(channel, message);
      }
    } else {
      LOGGER.info(
          "Message {} from queue '{}' failed after {} attempt(s), moving it to '{}'",
          message.messageId(),
          this.queue,
          attempts,
          this.failureQueue);
      try {
        channel.basicPublish(
            "",
            this.failureQueue,
            this.deadLetterProperties(message, failure, attempts),
            message.body());
        channel.basicAck(message.deliveryTag(), false);
        this.metricsCollector.consumeDisposition(
            MetricsCollector.ConsumeDisposition.DEAD_LETTERED);
      } catch (IOException | RuntimeException e) {
        LOGGER.warn(
            "Could not dead-letter message {} from queue '{}' to '{}': {}",
            message.messageId(),
            this.queue,
            this.failureQueue,
            e.getMessage());
        this.nack(channel, message);
      }
    }
  }

  private AMQP.BasicProperties deadLetterProperties(
      AmqpMessage message, Throwable failure, int attempts) {
    AMQP.BasicProperties properties = message.properties();
    if (this.deadLetterPolicy == DeadLetterPolicy.STAMPED) {
      Map<String, Object> headers =
          properties.getHeaders() == null
              ? new HashMap<>()
              : new HashMap<>(properties.getHeaders());
      headers.put(Message.ATTEMPTS_HEADER, attempts);
      headers.put(Message.ORIGINAL_QUEUE_HEADER, this.queue);
      headers.put(DeadLetterPolicy.REASON_HEADER, reason(failure));
      headers.put(DeadLetterPolicy.TIMESTAMP_HEADER, System.currentTimeMillis());
      return properties.builder().headers(headers).expiration(null).build();
    } else {
      return properties;
    }
  }

  private void nack(Channel channel, AmqpMessage message) {
    try {
      channel.basicNack(message.deliveryTag(), false, true);
    } catch (IOException | RuntimeException e) {
      LOGGER.warn(
          "Could not nack message {} from queue '{}', broker will redeliver it: {}",
          message.messageId(),
          this.queue,
          e.getMessage());
    }
  }

  private static String reason(Throwable failure) {
    String message = failure.getMessage();
    return message == null ? failure.getClass().getName() : message;
  }

  private static Throwable unwrap(Throwable failure) {
    if (failure instanceof CompletionException && failure.getCause() != null) {
      return failure.getCause();
    } else {
      return failure;
    }
  }

  private final class DeliveryConsumer extends DefaultConsumer {

    private DeliveryConsumer(Channel channel) {
      super(channel);
    }

    @Override
    public void handleDelivery(
        String consumerTag, Envelope envelope, AMQP.BasicProperties properties, byte[] body)
        throws IOException {
      Channel channel = this.getChannel();
      if (closed.get()) {
        // cancelled, give the message back
        channel.basicNack(envelope.getDeliveryTag(), false, true);
        return;
      }
      metricsCollector.consume();
      AmqpMessage message = new AmqpMessage(queue, envelope, properties, body);
      try {
        handlerExecutor.execute(() -> handle(channel, message));
      } catch (RejectedExecutionException e) {
        LOGGER.info(
            "Handler executor rejected message {} from queue '{}', returning it",
            message.messageId(),
            queue);
        nack(channel, message);
      }
    }

    @Override
    public void handleCancel(String consumerTag) {
      LOGGER.warn(
          "Consumer {} on queue '{}' cancelled by the broker (tag {})", id, queue, consumerTag);
    }
  }

  @Override
  public String toString() {
    return "RetryingConsumer{"
        + "id="
        + id
        + ", queue='"
        + queue
        + '\''
        + ", failureQueue='"
        + failureQueue
        + '\''
        + ", maxAttempts="
        + maxAttempts
        + '}';
  }
}
