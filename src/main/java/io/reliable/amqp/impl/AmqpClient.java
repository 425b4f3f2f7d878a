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
import static io.reliable.amqp.Resource.State.OPEN;
import static io.reliable.amqp.Resource.State.RECOVERING;

import com.rabbitmq.client.ConnectionFactory;
import io.reliable.amqp.AmqpException;
import io.reliable.amqp.Client;
import io.reliable.amqp.ConnectionSupervisor;
import io.reliable.amqp.ConsumerBuilder;
import io.reliable.amqp.PublishOptions;
import io.reliable.amqp.Resource;
import io.reliable.amqp.Subscription;
import io.reliable.amqp.metrics.MetricsCollector;
import java.net.URISyntaxException;
import java.security.KeyManagementException;
import java.security.NoSuchAlgorithmException;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

final class AmqpClient implements Client {

  private static final Logger LOGGER = LoggerFactory.getLogger(AmqpClient.class);

  private static final AtomicLong ID_SEQUENCE = new AtomicLong(0);

  private static final Duration HANDLER_SHUTDOWN_TIMEOUT = Duration.ofSeconds(10);

  private final long id;
  private final AmqpConnectionSupervisor supervisor;
  private final AmqpPublisher publisher;
  private final DelayedRedelivery delayedRedelivery;
  private final AmqpClientBuilder.AmqpRetryConfiguration retryConfiguration;
  private final ExecutorService handlerExecutor;
  private final boolean internalHandlerExecutor;
  private final ScheduledExecutorService scheduledExecutorService;
  private final boolean internalScheduledExecutor;
  private final MetricsCollector metricsCollector;
  private final List<RetryingConsumer> subscriptions = new CopyOnWriteArrayList<>();
  private final AtomicBoolean closed = new AtomicBoolean(false);

  AmqpClient(AmqpClientBuilder builder) {
    this.id = ID_SEQUENCE.getAndIncrement();
    String threadPrefix = String.format("reliable-amqp-client-%d-", this.id);
    if (builder.handlerExecutor() == null) {
      this.handlerExecutor =
          Executors.newCachedThreadPool(Utils.threadFactory(threadPrefix + "handler-"));
      this.internalHandlerExecutor = true;
    } else {
      this.handlerExecutor = builder.handlerExecutor();
      this.internalHandlerExecutor = false;
    }
    if (builder.scheduledExecutorService() == null) {
      this.scheduledExecutorService =
          Executors.newScheduledThreadPool(1, Utils.threadFactory(threadPrefix + "scheduler-"));
      this.internalScheduledExecutor = true;
    } else {
      this.scheduledExecutorService = builder.scheduledExecutorService();
      this.internalScheduledExecutor = false;
    }
    this.metricsCollector = builder.metricsCollector();
    this.retryConfiguration = builder.retryConfiguration();

    ConnectionFactory connectionFactory = connectionFactory(builder);
    this.supervisor =
        new AmqpConnectionSupervisor(
            connectionFactory,
            builder.name(),
            builder.recoveryConfiguration(),
            this.scheduledExecutorService,
            this.metricsCollector,
            builder.listeners());
    this.supervisor.addSetup(new TopologyDeclarator(builder.topology()));
    this.delayedRedelivery =
        new DelayedRedelivery(this.retryConfiguration.activated(), retryConfiguration.queuePrefix());
    this.supervisor.addSetup(this.delayedRedelivery);
    this.publisher = new AmqpPublisher(this.supervisor, this.metricsCollector);
  }

  private static ConnectionFactory connectionFactory(AmqpClientBuilder builder) {
    ConnectionFactory cf =
        builder.connectionFactory() == null ? new ConnectionFactory() : builder.connectionFactory();
    if (builder.uri() != null) {
      try {
        cf.setUri(builder.uri());
      } catch (URISyntaxException | NoSuchAlgorithmException | KeyManagementException e) {
        throw new IllegalArgumentException("Invalid broker URI: " + builder.uri(), e);
      }
    }
    // recovery is handled by the supervisor
    cf.setAutomaticRecoveryEnabled(false);
    cf.setTopologyRecoveryEnabled(false);
    return cf;
  }

  @Override
  public void init() {
    this.checkNotClosed();
    LOGGER.debug("Initializing client {}", this.id);
    this.supervisor.connect();
  }

  @Override
  public Subscription consume(
      String queue, String failureQueue, Subscription.MessageHandler handler) {
    return this.consume(queue, failureQueue, handler, 0);
  }

  @Override
  public Subscription consume(
      String queue, String failureQueue, Subscription.MessageHandler handler, int maxAttempts) {
    return this.consumerBuilder()
        .queue(queue)
        .failureQueue(failureQueue)
        .messageHandler(handler)
        .maxAttempts(maxAttempts)
        .subscribe();
  }

  @Override
  public ConsumerBuilder consumerBuilder() {
    this.checkNotClosed();
    return new AmqpConsumerBuilder(this);
  }

  @Override
  public String publish(String exchange, String routingKey, byte[] body) {
    return this.publish(exchange, routingKey, body, PublishOptions.options());
  }

  @Override
  public String publish(String exchange, String routingKey, byte[] body, PublishOptions options) {
    return this.publisher.publish(
        exchange, routingKey, body, options == null ? PublishOptions.options() : options);
  }

  @Override
  public ConnectionSupervisor supervisor() {
    return this.supervisor;
  }

  @Override
  public void close() {
    Resource.State state = this.supervisor.state();
    if (state != OPEN && state != RECOVERING) {
      if (state == CLOSED && this.closed.compareAndSet(false, true)) {
        // the connection closed itself, nothing else releases the executors
        LOGGER.debug("Releasing executors of client {}", this.id);
        this.shutdownExecutors();
      }
      throw new AmqpException.AmqpResourceInvalidStateException(
          "Cannot close client, it is not connected (state %s)", state);
    }
    if (this.closed.compareAndSet(false, true)) {
      LOGGER.debug("Closing client {}", this.id);
      for (RetryingConsumer subscription : this.subscriptions) {
        try {
          subscription.cancel();
        } catch (Exception e) {
          LOGGER.info("Error while cancelling subscription {}: {}", subscription, e.getMessage());
        }
      }
      if (this.internalHandlerExecutor) {
        Utils.shutdownGracefully(this.handlerExecutor, HANDLER_SHUTDOWN_TIMEOUT);
      }
      try {
        this.supervisor.close();
      } catch (AmqpException.AmqpResourceInvalidStateException e) {
        LOGGER.debug("Connection already closed: {}", e.getMessage());
      } finally {
        if (this.internalScheduledExecutor) {
          this.scheduledExecutorService.shutdownNow();
        }
      }
      LOGGER.debug("Client {} closed", this.id);
    }
  }

  // internal API

  private void shutdownExecutors() {
    if (this.internalHandlerExecutor) {
      Utils.shutdownGracefully(this.handlerExecutor, HANDLER_SHUTDOWN_TIMEOUT);
    }
    if (this.internalScheduledExecutor) {
      this.scheduledExecutorService.shutdownNow();
    }
  }

  private void checkNotClosed() {
    if (this.closed.get()) {
      throw new AmqpException.AmqpResourceClosedException("Client is closed");
    }
  }

  void addSubscription(RetryingConsumer subscription) {
    this.subscriptions.add(subscription);
  }

  void removeSubscription(RetryingConsumer subscription) {
    this.subscriptions.remove(subscription);
  }

  AmqpConnectionSupervisor supervisorImpl() {
    return this.supervisor;
  }

  DelayedRedelivery delayedRedelivery() {
    return this.delayedRedelivery;
  }

  AmqpClientBuilder.AmqpRetryConfiguration retryConfiguration() {
    return this.retryConfiguration;
  }

  ExecutorService handlerExecutor() {
    return this.handlerExecutor;
  }

  ScheduledExecutorService scheduledExecutorService() {
    return this.scheduledExecutorService;
  }

  MetricsCollector metricsCollector() {
    return this.metricsCollector;
  }

  @Override
  public String toString() {
    return "AmqpClient{" + "id=" + id + ", supervisor=" + supervisor + '}';
  }
}
