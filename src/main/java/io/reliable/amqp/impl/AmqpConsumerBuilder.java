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

import static io.reliable.amqp.impl.Assert.notNull;

import io.reliable.amqp.BackOffDelayPolicy;
import io.reliable.amqp.ConsumerBuilder;
import io.reliable.amqp.DeadLetterPolicy;
import io.reliable.amqp.Resource;
import io.reliable.amqp.Subscription;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;

class AmqpConsumerBuilder implements ConsumerBuilder {

  private final AmqpClient client;
  private String queue;
  private String failureQueue;
  private Subscription.AsyncMessageHandler handler;
  private int maxAttempts = 0;
  private BackOffDelayPolicy delayPolicy;
  private DeadLetterPolicy deadLetterPolicy;
  private final List<Resource.StateListener> listeners = new ArrayList<>();

  AmqpConsumerBuilder(AmqpClient client) {
    this.client = client;
    this.delayPolicy = client.retryConfiguration().delayPolicy();
    this.deadLetterPolicy = client.retryConfiguration().deadLetterPolicy();
  }

  @Override
  public ConsumerBuilder queue(String queue) {
    this.queue = queue;
    return this;
  }

  @Override
  public ConsumerBuilder failureQueue(String failureQueue) {
    this.failureQueue = failureQueue;
    return this;
  }

  @Override
  public ConsumerBuilder messageHandler(Subscription.MessageHandler handler) {
    notNull(handler, "Message handler cannot be null");
    this.handler =
        message -> {
          try {
            handler.handle(message);
            return null;
          } catch (Exception e) {
            return CompletableFuture.failedFuture(e);
          }
        };
    return this;
  }

  @Override
  public ConsumerBuilder asyncMessageHandler(Subscription.AsyncMessageHandler handler) {
    this.handler = handler;
    return this;
  }

  @Override
  public ConsumerBuilder maxAttempts(int maxAttempts) {
    if (maxAttempts < 0) {
      throw new IllegalArgumentException("Max attempts must be positive or 0 (unlimited)");
    }
    this.maxAttempts = maxAttempts;
    return this;
  }

  @Override
  public ConsumerBuilder delayPolicy(BackOffDelayPolicy delayPolicy) {
    this.delayPolicy = delayPolicy;
    return this;
  }

  @Override
  public ConsumerBuilder deadLetterPolicy(DeadLetterPolicy deadLetterPolicy) {
    this.deadLetterPolicy = deadLetterPolicy;
    return this;
  }

  @Override
  public ConsumerBuilder listeners(Resource.StateListener... listeners) {
    if (listeners == null || listeners.length == 0) {
      this.listeners.clear();
    } else {
      this.listeners.addAll(List.of(listeners));
    }
    return this;
  }

  @Override
  public Subscription subscribe() {
    Assert.notBlank(this.queue, "A queue must be specified");
    Assert.notBlank(this.failureQueue, "A failure queue must be specified");
    notNull(this.handler, "A message handler must be set");
    notNull(this.delayPolicy, "The delay policy cannot be null");
    notNull(this.deadLetterPolicy, "The dead letter policy cannot be null");
    RetryingConsumer consumer = new RetryingConsumer(this);
    this.client.addSubscription(consumer);
    try {
      consumer.subscribe();
    } catch (RuntimeException e) {
      this.client.removeSubscription(consumer);
      throw e;
    }
    return consumer;
  }

  AmqpClient client() {
    return this.client;
  }

  String queue() {
    return this.queue;
  }

  String failureQueue() {
    return this.failureQueue;
  }

  Subscription.AsyncMessageHandler handler() {
    return this.handler;
  }

  int maxAttempts() {
    return this.maxAttempts;
  }

  BackOffDelayPolicy delayPolicy() {
    return this.delayPolicy;
  }

  DeadLetterPolicy deadLetterPolicy() {
    return this.deadLetterPolicy;
  }

  List<Resource.StateListener> listeners() {
    return this.listeners;
  }
}
