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
package io.reliable.amqp;

/**
 * Entry point of the library: reliable consuming and publishing on top of a supervised
 * connection.
 *
 * <p>Instances are created with a {@link ClientBuilder}, see {@link
 * io.reliable.amqp.impl.AmqpClientBuilder}.
 *
 * <p>Implementations must be thread-safe.
 */
public interface Client extends AutoCloseable {

  /**
   * Connect to the broker and declare the topology.
   *
   * <p>Returns once the topology is declared. This is a no-op if the client is already connected.
   *
   * @throws AmqpException.AmqpConnectionException if the connection cannot be opened
   * @throws AmqpException.AmqpSetupException if the topology declaration fails
   */
  void init();

  /**
   * Consume a queue with no limit of attempts.
   *
   * @param queue the queue to consume from
   * @param failureQueue the queue for messages that exhausted their attempts
   * @param handler the processing logic
   * @return the subscription, to cancel it
   */
  Subscription consume(String queue, String failureQueue, Subscription.MessageHandler handler);

  /**
   * Consume a queue.
   *
   * @param queue the queue to consume from
   * @param failureQueue the queue for messages that exhausted their attempts
   * @param handler the processing logic
   * @param maxAttempts maximum number of attempts, 0 for no limit
   * @return the subscription, to cancel it
   */
  Subscription consume(
      String queue, String failureQueue, Subscription.MessageHandler handler, int maxAttempts);

  /**
   * Create a builder to configure a subscription.
   *
   * @return the consumer builder
   */
  ConsumerBuilder consumerBuilder();

  /**
   * Publish a transient message.
   *
   * @param exchange the exchange, empty string for the default exchange
   * @param routingKey the routing key
   * @param body the message body
   * @return the generated message ID
   * @throws AmqpException.AmqpFlowControlException if the broker blocks publishing
   */
  String publish(String exchange, String routingKey, byte[] body);

  /**
   * Publish a message.
   *
   * <p>The call is one attempt: the message is not buffered for a later retry if the attempt
   * fails.
   *
   * @param exchange the exchange, empty string for the default exchange
   * @param routingKey the routing key
   * @param body the message body
   * @param options the message options, can be null
   * @return the generated message ID
   * @throws AmqpException.AmqpFlowControlException if the broker blocks publishing
   * @throws AmqpException.AmqpResourceInvalidStateException if the client is not connected
   */
  String publish(String exchange, String routingKey, byte[] body, PublishOptions options);

  /**
   * The connection supervisor of the client.
   *
   * <p>Applications can use it to register their own setup actions.
   *
   * @return the supervisor
   */
  ConnectionSupervisor supervisor();

  /**
   * Close the client and release its resources.
   *
   * @throws AmqpException.AmqpResourceInvalidStateException if the client is not connected
   */
  @Override
  void close();
}
