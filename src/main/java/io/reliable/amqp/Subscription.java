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

import java.util.concurrent.CompletionStage;

/**
 * A consumer subscription on a queue, with retry and dead-lettering of failed messages.
 *
 * <p>The subscription survives connection recoveries: it is re-established on each new channel.
 * Cancelling it removes the broker-side consumer and stops the re-establishment.
 *
 * @see Client#consume(String, String, MessageHandler)
 * @see ConsumerBuilder
 */
public interface Subscription extends AutoCloseable, Resource {

  /**
   * The consumed queue.
   *
   * @return the queue
   */
  String queue();

  /**
   * The queue messages go to once they have exhausted their attempts.
   *
   * @return the failure queue
   */
  String failureQueue();

  /**
   * The current consumer tag, assigned by the broker.
   *
   * <p>It changes after each connection recovery.
   *
   * @return the consumer tag, null if the subscription is not active
   */
  String consumerTag();

  /**
   * Cancel the subscription.
   *
   * <p>Messages already delivered complete normally (acknowledgment, retry, or dead-lettering). The
   * connection and its channel stay open. Calling this method several times has no effect.
   */
  void cancel();

  /** Same as {@link #cancel()}. */
  @Override
  void close();

  /**
   * Synchronous message processing.
   *
   * <p>The processing is considered successful if the method returns normally, it has failed if
   * the method throws.
   */
  @FunctionalInterface
  interface MessageHandler {

    /**
     * Process a message.
     *
     * @param message the message
     * @throws Exception if the processing fails
     */
    void handle(Message message) throws Exception;
  }

  /**
   * Asynchronous message processing.
   *
   * <p>The processing is considered successful when the returned stage completes normally, it has
   * failed if it completes exceptionally or if the method throws.
   */
  @FunctionalInterface
  interface AsyncMessageHandler {

    /**
     * Process a message.
     *
     * @param message the message
     * @return the processing outcome
     */
    CompletionStage<?> handle(Message message);
  }
}
