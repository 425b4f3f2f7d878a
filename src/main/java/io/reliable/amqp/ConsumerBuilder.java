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
 * API to configure and create a {@link Subscription}.
 *
 * <pre>
 * Subscription subscription = client.consumerBuilder()
 *     .queue("work")
 *     .failureQueue("fail")
 *     .maxAttempts(5)
 *     .messageHandler(message -&gt; process(message.body()))
 *     .subscribe();
 * </pre>
 */
public interface ConsumerBuilder {

  /**
   * The queue to consume from.
   *
   * @param queue queue
   * @return this builder instance
   */
  ConsumerBuilder queue(String queue);

  /**
   * The queue messages are sent to once they have exhausted their attempts.
   *
   * <p>This is a plain queue, it must exist (e.g. be part of the {@link Topology}). Consuming it is
   * the application's responsibility.
   *
   * @param failureQueue failure queue
   * @return this builder instance
   */
  ConsumerBuilder failureQueue(String failureQueue);

  /**
   * Synchronous processing logic.
   *
   * @param handler processing logic
   * @return this builder instance
   */
  ConsumerBuilder messageHandler(Subscription.MessageHandler handler);

  /**
   * Asynchronous processing logic.
   *
   * @param handler processing logic
   * @return this builder instance
   */
  ConsumerBuilder asyncMessageHandler(Subscription.AsyncMessageHandler handler);

  /**
   * Maximum number of processing attempts of a message before it goes to the failure queue.
   *
   * <p>Default is 0, which means no limit: messages are retried until they succeed.
   *
   * @param maxAttempts the maximum number of attempts, 0 for no limit
   * @return this builder instance
   */
  ConsumerBuilder maxAttempts(int maxAttempts);

  /**
   * Delay policy for redelivery after a failed attempt.
   *
   * <p>The policy is called with the number of failed attempts so far (starting at 1). Default is
   * the client policy, see {@link ClientBuilder.RetryConfiguration#delayPolicy(BackOffDelayPolicy)}.
   *
   * @param delayPolicy the policy
   * @return this builder instance
   */
  ConsumerBuilder delayPolicy(BackOffDelayPolicy delayPolicy);

  /**
   * Metadata policy for dead-lettered messages.
   *
   * <p>Default is the client policy, see {@link
   * ClientBuilder.RetryConfiguration#deadLetterPolicy(DeadLetterPolicy)}.
   *
   * @param deadLetterPolicy the policy
   * @return this builder instance
   */
  ConsumerBuilder deadLetterPolicy(DeadLetterPolicy deadLetterPolicy);

  /**
   * Add {@link Resource.StateListener}s to the subscription.
   *
   * @param listeners listeners
   * @return this builder instance
   */
  ConsumerBuilder listeners(Resource.StateListener... listeners);

  /**
   * Create the subscription.
   *
   * <p>Returns once the broker has confirmed the subscription.
   *
   * @return the subscription
   */
  Subscription subscribe();
}
