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

import java.util.Map;

/**
 * A message delivered to a {@link Subscription.MessageHandler}.
 *
 * <p>Instances are read-only.
 */
public interface Message {

  /** Header carrying the number of failed processing attempts of a message. */
  String ATTEMPTS_HEADER = "x-retry-attempts";

  /** Header carrying the queue a delayed message must go back to. */
  String ORIGINAL_QUEUE_HEADER = "x-retry-original-queue";

  /**
   * The body of the message.
   *
   * @return the body
   */
  byte[] body();

  /**
   * The message ID, set by the publisher.
   *
   * @return the message ID, can be null
   */
  String messageId();

  /**
   * The number of previous failed processing attempts.
   *
   * <p>The value travels with the message (in the {@value #ATTEMPTS_HEADER} header), it is 0 on
   * the first delivery.
   *
   * @return the number of failed attempts
   */
  int attempt();

  /**
   * The queue the message has been consumed from.
   *
   * @return the queue
   */
  String queue();

  /**
   * The exchange the message was published to.
   *
   * @return the exchange, empty for the default exchange
   */
  String exchange();

  /**
   * The routing key the message was published with.
   *
   * @return the routing key
   */
  String routingKey();

  /**
   * Whether the broker flagged the message as redelivered.
   *
   * @return the redelivered flag
   */
  boolean redelivered();

  /**
   * The content type of the message.
   *
   * @return the content type, can be null
   */
  String contentType();

  /**
   * The message headers.
   *
   * @return the headers, empty if there are no headers
   */
  Map<String, Object> headers();

  /**
   * A header value.
   *
   * @param key header key
   * @return the value, null if the header is not present
   */
  default Object header(String key) {
    return headers().get(key);
  }
}
