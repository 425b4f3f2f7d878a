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
import com.rabbitmq.client.Envelope;
import com.rabbitmq.client.LongString;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import io.reliable.amqp.Message;
import java.util.Collections;
import java.util.Map;

final class AmqpMessage implements Message {

  static final int MAX_ATTEMPTS = Integer.MAX_VALUE - 1;

  private final String queue;
  private final Envelope envelope;
  private final AMQP.BasicProperties properties;
  private final byte[] body;
  private final int attempt;

  AmqpMessage(String queue, Envelope envelope, AMQP.BasicProperties properties, byte[] body) {
    this.queue = queue;
    this.envelope = envelope;
    this.properties = properties == null ? new AMQP.BasicProperties() : properties;
    this.body = body == null ? new byte[0] : body;
    this.attempt = attempts(this.properties.getHeaders());
  }

  @Override
  @SuppressFBWarnings("EI_EXPOSE_REP")
  public byte[] body() {
    return this.body;
  }

  @Override
  public String messageId() {
    return this.properties.getMessageId();
  }

  @Override
  public int attempt() {
    return this.attempt;
  }

  @Override
  public String queue() {
    return this.queue;
  }

  @Override
  public String exchange() {
    return this.envelope.getExchange();
  }

  @Override
  public String routingKey() {
    return this.envelope.getRoutingKey();
  }

  @Override
  public boolean redelivered() {
    return this.envelope.isRedeliver();
  }

  @Override
  public String contentType() {
    return this.properties.getContentType();
  }

  @Override
  public Map<String, Object> headers() {
    Map<String, Object> headers = this.properties.getHeaders();
    return headers == null ? Collections.emptyMap() : Collections.unmodifiableMap(headers);
  }

  long deliveryTag() {
    return this.envelope.getDeliveryTag();
  }

  AMQP.BasicProperties properties() {
    return this.properties;
  }

  /**
   * Read the attempt counter from the headers.
   *
   * <p>The broker may hand back numbers as any integral type and strings as {@link LongString}.
   * A missing or unreadable header counts as 0. The counter is capped at {@link
   * #MAX_ATTEMPTS}, so the next attempt number never overflows.
   */
  static int attempts(Map<String, Object> headers) {
    if (headers == null) {
      return 0;
    }
    Object value = headers.get(ATTEMPTS_HEADER);
    if (value instanceof Number) {
      return clamp(((Number) value).longValue());
    } else if (value instanceof LongString || value instanceof String) {
      try {
        return clamp(Long.parseLong(value.toString().trim()));
      } catch (NumberFormatException e) {
        return 0;
      }
    } else {
      return 0;
    }
  }

  private static int clamp(long attempts) {
    return (int) Math.min(Math.max(attempts, 0), MAX_ATTEMPTS);
  }

  @Override
  public String toString() {
    return "AmqpMessage{"
        + "queue='"
        + queue
        + '\''
        + ", messageId='"
        + messageId()
        + '\''
        + ", attempt="
        + attempt
        + ", deliveryTag="
        + envelope.getDeliveryTag()
        + '}';
  }
}
