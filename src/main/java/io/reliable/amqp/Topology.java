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

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Declarative description of the exchanges, queues, and bindings an application relies on.
 *
 * <p>Exchanges are always of type <code>topic</code>. A queue can be bound to one of them with a
 * routing key pattern. The description is immutable, it is declared on the first connection and
 * then again after each connection recovery.
 *
 * <p>Declarations must be idempotent on the broker side: declaring an existing entity with the
 * same settings is a no-op, declaring it with different settings is an error.
 *
 * <pre>
 * Topology topology = Topology.builder()
 *     .exchange("data.test").durable(true).topology()
 *     .queue("work").durable(true).bindToTopic("data.test", "*").topology()
 *     .queue("fail").durable(true).topology()
 *     .prefetch(10)
 *     .build();
 * </pre>
 */
public final class Topology {

  static final String TOPIC = "topic";

  private static final Topology EMPTY = builder().build();

  private final Map<String, ExchangeSpecification> exchanges;
  private final Map<String, QueueSpecification> queues;
  private final int prefetch;

  private Topology(Builder builder) {
    Map<String, ExchangeSpecification> exchangesCopy = new LinkedHashMap<>();
    builder.exchanges.forEach((name, b) -> exchangesCopy.put(name, new ExchangeSpecification(b)));
    Map<String, QueueSpecification> queuesCopy = new LinkedHashMap<>();
    builder.queues.forEach((name, b) -> queuesCopy.put(name, new QueueSpecification(b)));
    this.exchanges = Collections.unmodifiableMap(exchangesCopy);
    this.queues = Collections.unmodifiableMap(queuesCopy);
    this.prefetch = builder.prefetch;
  }

  public static Builder builder() {
    return new Builder();
  }

  public static Topology empty() {
    return EMPTY;
  }

  /**
   * Exchanges, in definition order.
   *
   * @return the exchanges
   */
  public Collection<ExchangeSpecification> exchanges() {
    return this.exchanges.values();
  }

  /**
   * Queues, in definition order.
   *
   * @return the queues
   */
  public Collection<QueueSpecification> queues() {
    return this.queues.values();
  }

  public ExchangeSpecification exchange(String name) {
    return this.exchanges.get(name);
  }

  public QueueSpecification queue(String name) {
    return this.queues.get(name);
  }

  /**
   * Maximum number of unacknowledged deliveries on the channel, 0 means no limit.
   *
   * @return the prefetch
   */
  public int prefetch() {
    return this.prefetch;
  }

  public boolean isEmpty() {
    return this.exchanges.isEmpty() && this.queues.isEmpty() && this.prefetch == 0;
  }

  @Override
  public String toString() {
    return "Topology{"
        + "exchanges="
        + exchanges.keySet()
        + ", queues="
        + queues.keySet()
        + ", prefetch="
        + prefetch
        + '}';
  }

  /** Topic exchange declaration. */
  public static final class ExchangeSpecification {

    private final String name;
    private final boolean durable;
    private final boolean autoDelete;
    private final boolean internal;
    private final Map<String, Object> arguments;

    private ExchangeSpecification(ExchangeBuilder builder) {
      this.name = builder.name;
      this.durable = builder.durable;
      this.autoDelete = builder.autoDelete;
      this.internal = builder.internal;
      this.arguments = Collections.unmodifiableMap(new LinkedHashMap<>(builder.arguments));
    }

    public String name() {
      return name;
    }

    public String type() {
      return TOPIC;
    }

    public boolean durable() {
      return durable;
    }

    public boolean autoDelete() {
      return autoDelete;
    }

    public boolean internal() {
      return internal;
    }

    public Map<String, Object> arguments() {
      return arguments;
    }
  }

  /** Queue declaration, with an optional binding to a topic exchange. */
  public static final class QueueSpecification {

    private final String name;
    private final boolean durable;
    private final boolean exclusive;
    private final boolean autoDelete;
    private final Map<String, Object> arguments;
    private final BindingSpecification binding;

    private QueueSpecification(QueueBuilder builder) {
      this.name = builder.name;
      this.durable = builder.durable;
      this.exclusive = builder.exclusive;
      this.autoDelete = builder.autoDelete;
      this.arguments = Collections.unmodifiableMap(new LinkedHashMap<>(builder.arguments));
      this.binding =
          builder.bindingExchange == null
              ? null
              : new BindingSpecification(builder.bindingExchange, builder.name, builder.bindingKey);
    }

    public String name() {
      return name;
    }

    public boolean durable() {
      return durable;
    }

    public boolean exclusive() {
      return exclusive;
    }

    public boolean autoDelete() {
      return autoDelete;
    }

    public Map<String, Object> arguments() {
      return arguments;
    }

    /**
     * The binding of the queue, null if the queue is not bound.
     *
     * @return the binding
     */
    public BindingSpecification binding() {
      return binding;
    }
  }

  /** Binding between a topic exchange and a queue. */
  public static final class BindingSpecification {

    private final String exchange;
    private final String queue;
    private final String key;

    private BindingSpecification(String exchange, String queue, String key) {
      this.exchange = exchange;
      this.queue = queue;
      this.key = key;
    }

    public String exchange() {
      return exchange;
    }

    public String queue() {
      return queue;
    }

    /**
     * Routing key pattern, with <code>*</code> and <code>#</code> wildcards.
     *
     * @return the pattern
     */
    public String key() {
      return key;
    }

    @Override
    public boolean equals(Object o) {
      if (this == o) return true;
      if (o == null || getClass() != o.getClass()) return false;
      BindingSpecification that = (BindingSpecification) o;
      return Objects.equals(exchange, that.exchange)
          && Objects.equals(queue, that.queue)
          && Objects.equals(key, that.key);
    }

    @Override
    public int hashCode() {
      return Objects.hash(exchange, queue, key);
    }
  }

  public static final class Builder {

    private final Map<String, ExchangeBuilder> exchanges = new LinkedHashMap<>();
    private final Map<String, QueueBuilder> queues = new LinkedHashMap<>();
    private int prefetch = 0;

    private Builder() {}

    /**
     * Define a topic exchange.
     *
     * <p>Calling this method again with the same name returns the existing definition.
     *
     * @param name exchange name
     * @return the exchange definition
     */
    public ExchangeBuilder exchange(String name) {
      if (name == null || name.isBlank()) {
        throw new IllegalArgumentException("Exchange name cannot be null or blank");
      }
      return this.exchanges.computeIfAbsent(name, n -> new ExchangeBuilder(this, n));
    }

    /**
     * Define a queue.
     *
     * <p>Calling this method again with the same name returns the existing definition.
     *
     * @param name queue name
     * @return the queue definition
     */
    public QueueBuilder queue(String name) {
      if (name == null || name.isBlank()) {
        throw new IllegalArgumentException("Queue name cannot be null or blank");
      }
      return this.queues.computeIfAbsent(name, n -> new QueueBuilder(this, n));
    }

    /**
     * Set the channel prefetch, applied once all the declarations succeeded.
     *
     * @param prefetch maximum number of unacknowledged deliveries, 0 for no limit
     * @return this builder
     */
    public Builder prefetch(int prefetch) {
      if (prefetch < 0) {
        throw new IllegalArgumentException("Prefetch must be positive or 0");
      }
      this.prefetch = prefetch;
      return this;
    }

    public Topology build() {
      return new Topology(this);
    }
  }

  public static final class ExchangeBuilder {

    private final Builder topology;
    private final String name;
    private boolean durable = true;
    private boolean autoDelete = false;
    private boolean internal = false;
    private final Map<String, Object> arguments = new LinkedHashMap<>();

    private ExchangeBuilder(Builder topology, String name) {
      this.topology = topology;
      this.name = name;
    }

    public ExchangeBuilder durable(boolean durable) {
      this.durable = durable;
      return this;
    }

    public ExchangeBuilder autoDelete(boolean autoDelete) {
      this.autoDelete = autoDelete;
      return this;
    }

    public ExchangeBuilder internal(boolean internal) {
      this.internal = internal;
      return this;
    }

    public ExchangeBuilder argument(String key, Object value) {
      this.arguments.put(key, value);
      return this;
    }

    /**
     * Go back to the topology builder.
     *
     * @return the topology builder
     */
    public Builder topology() {
      return this.topology;
    }
  }

  public static final class QueueBuilder {

    private final Builder topology;
    private final String name;
    private boolean durable = true;
    private boolean exclusive = false;
    private boolean autoDelete = false;
    private final Map<String, Object> arguments = new LinkedHashMap<>();
    private String bindingExchange;
    private String bindingKey;

    private QueueBuilder(Builder topology, String name) {
      this.topology = topology;
      this.name = name;
    }

    public QueueBuilder durable(boolean durable) {
      this.durable = durable;
      return this;
    }

    public QueueBuilder exclusive(boolean exclusive) {
      this.exclusive = exclusive;
      return this;
    }

    public QueueBuilder autoDelete(boolean autoDelete) {
      this.autoDelete = autoDelete;
      return this;
    }

    public QueueBuilder argument(String key, Object value) {
      this.arguments.put(key, value);
      return this;
    }

    /**
     * Bind the queue to a topic exchange.
     *
     * @param exchange the exchange, declared in the same topology or already existing
     * @param key the routing key pattern
     * @return this queue definition
     */
    public QueueBuilder bindToTopic(String exchange, String key) {
      if (exchange == null || exchange.isBlank()) {
        throw new IllegalArgumentException("Binding exchange cannot be null or blank");
      }
      this.bindingExchange = exchange;
      this.bindingKey = key == null ? "" : key;
      return this;
    }

    /**
     * Go back to the topology builder.
     *
     * @return the topology builder
     */
    public Builder topology() {
      return this.topology;
    }
  }
}
