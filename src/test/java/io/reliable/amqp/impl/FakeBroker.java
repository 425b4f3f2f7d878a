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

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyBoolean;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.doAnswer;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import com.rabbitmq.client.AMQP;
import com.rabbitmq.client.AlreadyClosedException;
import com.rabbitmq.client.BlockedListener;
import com.rabbitmq.client.Channel;
import com.rabbitmq.client.Connection;
import com.rabbitmq.client.ConnectionFactory;
import com.rabbitmq.client.Consumer;
import com.rabbitmq.client.Envelope;
import com.rabbitmq.client.ShutdownListener;
import com.rabbitmq.client.ShutdownSignalException;
import com.rabbitmq.client.impl.AMQImpl;
import java.io.IOException;
import java.net.ConnectException;
import java.time.Duration;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * In-memory broker behind Mockito mocks of {@link ConnectionFactory}, {@link Connection} and
 * {@link Channel}.
 *
 * <p>Supports exchanges (default, topic, direct, fanout), queues, bindings, consumers with
 * prefetch, acks and nacks, per-message TTL with dead-lettering, connection drops and connection
 * blocking. Deliveries are dispatched on a single thread.
 */
final class FakeBroker implements AutoCloseable {

  private static final Logger LOGGER = LoggerFactory.getLogger(FakeBroker.class);

  private static final int NOT_FOUND = 404;

  private final Object lock = new Object();
  private final Map<String, String> exchanges = new LinkedHashMap<>();
  private final Map<String, FakeQueue> queues = new LinkedHashMap<>();
  private final Set<Binding> bindings = new LinkedHashSet<>();
  private final List<FakeConnection> connections = new CopyOnWriteArrayList<>();
  private final ExecutorService dispatcher =
      Executors.newSingleThreadExecutor(Utils.threadFactory("fake-broker-dispatcher-"));
  private final ScheduledExecutorService scheduler =
      Executors.newSingleThreadScheduledExecutor(Utils.threadFactory("fake-broker-ttl-"));
  private final AtomicLong consumerTagSequence = new AtomicLong(0);
  private final AtomicInteger connectionCount = new AtomicInteger(0);
  private final AtomicInteger exchangeDeclareCount = new AtomicInteger(0);
  private final AtomicInteger queueDeclareCount = new AtomicInteger(0);
  private final AtomicInteger bindCount = new AtomicInteger(0);
  private volatile boolean refuseConnections = false;
  private volatile long connectionDelayMs = 0;
  private volatile boolean blocked = false;

  ConnectionFactory connectionFactory() {
    ConnectionFactory cf = mock(ConnectionFactory.class);
    try {
      when(cf.newConnection(anyString())).thenAnswer(invocation -> this.newConnection());
    } catch (Exception e) {
      throw new RuntimeException(e);
    }
    return cf;
  }

  // test controls

  /** Kill all the connections, as a network failure would. */
  void dropConnections() {
    for (FakeConnection connection : this.connections) {
      if (connection.open) {
        connection.terminate(false);
      }
    }
  }

  /** Close all the channels from the broker side, connections stay open. */
  void closeChannels() {
    for (FakeConnection connection : this.connections) {
      for (FakeChannel channel : connection.channels) {
        if (channel.open) {
          channel.terminate(new ShutdownSignalException(false, false, null, channel.mock));
        }
      }
    }
  }

  void refuseConnections(boolean refuse) {
    this.refuseConnections = refuse;
  }

  /** Delay the creation of the next connections, as a slow network would. */
  void connectionDelay(Duration delay) {
    this.connectionDelayMs = delay.toMillis();
  }

  void block() {
    this.blocked = true;
    for (FakeConnection connection : this.connections) {
      if (connection.open) {
        connection.blockedListeners.forEach(
            l -> {
              try {
                l.handleBlocked("low on memory");
              } catch (IOException e) {
                throw new RuntimeException(e);
              }
            });
      }
    }
  }

  void unblock() {
    this.blocked = false;
    for (FakeConnection connection : this.connections) {
      if (connection.open) {
        connection.blockedListeners.forEach(
            l -> {
              try {
                l.handleUnblocked();
              } catch (IOException e) {
                throw new RuntimeException(e);
              }
            });
      }
    }
  }

  /** Publish from outside the client, e.g. to fill a queue before a consumer subscribes. */
  void publish(String exchange, String routingKey, byte[] body) {
    this.route(exchange, routingKey, new AMQP.BasicProperties(), body);
    this.dispatch();
  }

  // inspection

  boolean exchangeExists(String name) {
    synchronized (this.lock) {
      return this.exchanges.containsKey(name);
    }
  }

  boolean queueExists(String name) {
    synchronized (this.lock) {
      return this.queues.containsKey(name);
    }
  }

  Set<String> exchanges() {
    synchronized (this.lock) {
      return new LinkedHashSet<>(this.exchanges.keySet());
    }
  }

  Set<String> queues() {
    synchronized (this.lock) {
      return new LinkedHashSet<>(this.queues.keySet());
    }
  }

  Set<Binding> bindings() {
    synchronized (this.lock) {
      return new LinkedHashSet<>(this.bindings);
    }
  }

  int messageCount(String queue) {
    synchronized (this.lock) {
      FakeQueue q = this.queues.get(queue);
      return q == null ? 0 : q.ready.size();
    }
  }

  int unackedCount() {
    int count = 0;
    for (FakeConnection connection : this.connections) {
      for (FakeChannel channel : connection.channels) {
        synchronized (this.lock) {
          count += channel.unacked.size();
        }
      }
    }
    return count;
  }

  /** Ready messages of a queue, without removing them. */
  List<StoredMessage> messages(String queue) {
    synchronized (this.lock) {
      FakeQueue q = this.queues.get(queue);
      return q == null ? Collections.emptyList() : new ArrayList<>(q.ready);
    }
  }

  int consumerCount(String queue) {
    synchronized (this.lock) {
      FakeQueue q = this.queues.get(queue);
      return q == null ? 0 : q.consumers.size();
    }
  }

  int connectionCount() {
    return this.connectionCount.get();
  }

  int openConnectionCount() {
    return (int) this.connections.stream().filter(c -> c.open).count();
  }

  int exchangeDeclareCount() {
    return this.exchangeDeclareCount.get();
  }

  int queueDeclareCount() {
    return this.queueDeclareCount.get();
  }

  int bindCount() {
    return this.bindCount.get();
  }

  @Override
  public void close() {
    this.dispatcher.shutdownNow();
    this.scheduler.shutdownNow();
  }

  // internals

  private Connection newConnection() throws IOException, InterruptedException {
    if (this.connectionDelayMs > 0) {
      Thread.sleep(this.connectionDelayMs);
    }
    if (this.refuseConnections) {
      throw new ConnectException("Connection refused");
    }
    this.connectionCount.incrementAndGet();
    FakeConnection connection = new FakeConnection();
    this.connections.add(connection);
    return connection.mock;
  }

  private void declareExchange(String name, String type) {
    this.exchangeDeclareCount.incrementAndGet();
    synchronized (this.lock) {
      this.exchanges.putIfAbsent(name, type);
    }
  }

  private void declareQueue(String name, Map<String, Object> arguments) {
    this.queueDeclareCount.incrementAndGet();
    synchronized (this.lock) {
      this.queues.computeIfAbsent(name, n -> new FakeQueue(n, arguments));
    }
  }

  private void bind(FakeChannel channel, String queue, String exchange, String key)
      throws IOException {
    this.bindCount.incrementAndGet();
    String error = null;
    synchronized (this.lock) {
      if (!this.exchanges.containsKey(exchange)) {
        error = "NOT_FOUND - no exchange '" + exchange + "'";
      } else if (!this.queues.containsKey(queue)) {
        error = "NOT_FOUND - no queue '" + queue + "'";
      } else {
        this.bindings.add(new Binding(exchange, queue, key));
      }
    }
    if (error != null) {
      throw channel.error(NOT_FOUND, error);
    }
  }

  private void route(
      String exchange, String routingKey, AMQP.BasicProperties properties, byte[] body) {
    synchronized (this.lock) {
      List<FakeQueue> targets = new ArrayList<>();
      if (exchange.isEmpty()) {
        FakeQueue q = this.queues.get(routingKey);
        if (q != null) {
          targets.add(q);
        }
      } else {
        String type = this.exchanges.get(exchange);
        if (type == null) {
          LOGGER.debug("No exchange '{}', dropping message", exchange);
          return;
        }
        for (Binding binding : this.bindings) {
          if (binding.exchange.equals(exchange) && matches(type, binding.key, routingKey)) {
            FakeQueue q = this.queues.get(binding.queue);
            if (q != null && !targets.contains(q)) {
              targets.add(q);
            }
          }
        }
      }
      for (FakeQueue q : targets) {
        StoredMessage message =
            new StoredMessage(exchange, routingKey, properties, body.clone(), false);
        q.ready.addLast(message);
        this.maybeScheduleExpiry(q, message);
      }
    }
  }

  private void maybeScheduleExpiry(FakeQueue queue, StoredMessage message) {
    String expiration = message.properties.getExpiration();
    if (expiration != null) {
      long ttl = Long.parseLong(expiration);
      try {
        this.scheduler.schedule(() -> this.expire(queue, message), ttl, TimeUnit.MILLISECONDS);
      } catch (RejectedExecutionException e) {
        LOGGER.debug("Broker closed, message will not expire");
      }
    }
  }

  private void expire(FakeQueue queue, StoredMessage message) {
    synchronized (this.lock) {
      if (!queue.ready.remove(message)) {
        return;
      }
      Object dlx = queue.arguments.get("x-dead-letter-exchange");
      if (dlx == null) {
        return;
      }
      Object dlk = queue.arguments.get("x-dead-letter-routing-key");
      String routingKey = dlk == null ? message.routingKey : dlk.toString();
      this.route(
          dlx.toString(),
          routingKey,
          message.properties.builder().expiration(null).build(),
          message.body);
    }
    this.dispatch();
  }

  static boolean matches(String type, String pattern, String routingKey) {
    if ("fanout".equals(type)) {
      return true;
    } else if ("topic".equals(type)) {
      return topicMatches(pattern.split("\\.", -1), 0, routingKey.split("\\.", -1), 0);
    } else {
      return pattern.equals(routingKey);
    }
  }

  private static boolean topicMatches(String[] pattern, int p, String[] words, int w) {
    if (p == pattern.length) {
      return w == words.length;
    }
    if ("#".equals(pattern[p])) {
      for (int i = w; i <= words.length; i++) {
        if (topicMatches(pattern, p + 1, words, i)) {
          return true;
        }
      }
      return false;
    }
    if (w == words.length) {
      return false;
    }
    if ("*".equals(pattern[p]) || pattern[p].equals(words[w])) {
      return topicMatches(pattern, p + 1, words, w + 1);
    }
    return false;
  }

  private void dispatch() {
    try {
      this.dispatcher.execute(this::doDispatch);
    } catch (RejectedExecutionException e) {
      LOGGER.debug("Broker closed, no dispatching");
    }
  }

  private void doDispatch() {
    List<Runnable> deliveries = new ArrayList<>();
    synchronized (this.lock) {
      for (FakeQueue queue : this.queues.values()) {
        boolean delivered = true;
        while (delivered && !queue.ready.isEmpty() && !queue.consumers.isEmpty()) {
          delivered = false;
          for (int i = 0; i < queue.consumers.size() && !queue.ready.isEmpty(); i++) {
            FakeConsumer consumer = queue.nextConsumer();
            FakeChannel channel = consumer.channel;
            if (channel.open
                && (channel.prefetch == 0 || channel.unacked.size() < channel.prefetch)) {
              StoredMessage message = queue.ready.pollFirst();
              long deliveryTag = channel.deliveryTagSequence.incrementAndGet();
              channel.unacked.put(deliveryTag, new Unacked(queue, message));
              Envelope envelope =
                  new Envelope(
                      deliveryTag, message.redelivered, message.exchange, message.routingKey);
              deliveries.add(
                  () -> {
                    try {
                      consumer.callback.handleDelivery(
                          consumer.tag, envelope, message.properties, message.body);
                    } catch (Exception e) {
                      LOGGER.warn("Error in consumer {}", consumer.tag, e);
                    }
                  });
              delivered = true;
            }
          }
        }
      }
    }
    deliveries.forEach(Runnable::run);
  }

  private static ShutdownSignalException alreadyClosed(Object ref) {
    return new ShutdownSignalException(false, true, null, ref);
  }

  private final class FakeConnection {

    private final Connection mock = mock(Connection.class);
    private final List<FakeChannel> channels = new CopyOnWriteArrayList<>();
    private final List<ShutdownListener> shutdownListeners = new CopyOnWriteArrayList<>();
    private final List<BlockedListener> blockedListeners = new CopyOnWriteArrayList<>();
    private volatile boolean open = true;

    private FakeConnection() {
      try {
        when(mock.isOpen()).thenAnswer(invocation -> this.open);
        when(mock.createChannel())
            .thenAnswer(
                invocation -> {
                  if (!this.open) {
                    throw new AlreadyClosedException(alreadyClosed(this.mock));
                  }
                  FakeChannel channel = new FakeChannel();
                  this.channels.add(channel);
                  return channel.mock;
                });
        doAnswer(
                invocation -> {
                  this.shutdownListeners.add(invocation.getArgument(0));
                  return null;
                })
            .when(mock)
            .addShutdownListener(any(ShutdownListener.class));
        doAnswer(
                invocation -> {
                  BlockedListener listener = invocation.getArgument(0);
                  this.blockedListeners.add(listener);
                  if (blocked) {
                    listener.handleBlocked("low on memory");
                  }
                  return null;
                })
            .when(mock)
            .addBlockedListener(any(BlockedListener.class));
        doAnswer(
                invocation -> {
                  if (!this.open) {
                    throw new AlreadyClosedException(alreadyClosed(this.mock));
                  }
                  this.terminate(true);
                  return null;
                })
            .when(mock)
            .close();
        doAnswer(
                invocation -> {
                  if (this.open) {
                    this.terminate(true);
                  }
                  return null;
                })
            .when(mock)
            .abort();
      } catch (IOException e) {
        throw new RuntimeException(e);
      }
    }

    private void terminate(boolean initiatedByApplication) {
      this.open = false;
      ShutdownSignalException signal =
          new ShutdownSignalException(true, initiatedByApplication, null, this.mock);
      for (FakeChannel channel : this.channels) {
        if (channel.open) {
          channel.terminate(signal);
        }
      }
      this.shutdownListeners.forEach(l -> l.shutdownCompleted(signal));
    }
  }

  private final class FakeChannel {

    private final Channel mock = mock(Channel.class);
    private final Map<Long, Unacked> unacked = new LinkedHashMap<>();
    private final Map<String, FakeConsumer> consumers = new LinkedHashMap<>();
    private final AtomicLong deliveryTagSequence = new AtomicLong(0);
    private final List<ShutdownListener> shutdownListeners = new CopyOnWriteArrayList<>();
    private volatile boolean open = true;
    private volatile int prefetch = 0;

    private FakeChannel() {
      try {
        when(mock.isOpen()).thenAnswer(invocation -> this.open);
        doAnswer(
                invocation -> {
                  this.shutdownListeners.add(invocation.getArgument(0));
                  return null;
                })
            .when(mock)
            .addShutdownListener(any(ShutdownListener.class));
        when(mock.exchangeDeclare(
                anyString(), anyString(), anyBoolean(), anyBoolean(), anyBoolean(), any()))
            .thenAnswer(
                invocation -> {
                  this.checkOpen();
                  declareExchange(invocation.getArgument(0), invocation.getArgument(1));
                  return null;
                });
        when(mock.queueDeclare(anyString(), anyBoolean(), anyBoolean(), anyBoolean(), any()))
            .thenAnswer(
                invocation -> {
                  this.checkOpen();
                  declareQueue(invocation.getArgument(0), invocation.getArgument(4));
                  return null;
                });
        when(mock.queueDeclarePassive(anyString()))
            .thenAnswer(
                invocation -> {
                  this.checkOpen();
                  String queueName = invocation.getArgument(0);
                  boolean queueExists;
                  synchronized (lock) {
                    queueExists = queues.containsKey(queueName);
                  }
                  if (!queueExists) {
                    throw this.error(NOT_FOUND, "NOT_FOUND - no queue '" + queueName + "'");
                  }
                  return null;
                });
        when(mock.queueBind(anyString(), anyString(), anyString()))
            .thenAnswer(
                invocation -> {
                  this.checkOpen();
                  bind(
                      this,
                      invocation.getArgument(0),
                      invocation.getArgument(1),
                      invocation.getArgument(2));
                  return null;
                });
        doAnswer(
                invocation -> {
                  this.checkOpen();
                  this.prefetch = invocation.getArgument(0);
                  dispatch();
                  return null;
                })
            .when(mock)
            .basicQos(anyInt());
        when(mock.basicConsume(anyString(), anyBoolean(), any(Consumer.class)))
            .thenAnswer(
                invocation -> {
                  this.checkOpen();
                  String queueName = invocation.getArgument(0);
                  Consumer callback = invocation.getArgument(2);
                  String tag = "amq.ctag-" + consumerTagSequence.incrementAndGet();
                  boolean queueExists;
                  synchronized (lock) {
                    FakeQueue queue = queues.get(queueName);
                    queueExists = queue != null;
                    if (queueExists) {
                      FakeConsumer consumer = new FakeConsumer(tag, queue, this, callback);
                      queue.consumers.add(consumer);
                      this.consumers.put(tag, consumer);
                    }
                  }
                  if (!queueExists) {
                    throw this.error(NOT_FOUND, "NOT_FOUND - no queue '" + queueName + "'");
                  }
                  callback.handleConsumeOk(tag);
                  dispatch();
                  return tag;
                });
        doAnswer(
                invocation -> {
                  this.checkOpen();
                  String tag = invocation.getArgument(0);
                  FakeConsumer consumer;
                  synchronized (lock) {
                    consumer = this.consumers.remove(tag);
                    if (consumer != null) {
                      consumer.queue.consumers.remove(consumer);
                    }
                  }
                  if (consumer == null) {
                    throw new IOException("Unknown consumer tag " + tag);
                  }
                  consumer.callback.handleCancelOk(tag);
                  return null;
                })
            .when(mock)
            .basicCancel(anyString());
        doAnswer(
                invocation -> {
                  this.checkOpen();
                  long tag = invocation.getArgument(0);
                  synchronized (lock) {
                    this.unacked.remove(tag);
                  }
                  dispatch();
                  return null;
                })
            .when(mock)
            .basicAck(anyLong(), anyBoolean());
        doAnswer(
                invocation -> {
                  this.checkOpen();
                  long tag = invocation.getArgument(0);
                  boolean requeue = invocation.getArgument(2);
                  synchronized (lock) {
                    Unacked u = this.unacked.remove(tag);
                    if (u != null && requeue) {
                      u.queue.ready.addFirst(u.message.redelivered());
                    }
                  }
                  dispatch();
                  return null;
                })
            .when(mock)
            .basicNack(anyLong(), anyBoolean(), anyBoolean());
        doAnswer(
                invocation -> {
                  this.checkOpen();
                  route(
                      invocation.getArgument(0),
                      invocation.getArgument(1),
                      invocation.getArgument(2),
                      invocation.getArgument(3));
                  dispatch();
                  return null;
                })
            .when(mock)
            .basicPublish(anyString(), anyString(), any(), any());
        doAnswer(
                invocation -> {
                  if (!this.open) {
                    throw new AlreadyClosedException(alreadyClosed(this.mock));
                  }
                  this.terminate(alreadyClosed(this.mock));
                  return null;
                })
            .when(mock)
            .close();
        doAnswer(
                invocation -> {
                  if (this.open) {
                    this.terminate(alreadyClosed(this.mock));
                  }
                  return null;
                })
            .when(mock)
            .abort();
      } catch (Exception e) {
        throw new RuntimeException(e);
      }
    }

    /** Channel-level error: the broker closes the channel and the call fails. */
    private IOException error(int code, String text) {
      ShutdownSignalException signal =
          new ShutdownSignalException(
              false, false, new AMQImpl.Channel.Close(code, text, 0, 0), this.mock);
      this.terminate(signal);
      return new IOException(text, signal);
    }

    private void checkOpen() {
      if (!this.open) {
        throw new AlreadyClosedException(alreadyClosed(this.mock));
      }
    }

    /** Close the channel, unacknowledged messages go back to their queue. */
    private void terminate(ShutdownSignalException signal) {
      synchronized (lock) {
        this.open = false;
        for (FakeConsumer consumer : this.consumers.values()) {
          consumer.queue.consumers.remove(consumer);
        }
        this.consumers.clear();
        List<Unacked> toRequeue = new ArrayList<>(this.unacked.values());
        Collections.reverse(toRequeue);
        for (Unacked u : toRequeue) {
          u.queue.ready.addFirst(u.message.redelivered());
        }
        this.unacked.clear();
      }
      if (!signal.isHardError()) {
        this.shutdownListeners.forEach(l -> l.shutdownCompleted(signal));
      }
      dispatch();
    }
  }

  private static final class FakeQueue {

    private final String name;
    private final Map<String, Object> arguments;
    private final Deque<StoredMessage> ready = new ArrayDeque<>();
    private final List<FakeConsumer> consumers = new ArrayList<>();
    private int nextConsumer = 0;

    private FakeQueue(String name, Map<String, Object> arguments) {
      this.name = name;
      this.arguments = arguments == null ? Collections.emptyMap() : new LinkedHashMap<>(arguments);
    }

    private FakeConsumer nextConsumer() {
      if (this.nextConsumer >= this.consumers.size()) {
        this.nextConsumer = 0;
      }
      return this.consumers.get(this.nextConsumer++);
    }

    @Override
    public String toString() {
      return this.name;
    }
  }

  private static final class FakeConsumer {

    private final String tag;
    private final FakeQueue queue;
    private final FakeChannel channel;
    private final Consumer callback;

    private FakeConsumer(String tag, FakeQueue queue, FakeChannel channel, Consumer callback) {
      this.tag = tag;
      this.queue = queue;
      this.channel = channel;
      this.callback = callback;
    }
  }

  private static final class Unacked {

    private final FakeQueue queue;
    private final StoredMessage message;

    private Unacked(FakeQueue queue, StoredMessage message) {
      this.queue = queue;
      this.message = message;
    }
  }

  static final class StoredMessage {

    private final String exchange;
    private final String routingKey;
    private final AMQP.BasicProperties properties;
    private final byte[] body;
    private final boolean redelivered;

    private StoredMessage(
        String exchange,
        String routingKey,
        AMQP.BasicProperties properties,
        byte[] body,
        boolean redelivered) {
      this.exchange = exchange;
      this.routingKey = routingKey;
      this.properties = properties == null ? new AMQP.BasicProperties() : properties;
      this.body = body;
      this.redelivered = redelivered;
    }

    private StoredMessage redelivered() {
      return new StoredMessage(this.exchange, this.routingKey, this.properties, this.body, true);
    }

    String exchange() {
      return this.exchange;
    }

    String routingKey() {
      return this.routingKey;
    }

    AMQP.BasicProperties properties() {
      return this.properties;
    }

    byte[] body() {
      return this.body;
    }

    String bodyAsString() {
      return new String(this.body);
    }

    Object header(String key) {
      Map<String, Object> headers = this.properties.getHeaders();
      return headers == null ? null : headers.get(key);
    }
  }

  static final class Binding {

    private final String exchange;
    private final String queue;
    private final String key;

    Binding(String exchange, String queue, String key) {
      this.exchange = exchange;
      this.queue = queue;
      this.key = key;
    }

    @Override
    public boolean equals(Object o) {
      if (this == o) {
        return true;
      }
      if (o == null || getClass() != o.getClass()) {
        return false;
      }
      Binding binding = (Binding) o;
      return exchange.equals(binding.exchange)
          && queue.equals(binding.queue)
          && key.equals(binding.key);
    }

    @Override
    public int hashCode() {
      return java.util.Objects.hash(exchange, queue, key);
    }

    @Override
    public String toString() {
      return exchange + " -> " + queue + " (" + key + ")";
    }
  }
}
