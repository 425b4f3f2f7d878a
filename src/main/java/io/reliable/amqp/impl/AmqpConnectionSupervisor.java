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
import static io.reliable.amqp.Resource.State.DISCONNECTED;
import static io.reliable.amqp.Resource.State.OPEN;
import static io.reliable.amqp.Resource.State.OPENING;
import static io.reliable.amqp.Resource.State.RECOVERING;

import com.rabbitmq.client.BlockedListener;
import com.rabbitmq.client.Channel;
import com.rabbitmq.client.Connection;
import com.rabbitmq.client.ConnectionFactory;
import com.rabbitmq.client.ShutdownSignalException;
import io.reliable.amqp.AmqpException;
import io.reliable.amqp.BackOffDelayPolicy;
import io.reliable.amqp.ConnectionSupervisor;
import io.reliable.amqp.metrics.MetricsCollector;
import java.io.IOException;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.BiConsumer;
import java.util.function.Predicate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link ConnectionSupervisor} over a single connection and a single channel.
 *
 * <p>The automatic recovery of the underlying client must be disabled: the supervisor listens to
 * shutdown signals itself, opens a new connection and/or channel, and replays the registered setup
 * actions before going back to {@link State#OPEN}.
 */
final class AmqpConnectionSupervisor extends ResourceBase implements ConnectionSupervisor {

  private static final Logger LOGGER = LoggerFactory.getLogger(AmqpConnectionSupervisor.class);

  private static final AtomicLong ID_SEQUENCE = new AtomicLong(0);

  private static final Predicate<Exception> CONNECTION_EXCEPTION_PREDICATE =
      ExceptionUtils::isConnectionFailure;

  /** Failed replays are retried as well, a fresh channel may succeed. */
  private static final Predicate<Exception> RECOVERY_PREDICATE =
      CONNECTION_EXCEPTION_PREDICATE.or(e -> e instanceof AmqpException.AmqpSetupException);

  private final long id;
  private final String name;
  private final ConnectionFactory connectionFactory;
  private final AmqpClientBuilder.AmqpRecoveryConfiguration recoveryConfiguration;
  private final ScheduledExecutorService scheduledExecutorService;
  private final MetricsCollector metricsCollector;
  private final List<Registration> setups = new CopyOnWriteArrayList<>();
  private final Lock setupLock = new ReentrantLock();
  private final AtomicBoolean closed = new AtomicBoolean(false);
  private final AtomicBoolean recovering = new AtomicBoolean(false);
  private volatile Connection connection;
  private volatile Channel channel;
  private volatile boolean blocked = false;
  private volatile CompletableFuture<Void> recoveryTask;

  AmqpConnectionSupervisor(
      ConnectionFactory connectionFactory,
      String name,
      AmqpClientBuilder.AmqpRecoveryConfiguration recoveryConfiguration,
      ScheduledExecutorService scheduledExecutorService,
      MetricsCollector metricsCollector,
      List<StateListener> listeners) {
    super(listeners, DISCONNECTED);
    this.id = ID_SEQUENCE.getAndIncrement();
    this.name = name == null ? "reliable-amqp-client-" + this.id : name;
    this.connectionFactory = connectionFactory;
    this.recoveryConfiguration = recoveryConfiguration;
    this.scheduledExecutorService = scheduledExecutorService;
    this.metricsCollector = metricsCollector;
  }

  @Override
  public void connect() {
    if (!this.compareAndSetState(DISCONNECTED, OPENING)) {
      State current = this.state();
      if (current == CLOSING || current == CLOSED) {
        throw new AmqpException.AmqpResourceClosedException(
            "Connection '" + this.name + "' is closed");
      }
      LOGGER.debug("Connection '{}' already started (state {})", this.name, current);
      return;
    }
    LOGGER.debug("Opening connection '{}'", this.name);
    Connection nc = null;
    this.setupLock.lock();
    try {
      nc =
          RetryUtils.callAndMaybeRetry(
              this::newConnection,
              CONNECTION_EXCEPTION_PREDICATE,
              this.recoveryConfiguration.backOffDelayPolicy(),
              this.recoveryConfiguration.initialConnectionAttempts(),
              "Connection '%s' opening",
              this.name);
      Channel ch = this.openChannel(nc);
      this.connection = nc;
      this.channel = ch;
      this.replay(ch);
      checkStillOpen(nc, ch);
      this.metricsCollector.openConnection();
      this.state(OPEN);
      LOGGER.debug("Connection '{}' opened, {} setup action(s) applied", this.name, setups.size());
    } catch (Exception e) {
      AmqpException failure = ExceptionUtils.convert(e, "Error while opening connection '%s'", name);
      LOGGER.debug("Could not open connection '{}': {}", this.name, failure.getMessage());
      if (nc != null) {
        nc.abort();
      }
      this.connection = null;
      this.channel = null;
      this.state(DISCONNECTED, failure);
      throw failure;
    } finally {
      this.setupLock.unlock();
    }
  }

  @Override
  public SetupRegistration addSetup(SetupAction action) {
    State current = this.state();
    if (current == CLOSING || current == CLOSED) {
      throw new AmqpException.AmqpResourceClosedException(
          "Connection '" + this.name + "' is closed");
    }
    Registration registration = new Registration(action);
    this.setupLock.lock();
    try {
      this.setups.add(registration);
      Channel ch = this.state() == OPEN ? this.channel : null;
      if (ch != null) {
        try {
          action.setup(ch);
        } catch (Exception e) {
          this.setups.remove(registration);
          registration.active = false;
          throw ExceptionUtils.convertSetup(e, "Setup action failed on connection '%s'", name);
        }
      }
    } finally {
      this.setupLock.unlock();
    }
    return registration;
  }

  @Override
  public void removeSetup(SetupRegistration registration, ChannelCallback cleanup) {
    this.setupLock.lock();
    try {
      boolean removed = this.setups.remove(registration);
      if (registration instanceof Registration) {
        ((Registration) registration).active = false;
      }
      Channel ch = this.state() == OPEN ? this.channel : null;
      if (removed && cleanup != null && ch != null) {
        try {
          cleanup.execute(ch);
        } catch (Exception e) {
          LOGGER.warn(
              "Error during setup action cleanup on connection '{}': {}",
              this.name,
              e.getMessage());
        }
      }
    } finally {
      this.setupLock.unlock();
    }
  }

  @Override
  public Channel channel() {
    this.checkOpen();
    return this.channel;
  }

  @Override
  public State state() {
    return super.state();
  }

  @Override
  public void close() {
    State current = this.state();
    if (current != OPEN && current != RECOVERING) {
      throw new AmqpException.AmqpResourceInvalidStateException(
          "Cannot close connection '%s', it is not connected (state %s)", this.name, current);
    }
    this.close(null);
  }

  boolean blocked() {
    return this.blocked;
  }

  String name() {
    return this.name;
  }

  // internal API

  private Connection newConnection() throws InterruptedException {
    Utils.throwIfInterrupted();
    Connection nc;
    try {
      nc = this.connectionFactory.newConnection(this.name);
    } catch (IOException | TimeoutException e) {
      throw ExceptionUtils.convert(e, "Could not open connection '%s'", this.name);
    }
    this.blocked = false;
    nc.addShutdownListener(signal -> this.connectionShutdown(nc, signal));
    nc.addBlockedListener(
        new BlockedListener() {
          @Override
          public void handleBlocked(String reason) {
            LOGGER.info("Connection '{}' blocked by broker: {}", name, reason);
            blocked = true;
          }

          @Override
          public void handleUnblocked() {
            LOGGER.info("Connection '{}' unblocked by broker", name);
            blocked = false;
          }
        });
    return nc;
  }

  private Channel openChannel(Connection nc) throws IOException {
    Channel ch = nc.createChannel();
    if (ch == null) {
      throw new AmqpException.AmqpConnectionException(
          "No channel available on connection '" + this.name + "'", null);
    }
    ch.addShutdownListener(signal -> this.channelShutdown(ch, signal));
    return ch;
  }

  private void replay(Channel ch) throws Exception {
    LOGGER.debug("Applying {} setup action(s) on connection '{}'", this.setups.size(), this.name);
    int index = 0;
    for (Registration registration : this.setups) {
      Utils.throwIfInterrupted();
      try {
        registration.action.setup(ch);
      } catch (IOException | RuntimeException e) {
        throw ExceptionUtils.convertSetup(
            e, "Setup action #%d failed on connection '%s'", index, this.name);
      }
      index++;
    }
  }

  private static void checkStillOpen(Connection nc, Channel ch) {
    if (!nc.isOpen() || !ch.isOpen()) {
      throw new AmqpException.AmqpConnectionException(
          "Connection or channel closed during setup", null);
    }
  }

  private void connectionShutdown(Connection nc, ShutdownSignalException signal) {
    if (signal.isInitiatedByApplication() || nc != this.connection) {
      return;
    }
    if (this.state() != OPEN) {
      LOGGER.debug(
          "Connection '{}' shut down while in state {}, ignoring", this.name, this.state());
      return;
    }
    LOGGER.info(
        "Connection '{}' has been disconnected ({}).",
        this.name,
        ExceptionUtils.describe(signal));
    this.recoverAfterFailure(ExceptionUtils.convert(signal), true);
  }

  private void channelShutdown(Channel ch, ShutdownSignalException signal) {
    if (signal.isInitiatedByApplication() || signal.isHardError() || ch != this.channel) {
      return;
    }
    if (this.state() != OPEN) {
      return;
    }
    LOGGER.info(
        "Channel of connection '{}' has been closed ({}).",
        this.name,
        ExceptionUtils.describe(signal));
    this.recoverAfterFailure(ExceptionUtils.convert(signal), false);
  }

  private void recoverAfterFailure(AmqpException failureCause, boolean connectionLost) {
    if (!this.recoveryConfiguration.activated()) {
      LOGGER.info("Recovery is deactivated, closing connection '{}'", this.name);
      this.close(failureCause);
      return;
    }
    if (!this.recovering.compareAndSet(false, true)) {
      LOGGER.debug("Connection '{}' already recovering", this.name);
      return;
    }
    this.state(RECOVERING, failureCause);
    this.channel = null;
    if (connectionLost) {
      this.connection = null;
    }
    LOGGER.debug("Scheduling recovery of connection '{}'", this.name);
    BackOffDelayPolicy delayPolicy = this.recoveryConfiguration.backOffDelayPolicy();
    CompletableFuture<Void> task =
        AsyncRetry.asyncRetry(this::reopen)
            .description("Recovering connection '%s'", this.name)
            .delayPolicy(delayPolicy)
            .retry(RECOVERY_PREDICATE.and(e -> this.state() == RECOVERING))
            .scheduler(this.scheduledExecutorService)
            .build();
    this.recoveryTask = task;
    task.whenComplete(
        (result, t) -> {
          this.recovering.set(false);
          if (t != null && this.state() == RECOVERING) {
            LOGGER.warn(
                "Could not recover connection '{}', closing it: {}", this.name, t.getMessage());
            this.close(t);
          }
        });
  }

  private Void reopen() throws Exception {
    Connection nc = this.connection;
    if (nc == null || !nc.isOpen()) {
      if (nc != null) {
        nc.abort();
      }
      LOGGER.debug("Opening new connection for '{}'", this.name);
      nc = this.newConnection();
    }
    Channel ch = null;
    this.setupLock.lock();
    try {
      if (this.state() != RECOVERING) {
        LOGGER.debug("Connection '{}' no longer recovering, stopping", this.name);
        if (nc != this.connection) {
          nc.abort();
        }
        return null;
      }
      this.connection = nc;
      ch = this.openChannel(nc);
      this.channel = ch;
      LOGGER.debug("Replaying setup actions on connection '{}'", this.name);
      this.replay(ch);
      checkStillOpen(nc, ch);
      this.metricsCollector.recoverConnection();
      this.state(OPEN);
    } catch (Exception e) {
      this.channel = null;
      if (ch != null) {
        ch.abort();
      }
      LOGGER.warn(
          "Error while recovering connection '{}': {}",
          this.name,
          RetryUtils.exceptionMessage(e));
      throw e instanceof AmqpException ? e : ExceptionUtils.convert(e);
    } finally {
      this.setupLock.unlock();
    }
    LOGGER.info("Recovered connection '{}'", this.name);
    return null;
  }

  private void close(Throwable cause) {
    if (this.closed.compareAndSet(false, true)) {
      this.state(CLOSING, cause);
      LOGGER.debug("Closing connection '{}'", this.name);
      CompletableFuture<Void> task = this.recoveryTask;
      if (task != null) {
        task.cancel(false);
      }
      BiConsumer<String, Utils.RunnableWithException> safeClose =
          (label, action) -> {
            try {
              action.run();
            } catch (Exception e) {
              LOGGER.info(
                  "Error during connection '{}' closing ({}): {}", this.name, label, e.getMessage());
            }
          };
      this.setupLock.lock();
      try {
        Channel ch = this.channel;
        Connection nc = this.connection;
        this.channel = null;
        this.connection = null;
        if (ch != null && ch.isOpen()) {
          safeClose.accept("channel", ch::close);
        }
        if (nc != null) {
          if (cause == null && nc.isOpen()) {
            safeClose.accept("connection", nc::close);
          } else {
            safeClose.accept("connection", nc::abort);
          }
        }
        this.setups.forEach(r -> r.active = false);
        this.setups.clear();
      } finally {
        this.setupLock.unlock();
      }
      this.metricsCollector.closeConnection();
      this.state(CLOSED, cause);
      LOGGER.debug("Connection '{}' closed", this.name);
    }
  }

  @Override
  public String toString() {
    return "AmqpConnectionSupervisor{" + "id=" + id + ", name='" + name + '\'' + '}';
  }

  private static final class Registration implements SetupRegistration {

    private final SetupAction action;
    private volatile boolean active = true;

    private Registration(SetupAction action) {
      this.action = action;
    }

    @Override
    public boolean active() {
      return this.active;
    }
  }
}
