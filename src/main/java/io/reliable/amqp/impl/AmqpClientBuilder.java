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

import com.rabbitmq.client.ConnectionFactory;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import io.reliable.amqp.BackOffDelayPolicy;
import io.reliable.amqp.Client;
import io.reliable.amqp.ClientBuilder;
import io.reliable.amqp.DeadLetterPolicy;
import io.reliable.amqp.Resource;
import io.reliable.amqp.Topology;
import io.reliable.amqp.metrics.MetricsCollector;
import io.reliable.amqp.metrics.NoOpMetricsCollector;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.ScheduledExecutorService;

/**
 * Entry point to create a {@link Client}.
 *
 * <pre>{@code
 * Client client = new AmqpClientBuilder()
 *     .uri("amqp://localhost:5672/%2f")
 *     .topology(Topology.builder()
 *         .exchange("data.test").topology()
 *         .queue("work").bindToTopic("data.test", "#").topology()
 *         .queue("fail").topology()
 *         .build())
 *     .build();
 * client.init();
 * }</pre>
 */
public class AmqpClientBuilder implements ClientBuilder {

  private String uri;
  private ConnectionFactory connectionFactory;
  private String name;
  private Topology topology = Topology.empty();
  private ExecutorService handlerExecutor;
  private ScheduledExecutorService scheduledExecutorService;
  private MetricsCollector metricsCollector = NoOpMetricsCollector.INSTANCE;
  private final List<Resource.StateListener> listeners = new ArrayList<>();
  private final AmqpRecoveryConfiguration recoveryConfiguration =
      new AmqpRecoveryConfiguration(this);
  private final AmqpRetryConfiguration retryConfiguration = new AmqpRetryConfiguration(this);

  public AmqpClientBuilder() {}

  @Override
  public AmqpClientBuilder uri(String uri) {
    this.uri = uri;
    return this;
  }

  @Override
  public AmqpClientBuilder connectionFactory(ConnectionFactory connectionFactory) {
    this.connectionFactory = connectionFactory;
    return this;
  }

  @Override
  public AmqpClientBuilder name(String name) {
    this.name = name;
    return this;
  }

  @Override
  public AmqpClientBuilder topology(Topology topology) {
    this.topology = topology == null ? Topology.empty() : topology;
    return this;
  }

  @Override
  public AmqpClientBuilder handlerExecutor(ExecutorService executorService) {
    this.handlerExecutor = executorService;
    return this;
  }

  @Override
  public AmqpClientBuilder scheduledExecutorService(
      ScheduledExecutorService scheduledExecutorService) {
    this.scheduledExecutorService = scheduledExecutorService;
    return this;
  }

  @Override
  public AmqpClientBuilder metricsCollector(MetricsCollector metricsCollector) {
    this.metricsCollector =
        metricsCollector == null ? NoOpMetricsCollector.INSTANCE : metricsCollector;
    return this;
  }

  @Override
  public AmqpClientBuilder listeners(Resource.StateListener... listeners) {
    if (listeners == null || listeners.length == 0) {
      this.listeners.clear();
    } else {
      this.listeners.addAll(List.of(listeners));
    }
    return this;
  }

  @Override
  @SuppressFBWarnings("EI_EXPOSE_REP")
  public RecoveryConfiguration recovery() {
    return this.recoveryConfiguration;
  }

  @Override
  @SuppressFBWarnings("EI_EXPOSE_REP")
  public RetryConfiguration retry() {
    return this.retryConfiguration;
  }

  @Override
  public Client build() {
    return new AmqpClient(this);
  }

  String uri() {
    return this.uri;
  }

  ConnectionFactory connectionFactory() {
    return this.connectionFactory;
  }

  String name() {
    return this.name;
  }

  Topology topology() {
    return this.topology;
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

  List<Resource.StateListener> listeners() {
    return this.listeners;
  }

  AmqpRecoveryConfiguration recoveryConfiguration() {
    return this.recoveryConfiguration;
  }

  AmqpRetryConfiguration retryConfiguration() {
    return this.retryConfiguration;
  }

  static class AmqpRecoveryConfiguration implements RecoveryConfiguration {

    private final AmqpClientBuilder clientBuilder;
    private boolean activated = true;
    private BackOffDelayPolicy backOffDelayPolicy = BackOffDelayPolicy.fixed(Duration.ofSeconds(5));
    private int initialConnectionAttempts = 1;

    AmqpRecoveryConfiguration(AmqpClientBuilder clientBuilder) {
      this.clientBuilder = clientBuilder;
    }

    @Override
    public AmqpRecoveryConfiguration activated(boolean activated) {
      this.activated = activated;
      return this;
    }

    @Override
    public AmqpRecoveryConfiguration backOffDelayPolicy(BackOffDelayPolicy backOffDelayPolicy) {
      Assert.notNull(backOffDelayPolicy, "Back-off delay policy cannot be null");
      this.backOffDelayPolicy = backOffDelayPolicy;
      return this;
    }

    @Override
    public AmqpRecoveryConfiguration initialConnectionAttempts(int attempts) {
      if (attempts < 1) {
        throw new IllegalArgumentException("There must be at least 1 connection attempt");
      }
      this.initialConnectionAttempts = attempts;
      return this;
    }

    @Override
    public AmqpClientBuilder clientBuilder() {
      return this.clientBuilder;
    }

    boolean activated() {
      return this.activated;
    }

    BackOffDelayPolicy backOffDelayPolicy() {
      return this.backOffDelayPolicy;
    }

    int initialConnectionAttempts() {
      return this.initialConnectionAttempts;
    }
  }

  static class AmqpRetryConfiguration implements RetryConfiguration {

    private final AmqpClientBuilder clientBuilder;
    private boolean activated = true;
    private String queuePrefix = DelayedRedelivery.DEFAULT_PREFIX;
    private BackOffDelayPolicy delayPolicy = BackOffDelayPolicy.linear(Duration.ofMillis(300));
    private DeadLetterPolicy deadLetterPolicy = DeadLetterPolicy.UNCHANGED;

    AmqpRetryConfiguration(AmqpClientBuilder clientBuilder) {
      this.clientBuilder = clientBuilder;
    }

    @Override
    public AmqpRetryConfiguration activated(boolean activated) {
      this.activated = activated;
      return this;
    }

    @Override
    public AmqpRetryConfiguration queuePrefix(String prefix) {
      Assert.notBlank(prefix, "Retry queue prefix cannot be blank");
      this.queuePrefix = prefix;
      return this;
    }

    @Override
    public AmqpRetryConfiguration delayPolicy(BackOffDelayPolicy delayPolicy) {
      Assert.notNull(delayPolicy, "Delay policy cannot be null");
      this.delayPolicy = delayPolicy;
      return this;
    }

    @Override
    public AmqpRetryConfiguration deadLetterPolicy(DeadLetterPolicy deadLetterPolicy) {
      Assert.notNull(deadLetterPolicy, "Dead letter policy cannot be null");
      this.deadLetterPolicy = deadLetterPolicy;
      return this;
    }

    @Override
    public AmqpClientBuilder clientBuilder() {
      return this.clientBuilder;
    }

    boolean activated() {
      return this.activated;
    }

    String queuePrefix() {
      return this.queuePrefix;
    }

    BackOffDelayPolicy delayPolicy() {
      return this.delayPolicy;
    }

    DeadLetterPolicy deadLetterPolicy() {
      return this.deadLetterPolicy;
    }
  }
}
