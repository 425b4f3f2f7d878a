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

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.junit.jupiter.api.Test;

public class TopologyTest {

  @Test
  void definitionsKeepDeclarationOrder() {
    Topology topology =
        Topology.builder()
            .exchange("b")
            .topology()
            .exchange("a")
            .topology()
            .queue("q2")
            .topology()
            .queue("q1")
            .bindToTopic("a", "x.#")
            .topology()
            .build();
    assertThat(topology.exchanges())
        .extracting(Topology.ExchangeSpecification::name)
        .containsExactly("b", "a");
    assertThat(topology.queues())
        .extracting(Topology.QueueSpecification::name)
        .containsExactly("q2", "q1");
    assertThat(topology.queue("q2").binding()).isNull();
    Topology.BindingSpecification binding = topology.queue("q1").binding();
    assertThat(binding.exchange()).isEqualTo("a");
    assertThat(binding.queue()).isEqualTo("q1");
    assertThat(binding.key()).isEqualTo("x.#");
  }

  @Test
  void exchangesAreTopicAndDurableByDefault() {
    Topology topology = Topology.builder().exchange("data.test").topology().build();
    Topology.ExchangeSpecification exchange = topology.exchange("data.test");
    assertThat(exchange.type()).isEqualTo("topic");
    assertThat(exchange.durable()).isTrue();
    assertThat(exchange.autoDelete()).isFalse();
    assertThat(exchange.internal()).isFalse();
  }

  @Test
  void sameNameReturnsSameDefinition() {
    Topology.Builder builder = Topology.builder();
    builder.queue("work").durable(false);
    builder.queue("work").argument("x-max-length", 100);
    Topology topology = builder.build();
    assertThat(topology.queues()).hasSize(1);
    assertThat(topology.queue("work").durable()).isFalse();
    assertThat(topology.queue("work").arguments()).containsEntry("x-max-length", 100);
  }

  @Test
  void topologyIsNotAffectedByLaterBuilderChanges() {
    Topology.Builder builder = Topology.builder();
    builder.queue("work");
    Topology topology = builder.build();
    builder.queue("other");
    builder.queue("work").argument("x-max-length", 100);
    assertThat(topology.queues()).hasSize(1);
    assertThat(topology.queue("work").arguments()).isEmpty();
  }

  @Test
  void emptyTopology() {
    assertThat(Topology.empty().isEmpty()).isTrue();
    assertThat(Topology.builder().prefetch(1).build().isEmpty()).isFalse();
  }

  @Test
  void invalidDefinitionsAreRejected() {
    assertThatThrownBy(() -> Topology.builder().exchange(" "))
        .isInstanceOf(IllegalArgumentException.class);
    assertThatThrownBy(() -> Topology.builder().queue(null))
        .isInstanceOf(IllegalArgumentException.class);
    assertThatThrownBy(() -> Topology.builder().queue("q").bindToTopic("", "#"))
        .isInstanceOf(IllegalArgumentException.class);
    assertThatThrownBy(() -> Topology.builder().prefetch(-1))
        .isInstanceOf(IllegalArgumentException.class);
  }
}
