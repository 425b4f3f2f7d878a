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
package io.reliable.amqp.metrics;

/** Interface to collect execution data of the client. */
public interface MetricsCollector {

  /** Called when a connection is opened, initially or after a recovery. */
  void openConnection();

  /** Called when a connection is closed or lost. */
  void closeConnection();

  /** Called when a connection recovery succeeds. */
  void recoverConnection();

  /** Called when a new {@link io.reliable.amqp.Subscription} is created. */
  void openConsumer();

  /** Called when a {@link io.reliable.amqp.Subscription} is cancelled. */
  void closeConsumer();

  /** Called when a message is published. */
  void publish();

  /**
   * Called when a publish attempt fails.
   *
   * @param failure the type of failure
   */
  void publishFailure(PublishFailure failure);

  /** Called when a message is dispatched to a {@link io.reliable.amqp.Subscription}. */
  void consume();

  /**
   * Called when a message processing attempt is settled.
   *
   * @param disposition disposition (outcome)
   */
  void consumeDisposition(ConsumeDisposition disposition);

  /** Reasons a publish attempt fails. */
  enum PublishFailure {
    /** The broker blocks the connection. */
    FLOW_CONTROL,
    /** The channel is not available or the write failed. */
    UNAVAILABLE
  }

  /** The outcomes of a message processing attempt. */
  enum ConsumeDisposition {
    /** The processing succeeded, the message has been acknowledged. */
    ACKNOWLEDGED,
    /** The processing failed, the message will be redelivered after a delay. */
    REQUEUED,
    /** The processing failed too many times, the message went to the failure queue. */
    DEAD_LETTERED
  }
}
