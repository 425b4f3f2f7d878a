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

import com.rabbitmq.client.Channel;
import java.io.IOException;

/**
 * Owner of the connection to the broker and of the channel used by the library.
 *
 * <p>The supervisor keeps an ordered registry of {@link SetupAction}s (topology declaration,
 * consumers). The actions are executed, in registration order, each time a new channel becomes
 * available: on the first connection and after each connection recovery. This way broker-side
 * state (queues, bindings, consumers) is re-created from its description instead of being assumed
 * to survive a connection failure.
 *
 * <p>The channel is never reused across recoveries, callers should get it with {@link #channel()}
 * for each operation and not keep a reference to it.
 */
public interface ConnectionSupervisor extends Resource, AutoCloseable {

  /**
   * Connect to the broker and execute the registered setup actions.
   *
   * <p>Returns when all the actions have been executed. This is a no-op if the supervisor is
   * already connected.
   *
   * @throws AmqpException.AmqpConnectionException if the connection cannot be opened
   * @throws AmqpException.AmqpSetupException if a setup action fails
   */
  void connect();

  /**
   * Register a setup action.
   *
   * <p>The action is executed immediately if a channel is available, so late registrations are not
   * missed.
   *
   * @param action the action, it must be idempotent
   * @return the registration handle, to use with {@link #removeSetup(SetupRegistration,
   *     ChannelCallback)}
   * @throws AmqpException.AmqpSetupException if the immediate execution of the action fails, the
   *     action is not registered then
   */
  SetupRegistration addSetup(SetupAction action);

  /**
   * Unregister a setup action, so it is not executed on future recoveries.
   *
   * @param registration the registration handle
   * @param cleanup callback to undo the live effect of the action on the current channel (e.g.
   *     cancel a consumer), can be null
   */
  void removeSetup(SetupRegistration registration, ChannelCallback cleanup);

  /**
   * The current channel.
   *
   * @return the current channel
   * @throws AmqpException.AmqpResourceInvalidStateException if the supervisor is not open
   */
  Channel channel();

  /**
   * Current state of the supervisor.
   *
   * @return the state
   */
  State state();

  /**
   * Close the channel and the connection.
   *
   * @throws AmqpException.AmqpResourceInvalidStateException if the supervisor is not connected
   */
  @Override
  void close();

  /**
   * Idempotent action executed on each new channel.
   *
   * <p>Executions are sequential: an action starts once the previous one has completed.
   */
  @FunctionalInterface
  interface SetupAction {

    /**
     * Set up broker-side state.
     *
     * @param channel the new channel
     * @throws IOException if a broker operation fails
     */
    void setup(Channel channel) throws IOException;
  }

  /** Callback executed against the current channel. */
  @FunctionalInterface
  interface ChannelCallback {

    void execute(Channel channel) throws IOException;
  }

  /** Handle on a registered {@link SetupAction}. */
  interface SetupRegistration {

    /**
     * Whether the action is still registered.
     *
     * @return true if the action is still in the registry
     */
    boolean active();
  }
}
