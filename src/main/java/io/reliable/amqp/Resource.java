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
 * Something with a lifecycle that follows the broker connection.
 *
 * <p>The {@link ConnectionSupervisor} starts {@link State#DISCONNECTED}, goes through {@link
 * State#OPENING} on {@link Client#init()}, and alternates between {@link State#OPEN} and {@link
 * State#RECOVERING} while the broker comes and goes. A {@link Subscription} is open from {@link
 * ConsumerBuilder#subscribe()} until it is cancelled, and survives recoveries of the supervisor.
 *
 * <p>Listeners see every transition, e.g. to hold back publishing while the supervisor is
 * recovering, or to alert when it gives up and closes.
 */
public interface Resource {

  /**
   * Callback for state transitions, called on the thread that made the transition.
   *
   * @see ClientBuilder#listeners(StateListener...)
   * @see ConsumerBuilder#listeners(StateListener...)
   */
  @FunctionalInterface
  interface StateListener {

    /**
     * Called after each transition.
     *
     * @param context the transition
     */
    void handle(Context context);
  }

  /** A state transition. */
  interface Context {

    /**
     * The supervisor or subscription that changed state.
     *
     * @return the resource
     */
    Resource resource();

    /**
     * What caused the transition, e.g. the broker error that triggered a recovery.
     *
     * @return the failure, or null for a transition requested by the application
     */
    Throwable failureCause();

    /**
     * The state before the transition.
     *
     * @return previous state
     */
    State previousState();

    /**
     * The state after the transition.
     *
     * @return new state
     */
    State currentState();
  }

  enum State {
    /** Created, {@link Client#init()} not called yet. */
    DISCONNECTED,
    /** Connecting and running the setup actions. */
    OPENING,
    /** Usable: publishing works and subscriptions receive messages. */
    OPEN,
    /** Connection or channel lost, reconnecting and replaying the setup actions. */
    RECOVERING,
    /** Releasing the channel and the connection. */
    CLOSING,
    /** Closed by the application, or after recovery gave up. Final. */
    CLOSED
  }
}
