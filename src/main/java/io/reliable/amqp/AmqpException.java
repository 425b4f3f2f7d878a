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
 * Root of the exceptions thrown by the library.
 *
 * <p>All the exceptions are unchecked. Checked exceptions from the underlying AMQP client are
 * converted to one of the subclasses.
 */
public class AmqpException extends RuntimeException {

  public AmqpException(Throwable cause) {
    super(cause);
  }

  public AmqpException(String format, Object... args) {
    super(String.format(format, args));
  }

  public AmqpException(String message, Throwable cause) {
    super(message, cause);
  }

  /** Problem with the connection to the broker (network failure, broker shutdown, etc). */
  public static class AmqpConnectionException extends AmqpException {

    public AmqpConnectionException(String message, Throwable cause) {
      super(message, cause);
    }
  }

  /** Topology or consumer setup failed, e.g. a queue declaration with inconsistent arguments. */
  public static class AmqpSetupException extends AmqpException {

    public AmqpSetupException(String message, Throwable cause) {
      super(message, cause);
    }
  }

  /**
   * The broker applies flow control on the connection, the message has not been sent.
   *
   * <p>The caller is expected to retry later or to slow down.
   */
  public static class AmqpFlowControlException extends AmqpException {

    public AmqpFlowControlException(String format, Object... args) {
      super(format, args);
    }
  }

  public static class AmqpResourceInvalidStateException extends AmqpException {

    public AmqpResourceInvalidStateException(String format, Object... args) {
      super(format, args);
    }

    public AmqpResourceInvalidStateException(String message, Throwable cause) {
      super(message, cause);
    }
  }

  public static class AmqpResourceClosedException extends AmqpResourceInvalidStateException {

    public AmqpResourceClosedException(String message) {
      super(message);
    }

    public AmqpResourceClosedException(String message, Throwable cause) {
      super(message, cause);
    }
  }
}
