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
import com.rabbitmq.client.Method;
import com.rabbitmq.client.ShutdownSignalException;
import io.reliable.amqp.AmqpException;
import java.io.IOException;
import java.util.concurrent.TimeoutException;

abstract class ExceptionUtils {

  private ExceptionUtils() {}

  static AmqpException convert(Exception e) {
    return convert(e, null);
  }

  static AmqpException convert(Exception e, String format, Object... args) {
    String message = format != null ? String.format(format, args) : null;
    if (e instanceof AmqpException) {
      return (AmqpException) e;
    }
    ShutdownSignalException sse = shutdownSignal(e);
    if (sse != null) {
      if (sse.isHardError()) {
        return new AmqpException.AmqpConnectionException(
            message(message, describe(sse)), e);
      } else {
        return new AmqpException(message(message, describe(sse)), e);
      }
    } else if (e instanceof IOException || e instanceof TimeoutException) {
      return new AmqpException.AmqpConnectionException(message(message, e.getMessage()), e);
    } else {
      return message == null ? new AmqpException(e) : new AmqpException(message, e);
    }
  }

  /**
   * Convert an exception raised during a setup action.
   *
   * <p>Connection failures stay connection failures, so the caller can tell a broken connection
   * from a topology problem.
   */
  static AmqpException convertSetup(Exception e, String format, Object... args) {
    AmqpException converted = convert(e, format, args);
    if (converted instanceof AmqpException.AmqpConnectionException
        || converted instanceof AmqpException.AmqpSetupException
        || converted instanceof AmqpException.AmqpResourceInvalidStateException) {
      return converted;
    } else {
      return new AmqpException.AmqpSetupException(
          converted.getMessage(), converted.getCause() == null ? converted : converted.getCause());
    }
  }

  static boolean isConnectionFailure(Exception e) {
    return convert(e) instanceof AmqpException.AmqpConnectionException;
  }

  /**
   * The shutdown signal behind an exception, if any.
   *
   * @return the signal or null
   */
  static ShutdownSignalException shutdownSignal(Throwable e) {
    Throwable current = e;
    int depth = 0;
    while (current != null && depth < 10) {
      if (current instanceof ShutdownSignalException) {
        return (ShutdownSignalException) current;
      }
      current = current.getCause();
      depth++;
    }
    return null;
  }

  static int replyCode(ShutdownSignalException sse) {
    Method reason = sse.getReason();
    if (reason instanceof AMQP.Channel.Close) {
      return ((AMQP.Channel.Close) reason).getReplyCode();
    } else if (reason instanceof AMQP.Connection.Close) {
      return ((AMQP.Connection.Close) reason).getReplyCode();
    } else {
      return -1;
    }
  }

  static String describe(ShutdownSignalException sse) {
    Method reason = sse.getReason();
    String replyText = null;
    if (reason instanceof AMQP.Channel.Close) {
      replyText = ((AMQP.Channel.Close) reason).getReplyText();
    } else if (reason instanceof AMQP.Connection.Close) {
      replyText = ((AMQP.Connection.Close) reason).getReplyText();
    }
    String level = sse.isHardError() ? "connection" : "channel";
    if (replyText == null) {
      return String.format("%s shut down (%s)", level, sse.getMessage());
    } else {
      return String.format("%s closed by broker: %d %s", level, replyCode(sse), replyText);
    }
  }

  private static String message(String prefix, String detail) {
    if (prefix == null) {
      return detail;
    } else if (detail == null) {
      return prefix;
    } else {
      return prefix + " (" + detail + ")";
    }
  }
}
