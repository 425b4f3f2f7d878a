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
 * What happens to the metadata of a message sent to a failure queue.
 *
 * <p>The body is always kept as-is.
 */
public enum DeadLetterPolicy {

  /** Properties and headers are kept unchanged. */
  UNCHANGED,

  /**
   * Properties are kept, dead-letter headers are added: {@value #REASON_HEADER}, {@value
   * #TIMESTAMP_HEADER} (epoch milliseconds), and {@value Message#ORIGINAL_QUEUE_HEADER}.
   */
  STAMPED;

  public static final String REASON_HEADER = "x-dead-letter-reason";
  public static final String TIMESTAMP_HEADER = "x-dead-lettered-at";
}
