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

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Optional settings of a published message.
 *
 * <pre>
 * client.publish("data.test", "some.key", body,
 *     PublishOptions.persistent().header("origin", "billing").contentType("application/json"));
 * </pre>
 */
public final class PublishOptions {

  private boolean persistent;
  private String contentType;
  private final Map<String, Object> headers = new LinkedHashMap<>();

  private PublishOptions(boolean persistent) {
    this.persistent = persistent;
  }

  /**
   * Options for a transient message, without headers.
   *
   * @return new options
   */
  public static PublishOptions options() {
    return new PublishOptions(false);
  }

  /**
   * Options for a persistent message.
   *
   * @return new options
   */
  public static PublishOptions persistent() {
    return new PublishOptions(true);
  }

  public PublishOptions persistent(boolean persistent) {
    this.persistent = persistent;
    return this;
  }

  public PublishOptions contentType(String contentType) {
    this.contentType = contentType;
    return this;
  }

  public PublishOptions header(String key, Object value) {
    this.headers.put(key, value);
    return this;
  }

  public PublishOptions headers(Map<String, Object> headers) {
    if (headers != null) {
      this.headers.putAll(headers);
    }
    return this;
  }

  public boolean isPersistent() {
    return this.persistent;
  }

  public String contentType() {
    return this.contentType;
  }

  public Map<String, Object> headers() {
    return Collections.unmodifiableMap(this.headers);
  }
}
