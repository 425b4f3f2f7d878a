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

import io.reliable.amqp.AmqpException;
import io.reliable.amqp.BackOffDelayPolicy;
import java.time.Duration;
import java.util.concurrent.Callable;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.function.Predicate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Retries a task on a scheduler until it succeeds, the retry predicate rejects the failure, or the
 * delay policy times out.
 */
final class AsyncRetry<V> {

  private static final Logger LOGGER = LoggerFactory.getLogger(AsyncRetry.class);

  private final CompletableFuture<V> completableFuture;

  private AsyncRetry(
      Callable<V> task,
      String description,
      ScheduledExecutorService scheduler,
      BackOffDelayPolicy delayPolicy,
      Predicate<Exception> retry) {
    this.completableFuture = new CompletableFuture<>();
    // first attempt on the scheduler too, the caller can be a connection I/O thread
    AttemptRunner<V> runner =
        new AttemptRunner<>(
            task, description, scheduler, delayPolicy, retry, this.completableFuture);
    runner.schedule(0);
  }

  static <V> AsyncRetryBuilder<V> asyncRetry(Callable<V> task) {
    return new AsyncRetryBuilder<>(task);
  }

  private static final class AttemptRunner<V> implements Runnable {

    private final Callable<V> task;
    private final String description;
    private final ScheduledExecutorService scheduler;
    private final BackOffDelayPolicy delayPolicy;
    private final Predicate<Exception> retry;
    private final CompletableFuture<V> result;
    private final Utils.StopWatch stopWatch = new Utils.StopWatch();
    private volatile int attempt;

    private AttemptRunner(
        Callable<V> task,
        String description,
        ScheduledExecutorService scheduler,
        BackOffDelayPolicy delayPolicy,
        Predicate<Exception> retry,
        CompletableFuture<V> result) {
      this.task = task;
      this.description = description;
      this.scheduler = scheduler;
      this.delayPolicy = delayPolicy;
      this.retry = retry;
      this.result = result;
    }

    private void schedule(int attempt) {
      this.attempt = attempt;
      Duration delay = this.delayPolicy.delay(attempt);
      if (BackOffDelayPolicy.TIMEOUT.equals(delay)) {
        LOGGER.debug(
            "Retryable task '{}' timed out after {} attempt(s) and {} ms",
            this.description,
            attempt,
            this.stopWatch.stop().toMillis());
        this.result.completeExceptionally(
            new AmqpException(
                "Retryable task '%s' timed out after %d attempt(s)", this.description, attempt));
        return;
      }
      try {
        this.scheduler.schedule(this, delay.toMillis(), TimeUnit.MILLISECONDS);
      } catch (RejectedExecutionException e) {
        LOGGER.debug("Could not schedule retryable task '{}': {}", this.description, e.getMessage());
        this.result.completeExceptionally(e);
      }
    }

    @Override
    public void run() {
      if (this.result.isDone()) {
        return;
      }
      LOGGER.debug("Running retryable task '{}', attempt #{}", this.description, this.attempt + 1);
      try {
        V value = this.task.call();
        LOGGER.debug(
            "Retryable task '{}' succeeded after {} ms",
            this.description,
            this.stopWatch.stop().toMillis());
        this.result.complete(value);
      } catch (Exception e) {
        if (e instanceof InterruptedException) {
          Thread.currentThread().interrupt();
          this.result.completeExceptionally(e);
        } else if (this.retry.test(e)) {
          LOGGER.debug(
              "Retryable task '{}' failed ({}), scheduling another attempt",
              this.description,
              RetryUtils.exceptionMessage(e));
          this.schedule(this.attempt + 1);
        } else {
          LOGGER.debug(
              "Retryable task '{}' failed with non-retryable error: {}",
              this.description,
              RetryUtils.exceptionMessage(e));
          this.result.completeExceptionally(e);
        }
      }
    }
  }

  static final class AsyncRetryBuilder<V> {

    private final Callable<V> task;
    private String description = "";
    private ScheduledExecutorService scheduler;
    private BackOffDelayPolicy delayPolicy = BackOffDelayPolicy.fixed(Duration.ofSeconds(1));
    private Predicate<Exception> retry = e -> true;

    private AsyncRetryBuilder(Callable<V> task) {
      this.task = task;
    }

    AsyncRetryBuilder<V> scheduler(ScheduledExecutorService scheduler) {
      this.scheduler = scheduler;
      return this;
    }

    AsyncRetryBuilder<V> delay(Duration delay) {
      this.delayPolicy = BackOffDelayPolicy.fixedWithInitialDelay(delay, delay);
      return this;
    }

    AsyncRetryBuilder<V> delayPolicy(BackOffDelayPolicy delayPolicy) {
      this.delayPolicy = delayPolicy;
      return this;
    }

    AsyncRetryBuilder<V> retry(Predicate<Exception> predicate) {
      this.retry = predicate;
      return this;
    }

    AsyncRetryBuilder<V> description(String format, Object... args) {
      this.description = String.format(format, args);
      return this;
    }

    CompletableFuture<V> build() {
      if (this.scheduler == null) {
        throw new IllegalStateException("A scheduler is required");
      }
      return new AsyncRetry<>(
              this.task, this.description, this.scheduler, this.delayPolicy, this.retry)
          .completableFuture;
    }
  }
}
