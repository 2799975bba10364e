/*
 * Copyright 2025 Google LLC
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *      http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package com.atlasexplorer.client.submission;

import com.atlasexplorer.client.crypto.KeyWrapper;
import com.atlasexplorer.client.submission.model.ErrorReason;
import com.atlasexplorer.client.submission.model.Stage;
import com.atlasexplorer.shared.util.Cancellation;
import com.google.auto.value.AutoValue;
import com.google.common.annotations.VisibleForTesting;
import com.google.common.collect.ImmutableList;
import com.google.common.hash.HashCode;
import com.google.common.hash.Hashing;
import com.google.common.io.MoreFiles;
import com.google.common.util.concurrent.SettableFuture;
import com.google.inject.Inject;
import java.io.IOException;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Single flight gate in front of {@link SubmissionOrchestrator}.
 *
 * <p>Submissions are keyed by the SHA-256 of each workload, in order, and the target core. At most
 * one submission per key is in flight; identical requests arriving meanwhile wait for its outcome.
 * The key is released as soon as that submission completes, successfully or not, so nothing is
 * retained and a later request submits again.
 */
public final class DeduplicatingSubmitter {

  private static final Logger logger = LoggerFactory.getLogger(DeduplicatingSubmitter.class);

  private static final Duration WAIT_SLICE = Duration.ofMillis(200);

  private final SubmissionOrchestrator orchestrator;
  private final ConcurrentMap<SubmissionKey, SettableFuture<ResultPackage>> results =
      new ConcurrentHashMap<>();

  @Inject
  public DeduplicatingSubmitter(SubmissionOrchestrator orchestrator) {
    this.orchestrator = orchestrator;
  }

  /**
   * Returns the result of the in-flight submission for this workload and core, submitting only if
   * there is none.
   *
   * @throws SubmissionException from the submission that produced the outcome, or at {@link
   *     Stage#AWAIT_IDENTICAL} with {@link ErrorReason#CANCELLED} if {@code cancellation} fired
   *     while waiting for another caller's run
   */
  public ResultPackage submit(
      Path workloadPath, TargetCore targetCore, KeyWrapper recipient, Cancellation cancellation)
      throws SubmissionException {
    return submit(ImmutableList.of(workloadPath), targetCore, recipient, cancellation);
  }

  /** Same as the single workload form, keyed by the ordered contents of every workload. */
  public ResultPackage submit(
      List<Path> workloadPaths,
      TargetCore targetCore,
      KeyWrapper recipient,
      Cancellation cancellation)
      throws SubmissionException {
    SubmissionKey key = SubmissionKey.create(hashWorkloads(workloadPaths), targetCore);
    SettableFuture<ResultPackage> future = SettableFuture.create();
    SettableFuture<ResultPackage> existing = results.putIfAbsent(key, future);
    if (existing != null) {
      logger.info("Waiting for in-flight submission of {}", key);
      return await(existing, cancellation);
    }
    try {
      ResultPackage result =
          orchestrator.submit(workloadPaths, targetCore, recipient, cancellation);
      future.set(result);
      return result;
    } catch (SubmissionException | RuntimeException e) {
      future.setException(e);
      throw e;
    } finally {
      results.remove(key, future);
    }
  }

  /** Number of keys currently in flight. */
  @VisibleForTesting
  int size() {
    return results.size();
  }

  private static ResultPackage await(
      SettableFuture<ResultPackage> future, Cancellation cancellation)
      throws SubmissionException {
    while (true) {
      if (cancellation.isCancelled()) {
        throw new SubmissionException(
            Stage.AWAIT_IDENTICAL, ErrorReason.CANCELLED, "Cancelled while waiting for a result");
      }
      try {
        return future.get(WAIT_SLICE.toMillis(), TimeUnit.MILLISECONDS);
      } catch (TimeoutException e) {
        logger.trace("Still waiting for an identical submission");
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
        throw new SubmissionException(
            Stage.AWAIT_IDENTICAL, ErrorReason.CANCELLED, "Interrupted while waiting", e);
      } catch (ExecutionException e) {
        if (e.getCause() instanceof SubmissionException) {
          SubmissionException cause = (SubmissionException) e.getCause();
          throw new SubmissionException(
              cause.getStage(), cause.getReason(), cause.getMessage(), cause);
        }
        throw new IllegalStateException("Identical submission failed", e.getCause());
      }
    }
  }

  private static HashCode hashWorkloads(List<Path> workloadPaths) throws SubmissionException {
    if (workloadPaths.isEmpty()) {
      throw new SubmissionException(
          Stage.READ_WORKLOAD, ErrorReason.INVALID_WORKLOAD, "No workload given");
    }
    List<HashCode> digests = new ArrayList<>();
    for (Path workloadPath : workloadPaths) {
      digests.add(hashWorkload(workloadPath));
    }
    return digests.size() == 1 ? digests.get(0) : Hashing.combineOrdered(digests);
  }

  private static HashCode hashWorkload(Path workloadPath) throws SubmissionException {
    try {
      return MoreFiles.asByteSource(workloadPath).hash(Hashing.sha256());
    } catch (NoSuchFileException e) {
      throw new SubmissionException(
          Stage.READ_WORKLOAD, ErrorReason.INVALID_WORKLOAD, workloadPath + " does not exist", e);
    } catch (IOException e) {
      throw new SubmissionException(
          Stage.READ_WORKLOAD, ErrorReason.IO_ERROR, "Could not hash " + workloadPath, e);
    }
  }

  /** Cache key: workload digest and target core. */
  @AutoValue
  abstract static class SubmissionKey {

    static SubmissionKey create(HashCode workloadSha256, TargetCore targetCore) {
      return new AutoValue_DeduplicatingSubmitter_SubmissionKey(workloadSha256, targetCore);
    }

    abstract HashCode workloadSha256();

    abstract TargetCore targetCore();
  }
}
