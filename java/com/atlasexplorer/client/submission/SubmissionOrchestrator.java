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

import com.atlasexplorer.client.crypto.HybridEnvelopeEncryptor;
import com.atlasexplorer.client.crypto.IntegrityException;
import com.atlasexplorer.client.crypto.KeyException;
import com.atlasexplorer.client.crypto.KeyWrapper;
import com.atlasexplorer.client.envelope.EnvelopeCodec;
import com.atlasexplorer.client.envelope.EnvelopeFormatException;
import com.atlasexplorer.client.poller.JobState;
import com.atlasexplorer.client.poller.JobStatusPoller;
import com.atlasexplorer.client.poller.PollResult;
import com.atlasexplorer.client.service.ExperimentServiceClient;
import com.atlasexplorer.client.service.ExperimentServiceException;
import com.atlasexplorer.client.service.model.CreateJobRequest;
import com.atlasexplorer.client.service.model.CreateJobResponse;
import com.atlasexplorer.client.submission.model.ErrorReason;
import com.atlasexplorer.client.submission.model.Stage;
import com.atlasexplorer.client.transfer.SignedUrl;
import com.atlasexplorer.client.transfer.TransferClient;
import com.atlasexplorer.client.transfer.TransferException;
import com.atlasexplorer.shared.util.Cancellation;
import com.atlasexplorer.shared.util.CancelledException;
import com.google.common.collect.ImmutableList;
import com.google.inject.Inject;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.time.Clock;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs one workload, or a bundle of several, through the secure submission pipeline:
 *
 * <ol>
 *   <li>{@link Stage#READ_WORKLOAD} read and validate the workload file
 *   <li>{@link Stage#ENCRYPT} seal it for the service's public key
 *   <li>{@link Stage#CREATE_JOB} register the job and receive an upload URL
 *   <li>{@link Stage#UPLOAD} upload the envelope
 *   <li>{@link Stage#START_JOB} let the service pick up the uploaded artifact
 *   <li>{@link Stage#POLL} wait for a terminal state
 *   <li>{@link Stage#DOWNLOAD} fetch the result envelope
 *   <li>{@link Stage#DECRYPT} open it with this client's private key
 *   <li>{@link Stage#PERSIST_ARTIFACT} keep both envelopes, when a working directory is set
 * </ol>
 *
 * A failing stage ends the run with a {@link SubmissionException} naming that stage. Nothing is
 * cleaned up remotely.
 */
public final class SubmissionOrchestrator {

  private static final Logger logger = LoggerFactory.getLogger(SubmissionOrchestrator.class);

  private static final byte[] ELF_MAGIC = {0x7f, 'E', 'L', 'F'};

  private final HybridEnvelopeEncryptor encryptor;
  private final EnvelopeCodec codec;
  private final ExperimentServiceClient serviceClient;
  private final TransferClient transferClient;
  private final JobStatusPoller poller;
  private final SubmissionConfig config;
  private final Optional<ExperimentWorkspace> workspace;
  private final Clock clock;

  @Inject
  public SubmissionOrchestrator(
      HybridEnvelopeEncryptor encryptor,
      EnvelopeCodec codec,
      ExperimentServiceClient serviceClient,
      TransferClient transferClient,
      JobStatusPoller poller,
      SubmissionConfig config,
      Clock clock) {
    this.encryptor = encryptor;
    this.codec = codec;
    this.serviceClient = serviceClient;
    this.transferClient = transferClient;
    this.poller = poller;
    this.config = config;
    this.workspace = config.workingDirectory().map(ExperimentWorkspace::new);
    this.clock = clock;
  }

  /** Submits without a deadline or a way to cancel. */
  public ResultPackage submit(Path workloadPath, TargetCore targetCore, KeyWrapper recipient)
      throws SubmissionException {
    return submit(workloadPath, targetCore, recipient, Cancellation.create());
  }

  /**
   * Encrypts the workload for {@code recipient}, runs it on {@code targetCore} and returns the
   * decrypted result.
   *
   * @throws SubmissionException naming the failed stage
   */
  public ResultPackage submit(
      Path workloadPath, TargetCore targetCore, KeyWrapper recipient, Cancellation cancellation)
      throws SubmissionException {
    return submit(ImmutableList.of(workloadPath), targetCore, recipient, cancellation);
  }

  /**
   * Bundles {@code workloadPaths} into one package, encrypts it for {@code recipient}, runs it on
   * {@code targetCore} and returns the decrypted result. A single workload is sent as is; several
   * travel as one ZIP archive with an entry per file name.
   *
   * @throws SubmissionException naming the failed stage
   */
  public ResultPackage submit(
      List<Path> workloadPaths,
      TargetCore targetCore,
      KeyWrapper recipient,
      Cancellation cancellation)
      throws SubmissionException {
    ImmutableList<Path> paths = ImmutableList.copyOf(workloadPaths);
    ExperimentSubmission submission =
        ExperimentSubmission.create(
            UUID.randomUUID().toString(), paths, targetCore, clock.instant());
    logger.info("Submission {}: {} on {}", submission.id(), paths, targetCore);

    ImmutableList<String> workloadNames =
        runStage(Stage.READ_WORKLOAD, submission, () -> workloadNames(paths));
    byte[] workload =
        runStage(Stage.READ_WORKLOAD, submission, () -> readWorkloads(paths, workloadNames));
    byte[] workloadEnvelope;
    try {
      workloadEnvelope =
          runStage(
              Stage.ENCRYPT,
              submission,
              () -> codec.serialize(encryptor.encrypt(workload, recipient)));
    } finally {
      Arrays.fill(workload, (byte) 0);
    }

    CreateJobResponse job =
        runStage(
            Stage.CREATE_JOB,
            submission,
            () ->
                serviceClient.createJob(
                    CreateJobRequest.builder()
                        .setSubmissionId(submission.id())
                        .setTargetCore(targetCore.serviceName())
                        .setWorkloadName(workloadNames.get(0))
                        .setWorkloadNames(workloadNames)
                        .setPackaging(WorkloadArchive.packaging(workloadNames.size()))
                        .setEncryptedSize(workloadEnvelope.length)
                        .setChannel(config.channel())
                        .setRegion(config.region())
                        .build(),
                    cancellation));
    String jobId = job.jobId();

    runStage(
        Stage.UPLOAD,
        submission,
        () -> {
          transferClient.upload(job.uploadUrl(), workloadEnvelope, cancellation);
          return null;
        });
    runStage(
        Stage.START_JOB,
        submission,
        () -> {
          serviceClient.startJob(jobId, cancellation);
          return null;
        });

    PollResult pollResult =
        runStage(Stage.POLL, submission, () -> poller.pollUntilTerminal(jobId, cancellation));
    SignedUrl downloadUrl = requireSucceeded(submission, jobId, pollResult);

    byte[] resultEnvelope =
        runStage(
            Stage.DOWNLOAD, submission, () -> transferClient.download(downloadUrl, cancellation));
    byte[] result =
        runStage(
            Stage.DECRYPT,
            submission,
            () -> encryptor.decrypt(codec.parse(resultEnvelope), config.resultKey()));

    if (workspace.isPresent()) {
      runStage(
          Stage.PERSIST_ARTIFACT,
          submission,
          () -> {
            workspace.get().saveEncryptedWorkload(jobId, workloadEnvelope);
            workspace.get().saveEncryptedResult(jobId, resultEnvelope);
            return null;
          });
    }

    ResultPackage resultPackage = ResultPackage.create(submission.id(), jobId, result);
    Arrays.fill(result, (byte) 0);
    logger.info(
        "Submission {}: job {} returned {} bytes (sha256 {})",
        submission.id(),
        jobId,
        resultPackage.size(),
        resultPackage.sha256());
    return resultPackage;
  }

  private static ImmutableList<String> workloadNames(ImmutableList<Path> paths)
      throws SubmissionException {
    if (paths.isEmpty()) {
      throw invalidWorkload("No workload given");
    }
    Set<String> seen = new HashSet<>();
    ImmutableList.Builder<String> names = ImmutableList.builder();
    for (Path path : paths) {
      Path fileName = path.getFileName();
      if (fileName == null) {
        throw invalidWorkload(path + " has no file name");
      }
      if (!seen.add(fileName.toString())) {
        throw invalidWorkload("Two workloads are named " + fileName);
      }
      names.add(fileName.toString());
    }
    return names.build();
  }

  private byte[] readWorkloads(ImmutableList<Path> paths, ImmutableList<String> names)
      throws IOException, SubmissionException {
    List<byte[]> contents = new ArrayList<>();
    try {
      long total = 0;
      for (Path path : paths) {
        byte[] bytes = readWorkload(path);
        contents.add(bytes);
        total += bytes.length;
        if (total > config.maxWorkloadBytes()) {
          throw invalidWorkload(
              String.format(
                  "Workloads add up to more than the %d bytes allowed",
                  config.maxWorkloadBytes()));
        }
      }
      return WorkloadArchive.pack(names, contents);
    } finally {
      contents.forEach(bytes -> Arrays.fill(bytes, (byte) 0));
    }
  }

  private byte[] readWorkload(Path workloadPath) throws IOException, SubmissionException {
    if (!Files.isRegularFile(workloadPath)) {
      throw invalidWorkload(workloadPath + " is not a regular file");
    }
    long size = Files.size(workloadPath);
    if (size == 0) {
      throw invalidWorkload(workloadPath + " is empty");
    }
    if (size > config.maxWorkloadBytes()) {
      throw invalidWorkload(
          String.format(
              "%s has %d bytes, more than the %d allowed",
              workloadPath, size, config.maxWorkloadBytes()));
    }
    byte[] bytes = Files.readAllBytes(workloadPath);
    if (bytes.length < ELF_MAGIC.length
        || !Arrays.equals(Arrays.copyOf(bytes, ELF_MAGIC.length), ELF_MAGIC)) {
      throw invalidWorkload(workloadPath + " is not an ELF executable");
    }
    return bytes;
  }

  private static SubmissionException invalidWorkload(String message) {
    return new SubmissionException(Stage.READ_WORKLOAD, ErrorReason.INVALID_WORKLOAD, message);
  }

  private static SignedUrl requireSucceeded(
      ExperimentSubmission submission, String jobId, PollResult pollResult)
      throws SubmissionException {
    if (pollResult.state() == JobState.SUCCEEDED) {
      return pollResult.downloadUrl().get();
    }
    String reason = pollResult.failureReason().orElse("no reason given");
    if (pollResult.state() == JobState.FAILED) {
      throw new SubmissionException(
          Stage.POLL,
          ErrorReason.REMOTE_FAILURE,
          String.format("Job %s of submission %s failed: %s", jobId, submission.id(), reason));
    }
    throw new SubmissionException(
        Stage.POLL,
        ErrorReason.JOB_EXPIRED,
        String.format(
            "Job %s of submission %s expired after %s and %d status calls: %s",
            jobId, submission.id(), pollResult.elapsed(), pollResult.statusCalls(), reason));
  }

  private static <T> T runStage(
      Stage stage, ExperimentSubmission submission, StageAction<T> action)
      throws SubmissionException {
    logger.debug("Submission {}: entering {}", submission.id(), stage);
    try {
      return action.run();
    } catch (SubmissionException e) {
      throw e;
    } catch (CancelledException e) {
      throw failure(stage, submission, ErrorReason.CANCELLED, e);
    } catch (KeyException e) {
      throw failure(stage, submission, ErrorReason.KEY_ERROR, e);
    } catch (IntegrityException e) {
      throw failure(stage, submission, ErrorReason.INTEGRITY_ERROR, e);
    } catch (EnvelopeFormatException e) {
      throw failure(stage, submission, ErrorReason.FORMAT_ERROR, e);
    } catch (TransferException e) {
      throw failure(stage, submission, ErrorReason.TRANSFER_ERROR, e);
    } catch (ExperimentServiceException e) {
      throw failure(stage, submission, toReason(e), e);
    } catch (NoSuchFileException e) {
      throw failure(stage, submission, ErrorReason.INVALID_WORKLOAD, e);
    } catch (IOException e) {
      throw failure(stage, submission, ErrorReason.IO_ERROR, e);
    }
  }

  private static ErrorReason toReason(ExperimentServiceException e) {
    switch (e.getReason()) {
      case UNAUTHENTICATED:
      case REJECTED:
        return ErrorReason.SERVICE_REJECTED;
      case MALFORMED_RESPONSE:
        return ErrorReason.FORMAT_ERROR;
      case UNAVAILABLE:
      default:
        return ErrorReason.SERVICE_UNAVAILABLE;
    }
  }

  private static SubmissionException failure(
      Stage stage, ExperimentSubmission submission, ErrorReason reason, Exception cause) {
    logger.error(
        "Submission {} failed in {} ({}): {}", submission.id(), stage, reason, cause.getMessage());
    return new SubmissionException(
        stage,
        reason,
        String.format("Submission %s failed in %s: %s", submission.id(), stage, cause.getMessage()),
        cause);
  }

  /** Body of a single stage. */
  @FunctionalInterface
  private interface StageAction<T> {
    T run()
        throws IOException,
            KeyException,
            IntegrityException,
            EnvelopeFormatException,
            TransferException,
            ExperimentServiceException,
            CancelledException,
            SubmissionException;
  }
}
