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

import static com.google.common.truth.Truth.assertThat;
import static java.nio.charset.StandardCharsets.UTF_8;
import static org.junit.Assert.assertThrows;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import com.atlasexplorer.client.crypto.HybridEnvelopeEncryptor;
import com.atlasexplorer.client.crypto.KeyException;
import com.atlasexplorer.client.crypto.KeyWrapper;
import com.atlasexplorer.client.envelope.EnvelopeCodec;
import com.atlasexplorer.client.envelope.WrapScheme;
import com.atlasexplorer.client.poller.JobStatusPoller;
import com.atlasexplorer.client.poller.PollerConfig;
import com.atlasexplorer.client.poller.testing.FakeClockSleeper;
import com.atlasexplorer.client.service.ExperimentServiceException;
import com.atlasexplorer.client.service.model.CreateJobRequest;
import com.atlasexplorer.client.service.model.JobStatusResponse;
import com.atlasexplorer.client.service.testing.FakeExperimentServiceClient;
import com.atlasexplorer.client.submission.model.ErrorReason;
import com.atlasexplorer.client.submission.model.Stage;
import com.atlasexplorer.client.transfer.TransferException;
import com.atlasexplorer.client.transfer.testing.InMemoryTransferClient;
import com.atlasexplorer.shared.util.Cancellation;
import com.google.acai.Acai;
import com.google.common.collect.ImmutableList;
import com.google.common.primitives.Bytes;
import com.google.inject.Inject;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Stream;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;
import org.mockito.ArgumentCaptor;

@RunWith(JUnit4.class)
public final class SubmissionOrchestratorTest {

  private static final byte[] ELF_HEADER = {0x7f, 'E', 'L', 'F', 2, 1, 1, 0};
  private static final byte[] RESULT = "cycles=1234 instructions=999".getBytes(UTF_8);

  @Rule public final Acai acai = new Acai(SubmissionTestModule.class);
  @Rule public final TemporaryFolder tempFolder = new TemporaryFolder();

  @Inject SubmissionOrchestrator orchestrator;
  @Inject FakeExperimentServiceClient service;
  @Inject InMemoryTransferClient storage;
  @Inject FakeClockSleeper clock;
  @Inject HybridEnvelopeEncryptor encryptor;
  @Inject EnvelopeCodec codec;
  @Inject JobStatusPoller poller;

  @Test
  public void submit_runsWorkloadAndReturnsDecryptedResult() throws Exception {
    Path workload = writeWorkload("hello.elf", elf("hello mips"));
    publishResult(RESULT);
    service.thenReport("queued", "running", "running", "succeeded");

    ResultPackage result =
        orchestrator.submit(workload, TargetCore.P8700, TestKeys.SERVICE_PUBLIC);

    assertThat(result.bytes()).isEqualTo(RESULT);
    assertThat(result.jobId()).isEqualTo(FakeExperimentServiceClient.JOB_ID);
    assertThat(result.size()).isEqualTo((long) RESULT.length);
    assertThat(service.getStatusCalls()).isEqualTo(4);
    assertThat(service.getStartedJobs()).containsExactly(FakeExperimentServiceClient.JOB_ID);
    assertThat(service.getCreateRequests()).hasSize(1);
    assertThat(service.getCreateRequests().get(0).targetCore()).isEqualTo("P8700");
    assertThat(service.getCreateRequests().get(0).workloadName()).isEqualTo("hello.elf");
    assertThat(service.getCreateRequests().get(0).channel()).isEqualTo("stable");
    assertThat(clock.getSleeps()).hasSize(3);
  }

  @Test
  public void submit_uploadsOnlyCiphertextThatServiceCanOpen() throws Exception {
    byte[] elf = elf("secret algorithm");
    Path workload = writeWorkload("secret.elf", elf);
    publishResult(RESULT);
    service.thenReport("succeeded");

    orchestrator.submit(workload, TargetCore.I8500_1_THREAD, TestKeys.SERVICE_PUBLIC);

    byte[] uploaded = storage.get(FakeExperimentServiceClient.UPLOAD_URL).get();
    assertThat(Bytes.indexOf(uploaded, "secret algorithm".getBytes(UTF_8))).isEqualTo(-1);
    assertThat(service.getCreateRequests().get(0).encryptedSize())
        .isEqualTo((long) uploaded.length);
    assertThat(encryptor.decrypt(codec.parse(uploaded), TestKeys.SERVICE_PRIVATE)).isEqualTo(elf);
    assertThat(service.getCreateRequests().get(0).targetCore()).isEqualTo("I8500_(1_thread)");
  }

  @Test
  public void submit_severalWorkloads_uploadsOneZipBundle() throws Exception {
    Path mandelbrot = writeWorkload("mandelbrot_rv64_O0.elf", elf("mandelbrot"));
    Path memcpy = writeWorkload("memcpy_rv64.elf", elf("memcpy"));
    publishResult(RESULT);
    service.thenReport("succeeded");

    ResultPackage result =
        orchestrator.submit(
            ImmutableList.of(mandelbrot, memcpy),
            TargetCore.SHOGUN_2T,
            TestKeys.SERVICE_PUBLIC,
            Cancellation.create());

    assertThat(result.bytes()).isEqualTo(RESULT);
    CreateJobRequest request = service.getCreateRequests().get(0);
    assertThat(request.targetCore()).isEqualTo("shogun_2t");
    assertThat(request.packaging()).isEqualTo(WorkloadArchive.PACKAGING_ZIP);
    assertThat(request.workloadName()).isEqualTo("mandelbrot_rv64_O0.elf");
    assertThat(request.workloadNames())
        .containsExactly("mandelbrot_rv64_O0.elf", "memcpy_rv64.elf")
        .inOrder();
    byte[] uploaded = storage.get(FakeExperimentServiceClient.UPLOAD_URL).get();
    Map<String, byte[]> bundle =
        WorkloadArchiveTest.unzip(
            encryptor.decrypt(codec.parse(uploaded), TestKeys.SERVICE_PRIVATE));
    assertThat(bundle.get("mandelbrot_rv64_O0.elf")).isEqualTo(elf("mandelbrot"));
    assertThat(bundle.get("memcpy_rv64.elf")).isEqualTo(elf("memcpy"));
  }

  @Test
  public void submit_singleWorkload_announcesRawElf() throws Exception {
    Path workload = writeWorkload("hello.elf", elf("hello"));
    publishResult(RESULT);
    service.thenReport("succeeded");

    orchestrator.submit(workload, TargetCore.P8700, TestKeys.SERVICE_PUBLIC);

    CreateJobRequest request = service.getCreateRequests().get(0);
    assertThat(request.packaging()).isEqualTo(WorkloadArchive.PACKAGING_ELF);
    assertThat(request.workloadNames()).containsExactly("hello.elf");
  }

  @Test
  public void submit_invalidWorkloadList_failsInReadStage() throws Exception {
    Path hello = writeWorkload("hello.elf", elf("hello"));
    Path script = writeWorkload("script.sh", "#!/bin/sh\n".getBytes(UTF_8));
    Path sameName = tempFolder.newFolder("other").toPath().resolve("hello.elf");
    Files.write(sameName, elf("other"));

    assertListFailure(ImmutableList.of());
    assertListFailure(ImmutableList.of(hello, script));
    assertListFailure(ImmutableList.of(hello, sameName));
    assertThat(service.getCreateRequests()).isEmpty();
  }

  @Test
  public void submit_notElf_failsBeforeContactingService() throws Exception {
    Path workload = writeWorkload("script.sh", "#!/bin/sh\necho hi\n".getBytes(UTF_8));

    assertFailure(workload, Stage.READ_WORKLOAD, ErrorReason.INVALID_WORKLOAD);
    assertThat(service.getCreateRequests()).isEmpty();
  }

  @Test
  public void submit_emptyOrMissingWorkload_failsInReadStage() throws Exception {
    Path empty = writeWorkload("empty.elf", new byte[0]);
    Path missing = tempFolder.getRoot().toPath().resolve("missing.elf");

    assertFailure(empty, Stage.READ_WORKLOAD, ErrorReason.INVALID_WORKLOAD);
    assertFailure(missing, Stage.READ_WORKLOAD, ErrorReason.INVALID_WORKLOAD);
    assertFailure(
        tempFolder.getRoot().toPath(), Stage.READ_WORKLOAD, ErrorReason.INVALID_WORKLOAD);
  }

  @Test
  public void submit_keyWrapFailure_failsInEncryptStage() throws Exception {
    Path workload = writeWorkload("hello.elf", elf("hello"));
    KeyWrapper broken =
        new KeyWrapper() {
          @Override
          public WrapScheme scheme() {
            return WrapScheme.TINK_HYBRID;
          }

          @Override
          public byte[] wrap(byte[] secret, byte[] associatedData) throws KeyException {
            throw new KeyException(
                "no", com.atlasexplorer.client.crypto.model.ErrorReason.KEY_WRAP_FAILED);
          }
        };

    SubmissionException e =
        assertThrows(
            SubmissionException.class,
            () -> orchestrator.submit(workload, TargetCore.P8700, broken));

    assertThat(e.getStage()).isEqualTo(Stage.ENCRYPT);
    assertThat(e.getReason()).isEqualTo(ErrorReason.KEY_ERROR);
  }

  @Test
  public void submit_unauthenticated_failsInCreateJobStage() throws Exception {
    Path workload = writeWorkload("hello.elf", elf("hello"));
    service.failCreateJob(
        new ExperimentServiceException(
            "bad key", com.atlasexplorer.client.service.model.ErrorReason.UNAUTHENTICATED));

    assertFailure(workload, Stage.CREATE_JOB, ErrorReason.SERVICE_REJECTED);
  }

  @Test
  public void submit_uploadFailure_neverStartsJob() throws Exception {
    Path workload = writeWorkload("hello.elf", elf("hello"));
    storage.failNextTransfer(
        new TransferException(
            "gone", com.atlasexplorer.client.transfer.model.ErrorReason.RETRIES_EXHAUSTED));

    assertFailure(workload, Stage.UPLOAD, ErrorReason.TRANSFER_ERROR);
    assertThat(service.getStartedJobs()).isEmpty();
  }

  @Test
  public void submit_startFailure_failsInStartStage() throws Exception {
    Path workload = writeWorkload("hello.elf", elf("hello"));
    service.failStartJob(
        new ExperimentServiceException(
            "down", com.atlasexplorer.client.service.model.ErrorReason.UNAVAILABLE));

    assertFailure(workload, Stage.START_JOB, ErrorReason.SERVICE_UNAVAILABLE);
    assertThat(service.getStatusCalls()).isEqualTo(0);
  }

  @Test
  public void submit_remoteFailure_failsInPollStage() throws Exception {
    Path workload = writeWorkload("hello.elf", elf("hello"));
    service
        .thenReport("running")
        .thenRespond(
            JobStatusResponse.builder()
                .jobId(FakeExperimentServiceClient.JOB_ID)
                .state("failed")
                .failureReason(Optional.of("segmentation fault"))
                .build());

    SubmissionException e = assertFailure(workload, Stage.POLL, ErrorReason.REMOTE_FAILURE);

    assertThat(e).hasMessageThat().contains("segmentation fault");
  }

  @Test
  public void submit_neverFinishing_expiresInPollStage() throws Exception {
    Path workload = writeWorkload("hello.elf", elf("hello"));
    service.thenReport("running");

    assertFailure(workload, Stage.POLL, ErrorReason.JOB_EXPIRED);
    assertThat(clock.instant())
        .isEqualTo(FakeClockSleeper.DEFAULT_START.plus(PollerConfig.DEFAULT_MAX_WAIT));
  }

  @Test
  public void submit_unknownRemoteState_failsWithFormatError() throws Exception {
    Path workload = writeWorkload("hello.elf", elf("hello"));
    service.thenReport("teleported");

    assertFailure(workload, Stage.POLL, ErrorReason.FORMAT_ERROR);
  }

  @Test
  public void submit_missingResult_failsInDownloadStage() throws Exception {
    Path workload = writeWorkload("hello.elf", elf("hello"));
    service.thenReport("succeeded");

    assertFailure(workload, Stage.DOWNLOAD, ErrorReason.TRANSFER_ERROR);
  }

  @Test
  public void submit_resultForAnotherClient_failsIntegrity() throws Exception {
    Path workload = writeWorkload("hello.elf", elf("hello"));
    storage.put(
        FakeExperimentServiceClient.DOWNLOAD_URL,
        codec.serialize(encryptor.encrypt(RESULT, TestKeys.SERVICE_PUBLIC)));
    service.thenReport("succeeded");

    assertFailure(workload, Stage.DECRYPT, ErrorReason.INTEGRITY_ERROR);
  }

  @Test
  public void submit_garbageResult_failsWithFormatError() throws Exception {
    Path workload = writeWorkload("hello.elf", elf("hello"));
    storage.put(FakeExperimentServiceClient.DOWNLOAD_URL, "not an envelope".getBytes(UTF_8));
    service.thenReport("succeeded");

    assertFailure(workload, Stage.DECRYPT, ErrorReason.FORMAT_ERROR);
  }

  @Test
  public void submit_cancelled_stopsAtFirstRemoteCall() throws Exception {
    Path workload = writeWorkload("hello.elf", elf("hello"));
    Cancellation cancellation = Cancellation.create();
    cancellation.cancel();

    SubmissionException e =
        assertThrows(
            SubmissionException.class,
            () ->
                orchestrator.submit(
                    workload, TargetCore.P8700, TestKeys.SERVICE_PUBLIC, cancellation));

    assertThat(e.getStage()).isEqualTo(Stage.CREATE_JOB);
    assertThat(e.getReason()).isEqualTo(ErrorReason.CANCELLED);
  }

  @Test
  public void submit_withWorkingDirectory_keepsOnlyEnvelopes() throws Exception {
    Path root = tempFolder.newFolder("work").toPath();
    SubmissionOrchestrator persisting = orchestratorWith(encryptor, Optional.of(root));
    Path workload = writeWorkload("hello.elf", elf("hello"));
    publishResult(RESULT);
    service.thenReport("succeeded");

    persisting.submit(workload, TargetCore.P8700, TestKeys.SERVICE_PUBLIC);

    Path jobDirectory = root.resolve(FakeExperimentServiceClient.JOB_ID);
    assertThat(Files.exists(jobDirectory.resolve(ExperimentWorkspace.WORKLOAD_FILE))).isTrue();
    byte[] savedResult = Files.readAllBytes(jobDirectory.resolve(ExperimentWorkspace.RESULT_FILE));
    assertThat(encryptor.decrypt(codec.parse(savedResult), TestKeys.CLIENT_PRIVATE))
        .isEqualTo(RESULT);
    try (Stream<Path> files = Files.list(jobDirectory)) {
      assertThat(files.count()).isEqualTo(2L);
    }
  }

  @Test
  public void submit_jobIdWithSlashes_persistsUnderEscapedDirectory() throws Exception {
    Path root = tempFolder.newFolder("work").toPath();
    SubmissionOrchestrator persisting = orchestratorWith(encryptor, Optional.of(root));
    Path workload = writeWorkload("hello.elf", elf("hello"));
    publishResult(RESULT);
    service.withJobId("projects/p/jobs/1").thenReport("succeeded");

    ResultPackage result = persisting.submit(workload, TargetCore.P8700, TestKeys.SERVICE_PUBLIC);

    assertThat(result.bytes()).isEqualTo(RESULT);
    assertThat(result.jobId()).isEqualTo("projects/p/jobs/1");
    Path jobDirectory = root.resolve("projects%2Fp%2Fjobs%2F1");
    assertThat(Files.exists(jobDirectory.resolve(ExperimentWorkspace.RESULT_FILE))).isTrue();
  }

  @Test
  public void submit_encryptFails_zeroesWorkloadBuffer() throws Exception {
    HybridEnvelopeEncryptor failingEncryptor = mock(HybridEnvelopeEncryptor.class);
    ArgumentCaptor<byte[]> plaintext = ArgumentCaptor.forClass(byte[].class);
    when(failingEncryptor.encrypt(plaintext.capture(), any()))
        .thenThrow(
            new KeyException(
                "no", com.atlasexplorer.client.crypto.model.ErrorReason.KEY_WRAP_FAILED));
    SubmissionOrchestrator failing = orchestratorWith(failingEncryptor, Optional.empty());
    Path workload = writeWorkload("hello.elf", elf("hello"));

    SubmissionException e =
        assertThrows(
            SubmissionException.class,
            () -> failing.submit(workload, TargetCore.P8700, TestKeys.SERVICE_PUBLIC));

    assertThat(e.getStage()).isEqualTo(Stage.ENCRYPT);
    byte[] buffer = plaintext.getValue();
    assertThat(buffer.length).isEqualTo(elf("hello").length);
    assertThat(buffer).isEqualTo(new byte[buffer.length]);
  }

  private SubmissionOrchestrator orchestratorWith(
      HybridEnvelopeEncryptor envelopeEncryptor, Optional<Path> workingDirectory) {
    return new SubmissionOrchestrator(
        envelopeEncryptor,
        codec,
        service,
        storage,
        poller,
        SubmissionConfig.builder()
            .setChannel("stable")
            .setRegion("eu")
            .setResultKey(TestKeys.CLIENT_PRIVATE)
            .setWorkingDirectory(workingDirectory)
            .build(),
        clock);
  }

  private SubmissionException assertFailure(Path workload, Stage stage, ErrorReason reason) {
    SubmissionException e =
        assertThrows(
            SubmissionException.class,
            () -> orchestrator.submit(workload, TargetCore.P8700, TestKeys.SERVICE_PUBLIC));
    assertThat(e.getStage()).isEqualTo(stage);
    assertThat(e.getReason()).isEqualTo(reason);
    return e;
  }

  private void assertListFailure(ImmutableList<Path> workloads) {
    SubmissionException e =
        assertThrows(
            SubmissionException.class,
            () ->
                orchestrator.submit(
                    workloads,
                    TargetCore.SHOGUN_2T,
                    TestKeys.SERVICE_PUBLIC,
                    Cancellation.create()));
    assertThat(e.getStage()).isEqualTo(Stage.READ_WORKLOAD);
    assertThat(e.getReason()).isEqualTo(ErrorReason.INVALID_WORKLOAD);
  }

  private void publishResult(byte[] result) throws Exception {
    storage.put(
        FakeExperimentServiceClient.DOWNLOAD_URL,
        codec.serialize(encryptor.encrypt(result, TestKeys.CLIENT_PUBLIC)));
  }

  private Path writeWorkload(String name, byte[] content) throws Exception {
    Path path = tempFolder.getRoot().toPath().resolve(name);
    Files.write(path, content);
    return path;
  }

  private static byte[] elf(String body) {
    return Bytes.concat(ELF_HEADER, body.getBytes(UTF_8));
  }
}
