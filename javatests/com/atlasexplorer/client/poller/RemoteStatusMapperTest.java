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

package com.atlasexplorer.client.poller;

import static com.google.common.truth.Truth.assertThat;
import static org.junit.Assert.assertThrows;

import com.atlasexplorer.client.service.ExperimentServiceException;
import com.atlasexplorer.client.service.model.ErrorReason;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public final class RemoteStatusMapperTest {

  @Test
  public void map_knownStates() throws Exception {
    assertThat(RemoteStatusMapper.map("queued")).isEqualTo(JobState.QUEUED);
    assertThat(RemoteStatusMapper.map("Running")).isEqualTo(JobState.RUNNING);
    assertThat(RemoteStatusMapper.map(" COMPLETED ")).isEqualTo(JobState.SUCCEEDED);
    assertThat(RemoteStatusMapper.map("error")).isEqualTo(JobState.FAILED);
    assertThat(RemoteStatusMapper.map("timed_out")).isEqualTo(JobState.EXPIRED);
  }

  @Test
  public void map_unknownState_throws() {
    ExperimentServiceException e =
        assertThrows(ExperimentServiceException.class, () -> RemoteStatusMapper.map("paused"));

    assertThat(e.getReason()).isEqualTo(ErrorReason.MALFORMED_RESPONSE);
  }

  @Test
  public void jobState_regressionOnlyBetweenNonTerminalStates() {
    assertThat(JobState.RUNNING.isRegressionTo(JobState.QUEUED)).isTrue();
    assertThat(JobState.QUEUED.isRegressionTo(JobState.RUNNING)).isFalse();
    assertThat(JobState.RUNNING.isRegressionTo(JobState.FAILED)).isFalse();
    assertThat(JobState.EXPIRED.isTerminal()).isTrue();
  }
}
