package com.scholary.video.summarizer.gemini;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class ProcessingStatePollerTest {

  private static final String NAME = "files/abc123";

  @Mock private RemoteFileService remoteFileService;

  private FakeClock clock;
  private List<Long> sleeps;
  private ProcessingStatePoller poller;

  @BeforeEach
  void setUp() {
    clock = new FakeClock();
    sleeps = new ArrayList<>();
    poller =
        new ProcessingStatePoller(
            remoteFileService,
            clock,
            millis -> {
              sleeps.add(millis);
              clock.advance(millis);
            });
  }

  @Test
  void waitUntilActive_returnsOnceActive() {
    when(remoteFileService.getStatus(NAME))
        .thenReturn(status(RemoteFileState.PROCESSING))
        .thenReturn(status(RemoteFileState.PROCESSING))
        .thenReturn(status(RemoteFileState.ACTIVE));

    poller.waitUntilActive(NAME, 300_000, 5_000);

    verify(remoteFileService, times(3)).getStatus(NAME);
    assertThat(sleeps).containsExactly(5_000L, 5_000L);
  }

  @Test
  void waitUntilActive_failsImmediatelyOnFailedState() {
    when(remoteFileService.getStatus(NAME)).thenReturn(status(RemoteFileState.FAILED));

    assertThatThrownBy(() -> poller.waitUntilActive(NAME, 300_000, 5_000))
        .isInstanceOf(ProcessingFailedException.class);

    verify(remoteFileService, times(1)).getStatus(NAME);
    assertThat(sleeps).isEmpty();
  }

  @Test
  void waitUntilActive_timesOutWhenNeverActive() {
    when(remoteFileService.getStatus(NAME)).thenReturn(status(RemoteFileState.PROCESSING));

    assertThatThrownBy(() -> poller.waitUntilActive(NAME, 10_000, 5_000))
        .isInstanceOf(ProcessingTimeoutException.class)
        .hasMessage("File processing timeout after 10 seconds");

    verify(remoteFileService, times(2)).getStatus(NAME);
  }

  @Test
  void waitUntilActive_propagatesStatusErrors() {
    when(remoteFileService.getStatus(NAME))
        .thenThrow(new RemoteFileException("Failed to check file status: 500 - boom", 500, "boom"));

    assertThatThrownBy(() -> poller.waitUntilActive(NAME, 10_000, 5_000))
        .isInstanceOf(RemoteFileException.class);
  }

  private static RemoteFileStatus status(RemoteFileState state) {
    return new RemoteFileStatus(NAME, state, "video/mp4");
  }

  /** Clock that only moves when told to. */
  static class FakeClock extends Clock {

    private long millis;

    void advance(long delta) {
      millis += delta;
    }

    @Override
    public ZoneId getZone() {
      return ZoneOffset.UTC;
    }

    @Override
    public Clock withZone(ZoneId zone) {
      return this;
    }

    @Override
    public Instant instant() {
      return Instant.ofEpochMilli(millis);
    }

    @Override
    public long millis() {
      return millis;
    }
  }
}
