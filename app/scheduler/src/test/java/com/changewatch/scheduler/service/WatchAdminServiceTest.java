package com.changewatch.scheduler.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.changewatch.scheduler.api.InvalidAdminRequestException;
import com.changewatch.scheduler.api.WatchNotFoundException;
import com.changewatch.scheduler.api.request.NotificationSettingsRequest;
import com.changewatch.scheduler.api.request.WatchCreateRequest;
import com.changewatch.scheduler.fetch.ContentFetcherRegistry;
import com.changewatch.scheduler.fetch.TextChangeDetector;
import com.changewatch.scheduler.model.NotificationSettings;
import com.changewatch.scheduler.model.Watch;
import com.changewatch.scheduler.repository.SnapshotStore;
import com.changewatch.scheduler.repository.WatchStore;
import com.changewatch.scheduler.worker.RecheckTicker;
import java.time.Duration;
import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class WatchAdminServiceTest {

  @Mock private WatchStore watchStore;
  @Mock private SnapshotStore snapshotStore;
  @Mock private ContentFetcherRegistry fetcherRegistry;
  @Mock private RecheckTicker recheckTicker;

  @InjectMocks private WatchAdminService service;

  @Test
  void createAppliesDefaults() {
    final Watch watch = service.create(request(" https://example.com/page ", null, null));

    assertThat(watch.uuid()).isNotBlank();
    assertThat(watch.url()).isEqualTo("https://example.com/page");
    assertThat(watch.method()).isEqualTo("GET");
    assertThat(watch.processor()).isEqualTo(TextChangeDetector.PROCESSOR);
    assertThat(watch.filterFailureNotificationEnabled()).isTrue();
    assertThat(watch.checkInterval()).isEqualTo(Duration.ofSeconds(600));
    verify(watchStore).save(watch);
  }

  @Test
  void createRejectsNonHttpUrl() {
    assertThatThrownBy(() -> service.create(request("ftp://example.com", null, null)))
        .isInstanceOf(InvalidAdminRequestException.class)
        .hasMessageContaining("http");
    verify(watchStore, never()).save(any());
  }

  @Test
  void createRejectsUnsupportedMethod() {
    assertThatThrownBy(() -> service.create(request("https://example.com", "TRACE", null)))
        .isInstanceOf(InvalidAdminRequestException.class);
  }

  @Test
  void createRejectsUnknownFetchBackend() {
    when(fetcherRegistry.names()).thenReturn(List.of("http", "browser"));

    assertThatThrownBy(() -> service.create(request("https://example.com", null, "selenium")))
        .isInstanceOf(InvalidAdminRequestException.class)
        .hasMessageContaining("selenium");
  }

  @Test
  void createAcceptsSystemBackend() {
    assertThat(service.create(request("https://example.com", "post", "system")).method())
        .isEqualTo("POST");
  }

  @Test
  void getUnknownWatchThrows() {
    when(watchStore.find("missing")).thenReturn(Optional.empty());

    assertThatThrownBy(() -> service.get("missing")).isInstanceOf(WatchNotFoundException.class);
  }

  @Test
  void deleteRemovesSnapshots() {
    when(watchStore.delete("w1")).thenReturn(true);

    service.delete("w1");

    verify(snapshotStore).deleteAll("w1");
  }

  @Test
  void deleteUnknownWatchThrowsWithoutTouchingSnapshots() {
    when(watchStore.delete("missing")).thenReturn(false);

    assertThatThrownBy(() -> service.delete("missing"))
        .isInstanceOf(WatchNotFoundException.class);
    verify(snapshotStore, never()).deleteAll(any());
  }

  @Test
  void recheckQueuesExistingWatch() {
    when(watchStore.find("w1")).thenReturn(Optional.of(Watch.builder().uuid("w1").build()));
    when(recheckTicker.recheckNow("w1")).thenReturn(true);

    assertThat(service.recheck("w1")).isTrue();
  }

  @Test
  void updateNotificationSettingsStoresGlobalTargets() {
    final NotificationSettings settings =
        service.updateNotificationSettings(
            new NotificationSettingsRequest(List.of("https://hooks.example"), null));

    assertThat(settings.notificationFormat()).isEqualTo("text");
    final ArgumentCaptor<NotificationSettings> captor =
        ArgumentCaptor.forClass(NotificationSettings.class);
    verify(watchStore).updateNotificationSettings(captor.capture());
    assertThat(captor.getValue().notificationUrls()).containsExactly("https://hooks.example");
  }

  private static WatchCreateRequest request(String url, String method, String backend) {
    return new WatchCreateRequest(
        url, null, method, null, backend, null, 600L, null, null, null, null, null, null, null);
  }
}
