package com.changewatch.scheduler.api.response;

import com.changewatch.scheduler.model.QueueItem;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.util.Collection;
import java.util.List;

/** ジョブキューの中身 (取り出し順) と claim 中の watch。 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record QueueResponse(int size, List<Item> items, List<String> claimedWatchIds) {

  public static QueueResponse of(List<QueueItem> items, Collection<String> claimed) {
    return new QueueResponse(
        items.size(),
        items.stream()
            .map(
                item ->
                    new Item(item.watchId(), item.priority(), item.sequence(), item.forced()))
            .toList(),
        claimed.stream().sorted().toList());
  }

  @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
  public record Item(String watchId, int priority, long sequence, boolean forced) {}
}
