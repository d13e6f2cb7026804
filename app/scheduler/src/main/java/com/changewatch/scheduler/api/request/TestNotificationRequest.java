package com.changewatch.scheduler.api.request;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

/** 疎通確認用の単発通知。watch_id を指定するとその watch の通知先を使う。 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record TestNotificationRequest(String watchId, String title, String body) {}
