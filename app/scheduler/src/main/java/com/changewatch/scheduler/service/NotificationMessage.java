package com.changewatch.scheduler.service;

/** 投入時に確定する通知の件名と本文。 */
public record NotificationMessage(String title, String body) {}
