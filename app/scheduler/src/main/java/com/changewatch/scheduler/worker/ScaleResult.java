package com.changewatch.scheduler.worker;

public enum ScaleResult {
  NO_CHANGE,
  SUCCESS,
  ERROR
}
