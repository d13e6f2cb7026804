package com.changewatch.scheduler.worker;

public enum HealthStatus {
  HEALTHY,
  /** 死んだワーカーを見つけて作り直した。 */
  REPAIRED,
  /** 作り直した後も期待数に届いていない。 */
  DEGRADED
}
