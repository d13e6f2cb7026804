package com.changewatch.scheduler.worker;

/** ワーカーのループが抜けた理由。 */
public enum WorkerOutcome {
  /** max-jobs または max-runtime に達した。ドライバが同じ id で作り直す。 */
  RESTART,
  SHUTDOWN
}
