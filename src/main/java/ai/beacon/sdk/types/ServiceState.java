package ai.beacon.sdk.types;

/** Lifecycle of the emission core's backend */
public enum ServiceState {
  UNINITIALIZED,
  INITIALIZING,
  READY,
  FAILED
}
