package io.b2mash.credits.execution;

public enum TriggerSource {
  AUTO,
  MANUAL
}
