package io.b2mash.credits.scheduler;

public enum SchedulerState {
  STOPPED,
  STARTING,
  RUNNING,
  STOPPING
}
