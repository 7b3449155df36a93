package io.b2mash.credits.scheduler;

import io.b2mash.credits.config.CreditSchedulerProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

/** Starts the credit scheduler once the application is ready, if configured to. */
@Component
public class SchedulerAutoStart {

  private static final Logger log = LoggerFactory.getLogger(SchedulerAutoStart.class);

  private final CreditSchedulerLoop schedulerLoop;
  private final CreditSchedulerProperties properties;

  public SchedulerAutoStart(
      CreditSchedulerLoop schedulerLoop, CreditSchedulerProperties properties) {
    this.schedulerLoop = schedulerLoop;
    this.properties = properties;
  }

  @EventListener(ApplicationReadyEvent.class)
  public void onApplicationReady() {
    if (!properties.autoStart()) {
      log.info(
          "Credit scheduler auto-start disabled; start it via"
              + " POST /api/credit-schedules/scheduler/start");
      return;
    }
    schedulerLoop.start();
  }
}
