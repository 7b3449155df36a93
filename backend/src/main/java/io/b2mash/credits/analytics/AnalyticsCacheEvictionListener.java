package io.b2mash.credits.analytics;

import io.b2mash.credits.execution.event.CreditExecutionFinishedEvent;
import org.springframework.stereotype.Component;
import org.springframework.transaction.event.TransactionPhase;
import org.springframework.transaction.event.TransactionalEventListener;

@Component
public class AnalyticsCacheEvictionListener {

  private final CreditAnalyticsService analyticsService;

  public AnalyticsCacheEvictionListener(CreditAnalyticsService analyticsService) {
    this.analyticsService = analyticsService;
  }

  @TransactionalEventListener(phase = TransactionPhase.AFTER_COMMIT)
  public void onExecutionFinished(CreditExecutionFinishedEvent event) {
    analyticsService.evictAll();
  }
}
