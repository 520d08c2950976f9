package com.flagship.wallet_ledger.config;

import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * Enables the outbox publisher and the metrics refresh. Kept separate from
 * the publisher so disabling publishing does not stop the metric gauges.
 */
@Configuration
@EnableScheduling
public class SchedulingConfig {
}
