package com.portfoliosync.worker.task;

import java.math.BigDecimal;

public record UserAnalyticsResult(int portfolios, BigDecimal totalValueBase) {}
