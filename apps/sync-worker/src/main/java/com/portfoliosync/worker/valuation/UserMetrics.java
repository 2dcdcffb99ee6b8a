package com.portfoliosync.worker.valuation;

import java.math.BigDecimal;

public record UserMetrics(int portfolioCount, BigDecimal totalValueBase) {}
