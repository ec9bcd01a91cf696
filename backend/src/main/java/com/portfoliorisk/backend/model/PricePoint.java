package com.portfoliorisk.backend.model;

import java.time.Instant;

public record PricePoint(Instant timestamp, double close) {}
