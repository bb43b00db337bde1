package com.raisket.advisor.model;

import java.math.BigDecimal;

public record InstrumentAllocation(Instrument instrument, BigDecimal amount) {
}
