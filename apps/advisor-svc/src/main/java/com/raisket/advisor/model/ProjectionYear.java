package com.raisket.advisor.model;

import java.math.BigDecimal;

public record ProjectionYear(int year, BigDecimal contributed, BigDecimal interest, BigDecimal balance) {
}
