package my.portfolioanalyzer.app.model;

import java.math.BigDecimal;
import java.time.LocalDate;

public record ValuePoint(
		LocalDate date,
		BigDecimal value
) {
}
