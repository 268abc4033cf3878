package my.portfolioanalyzer.app.domain;

public record Investor(
		String investorId,
		String name,
		String address,
		String phone
) {
}
