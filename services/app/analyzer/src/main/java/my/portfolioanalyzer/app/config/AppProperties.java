package my.portfolioanalyzer.app.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import my.portfolioanalyzer.app.domain.Bond;
import my.portfolioanalyzer.app.domain.Investment;
import my.portfolioanalyzer.app.domain.Investor;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.math.BigDecimal;
import java.nio.file.Path;
import java.util.List;

@Validated
@ConfigurationProperties(prefix = "app")
public record AppProperties(
		@Valid @NotNull InvestorProfile investor,
		@Valid @NotNull Input input,
		@Valid @NotNull Store store,
		@Valid @NotNull Output output,
		Interactive interactive,
		List<@Valid SeedBond> seedBonds
) {
	public AppProperties {
		interactive = interactive == null ? new Interactive(false) : interactive;
		seedBonds = seedBonds == null ? List.of() : List.copyOf(seedBonds);
	}

	public List<Bond> seedBondHoldings() {
		return seedBonds.stream().map(SeedBond::toBond).toList();
	}

	public record InvestorProfile(
			@NotBlank String id,
			@NotBlank String name,
			String address,
			String phone
	) {
		public Investor toInvestor() {
			return new Investor(id, name, address == null ? "" : address, phone == null ? "" : phone);
		}
	}

	public record Input(
			@NotBlank String stocksFile,
			@NotBlank String bondsFile,
			@NotBlank String priceHistoryFile
	) {
		public Path stocksPath() {
			return Path.of(stocksFile);
		}

		public Path bondsPath() {
			return Path.of(bondsFile);
		}

		public Path priceHistoryPath() {
			return Path.of(priceHistoryFile);
		}
	}

	public record Store(
			@NotBlank String path
	) {
		public Path databasePath() {
			return Path.of(path);
		}
	}

	public record Output(
			@NotBlank String reportFile,
			@NotBlank String csvFile,
			@NotBlank String chartFile
	) {
		public Path reportPath() {
			return Path.of(reportFile);
		}

		public Path csvPath() {
			return Path.of(csvFile);
		}

		public Path chartPath() {
			return Path.of(chartFile);
		}
	}

	public record Interactive(
			boolean enabled
	) {
	}

	/**
	 * A bond entered by hand rather than read from the bond file.
	 */
	public record SeedBond(
			@NotBlank String id,
			@NotBlank String symbol,
			int quantity,
			@NotNull BigDecimal purchasePrice,
			@NotNull BigDecimal currentPrice,
			@NotNull BigDecimal coupon,
			@NotBlank String yieldRate,
			@NotBlank String purchaseDate
	) {
		public Bond toBond() {
			return new Bond(id, symbol, quantity, purchasePrice, currentPrice, coupon,
					Bond.parseYieldRate(yieldRate), Investment.parsePurchaseDate(purchaseDate));
		}
	}
}
