package my.portfolioanalyzer.app.service;

import my.portfolioanalyzer.app.config.AppProperties;
import my.portfolioanalyzer.app.domain.Bond;
import my.portfolioanalyzer.app.domain.Investment;
import my.portfolioanalyzer.app.domain.Investor;
import my.portfolioanalyzer.app.importer.BondFileParser;
import my.portfolioanalyzer.app.importer.ParseResult;
import my.portfolioanalyzer.app.importer.StockFileParser;
import my.portfolioanalyzer.app.repository.HoldingStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * One analysis run: read holdings, persist them, then produce every output. Output steps handle their own
 * failures; store failures propagate and end the run.
 */
@Service
public class PortfolioAnalysisService {
	private static final Logger logger = LoggerFactory.getLogger(PortfolioAnalysisService.class);

	private final AppProperties properties;
	private final StockFileParser stockFileParser;
	private final BondFileParser bondFileParser;
	private final HoldingStoreService holdingStoreService;
	private final ReportWriterService reportWriterService;
	private final CsvExportService csvExportService;
	private final PortfolioFilterConsole filterConsole;
	private final PortfolioChartService chartService;

	public PortfolioAnalysisService(AppProperties properties,
									StockFileParser stockFileParser,
									BondFileParser bondFileParser,
									HoldingStoreService holdingStoreService,
									ReportWriterService reportWriterService,
									CsvExportService csvExportService,
									PortfolioFilterConsole filterConsole,
									PortfolioChartService chartService) {
		this.properties = properties;
		this.stockFileParser = stockFileParser;
		this.bondFileParser = bondFileParser;
		this.holdingStoreService = holdingStoreService;
		this.reportWriterService = reportWriterService;
		this.csvExportService = csvExportService;
		this.filterConsole = filterConsole;
		this.chartService = chartService;
	}

	public void run() {
		Investor investor = properties.investor().toInvestor();
		AppProperties.Input input = properties.input();
		AppProperties.Output output = properties.output();

		ParseResult<Investment> stockResult = stockFileParser.read(input.stocksPath());
		ParseResult<Bond> bondResult = bondFileParser.read(input.bondsPath());
		List<Investment> stocks = stockResult.holdings();
		List<Bond> bonds = new ArrayList<>(bondResult.holdings());
		bonds.addAll(properties.seedBondHoldings());
		logger.info("Loaded {} stocks (complete={}) and {} bonds (complete={}, {} lines skipped, {} seeded)",
				stocks.size(), stockResult.complete(), bonds.size(), bondResult.complete(),
				bondResult.skippedLines(), properties.seedBonds().size());

		Path databasePath = properties.store().databasePath();
		try (HoldingStore store = holdingStoreService.setupStore(databasePath, stocks, bonds)) {
			logger.info("Store {} holds {} stocks and {} bonds", databasePath, store.countStocks(), store.countBonds());

			reportWriterService.writeReport(investor, stocks, bonds, output.reportPath());
			csvExportService.exportCsv(stocks, output.csvPath());
			if (properties.interactive().enabled()) {
				filterConsole.run(stocks, new InputStreamReader(System.in, StandardCharsets.UTF_8), System.out);
			}
			chartService.visualize(input.priceHistoryPath(), PortfolioChartService.quantitiesBySymbol(stocks),
					output.chartPath());
		}
	}
}
