package my.portfolioanalyzer.app.config;

import my.portfolioanalyzer.app.service.PortfolioAnalysisService;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

@Component
@ConditionalOnProperty(name = "app.run.enabled", havingValue = "true", matchIfMissing = true)
public class AnalysisRunner implements ApplicationRunner {
	private final PortfolioAnalysisService analysisService;

	public AnalysisRunner(PortfolioAnalysisService analysisService) {
		this.analysisService = analysisService;
	}

	@Override
	public void run(ApplicationArguments args) {
		analysisService.run();
	}
}
