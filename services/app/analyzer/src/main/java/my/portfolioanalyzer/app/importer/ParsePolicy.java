package my.portfolioanalyzer.app.importer;

public enum ParsePolicy {
	/** Stop at the first line that cannot be turned into a holding. */
	FAIL_FAST,
	/** Silently skip lines with an unexpected field count; stop at any other failure. */
	SKIP_FIELD_COUNT_MISMATCH
}
