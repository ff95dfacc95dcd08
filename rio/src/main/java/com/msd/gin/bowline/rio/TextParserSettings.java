package com.msd.gin.bowline.rio;

import org.eclipse.rdf4j.rio.RioSetting;
import org.eclipse.rdf4j.rio.helpers.BooleanRioSetting;

public final class TextParserSettings {
	private TextParserSettings() {}

	/**
	 * Whether the Turtle parser accepts the SPARQL-style PREFIX and BASE directives.
	 * <p>
	 * Defaults to true.
	 */
	public static final RioSetting<Boolean> SPARQL_STYLE_DIRECTIVES = new BooleanRioSetting(
			"com.msd.gin.bowline.rio.sparql_style_directives", "Accept SPARQL-style PREFIX and BASE directives", Boolean.TRUE);

	/**
	 * Whether the N-Triples parser stops at the first invalid line. If false, invalid lines are reported to the
	 * {@link org.eclipse.rdf4j.rio.ParseErrorListener} and skipped.
	 * <p>
	 * Defaults to true.
	 */
	public static final RioSetting<Boolean> FAIL_ON_INVALID_LINES = new BooleanRioSetting(
			"com.msd.gin.bowline.rio.fail_on_invalid_lines", "Fail on invalid N-Triples lines", Boolean.TRUE);
}
