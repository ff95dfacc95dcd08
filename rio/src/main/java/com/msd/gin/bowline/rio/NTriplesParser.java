package com.msd.gin.bowline.rio;

import com.msd.gin.bowline.common.InterningValueFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.util.Collection;
import java.util.HashSet;
import java.util.Optional;
import java.util.Set;

import org.apache.commons.io.input.BOMInputStream;
import org.eclipse.rdf4j.model.Statement;
import org.eclipse.rdf4j.model.ValueFactory;
import org.eclipse.rdf4j.rio.ParseErrorListener;
import org.eclipse.rdf4j.rio.RDFFormat;
import org.eclipse.rdf4j.rio.RDFHandlerException;
import org.eclipse.rdf4j.rio.RDFParseException;
import org.eclipse.rdf4j.rio.RDFParser;
import org.eclipse.rdf4j.rio.RDFParserFactory;
import org.eclipse.rdf4j.rio.RioSetting;
import org.eclipse.rdf4j.rio.helpers.AbstractRDFParser;
import org.kohsuke.MetaInfServices;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * RDF parser for <a href="https://www.w3.org/TR/n-triples/">N-Triples</a>, one {@link NTriplesLineParser} call per line.
 * With {@link TextParserSettings#FAIL_ON_INVALID_LINES} disabled, invalid lines are reported and skipped.
 */
public class NTriplesParser extends AbstractRDFParser {
	private static final Logger LOG = LoggerFactory.getLogger(NTriplesParser.class);

	@MetaInfServices(RDFParserFactory.class)
	public static final class Factory implements RDFParserFactory {

		@Override
		public RDFFormat getRDFFormat() {
			return RDFFormat.NTRIPLES;
		}

		@Override
		public RDFParser getParser() {
			return new NTriplesParser();
		}

	}

	public NTriplesParser() {
		super(new InterningValueFactory());
	}

	public NTriplesParser(ValueFactory valueFactory) {
		super(valueFactory);
	}

	@Override
	public RDFFormat getRDFFormat() {
		return RDFFormat.NTRIPLES;
	}

	@Override
	public Collection<RioSetting<?>> getSupportedSettings() {
		Set<RioSetting<?>> result = new HashSet<>(super.getSupportedSettings());
		result.add(TextParserSettings.FAIL_ON_INVALID_LINES);
		return result;
	}

	@Override
	public synchronized void parse(InputStream in, String baseURI) throws IOException, RDFParseException, RDFHandlerException {
		if (in == null) {
			throw new IllegalArgumentException("Input stream must not be 'null'");
		}
		parse(new InputStreamReader(new BOMInputStream(in, false), StandardCharsets.UTF_8), baseURI);
	}

	/**
	 * @param baseURI ignored, N-Triples only contains absolute IRIs
	 */
	@Override
	public synchronized void parse(Reader reader, String baseURI) throws IOException, RDFParseException, RDFHandlerException {
		if (reader == null) {
			throw new IllegalArgumentException("Reader must not be 'null'");
		}
		clear();
		try {
			BufferedReader lineReader = reader instanceof BufferedReader ? (BufferedReader) reader : new BufferedReader(reader);
			NTriplesLineParser lineParser = new NTriplesLineParser(valueFactory);
			boolean failOnInvalidLines = getParserConfig().get(TextParserSettings.FAIL_ON_INVALID_LINES);
			if (rdfHandler != null) {
				rdfHandler.startRDF();
			}
			long lineNo = 0;
			long count = 0;
			long skipped = 0;
			String line;
			while ((line = lineReader.readLine()) != null) {
				lineNo++;
				reportLocation(lineNo, 1);
				Optional<Statement> stmt;
				try {
					stmt = lineParser.parseLine(line, lineNo);
				} catch (RDFParseException e) {
					if (failOnInvalidLines) {
						notifyFatalError(e);
						throw e;
					}
					ParseErrorListener listener = getParseErrorListener();
					if (listener != null) {
						listener.error(e.getMessage(), e.getLineNumber(), e.getColumnNumber());
					}
					LOG.warn("Skipping invalid N-Triples line {}: {}", lineNo, e.getMessage());
					skipped++;
					continue;
				}
				if (stmt.isPresent()) {
					count++;
					if (rdfHandler != null) {
						rdfHandler.handleStatement(stmt.get());
					}
				}
			}
			if (rdfHandler != null) {
				rdfHandler.endRDF();
			}
			LOG.debug("Parsed {} statements from {} N-Triples lines ({} skipped)", count, lineNo, skipped);
		} finally {
			clear();
		}
	}

	private void notifyFatalError(RDFParseException e) {
		ParseErrorListener listener = getParseErrorListener();
		if (listener != null) {
			listener.fatalError(e.getMessage(), e.getLineNumber(), e.getColumnNumber());
		}
	}
}
