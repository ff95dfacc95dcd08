package com.msd.gin.bowline.rio;

import com.msd.gin.bowline.common.InterningValueFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.net.URISyntaxException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

import org.apache.commons.io.input.BOMInputStream;
import org.eclipse.rdf4j.model.Namespace;
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
import org.eclipse.rdf4j.rio.helpers.BasicParserSettings;
import org.kohsuke.MetaInfServices;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * RDF parser for <a href="https://www.w3.org/TR/turtle/">RDF 1.1 Turtle</a>.
 * Each top-level statement is parsed completely before its triples are passed to the {@link org.eclipse.rdf4j.rio.RDFHandler}.
 */
public class TurtleParser extends AbstractRDFParser {
	private static final Logger LOG = LoggerFactory.getLogger(TurtleParser.class);

	@MetaInfServices(RDFParserFactory.class)
	public static final class Factory implements RDFParserFactory {

		@Override
		public RDFFormat getRDFFormat() {
			return RDFFormat.TURTLE;
		}

		@Override
		public RDFParser getParser() {
			return new TurtleParser();
		}

	}

	/**
	 * Creates a new TurtleParser that will use an {@link InterningValueFactory} to create RDF model objects.
	 */
	public TurtleParser() {
		super(new InterningValueFactory());
	}

	/**
	 * Creates a new TurtleParser that will use the supplied ValueFactory to create RDF model objects.
	 *
	 * @param valueFactory A ValueFactory.
	 */
	public TurtleParser(ValueFactory valueFactory) {
		super(valueFactory);
	}

	@Override
	public RDFFormat getRDFFormat() {
		return RDFFormat.TURTLE;
	}

	@Override
	public Collection<RioSetting<?>> getSupportedSettings() {
		Set<RioSetting<?>> result = new HashSet<>(super.getSupportedSettings());
		result.add(TextParserSettings.SPARQL_STYLE_DIRECTIVES);
		return result;
	}

	@Override
	public synchronized void parse(InputStream in, String baseURI) throws IOException, RDFParseException, RDFHandlerException {
		if (in == null) {
			throw new IllegalArgumentException("Input stream must not be 'null'");
		}
		parse(new InputStreamReader(new BOMInputStream(in, false), StandardCharsets.UTF_8), baseURI);
	}

	@Override
	public synchronized void parse(Reader reader, String baseURI) throws IOException, RDFParseException, RDFHandlerException {
		if (reader == null) {
			throw new IllegalArgumentException("Reader must not be 'null'");
		}
		clear();
		TextCursor cursor = new TextCursor(reader);
		try {
			ParserState state = createState(cursor, baseURI);
			TurtleGrammar grammar = new TurtleGrammar(cursor, state, valueFactory,
					getParserConfig().get(TextParserSettings.SPARQL_STYLE_DIRECTIVES), this::handleNamespace);
			if (rdfHandler != null) {
				rdfHandler.startRDF();
			}
			long count = 0;
			List<Statement> batch = new ArrayList<>();
			while (grammar.parseStatement(batch)) {
				reportLocation(grammar.getLineNumber(), grammar.getColumnNumber());
				if (rdfHandler != null) {
					for (Statement stmt : batch) {
						rdfHandler.handleStatement(stmt);
					}
				}
				count += batch.size();
				batch.clear();
			}
			if (rdfHandler != null) {
				rdfHandler.endRDF();
			}
			LOG.debug("Parsed {} statements from Turtle document", count);
		} catch (RDFParseException e) {
			ParseErrorListener listener = getParseErrorListener();
			if (listener != null) {
				listener.fatalError(e.getMessage(), e.getLineNumber(), e.getColumnNumber());
			}
			throw e;
		} finally {
			clear();
		}
	}

	private ParserState createState(TextCursor cursor, String baseURI) {
		ParserState state = new ParserState();
		// only prefixes the caller configured, not the RDFa initial context that is the setting's default
		if (getParserConfig().isSet(BasicParserSettings.NAMESPACES)) {
			for (Namespace ns : getParserConfig().get(BasicParserSettings.NAMESPACES)) {
				state.setNamespace(ns.getPrefix(), ns.getName());
			}
		}
		if (baseURI != null && !baseURI.isEmpty()) {
			try {
				state.setBase(baseURI);
			} catch (URISyntaxException e) {
				throw cursor.error("Invalid base IRI <" + baseURI + ">: " + e.getMessage(), e);
			}
		}
		return state;
	}

	private void handleNamespace(String prefix, String iri) {
		if (rdfHandler != null) {
			rdfHandler.handleNamespace(prefix, iri);
		}
	}
}
