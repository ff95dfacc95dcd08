package com.msd.gin.bowline.rio;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.StringReader;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import org.eclipse.rdf4j.model.Statement;
import org.eclipse.rdf4j.model.ValueFactory;
import org.eclipse.rdf4j.model.impl.SimpleNamespace;
import org.eclipse.rdf4j.model.impl.SimpleValueFactory;
import org.eclipse.rdf4j.rio.RDFFormat;
import org.eclipse.rdf4j.rio.RDFParseException;
import org.eclipse.rdf4j.rio.RDFParser;
import org.eclipse.rdf4j.rio.Rio;
import org.eclipse.rdf4j.rio.helpers.BasicParserSettings;
import org.eclipse.rdf4j.rio.helpers.ParseErrorCollector;
import org.eclipse.rdf4j.rio.helpers.StatementCollector;
import org.junit.jupiter.api.Test;

public class TurtleParserTest {
	private static final ValueFactory VF = SimpleValueFactory.getInstance();

	private static final String DOC = "@prefix ex: <http://example.org/> .\n"
			+ "PREFIX foaf: <http://xmlns.com/foaf/0.1/>\n"
			+ "ex:alice a foaf:Person ;\n"
			+ "\tfoaf:name \"Alice\" ;\n"
			+ "\tfoaf:knows [ foaf:name \"Bob\" ] .\n";

	@Test
	public void testParseDocument() throws IOException {
		TurtleParser parser = new TurtleParser();
		StatementCollector collector = new StatementCollector();
		parser.setRDFHandler(collector);
		parser.parse(new StringReader(DOC), null);
		assertEquals(4, collector.getStatements().size());
		assertThat(collector.getStatements()).contains(VF.createStatement(VF.createIRI("http://example.org/alice"),
				VF.createIRI("http://xmlns.com/foaf/0.1/name"), VF.createLiteral("Alice")));
		assertEquals("http://example.org/", collector.getNamespaces().get("ex"));
		assertEquals("http://xmlns.com/foaf/0.1/", collector.getNamespaces().get("foaf"));
	}

	@Test
	public void testStatementOrder() throws IOException {
		TurtleParser parser = new TurtleParser();
		List<Statement> stmts = new ArrayList<>();
		parser.setRDFHandler(new StatementCollector(stmts));
		parser.parse(new StringReader(DOC), null);
		assertEquals("Alice", stmts.get(1).getObject().stringValue());
		// nested list triples come before the triple that refers to the node
		assertEquals("Bob", stmts.get(2).getObject().stringValue());
		assertEquals(stmts.get(2).getSubject(), stmts.get(3).getObject());
	}

	@Test
	public void testRepeatedIrisAreInterned() throws IOException {
		TurtleParser parser = new TurtleParser();
		List<Statement> stmts = new ArrayList<>();
		parser.setRDFHandler(new StatementCollector(stmts));
		parser.parse(new StringReader("<http://example.org/s> <http://example.org/p> 1, 2 ."), null);
		assertSame(stmts.get(0).getPredicate(), stmts.get(1).getPredicate());
	}

	@Test
	public void testByteOrderMark() throws IOException {
		ByteArrayOutputStream bytes = new ByteArrayOutputStream();
		bytes.write(new byte[] { (byte) 0xEF, (byte) 0xBB, (byte) 0xBF });
		bytes.write("@prefix ex: <http://example.org/> .\nex:s ex:p \"\u00fcber\" .".getBytes(StandardCharsets.UTF_8));
		TurtleParser parser = new TurtleParser();
		StatementCollector collector = new StatementCollector();
		parser.setRDFHandler(collector);
		parser.parse(new ByteArrayInputStream(bytes.toByteArray()), null);
		assertEquals("\u00fcber", collector.getStatements().iterator().next().getObject().stringValue());
	}

	@Test
	public void testBaseUri() throws IOException {
		TurtleParser parser = new TurtleParser();
		StatementCollector collector = new StatementCollector();
		parser.setRDFHandler(collector);
		parser.parse(new StringReader("<s> <p> <#o> ."), "http://example.org/doc");
		assertThat(collector.getStatements()).containsExactly(VF.createStatement(VF.createIRI("http://example.org/s"),
				VF.createIRI("http://example.org/p"), VF.createIRI("http://example.org/doc#o")));
	}

	@Test
	public void testPreboundNamespaces() throws IOException {
		TurtleParser parser = new TurtleParser();
		parser.getParserConfig().set(BasicParserSettings.NAMESPACES,
				Collections.singleton(new SimpleNamespace("zz", "http://zz.example.org/")));
		StatementCollector collector = new StatementCollector();
		parser.setRDFHandler(collector);
		parser.parse(new StringReader("zz:s zz:p zz:o ."), null);
		assertEquals(VF.createIRI("http://zz.example.org/s"), collector.getStatements().iterator().next().getSubject());
	}

	@Test
	public void testSparqlStyleDirectivesDisabled() {
		TurtleParser parser = new TurtleParser();
		parser.getParserConfig().set(TextParserSettings.SPARQL_STYLE_DIRECTIVES, false);
		ParseErrorCollector errors = new ParseErrorCollector();
		parser.setParseErrorListener(errors);
		parser.setRDFHandler(new StatementCollector());
		assertThrows(RDFParseException.class, () -> parser.parse(new StringReader(DOC), null));
		assertEquals(1, errors.getFatalErrors().size());
		assertThat(errors.getFatalErrors().get(0)).contains("SPARQL-style directive not allowed");
	}

	@Test
	public void testFatalErrorReported() {
		TurtleParser parser = new TurtleParser();
		ParseErrorCollector errors = new ParseErrorCollector();
		parser.setParseErrorListener(errors);
		parser.setRDFHandler(new StatementCollector());
		RDFParseException e = assertThrows(RDFParseException.class,
				() -> parser.parse(new StringReader("<http://example.org/s> <http://example.org/p> zzunbound:o ."), null));
		assertEquals(1, e.getLineNumber());
		assertEquals(1, errors.getFatalErrors().size());
		assertThat(errors.getErrors()).isEmpty();
	}

	@Test
	public void testParserIsReusable() throws IOException {
		TurtleParser parser = new TurtleParser();
		StatementCollector collector = new StatementCollector();
		parser.setRDFHandler(collector);
		parser.parse(new StringReader("@prefix zzex: <http://example.org/> .\nzzex:s zzex:p zzex:o ."), null);
		assertEquals(1, collector.getStatements().size());
		assertThrows(RDFParseException.class, () -> parser.parse(new StringReader("zzex:s zzex:p zzex:o ."), null));
	}

	@Test
	public void testSupportedSettings() {
		assertThat(new TurtleParser().getSupportedSettings()).contains(TextParserSettings.SPARQL_STYLE_DIRECTIVES);
	}

	@Test
	public void testRegisteredForTurtle() {
		assertThat(Rio.createParser(RDFFormat.TURTLE)).isInstanceOf(TurtleParser.class);
		assertEquals(RDFFormat.TURTLE, new TurtleParser().getRDFFormat());
	}

	@Test
	public void testRioDefaultNamespacesNotBound() {
		RDFParser parser = Rio.createParser(RDFFormat.TURTLE);
		parser.setRDFHandler(new StatementCollector());
		assertThatThrownBy(() -> parser.parse(new StringReader("foaf:a rdf:type owl:Class ."), ""))
				.isInstanceOf(RDFParseException.class).hasMessageContaining("Unknown prefix 'foaf:'");
	}
}
