package com.msd.gin.bowline.rio;

import com.msd.gin.bowline.common.CharacterClasses;

import java.io.IOException;
import java.io.Reader;
import java.net.URISyntaxException;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.function.BiConsumer;
import java.util.function.Consumer;

import javax.annotation.Nullable;
import javax.annotation.concurrent.NotThreadSafe;

import org.eclipse.rdf4j.model.BNode;
import org.eclipse.rdf4j.model.IRI;
import org.eclipse.rdf4j.model.Resource;
import org.eclipse.rdf4j.model.Statement;
import org.eclipse.rdf4j.model.Value;
import org.eclipse.rdf4j.model.ValueFactory;
import org.eclipse.rdf4j.model.vocabulary.RDF;
import org.eclipse.rdf4j.model.vocabulary.XSD;
import org.eclipse.rdf4j.rio.RDFParseException;

/**
 * Recursive descent parser for Turtle documents, one method per grammar rule.
 * <p>
 * The current subject and predicate are passed down as arguments, so a nested blank node property list
 * only shadows the subject for the duration of its own call.
 * Namespace and base state lives in a {@link ParserState} owned by this instance, which covers exactly one document.
 */
@NotThreadSafe
public final class TurtleGrammar {
	private static final String PREFIX_KEYWORD = "prefix";
	private static final String BASE_KEYWORD = "base";

	private final TextCursor cursor;
	private final TermLexer lexer;
	private final ParserState state;
	private final ValueFactory valueFactory;
	private final boolean sparqlDirectives;
	private final BiConsumer<String,String> namespaceListener;

	public TurtleGrammar(Reader reader, ValueFactory valueFactory) {
		this(new TextCursor(reader), new ParserState(), valueFactory, true, (prefix, iri) -> {});
	}

	TurtleGrammar(TextCursor cursor, ParserState state, ValueFactory valueFactory, boolean sparqlDirectives, BiConsumer<String,String> namespaceListener) {
		this.cursor = cursor;
		this.lexer = new TermLexer(cursor);
		this.state = state;
		this.valueFactory = valueFactory;
		this.sparqlDirectives = sparqlDirectives;
		this.namespaceListener = namespaceListener;
	}

	/**
	 * Parses the whole remaining document.
	 */
	public void parseDocument(Collection<? super Statement> out) throws IOException, RDFParseException {
		List<Statement> batch = new ArrayList<>();
		while (parseStatement(batch)) {
			out.addAll(batch);
			batch.clear();
		}
	}

	/**
	 * Parses the next directive or triples block.
	 *
	 * @param batch receives the triples of the statement, in the order they are produced
	 * @return false if the end of the document was reached before any statement
	 */
	public boolean parseStatement(List<Statement> batch) throws IOException, RDFParseException {
		int c = lexer.skipWhitespaceAndComments();
		if (c == TextCursor.EOF) {
			return false;
		}
		if (c == '@') {
			parseAtDirective();
		} else if (!parseSparqlDirective()) {
			parseTriples(batch::add);
			lexer.skipWhitespaceAndComments();
			cursor.expect('.', "triples");
		}
		return true;
	}

	public long getLineNumber() {
		return cursor.getLineNumber();
	}

	public long getColumnNumber() {
		return cursor.getColumnNumber();
	}

	private void parseAtDirective() throws IOException {
		cursor.expect('@', "directive");
		StringBuilder keyword = new StringBuilder(8);
		int c = cursor.read();
		while (CharacterClasses.isAsciiLetter(c)) {
			keyword.appendCodePoint(c);
			c = cursor.read();
		}
		cursor.unread(c);
		if (PREFIX_KEYWORD.equals(keyword.toString())) {
			parsePrefixBody();
		} else if (BASE_KEYWORD.equals(keyword.toString())) {
			parseBaseBody();
		} else {
			throw cursor.error("Unknown directive \"@" + keyword + "\"");
		}
		lexer.skipWhitespaceAndComments();
		cursor.expect('.', "@" + keyword + " directive");
	}

	/**
	 * PREFIX and BASE keywords, case-insensitive and without a terminating dot.
	 * A keyword followed by ':' is a prefixed name and is left unread.
	 *
	 * @return true if a directive was parsed
	 */
	private boolean parseSparqlDirective() throws IOException {
		if (!CharacterClasses.isAsciiLetter(cursor.peek())) {
			return false;
		}
		String keyword = lexer.readNameRun();
		boolean isPrefix = PREFIX_KEYWORD.equalsIgnoreCase(keyword);
		boolean isBase = BASE_KEYWORD.equalsIgnoreCase(keyword);
		if ((!isPrefix && !isBase) || cursor.peek() == ':') {
			cursor.unread(keyword);
			return false;
		}
		if (!sparqlDirectives) {
			throw cursor.error("SPARQL-style directive not allowed: " + keyword);
		}
		if (isPrefix) {
			parsePrefixBody();
		} else {
			parseBaseBody();
		}
		return true;
	}

	private void parsePrefixBody() throws IOException {
		int c = lexer.skipWhitespaceAndComments();
		String prefix = "";
		if (CharacterClasses.isPnCharsBase(c)) {
			prefix = lexer.readNameRun();
		}
		cursor.expect(':', "PNAME_NS");
		lexer.skipWhitespaceAndComments();
		String namespace = parseIriRef();
		state.setNamespace(prefix, namespace);
		namespaceListener.accept(prefix, namespace);
	}

	private void parseBaseBody() throws IOException {
		lexer.skipWhitespaceAndComments();
		String iri = lexer.readIriRef();
		try {
			state.setBase(iri);
		} catch (URISyntaxException e) {
			throw cursor.error("Invalid base IRI <" + iri + ">: " + e.getMessage(), e);
		}
	}

	private void parseTriples(Consumer<Statement> out) throws IOException {
		Resource subject;
		if (cursor.peek() == '[') {
			cursor.read();
			int c = lexer.skipWhitespaceAndComments();
			if (c == ']') {
				cursor.read();
				subject = valueFactory.createBNode();
				lexer.skipWhitespaceAndComments();
				parsePredicateObjectList(subject, out);
			} else {
				subject = parseBlankNodePropertyListBody(out);
				c = lexer.skipWhitespaceAndComments();
				if (c != '.') {
					parsePredicateObjectList(subject, out);
				}
			}
		} else {
			subject = parseSubject(out);
			lexer.skipWhitespaceAndComments();
			parsePredicateObjectList(subject, out);
		}
	}

	private Resource parseSubject(Consumer<Statement> out) throws IOException {
		int c = cursor.peek();
		if (c == '<') {
			return createIRI(parseIriRef());
		} else if (c == '_') {
			return valueFactory.createBNode(lexer.readBlankNodeLabel());
		} else if (c == '(') {
			return parseCollection(out);
		} else if (c == ':' || CharacterClasses.isPnCharsBase(c)) {
			String prefix = readPrefix();
			if (cursor.peek() != ':') {
				throw cursor.error("Expected a subject, found '" + prefix + "'");
			}
			return parsePrefixedName(prefix);
		} else {
			cursor.read();
			throw cursor.error("Expected a subject, found " + TextCursor.describe(c));
		}
	}

	/**
	 * predicateObjectList ::= verb objectList (';' (verb objectList)?)*
	 */
	private void parsePredicateObjectList(Resource subject, Consumer<Statement> out) throws IOException {
		IRI predicate = parseVerb();
		lexer.skipWhitespaceAndComments();
		parseObjectList(subject, predicate, out);
		int c = lexer.skipWhitespaceAndComments();
		while (c == ';') {
			while (c == ';') {
				cursor.read();
				c = lexer.skipWhitespaceAndComments();
			}
			if (c == '.' || c == ']' || c == TextCursor.EOF) {
				break;
			}
			predicate = parseVerb();
			lexer.skipWhitespaceAndComments();
			parseObjectList(subject, predicate, out);
			c = lexer.skipWhitespaceAndComments();
		}
	}

	/**
	 * objectList ::= object (',' object)*
	 */
	private void parseObjectList(Resource subject, IRI predicate, Consumer<Statement> out) throws IOException {
		while (true) {
			Value object = parseObject(out);
			emit(subject, predicate, object, out);
			int c = lexer.skipWhitespaceAndComments();
			if (c != ',') {
				return;
			}
			cursor.read();
			lexer.skipWhitespaceAndComments();
		}
	}

	private void emit(@Nullable Resource subject, @Nullable IRI predicate, Value object, Consumer<Statement> out) {
		if (subject == null) {
			throw cursor.error("Missing subject for object " + object);
		}
		if (predicate == null) {
			throw cursor.error("Missing predicate for object " + object);
		}
		out.accept(valueFactory.createStatement(subject, predicate, object));
	}

	/**
	 * verb ::= iri | 'a'
	 */
	private IRI parseVerb() throws IOException {
		int c = cursor.peek();
		if (c == '<') {
			return createIRI(parseIriRef());
		} else if (c == ':' || CharacterClasses.isPnCharsBase(c)) {
			String prefix = readPrefix();
			if (cursor.peek() == ':') {
				return parsePrefixedName(prefix);
			} else if ("a".equals(prefix)) {
				return RDF.TYPE;
			} else {
				throw cursor.error("Expected a predicate, found '" + prefix + "'");
			}
		} else {
			cursor.read();
			throw cursor.error("Expected a predicate, found " + TextCursor.describe(c));
		}
	}

	private Value parseObject(Consumer<Statement> out) throws IOException {
		int c = cursor.peek();
		if (c == '<') {
			return createIRI(parseIriRef());
		} else if (c == '_') {
			return valueFactory.createBNode(lexer.readBlankNodeLabel());
		} else if (c == '(') {
			return parseCollection(out);
		} else if (c == '[') {
			cursor.read();
			c = lexer.skipWhitespaceAndComments();
			if (c == ']') {
				cursor.read();
				return valueFactory.createBNode();
			}
			return parseBlankNodePropertyListBody(out);
		} else if (c == '"' || c == '\'') {
			return parseRDFLiteral();
		} else if (CharacterClasses.isDigit(c) || c == '+' || c == '-' || c == '.') {
			TermLexer.Numeric number = lexer.readNumber();
			return valueFactory.createLiteral(number.label, number.datatype);
		} else if (c == ':' || CharacterClasses.isPnCharsBase(c)) {
			String prefix = readPrefix();
			if (cursor.peek() == ':') {
				return parsePrefixedName(prefix);
			} else if ("true".equals(prefix) || "false".equals(prefix)) {
				return valueFactory.createLiteral(prefix, XSD.BOOLEAN);
			} else {
				throw cursor.error("Expected an object, found '" + prefix + "'");
			}
		} else {
			cursor.read();
			throw cursor.error("Expected an object, found " + TextCursor.describe(c));
		}
	}

	/**
	 * The part of blankNodePropertyList after '['. The new node is the subject of the nested list only.
	 */
	private BNode parseBlankNodePropertyListBody(Consumer<Statement> out) throws IOException {
		BNode node = valueFactory.createBNode();
		parsePredicateObjectList(node, out);
		lexer.skipWhitespaceAndComments();
		cursor.expect(']', "blankNodePropertyList");
		return node;
	}

	/**
	 * collection ::= '(' object* ')'
	 */
	private Resource parseCollection(Consumer<Statement> out) throws IOException {
		cursor.expect('(', "collection");
		List<Value> members = new ArrayList<>();
		int c = lexer.skipWhitespaceAndComments();
		while (c != ')') {
			if (c == TextCursor.EOF) {
				throw cursor.error("Unterminated collection, expected ')'");
			}
			members.add(parseObject(out));
			c = lexer.skipWhitespaceAndComments();
		}
		cursor.read();
		return CollectionDesugarer.desugar(members, valueFactory, out);
	}

	/**
	 * RDFLiteral ::= String (LANGTAG | '^^' iri)?
	 */
	private Value parseRDFLiteral() throws IOException {
		String label = lexer.readQuotedString(true);
		int c = cursor.peek();
		if (c == '@') {
			return valueFactory.createLiteral(label, lexer.readLanguageTag());
		} else if (c == '^') {
			cursor.expect('^', "datatype");
			cursor.expect('^', "datatype");
			return valueFactory.createLiteral(label, parseIri());
		} else {
			return valueFactory.createLiteral(label);
		}
	}

	/**
	 * iri ::= IRIREF | PrefixedName
	 */
	private IRI parseIri() throws IOException {
		int c = cursor.peek();
		if (c == '<') {
			return createIRI(parseIriRef());
		} else if (c == ':' || CharacterClasses.isPnCharsBase(c)) {
			String prefix = readPrefix();
			if (cursor.peek() != ':') {
				throw cursor.error("Expected a prefixed name, found '" + prefix + "'");
			}
			return parsePrefixedName(prefix);
		} else {
			cursor.read();
			throw cursor.error("Expected an IRI, found " + TextCursor.describe(c));
		}
	}

	/**
	 * Reads the PN_PREFIX part of a prefixed name, or a bare keyword. Empty if the next character is ':'.
	 */
	private String readPrefix() throws IOException {
		return cursor.peek() == ':' ? "" : lexer.readNameRun();
	}

	/**
	 * Completes a PrefixedName after its prefix, looking the prefix up in the current namespace table.
	 */
	private IRI parsePrefixedName(String prefix) throws IOException {
		cursor.expect(':', "PrefixedName");
		String namespace = state.getNamespace(prefix);
		if (namespace == null) {
			throw cursor.error("Unknown prefix '" + prefix + ":' in PrefixedName");
		}
		return createIRI(namespace + lexer.readLocalName());
	}

	/**
	 * Reads an IRIREF and resolves it against the current base.
	 */
	private String parseIriRef() throws IOException {
		String iri = lexer.readIriRef();
		try {
			return state.resolve(iri);
		} catch (URISyntaxException e) {
			throw cursor.error("Invalid IRI <" + iri + ">: " + e.getMessage(), e);
		}
	}

	private IRI createIRI(String iri) {
		try {
			return valueFactory.createIRI(iri);
		} catch (IllegalArgumentException e) {
			throw cursor.error("Invalid IRI <" + iri + ">: " + e.getMessage(), e);
		}
	}
}
