package com.msd.gin.bowline.rio;

import com.msd.gin.bowline.common.InterningValueFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.Optional;

import javax.annotation.concurrent.ThreadSafe;

import org.eclipse.rdf4j.model.IRI;
import org.eclipse.rdf4j.model.Resource;
import org.eclipse.rdf4j.model.Statement;
import org.eclipse.rdf4j.model.Value;
import org.eclipse.rdf4j.model.ValueFactory;
import org.eclipse.rdf4j.rio.RDFParseException;

/**
 * Parses a single N-Triples line. Every call is independent, so one instance can be shared between threads
 * as long as its value factory is thread-safe.
 */
@ThreadSafe
public final class NTriplesLineParser {
	private final ValueFactory valueFactory;

	public NTriplesLineParser() {
		this(new InterningValueFactory());
	}

	public NTriplesLineParser(ValueFactory valueFactory) {
		this.valueFactory = valueFactory;
	}

	public Optional<Statement> parseLine(String line) throws RDFParseException {
		return parseLine(line, 1);
	}

	/**
	 * @param line the text of one line, with or without its line terminator
	 * @param lineNumber reported in parse errors
	 * @return the triple on the line, or empty for a blank or comment-only line
	 * @throws RDFParseException if the line is not a valid triple
	 */
	public Optional<Statement> parseLine(String line, long lineNumber) throws RDFParseException {
		TextCursor cursor = TextCursor.forLine(stripLineTerminator(line), lineNumber);
		TermLexer lexer = new TermLexer(cursor);
		try {
			int c = lexer.skipLineWhitespace();
			if (c == TextCursor.EOF || c == '#') {
				return Optional.empty();
			}
			Resource subj = parseSubject(cursor, lexer);
			lexer.skipLineWhitespace();
			IRI pred = parsePredicate(cursor, lexer);
			lexer.skipLineWhitespace();
			Value obj = parseObject(cursor, lexer);
			lexer.skipLineWhitespace();
			cursor.expect('.', "triple");
			c = lexer.skipLineWhitespace();
			if (c != TextCursor.EOF && c != '#') {
				cursor.read();
				throw cursor.error("Unexpected content after end of triple: " + TextCursor.describe(c));
			}
			return Optional.of(valueFactory.createStatement(subj, pred, obj));
		} catch (IOException e) {
			// not expected from an in-memory line
			throw new UncheckedIOException(e);
		}
	}

	private static String stripLineTerminator(String line) {
		int end = line.length();
		if (end > 0 && line.charAt(end - 1) == '\n') {
			end--;
		}
		if (end > 0 && line.charAt(end - 1) == '\r') {
			end--;
		}
		return line.substring(0, end);
	}

	private Resource parseSubject(TextCursor cursor, TermLexer lexer) throws IOException {
		int c = cursor.peek();
		if (c == '<') {
			return parseIRI(cursor, lexer);
		} else if (c == '_') {
			return valueFactory.createBNode(lexer.readBlankNodeLabel());
		} else {
			cursor.read();
			throw cursor.error("Expected an IRI or blank node as subject, found " + TextCursor.describe(c));
		}
	}

	private IRI parsePredicate(TextCursor cursor, TermLexer lexer) throws IOException {
		int c = cursor.peek();
		if (c != '<') {
			cursor.read();
			throw cursor.error("Expected an IRI as predicate, found " + TextCursor.describe(c));
		}
		return parseIRI(cursor, lexer);
	}

	private Value parseObject(TextCursor cursor, TermLexer lexer) throws IOException {
		int c = cursor.peek();
		if (c == '<') {
			return parseIRI(cursor, lexer);
		} else if (c == '_') {
			return valueFactory.createBNode(lexer.readBlankNodeLabel());
		} else if (c == '"') {
			String label = lexer.readQuotedString(false);
			c = cursor.peek();
			if (c == '@') {
				return valueFactory.createLiteral(label, lexer.readLanguageTag());
			} else if (c == '^') {
				cursor.expect('^', "datatype");
				cursor.expect('^', "datatype");
				return valueFactory.createLiteral(label, parseIRI(cursor, lexer));
			} else {
				return valueFactory.createLiteral(label);
			}
		} else {
			cursor.read();
			throw cursor.error("Expected an IRI, blank node or literal as object, found " + TextCursor.describe(c));
		}
	}

	private IRI parseIRI(TextCursor cursor, TermLexer lexer) throws IOException {
		String iri = lexer.readIriRef();
		try {
			return valueFactory.createIRI(iri);
		} catch (IllegalArgumentException e) {
			throw cursor.error("Invalid IRI <" + iri + ">: " + e.getMessage(), e);
		}
	}
}
