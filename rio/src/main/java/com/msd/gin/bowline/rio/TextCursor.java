package com.msd.gin.bowline.rio;

import java.io.IOException;
import java.io.Reader;
import java.io.StringReader;
import java.util.ArrayDeque;
import java.util.Deque;

import javax.annotation.concurrent.NotThreadSafe;

import org.eclipse.rdf4j.rio.RDFParseException;

/**
 * Code point cursor over a character source, with pushback and line/column tracking for error reporting.
 */
@NotThreadSafe
public final class TextCursor {
	public static final int EOF = -1;

	private final Reader reader;
	private final Deque<Integer> pushback = new ArrayDeque<>();
	private long lineNumber;
	private long columnNumber;
	private long previousLineLength;

	public TextCursor(Reader reader) {
		this(reader, 1);
	}

	public TextCursor(Reader reader, long firstLineNumber) {
		this.reader = reader;
		this.lineNumber = firstLineNumber;
		this.columnNumber = 0;
	}

	public static TextCursor forLine(String line, long lineNumber) {
		return new TextCursor(new StringReader(line), lineNumber);
	}

	public int read() throws IOException {
		int c;
		if (!pushback.isEmpty()) {
			c = pushback.pop();
		} else {
			c = readFromSource();
		}
		if (c == '\n') {
			lineNumber++;
			previousLineLength = columnNumber;
			columnNumber = 0;
		} else if (c != EOF) {
			columnNumber++;
		}
		return c;
	}

	private int readFromSource() throws IOException {
		int high = reader.read();
		if (high == EOF) {
			return EOF;
		}
		if (Character.isLowSurrogate((char) high)) {
			throw error("Unpaired surrogate character in input");
		}
		if (!Character.isHighSurrogate((char) high)) {
			return high;
		}
		int low = reader.read();
		if (low == EOF || !Character.isLowSurrogate((char) low)) {
			throw error("Unpaired surrogate character in input");
		}
		return Character.toCodePoint((char) high, (char) low);
	}

	public int peek() throws IOException {
		int c = read();
		unread(c);
		return c;
	}

	public void unread(int c) {
		if (c == EOF) {
			return;
		}
		if (c == '\n') {
			lineNumber--;
			columnNumber = previousLineLength;
		} else {
			columnNumber--;
		}
		pushback.push(c);
	}

	/**
	 * Pushes back the code points of the given text so that its first character is read next.
	 */
	public void unread(CharSequence text) {
		int i = text.length();
		while (i > 0) {
			int cp = Character.codePointBefore(text, i);
			unread(cp);
			i -= Character.charCount(cp);
		}
	}

	/**
	 * Reads the next code point and fails unless it is the expected one.
	 */
	public void expect(int expected, String production) throws IOException {
		int c = read();
		if (c != expected) {
			throw error("Expected '" + new String(Character.toChars(expected)) + "' in " + production + ", found " + describe(c));
		}
	}

	public long getLineNumber() {
		return lineNumber;
	}

	/**
	 * 1-based column of the next code point to be read.
	 */
	public long getColumnNumber() {
		return columnNumber + 1;
	}

	public RDFParseException error(String msg) {
		return new RDFParseException(msg, lineNumber, columnNumber);
	}

	public RDFParseException error(String msg, Throwable cause) {
		return new RDFParseException(msg, cause, lineNumber, columnNumber);
	}

	static String describe(int c) {
		if (c == EOF) {
			return "end of input";
		}
		switch (c) {
			case '\n':
				return "'\\n'";
			case '\r':
				return "'\\r'";
			case '\t':
				return "'\\t'";
			default:
				return "'" + new String(Character.toChars(c)) + "'";
		}
	}
}
