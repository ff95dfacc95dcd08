package com.msd.gin.bowline.rio;

import com.msd.gin.bowline.common.CharacterClasses;

import java.io.IOException;

import org.eclipse.rdf4j.model.IRI;
import org.eclipse.rdf4j.model.vocabulary.XSD;

/**
 * Terminal productions shared by the N-Triples and Turtle grammars: IRI references, blank node labels,
 * quoted strings with escape decoding, language tags, numbers and prefixed name parts.
 * Methods return decoded text; building terms from it is left to the caller's value factory.
 */
final class TermLexer {
	private final TextCursor cursor;

	TermLexer(TextCursor cursor) {
		this.cursor = cursor;
	}

	static final class Numeric {
		final String label;
		final IRI datatype;

		Numeric(String label, IRI datatype) {
			this.label = label;
			this.datatype = datatype;
		}
	}

	/**
	 * Skips space and tab.
	 *
	 * @return the next code point, not consumed
	 */
	int skipLineWhitespace() throws IOException {
		int c = cursor.read();
		while (CharacterClasses.isLineWhitespace(c)) {
			c = cursor.read();
		}
		cursor.unread(c);
		return c;
	}

	/**
	 * Skips whitespace including line breaks, and comments.
	 *
	 * @return the next code point, not consumed
	 */
	int skipWhitespaceAndComments() throws IOException {
		int c = cursor.read();
		while (CharacterClasses.isWhitespace(c) || c == '#') {
			if (c == '#') {
				skipComment();
			}
			c = cursor.read();
		}
		cursor.unread(c);
		return c;
	}

	/**
	 * Consumes the rest of a comment up to and including the line break.
	 */
	void skipComment() throws IOException {
		int c = cursor.read();
		while (c != TextCursor.EOF && c != '\n' && c != '\r') {
			c = cursor.read();
		}
	}

	/**
	 * IRIREF ::= '&lt;' ([^#x00-#x20&lt;&gt;"{}|^`\] | UCHAR)* '&gt;'
	 */
	String readIriRef() throws IOException {
		cursor.expect('<', "IRIREF");
		StringBuilder iri = new StringBuilder(64);
		while (true) {
			int c = cursor.read();
			if (c == '>') {
				return iri.toString();
			} else if (c == TextCursor.EOF) {
				throw cursor.error("Unterminated IRI, expected '>'");
			} else if (c == '\\') {
				int e = cursor.read();
				if (e != 'u' && e != 'U') {
					throw cursor.error("Only unicode escapes are allowed in IRIs, found \\" + TextCursor.describe(e));
				}
				int cp = readUnicodeEscape(e == 'u' ? 4 : 8);
				if (!CharacterClasses.isIriChar(cp)) {
					throw cursor.error("Illegal escaped character U+" + String.format("%04X", cp) + " in IRI");
				}
				iri.appendCodePoint(cp);
			} else if (!CharacterClasses.isIriChar(c)) {
				throw cursor.error("Illegal character " + TextCursor.describe(c) + " in IRI");
			} else {
				iri.appendCodePoint(c);
			}
		}
	}

	/**
	 * BLANK_NODE_LABEL ::= '_:' (PN_CHARS_U | [0-9]) ((PN_CHARS | '.')* PN_CHARS)?
	 *
	 * @return the label without the '_:' marker
	 */
	String readBlankNodeLabel() throws IOException {
		cursor.expect('_', "BLANK_NODE_LABEL");
		cursor.expect(':', "BLANK_NODE_LABEL");
		int c = cursor.read();
		if (!CharacterClasses.isBlankNodeLabelStart(c)) {
			throw cursor.error("Illegal blank node label start " + TextCursor.describe(c));
		}
		StringBuilder label = new StringBuilder(16);
		label.appendCodePoint(c);
		c = cursor.read();
		while (CharacterClasses.isPnChars(c) || c == '.') {
			label.appendCodePoint(c);
			c = cursor.read();
		}
		cursor.unread(c);
		unreadTrailingDots(label, countTrailingDots(label));
		return label.toString();
	}

	/**
	 * Reads a quoted string starting at the opening quote and decodes its escapes.
	 *
	 * @param allowLong whether the triple-quoted and single-quote forms are accepted
	 */
	String readQuotedString(boolean allowLong) throws IOException {
		int q = cursor.read();
		if (q != '"' && (q != '\'' || !allowLong)) {
			throw cursor.error("Expected a quoted string, found " + TextCursor.describe(q));
		}
		int c = cursor.read();
		if (c == q) {
			if (allowLong) {
				int c3 = cursor.read();
				if (c3 == q) {
					return readLongStringBody(q);
				}
				cursor.unread(c3);
			}
			return "";
		}
		cursor.unread(c);
		return readShortStringBody(q);
	}

	private String readShortStringBody(int q) throws IOException {
		StringBuilder sb = new StringBuilder(32);
		while (true) {
			int c = cursor.read();
			if (c == q) {
				return sb.toString();
			} else if (c == TextCursor.EOF) {
				throw cursor.error("Unterminated string literal");
			} else if (c == '\n' || c == '\r') {
				throw cursor.error("Illegal line break in single-line string literal");
			} else if (c == '\\') {
				sb.appendCodePoint(readEscape());
			} else {
				sb.appendCodePoint(c);
			}
		}
	}

	private String readLongStringBody(int q) throws IOException {
		StringBuilder sb = new StringBuilder(128);
		while (true) {
			int c = cursor.read();
			if (c == q) {
				int run = 1;
				c = cursor.read();
				while (c == q) {
					run++;
					c = cursor.read();
				}
				if (run >= 3) {
					cursor.unread(c);
					if (run > 5) {
						throw cursor.error("Too many quotes at the end of a long string literal");
					}
					appendQuotes(sb, q, run - 3);
					return sb.toString();
				}
				appendQuotes(sb, q, run);
			}
			if (c == TextCursor.EOF) {
				throw cursor.error("Unterminated long string literal");
			} else if (c == '\\') {
				sb.appendCodePoint(readEscape());
			} else {
				sb.appendCodePoint(c);
			}
		}
	}

	private static void appendQuotes(StringBuilder sb, int q, int count) {
		for (int i = 0; i < count; i++) {
			sb.appendCodePoint(q);
		}
	}

	/**
	 * Decodes ECHAR or UCHAR. The backslash has already been consumed.
	 */
	int readEscape() throws IOException {
		int c = cursor.read();
		switch (c) {
			case 't':
				return '\t';
			case 'b':
				return '\b';
			case 'n':
				return '\n';
			case 'r':
				return '\r';
			case 'f':
				return '\f';
			case '"':
				return '"';
			case '\'':
				return '\'';
			case '\\':
				return '\\';
			case 'u':
				return readUnicodeEscape(4);
			case 'U':
				return readUnicodeEscape(8);
			default:
				throw cursor.error("Undefined escape sequence \\" + (c == TextCursor.EOF ? "" : new String(Character.toChars(c))));
		}
	}

	private int readUnicodeEscape(int digits) throws IOException {
		StringBuilder hex = new StringBuilder(digits);
		for (int i = 0; i < digits; i++) {
			int c = cursor.read();
			if (!CharacterClasses.isHex(c)) {
				throw cursor.error("Expected " + digits + " hex digits in unicode escape, found " + TextCursor.describe(c));
			}
			hex.appendCodePoint(c);
		}
		long cp = Long.parseLong(hex.toString(), 16);
		if (cp > Integer.MAX_VALUE || !CharacterClasses.isScalarValue((int) cp)) {
			throw cursor.error("Unicode escape \\" + (digits == 4 ? 'u' : 'U') + hex + " is not a valid scalar value");
		}
		return (int) cp;
	}

	/**
	 * LANGTAG ::= '@' [a-zA-Z]+ ('-' [a-zA-Z0-9]+)*
	 *
	 * @return the tag without the '@'
	 */
	String readLanguageTag() throws IOException {
		cursor.expect('@', "LANGTAG");
		StringBuilder tag = new StringBuilder(8);
		int c = cursor.read();
		if (!CharacterClasses.isAsciiLetter(c)) {
			throw cursor.error("Expected a letter in language tag, found " + TextCursor.describe(c));
		}
		while (CharacterClasses.isAsciiLetter(c)) {
			tag.appendCodePoint(c);
			c = cursor.read();
		}
		while (c == '-') {
			tag.append('-');
			c = cursor.read();
			if (!CharacterClasses.isAsciiLetterOrDigit(c)) {
				throw cursor.error("Expected a letter or digit in language subtag, found " + TextCursor.describe(c));
			}
			while (CharacterClasses.isAsciiLetterOrDigit(c)) {
				tag.appendCodePoint(c);
				c = cursor.read();
			}
		}
		cursor.unread(c);
		return tag.toString();
	}

	/**
	 * INTEGER, DECIMAL or DOUBLE. The label is the exact source text.
	 */
	Numeric readNumber() throws IOException {
		StringBuilder sb = new StringBuilder(16);
		int c = cursor.read();
		if (c == '+' || c == '-') {
			sb.appendCodePoint(c);
			c = cursor.read();
		}
		int intDigits = 0;
		while (CharacterClasses.isDigit(c)) {
			sb.appendCodePoint(c);
			intDigits++;
			c = cursor.read();
		}
		int fracDigits = 0;
		IRI datatype = XSD.INTEGER;
		if (c == '.') {
			int next = cursor.read();
			if (CharacterClasses.isDigit(next)) {
				sb.append('.');
				datatype = XSD.DECIMAL;
				c = next;
				while (CharacterClasses.isDigit(c)) {
					sb.appendCodePoint(c);
					fracDigits++;
					c = cursor.read();
				}
			} else if ((next == 'e' || next == 'E') && intDigits > 0) {
				sb.append('.');
				c = next;
			} else {
				// the dot terminates the statement
				cursor.unread(next);
			}
		}
		if (intDigits == 0 && fracDigits == 0) {
			throw cursor.error("Expected a digit in numeric literal, found " + TextCursor.describe(c));
		}
		if (c == 'e' || c == 'E') {
			sb.appendCodePoint(c);
			c = cursor.read();
			if (c == '+' || c == '-') {
				sb.appendCodePoint(c);
				c = cursor.read();
			}
			if (!CharacterClasses.isDigit(c)) {
				throw cursor.error("Exponent value missing in numeric literal " + sb);
			}
			while (CharacterClasses.isDigit(c)) {
				sb.appendCodePoint(c);
				c = cursor.read();
			}
			datatype = XSD.DOUBLE;
		}
		cursor.unread(c);
		return new Numeric(sb.toString(), datatype);
	}

	/**
	 * Reads a run of prefix name characters (PN_CHARS and '.'). Trailing dots are left unread.
	 * The caller checks the first character.
	 */
	String readNameRun() throws IOException {
		StringBuilder name = new StringBuilder(16);
		int c = cursor.read();
		while (CharacterClasses.isPnChars(c) || c == '.') {
			name.appendCodePoint(c);
			c = cursor.read();
		}
		cursor.unread(c);
		unreadTrailingDots(name, countTrailingDots(name));
		return name.toString();
	}

	/**
	 * PN_LOCAL, read after the ':' of a prefixed name. Percent encodings are kept, local escapes are unescaped.
	 *
	 * @return the local name, possibly empty
	 */
	String readLocalName() throws IOException {
		StringBuilder local = new StringBuilder(32);
		int c = cursor.read();
		if (!CharacterClasses.isLocalNameStart(c) && c != '%' && c != '\\') {
			cursor.unread(c);
			return "";
		}
		// dots read since the last other character; an escaped dot does not count
		int trailingDots = 0;
		while (true) {
			if (c == '%') {
				local.append('%');
				for (int i = 0; i < 2; i++) {
					int h = cursor.read();
					if (!CharacterClasses.isHex(h)) {
						throw cursor.error("Incomplete percent encoding in local name, found " + TextCursor.describe(h));
					}
					local.appendCodePoint(h);
				}
				trailingDots = 0;
			} else if (c == '\\') {
				int e = cursor.read();
				if (!CharacterClasses.isLocalEscapable(e)) {
					throw cursor.error("Illegal escape in local name: \\" + TextCursor.describe(e));
				}
				local.appendCodePoint(e);
				trailingDots = 0;
			} else if (c == '.') {
				local.append('.');
				trailingDots++;
			} else if (CharacterClasses.isLocalNameChar(c)) {
				local.appendCodePoint(c);
				trailingDots = 0;
			} else {
				cursor.unread(c);
				break;
			}
			c = cursor.read();
		}
		unreadTrailingDots(local, trailingDots);
		return local.toString();
	}

	private static int countTrailingDots(CharSequence s) {
		int n = 0;
		while (n < s.length() && s.charAt(s.length() - 1 - n) == '.') {
			n++;
		}
		return n;
	}

	private void unreadTrailingDots(StringBuilder sb, int count) {
		for (int i = 0; i < count; i++) {
			sb.setLength(sb.length() - 1);
			cursor.unread('.');
		}
	}
}
