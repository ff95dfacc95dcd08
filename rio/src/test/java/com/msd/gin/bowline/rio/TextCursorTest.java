package com.msd.gin.bowline.rio;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.io.IOException;
import java.io.StringReader;

import org.eclipse.rdf4j.rio.RDFParseException;
import org.junit.jupiter.api.Test;

public class TextCursorTest {
	@Test
	public void testPositions() throws IOException {
		TextCursor cursor = new TextCursor(new StringReader("ab\ncd"));
		assertEquals('a', cursor.read());
		assertEquals('b', cursor.read());
		assertEquals(1, cursor.getLineNumber());
		assertEquals(3, cursor.getColumnNumber());
		assertEquals('\n', cursor.read());
		assertEquals(2, cursor.getLineNumber());
		assertEquals(1, cursor.getColumnNumber());
		cursor.unread('\n');
		assertEquals(1, cursor.getLineNumber());
		assertEquals(3, cursor.getColumnNumber());
		assertEquals('\n', cursor.read());
		assertEquals('c', cursor.read());
		assertEquals('d', cursor.read());
		assertEquals(TextCursor.EOF, cursor.read());
		assertEquals(TextCursor.EOF, cursor.peek());
	}

	@Test
	public void testSupplementaryCodePoint() throws IOException {
		TextCursor cursor = new TextCursor(new StringReader("😀x"));
		assertEquals(0x1F600, cursor.read());
		assertEquals(2, cursor.getColumnNumber());
		assertEquals('x', cursor.read());
	}

	@Test
	public void testUnreadText() throws IOException {
		TextCursor cursor = new TextCursor(new StringReader("z"));
		cursor.unread("xy");
		assertEquals('x', cursor.read());
		assertEquals('y', cursor.peek());
		assertEquals('y', cursor.read());
		assertEquals('z', cursor.read());
	}

	@Test
	public void testErrorPosition() throws IOException {
		TextCursor cursor = TextCursor.forLine("abc", 42);
		cursor.read();
		cursor.read();
		RDFParseException e = cursor.error("bad");
		assertEquals(42, e.getLineNumber());
		assertEquals(2, e.getColumnNumber());
	}

	@Test
	public void testUnpairedSurrogates() {
		TextCursor lowFirst = new TextCursor(new StringReader("a\uDC00b"));
		assertThrows(RDFParseException.class, () -> {
			lowFirst.read();
			lowFirst.read();
		});
		TextCursor highAlone = new TextCursor(new StringReader("\uD83Dx"));
		assertThrows(RDFParseException.class, highAlone::read);
	}
}
