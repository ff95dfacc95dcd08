package com.msd.gin.bowline.common;

import java.util.Arrays;

/**
 * Character classes of the N-Triples and Turtle grammars, expressed as sorted code point range tables.
 * All methods take code points, not UTF-16 chars.
 */
public final class CharacterClasses {
	private CharacterClasses() {}

	/**
	 * Flattened inclusive ranges, [start0, end0, start1, end1, ...], sorted and non-overlapping.
	 */
	private static final int[] PN_CHARS_BASE = {
		'A', 'Z',
		'a', 'z',
		0x00C0, 0x00D6,
		0x00D8, 0x00F6,
		0x00F8, 0x02FF,
		0x0370, 0x037D,
		0x037F, 0x1FFF,
		0x200C, 0x200D,
		0x2070, 0x218F,
		0x2C00, 0x2FEF,
		0x3001, 0xD7FF,
		0xF900, 0xFDCF,
		0xFDF0, 0xFFFD,
		0x10000, 0xEFFFF
	};

	// PN_CHARS minus PN_CHARS_U
	private static final int[] PN_CHARS_EXTRA = {
		'-', '-',
		'0', '9',
		0x00B7, 0x00B7,
		0x0300, 0x036F,
		0x203F, 0x2040
	};

	// IRIREF excludes #x00-#x20 <>"{}|^`\
	private static final int[] IRI_FORBIDDEN = {
		0x00, 0x20,
		'"', '"',
		'<', '<',
		'>', '>',
		'\\', '\\',
		'^', '^',
		'`', '`',
		'{', '}'
	};

	private static final String LOCAL_ESCAPABLE = "_~.-!$&'()*+,;=/?#@%";

	static {
		checkSorted(PN_CHARS_BASE);
		checkSorted(PN_CHARS_EXTRA);
		checkSorted(IRI_FORBIDDEN);
	}

	private static void checkSorted(int[] ranges) {
		if (ranges.length % 2 != 0) {
			throw new AssertionError("Unbalanced range table");
		}
		for (int i = 1; i < ranges.length; i++) {
			if (ranges[i] < ranges[i - 1] || (i % 2 == 0 && ranges[i] == ranges[i - 1])) {
				throw new AssertionError("Range table not sorted at index " + i);
			}
		}
	}

	static boolean inRanges(int[] ranges, int cp) {
		int pos = Arrays.binarySearch(ranges, cp);
		if (pos >= 0) {
			return true;
		}
		// an odd insertion point lies between a start and its end
		int insertion = -pos - 1;
		return (insertion & 1) == 1;
	}

	public static boolean isPnCharsBase(int cp) {
		return inRanges(PN_CHARS_BASE, cp);
	}

	public static boolean isPnCharsU(int cp) {
		return cp == '_' || isPnCharsBase(cp);
	}

	public static boolean isPnChars(int cp) {
		return isPnCharsU(cp) || inRanges(PN_CHARS_EXTRA, cp);
	}

	/**
	 * First character of a blank node label: PN_CHARS_U or a digit.
	 */
	public static boolean isBlankNodeLabelStart(int cp) {
		return isPnCharsU(cp) || isDigit(cp);
	}

	/**
	 * First character of a local name, excluding PLX which the caller handles.
	 */
	public static boolean isLocalNameStart(int cp) {
		return isPnCharsU(cp) || cp == ':' || isDigit(cp);
	}

	public static boolean isLocalNameChar(int cp) {
		return isPnChars(cp) || cp == ':';
	}

	public static boolean isLocalEscapable(int cp) {
		return cp < 0x80 && LOCAL_ESCAPABLE.indexOf(cp) >= 0;
	}

	public static boolean isIriChar(int cp) {
		return cp >= 0 && !inRanges(IRI_FORBIDDEN, cp);
	}

	public static boolean isDigit(int cp) {
		return cp >= '0' && cp <= '9';
	}

	public static boolean isHex(int cp) {
		return isDigit(cp) || (cp >= 'a' && cp <= 'f') || (cp >= 'A' && cp <= 'F');
	}

	public static boolean isAsciiLetter(int cp) {
		return (cp >= 'a' && cp <= 'z') || (cp >= 'A' && cp <= 'Z');
	}

	public static boolean isAsciiLetterOrDigit(int cp) {
		return isAsciiLetter(cp) || isDigit(cp);
	}

	/**
	 * Turtle whitespace: space, tab, CR and LF.
	 */
	public static boolean isWhitespace(int cp) {
		return cp == ' ' || cp == '\t' || cp == '\r' || cp == '\n';
	}

	/**
	 * N-Triples intra-line whitespace: space and tab only.
	 */
	public static boolean isLineWhitespace(int cp) {
		return cp == ' ' || cp == '\t';
	}

	/**
	 * True if the code point is a Unicode scalar value, i.e. in range and not a surrogate.
	 */
	public static boolean isScalarValue(int cp) {
		return cp >= 0 && cp <= Character.MAX_CODE_POINT && (cp < Character.MIN_SURROGATE || cp > Character.MAX_SURROGATE);
	}
}
