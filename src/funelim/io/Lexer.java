// This file is part of the FunElim Compiler (fec).
//
// The FunElim Compiler is free software; you can redistribute
// it and/or modify it under the terms of the GNU General Public
// License as published by the Free Software Foundation; either
// version 3 of the License, or (at your option) any later version.
//
// The FunElim Compiler is distributed in the hope that it
// will be useful, but WITHOUT ANY WARRANTY; without even the
// implied warranty of MERCHANTABILITY or FITNESS FOR A PARTICULAR
// PURPOSE. See the GNU General Public License for more details.
//
// You should have received a copy of the GNU General Public
// License along with the FunElim Compiler. If not, see
// <http://www.gnu.org/licenses/>
//
// Copyright 2018, David James Pearce.
package funelim.io;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.Reader;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;

import funelim.util.SyntaxError;

/**
 * Responsible for turning a stream of characters into a sequence of tokens.
 *
 * @author Daivd J. Pearce
 *
 */
public class Lexer {

	private final String input;
	private int pos;

	public Lexer(String input) {
		this.input = input;
	}

	public Lexer(Reader reader) throws IOException {
		BufferedReader in = new BufferedReader(reader);

		StringBuilder text = new StringBuilder();
		String tmp;
		while ((tmp = in.readLine()) != null) {
			text.append(tmp);
			text.append("\n");
		}

		input = text.toString();
	}

	/**
	 * Get the text being scanned.
	 *
	 * @return
	 */
	public String source() {
		return input;
	}

	/**
	 * Scan all characters from the input stream and generate a corresponding
	 * list of tokens, whilst discarding all whitespace and comments.
	 *
	 * @return
	 */
	public List<Token> scan() {
		ArrayList<Token> tokens = new ArrayList<>();
		pos = 0;

		while (pos < input.length()) {
			char c = input.charAt(pos);
			if (Character.isDigit(c)) {
				tokens.add(scanNumericConstant());
			} else if (c == '(' && (pos + 1) < input.length() && input.charAt(pos + 1) == '*') {
				scanBlockComment();
			} else if (isOperatorStart(c)) {
				tokens.add(scanOperator());
			} else if (Character.isJavaIdentifierStart(c)) {
				tokens.add(scanIdentifier());
			} else if (Character.isWhitespace(c)) {
				skipWhitespace();
			} else {
				syntaxError("syntax error");
			}
		}

		return tokens;
	}

	/**
	 * Scan a numeric constant. That is a sequence of digits which gives an
	 * integer constant.
	 *
	 * @return
	 */
	public Token scanNumericConstant() {
		int start = pos;
		while (pos < input.length() && Character.isDigit(input.charAt(pos))) {
			pos = pos + 1;
		}
		int r = new BigInteger(input.substring(start, pos)).intValue();
		return new Int(r, input.substring(start, pos), start);
	}

	static final char[] opStarts = { '(', ')', ',', ':', '=', '-', '#', '?', '@' };

	public boolean isOperatorStart(char c) {
		for (char o : opStarts) {
			if (c == o) {
				return true;
			}
		}
		return false;
	}

	public Token scanOperator() {
		char c = input.charAt(pos);
		char next = (pos + 1) < input.length() ? input.charAt(pos + 1) : '\0';

		if (c == '(') {
			return new LeftBrace(pos++);
		} else if (c == ')') {
			return new RightBrace(pos++);
		} else if (c == ',') {
			return new Comma(pos++);
		} else if (c == ':' && next == '=') {
			pos += 2;
			return new ColonEquals(pos - 2);
		} else if (c == ':') {
			return new Colon(pos++);
		} else if (c == '=' && next == '>') {
			pos += 2;
			return new DoubleArrow(pos - 2);
		} else if (c == '-' && next == '>') {
			pos += 2;
			return new Arrow(pos - 2);
		} else if (c == '#') {
			return new Hash(pos++);
		} else if (c == '?') {
			return new QuestionMark(pos++);
		} else if (c == '@') {
			return new At(pos++);
		}

		syntaxError("unknown operator encountered: " + c);
		return null;
	}

	public static final String[] keywords = { "fun", "forall", "let", "in", "Prop", "Set", "Type" };

	public Token scanIdentifier() {
		int start = pos;
		while (pos < input.length() && (Character.isJavaIdentifierPart(input.charAt(pos)) || input.charAt(pos) == '\'')) {
			pos++;
		}
		String text = input.substring(start, pos);

		// now, check for keywords
		for (String keyword : keywords) {
			if (keyword.equals(text)) {
				return new Keyword(text, start);
			}
		}

		// otherwise, must be identifier
		return new Identifier(text, start);
	}

	public void scanBlockComment() {
		int start = pos;
		while ((pos + 1) < input.length() && (input.charAt(pos) != '*' || input.charAt(pos + 1) != ')')) {
			pos++;
		}
		if ((pos + 1) >= input.length()) {
			throw new SyntaxError("unterminated comment", input, start, input.length() - 1);
		}
		pos++;
		pos++;
	}

	/**
	 * Skip over any whitespace at the current index position in the input
	 * string.
	 */
	public void skipWhitespace() {
		while (pos < input.length() && Character.isWhitespace(input.charAt(pos))) {
			pos++;
		}
	}

	/**
	 * Raise a syntax error with a given message at the current index.
	 *
	 * @param msg
	 */
	private void syntaxError(String msg) {
		throw new SyntaxError(msg, input, pos, pos);
	}

	/**
	 * The base class for all tokens.
	 *
	 * @author David J. Pearce
	 *
	 */
	public static abstract class Token {

		public final String text;
		public final int start;

		public Token(String text, int pos) {
			this.text = text;
			this.start = pos;
		}

		public int end() {
			return start + text.length() - 1;
		}
	}

	/**
	 * Represents an integer constant. That is, a sequence of 1 or more digits.
	 *
	 * @author David J. Pearce
	 *
	 */
	public static class Int extends Token {

		public final int value;

		public Int(int r, String text, int pos) {
			super(text, pos);
			value = r;
		}
	}

	/**
	 * Represents a variable or constant name. That is, a alphabetic character (or
	 * '_'), followed by a sequence of zero or more alpha-numeric characters or
	 * primes.
	 *
	 * @author David J. Pearce
	 *
	 */
	public static class Identifier extends Token {

		public Identifier(String text, int pos) {
			super(text, pos);
		}
	}

	/**
	 * Represents a known keyword. In essence, a keyword is a sequence of one or
	 * more alphabetic characters which is defined in advance.
	 *
	 * @author David J. Pearce
	 *
	 */
	public static class Keyword extends Token {

		public Keyword(String text, int pos) {
			super(text, pos);
		}
	}

	public static class LeftBrace extends Token {

		public LeftBrace(int pos) {
			super("(", pos);
		}
	}

	public static class RightBrace extends Token {

		public RightBrace(int pos) {
			super(")", pos);
		}
	}

	public static class Comma extends Token {
		public Comma(int pos) {
			super(",", pos);
		}
	}

	public static class Colon extends Token {
		public Colon(int pos) {
			super(":", pos);
		}
	}

	public static class ColonEquals extends Token {
		public ColonEquals(int pos) {
			super(":=", pos);
		}
	}

	public static class DoubleArrow extends Token {
		public DoubleArrow(int pos) {
			super("=>", pos);
		}
	}

	public static class Arrow extends Token {
		public Arrow(int pos) {
			super("->", pos);
		}
	}

	public static class Hash extends Token {
		public Hash(int pos) {
			super("#", pos);
		}
	}

	public static class QuestionMark extends Token {
		public QuestionMark(int pos) {
			super("?", pos);
		}
	}

	public static class At extends Token {
		public At(int pos) {
			super("@", pos);
		}
	}
}
