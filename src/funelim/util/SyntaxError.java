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
package funelim.util;

import java.io.PrintStream;

/**
 * This exception is thrown when the term reader encounters malformed input.
 *
 * @author David Pearce
 */
public class SyntaxError extends RuntimeException {

	private final String msg;
	private final String src;
	private final int start;
	private final int end;

	/**
	 * Identify a syntax error at a particular point in the input.
	 *
	 * @param msg   Message detailing the problem.
	 * @param src   The text being read when the problem arose.
	 * @param start Index of the first offending character.
	 * @param end   Index of the last offending character.
	 */
	public SyntaxError(String msg, String src, int start, int end) {
		this.msg = msg;
		this.src = src;
		this.start = start;
		this.end = end;
	}

	@Override
	public String getMessage() {
		if (msg != null) {
			return msg;
		} else {
			return "";
		}
	}

	/**
	 * The text being read when the error arose.
	 *
	 * @return
	 */
	public String source() {
		return src;
	}

	/**
	 * Get index of first character of offending location.
	 *
	 * @return
	 */
	public int start() {
		return start;
	}

	/**
	 * Get index of last character of offending location.
	 *
	 * @return
	 */
	public int end() {
		return end;
	}

	/**
	 * Output the syntax error to a given output stream, underlining the
	 * offending part of the input.
	 */
	public void outputSourceError(PrintStream output) {
		if (src == null || start < 0) {
			output.println("syntax error: " + getMessage());
		} else {
			int lineStart = 0;
			int lineEnd = 0;
			int line = 0;
			while (lineEnd < src.length() && lineEnd <= start) {
				lineStart = lineEnd;
				lineEnd = parseLine(src, lineEnd);
				line = line + 1;
			}
			lineEnd = Math.min(lineEnd, src.length());
			output.println("line " + line + ": " + getMessage());
			String text = src.substring(lineStart, lineEnd);
			if (text.endsWith("\n")) {
				output.print(text);
			} else {
				output.println(text);
			}
			StringBuilder marker = new StringBuilder();
			for (int i = lineStart; i < start; ++i) {
				marker.append(src.charAt(i) == '\t' ? '\t' : ' ');
			}
			for (int i = start; i <= end; ++i) {
				marker.append('^');
			}
			output.println(marker);
		}
	}

	private static int parseLine(String text, int index) {
		while (index < text.length() && text.charAt(index) != '\n') {
			index++;
		}
		return index + 1;
	}

	public static final long serialVersionUID = 1l;
}
