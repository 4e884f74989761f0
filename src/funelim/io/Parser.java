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

import java.util.ArrayList;
import java.util.List;

import funelim.core.Context;
import funelim.core.Syntax;
import funelim.core.Syntax.Declaration;
import funelim.core.Syntax.Term;
import funelim.core.Terms;
import funelim.io.Lexer.*;
import funelim.util.SyntaxError;

/**
 * Reads terms and contexts. Identifiers bound by an enclosing binder (or by
 * the scope given) become de Bruijn indices, whilst free identifiers become
 * global constants.
 *
 * @author David J. Pearce
 *
 */
public class Parser {
	private final String source;
	private final ArrayList<Token> tokens;
	private int index;

	public Parser(String source, List<Token> tokens) {
		this.source = source;
		this.tokens = new ArrayList<>(tokens);
	}

	/**
	 * Read a closed term from a string.
	 *
	 * @param text
	 * @return
	 */
	public static Term parse(String text) {
		return parse(text, Scope.EMPTY);
	}

	/**
	 * Read a term from a string, within a given scope.
	 *
	 * @param text
	 * @param scope
	 * @return
	 */
	public static Term parse(String text, Scope scope) {
		Parser p = new Parser(text, new Lexer(text).scan());
		Term t = p.parseTerm(scope);
		p.checkEof();
		return t;
	}

	/**
	 * Read a context from a string.
	 *
	 * @param text
	 * @return
	 */
	public static Context parseContext(String text) {
		Parser p = new Parser(text, new Lexer(text).scan());
		Context ctx = p.parseContext(Scope.EMPTY);
		p.checkEof();
		return ctx;
	}

	/**
	 * Parse a telescope of zero or more declarations, of the form:
	 *
	 * <pre>
	 * Context ::= ( '(' Ident+ ':' Term [ ':=' Term ] ')' )*
	 * </pre>
	 *
	 * Each declaration may refer to those before it.
	 *
	 * @param scope
	 * @return
	 */
	public Context parseContext(Scope scope) {
		Context ctx = Context.EMPTY;
		while (index < tokens.size() && tokens.get(index) instanceof LeftBrace) {
			match("(");
			List<Identifier> names = matchIdentifiers();
			match(":");
			Term type = parseTerm(scope);
			Term value = null;
			if (index < tokens.size() && tokens.get(index) instanceof ColonEquals) {
				if (names.size() != 1) {
					syntaxError("definitions bind a single name", names.get(1));
				}
				match(":=");
				value = parseTerm(scope);
			}
			match(")");
			for (int i = 0; i != names.size(); ++i) {
				ctx = ctx.push(new Declaration(nameOf(names.get(i)), value, Terms.lift(i, type)));
				scope = scope.push(nameOf(names.get(i)));
			}
		}
		return ctx;
	}

	/**
	 * Parse a term, of the form:
	 *
	 * <pre>
	 * Term ::= 'fun' Binders '=>' Term
	 *       | 'forall' Binders ',' Term
	 *       | 'let' Ident ':' Term ':=' Term 'in' Term
	 *       | App [ '->' Term ]
	 * </pre>
	 *
	 * @param scope
	 * @return
	 */
	public Term parseTerm(Scope scope) {
		checkNotEof();
		Token lookahead = tokens.get(index);
		if (lookahead.text.equals("fun")) {
			matchKeyword("fun");
			return parseBinders(scope, true);
		} else if (lookahead.text.equals("forall")) {
			matchKeyword("forall");
			return parseBinders(scope, false);
		} else if (lookahead.text.equals("let")) {
			return parseLet(scope);
		}
		Term lhs = parseApplication(scope);
		if (index < tokens.size() && tokens.get(index) instanceof Arrow) {
			match("->");
			Term rhs = parseTerm(scope);
			return new Term.Product(null, lhs, Terms.lift(1, rhs));
		}
		return lhs;
	}

	/**
	 * Parse the binders of an abstraction or product, followed by its body.
	 *
	 * <pre>
	 * Binders ::= ( '(' Ident+ ':' Term ')' )+
	 * </pre>
	 *
	 * @param scope
	 * @param lambda
	 * @return
	 */
	private Term parseBinders(Scope scope, boolean lambda) {
		ArrayList<String> names = new ArrayList<>();
		ArrayList<Term> types = new ArrayList<>();
		Scope inner = scope;
		do {
			match("(");
			List<Identifier> ids = matchIdentifiers();
			match(":");
			Term type = parseTerm(inner);
			match(")");
			for (int i = 0; i != ids.size(); ++i) {
				names.add(nameOf(ids.get(i)));
				types.add(Terms.lift(i, type));
			}
			for (Identifier id : ids) {
				inner = inner.push(nameOf(id));
			}
		} while (index < tokens.size() && tokens.get(index) instanceof LeftBrace);
		match(lambda ? "=>" : ",");
		Term body = parseTerm(inner);
		for (int i = names.size() - 1; i >= 0; --i) {
			if (lambda) {
				body = new Term.Lambda(names.get(i), types.get(i), body);
			} else {
				body = new Term.Product(names.get(i), types.get(i), body);
			}
		}
		return body;
	}

	private Term parseLet(Scope scope) {
		matchKeyword("let");
		String name = nameOf(matchIdentifier());
		match(":");
		Term type = parseTerm(scope);
		match(":=");
		Term value = parseTerm(scope);
		matchKeyword("in");
		Term body = parseTerm(scope.push(name));
		return new Term.LetIn(name, value, type, body);
	}

	/**
	 * Parse an application of one atom to zero or more others.
	 *
	 * @param scope
	 * @return
	 */
	private Term parseApplication(Scope scope) {
		Term head = parseAtom(scope);
		ArrayList<Term> args = new ArrayList<>();
		while (index < tokens.size() && isAtomStart(tokens.get(index))) {
			args.add(parseAtom(scope));
		}
		return Terms.applist(head, args);
	}

	private boolean isAtomStart(Token t) {
		if (t instanceof Keyword) {
			return t.text.equals("Prop") || t.text.equals("Set") || t.text.equals("Type");
		}
		return t instanceof LeftBrace || t instanceof Hash || t instanceof QuestionMark || t instanceof Identifier;
	}

	/**
	 * Parse an atomic term, of the form:
	 *
	 * <pre>
	 * Atom ::= '(' Term ')' | '#' Int | '?' Int | 'Prop' | 'Set' | 'Type'
	 *       | Ident [ '@' Int ]
	 * </pre>
	 *
	 * @param scope
	 * @return
	 */
	private Term parseAtom(Scope scope) {
		checkNotEof();
		Token lookahead = tokens.get(index);
		if (lookahead instanceof LeftBrace) {
			match("(");
			Term t = parseTerm(scope);
			match(")");
			return t;
		} else if (lookahead instanceof Hash) {
			match("#");
			Int i = match(Int.class, "an integer");
			if (i.value < 1) {
				syntaxError("de Bruijn indices start at 1", i);
			}
			return new Term.Rel(i.value);
		} else if (lookahead instanceof QuestionMark) {
			match("?");
			return new Term.Evar(match(Int.class, "an integer").value);
		} else if (lookahead.text.equals("Prop")) {
			index++;
			return new Term.Sort(Term.Sort.Kind.PROP);
		} else if (lookahead.text.equals("Set")) {
			index++;
			return new Term.Sort(Term.Sort.Kind.SET);
		} else if (lookahead.text.equals("Type")) {
			index++;
			return new Term.Sort(Term.Sort.Kind.TYPE);
		}
		Identifier id = matchIdentifier();
		if (index < tokens.size() && tokens.get(index) instanceof At) {
			match("@");
			return new Term.Ind(id.text, match(Int.class, "an integer").value);
		}
		int rel = scope.lookup(id.text);
		return rel > 0 ? new Term.Rel(rel) : new Term.Const(id.text);
	}

	private static String nameOf(Identifier id) {
		return id.text.equals(Syntax.ANONYMOUS) ? null : id.text;
	}

	private void checkNotEof() {
		if (index >= tokens.size()) {
			int end = Math.max(0, source.length() - 1);
			throw new SyntaxError("unexpected end-of-input", source, end, end);
		}
	}

	private void checkEof() {
		if (index < tokens.size()) {
			syntaxError("unexpected '" + tokens.get(index).text + "'", tokens.get(index));
		}
	}

	private Token match(String op) {
		checkNotEof();
		Token t = tokens.get(index);
		if (!t.text.equals(op)) {
			syntaxError("expecting '" + op + "', found '" + t.text + "'", t);
		}
		index = index + 1;
		return t;
	}

	@SuppressWarnings("unchecked")
	private <T extends Token> T match(Class<T> c, String name) {
		checkNotEof();
		Token t = tokens.get(index);
		if (!c.isInstance(t)) {
			syntaxError("expecting " + name + ", found '" + t.text + "'", t);
		}
		index = index + 1;
		return (T) t;
	}

	private Identifier matchIdentifier() {
		checkNotEof();
		Token t = tokens.get(index);
		if (t instanceof Identifier) {
			Identifier i = (Identifier) t;
			index = index + 1;
			return i;
		}
		syntaxError("identifier expected", t);
		return null; // unreachable.
	}

	private List<Identifier> matchIdentifiers() {
		ArrayList<Identifier> ids = new ArrayList<>();
		ids.add(matchIdentifier());
		while (index < tokens.size() && tokens.get(index) instanceof Identifier) {
			ids.add(matchIdentifier());
		}
		return ids;
	}

	private Keyword matchKeyword(String keyword) {
		checkNotEof();
		Token t = tokens.get(index);
		if (t instanceof Keyword) {
			if (t.text.equals(keyword)) {
				index = index + 1;
				return (Keyword) t;
			}
		}
		syntaxError("keyword " + keyword + " expected.", t);
		return null;
	}

	private void syntaxError(String msg, Token t) {
		throw new SyntaxError(msg, source, t.start, t.end());
	}

	/**
	 * The names bound around the term being parsed, innermost first.
	 *
	 * @author David J. Pearce
	 *
	 */
	public static class Scope {
		public static final Scope EMPTY = new Scope(null, null);

		private final String name;
		private final Scope parent;

		private Scope(String name, Scope parent) {
			this.name = name;
			this.parent = parent;
		}

		/**
		 * Construct the scope of a context, in which its declarations are bound.
		 *
		 * @param ctx
		 * @return
		 */
		public static Scope of(Context ctx) {
			Scope s = EMPTY;
			for (Declaration d : ctx) {
				s = s.push(d.name());
			}
			return s;
		}

		/**
		 * Bind a new innermost name. Anonymous binders are given as
		 * <code>null</code>.
		 *
		 * @param name
		 * @return
		 */
		public Scope push(String name) {
			return new Scope(name, this);
		}

		/**
		 * Determine the de Bruijn index of a given name, or zero if it is not
		 * bound.
		 *
		 * @param name
		 * @return
		 */
		public int lookup(String name) {
			int i = 1;
			for (Scope s = this; s != EMPTY; s = s.parent) {
				if (name.equals(s.name)) {
					return i;
				}
				i = i + 1;
			}
			return 0;
		}
	}
}
