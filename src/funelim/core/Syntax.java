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
package funelim.core;

import java.util.Arrays;
import java.util.List;
import java.util.Objects;

import funelim.util.Anomaly;
import jmodelgen.core.Domain;
import jmodelgen.core.Domains;

/**
 * The term language manipulated by the derivation passes. Variables bound by
 * binders are referenced by de Bruijn index, where <code>#1</code> refers to
 * the innermost enclosing binder. Equality on terms is structural and ignores
 * binder names, hence two alpha-equivalent terms are equal and hash
 * identically.
 *
 * @author David J. Pearce
 *
 */
public class Syntax {
	public final static int TERM_rel = 0;
	public final static int TERM_var = 1;
	public final static int TERM_const = 2;
	public final static int TERM_ind = 3;
	public final static int TERM_sort = 4;
	public final static int TERM_app = 5;
	public final static int TERM_lambda = 6;
	public final static int TERM_product = 7;
	public final static int TERM_letin = 8;
	public final static int TERM_case = 9;
	public final static int TERM_proj = 10;
	public final static int TERM_evar = 11;

	/**
	 * The name used when printing an anonymous binder.
	 */
	public final static String ANONYMOUS = "_";

	public interface Term {

		/**
		 * Get the opcode associated with the syntactic form of this term.
		 *
		 * @return
		 */
		public int getOpcode();

		/**
		 * An abstract term to be implemented by all other terms. The hash code is
		 * computed once on construction from the de Bruijn structure alone.
		 *
		 * @author David J. Pearce
		 *
		 */
		public static abstract class AbstractTerm implements Term {
			private final int opcode;
			private final int hash;

			public AbstractTerm(int opcode, int hash) {
				this.opcode = opcode;
				this.hash = hash * 31 + opcode;
			}

			@Override
			public int getOpcode() {
				return opcode;
			}

			@Override
			public int hashCode() {
				return hash;
			}
		}

		/**
		 * A marker interface for terms which introduce a bound variable into their
		 * body.
		 *
		 * @author David J. Pearce
		 *
		 */
		public interface Binder extends Term {
			public String name();

			public Term type();

			public Term body();
		}

		/**
		 * A reference to a bound variable by de Bruijn index, written
		 * <code>#i</code>.
		 *
		 * @author David J. Pearce
		 *
		 */
		public class Rel extends AbstractTerm {
			private final int index;

			public Rel(int index) {
				super(TERM_rel, index);
				Anomaly.check(index > 0, "invalid de Bruijn index " + index);
				this.index = index;
			}

			public int index() {
				return index;
			}

			@Override
			public boolean equals(Object o) {
				return o instanceof Rel && ((Rel) o).index == index;
			}

			@Override
			public String toString() {
				return "#" + index;
			}

			public static Domain.Big<Rel> toBigDomain(Domain.Small<Integer> indices) {
				return Domains.Adaptor(indices, Rel::new);
			}
		}

		/**
		 * A reference to a named (section) variable. Where-clauses and recursive
		 * self references are typically named this way before being cut out of a
		 * context.
		 *
		 * @author David J. Pearce
		 *
		 */
		public class Var extends AbstractTerm {
			private final String name;

			public Var(String name) {
				super(TERM_var, name.hashCode());
				this.name = name;
			}

			public String name() {
				return name;
			}

			@Override
			public boolean equals(Object o) {
				return o instanceof Var && ((Var) o).name.equals(name);
			}

			@Override
			public String toString() {
				return name;
			}
		}

		/**
		 * A reference to a global constant, such as a defined function, a
		 * constructor or a logical connective.
		 *
		 * @author David J. Pearce
		 *
		 */
		public class Const extends AbstractTerm {
			private final String name;

			public Const(String name) {
				super(TERM_const, name.hashCode());
				this.name = name;
			}

			public String name() {
				return name;
			}

			@Override
			public boolean equals(Object o) {
				return o instanceof Const && ((Const) o).name.equals(name);
			}

			@Override
			public String toString() {
				return name;
			}

			public static Domain.Big<Const> toBigDomain(Domain.Small<String> names) {
				return Domains.Adaptor(names, Const::new);
			}
		}

		/**
		 * A reference to the <code>i</code>th inductive type of a (possibly
		 * mutual) declared block, e.g. the graph relation of a function once
		 * declared.
		 *
		 * @author David J. Pearce
		 *
		 */
		public class Ind extends AbstractTerm {
			private final String block;
			private final int index;

			public Ind(String block, int index) {
				super(TERM_ind, block.hashCode() * 31 + index);
				this.block = block;
				this.index = index;
			}

			public String block() {
				return block;
			}

			public int index() {
				return index;
			}

			@Override
			public boolean equals(Object o) {
				if (o instanceof Ind) {
					Ind i = (Ind) o;
					return i.block.equals(block) && i.index == index;
				}
				return false;
			}

			@Override
			public String toString() {
				return block + "@" + index;
			}
		}

		/**
		 * One of the sorts <code>Prop</code>, <code>Set</code> or
		 * <code>Type</code>.
		 *
		 * @author David J. Pearce
		 *
		 */
		public class Sort extends AbstractTerm {
			public enum Kind {
				PROP, SET, TYPE
			}

			private final Kind kind;

			public Sort(Kind kind) {
				super(TERM_sort, kind.ordinal());
				this.kind = kind;
			}

			public Kind kind() {
				return kind;
			}

			@Override
			public boolean equals(Object o) {
				return o instanceof Sort && ((Sort) o).kind == kind;
			}

			@Override
			public String toString() {
				switch (kind) {
				case PROP:
					return "Prop";
				case SET:
					return "Set";
				default:
					return "Type";
				}
			}
		}

		/**
		 * An application of a head to one or more arguments. The head of an
		 * application is never itself an application, since nested applications
		 * are flattened on construction.
		 *
		 * @author David J. Pearce
		 *
		 */
		public class App extends AbstractTerm {
			private final Term head;
			private final Term[] arguments;

			public App(Term head, Term... arguments) {
				this(flatten(head, arguments));
			}

			private App(Term[] items) {
				super(TERM_app, Arrays.hashCode(items));
				Anomaly.check(items.length > 1, "application without arguments", items[0]);
				this.head = items[0];
				this.arguments = Arrays.copyOfRange(items, 1, items.length);
			}

			public Term head() {
				return head;
			}

			public Term[] arguments() {
				return arguments;
			}

			public int size() {
				return arguments.length;
			}

			public Term get(int i) {
				return arguments[i];
			}

			@Override
			public boolean equals(Object o) {
				if (o instanceof App) {
					App a = (App) o;
					return a.hashCode() == hashCode() && a.head.equals(head) && Arrays.equals(a.arguments, arguments);
				}
				return false;
			}

			@Override
			public String toString() {
				String r = bracket(head);
				for (Term arg : arguments) {
					r += " " + bracket(arg);
				}
				return r;
			}

			private static Term[] flatten(Term head, Term[] arguments) {
				if (head instanceof App) {
					App h = (App) head;
					Term[] items = new Term[1 + h.arguments.length + arguments.length];
					items[0] = h.head;
					System.arraycopy(h.arguments, 0, items, 1, h.arguments.length);
					System.arraycopy(arguments, 0, items, 1 + h.arguments.length, arguments.length);
					return items;
				} else {
					Term[] items = new Term[1 + arguments.length];
					items[0] = head;
					System.arraycopy(arguments, 0, items, 1, arguments.length);
					return items;
				}
			}

			public static App construct(Term head, Term argument) {
				return new App(head, argument);
			}

			public static Domain.Big<App> toBigDomain(Domain.Big<Term> heads, Domain.Big<Term> arguments) {
				return Domains.Product(heads, arguments, App::construct);
			}
		}

		/**
		 * Represents an abstraction <code>fun (x : T) => b</code>.
		 *
		 * @author David J. Pearce
		 *
		 */
		public class Lambda extends AbstractTerm implements Binder {
			private final String name;
			private final Term type;
			private final Term body;

			public Lambda(String name, Term type, Term body) {
				super(TERM_lambda, type.hashCode() * 31 + body.hashCode());
				this.name = name;
				this.type = type;
				this.body = body;
			}

			@Override
			public String name() {
				return name;
			}

			@Override
			public Term type() {
				return type;
			}

			@Override
			public Term body() {
				return body;
			}

			@Override
			public boolean equals(Object o) {
				if (o instanceof Lambda) {
					Lambda l = (Lambda) o;
					return l.hashCode() == hashCode() && l.type.equals(type) && l.body.equals(body);
				}
				return false;
			}

			@Override
			public String toString() {
				return "fun (" + nameOf(name) + " : " + type + ") => " + body;
			}

			public static Lambda construct(Term type, Term body) {
				return new Lambda("x", type, body);
			}

			public static Domain.Big<Lambda> toBigDomain(Domain.Big<Term> types, Domain.Big<Term> bodies) {
				return Domains.Product(types, bodies, Lambda::construct);
			}
		}

		/**
		 * Represents a dependent product <code>forall (x : T), B</code>, which is
		 * printed as an arrow when its body does not mention the bound variable.
		 *
		 * @author David J. Pearce
		 *
		 */
		public class Product extends AbstractTerm implements Binder {
			private final String name;
			private final Term type;
			private final Term body;

			public Product(String name, Term type, Term body) {
				super(TERM_product, type.hashCode() * 37 + body.hashCode());
				this.name = name;
				this.type = type;
				this.body = body;
			}

			@Override
			public String name() {
				return name;
			}

			@Override
			public Term type() {
				return type;
			}

			@Override
			public Term body() {
				return body;
			}

			@Override
			public boolean equals(Object o) {
				if (o instanceof Product) {
					Product p = (Product) o;
					return p.hashCode() == hashCode() && p.type.equals(type) && p.body.equals(body);
				}
				return false;
			}

			@Override
			public String toString() {
				if (name == null && Terms.noccurn(1, body)) {
					return bracketArrow(type) + " -> " + Terms.lift(-1, body);
				}
				return "forall (" + nameOf(name) + " : " + type + "), " + body;
			}

			public static Product construct(Term type, Term body) {
				return new Product("x", type, body);
			}

			public static Domain.Big<Product> toBigDomain(Domain.Big<Term> types, Domain.Big<Term> bodies) {
				return Domains.Product(types, bodies, Product::construct);
			}
		}

		/**
		 * Represents a local definition <code>let x : T := v in b</code>.
		 *
		 * @author David J. Pearce
		 *
		 */
		public class LetIn extends AbstractTerm implements Binder {
			private final String name;
			private final Term value;
			private final Term type;
			private final Term body;

			public LetIn(String name, Term value, Term type, Term body) {
				super(TERM_letin, (value.hashCode() * 31 + type.hashCode()) * 31 + body.hashCode());
				this.name = name;
				this.value = value;
				this.type = type;
				this.body = body;
			}

			@Override
			public String name() {
				return name;
			}

			public Term value() {
				return value;
			}

			@Override
			public Term type() {
				return type;
			}

			@Override
			public Term body() {
				return body;
			}

			@Override
			public boolean equals(Object o) {
				if (o instanceof LetIn) {
					LetIn l = (LetIn) o;
					return l.hashCode() == hashCode() && l.value.equals(value) && l.type.equals(type)
							&& l.body.equals(body);
				}
				return false;
			}

			@Override
			public String toString() {
				return "let " + nameOf(name) + " : " + type + " := " + value + " in " + body;
			}
		}

		/**
		 * Represents a case analysis on a discriminee. Each branch is a function
		 * taking the arguments of the corresponding constructor, and the predicate
		 * is a function from the discriminee to the type of the whole case.
		 *
		 * @author David J. Pearce
		 *
		 */
		public class Case extends AbstractTerm {
			private final Term predicate;
			private final Term discriminee;
			private final Term[] branches;

			public Case(Term predicate, Term discriminee, Term... branches) {
				super(TERM_case, (predicate.hashCode() * 31 + discriminee.hashCode()) * 31 + Arrays.hashCode(branches));
				this.predicate = predicate;
				this.discriminee = discriminee;
				this.branches = branches;
			}

			public Term predicate() {
				return predicate;
			}

			public Term discriminee() {
				return discriminee;
			}

			public Term[] branches() {
				return branches;
			}

			@Override
			public boolean equals(Object o) {
				if (o instanceof Case) {
					Case c = (Case) o;
					return c.hashCode() == hashCode() && c.predicate.equals(predicate)
							&& c.discriminee.equals(discriminee) && Arrays.equals(c.branches, branches);
				}
				return false;
			}

			@Override
			public String toString() {
				String r = "match " + discriminee + " return " + predicate + " with";
				for (Term b : branches) {
					r += " | " + b;
				}
				return r + " end";
			}
		}

		/**
		 * Represents the projection of a named field out of a record value.
		 *
		 * @author David J. Pearce
		 *
		 */
		public class Proj extends AbstractTerm {
			private final String projection;
			private final Term operand;

			public Proj(String projection, Term operand) {
				super(TERM_proj, projection.hashCode() * 31 + operand.hashCode());
				this.projection = projection;
				this.operand = operand;
			}

			public String projection() {
				return projection;
			}

			public Term operand() {
				return operand;
			}

			@Override
			public boolean equals(Object o) {
				if (o instanceof Proj) {
					Proj p = (Proj) o;
					return p.projection.equals(projection) && p.operand.equals(operand);
				}
				return false;
			}

			@Override
			public String toString() {
				return bracket(operand) + ".(" + projection + ")";
			}
		}

		/**
		 * An existential placeholder <code>?n</code>, standing for a term which is
		 * yet to be provided (e.g. the witness produced by a refinement step).
		 * Placeholders allocated for auxiliary definitions carry the name of that
		 * definition, and print as <code>?name</code>. The name plays no part in
		 * equality.
		 *
		 * @author David J. Pearce
		 *
		 */
		public class Evar extends AbstractTerm {
			private final int id;
			private final String name;
			private final Term[] instance;

			public Evar(int id, Term... instance) {
				this(id, null, instance);
			}

			public Evar(int id, String name, Term... instance) {
				super(TERM_evar, id * 31 + Arrays.hashCode(instance));
				this.id = id;
				this.name = name;
				this.instance = instance;
			}

			public int id() {
				return id;
			}

			/**
			 * Get the name of the definition this placeholder stands for, or
			 * <code>null</code> when it has none.
			 *
			 * @return
			 */
			public String name() {
				return name;
			}

			public Term[] instance() {
				return instance;
			}

			@Override
			public boolean equals(Object o) {
				if (o instanceof Evar) {
					Evar e = (Evar) o;
					return e.id == id && Arrays.equals(e.instance, instance);
				}
				return false;
			}

			@Override
			public String toString() {
				String r = "?" + (name != null ? name : Integer.toString(id));
				if (instance.length == 0) {
					return r;
				}
				return r + Arrays.toString(instance);
			}
		}
	}

	/**
	 * A single entry of a typing context: a name, an optional value (for local
	 * definitions) and a type. The type (and value) live in the context formed by
	 * the entries outside this one.
	 *
	 * @author David J. Pearce
	 *
	 */
	public static class Declaration {
		private final String name;
		private final Term value;
		private final Term type;

		public Declaration(String name, Term type) {
			this(name, null, type);
		}

		public Declaration(String name, Term value, Term type) {
			this.name = name;
			this.value = value;
			this.type = type;
		}

		public String name() {
			return name;
		}

		/**
		 * Get the value of this declaration, or <code>null</code> if it is an
		 * assumption.
		 *
		 * @return
		 */
		public Term value() {
			return value;
		}

		public Term type() {
			return type;
		}

		public boolean isDefinition() {
			return value != null;
		}

		public Declaration rename(String name) {
			return new Declaration(name, value, type);
		}

		/**
		 * Apply a function to the type and value of this declaration.
		 *
		 * @param fn
		 * @return
		 */
		public Declaration map(java.util.function.Function<Term, Term> fn) {
			Term v = value == null ? null : fn.apply(value);
			Term t = fn.apply(type);
			if (v == value && t == type) {
				return this;
			}
			return new Declaration(name, v, t);
		}

		@Override
		public boolean equals(Object o) {
			if (o instanceof Declaration) {
				Declaration d = (Declaration) o;
				return Objects.equals(d.name, name) && Objects.equals(d.value, value) && d.type.equals(type);
			}
			return false;
		}

		@Override
		public int hashCode() {
			return Objects.hashCode(name) ^ Objects.hashCode(value) ^ type.hashCode();
		}

		@Override
		public String toString() {
			if (value == null) {
				return "(" + nameOf(name) + " : " + type + ")";
			}
			return "(" + nameOf(name) + " : " + type + " := " + value + ")";
		}
	}

	/**
	 * A pattern, as found in the pattern vector of a matching problem. Patterns
	 * are either a variable of the source context, a constructor applied to
	 * sub-patterns, or an inaccessible term fixed by typing.
	 *
	 * @author David J. Pearce
	 *
	 */
	public interface Pattern {

		/**
		 * Convert this pattern into the term it denotes.
		 *
		 * @return
		 */
		public Term toTerm();

		public class Variable implements Pattern {
			private final int index;

			public Variable(int index) {
				Anomaly.check(index > 0, "invalid pattern variable " + index);
				this.index = index;
			}

			public int index() {
				return index;
			}

			@Override
			public Term toTerm() {
				return new Term.Rel(index);
			}

			@Override
			public boolean equals(Object o) {
				return o instanceof Variable && ((Variable) o).index == index;
			}

			@Override
			public int hashCode() {
				return index;
			}

			@Override
			public String toString() {
				return "#" + index;
			}
		}

		public class Constructor implements Pattern {
			private final Term constructor;
			private final Pattern[] arguments;

			public Constructor(Term constructor, Pattern... arguments) {
				this.constructor = constructor;
				this.arguments = arguments;
			}

			public Term constructor() {
				return constructor;
			}

			public Pattern[] arguments() {
				return arguments;
			}

			@Override
			public Term toTerm() {
				if (arguments.length == 0) {
					return constructor;
				}
				Term[] args = new Term[arguments.length];
				for (int i = 0; i != args.length; ++i) {
					args[i] = arguments[i].toTerm();
				}
				return new Term.App(constructor, args);
			}

			@Override
			public boolean equals(Object o) {
				if (o instanceof Constructor) {
					Constructor c = (Constructor) o;
					return c.constructor.equals(constructor) && Arrays.equals(c.arguments, arguments);
				}
				return false;
			}

			@Override
			public int hashCode() {
				return constructor.hashCode() ^ Arrays.hashCode(arguments);
			}

			@Override
			public String toString() {
				if (arguments.length == 0) {
					return constructor.toString();
				}
				String r = "(" + constructor;
				for (Pattern p : arguments) {
					r += " " + p;
				}
				return r + ")";
			}
		}

		public class Inaccessible implements Pattern {
			private final Term term;

			public Inaccessible(Term term) {
				this.term = term;
			}

			public Term term() {
				return term;
			}

			@Override
			public Term toTerm() {
				return term;
			}

			@Override
			public boolean equals(Object o) {
				return o instanceof Inaccessible && ((Inaccessible) o).term.equals(term);
			}

			@Override
			public int hashCode() {
				return ~term.hashCode();
			}

			@Override
			public String toString() {
				return "?(" + term + ")";
			}
		}
	}

	/**
	 * Construct the domain of all terms up to a given nesting depth, built from
	 * the given de Bruijn indices and constants using applications, abstractions
	 * and products.
	 *
	 * @param depth     Maximum nesting depth of compound terms
	 * @param indices   The de Bruijn indices which may appear
	 * @param constants The constant names which may appear
	 * @return
	 */
	public static Domain.Big<Term> toBigDomain(int depth, Domain.Small<Integer> indices, Domain.Small<String> constants) {
		Domain.Big<? extends Term> rels = Term.Rel.toBigDomain(indices);
		Domain.Big<? extends Term> consts = Term.Const.toBigDomain(constants);
		Domain.Big<Term> terminals = Domains.Union(rels, consts);
		if (depth <= 0) {
			return terminals;
		} else {
			Domain.Big<Term> subterms = toBigDomain(depth - 1, indices, constants);
			Domain.Big<? extends Term> apps = Term.App.toBigDomain(subterms, subterms);
			Domain.Big<? extends Term> lambdas = Term.Lambda.toBigDomain(subterms, subterms);
			Domain.Big<? extends Term> products = Term.Product.toBigDomain(subterms, subterms);
			return Domains.Union(terminals, apps, lambdas, products);
		}
	}

	/**
	 * Print a binder name, using the anonymous name where none is given.
	 *
	 * @param name
	 * @return
	 */
	public static String nameOf(String name) {
		return name == null ? ANONYMOUS : name;
	}

	/**
	 * Convert a list of terms into an array.
	 *
	 * @param terms
	 * @return
	 */
	public static Term[] toArray(List<Term> terms) {
		return terms.toArray(new Term[terms.size()]);
	}

	private static boolean isAtomic(Term t) {
		switch (t.getOpcode()) {
		case TERM_rel:
		case TERM_var:
		case TERM_const:
		case TERM_ind:
		case TERM_sort:
		case TERM_evar:
			return true;
		default:
			return false;
		}
	}

	private static String bracket(Term t) {
		return isAtomic(t) ? t.toString() : "(" + t + ")";
	}

	private static String bracketArrow(Term t) {
		return isAtomic(t) || t instanceof Term.App ? t.toString() : "(" + t + ")";
	}
}
