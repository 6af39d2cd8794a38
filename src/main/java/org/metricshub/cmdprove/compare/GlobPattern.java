package org.metricshub.cmdprove.compare;

/*-
 * ╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲
 * cmdprove
 * ჻჻჻჻჻჻
 * Copyright (C) 2025 MetricsHub
 * ჻჻჻჻჻჻
 * This program is free software: you can redistribute it and/or modify
 * it under the terms of the GNU Lesser General Public License as
 * published by the Free Software Foundation, either version 3 of the
 * License, or (at your option) any later version.
 *
 * This program is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 * GNU General Lesser Public License for more details.
 *
 * You should have received a copy of the GNU General Lesser Public
 * License along with this program.  If not, see
 * <http://www.gnu.org/licenses/lgpl-3.0.html>.
 * ╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱
 */

import java.util.ArrayList;
import java.util.BitSet;
import java.util.List;
import java.util.Objects;

/**
 * A compiled shell glob pattern with the extended grouping operators.
 * <p>
 * Grammar (a pattern always matches the <em>whole</em> subject string,
 * newlines included, nothing is matched line by line):
 *
 * <pre>
 * pattern     := element*
 * element     := '\' c                  literal character c
 *              | '*' | '?'              any string / any single character
 *              | '[' bracket ']'        one character out of a set
 *              | op '(' list ')'        extended group, op in ? * + @ !
 *              | c                      literal character c
 * list        := pattern ( '|' pattern )*
 * bracket     := ( '!' | '^' )? ']'? item+
 * item        := '[:' class ':]' | c '-' c | '\' c | c
 * </pre>
 *
 * Extended groups:
 * <ul>
 * <li><code>?(list)</code> zero or one occurrence of the alternatives
 * <li><code>*(list)</code> zero or more occurrences
 * <li><code>+(list)</code> one or more occurrences
 * <li><code>@(list)</code> exactly one occurrence
 * <li><code>!(list)</code> any string that does not match <code>@(list)</code>
 * </ul>
 * Precedence and escaping rules:
 * <ul>
 * <li><code>*</code> and <code>?</code> are operators only when directly
 * followed by <code>(</code>; <code>+</code>, <code>@</code> and
 * <code>!</code> are literal characters unless directly followed by
 * <code>(</code>.
 * <li>Inside a group, <code>|</code> and <code>)</code> only separate or close
 * alternatives at the group's own nesting level; nested groups and bracket
 * expressions are parsed first.
 * <li>A backslash makes the next character literal everywhere, including
 * inside brackets and groups. A trailing backslash matches itself.
 * <li>A <code>[</code> without a closing <code>]</code> is a literal
 * character. An unterminated extended group is a syntax error.
 * <li>POSIX classes: alnum, alpha, blank, cntrl, digit, graph, lower, print,
 * punct, space, upper, word, xdigit.
 * </ul>
 */
public final class GlobPattern {

	private final String pattern;
	private final Sequence root;

	private GlobPattern(String pattern) {
		this.pattern = pattern;
		// a ')' or '|' outside of any group is a plain character
		this.root = new Parser(pattern).parseSequence(false);
	}

	/**
	 * Compiles the specified glob pattern.
	 *
	 * @param pattern the pattern
	 * @return the compiled pattern
	 * @throws GlobSyntaxException if an extended group is malformed
	 */
	public static GlobPattern compile(String pattern) {
		return new GlobPattern(Objects.requireNonNull(pattern, "Pattern must not be null"));
	}

	/**
	 * Convenience method to compile and match in one go.
	 *
	 * @param pattern the glob pattern
	 * @param text the subject
	 * @return whether the whole text matches the pattern
	 */
	public static boolean matches(String pattern, CharSequence text) {
		return compile(pattern).matches(text);
	}

	/**
	 * @param text the subject
	 * @return whether the whole text matches this pattern
	 */
	public boolean matches(CharSequence text) {
		return new Matcher(text.toString()).matches(root);
	}

	/**
	 * @return the source of this pattern
	 */
	public String pattern() {
		return pattern;
	}

	@Override
	public String toString() {
		return pattern;
	}

	//
	// Pattern tree
	//

	private interface Node {}

	private static final class Literal implements Node {
		private final char c;

		Literal(char c) {
			this.c = c;
		}
	}

	private static final class AnyChar implements Node {}

	private static final class AnyString implements Node {}

	private static final class CharClass implements Node {
		private final boolean negated;
		private final StringBuilder singles = new StringBuilder();
		private final List<char[]> ranges = new ArrayList<char[]>();
		private final List<String> namedClasses = new ArrayList<String>();

		CharClass(boolean negated) {
			this.negated = negated;
		}

		boolean accepts(char c) {
			boolean found = singles.indexOf(String.valueOf(c)) >= 0;
			for (int i = 0; !found && i < ranges.size(); i++) {
				char[] range = ranges.get(i);
				found = c >= range[0] && c <= range[1];
			}
			for (int i = 0; !found && i < namedClasses.size(); i++) {
				found = inNamedClass(namedClasses.get(i), c);
			}
			return found != negated;
		}
	}

	private static final class Group implements Node {
		private final char op;
		private final List<Sequence> alternatives = new ArrayList<Sequence>();

		Group(char op) {
			this.op = op;
		}
	}

	private static final class Sequence {
		private final List<Node> nodes = new ArrayList<Node>();
	}

	private static boolean inNamedClass(String name, char c) {
		switch (name) {
		case "alnum":
			return Character.isLetterOrDigit(c);
		case "alpha":
			return Character.isLetter(c);
		case "blank":
			return c == ' ' || c == '\t';
		case "cntrl":
			return Character.isISOControl(c);
		case "digit":
			return c >= '0' && c <= '9';
		case "graph":
			return c > ' ' && c != 0x7f && !Character.isWhitespace(c) && !Character.isISOControl(c);
		case "lower":
			return Character.isLowerCase(c);
		case "print":
			return c >= ' ' && c != 0x7f && !Character.isISOControl(c);
		case "punct":
			return c > ' ' && c < 0x7f && !Character.isLetterOrDigit(c);
		case "space":
			return Character.isWhitespace(c);
		case "upper":
			return Character.isUpperCase(c);
		case "word":
			return Character.isLetterOrDigit(c) || c == '_';
		case "xdigit":
			return (c >= '0' && c <= '9') || (c >= 'a' && c <= 'f') || (c >= 'A' && c <= 'F');
		default:
			return false;
		}
	}

	//
	// Parser
	//

	private static final class Parser {
		private final String src;
		private int pos;

		Parser(String src) {
			this.src = src;
		}

		/**
		 * Parses elements until the end of the pattern or, when inside a group,
		 * until a '|' or ')' at the current nesting level.
		 */
		Sequence parseSequence(boolean inGroup) {
			Sequence seq = new Sequence();
			while (pos < src.length()) {
				char c = src.charAt(pos);
				if (inGroup && (c == '|' || c == ')')) {
					break;
				}
				if (c == '\\') {
					if (pos + 1 < src.length()) {
						seq.nodes.add(new Literal(src.charAt(pos + 1)));
						pos += 2;
					} else {
						seq.nodes.add(new Literal('\\'));
						pos++;
					}
				} else if (isGroupOperator(c) && pos + 1 < src.length() && src.charAt(pos + 1) == '(') {
					seq.nodes.add(parseGroup(c));
				} else if (c == '*') {
					pos++;
					// consecutive stars are equivalent to one
					if (seq.nodes.isEmpty() || !(seq.nodes.get(seq.nodes.size() - 1) instanceof AnyString)) {
						seq.nodes.add(new AnyString());
					}
				} else if (c == '?') {
					pos++;
					seq.nodes.add(new AnyChar());
				} else if (c == '[') {
					CharClass cc = parseBracket();
					if (cc == null) {
						seq.nodes.add(new Literal('['));
						pos++;
					} else {
						seq.nodes.add(cc);
					}
				} else {
					seq.nodes.add(new Literal(c));
					pos++;
				}
			}
			return seq;
		}

		private boolean isGroupOperator(char c) {
			return c == '?' || c == '*' || c == '+' || c == '@' || c == '!';
		}

		private Group parseGroup(char op) {
			int start = pos;
			pos += 2; // op and '('
			Group group = new Group(op);
			while (true) {
				group.alternatives.add(parseSequence(true));
				if (pos >= src.length()) {
					throw new GlobSyntaxException(src, start, "Unterminated group '" + op + "('");
				}
				char c = src.charAt(pos++);
				if (c == ')') {
					return group;
				}
				// c == '|': next alternative
			}
		}

		/**
		 * Parses a bracket expression starting at the current '['.
		 *
		 * @return the class, or <code>null</code> (position unchanged) when the
		 *         bracket is never closed
		 */
		private CharClass parseBracket() {
			int i = pos + 1;
			boolean negated = false;
			if (i < src.length() && (src.charAt(i) == '!' || src.charAt(i) == '^')) {
				negated = true;
				i++;
			}
			CharClass cc = new CharClass(negated);
			boolean first = true;
			while (i < src.length()) {
				char c = src.charAt(i);
				if (c == ']' && !first) {
					pos = i + 1;
					return cc;
				}
				first = false;
				if (c == '[' && i + 1 < src.length() && src.charAt(i + 1) == ':') {
					int close = src.indexOf(":]", i + 2);
					if (close > 0) {
						cc.namedClasses.add(src.substring(i + 2, close));
						i = close + 2;
						continue;
					}
				}
				if (c == '\\' && i + 1 < src.length()) {
					c = src.charAt(++i);
				}
				if (i + 2 < src.length() && src.charAt(i + 1) == '-' && src.charAt(i + 2) != ']') {
					char to = src.charAt(i + 2);
					int next = i + 3;
					if (to == '\\' && i + 3 < src.length()) {
						to = src.charAt(i + 3);
						next = i + 4;
					}
					cc.ranges.add(new char[] { c, to });
					i = next;
				} else {
					cc.singles.append(c);
					i++;
				}
			}
			return null;
		}
	}

	//
	// Matcher
	//

	/**
	 * Matches by moving sets of text positions through the pattern, from
	 * left to right. The recursion depth is bounded by the nesting depth of
	 * the pattern, not by the length of the text.
	 */
	private static final class Matcher {
		private final String text;
		private final int length;

		Matcher(String text) {
			this.text = text;
			this.length = text.length();
		}

		boolean matches(Sequence root) {
			BitSet start = new BitSet();
			start.set(0);
			return advance(root, start).get(length);
		}

		/**
		 * @return every position <code>q</code> such that the sequence matches
		 *         <code>text[p, q)</code> for some <code>p</code> in <code>starts</code>
		 */
		private BitSet advance(Sequence seq, BitSet starts) {
			BitSet current = starts;
			for (int i = 0; i < seq.nodes.size() && !current.isEmpty(); i++) {
				current = step(seq.nodes.get(i), current);
			}
			return current;
		}

		private BitSet step(Node node, BitSet starts) {
			if (node instanceof AnyString) {
				BitSet next = new BitSet(length + 1);
				next.set(starts.nextSetBit(0), length + 1);
				return next;
			}
			if (node instanceof Group) {
				return stepGroup((Group) node, starts);
			}
			BitSet next = new BitSet(length + 1);
			for (int p = starts.nextSetBit(0); p >= 0 && p < length; p = starts.nextSetBit(p + 1)) {
				if (acceptsChar(node, text.charAt(p))) {
					next.set(p + 1);
				}
			}
			return next;
		}

		private boolean acceptsChar(Node node, char c) {
			if (node instanceof Literal) {
				return ((Literal) node).c == c;
			}
			if (node instanceof CharClass) {
				return ((CharClass) node).accepts(c);
			}
			// AnyChar
			return true;
		}

		private BitSet stepGroup(Group group, BitSet starts) {
			switch (group.op) {
			case '@':
				return advanceAlternatives(group, starts);
			case '?': {
				BitSet next = advanceAlternatives(group, starts);
				next.or(starts);
				return next;
			}
			case '!':
				return advanceNegated(group, starts);
			case '*':
				return repeat(group, starts);
			case '+':
				return repeat(group, advanceAlternatives(group, starts));
			default:
				throw new IllegalStateException("Unknown group operator: " + group.op);
			}
		}

		private BitSet advanceAlternatives(Group group, BitSet starts) {
			BitSet next = new BitSet(length + 1);
			for (Sequence alternative : group.alternatives) {
				next.or(advance(alternative, starts));
			}
			return next;
		}

		/**
		 * Adds to <code>reached</code> every position reachable through any
		 * number of further repetitions. Positions only move forward, so a single
		 * ascending scan visits each of them once.
		 */
		private BitSet repeat(Group group, BitSet reached) {
			BitSet result = (BitSet) reached.clone();
			BitSet single = new BitSet(length + 1);
			for (int p = result.nextSetBit(0); p >= 0; p = result.nextSetBit(p + 1)) {
				single.clear();
				single.set(p);
				result.or(advanceAlternatives(group, single));
			}
			return result;
		}

		/** <code>!(list)</code> matches <code>text[p, q)</code> when no alternative does. */
		private BitSet advanceNegated(Group group, BitSet starts) {
			BitSet next = new BitSet(length + 1);
			BitSet single = new BitSet(length + 1);
			for (int p = starts.nextSetBit(0); p >= 0; p = starts.nextSetBit(p + 1)) {
				single.clear();
				single.set(p);
				BitSet ends = new BitSet(length + 1);
				ends.set(p, length + 1);
				ends.andNot(advanceAlternatives(group, single));
				next.or(ends);
			}
			return next;
		}
	}
}
