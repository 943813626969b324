package org.metricshub.rawk.frontend.ast;

/*-
 * ╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲
 * Rawk
 * ჻჻჻჻჻჻
 * Copyright (C) 2006 - 2025 MetricsHub
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

import java.util.Objects;

/**
 * A rule of an AWK program.
 * <p>
 * BEGIN and END rules never carry a pattern. A {@link PatternAction} may lack
 * either its pattern or its action, but not both in a parsed program.
 */
public abstract class Rule {

	private Rule() {}

	/**
	 * @return the action of this rule, or null when the rule has none
	 */
	public abstract Action getAction();

	/**
	 * {@code BEGIN { ... }}
	 */
	public static final class Begin extends Rule {
		private final Action action;

		public Begin(Action action) {
			this.action = Objects.requireNonNull(action, "action");
		}

		@Override
		public Action getAction() {
			return action;
		}

		@Override
		public boolean equals(Object o) {
			return o instanceof Begin && ((Begin) o).action.equals(action);
		}

		@Override
		public int hashCode() {
			return Objects.hash("BEGIN", action);
		}

		@Override
		public String toString() {
			return "BEGIN " + action;
		}
	}

	/**
	 * {@code END { ... }}
	 */
	public static final class End extends Rule {
		private final Action action;

		public End(Action action) {
			this.action = Objects.requireNonNull(action, "action");
		}

		@Override
		public Action getAction() {
			return action;
		}

		@Override
		public boolean equals(Object o) {
			return o instanceof End && ((End) o).action.equals(action);
		}

		@Override
		public int hashCode() {
			return Objects.hash("END", action);
		}

		@Override
		public String toString() {
			return "END " + action;
		}
	}

	/**
	 * Pattern-less action, run for every record. This is the
	 * {@code Action(Action)} rule form: a bare {@code { ... }} block, as
	 * opposed to {@link PatternAction} whose action is guarded by a pattern.
	 */
	public static final class Unconditional extends Rule {
		private final Action action;

		public Unconditional(Action action) {
			this.action = Objects.requireNonNull(action, "action");
		}

		@Override
		public Action getAction() {
			return action;
		}

		@Override
		public boolean equals(Object o) {
			return o instanceof Unconditional && ((Unconditional) o).action.equals(action);
		}

		@Override
		public int hashCode() {
			return Objects.hash("main", action);
		}

		@Override
		public String toString() {
			return action.toString();
		}
	}

	/**
	 * {@code pattern [{ ... }]}. Without an action, the matching record is
	 * printed as is.
	 */
	public static final class PatternAction extends Rule {
		private final Expression pattern;
		private final Action action;

		public PatternAction(Expression pattern, Action action) {
			this.pattern = pattern;
			this.action = action;
		}

		/**
		 * @return the pattern, or null
		 */
		public Expression getPattern() {
			return pattern;
		}

		@Override
		public Action getAction() {
			return action;
		}

		@Override
		public boolean equals(Object o) {
			if (!(o instanceof PatternAction)) {
				return false;
			}
			PatternAction other = (PatternAction) o;
			return Objects.equals(pattern, other.pattern) && Objects.equals(action, other.action);
		}

		@Override
		public int hashCode() {
			return Objects.hash(pattern, action);
		}

		@Override
		public String toString() {
			if (pattern == null) {
				return action == null ? "" : action.toString();
			}
			return action == null ? pattern.toString() : pattern + " " + action;
		}
	}
}
