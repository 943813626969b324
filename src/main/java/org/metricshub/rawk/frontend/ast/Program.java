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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A parsed AWK program: its BEGIN blocks, its main rules and its END blocks,
 * each in source order.
 */
public final class Program {

	private final List<Rule> beginBlocks = new ArrayList<Rule>();
	private final List<Rule> rules = new ArrayList<Rule>();
	private final List<Rule> endBlocks = new ArrayList<Rule>();

	/**
	 * Appends the specified rule to the matching section of the program.
	 *
	 * @param rule rule to add
	 */
	public void addRule(Rule rule) {
		if (rule instanceof Rule.Begin) {
			beginBlocks.add(rule);
		} else if (rule instanceof Rule.End) {
			endBlocks.add(rule);
		} else {
			rules.add(rule);
		}
	}

	public List<Rule> getBeginBlocks() {
		return Collections.unmodifiableList(beginBlocks);
	}

	/**
	 * @return the main rules (neither BEGIN nor END), in source order
	 */
	public List<Rule> getRules() {
		return Collections.unmodifiableList(rules);
	}

	public List<Rule> getEndBlocks() {
		return Collections.unmodifiableList(endBlocks);
	}

	/**
	 * @return the total number of rules, all sections included
	 */
	public int size() {
		return beginBlocks.size() + rules.size() + endBlocks.size();
	}

	public boolean isEmpty() {
		return size() == 0;
	}

	@Override
	public boolean equals(Object o) {
		if (!(o instanceof Program)) {
			return false;
		}
		Program other = (Program) o;
		return beginBlocks.equals(other.beginBlocks) && rules.equals(other.rules) && endBlocks.equals(other.endBlocks);
	}

	@Override
	public int hashCode() {
		return 31 * (31 * beginBlocks.hashCode() + rules.hashCode()) + endBlocks.hashCode();
	}

	/**
	 * Renders the program as AWK source, one rule per line.
	 */
	@Override
	public String toString() {
		StringBuilder sb = new StringBuilder();
		appendRules(sb, beginBlocks);
		appendRules(sb, rules);
		appendRules(sb, endBlocks);
		return sb.toString();
	}

	private static void appendRules(StringBuilder sb, List<Rule> section) {
		for (Rule rule : section) {
			sb.append(rule).append('\n');
		}
	}
}
