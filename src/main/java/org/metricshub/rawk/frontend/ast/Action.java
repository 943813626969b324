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
 * The body of a rule: an ordered list of statements between braces.
 */
public final class Action {

	private final List<Statement> statements;

	public Action(List<Statement> statements) {
		this.statements = Collections.unmodifiableList(new ArrayList<Statement>(statements));
	}

	public List<Statement> getStatements() {
		return statements;
	}

	@Override
	public boolean equals(Object o) {
		return o instanceof Action && ((Action) o).statements.equals(statements);
	}

	@Override
	public int hashCode() {
		return statements.hashCode();
	}

	@Override
	public String toString() {
		StringBuilder sb = new StringBuilder("{\n");
		for (Statement statement : statements) {
			sb.append('\t').append(statement.toString().replace("\n", "\n\t")).append('\n');
		}
		return sb.append('}').toString();
	}
}
