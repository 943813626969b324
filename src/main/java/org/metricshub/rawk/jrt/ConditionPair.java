package org.metricshub.rawk.jrt;

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

/**
 * State of a range pattern ({@code start, end}) across records.
 * <p>
 * One instance exists per rule. A record is part of the range from the one
 * where the start condition holds, up to and including the one where the end
 * condition holds. Both may hold on the same record, in which case the range
 * covers that record only.
 */
public class ConditionPair {

	private boolean inRange = false;

	/**
	 * Updates the state with the conditions evaluated on the current record.
	 *
	 * @param startMatches whether the start condition holds on the record
	 *        (only relevant when the range is not active)
	 * @param endMatches whether the end condition holds on the record
	 * @return whether the current record belongs to the range
	 */
	public boolean update(boolean startMatches, boolean endMatches) {
		if (inRange) {
			if (endMatches) {
				inRange = false;
			}
			return true;
		}
		if (startMatches) {
			inRange = !endMatches;
			return true;
		}
		return false;
	}

	/**
	 * @return whether a range is currently open, i.e. its start matched and
	 *         its end did not match yet
	 */
	public boolean isActive() {
		return inRange;
	}

	public void reset() {
		inRange = false;
	}
}
