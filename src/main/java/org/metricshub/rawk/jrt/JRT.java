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

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.StringTokenizer;
import org.metricshub.rawk.util.AwkLogger;
import org.slf4j.Logger;

/**
 * The Rawk runtime.
 * <p>
 * The static methods are the one place where AWK values are converted
 * between strings and numbers. An instance holds the state of one execution
 * of a program:
 * <ul>
 * <li>the current record ($0) and its fields, split lazily with the FS in
 * effect on first access;
 * <li>the special variables NR, FNR, FILENAME, FS, OFS and NF;
 * <li>user variables and associative arrays;
 * <li>the state of the range pattern of each main rule.
 * </ul>
 * <p>
 * Nothing here throws on AWK-level errors: unknown variables, missing fields
 * and invalid numbers degrade to {@code ""} or {@code 0}.
 *
 * @author Danny Daglas
 */
public class JRT {

	private static final Logger LOG = AwkLogger.getLogger(JRT.class);

	// Current input line ($0).
	private String inputLine = "";
	// Fields of the current input line ($0, $1, $2, ...), or null until split
	private List<String> inputFields = null;

	// JRT-managed special variables
	private long nr; // total record number
	private long fnr; // file record number
	private String filename = ""; // current input filename (empty for stdin)
	private String fs = " "; // field separator
	private String ofs = " "; // output field separator

	private final Map<String, AwkValue> variables = new HashMap<String, AwkValue>();
	private final Map<String, Map<String, AwkValue>> arrays = new HashMap<String, Map<String, AwkValue>>();

	// Range pattern state, indexed like the main rules of the program
	private final List<ConditionPair> conditionPairs;

	/**
	 * @param ruleCount number of main rules in the program, one range state
	 *        is kept for each of them
	 */
	public JRT(int ruleCount) {
		List<ConditionPair> pairs = new ArrayList<ConditionPair>(ruleCount);
		for (int i = 0; i < ruleCount; i++) {
			pairs.add(new ConditionPair());
		}
		this.conditionPairs = Collections.unmodifiableList(pairs);
	}

	// CONVERSIONS

	/**
	 * Convert a value to a double.
	 *
	 * @param value value to convert
	 * @return the numeric value, or 0 if the value is not a number
	 */
	public static double toDouble(AwkValue value) {
		if (value instanceof AwkValue.Number) {
			return ((AwkValue.Number) value).getValue();
		}
		if (value instanceof AwkValue.Text) {
			return toDouble(((AwkValue.Text) value).getValue());
		}
		return 0;
	}

	/**
	 * Convert a string to a double, using its longest numeric prefix.
	 * "25fix" converts to 25, "fix" to 0.
	 *
	 * @param s string to convert
	 * @return the numeric value of the leading number in s, or 0
	 */
	public static double toDouble(String s) {
		int start = 0;
		while (start < s.length() && Character.isWhitespace(s.charAt(start))) {
			start++;
		}
		if (start == s.length()) {
			return 0;
		}
		// Double.parseDouble would also accept NaN, Infinity and hexadecimal forms
		char first = s.charAt(start);
		if (!(first >= '0' && first <= '9') && first != '.' && first != '-' && first != '+') {
			return 0;
		}

		// Optimization: a double cannot be longer than 26 chars when converted to String
		int length = Math.min(s.length(), start + 26);

		// Loop:
		// If conversion fails, try with one character less.
		while (length > start) {
			String candidate = s.substring(start, length);
			char last = candidate.charAt(candidate.length() - 1);
			// "1d" and "1f" are valid Java literals, but not AWK numbers
			if ((last >= '0' && last <= '9') || last == '.') {
				try {
					return Double.parseDouble(candidate);
				} catch (NumberFormatException nfe) {
					LOG.trace("'{}' is not a number", candidate);
				}
			}
			length--;
		}

		// Failed (not even with one char)
		return 0;
	}

	/**
	 * Determines whether a double value actually represents a long integer
	 * within the limits of floating point precision.
	 *
	 * @param d the double value to examine
	 * @return {@code true} if {@code d} is effectively an integer
	 */
	public static boolean isActuallyLong(double d) {
		double r = Math.rint(d);
		return Math.abs(d - r) < Math.ulp(d);
	}

	/**
	 * Convert a value to a string.
	 *
	 * @param value value to convert
	 * @return its string representation
	 */
	public static String toAwkString(AwkValue value) {
		if (value instanceof AwkValue.Number) {
			return toAwkString(((AwkValue.Number) value).getValue());
		}
		if (value instanceof AwkValue.Text) {
			return ((AwkValue.Text) value).getValue();
		}
		return "";
	}

	/**
	 * Convert a number to a string. Integers print without decimals. Other
	 * values print with enough decimals to show 6 significant digits, without
	 * trailing zeros. NaN and infinities use their default Java form.
	 *
	 * @param d number to convert
	 * @return its string representation
	 */
	public static String toAwkString(double d) {
		if (Double.isNaN(d) || Double.isInfinite(d)) {
			return Double.toString(d);
		}
		if (d == 0) {
			// also covers -0
			return "0";
		}
		if (isActuallyLong(d) && Math.abs(d) < 1e18) {
			// If an integer, represent it as an integer (no floating point and decimals)
			return Long.toString((long) Math.rint(d));
		}

		int integerDigits = (int) Math.floor(Math.log10(Math.abs(d))) + 1;
		int decimals = Math.max(0, 6 - integerDigits);
		String s = String.format(Locale.US, "%." + decimals + "f", d);
		// trim the trailing zeroes
		if (s.indexOf('.') > -1) {
			while (s.endsWith("0")) {
				s = s.substring(0, s.length() - 1);
			}
			if (s.endsWith(".")) {
				s = s.substring(0, s.length() - 1);
			}
		}
		return s;
	}

	/**
	 * Whether the value can be used as a number in a comparison: numbers,
	 * uninitialized values, and strings that are entirely a number (surrounding
	 * blanks allowed).
	 *
	 * @param value value to examine
	 * @return true if the value looks numeric
	 */
	public static boolean looksNumeric(AwkValue value) {
		if (!(value instanceof AwkValue.Text)) {
			return true;
		}
		String s = ((AwkValue.Text) value).getValue().trim();
		if (s.isEmpty()) {
			return false;
		}
		char first = s.charAt(0);
		if (!(first >= '0' && first <= '9') && first != '.' && first != '-' && first != '+') {
			return false;
		}
		try {
			new BigDecimal(s);
			return true;
		} catch (NumberFormatException nfe) {
			return false;
		}
	}

	/**
	 * AWK truth value: numbers (and numeric strings) are true when not zero,
	 * other strings when not empty, uninitialized values never.
	 *
	 * @param value value to examine
	 * @return its truth value
	 */
	public static boolean toBoolean(AwkValue value) {
		if (value instanceof AwkValue.Uninitialized) {
			return false;
		}
		if (looksNumeric(value)) {
			return toDouble(value) != 0;
		}
		return !toAwkString(value).isEmpty();
	}

	/**
	 * Compares two values. Both are compared as numbers if they both look
	 * numeric, otherwise as strings.
	 *
	 * @param v1 The 1st value.
	 * @param v2 the 2nd value.
	 * @param mode
	 *        <ul>
	 *        <li>&lt; 0 - Return true if v1 &lt; v2.
	 *        <li>0 - Return true if v1 == v2.
	 *        <li>&gt; 0 - Return true if v1 &gt; v2.
	 *        </ul>
	 * @return a boolean
	 */
	public static boolean compare(AwkValue v1, AwkValue v2, int mode) {
		if (looksNumeric(v1) && looksNumeric(v2)) {
			double d1 = toDouble(v1);
			double d2 = toDouble(v2);
			if (mode < 0) {
				return d1 < d2;
			} else if (mode == 0) {
				return d1 == d2;
			} else {
				return d1 > d2;
			}
		}

		String s1 = toAwkString(v1);
		String s2 = toAwkString(v2);
		// string equality usually occurs more often than natural ordering comparison
		if (mode == 0) {
			return s1.equals(s2);
		} else if (mode < 0) {
			return s1.compareTo(s2) < 0;
		} else {
			return s1.compareTo(s2) > 0;
		}
	}

	/**
	 * Expands the escape sequences of a string literal: {@code \n}, {@code \t},
	 * {@code \r}, {@code \\}, {@code \"} and {@code \/}. Any other escaped
	 * character stands for itself.
	 *
	 * @param raw literal text, as written in the script
	 * @return the expanded text
	 */
	public static String unescape(String raw) {
		if (raw.indexOf('\\') < 0) {
			return raw;
		}
		StringBuilder sb = new StringBuilder(raw.length());
		for (int i = 0; i < raw.length(); i++) {
			char c = raw.charAt(i);
			if (c != '\\' || i + 1 == raw.length()) {
				sb.append(c);
				continue;
			}
			char escaped = raw.charAt(++i);
			switch (escaped) {
			case 'n':
				sb.append('\n');
				break;
			case 't':
				sb.append('\t');
				break;
			case 'r':
				sb.append('\r');
				break;
			default:
				// \\, \", \/ and anything else
				sb.append(escaped);
				break;
			}
		}
		return sb.toString();
	}

	// RECORDS AND FIELDS

	/**
	 * Makes the specified record the current one and counts it in NR and FNR.
	 *
	 * @param record the new record
	 */
	public void consumeRecord(String record) {
		nr++;
		fnr++;
		setInputLine(record);
	}

	/**
	 * Replaces $0. Fields will be split again on next access.
	 *
	 * @param inputLine new value of $0
	 */
	public void setInputLine(String inputLine) {
		this.inputLine = inputLine;
		this.inputFields = null;
	}

	public String getInputLine() {
		return inputLine;
	}

	/**
	 * Splits $0 into $1, $2, etc. with the current FS.
	 * <p>
	 * A single space (the default) splits on runs of blanks and ignores
	 * leading and trailing blanks. An empty FS splits into characters. Any
	 * other value is a literal separator.
	 */
	public void jrtParseFields() {
		List<String> fields = new ArrayList<String>();
		fields.add(inputLine); // $0

		if (!inputLine.isEmpty()) {
			if (fs.equals(" ")) {
				StringTokenizer tokenizer = new StringTokenizer(inputLine);
				while (tokenizer.hasMoreTokens()) {
					fields.add(tokenizer.nextToken());
				}
			} else if (fs.isEmpty()) {
				for (int i = 0; i < inputLine.length(); i++) {
					fields.add(String.valueOf(inputLine.charAt(i)));
				}
			} else {
				int start = 0;
				int end;
				while ((end = inputLine.indexOf(fs, start)) >= 0) {
					fields.add(inputLine.substring(start, end));
					start = end + fs.length();
				}
				fields.add(inputLine.substring(start));
			}
		}

		inputFields = fields;
	}

	private List<String> getInputFields() {
		if (inputFields == null) {
			jrtParseFields();
		}
		return inputFields;
	}

	/**
	 * Retrieve the contents of a particular input field.
	 *
	 * @param fieldNum field number, 0 being the whole record
	 * @return contents of the field, or an empty string if there is no such
	 *         field
	 */
	public String jrtGetInputField(long fieldNum) {
		if (fieldNum == 0) {
			return inputLine;
		}
		if (fieldNum < 0) {
			LOG.warn("Field $({}) is incorrect, using an empty value", fieldNum);
			return "";
		}
		List<String> fields = getInputFields();
		if (fieldNum < fields.size()) {
			return fields.get((int) fieldNum);
		}
		return "";
	}

	/**
	 * Stores a value into an input field. Assigning a field beyond NF extends
	 * the record with empty fields. $0 is rebuilt with OFS, except when $0
	 * itself is assigned.
	 *
	 * @param value The RHS of the assignment.
	 * @param fieldNum field number to update.
	 */
	public void jrtSetInputField(String value, long fieldNum) {
		if (fieldNum == 0) {
			setInputLine(value);
			return;
		}
		if (fieldNum < 0 || fieldNum > Integer.MAX_VALUE) {
			LOG.warn("Field $({}) is incorrect, assignment ignored", fieldNum);
			return;
		}
		List<String> fields = getInputFields();
		int fieldIndex = (int) fieldNum;
		// append the list to accommodate the new value
		while (fields.size() <= fieldIndex) {
			fields.add("");
		}
		fields.set(fieldIndex, value);
		rebuildDollarZeroFromFields();
	}

	private void rebuildDollarZeroFromFields() {
		StringBuilder newDollarZeroSb = new StringBuilder();
		for (int i = 1; i < inputFields.size(); i++) {
			if (i > 1) {
				newDollarZeroSb.append(ofs);
			}
			newDollarZeroSb.append(inputFields.get(i));
		}
		inputLine = newDollarZeroSb.toString();
		inputFields.set(0, inputLine);
	}

	public int getNF() {
		return getInputFields().size() - 1;
	}

	/**
	 * Adjust the current input field list and $0 when NF is updated by the
	 * AWK script. Fields are either truncated or extended with empty values
	 * so that {@code NF} truly reflects the number of fields.
	 *
	 * @param nf New value for NF
	 */
	public void jrtSetNF(int nf) {
		if (nf < 0) {
			nf = 0;
		}
		List<String> fields = getInputFields();
		int currentNF = fields.size() - 1;

		if (nf < currentNF) {
			for (int i = currentNF; i > nf; i--) {
				fields.remove(i);
			}
		} else if (nf > currentNF) {
			for (int i = currentNF + 1; i <= nf; i++) {
				fields.add("");
			}
		}

		rebuildDollarZeroFromFields();
	}

	// VARIABLES

	/**
	 * Reads a scalar variable, special variables included.
	 *
	 * @param name name of the variable
	 * @return its value, {@link AwkValue#UNINITIALIZED} if never assigned
	 */
	public AwkValue getVariable(String name) {
		switch (name) {
		case "NR":
			return AwkValue.of((double) nr);
		case "FNR":
			return AwkValue.of((double) fnr);
		case "NF":
			return AwkValue.of((double) getNF());
		case "FS":
			return AwkValue.of(fs);
		case "OFS":
			return AwkValue.of(ofs);
		case "FILENAME":
			return AwkValue.of(filename);
		default:
			AwkValue value = variables.get(name);
			return value == null ? AwkValue.UNINITIALIZED : value;
		}
	}

	/**
	 * Assigns a scalar variable. Assigning a special variable updates the
	 * runtime accordingly (assigning NF truncates or extends the record).
	 *
	 * @param name name of the variable
	 * @param value new value
	 */
	public void setVariable(String name, AwkValue value) {
		switch (name) {
		case "NR":
			nr = (long) toDouble(value);
			break;
		case "FNR":
			fnr = (long) toDouble(value);
			break;
		case "NF":
			jrtSetNF((int) toDouble(value));
			break;
		case "FS":
			fs = toAwkString(value);
			break;
		case "OFS":
			ofs = toAwkString(value);
			break;
		case "FILENAME":
			filename = toAwkString(value);
			break;
		default:
			variables.put(name, value);
			break;
		}
	}

	/**
	 * @param name name of the array
	 * @param key subscript
	 * @return the element, {@link AwkValue#UNINITIALIZED} if absent
	 */
	public AwkValue getArrayElement(String name, String key) {
		Map<String, AwkValue> array = arrays.get(name);
		if (array == null) {
			return AwkValue.UNINITIALIZED;
		}
		AwkValue value = array.get(key);
		return value == null ? AwkValue.UNINITIALIZED : value;
	}

	public void setArrayElement(String name, String key, AwkValue value) {
		Map<String, AwkValue> array = arrays.get(name);
		if (array == null) {
			array = new HashMap<String, AwkValue>();
			arrays.put(name, array);
		}
		array.put(key, value);
	}

	public long getNR() {
		return nr;
	}

	public long getFNR() {
		return fnr;
	}

	public void setFS(String fs) {
		this.fs = fs;
	}

	public String getOFSString() {
		return ofs;
	}

	public void setFILENAME(String filename) {
		this.filename = filename;
	}

	/**
	 * @param ruleIndex position of the rule among the main rules
	 * @return the range state of that rule
	 */
	public ConditionPair getConditionPair(int ruleIndex) {
		return conditionPairs.get(ruleIndex);
	}
}
