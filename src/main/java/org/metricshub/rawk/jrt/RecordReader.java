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

import java.io.BufferedInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CharsetDecoder;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.util.Iterator;
import java.util.NoSuchElementException;
import org.metricshub.rawk.util.AwkLogger;
import org.slf4j.Logger;

/**
 * Reads records, one per line, from a byte stream.
 * <p>
 * Each line is read only when the next record is requested, so records
 * piped from an interactive source are processed as they arrive. Lines end
 * with {@code \n}, and a {@code \r} before it is dropped. The records end
 * with the stream, or with the first line that is not valid UTF-8.
 * <p>
 * Bytes are taken one at a time from a buffer, so the underlying stream
 * sees bulk reads only.
 */
public class RecordReader implements Iterator<String> {

	private static final Logger LOG = AwkLogger.getLogger(RecordReader.class);

	private final InputStream input;
	private final CharsetDecoder decoder = StandardCharsets.UTF_8
			.newDecoder()
			.onMalformedInput(CodingErrorAction.REPORT)
			.onUnmappableCharacter(CodingErrorAction.REPORT);
	private final ByteArrayOutputStream lineBuffer = new ByteArrayOutputStream();

	private String nextRecord;
	private boolean finished;
	private long lineCount;

	/**
	 * @param input stream to read records from, not closed by this reader.
	 *        It is buffered here unless it already is a
	 *        {@link BufferedInputStream}.
	 */
	public RecordReader(InputStream input) {
		this.input = input instanceof BufferedInputStream ? input : new BufferedInputStream(input);
	}

	@Override
	public boolean hasNext() {
		if (nextRecord == null && !finished) {
			nextRecord = readRecord();
		}
		return nextRecord != null;
	}

	@Override
	public String next() {
		if (!hasNext()) {
			throw new NoSuchElementException();
		}
		String record = nextRecord;
		nextRecord = null;
		return record;
	}

	/**
	 * @return the next line, or null once the input is over
	 */
	private String readRecord() {
		lineBuffer.reset();
		boolean endOfStream = false;
		try {
			int b;
			while ((b = input.read()) != '\n') {
				if (b < 0) {
					endOfStream = true;
					break;
				}
				lineBuffer.write(b);
			}
		} catch (IOException e) {
			throw new UncheckedIOException("Failed to read input records", e);
		}

		if (endOfStream) {
			finished = true;
			// last line without a line terminator
			if (lineBuffer.size() == 0) {
				LOG.debug("End of input after {} records", lineCount);
				return null;
			}
		}

		byte[] bytes = lineBuffer.toByteArray();
		int length = bytes.length;
		if (length > 0 && bytes[length - 1] == '\r') {
			length--;
		}

		String record;
		try {
			record = decoder.decode(ByteBuffer.wrap(bytes, 0, length)).toString();
		} catch (CharacterCodingException e) {
			LOG.warn("Input line {} is not valid UTF-8, ignoring the rest of the input", lineCount + 1);
			LOG.debug("Decoding failure", e);
			finished = true;
			return null;
		}
		lineCount++;
		return record;
	}
}
