/*******************************************************************************
 * Copyright 2013 EMBL-EBI
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *   http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 ******************************************************************************/
package net.sf.cramcodec.io;

import java.io.Closeable;
import java.io.Flushable;
import java.io.IOException;

public interface BitOutputStream extends Closeable, Flushable {

	/**
	 * Writes the lowest <code>nofBitsToWrite</code> bits of
	 * <code>bitContainer</code>, most significant first.
	 */
	public void write(int bitContainer, int nofBitsToWrite) throws IOException;

	public void write(long bitContainer, int nofBitsToWrite) throws IOException;

	public void write(boolean bit) throws IOException;

	public void write(boolean bit, long repeat) throws IOException;

	/**
	 * Pads the last partial byte with zero bits and writes it out.
	 */
	@Override
	public void flush() throws IOException;
}
