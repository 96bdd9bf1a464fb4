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

import java.io.IOException;

/**
 * Reads bits most significant first. All reads are forward only.
 */
public interface BitInputStream {

	public boolean readBit() throws IOException;

	/**
	 * @param length
	 *            number of bits to read, 0 to 32
	 * @return the bits as an unsigned value, first bit read being the most
	 *         significant
	 */
	public int readBits(int length) throws IOException;

	public long readLongBits(int length) throws IOException;

	/**
	 * @return number of bits consumed so far
	 */
	public long getPosition();

	public boolean endOfStream();
}
