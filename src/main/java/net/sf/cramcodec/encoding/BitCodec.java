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
package net.sf.cramcodec.encoding;

import java.io.IOException;

import net.sf.cramcodec.io.BitInputStream;
import net.sf.cramcodec.io.BitOutputStream;
import net.sf.cramcodec.structure.ExternalDataReaders;
import net.sf.cramcodec.structure.ExternalDataWriters;

/**
 * A codec is immutable and holds no stream state: the core and external
 * cursors are passed in on every call so one codec can serve any number of
 * slices at once.
 * 
 * @param <T>
 *            the decoded value type
 */
public interface BitCodec<T> {

	public EncodingID id();

	public DataSeriesType valueType();

	/**
	 * @return the codec parameters in their compression header form
	 */
	public byte[] toByteArray();

	public T read(BitInputStream core, ExternalDataReaders external) throws IOException;

	/**
	 * Reads <code>length</code> consecutive byte values. Implementations
	 * must not allocate more than the streams can still supply, so a corrupt
	 * length fails with an {@link java.io.EOFException}.
	 */
	public byte[] readArray(BitInputStream core, ExternalDataReaders external, int length) throws IOException;

	public void write(BitOutputStream core, ExternalDataWriters external, T value) throws IOException;
}
