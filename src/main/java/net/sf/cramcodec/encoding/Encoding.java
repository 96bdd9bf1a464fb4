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

import net.sf.cramcodec.InvalidDataException;
import net.sf.cramcodec.io.BitInputStream;
import net.sf.cramcodec.io.BitOutputStream;
import net.sf.cramcodec.structure.ExternalDataReaders;
import net.sf.cramcodec.structure.ExternalDataWriters;

/**
 * An immutable codec choice for one data series or tag. Encodings belong to a
 * compression header and are shared by every reader decoding against it.
 * 
 * @param <T>
 *            the decoded value type
 */
public final class Encoding<T> {
	private final BitCodec<T> codec;

	public Encoding(BitCodec<T> codec) {
		if (codec == null)
			throw new NullPointerException("Codec cannot be null.");
		this.codec = codec;
	}

	public EncodingID id() {
		return codec.id();
	}

	public DataSeriesType valueType() {
		return codec.valueType();
	}

	public BitCodec<T> getCodec() {
		return codec;
	}

	public T decode(BitInputStream core, ExternalDataReaders external) throws IOException {
		return codec.read(core, external);
	}

	/**
	 * Decodes a run of <code>length</code> byte values.
	 */
	public byte[] decodeArray(BitInputStream core, ExternalDataReaders external, int length) throws IOException {
		if (length < 0)
			throw new InvalidDataException("Negative array length: " + length);
		return codec.readArray(core, external, length);
	}

	public void encode(BitOutputStream core, ExternalDataWriters external, T value) throws IOException {
		codec.write(core, external, value);
	}

	public EncodingParams toParams() {
		return new EncodingParams(codec.id(), codec.toByteArray());
	}

	@Override
	public boolean equals(Object obj) {
		if (!(obj instanceof Encoding))
			return false;
		return codec.equals(((Encoding<?>) obj).codec);
	}

	@Override
	public int hashCode() {
		return codec.hashCode();
	}

	@Override
	public String toString() {
		return codec.toString();
	}
}
