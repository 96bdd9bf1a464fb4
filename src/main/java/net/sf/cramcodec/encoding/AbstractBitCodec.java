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

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.util.Arrays;

import net.sf.cramcodec.CodecNotImplementedException;
import net.sf.cramcodec.io.BitInputStream;
import net.sf.cramcodec.io.ByteBufferUtils;
import net.sf.cramcodec.structure.ExternalDataReaders;

public abstract class AbstractBitCodec<T> implements BitCodec<T> {

	@Override
	public byte[] readArray(BitInputStream core, ExternalDataReaders external, int length) throws IOException {
		throw new CodecNotImplementedException(id(), "readArray");
	}

	/**
	 * Serializes a sequence of ITF8 parameters.
	 */
	protected static byte[] toITF8Params(int... values) {
		ByteArrayOutputStream baos = new ByteArrayOutputStream();
		for (int value : values) {
			try {
				ByteBufferUtils.writeUnsignedITF8(value, baos);
			} catch (IOException e) {
				throw new IllegalStateException(e);
			}
		}
		return baos.toByteArray();
	}

	@Override
	public boolean equals(Object obj) {
		if (obj == null || obj.getClass() != getClass())
			return false;

		return Arrays.equals(toByteArray(), ((BitCodec<?>) obj).toByteArray());
	}

	@Override
	public int hashCode() {
		return 31 * id().hashCode() + Arrays.hashCode(toByteArray());
	}

	@Override
	public String toString() {
		return getClass().getSimpleName() + Arrays.toString(toByteArray());
	}
}
