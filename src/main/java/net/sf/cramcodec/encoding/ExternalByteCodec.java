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
import net.sf.cramcodec.io.ByteBufferUtils;
import net.sf.cramcodec.structure.ExternalDataReaders;
import net.sf.cramcodec.structure.ExternalDataWriters;

/**
 * Raw bytes in the external block with the given content id.
 */
public class ExternalByteCodec extends AbstractBitCodec<Byte> {
	private final int contentId;

	public ExternalByteCodec(int contentId) {
		this.contentId = contentId;
	}

	public int getContentId() {
		return contentId;
	}

	@Override
	public EncodingID id() {
		return EncodingID.EXTERNAL;
	}

	@Override
	public DataSeriesType valueType() {
		return DataSeriesType.BYTE;
	}

	@Override
	public byte[] toByteArray() {
		return toITF8Params(contentId);
	}

	@Override
	public Byte read(BitInputStream core, ExternalDataReaders external) throws IOException {
		return (byte) ByteBufferUtils.readUnsignedByte(external.get(contentId));
	}

	@Override
	public byte[] readArray(BitInputStream core, ExternalDataReaders external, int length) throws IOException {
		return ByteBufferUtils.readFully(external.get(contentId), length);
	}

	@Override
	public void write(BitOutputStream core, ExternalDataWriters external, Byte value) throws IOException {
		external.get(contentId).write(value);
	}
}
