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
import java.io.EOFException;
import java.io.IOException;
import java.nio.ByteBuffer;

import net.sf.cramcodec.CodecNotImplementedException;
import net.sf.cramcodec.io.BitInputStream;
import net.sf.cramcodec.io.BitOutputStream;
import net.sf.cramcodec.io.ByteBufferUtils;
import net.sf.cramcodec.structure.ExternalDataReaders;
import net.sf.cramcodec.structure.ExternalDataWriters;

/**
 * Bytes from an external block up to a stop byte. The stop byte is consumed
 * but not returned.
 */
public class ByteArrayStopCodec extends AbstractBitCodec<byte[]> {
	private final byte stopByte;
	private final int contentId;

	public ByteArrayStopCodec(byte stopByte, int contentId) {
		this.stopByte = stopByte;
		this.contentId = contentId;
	}

	public byte getStopByte() {
		return stopByte;
	}

	public int getContentId() {
		return contentId;
	}

	@Override
	public EncodingID id() {
		return EncodingID.BYTE_ARRAY_STOP;
	}

	@Override
	public DataSeriesType valueType() {
		return DataSeriesType.BYTE_ARRAY;
	}

	@Override
	public byte[] toByteArray() {
		ByteArrayOutputStream baos = new ByteArrayOutputStream();
		baos.write(stopByte);
		byte[] id = ByteBufferUtils.writeUnsignedITF8(contentId);
		baos.write(id, 0, id.length);
		return baos.toByteArray();
	}

	@Override
	public byte[] read(BitInputStream core, ExternalDataReaders external) throws IOException {
		ByteBuffer buf = external.get(contentId);
		int start = buf.position();
		for (int i = start; i < buf.limit(); i++) {
			if (buf.get(i) == stopByte) {
				byte[] value = ByteBufferUtils.readFully(buf, i - start);
				buf.get();
				return value;
			}
		}

		throw new EOFException(String.format("Stop byte %d not found in external block %d.", stopByte & 0xFF,
				contentId));
	}

	@Override
	public void write(BitOutputStream core, ExternalDataWriters external, byte[] value) throws IOException {
		throw new CodecNotImplementedException(id(), "write");
	}
}
