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
package net.sf.cramcodec.structure;

import htsjdk.samtools.util.Log;

import java.io.EOFException;
import java.io.IOException;
import java.nio.ByteBuffer;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

import net.sf.cramcodec.InvalidDataException;
import net.sf.cramcodec.encoding.Encoding;
import net.sf.cramcodec.encoding.EncodingFactory;
import net.sf.cramcodec.encoding.EncodingParams;
import net.sf.cramcodec.io.ByteBufferUtils;

/**
 * Everything the records of a container share: what was preserved, how each
 * data series is encoded and how each tag is encoded. Immutable once built,
 * so one instance may serve several record readers at once.
 */
public class CompressionHeader {
	private static final Log log = Log.getInstance(CompressionHeader.class);

	private final boolean readNamesIncluded;
	private final boolean apDelta;
	private final boolean referenceRequired;
	private final SubstitutionMatrix substitutionMatrix;
	private final List<List<TagKey>> tagIdDictionary;
	private final DataSeriesEncodings dataSeriesEncodings;
	private final Map<Integer, Encoding<byte[]>> tagEncodings;

	private CompressionHeader(Builder builder) {
		this.readNamesIncluded = builder.readNamesIncluded;
		this.apDelta = builder.apDelta;
		this.referenceRequired = builder.referenceRequired;
		this.substitutionMatrix = builder.substitutionMatrix;

		List<List<TagKey>> dictionary = new ArrayList<List<TagKey>>(builder.tagIdDictionary.size());
		for (List<TagKey> keys : builder.tagIdDictionary)
			dictionary.add(Collections.unmodifiableList(new ArrayList<TagKey>(keys)));
		this.tagIdDictionary = Collections.unmodifiableList(dictionary);

		this.dataSeriesEncodings = new DataSeriesEncodings();
		for (Map.Entry<DataSeries, Encoding<?>> entry : builder.dataSeriesEncodings.asMap().entrySet())
			this.dataSeriesEncodings.put(entry.getKey(), entry.getValue());

		this.tagEncodings = Collections.unmodifiableMap(new TreeMap<Integer, Encoding<byte[]>>(builder.tagEncodings));
	}

	public static Builder builder() {
		return new Builder();
	}

	/**
	 * Whether records carry their names; otherwise names are only decoded for
	 * detached records.
	 */
	public boolean isReadNamesIncluded() {
		return readNamesIncluded;
	}

	/**
	 * Whether alignment starts are stored as the difference to the previous
	 * record's start.
	 */
	public boolean isApDelta() {
		return apDelta;
	}

	public boolean isReferenceRequired() {
		return referenceRequired;
	}

	public SubstitutionMatrix getSubstitutionMatrix() {
		return substitutionMatrix;
	}

	public List<List<TagKey>> getTagIdDictionary() {
		return tagIdDictionary;
	}

	/**
	 * @return the tag keys of the set or null if there is no such set
	 */
	public List<TagKey> getTagSet(int tagSetId) {
		if (tagSetId < 0 || tagSetId >= tagIdDictionary.size())
			return null;
		return tagIdDictionary.get(tagSetId);
	}

	/**
	 * The returned table is read-only, it is filled only while the header is
	 * built.
	 */
	public DataSeriesEncodings getDataSeriesEncodings() {
		return dataSeriesEncodings;
	}

	public Map<Integer, Encoding<byte[]>> getTagEncodings() {
		return tagEncodings;
	}

	public Encoding<byte[]> getTagEncoding(int contentId) {
		return tagEncodings.get(contentId);
	}

	/**
	 * Parses an uncompressed compression header block: the preservation map,
	 * the data series encoding map and the tag encoding map.
	 */
	public static CompressionHeader read(byte[] data) throws IOException {
		ByteBuffer buf = ByteBuffer.wrap(data);
		Builder builder = builder();
		EncodingFactory factory = new EncodingFactory();

		readPreservationMap(nextMap(buf), builder);
		readDataSeriesMap(nextMap(buf), builder, factory);
		readTagEncodingMap(nextMap(buf), builder, factory);

		CompressionHeader header = builder.build();
		log.debug(String.format("Compression header: %d data series, %d tag encodings, %d tag sets",
				header.dataSeriesEncodings.asMap().size(), header.tagEncodings.size(), header.tagIdDictionary.size()));
		return header;
	}

	private static ByteBuffer nextMap(ByteBuffer buf) throws EOFException, InvalidDataException {
		int size = ByteBufferUtils.readUnsignedITF8(buf);
		if (size < 0)
			throw new InvalidDataException("Negative map size: " + size);
		return ByteBuffer.wrap(ByteBufferUtils.readFully(buf, size));
	}

	private static void readPreservationMap(ByteBuffer buf, Builder builder) throws IOException {
		int count = ByteBufferUtils.readUnsignedITF8(buf);
		for (int i = 0; i < count; i++) {
			String key = readTwoCharKey(buf);

			if ("RN".equals(key))
				builder.readNamesIncluded(readBoolean(buf, key));
			else if ("AP".equals(key))
				builder.apDelta(readBoolean(buf, key));
			else if ("RR".equals(key))
				builder.referenceRequired(readBoolean(buf, key));
			else if ("SM".equals(key))
				builder.substitutionMatrix(new SubstitutionMatrix(ByteBufferUtils.readFully(buf, 5)));
			else if ("TD".equals(key)) {
				int size = ByteBufferUtils.readUnsignedITF8(buf);
				if (size < 0)
					throw new InvalidDataException("Negative tag dictionary size: " + size);
				builder.tagIdDictionary(parseTagIdDictionary(ByteBufferUtils.readFully(buf, size)));
			} else
				throw new InvalidDataException("Unknown preservation map key: " + key);
		}
	}

	private static boolean readBoolean(ByteBuffer buf, String key) throws EOFException, InvalidDataException {
		int value = ByteBufferUtils.readUnsignedByte(buf);
		if (value > 1)
			throw new InvalidDataException(String.format("Invalid boolean %d for preservation map key %s.", value, key));
		return value == 1;
	}

	/**
	 * Tag sets are NUL terminated runs of 3 byte keys: two name characters and
	 * the value type.
	 */
	static List<List<TagKey>> parseTagIdDictionary(byte[] bytes) throws InvalidDataException {
		List<List<TagKey>> dictionary = new ArrayList<List<TagKey>>();
		int start = 0;
		for (int i = 0; i < bytes.length; i++) {
			if (bytes[i] != 0)
				continue;

			int length = i - start;
			if (length % 3 != 0)
				throw new InvalidDataException("Tag set length is not a multiple of 3: " + length);

			List<TagKey> keys = new ArrayList<TagKey>(length / 3);
			for (int j = start; j < i; j += 3)
				keys.add(TagKey.fromBytes(bytes, j));
			dictionary.add(keys);
			start = i + 1;
		}

		if (start != bytes.length)
			throw new InvalidDataException("Unterminated tag set in tag dictionary.");

		return dictionary;
	}

	private static void readDataSeriesMap(ByteBuffer buf, Builder builder, EncodingFactory factory) throws IOException {
		int count = ByteBufferUtils.readUnsignedITF8(buf);
		for (int i = 0; i < count; i++) {
			String key = readTwoCharKey(buf);
			DataSeries series = DataSeries.byKey(key);
			if (series == null) {
				int codecId = ByteBufferUtils.readUnsignedITF8(buf);
				int size = ByteBufferUtils.readUnsignedITF8(buf);
				if (size < 0)
					throw new InvalidDataException("Negative parameter size: " + size);
				ByteBufferUtils.readFully(buf, size);
				log.warn(String.format("Skipping encoding of unknown data series %s (codec %d).", key, codecId));
				continue;
			}

			EncodingParams params = EncodingFactory.readNested(buf);
			builder.dataSeries(series, factory.createEncoding(series.getType(), params));
		}
	}

	private static void readTagEncodingMap(ByteBuffer buf, Builder builder, EncodingFactory factory)
			throws IOException {
		int count = ByteBufferUtils.readUnsignedITF8(buf);
		for (int i = 0; i < count; i++) {
			int contentId = ByteBufferUtils.readUnsignedITF8(buf);
			EncodingParams params = EncodingFactory.readNested(buf);
			builder.tagEncoding(contentId, factory.createByteArrayEncoding(params));
		}
	}

	private static String readTwoCharKey(ByteBuffer buf) throws EOFException {
		char c0 = (char) ByteBufferUtils.readUnsignedByte(buf);
		char c1 = (char) ByteBufferUtils.readUnsignedByte(buf);
		return new String(new char[] { c0, c1 });
	}

	public static class Builder {
		private boolean readNamesIncluded = true;
		private boolean apDelta = true;
		private boolean referenceRequired = true;
		private SubstitutionMatrix substitutionMatrix = new SubstitutionMatrix();
		private List<List<TagKey>> tagIdDictionary = new ArrayList<List<TagKey>>();
		private final DataSeriesEncodings dataSeriesEncodings = new DataSeriesEncodings();
		private final Map<Integer, Encoding<byte[]>> tagEncodings = new TreeMap<Integer, Encoding<byte[]>>();

		private Builder() {
		}

		public Builder readNamesIncluded(boolean readNamesIncluded) {
			this.readNamesIncluded = readNamesIncluded;
			return this;
		}

		public Builder apDelta(boolean apDelta) {
			this.apDelta = apDelta;
			return this;
		}

		public Builder referenceRequired(boolean referenceRequired) {
			this.referenceRequired = referenceRequired;
			return this;
		}

		public Builder substitutionMatrix(SubstitutionMatrix substitutionMatrix) {
			this.substitutionMatrix = substitutionMatrix;
			return this;
		}

		public Builder tagIdDictionary(List<List<TagKey>> tagIdDictionary) {
			this.tagIdDictionary = tagIdDictionary;
			return this;
		}

		public Builder dataSeries(DataSeries series, Encoding<?> encoding) {
			dataSeriesEncodings.put(series, encoding);
			return this;
		}

		public Builder tagEncoding(int contentId, Encoding<byte[]> encoding) {
			tagEncodings.put(contentId, encoding);
			return this;
		}

		public Builder tagEncoding(TagKey key, Encoding<byte[]> encoding) {
			return tagEncoding(key.getContentId(), encoding);
		}

		public CompressionHeader build() {
			return new CompressionHeader(this);
		}
	}
}
