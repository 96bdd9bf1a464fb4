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
package net.sf.cramcodec;

import htsjdk.samtools.Cigar;
import htsjdk.samtools.util.StringUtil;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import net.sf.cramcodec.encoding.read_features.ReadFeature;
import net.sf.cramcodec.encoding.read_features.ReadFeatures;
import net.sf.cramcodec.encoding.reader.BamFlags;
import net.sf.cramcodec.encoding.reader.CramFlags;

/**
 * A decoded CRAM record. Instances are meant to be reused: the record reader
 * resets every field before decoding into it. Optional fields are null when
 * absent.
 */
public class CramRecord {
	private long id;
	private int flags;
	private int cramFlags;

	private Integer referenceSequenceId;
	private int readLength;
	private Integer alignmentStart;
	private Integer readGroupId;
	private String readName;

	private int mateFlags;
	private Integer mateReferenceSequenceId;
	private Integer mateAlignmentStart;
	private int templateLength;
	private Integer mateDistance;

	private List<ReadTag> tags = new ArrayList<ReadTag>();
	private List<ReadFeature> readFeatures = new ArrayList<ReadFeature>();
	private Integer mappingQuality;
	private byte[] readBases = new byte[0];
	private byte[] qualityScores = new byte[0];

	public void reset() {
		id = 0;
		flags = 0;
		cramFlags = 0;
		referenceSequenceId = null;
		readLength = 0;
		alignmentStart = null;
		readGroupId = null;
		readName = null;
		mateFlags = 0;
		mateReferenceSequenceId = null;
		mateAlignmentStart = null;
		templateLength = 0;
		mateDistance = null;
		tags = new ArrayList<ReadTag>();
		readFeatures = new ArrayList<ReadFeature>();
		mappingQuality = null;
		readBases = new byte[0];
		qualityScores = new byte[0];
	}

	public long getId() {
		return id;
	}

	public void setId(long id) {
		this.id = id;
	}

	/**
	 * @return the BAM flags
	 */
	public int getFlags() {
		return flags;
	}

	public void setFlags(int flags) {
		this.flags = flags;
	}

	public int getCramFlags() {
		return cramFlags;
	}

	public void setCramFlags(int cramFlags) {
		this.cramFlags = cramFlags;
	}

	public Integer getReferenceSequenceId() {
		return referenceSequenceId;
	}

	public void setReferenceSequenceId(Integer referenceSequenceId) {
		this.referenceSequenceId = referenceSequenceId;
	}

	public int getReadLength() {
		return readLength;
	}

	public void setReadLength(int readLength) {
		this.readLength = readLength;
	}

	/**
	 * @return 1-based alignment start or null for an unplaced record
	 */
	public Integer getAlignmentStart() {
		return alignmentStart;
	}

	public void setAlignmentStart(Integer alignmentStart) {
		this.alignmentStart = alignmentStart;
	}

	public Integer getReadGroupId() {
		return readGroupId;
	}

	public void setReadGroupId(Integer readGroupId) {
		this.readGroupId = readGroupId;
	}

	public String getReadName() {
		return readName;
	}

	public void setReadName(String readName) {
		this.readName = readName;
	}

	public int getMateFlags() {
		return mateFlags;
	}

	public void setMateFlags(int mateFlags) {
		this.mateFlags = mateFlags;
	}

	public Integer getMateReferenceSequenceId() {
		return mateReferenceSequenceId;
	}

	public void setMateReferenceSequenceId(Integer mateReferenceSequenceId) {
		this.mateReferenceSequenceId = mateReferenceSequenceId;
	}

	public Integer getMateAlignmentStart() {
		return mateAlignmentStart;
	}

	public void setMateAlignmentStart(Integer mateAlignmentStart) {
		this.mateAlignmentStart = mateAlignmentStart;
	}

	public int getTemplateLength() {
		return templateLength;
	}

	public void setTemplateLength(int templateLength) {
		this.templateLength = templateLength;
	}

	/**
	 * @return number of records between this one and its mate further down
	 *         the slice, as stored
	 */
	public Integer getMateDistance() {
		return mateDistance;
	}

	public void setMateDistance(Integer mateDistance) {
		this.mateDistance = mateDistance;
	}

	public List<ReadTag> getTags() {
		return tags;
	}

	public void setTags(List<ReadTag> tags) {
		this.tags = tags;
	}

	public ReadTag getTag(String key) {
		for (ReadTag tag : tags)
			if (tag.getKey().equals(key))
				return tag;
		return null;
	}

	public List<ReadFeature> getReadFeatures() {
		return readFeatures;
	}

	public void setReadFeatures(List<ReadFeature> readFeatures) {
		this.readFeatures = readFeatures;
	}

	public Integer getMappingQuality() {
		return mappingQuality;
	}

	public void setMappingQuality(Integer mappingQuality) {
		this.mappingQuality = mappingQuality;
	}

	public byte[] getReadBases() {
		return readBases;
	}

	public void setReadBases(byte[] readBases) {
		this.readBases = readBases;
	}

	/**
	 * @return quality scores, empty if none were stored
	 */
	public byte[] getQualityScores() {
		return qualityScores;
	}

	public void setQualityScores(byte[] qualityScores) {
		this.qualityScores = qualityScores;
	}

	public boolean isSegmentUnmapped() {
		return (flags & BamFlags.READ_UNMAPPED_FLAG) != 0;
	}

	public boolean isNegativeStrand() {
		return (flags & BamFlags.READ_STRAND_FLAG) != 0;
	}

	public boolean isMateUnmapped() {
		return (flags & BamFlags.MATE_UNMAPPED_FLAG) != 0;
	}

	public boolean isMateNegativeStrand() {
		return (flags & BamFlags.MATE_STRAND_FLAG) != 0;
	}

	public boolean isForcePreserveQualityScores() {
		return (cramFlags & CramFlags.FORCE_PRESERVE_QS_FLAG) != 0;
	}

	public boolean isDetached() {
		return (cramFlags & CramFlags.DETACHED_FLAG) != 0;
	}

	public boolean isHasMateDownStream() {
		return (cramFlags & CramFlags.HAS_MATE_DOWNSTREAM_FLAG) != 0;
	}

	public boolean isUnknownBases() {
		return (cramFlags & CramFlags.UNKNOWN_BASES) != 0;
	}

	public Cigar getCigar() {
		return ReadFeatures.toCigar(readFeatures, readLength);
	}

	/**
	 * @return 1-based inclusive alignment end or null if the record is not
	 *         placed
	 */
	public Integer getAlignmentEnd() {
		if (alignmentStart == null)
			return null;
		return alignmentStart + getCigar().getReferenceLength() - 1;
	}

	@Override
	public String toString() {
		StringBuffer sb = new StringBuffer("[");
		sb.append("id=").append(id);
		if (readName != null)
			sb.append("; ").append(readName);
		sb.append("; flags=").append(flags);
		sb.append("; cramFlags=").append(cramFlags);
		sb.append("; ref=").append(referenceSequenceId);
		sb.append("; start=").append(alignmentStart);
		sb.append("; readLength=").append(readLength);
		sb.append("; mappingQuality=").append(mappingQuality);

		for (ReadFeature feature : readFeatures)
			sb.append("; ").append(feature.toString());
		for (ReadTag tag : tags)
			sb.append("; ").append(tag.toString());

		if (readBases.length > 0)
			sb.append("; ").append("bases: ").append(StringUtil.bytesToString(readBases));
		if (qualityScores.length > 0)
			sb.append("; ").append("qscores: ").append(Arrays.toString(qualityScores));

		sb.append("]");
		return sb.toString();
	}
}
