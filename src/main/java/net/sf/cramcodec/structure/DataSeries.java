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

import net.sf.cramcodec.encoding.DataSeriesType;

/**
 * Per-record columns of a slice, keyed by the two character code used in the
 * compression header.
 */
public enum DataSeries {
	BF_BamFlags(DataSeriesType.INT),
	CF_CramFlags(DataSeriesType.INT),
	RI_ReferenceSequenceId(DataSeriesType.INT),
	RL_ReadLength(DataSeriesType.INT),
	AP_AlignmentStart(DataSeriesType.INT),
	RG_ReadGroup(DataSeriesType.INT),
	RN_ReadName(DataSeriesType.BYTE_ARRAY),
	MF_MateFlags(DataSeriesType.INT),
	NS_MateReferenceSequenceId(DataSeriesType.INT),
	NP_MateAlignmentStart(DataSeriesType.INT),
	TS_TemplateLength(DataSeriesType.INT),
	NF_MateDistance(DataSeriesType.INT),
	TL_TagSetId(DataSeriesType.INT),
	FN_FeatureCount(DataSeriesType.INT),
	FC_FeatureCode(DataSeriesType.BYTE),
	FP_FeaturePositionDelta(DataSeriesType.INT),
	BA_Base(DataSeriesType.BYTE),
	QS_QualityScore(DataSeriesType.BYTE),
	BS_BaseSubstitutionCode(DataSeriesType.BYTE),
	IN_Insertion(DataSeriesType.BYTE_ARRAY),
	DL_DeletionLength(DataSeriesType.INT),
	RS_ReferenceSkipLength(DataSeriesType.INT),
	SC_SoftClip(DataSeriesType.BYTE_ARRAY),
	PD_PaddingLength(DataSeriesType.INT),
	HC_HardClipLength(DataSeriesType.INT),
	MQ_MappingQuality(DataSeriesType.INT),
	BB_StretchesOfBases(DataSeriesType.BYTE_ARRAY),
	QQ_StretchesOfQualityScores(DataSeriesType.BYTE_ARRAY);

	private final DataSeriesType type;

	private DataSeries(DataSeriesType type) {
		this.type = type;
	}

	public DataSeriesType getType() {
		return type;
	}

	public String getKey() {
		return name().substring(0, 2);
	}

	public byte[] getKeyBytes() {
		return new byte[] { (byte) name().charAt(0), (byte) name().charAt(1) };
	}

	/**
	 * @return the data series or null if the key is unknown
	 */
	public static DataSeries byKey(String key) {
		for (DataSeries s : values())
			if (s.getKey().equals(key))
				return s;
		return null;
	}
}
