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

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

import net.sf.cramcodec.MissingDataSeriesEncodingException;
import net.sf.cramcodec.encoding.Encoding;

/**
 * At most one encoding per data series. A series without an encoding is only
 * an error once a record actually needs it.
 */
public class DataSeriesEncodings {
	private final Map<DataSeries, Encoding<?>> encodings = new EnumMap<DataSeries, Encoding<?>>(DataSeries.class);

	/**
	 * @throws IllegalArgumentException
	 *             if the encoding produces values of another type than the
	 *             series holds
	 */
	DataSeriesEncodings put(DataSeries series, Encoding<?> encoding) {
		if (encoding.valueType() != series.getType())
			throw new IllegalArgumentException(String.format("Data series %s holds %s values but %s produces %s.",
					series.name(), series.getType(), encoding, encoding.valueType()));

		encodings.put(series, encoding);
		return this;
	}

	public boolean contains(DataSeries series) {
		return encodings.containsKey(series);
	}

	/**
	 * @return the encoding or null if the series has none
	 */
	@SuppressWarnings("unchecked")
	public <T> Encoding<T> get(DataSeries series) {
		return (Encoding<T>) encodings.get(series);
	}

	public <T> Encoding<T> getRequired(DataSeries series) throws MissingDataSeriesEncodingException {
		Encoding<T> encoding = get(series);
		if (encoding == null)
			throw new MissingDataSeriesEncodingException(series);
		return encoding;
	}

	public Map<DataSeries, Encoding<?>> asMap() {
		return Collections.unmodifiableMap(encodings);
	}
}
