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
package net.sf.cramcodec.encoding.reader;

/**
 * CRAM specific flags (CF) and mate flags (MF).
 */
public class CramFlags {
	public static final int FORCE_PRESERVE_QS_FLAG = 0x1;
	public static final int DETACHED_FLAG = 0x2;
	public static final int HAS_MATE_DOWNSTREAM_FLAG = 0x4;
	public static final int UNKNOWN_BASES = 0x8;

	public static final int MATE_NEG_STRAND_FLAG = 0x1;
	public static final int MATE_UNMAPPED_FLAG = 0x2;
}
