/*
 * Licensed to the Apache Software Foundation (ASF) under one
 * or more contributor license agreements.  See the NOTICE file
 * distributed with this work for additional information
 * regarding copyright ownership.  The ASF licenses this file
 * to you under the Apache License, Version 2.0 (the
 * "License"); you may not use this file except in compliance
 * with the License.  You may obtain a copy of the License at
 *
 *   http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing,
 * software distributed under the License is distributed on an
 * "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY
 * KIND, either express or implied.  See the License for the
 * specific language governing permissions and limitations
 * under the License.
 */

package org.beanmachine.bmg.utils;

/**
 * Monotonic id generator. Graphs own one instance each, so node ids of two
 * separately built but identical graphs coincide.
 */
public class IDSequence
{
	private long _current;

	public IDSequence() {
		reset();
	}

	public long getNextID() {
		return _current++;
	}

	/**
	 * Makes sure ids handed out later are larger than the given one,
	 * as needed when nodes with externally assigned ids are loaded.
	 */
	public void advanceTo(long id) {
		if( id >= _current )
			_current = id + 1;
	}

	public void reset() {
		_current = 0;
	}
}
