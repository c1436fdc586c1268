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

package org.beanmachine.bmg.plan;

import java.util.Arrays;

public class BNodeQuery extends BNode
{
	//position of this query in the inference result
	private final int _queryIndex;

	public BNodeQuery(long id, int queryIndex, BNode input) {
		super(id, NodeKind.QUERY, Arrays.asList(input));
		_queryIndex = queryIndex;
	}

	public int getQueryIndex() {
		return _queryIndex;
	}

	@Override
	public String getPayload() {
		return Integer.toString(_queryIndex);
	}

	@Override
	public String toString() {
		return "query(" + getID() + " #" + _queryIndex + ")";
	}
}
