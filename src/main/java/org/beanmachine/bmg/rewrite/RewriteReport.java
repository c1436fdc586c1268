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

package org.beanmachine.bmg.rewrite;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Outcome of running one fixer over a graph: the number of replacements
 * performed in each pass.
 */
public class RewriteReport
{
	private final String _fixerName;
	private final ArrayList<Integer> _replacementsPerPass;

	public RewriteReport(String fixerName) {
		_fixerName = fixerName;
		_replacementsPerPass = new ArrayList<Integer>();
	}

	void addPass(int numReplacements) {
		_replacementsPerPass.add(numReplacements);
	}

	public String getFixerName() {
		return _fixerName;
	}

	public int getNumPasses() {
		return _replacementsPerPass.size();
	}

	public List<Integer> getReplacementsPerPass() {
		return Collections.unmodifiableList(_replacementsPerPass);
	}

	public int getNumReplacements() {
		int ret = 0;
		for( int count : _replacementsPerPass )
			ret += count;
		return ret;
	}

	/**
	 * @return true if the last pass found nothing to fix
	 */
	public boolean reachedFixpoint() {
		return !_replacementsPerPass.isEmpty()
			&& _replacementsPerPass.get(_replacementsPerPass.size()-1) == 0;
	}

	@Override
	public String toString() {
		return _fixerName + ": " + getNumReplacements() + " replacements in "
			+ getNumPasses() + " passes " + _replacementsPerPass;
	}
}
