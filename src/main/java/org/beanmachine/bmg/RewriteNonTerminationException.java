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

package org.beanmachine.bmg;

/**
 * Raised when a fixer keeps producing replacements beyond the configured
 * pass ceiling.
 */
public class RewriteNonTerminationException extends BMGCompilerException
{
	private static final long serialVersionUID = 8107741233970360531L;

	private final String _fixerName;
	private final int _passes;

	public RewriteNonTerminationException(String fixerName, int passes) {
		super("Fixer " + fixerName + " did not reach a fixpoint within " + passes + " passes.");
		_fixerName = fixerName;
		_passes = passes;
	}

	public String getFixerName() {
		return _fixerName;
	}

	public int getPasses() {
		return _passes;
	}
}
