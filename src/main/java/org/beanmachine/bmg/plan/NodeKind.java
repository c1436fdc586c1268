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

/**
 * Closed set of node kinds of a Bean Machine Graph. Each kind fixes the
 * number of operands its nodes take; {@link #UNBOUNDED} marks n-ary kinds.
 */
public enum NodeKind
{
	//leaf values
	CONSTANT("const", 0, 0),

	//distributions
	NORMAL("Normal", 2, 2),
	BETA("Beta", 2, 2),
	BERNOULLI("Bernoulli", 1, 1),
	GAMMA("Gamma", 2, 2),

	//stochastic and model roots
	SAMPLE("Sample", 1, 1),
	OBSERVE("Observe", 2, 2),
	QUERY("Query", 1, 1),

	//arithmetic operators
	ADDITION("+", 2, 2),
	MULTI_ADDITION("+", 2, NodeKind.UNBOUNDED),
	MULTIPLICATION("*", 2, 2),
	MULTI_MULTIPLICATION("*", 2, NodeKind.UNBOUNDED),
	NEGATE("-", 1, 1),
	COMPLEMENT("complement", 1, 1),
	EXP("exp", 1, 1),
	LOG("log", 1, 1),
	LOGSUMEXP("logsumexp", 1, NodeKind.UNBOUNDED);

	public static final int UNBOUNDED = -1;

	private final String _label;
	private final int _minArity;
	private final int _maxArity;

	private NodeKind(String label, int minArity, int maxArity) {
		_label = label;
		_minArity = minArity;
		_maxArity = maxArity;
	}

	public String getLabel() {
		return _label;
	}

	public boolean acceptsArity(int numInputs) {
		return numInputs >= _minArity
			&& (_maxArity == UNBOUNDED || numInputs <= _maxArity);
	}

	public boolean isDistribution() {
		switch( this ) {
			case NORMAL:
			case BETA:
			case BERNOULLI:
			case GAMMA:
				return true;
			default:
				return false;
		}
	}

	public boolean isAddition() {
		return this == ADDITION || this == MULTI_ADDITION;
	}

	public boolean isMultiplication() {
		return this == MULTIPLICATION || this == MULTI_MULTIPLICATION;
	}

	/**
	 * Samples, observations and queries have an identity of their own; two of
	 * them over the same inputs are distinct nodes and are never interned.
	 */
	public boolean isInterned() {
		return this != SAMPLE && this != OBSERVE && this != QUERY;
	}

	public static boolean contains(String value) {
		for( NodeKind kind : values() )
			if( kind.name().equals(value) )
				return true;
		return false;
	}
}
