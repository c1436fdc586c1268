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

package org.beanmachine.bmg.types;

/**
 * Abstract value types of graph nodes. The value types form the lattice
 *
 * <pre>
 *            REAL
 *           /    \
 *  POSITIVE_REAL  NEGATIVE_REAL
 *     /     \
 * NATURAL  PROBABILITY
 *     \     /
 *     BOOLEAN
 * </pre>
 *
 * DISTRIBUTION and NONE (observations, queries) are outside the lattice.
 */
public enum BMGLatticeType
{
	BOOLEAN, NATURAL, PROBABILITY, POSITIVE_REAL, NEGATIVE_REAL, REAL,
	DISTRIBUTION, NONE;

	public boolean isValueType() {
		return this != DISTRIBUTION && this != NONE;
	}

	public boolean isSubtypeOf(BMGLatticeType that) {
		if( this == that )
			return true;
		if( !isValueType() || !that.isValueType() )
			return false;
		switch( that ) {
			case REAL:
				return true;
			case POSITIVE_REAL:
				return this == BOOLEAN || this == NATURAL || this == PROBABILITY;
			case NATURAL:
			case PROBABILITY:
				return this == BOOLEAN;
			default:
				return false;
		}
	}

	/**
	 * @return true for the types whose values lie in [0,1]
	 */
	public boolean isProbability() {
		return isSubtypeOf(PROBABILITY);
	}

	public boolean isNonNegative() {
		return isSubtypeOf(POSITIVE_REAL);
	}

	/**
	 * Least upper bound of two value types.
	 */
	public static BMGLatticeType supremum(BMGLatticeType a, BMGLatticeType b) {
		if( !a.isValueType() || !b.isValueType() )
			throw new IllegalArgumentException("No supremum of " + a + " and " + b + ".");
		if( a.isSubtypeOf(b) )
			return b;
		if( b.isSubtypeOf(a) )
			return a;
		if( a.isNonNegative() && b.isNonNegative() )
			return POSITIVE_REAL;
		return REAL;
	}
}
