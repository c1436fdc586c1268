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

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;

import org.apache.commons.logging.Log;
import org.apache.commons.logging.LogFactory;
import org.beanmachine.bmg.plan.BMGraph;
import org.beanmachine.bmg.plan.BNode;
import org.beanmachine.bmg.plan.BNodeConstant;
import org.beanmachine.bmg.plan.GraphChangeListener;

/**
 * Classifies nodes into {@link BMGLatticeType}s. Types are computed lazily
 * bottom-up and memoized; the typer listens to its graph and drops the cached
 * types of every node whose operands changed, directly or transitively.
 */
public class LatticeTyper implements GraphChangeListener
{
	private static final Log LOG = LogFactory.getLog(LatticeTyper.class.getName());

	private final BMGraph _graph;
	private final HashMap<BNode, BMGLatticeType> _types;

	public LatticeTyper(BMGraph graph) {
		_graph = graph;
		_types = new HashMap<BNode, BMGLatticeType>();
		_graph.addListener(this);
	}

	public BMGraph getGraph() {
		return _graph;
	}

	/**
	 * Types the given node and all its untyped operands, operands first.
	 * Only nodes of the typer's graph are memoized.
	 */
	public BMGLatticeType typeOf(BNode node) throws UntypableNodeException {
		BMGLatticeType type = _types.get(node);
		if( type != null )
			return type;

		//types of nodes outside the graph, valid for this call only
		HashMap<BNode, BMGLatticeType> local = new HashMap<BNode, BMGLatticeType>();
		Deque<BNode> stack = new ArrayDeque<BNode>();
		stack.push(node);
		while( !stack.isEmpty() ) {
			BNode current = stack.peek();
			if( lookup(current, local) != null ) {
				stack.pop();
				continue;
			}
			boolean ready = true;
			for( BNode input : current.getInput() )
				if( lookup(input, local) == null ) {
					stack.push(input);
					ready = false;
				}
			if( !ready )
				continue;

			stack.pop();
			ArrayList<BMGLatticeType> inputs = new ArrayList<BMGLatticeType>();
			for( BNode input : current.getInput() )
				inputs.add(lookup(input, local));
			BMGLatticeType ctype = computeType(current, inputs);
			if( _graph.contains(current) )
				_types.put(current, ctype);
			else
				local.put(current, ctype);
		}
		return lookup(node, local);
	}

	private BMGLatticeType lookup(BNode node, Map<BNode, BMGLatticeType> local) {
		BMGLatticeType type = _types.get(node);
		return (type != null) ? type : local.get(node);
	}

	public boolean isCached(BNode node) {
		return _types.containsKey(node);
	}

	public int getCacheSize() {
		return _types.size();
	}

	private static BMGLatticeType computeType(BNode node, List<BMGLatticeType> in)
		throws UntypableNodeException
	{
		switch( node.getKind() ) {
			case CONSTANT:
				return typeOfConstant(((BNodeConstant) node).getValue());
			case NORMAL:
				checkValues(node, in);
				checkNonNegative(node, in.get(1));
				return BMGLatticeType.DISTRIBUTION;
			case BETA:
			case GAMMA:
				checkValues(node, in);
				checkNonNegative(node, in.get(0));
				checkNonNegative(node, in.get(1));
				return BMGLatticeType.DISTRIBUTION;
			case BERNOULLI:
				checkValues(node, in);
				if( !in.get(0).isProbability() )
					throw new UntypableNodeException(node, "Bernoulli requires a probability, got " + in.get(0) + ".");
				return BMGLatticeType.DISTRIBUTION;
			case SAMPLE:
				return typeOfSupport(node, node.getInput(0));
			case OBSERVE:
				if( in.get(0).isValueType() && in.get(1).isValueType() )
					return BMGLatticeType.NONE;
				throw new UntypableNodeException(node, "observation of a non-value.");
			case QUERY:
				checkValues(node, in);
				return BMGLatticeType.NONE;
			case ADDITION:
			case MULTI_ADDITION:
				checkValues(node, in);
				if( allSubtypeOf(in, BMGLatticeType.NATURAL) )
					return BMGLatticeType.NATURAL;
				if( allSubtypeOf(in, BMGLatticeType.POSITIVE_REAL) )
					return BMGLatticeType.POSITIVE_REAL;
				if( allSubtypeOf(in, BMGLatticeType.NEGATIVE_REAL) )
					return BMGLatticeType.NEGATIVE_REAL;
				return BMGLatticeType.REAL;
			case MULTIPLICATION:
			case MULTI_MULTIPLICATION:
				checkValues(node, in);
				if( allSubtypeOf(in, BMGLatticeType.BOOLEAN) )
					return BMGLatticeType.BOOLEAN;
				if( allSubtypeOf(in, BMGLatticeType.PROBABILITY) )
					return BMGLatticeType.PROBABILITY;
				if( allSubtypeOf(in, BMGLatticeType.NATURAL) )
					return BMGLatticeType.NATURAL;
				if( allSubtypeOf(in, BMGLatticeType.POSITIVE_REAL) )
					return BMGLatticeType.POSITIVE_REAL;
				return BMGLatticeType.REAL;
			case NEGATE:
				checkValues(node, in);
				if( in.get(0).isNonNegative() )
					return BMGLatticeType.NEGATIVE_REAL;
				if( in.get(0) == BMGLatticeType.NEGATIVE_REAL )
					return BMGLatticeType.POSITIVE_REAL;
				return BMGLatticeType.REAL;
			case COMPLEMENT:
				checkValues(node, in);
				if( in.get(0) == BMGLatticeType.BOOLEAN )
					return BMGLatticeType.BOOLEAN;
				if( in.get(0).isProbability() )
					return BMGLatticeType.PROBABILITY;
				throw new UntypableNodeException(node, "complement requires a probability, got " + in.get(0) + ".");
			case EXP:
				checkValues(node, in);
				return (in.get(0) == BMGLatticeType.NEGATIVE_REAL) ?
					BMGLatticeType.PROBABILITY : BMGLatticeType.POSITIVE_REAL;
			case LOG:
				checkValues(node, in);
				if( in.get(0).isProbability() )
					return BMGLatticeType.NEGATIVE_REAL;
				if( in.get(0).isNonNegative() )
					return BMGLatticeType.REAL;
				throw new UntypableNodeException(node, "log requires a non-negative operand, got " + in.get(0) + ".");
			case LOGSUMEXP:
				checkValues(node, in);
				return BMGLatticeType.REAL;
			default:
				throw new UntypableNodeException(node, "unsupported node kind.");
		}
	}

	/**
	 * Smallest lattice type containing the given constant.
	 */
	public static BMGLatticeType typeOfConstant(double value) {
		if( value == 0 || value == 1 )
			return BMGLatticeType.BOOLEAN;
		if( value > 0 && !Double.isInfinite(value) && value == Math.rint(value) )
			return BMGLatticeType.NATURAL;
		if( value > 0 && value < 1 )
			return BMGLatticeType.PROBABILITY;
		if( value > 0 )
			return BMGLatticeType.POSITIVE_REAL;
		if( value < 0 )
			return BMGLatticeType.NEGATIVE_REAL;
		return BMGLatticeType.REAL;
	}

	private static BMGLatticeType typeOfSupport(BNode sample, BNode distribution)
		throws UntypableNodeException
	{
		switch( distribution.getKind() ) {
			case NORMAL: return BMGLatticeType.REAL;
			case BETA: return BMGLatticeType.PROBABILITY;
			case BERNOULLI: return BMGLatticeType.BOOLEAN;
			case GAMMA: return BMGLatticeType.POSITIVE_REAL;
			default:
				throw new UntypableNodeException(sample, "sample of non-distribution " + distribution + ".");
		}
	}

	private static boolean allSubtypeOf(List<BMGLatticeType> types, BMGLatticeType bound) {
		for( BMGLatticeType type : types )
			if( !type.isSubtypeOf(bound) )
				return false;
		return true;
	}

	private static void checkValues(BNode node, List<BMGLatticeType> types)
		throws UntypableNodeException
	{
		for( BMGLatticeType type : types )
			if( !type.isValueType() )
				throw new UntypableNodeException(node, "operand of type " + type + " is not a value.");
	}

	private static void checkNonNegative(BNode node, BMGLatticeType type)
		throws UntypableNodeException
	{
		if( !type.isNonNegative() )
			throw new UntypableNodeException(node, "parameter of type " + type + " may be negative.");
	}

	@Override
	public void nodeReplaced(BNode hold, BNode hnew, Collection<BNode> rewired) {
		//types compose bottom-up, so every transitive consumer is stale
		HashSet<BNode> stale = new HashSet<BNode>();
		Deque<BNode> worklist = new ArrayDeque<BNode>(rewired);
		worklist.push(hold);
		worklist.push(hnew);
		while( !worklist.isEmpty() ) {
			BNode current = worklist.pop();
			if( !stale.add(current) )
				continue;
			_types.remove(current);
			if( _graph.contains(current) )
				worklist.addAll(_graph.getConsumers(current));
		}
		if( LOG.isTraceEnabled() )
			LOG.trace("Invalidated types of " + stale.size() + " nodes after replacing " + hold + ".");
	}

	@Override
	public void nodeRemoved(BNode node) {
		_types.remove(node);
	}
}
